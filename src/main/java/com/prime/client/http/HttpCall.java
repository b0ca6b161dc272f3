package com.prime.client.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP request to the API: method, URL, query parameters, optional body and
 * the timeout that bounds this single call.
 */
public record HttpCall(String method, String url, Map<String, Object> queryParams,
                       BodyType bodyType, String body, Duration timeout) {

    public enum BodyType { NONE, JSON, FORM }

    public HttpCall {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(timeout, "timeout is required");
        queryParams = queryParams != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(queryParams)) : Map.of();
        bodyType = bodyType != null ? bodyType : BodyType.NONE;
    }

    public static HttpCall get(String url, Map<String, ?> params, Duration timeout) {
        return new HttpCall("GET", url, copy(params), BodyType.NONE, null, timeout);
    }

    public static HttpCall json(String method, String url, String jsonBody, Duration timeout) {
        return new HttpCall(method, url, Map.of(), BodyType.JSON, jsonBody, timeout);
    }

    public static HttpCall form(String method, String url, Map<String, ?> params, Duration timeout) {
        return new HttpCall(method, url, Map.of(), BodyType.FORM, QueryString.encode(params), timeout);
    }

    /**
     * The URL with the query string appended, as it goes on the wire.
     */
    public String fullUrl() {
        if (queryParams.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + QueryString.encode(queryParams);
    }

    private static Map<String, Object> copy(Map<String, ?> params) {
        return params != null ? new LinkedHashMap<>(params) : Map.of();
    }
}

package com.prime.client.http;

/**
 * Raw outcome of one HTTP call, before classification.
 *
 * @param statusCode the HTTP status code
 * @param body       the response body, never null (empty when the server sent none)
 * @param url        the full request URL, including the query string
 */
public record HttpResult(int statusCode, String body, String url) {

    public HttpResult {
        body = body != null ? body : "";
    }
}

package com.prime.client.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Form/query-string encoding of request parameters.
 * Keys keep the map's iteration order; null values are skipped.
 */
public final class QueryString {

    private QueryString() {
    }

    public static String encode(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(escape(entry.getKey()) + "=" + escape(String.valueOf(entry.getValue())));
        }
        return joiner.toString();
    }

    private static String escape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

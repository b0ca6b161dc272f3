package com.prime.client.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * A named API endpoint as listed by the catalog.
 *
 * @param name   unique within its kind
 * @param kind   data or service
 * @param url    absolute endpoint URL
 * @param method HTTP method, always GET for data resources
 */
public record ResourceDescriptor(String name, ResourceKind kind, String url, String method) {

    public ResourceDescriptor {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(url, "url is required");
        method = method != null && !method.isBlank() ? method.trim().toUpperCase(Locale.ROOT) : "GET";
    }

    public static ResourceDescriptor data(String name, String url) {
        return new ResourceDescriptor(name, ResourceKind.DATA, url, "GET");
    }

    public static ResourceDescriptor service(String name, String method, String url) {
        return new ResourceDescriptor(name, ResourceKind.SERVICE, url, method);
    }
}

package com.prime.client.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Basic-auth credentials for the API.
 */
public record Credentials(String username, String password) {

    public Credentials {
        Objects.requireNonNull(username, "username is required");
        Objects.requireNonNull(password, "password is required");
    }

    public String basicAuthHeader() {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=****]";
    }
}

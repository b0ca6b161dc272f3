package com.prime.client.health;

/**
 * A probe of one dependency of the client, typically the API server itself.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}

package com.prime.client.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and reports the worst of their statuses.
 * Each check's own status appears as a detail under the check's name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String message = "OK";
        Map<String, Object> details = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            details.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.status().compareTo(worst) > 0) {
                worst = result.status();
                message = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, message, details);
    }

    public int size() {
        return checks.size();
    }
}

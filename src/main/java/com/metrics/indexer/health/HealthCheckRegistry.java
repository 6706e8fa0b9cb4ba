package com.metrics.indexer.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered {@link HealthCheck} and reports the worst status.
 * Each check's own status appears as a detail under its name.
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
        String worstMessage = "OK";
        Map<String, Object> perCheck = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result = runSafely(check);
            perCheck.put(check.getName(), result.summary());
            if (result.status().isWorseThan(worst)) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worst, worstMessage, perCheck);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus runSafely(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check threw", e);
        }
    }
}

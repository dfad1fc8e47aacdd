package com.hierarchy.federation.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and folds them into one status.
 *
 * <p>The aggregate takes the worst status of any check: DOWN over DEGRADED
 * over UP. Each check's result is kept as a detail under its name.</p>
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

        Map<String, Object> checkResults = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up();
        String worstMessage = worst.message();

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            checkResults.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst.status(), worstMessage, checkResults);
    }

    public int size() {
        return checks.size();
    }
}

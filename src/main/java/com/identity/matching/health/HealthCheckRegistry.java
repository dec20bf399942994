package com.identity.matching.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named health checks rolled up into one status. The roll-up takes the worst
 * status of any check, and its message names the first check that reported it.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();

    /**
     * Registers a check. A later check with the same name replaces the earlier one.
     */
    public synchronized void register(HealthCheck check) {
        if (check != null) {
            checks.put(check.getName(), check);
        }
    }

    public HealthStatus checkAll() {
        HealthStatus.Status overall = HealthStatus.Status.UP;
        String headline = "OK";
        Map<String, Object> perCheck = new LinkedHashMap<>();

        for (HealthCheck check : ordered()) {
            HealthStatus result = run(check);
            perCheck.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            HealthStatus.Status next = overall.worse(result.status());
            if (next != overall) {
                overall = next;
                headline = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(overall, headline, perCheck);
    }

    public synchronized int size() {
        return checks.size();
    }

    private synchronized List<HealthCheck> ordered() {
        return new ArrayList<>(checks.values());
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={} error={}", check.getName(), e.toString());
            return HealthStatus.down(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}

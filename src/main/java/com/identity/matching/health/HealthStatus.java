package com.identity.matching.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one part of the matching engine, or of the engine as a whole.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        Status worse(Status other) {
            return other.compareTo(this) > 0 ? other : this;
        }
    }

    public HealthStatus {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        message = message == null ? "" : message;
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    /**
     * Returns a copy carrying one more detail entry.
     */
    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> one = new LinkedHashMap<>();
        one.put(key, value);
        return withDetails(one);
    }

    public HealthStatus withDetails(Map<String, ?> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new HealthStatus(status, message, merged);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}

package com.identity.matching.health;

/**
 * Check of one dependency of the matching engine, such as the nickname index
 * or a directory endpoint. Implementations should return quickly.
 */
public interface HealthCheck {

    /**
     * Stable name, used as the key in the rolled-up details.
     */
    String getName();

    HealthStatus check();
}

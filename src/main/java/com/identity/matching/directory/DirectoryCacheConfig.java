package com.identity.matching.directory;

/**
 * Configuration for the directory cache.
 *
 * @param maxSize    maximum number of cached scopes
 * @param ttlSeconds time-to-live in seconds for a cached directory
 * @param enabled    whether caching is enabled
 */
public record DirectoryCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public DirectoryCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 16 scopes, 900s TTL, enabled.
     */
    public static DirectoryCacheConfig defaults() {
        return new DirectoryCacheConfig(16, 900, true);
    }

    public static DirectoryCacheConfig disabled() {
        return new DirectoryCacheConfig(1, 1, false);
    }
}

package com.identity.matching.directory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.identity.matching.core.model.CandidateRecord;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Caffeine-backed cache in front of a {@link DirectoryProvider}, keyed by scope id.
 * A forced refresh invalidates the scope and always goes to the delegate.
 * Failed fetches are never cached.
 */
public class CachingDirectoryProvider implements DirectoryProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingDirectoryProvider.class);

    private final DirectoryProvider delegate;
    private final Cache<String, List<CandidateRecord>> cache;
    private final boolean enabled;
    private final MetricsService metrics;

    public CachingDirectoryProvider(DirectoryProvider delegate, DirectoryCacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingDirectoryProvider(DirectoryProvider delegate, DirectoryCacheConfig config,
                                    MetricsService metrics) {
        this.delegate = delegate;
        this.enabled = config.enabled();
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .build();
        log.info("directory.cache.initialized enabled={} maxSize={} ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public List<CandidateRecord> fetchAllCandidates(String scopeId, boolean forceRefresh) {
        if (!enabled) {
            return delegate.fetchAllCandidates(scopeId, forceRefresh);
        }
        if (forceRefresh) {
            cache.invalidate(scopeId);
            log.debug("directory.cache.bypassed scopeId={}", scopeId);
        } else {
            List<CandidateRecord> cached = cache.getIfPresent(scopeId);
            if (cached != null) {
                metrics.recordCacheHit();
                log.debug("directory.cache.hit scopeId={} size={}", scopeId, cached.size());
                return cached;
            }
            metrics.recordCacheMiss();
        }

        List<CandidateRecord> fetched = List.copyOf(delegate.fetchAllCandidates(scopeId, forceRefresh));
        cache.put(scopeId, fetched);
        return fetched;
    }

    public void invalidate(String scopeId) {
        cache.invalidate(scopeId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}

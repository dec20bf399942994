package com.identity.matching.metrics;

import com.identity.matching.core.model.RecommendationTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code identity.directory.fetch.duration}: Timer</li>
 *   <li>{@code identity.matching.duration}: Timer</li>
 *   <li>{@code identity.directory.size}: DistributionSummary</li>
 *   <li>{@code identity.recommendation}: Counter (tag: tier)</li>
 *   <li>{@code identity.link.approved}: Counter (tag: mode = single|bulk)</li>
 *   <li>{@code identity.link.approval.failed}: Counter</li>
 *   <li>{@code identity.directory.fetch.failed}: Counter</li>
 *   <li>{@code identity.directory.cache.hit} / {@code .miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer fetchTimer;
    private final Timer matchingTimer;
    private final DistributionSummary directorySizeSummary;
    private final Counter approvalFailureCounter;
    private final Counter fetchFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.fetchTimer = Timer.builder("identity.directory.fetch.duration")
                .description("Duration of full directory fetches")
                .register(registry);
        this.matchingTimer = Timer.builder("identity.matching.duration")
                .description("Duration of candidate selection over all unlinked records")
                .register(registry);
        this.directorySizeSummary = DistributionSummary.builder("identity.directory.size")
                .description("Number of candidate records per fetched directory")
                .register(registry);
        this.approvalFailureCounter = Counter.builder("identity.link.approval.failed")
                .description("Number of links that could not be persisted")
                .register(registry);
        this.fetchFailureCounter = Counter.builder("identity.directory.fetch.failed")
                .description("Number of failed directory fetches")
                .register(registry);
        this.cacheHitCounter = Counter.builder("identity.directory.cache.hit")
                .description("Number of directory cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("identity.directory.cache.miss")
                .description("Number of directory cache misses")
                .register(registry);
    }

    @Override
    public void recordFetchDuration(Duration duration) {
        fetchTimer.record(duration);
    }

    @Override
    public void recordMatchingDuration(Duration duration) {
        matchingTimer.record(duration);
    }

    @Override
    public void recordDirectorySize(int size) {
        directorySizeSummary.record(size);
    }

    @Override
    public void incrementRecommendation(RecommendationTier tier) {
        String key = "recommendation:" + tier.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("identity.recommendation")
                        .description("Number of local records per recommendation tier")
                        .tag("tier", tier.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementApproved(boolean bulk) {
        String mode = bulk ? "bulk" : "single";
        Counter counter = counterCache.computeIfAbsent("approved:" + mode, k ->
                Counter.builder("identity.link.approved")
                        .description("Number of links persisted")
                        .tag("mode", mode)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementApprovalFailure() {
        approvalFailureCounter.increment();
    }

    @Override
    public void incrementFetchFailure() {
        fetchFailureCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}

package com.identity.matching.metrics;

import com.identity.matching.core.model.RecommendationTier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    void recordsTimersAndDirectorySize() {
        metrics.recordFetchDuration(Duration.ofMillis(250));
        metrics.recordMatchingDuration(Duration.ofMillis(40));
        metrics.recordDirectorySize(120);

        assertEquals(1, registry.get("identity.directory.fetch.duration").timer().count());
        assertEquals(250.0, registry.get("identity.directory.fetch.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.get("identity.matching.duration").timer().count());
        assertEquals(120.0, registry.get("identity.directory.size").summary().totalAmount());
    }

    @Test
    void countsRecommendationsPerTier() {
        metrics.incrementRecommendation(RecommendationTier.MATCH);
        metrics.incrementRecommendation(RecommendationTier.MATCH);
        metrics.incrementRecommendation(RecommendationTier.REVIEW);

        assertEquals(2.0, registry.get("identity.recommendation").tag("tier", "MATCH").counter().count());
        assertEquals(1.0, registry.get("identity.recommendation").tag("tier", "REVIEW").counter().count());
    }

    @Test
    void countsApprovalsByMode() {
        metrics.incrementApproved(true);
        metrics.incrementApproved(false);
        metrics.incrementApproved(false);
        metrics.incrementApprovalFailure();

        assertEquals(1.0, registry.get("identity.link.approved").tag("mode", "bulk").counter().count());
        assertEquals(2.0, registry.get("identity.link.approved").tag("mode", "single").counter().count());
        assertEquals(1.0, registry.get("identity.link.approval.failed").counter().count());
    }

    @Test
    void countsFetchFailuresAndCacheAccess() {
        metrics.incrementFetchFailure();
        metrics.recordCacheHit();
        metrics.recordCacheMiss();
        metrics.recordCacheMiss();

        assertEquals(1.0, registry.get("identity.directory.fetch.failed").counter().count());
        assertEquals(1.0, registry.get("identity.directory.cache.hit").counter().count());
        assertEquals(2.0, registry.get("identity.directory.cache.miss").counter().count());
    }

    @Test
    void noOpAcceptsEverything() {
        MetricsService noOp = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            noOp.recordFetchDuration(Duration.ZERO);
            noOp.incrementRecommendation(RecommendationTier.NO_MATCH);
            noOp.incrementApproved(true);
            noOp.recordCacheHit();
        });
    }
}

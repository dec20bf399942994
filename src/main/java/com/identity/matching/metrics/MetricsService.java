package com.identity.matching.metrics;

import com.identity.matching.core.model.RecommendationTier;

import java.time.Duration;

/**
 * Interface for recording identity matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordFetchDuration(Duration duration);

    void recordMatchingDuration(Duration duration);

    void recordDirectorySize(int size);

    void incrementRecommendation(RecommendationTier tier);

    void incrementApproved(boolean bulk);

    void incrementApprovalFailure();

    void incrementFetchFailure();

    void recordCacheHit();

    void recordCacheMiss();
}

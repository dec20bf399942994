package com.identity.matching.metrics;

import com.identity.matching.core.model.RecommendationTier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFetchDuration(Duration duration) {
    }

    @Override
    public void recordMatchingDuration(Duration duration) {
    }

    @Override
    public void recordDirectorySize(int size) {
    }

    @Override
    public void incrementRecommendation(RecommendationTier tier) {
    }

    @Override
    public void incrementApproved(boolean bulk) {
    }

    @Override
    public void incrementApprovalFailure() {
    }

    @Override
    public void incrementFetchFailure() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

package com.identity.matching.review;

import com.identity.matching.core.model.RecommendationTier;
import com.identity.matching.selection.RejectedRecord;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one fetch-and-match run.
 *
 * @param runId         unique id, also put in the logging context
 * @param scopeId       directory scope that was matched
 * @param directorySize number of candidates fetched
 * @param localRecords  number of local records matched
 * @param matchCount    records whose best tier is MATCH
 * @param reviewCount   records whose best tier is REVIEW
 * @param noMatchCount  records without a chosen candidate
 * @param perfectCount  records in the perfect bucket
 * @param rejected      records rejected by validation
 * @param forcedRefresh whether the directory cache was bypassed
 * @param fetchDuration time spent fetching local records and the directory
 * @param matchDuration time spent selecting candidates
 */
public record MatchRun(
        String runId,
        String scopeId,
        int directorySize,
        int localRecords,
        int matchCount,
        int reviewCount,
        int noMatchCount,
        int perfectCount,
        List<RejectedRecord> rejected,
        boolean forcedRefresh,
        Duration fetchDuration,
        Duration matchDuration
) {
    public MatchRun {
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public int count(RecommendationTier tier) {
        return switch (tier) {
            case MATCH -> matchCount;
            case REVIEW -> reviewCount;
            case NO_MATCH -> noMatchCount;
        };
    }
}

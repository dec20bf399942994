package com.identity.matching.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of matching one local record against the directory: the chosen
 * candidate (if any), the per-field verdicts and the fused recommendation.
 * Created on every matching run and never persisted.
 */
public record MatchCandidate(
        LocalRecord localRecord,
        CandidateRecord chosen,
        FieldVerdicts verdicts,
        RecommendationTier tier
) {
    public MatchCandidate {
        Objects.requireNonNull(localRecord, "localRecord is required");
        Objects.requireNonNull(verdicts, "verdicts are required");
        Objects.requireNonNull(tier, "tier is required");
        if (chosen != null && tier == RecommendationTier.NO_MATCH) {
            throw new IllegalArgumentException("A chosen candidate cannot carry tier NO_MATCH");
        }
    }

    /**
     * Creates a result with no chosen candidate ("no match found").
     */
    public static MatchCandidate noMatch(LocalRecord localRecord) {
        return new MatchCandidate(localRecord, null,
                FieldVerdicts.none(localRecord.hasEmail(), localRecord.hasPhone()),
                RecommendationTier.NO_MATCH);
    }

    public Optional<CandidateRecord> getChosen() {
        return Optional.ofNullable(chosen);
    }

    public boolean hasCandidate() {
        return chosen != null;
    }

    public String localId() {
        return localRecord.getId();
    }

    /**
     * Returns true if a candidate was chosen and every populated field matched perfectly.
     * Such results are eligible for bulk approval.
     */
    public boolean isPerfectMatch() {
        return chosen != null && verdicts.allPopulatedPerfect();
    }

    @Override
    public String toString() {
        return "MatchCandidate{" +
                "localId='" + localRecord.getId() + '\'' +
                ", externalId=" + (chosen != null ? "'" + chosen.getExternalId() + "'" : "none") +
                ", verdicts=" + verdicts +
                ", tier=" + tier +
                '}';
    }
}

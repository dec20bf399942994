package com.identity.matching.core.model;

/**
 * Fused recommendation for a local record / candidate pairing.
 * Constants are declared from lowest to highest confidence.
 */
public enum RecommendationTier {
    /**
     * Unlikely to be the same person. A candidate with this tier is never proposed.
     */
    NO_MATCH,

    /**
     * Possible match that needs an operator to look at it carefully.
     */
    REVIEW,

    /**
     * High confidence match.
     */
    MATCH;

    public boolean isHigherThan(RecommendationTier other) {
        return ordinal() > other.ordinal();
    }
}

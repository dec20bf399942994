package com.identity.matching.core.model;

/**
 * Outcome of comparing one field (name, email or phone) between a local record
 * and a directory candidate. Constants are declared from lowest to highest confidence.
 */
public enum FieldVerdict {
    /**
     * The field does not match, or the local record has no value for it.
     */
    NO_MATCH(0),

    /**
     * The values are similar enough to suggest the same person (typo, nickname, same domain).
     */
    CLOSE(1),

    /**
     * The values are identical after normalization.
     */
    PERFECT(2);

    private final int rank;

    FieldVerdict(int rank) {
        this.rank = rank;
    }

    /**
     * Returns the rank used for tie-breaking: PERFECT=2, CLOSE=1, NO_MATCH=0.
     */
    public int rank() {
        return rank;
    }

    public boolean isAtLeast(FieldVerdict other) {
        return rank >= other.rank;
    }

    /**
     * Returns the more confident of the two verdicts.
     */
    public static FieldVerdict best(FieldVerdict a, FieldVerdict b) {
        return a.rank >= b.rank ? a : b;
    }
}

package com.identity.matching.review;

/**
 * States of a {@link MatchWorkflow}.
 */
public enum WorkflowState {
    /** Nothing loaded; the unmatched count can be shown. */
    IDLE,
    FETCHING,
    MATCHING,
    /** Perfect matches are waiting for bulk approval or manual review. */
    PERFECT_SUMMARY,
    /** The operator steps through the review queue. */
    REVIEW_QUEUE,
    APPROVING,
    SKIPPING,
    REFRESHING;

    /**
     * Returns true for the states in which the workflow waits for the operator.
     */
    public boolean isAwaitingOperator() {
        return this == IDLE || this == PERFECT_SUMMARY || this == REVIEW_QUEUE;
    }
}

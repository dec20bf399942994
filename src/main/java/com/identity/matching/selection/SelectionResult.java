package com.identity.matching.selection;

import com.identity.matching.core.model.MatchCandidate;

import java.util.List;

/**
 * Output of one selection pass: one {@link MatchCandidate} per eligible local
 * record, in input order, and the records rejected by validation.
 */
public record SelectionResult(List<MatchCandidate> candidates, List<RejectedRecord> rejected) {

    public SelectionResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }
}

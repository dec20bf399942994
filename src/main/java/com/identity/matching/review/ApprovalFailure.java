package com.identity.matching.review;

import com.identity.matching.core.model.MatchCandidate;

/**
 * A link that could not be persisted during bulk approval.
 */
public record ApprovalFailure(MatchCandidate candidate, String reason) {

    public String localId() {
        return candidate.localId();
    }
}

package com.identity.matching.review;

import java.util.List;

/**
 * Outcome of approving every perfect match in one pass.
 *
 * @param approved number of links persisted
 * @param failures links that could not be persisted; those items stay in the perfect bucket
 */
public record BulkApprovalResult(int approved, List<ApprovalFailure> failures) {

    public BulkApprovalResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}

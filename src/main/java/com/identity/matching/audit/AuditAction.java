package com.identity.matching.audit;

/**
 * Types of auditable actions in the matching workflow.
 */
public enum AuditAction {
    MATCH_RUN_COMPLETED,
    MATCH_RUN_FAILED,
    LINK_APPROVED,
    LINK_APPROVAL_FAILED,
    BULK_APPROVAL_COMPLETED
}

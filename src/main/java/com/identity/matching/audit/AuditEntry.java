package com.identity.matching.audit;

import com.identity.matching.logging.LogContext;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One line of the matching audit trail.
 *
 * @param subjectId the local record id for approvals, the scope id for runs
 * @param actorId   who triggered the action, if known
 * @param runId     the run in progress when the entry was made, if any
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        String runId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        if (id == null || action == null || timestamp == null) {
            throw new NullPointerException("id, action and timestamp are required");
        }
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Stamps a fresh id, the current instant and the MDC run id unless told otherwise.
     */
    public static final class Builder {
        private AuditAction action;
        private String subjectId;
        private String actorId;
        private String runId = LogContext.currentRunId();
        private Map<String, Object> details;
        private Instant timestamp;

        private Builder() {
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(UUID.randomUUID().toString(), action, subjectId, actorId, runId, details,
                    timestamp != null ? timestamp : Instant.now());
        }
    }
}

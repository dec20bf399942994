package com.identity.matching.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only, in-memory record of matching runs and link approvals.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} subjectId={} actorId={} runId={}",
                entry.action(), entry.subjectId(), entry.actorId(), entry.runId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return entries.stream()
                .filter(e -> runId.equals(e.runId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}

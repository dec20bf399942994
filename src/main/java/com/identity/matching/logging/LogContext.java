package com.identity.matching.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for a matching run or a link approval.
 * Closing restores whatever the keys held before, so an approval context
 * opened inside a bulk run leaves the run's keys intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMatchRun(runId, scopeId)) {
 *     log.info("workflow.run.completed perfect={} review={}", perfect, review);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forMatchRun(String runId, String scopeId) {
        return new LogContext()
                .with(RUN_ID, runId)
                .with("scopeId", scopeId)
                .with("operation", "match");
    }

    public static LogContext forApproval(String localId, String externalId) {
        return new LogContext()
                .with("localId", localId)
                .with("externalId", externalId)
                .with("operation", "approve");
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * The run id of the innermost open match-run context on this thread, or null.
     */
    public static String currentRunId() {
        return MDC.get(RUN_ID);
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, old) -> {
            if (old == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, old);
            }
        });
        previous.clear();
    }
}

package com.identity.matching.review;

import com.identity.matching.api.MatchingOptions;
import com.identity.matching.audit.AuditAction;
import com.identity.matching.audit.AuditService;
import com.identity.matching.core.model.CandidateRecord;
import com.identity.matching.core.model.LocalRecord;
import com.identity.matching.core.model.MatchCandidate;
import com.identity.matching.core.model.RecommendationTier;
import com.identity.matching.directory.DirectoryFetchException;
import com.identity.matching.directory.DirectoryProvider;
import com.identity.matching.logging.LogContext;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.metrics.NoOpMetricsService;
import com.identity.matching.selection.CandidateSelector;
import com.identity.matching.selection.SelectionResult;
import com.identity.matching.store.LinkPersistenceException;
import com.identity.matching.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Review and approval workflow for one directory scope, driven by method calls.
 *
 * <pre>
 * IDLE -&gt; FETCHING -&gt; MATCHING -&gt; PERFECT_SUMMARY | REVIEW_QUEUE | IDLE
 * PERFECT_SUMMARY -&gt; APPROVING (approve all) | REVIEW_QUEUE (review manually)
 * REVIEW_QUEUE    -&gt; APPROVING (approve current) | SKIPPING (previous / next)
 * any waiting state -&gt; REFRESHING -&gt; FETCHING (directory cache bypassed)
 * </pre>
 *
 * <p>A run that cannot fetch the directory or the local records ends in IDLE and the
 * caller receives a {@link DirectoryFetchException}; the run can simply be started
 * again. A link that cannot be persisted leaves its item and the cursor where they were.</p>
 *
 * <p>Results without a chosen candidate are counted in the {@link MatchRun} but are not
 * queued, since there is nothing to approve.</p>
 *
 * <p>One workflow belongs to one operator session. Only {@link #cancelFetch()} and
 * {@link #getState()} may be called from another thread.</p>
 */
public class MatchWorkflow {
    private static final Logger log = LoggerFactory.getLogger(MatchWorkflow.class);

    private static final Set<WorkflowState> REFRESHABLE =
            EnumSet.of(WorkflowState.IDLE, WorkflowState.PERFECT_SUMMARY, WorkflowState.REVIEW_QUEUE);

    private final String scopeId;
    private final RecordStore recordStore;
    private final DirectoryProvider directoryProvider;
    private final CandidateSelector selector;
    private final MatchingOptions options;
    private final MetricsService metrics;
    private final AuditService auditService;
    private final Executor fetchExecutor;
    private final String actorId;
    private final List<WorkflowListener> listeners = new CopyOnWriteArrayList<>();

    private volatile WorkflowState state = WorkflowState.IDLE;
    private volatile CompletableFuture<FetchedData> currentFetch;
    private MatchQueue queue = MatchQueue.empty();
    private MatchRun lastRun;

    private MatchWorkflow(Builder builder) {
        this.scopeId = Objects.requireNonNull(builder.scopeId, "scopeId is required");
        this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore is required");
        this.directoryProvider = Objects.requireNonNull(builder.directoryProvider, "directoryProvider is required");
        this.selector = Objects.requireNonNull(builder.selector, "selector is required");
        this.options = builder.options != null ? builder.options : MatchingOptions.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.fetchExecutor = builder.fetchExecutor != null ? builder.fetchExecutor : ForkJoinPool.commonPool();
        this.actorId = builder.actorId != null ? builder.actorId : "operator";
    }

    // ── Lifecycle ─────────────────────────────────────────────

    /**
     * Fetches the directory, matches every unlinked local record and fills the queue.
     *
     * @throws IllegalStateException   if the workflow is not IDLE
     * @throws DirectoryFetchException if the fetch fails, times out or is cancelled
     */
    public MatchRun start() {
        requireState(EnumSet.of(WorkflowState.IDLE), "start");
        return run(false);
    }

    /**
     * Discards the current queue and runs again with the directory cache bypassed.
     *
     * @throws IllegalStateException   if the workflow is busy
     * @throws DirectoryFetchException if the fetch fails, times out or is cancelled
     */
    public MatchRun refresh() {
        requireState(REFRESHABLE, "refresh");
        transition(WorkflowState.REFRESHING);
        queue = MatchQueue.empty();
        return run(true);
    }

    /**
     * Cancels a fetch in progress. The blocked {@link #start()} or {@link #refresh()}
     * call fails with a {@link DirectoryFetchException}.
     *
     * @return true if a fetch was cancelled
     */
    public boolean cancelFetch() {
        CompletableFuture<FetchedData> fetch = currentFetch;
        if (fetch != null && fetch.cancel(true)) {
            log.info("workflow.fetch.cancelled scopeId={}", scopeId);
            return true;
        }
        return false;
    }

    /**
     * Number of local records of the scope that still lack a directory link.
     */
    public int unmatchedCount() {
        return recordStore.countUnlinkedLocalRecords(scopeId);
    }

    // ── Perfect summary ───────────────────────────────────────

    /**
     * Persists the chosen candidate of every perfect match in one pass.
     * Links that fail stay in the perfect bucket and the workflow stays in
     * PERFECT_SUMMARY; otherwise it moves on to the review queue, or IDLE if nothing is left.
     */
    public BulkApprovalResult approveAllPerfect() {
        requireState(EnumSet.of(WorkflowState.PERFECT_SUMMARY), "approve all");
        transition(WorkflowState.APPROVING);

        int approved = 0;
        List<ApprovalFailure> failures = new ArrayList<>();
        for (MatchCandidate candidate : new ArrayList<>(queue.getPerfect())) {
            try {
                persist(candidate, true);
                queue.removePerfect(candidate);
                approved++;
            } catch (LinkPersistenceException e) {
                failures.add(new ApprovalFailure(candidate, e.getMessage()));
            }
        }

        auditService.record(AuditAction.BULK_APPROVAL_COMPLETED, scopeId, actorId, Map.of(
                "approved", approved,
                "failed", failures.size()
        ));
        log.info("workflow.bulk-approval.completed scopeId={} approved={} failed={}",
                scopeId, approved, failures.size());

        if (!failures.isEmpty()) {
            transition(WorkflowState.PERFECT_SUMMARY);
        } else {
            transition(queue.reviewSize() > 0 ? WorkflowState.REVIEW_QUEUE : WorkflowState.IDLE);
        }
        return new BulkApprovalResult(approved, failures);
    }

    /**
     * Puts the perfect matches in front of the review queue and starts stepping through it.
     */
    public void reviewManually() {
        requireState(EnumSet.of(WorkflowState.PERFECT_SUMMARY), "review manually");
        queue.mergePerfectIntoReview();
        transition(WorkflowState.REVIEW_QUEUE);
    }

    // ── Review queue ──────────────────────────────────────────

    public Optional<MatchCandidate> current() {
        return state == WorkflowState.REVIEW_QUEUE ? queue.current() : Optional.empty();
    }

    public boolean next() {
        return skip(true);
    }

    public boolean previous() {
        return skip(false);
    }

    /**
     * Persists the link of the item under the cursor and removes it from the queue.
     *
     * @throws LinkPersistenceException if the link cannot be stored, whatever the store threw;
     *                                   the item and cursor are kept
     */
    public MatchCandidate approveCurrent() {
        requireState(EnumSet.of(WorkflowState.REVIEW_QUEUE), "approve");
        MatchCandidate candidate = queue.current()
                .orElseThrow(() -> new IllegalStateException("Review queue is empty"));

        transition(WorkflowState.APPROVING);
        try {
            persist(candidate, false);
        } catch (LinkPersistenceException e) {
            transition(WorkflowState.REVIEW_QUEUE);
            throw e;
        }
        queue.removeCurrent();
        transition(queue.reviewSize() > 0 ? WorkflowState.REVIEW_QUEUE : WorkflowState.IDLE);
        return candidate;
    }

    // ── Accessors ─────────────────────────────────────────────

    public WorkflowState getState() {
        return state;
    }

    public List<MatchCandidate> getPerfectMatches() {
        return queue.getPerfect();
    }

    public List<MatchCandidate> getReviewQueue() {
        return queue.getReview();
    }

    public int getCursor() {
        return queue.getCursor();
    }

    public Optional<MatchRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    public String getScopeId() {
        return scopeId;
    }

    public void addListener(WorkflowListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(WorkflowListener listener) {
        listeners.remove(listener);
    }

    // ── Internal ──────────────────────────────────────────────

    private MatchRun run(boolean forceRefresh) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forMatchRun(runId, scopeId)) {
            transition(WorkflowState.FETCHING);
            long fetchStart = System.nanoTime();
            FetchedData fetched = fetch(forceRefresh);
            Duration fetchDuration = Duration.ofNanos(System.nanoTime() - fetchStart);
            metrics.recordFetchDuration(fetchDuration);
            metrics.recordDirectorySize(fetched.directory().size());

            transition(WorkflowState.MATCHING);
            long matchStart = System.nanoTime();
            SelectionResult selection = selector.select(fetched.localRecords(), fetched.directory());
            Duration matchDuration = Duration.ofNanos(System.nanoTime() - matchStart);
            metrics.recordMatchingDuration(matchDuration);

            List<MatchCandidate> perfect = new ArrayList<>();
            List<MatchCandidate> review = new ArrayList<>();
            Map<RecommendationTier, Integer> tiers = new EnumMap<>(RecommendationTier.class);
            for (MatchCandidate candidate : selection.candidates()) {
                tiers.merge(candidate.tier(), 1, Integer::sum);
                metrics.incrementRecommendation(candidate.tier());
                if (candidate.isPerfectMatch()) {
                    perfect.add(candidate);
                } else if (candidate.hasCandidate()) {
                    review.add(candidate);
                }
            }
            queue = new MatchQueue(perfect, review);

            MatchRun matchRun = new MatchRun(runId, scopeId, fetched.directory().size(),
                    selection.candidates().size(),
                    tiers.getOrDefault(RecommendationTier.MATCH, 0),
                    tiers.getOrDefault(RecommendationTier.REVIEW, 0),
                    tiers.getOrDefault(RecommendationTier.NO_MATCH, 0),
                    perfect.size(), selection.rejected(), forceRefresh, fetchDuration, matchDuration);
            lastRun = matchRun;

            auditService.record(AuditAction.MATCH_RUN_COMPLETED, scopeId, actorId, Map.of(
                    "runId", runId,
                    "directorySize", matchRun.directorySize(),
                    "perfect", perfect.size(),
                    "review", review.size(),
                    "noMatch", matchRun.noMatchCount(),
                    "rejected", matchRun.rejected().size()
            ));
            log.info("workflow.run.completed scopeId={} directory={} local={} perfect={} review={} noMatch={} rejected={}",
                    scopeId, matchRun.directorySize(), matchRun.localRecords(), perfect.size(), review.size(),
                    matchRun.noMatchCount(), matchRun.rejected().size());

            if (!perfect.isEmpty()) {
                transition(WorkflowState.PERFECT_SUMMARY);
            } else if (!review.isEmpty()) {
                transition(WorkflowState.REVIEW_QUEUE);
            } else {
                transition(WorkflowState.IDLE);
            }
            return matchRun;
        } catch (RuntimeException e) {
            queue = MatchQueue.empty();
            if (e instanceof DirectoryFetchException) {
                metrics.incrementFetchFailure();
            }
            auditService.record(AuditAction.MATCH_RUN_FAILED, scopeId, actorId, Map.of(
                    "runId", runId,
                    "error", String.valueOf(e.getMessage())
            ));
            log.error("workflow.run.failed scopeId={} runId={} error='{}'", scopeId, runId, e.getMessage(), e);
            transition(WorkflowState.IDLE);
            throw e;
        }
    }

    private FetchedData fetch(boolean forceRefresh) {
        CompletableFuture<FetchedData> fetch = CompletableFuture
                .supplyAsync(() -> new FetchedData(
                        recordStore.listUnlinkedLocalRecords(scopeId),
                        directoryProvider.fetchAllCandidates(scopeId, forceRefresh)), fetchExecutor)
                .orTimeout(options.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        currentFetch = fetch;
        try {
            return fetch.join();
        } catch (CancellationException e) {
            throw new DirectoryFetchException("Directory fetch cancelled for scope " + scopeId, e);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DirectoryFetchException dfe) {
                throw dfe;
            }
            if (cause instanceof TimeoutException) {
                throw new DirectoryFetchException("Directory fetch timed out after "
                        + options.getFetchTimeout() + " for scope " + scopeId, cause);
            }
            throw new DirectoryFetchException("Directory fetch failed for scope " + scopeId
                    + ": " + cause.getMessage(), cause);
        } finally {
            currentFetch = null;
        }
    }

    private void persist(MatchCandidate candidate, boolean bulk) {
        String localId = candidate.localId();
        String externalId = candidate.getChosen()
                .map(CandidateRecord::getExternalId)
                .orElseThrow(() -> new IllegalStateException("No candidate chosen for " + localId));

        try (LogContext ctx = LogContext.forApproval(localId, externalId)) {
            try {
                recordStore.persistLink(localId, externalId);
            } catch (RuntimeException e) {
                LinkPersistenceException failure = e instanceof LinkPersistenceException lpe
                        ? lpe
                        : new LinkPersistenceException(localId, "Could not link " + localId + " to "
                                + externalId + ": " + e.getMessage(), e);
                metrics.incrementApprovalFailure();
                auditService.record(AuditAction.LINK_APPROVAL_FAILED, localId, actorId, Map.of(
                        "externalId", externalId,
                        "bulk", bulk,
                        "error", String.valueOf(failure.getMessage())
                ));
                log.warn("workflow.link.failed localId={} externalId={} error='{}'",
                        localId, externalId, failure.getMessage(), e);
                throw failure;
            }
            metrics.incrementApproved(bulk);
            auditService.record(AuditAction.LINK_APPROVED, localId, actorId, Map.of(
                    "externalId", externalId,
                    "bulk", bulk,
                    "tier", candidate.tier().name()
            ));
            log.info("workflow.link.approved localId={} externalId={} bulk={}", localId, externalId, bulk);
        }
    }

    private boolean skip(boolean forward) {
        requireState(EnumSet.of(WorkflowState.REVIEW_QUEUE), forward ? "next" : "previous");
        transition(WorkflowState.SKIPPING);
        boolean moved = forward ? queue.next() : queue.previous();
        transition(WorkflowState.REVIEW_QUEUE);
        return moved;
    }

    private void requireState(Set<WorkflowState> allowed, String operation) {
        if (!allowed.contains(state)) {
            throw new IllegalStateException("Cannot " + operation + " in state " + state);
        }
    }

    private void transition(WorkflowState to) {
        WorkflowState from = state;
        state = to;
        log.debug("workflow.transition scopeId={} from={} to={}", scopeId, from, to);
        for (WorkflowListener listener : listeners) {
            try {
                listener.onTransition(from, to);
            } catch (RuntimeException e) {
                log.warn("workflow.listener.failed from={} to={} error='{}'", from, to, e.getMessage(), e);
            }
        }
    }

    private record FetchedData(List<LocalRecord> localRecords, List<CandidateRecord> directory) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String scopeId;
        private RecordStore recordStore;
        private DirectoryProvider directoryProvider;
        private CandidateSelector selector;
        private MatchingOptions options;
        private MetricsService metrics;
        private AuditService auditService;
        private Executor fetchExecutor;
        private String actorId;

        public Builder scopeId(String scopeId) {
            this.scopeId = scopeId;
            return this;
        }

        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder directoryProvider(DirectoryProvider directoryProvider) {
            this.directoryProvider = directoryProvider;
            return this;
        }

        public Builder selector(CandidateSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder options(MatchingOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Executor running the fetch, so that it can time out and be cancelled.
         */
        public Builder fetchExecutor(Executor fetchExecutor) {
            this.fetchExecutor = fetchExecutor;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public MatchWorkflow build() {
            return new MatchWorkflow(this);
        }
    }
}

package com.identity.matching.api;

import com.identity.matching.audit.AuditService;
import com.identity.matching.compare.EmailComparator;
import com.identity.matching.compare.NameComparator;
import com.identity.matching.compare.PhoneComparator;
import com.identity.matching.decision.RecommendationEngine;
import com.identity.matching.directory.DirectoryProvider;
import com.identity.matching.health.HealthCheck;
import com.identity.matching.health.HealthCheckRegistry;
import com.identity.matching.health.HealthStatus;
import com.identity.matching.health.NicknameIndexHealthCheck;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.metrics.NoOpMetricsService;
import com.identity.matching.nickname.NicknameDatasetLoader;
import com.identity.matching.nickname.NicknameIndex;
import com.identity.matching.review.MatchWorkflow;
import com.identity.matching.rules.Normalizer;
import com.identity.matching.selection.CandidateSelector;
import com.identity.matching.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the identity matching library.
 *
 * <p>Holds the process-wide pieces (nickname index, normalizer, comparators, metrics
 * and audit) and creates one {@link MatchWorkflow} per operator session.</p>
 *
 * <pre>
 * IdentityMatcher matcher = IdentityMatcher.builder()
 *     .options(MatchingOptions.defaults())
 *     .build();
 *
 * MatchWorkflow workflow = matcher.newWorkflow("list-42", recordStore, directoryProvider);
 * MatchRun run = workflow.start();
 * if (workflow.getState() == WorkflowState.PERFECT_SUMMARY) {
 *     workflow.approveAllPerfect();
 * }
 * </pre>
 */
public class IdentityMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IdentityMatcher.class);

    private final MatchingOptions options;
    private final NicknameIndex nicknameIndex;
    private final Normalizer normalizer;
    private final MetricsService metrics;
    private final AuditService auditService;
    private final ExecutorService matchingExecutor;
    private final CandidateSelector selector;
    private final HealthCheckRegistry healthCheckRegistry = new HealthCheckRegistry();

    private IdentityMatcher(Builder builder) {
        this.options = builder.options != null ? builder.options : MatchingOptions.defaults();
        this.nicknameIndex = builder.nicknameIndex != null
                ? builder.nicknameIndex
                : new NicknameDatasetLoader().loadDefault();
        this.normalizer = builder.normalizer != null ? builder.normalizer : new Normalizer();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.matchingExecutor = options.getParallelism() > 1
                ? Executors.newFixedThreadPool(options.getParallelism())
                : null;

        this.selector = new CandidateSelector(
                new NameComparator(normalizer, nicknameIndex, options),
                new EmailComparator(normalizer, options),
                new PhoneComparator(normalizer, options),
                new RecommendationEngine(),
                matchingExecutor);

        healthCheckRegistry.register(new NicknameIndexHealthCheck(nicknameIndex));
        log.info("identity.matcher.initialized nicknames={} degraded={} parallelism={}",
                nicknameIndex.size(), nicknameIndex.isDegraded(), options.getParallelism());
    }

    /**
     * Creates a workflow for one scope.
     */
    public MatchWorkflow newWorkflow(String scopeId, RecordStore recordStore, DirectoryProvider directoryProvider) {
        return workflowBuilder(scopeId, recordStore, directoryProvider).build();
    }

    /**
     * Returns a workflow builder preset with this matcher's collaborators, for further customization.
     */
    public MatchWorkflow.Builder workflowBuilder(String scopeId, RecordStore recordStore,
                                                 DirectoryProvider directoryProvider) {
        return MatchWorkflow.builder()
                .scopeId(scopeId)
                .recordStore(recordStore)
                .directoryProvider(directoryProvider)
                .selector(selector)
                .options(options)
                .metrics(metrics)
                .auditService(auditService);
    }

    public void registerHealthCheck(HealthCheck check) {
        healthCheckRegistry.register(check);
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public CandidateSelector getSelector() {
        return selector;
    }

    public NicknameIndex getNicknameIndex() {
        return nicknameIndex;
    }

    public Normalizer getNormalizer() {
        return normalizer;
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    @Override
    public void close() {
        if (matchingExecutor != null) {
            matchingExecutor.shutdown();
            try {
                if (!matchingExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    matchingExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                matchingExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingOptions options;
        private NicknameIndex nicknameIndex;
        private Normalizer normalizer;
        private MetricsService metrics;
        private AuditService auditService;

        public Builder options(MatchingOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Nickname index to use; the bundled dataset is loaded when none is set.
         */
        public Builder nicknameIndex(NicknameIndex nicknameIndex) {
            this.nicknameIndex = nicknameIndex;
            return this;
        }

        public Builder normalizer(Normalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder metricsService(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public IdentityMatcher build() {
            return new IdentityMatcher(this);
        }
    }
}

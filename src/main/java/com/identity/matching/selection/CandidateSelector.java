package com.identity.matching.selection;

import com.identity.matching.compare.EmailComparator;
import com.identity.matching.compare.FieldComparator;
import com.identity.matching.compare.NameComparator;
import com.identity.matching.compare.PhoneComparator;
import com.identity.matching.core.model.CandidateRecord;
import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.core.model.FieldVerdicts;
import com.identity.matching.core.model.InvalidRecordException;
import com.identity.matching.core.model.LocalRecord;
import com.identity.matching.core.model.MatchCandidate;
import com.identity.matching.core.model.RecommendationTier;
import com.identity.matching.decision.RecommendationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Picks, for each unlinked local record, the best directory candidate.
 *
 * <p>Every candidate is compared field by field and the verdicts are fused by the
 * {@link RecommendationEngine}. The highest tier wins; ties go to the higher verdict
 * rank sum and then to the candidate that comes first in the directory. Candidates
 * whose tier is NO_MATCH are never chosen, so a record without any better pairing
 * yields {@link MatchCandidate#noMatch(LocalRecord)}.</p>
 *
 * <p>Records that already carry an external reference are skipped. Invalid records,
 * local or directory, are reported in the {@link SelectionResult} and the rest of the
 * batch continues.</p>
 *
 * <p>With an {@link Executor}, local records are matched concurrently; the output
 * still follows input order.</p>
 */
public class CandidateSelector {
    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final FieldComparator nameComparator;
    private final FieldComparator emailComparator;
    private final FieldComparator phoneComparator;
    private final RecommendationEngine recommendationEngine;
    private final Executor executor;

    public CandidateSelector(NameComparator nameComparator, EmailComparator emailComparator,
                             PhoneComparator phoneComparator, RecommendationEngine recommendationEngine) {
        this(nameComparator, emailComparator, phoneComparator, recommendationEngine, null);
    }

    /**
     * @param executor executor for matching local records concurrently, or null to match on the caller's thread
     */
    public CandidateSelector(FieldComparator nameComparator, FieldComparator emailComparator,
                             FieldComparator phoneComparator, RecommendationEngine recommendationEngine,
                             Executor executor) {
        this.nameComparator = nameComparator;
        this.emailComparator = emailComparator;
        this.phoneComparator = phoneComparator;
        this.recommendationEngine = recommendationEngine;
        this.executor = executor;
    }

    /**
     * Matches every eligible local record against the directory.
     */
    public SelectionResult select(Collection<LocalRecord> localRecords, Collection<CandidateRecord> directory) {
        List<RejectedRecord> rejected = new ArrayList<>();

        List<CandidateRecord> candidates = new ArrayList<>(directory.size());
        for (CandidateRecord candidate : directory) {
            try {
                candidate.validate();
                candidates.add(candidate);
            } catch (InvalidRecordException e) {
                log.warn("selection.candidate.rejected externalId={} reason='{}'", e.getRecordId(), e.getMessage());
                rejected.add(new RejectedRecord(e.getRecordId(), RejectedRecord.DIRECTORY, e.getMessage()));
            }
        }

        List<LocalRecord> eligible = new ArrayList<>(localRecords.size());
        for (LocalRecord local : localRecords) {
            if (local.isLinked()) {
                log.debug("selection.local.skipped localId={} reason=already-linked", local.getId());
                continue;
            }
            try {
                local.validate();
                eligible.add(local);
            } catch (InvalidRecordException e) {
                log.warn("selection.local.rejected localId={} reason='{}'", e.getRecordId(), e.getMessage());
                rejected.add(new RejectedRecord(e.getRecordId(), RejectedRecord.LOCAL, e.getMessage()));
            }
        }

        List<MatchCandidate> results = executor == null
                ? matchSequentially(eligible, candidates)
                : matchConcurrently(eligible, candidates);

        log.debug("selection.completed local={} directory={} rejected={}",
                eligible.size(), candidates.size(), rejected.size());
        return new SelectionResult(results, rejected);
    }

    /**
     * Returns the best candidate for a single local record, or a no-match result.
     */
    public MatchCandidate selectBest(LocalRecord local, List<CandidateRecord> candidates) {
        MatchCandidate best = null;
        for (CandidateRecord candidate : candidates) {
            FieldVerdicts verdicts = compare(local, candidate);
            RecommendationTier tier = recommendationEngine.recommend(verdicts);
            if (tier == RecommendationTier.NO_MATCH) {
                continue;
            }
            if (best == null || isBetter(tier, verdicts, best)) {
                best = new MatchCandidate(local, candidate, verdicts, tier);
            }
        }
        return best != null ? best : MatchCandidate.noMatch(local);
    }

    /**
     * Computes the three field verdicts for one pairing.
     */
    public FieldVerdicts compare(LocalRecord local, CandidateRecord candidate) {
        FieldVerdict name = nameComparator.compare(local.getFullName(), Set.of(candidate.getName()));
        FieldVerdict email = local.getEmail()
                .map(value -> emailComparator.compare(value, candidate.getEmails()))
                .orElse(FieldVerdict.NO_MATCH);
        FieldVerdict phone = local.getPhone()
                .map(value -> phoneComparator.compare(value, candidate.getPhones()))
                .orElse(FieldVerdict.NO_MATCH);
        return new FieldVerdicts(name, email, phone, local.hasEmail(), local.hasPhone());
    }

    private boolean isBetter(RecommendationTier tier, FieldVerdicts verdicts, MatchCandidate current) {
        if (tier != current.tier()) {
            return tier.isHigherThan(current.tier());
        }
        return verdicts.rankSum() > current.verdicts().rankSum();
    }

    private List<MatchCandidate> matchSequentially(List<LocalRecord> locals, List<CandidateRecord> candidates) {
        List<MatchCandidate> results = new ArrayList<>(locals.size());
        for (LocalRecord local : locals) {
            results.add(selectBest(local, candidates));
        }
        return results;
    }

    private List<MatchCandidate> matchConcurrently(List<LocalRecord> locals, List<CandidateRecord> candidates) {
        List<CompletableFuture<MatchCandidate>> futures = new ArrayList<>(locals.size());
        for (LocalRecord local : locals) {
            futures.add(CompletableFuture.supplyAsync(() -> selectBest(local, candidates), executor));
        }
        List<MatchCandidate> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<MatchCandidate> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
        return results;
    }
}

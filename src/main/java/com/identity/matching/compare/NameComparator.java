package com.identity.matching.compare;

import com.identity.matching.api.MatchingOptions;
import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.nickname.NicknameIndex;
import com.identity.matching.rules.Normalizer;
import com.identity.matching.similarity.LevenshteinSimilarity;
import com.identity.matching.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Compares full names.
 *
 * <ol>
 *   <li>Equal normalized names are {@link FieldVerdict#PERFECT}.</li>
 *   <li>When both names have a given and a family token and the family names are
 *       similar enough, linked given names (nicknames) are {@link FieldVerdict#CLOSE};
 *       otherwise the given-name similarity decides PERFECT or CLOSE.</li>
 *   <li>If that step is not conclusive, the similarity of the whole normalized
 *       strings decides.</li>
 * </ol>
 */
public class NameComparator implements FieldComparator {
    private static final Logger log = LoggerFactory.getLogger(NameComparator.class);

    private final Normalizer normalizer;
    private final NicknameIndex nicknameIndex;
    private final SimilarityAlgorithm similarity;
    private final MatchingOptions options;

    public NameComparator(Normalizer normalizer, NicknameIndex nicknameIndex, MatchingOptions options) {
        this(normalizer, nicknameIndex, new LevenshteinSimilarity(), options);
    }

    public NameComparator(Normalizer normalizer, NicknameIndex nicknameIndex,
                          SimilarityAlgorithm similarity, MatchingOptions options) {
        this.normalizer = normalizer;
        this.nicknameIndex = nicknameIndex != null ? nicknameIndex : NicknameIndex.empty();
        this.similarity = similarity;
        this.options = options;
    }

    /**
     * Returns the best verdict of the local name against any candidate name.
     */
    @Override
    public FieldVerdict compare(String localValue, Collection<String> candidateValues) {
        FieldVerdict best = FieldVerdict.NO_MATCH;
        if (candidateValues == null) {
            return best;
        }
        for (String candidate : candidateValues) {
            best = FieldVerdict.best(best, compare(localValue, candidate));
            if (best == FieldVerdict.PERFECT) {
                break;
            }
        }
        return best;
    }

    /**
     * Compares two full names.
     */
    public FieldVerdict compare(String localName, String candidateName) {
        String local = normalizer.normalizeName(localName);
        String candidate = normalizer.normalizeName(candidateName);
        if (local.isEmpty() || candidate.isEmpty()) {
            return FieldVerdict.NO_MATCH;
        }
        if (local.equals(candidate)) {
            return FieldVerdict.PERFECT;
        }

        String[] localTokens = local.split(" ");
        String[] candidateTokens = candidate.split(" ");
        if (localTokens.length >= 2 && candidateTokens.length >= 2) {
            FieldVerdict tokenVerdict = compareTokens(localTokens, candidateTokens);
            if (tokenVerdict != FieldVerdict.NO_MATCH) {
                return tokenVerdict;
            }
        }

        double fullSimilarity = similarity.compute(local, candidate);
        log.debug("name.compare.fallback local='{}' candidate='{}' similarity={}", local, candidate, fullSimilarity);
        if (fullSimilarity >= options.getFullNamePerfectThreshold()) {
            return FieldVerdict.PERFECT;
        }
        if (fullSimilarity >= options.getFullNameCloseThreshold()) {
            return FieldVerdict.CLOSE;
        }
        return FieldVerdict.NO_MATCH;
    }

    private FieldVerdict compareTokens(String[] localTokens, String[] candidateTokens) {
        String localGiven = localTokens[0];
        String localFamily = localTokens[localTokens.length - 1];
        String candidateGiven = candidateTokens[0];
        String candidateFamily = candidateTokens[candidateTokens.length - 1];

        double familySimilarity = similarity.compute(localFamily, candidateFamily);
        if (familySimilarity < options.getFamilyNameThreshold()) {
            return FieldVerdict.NO_MATCH;
        }
        if (nicknameIndex.areLinked(localGiven, candidateGiven)) {
            return FieldVerdict.CLOSE;
        }
        double givenSimilarity = similarity.compute(localGiven, candidateGiven);
        if (givenSimilarity >= options.getGivenNamePerfectThreshold()) {
            return FieldVerdict.PERFECT;
        }
        if (givenSimilarity >= options.getGivenNameCloseThreshold()) {
            return FieldVerdict.CLOSE;
        }
        return FieldVerdict.NO_MATCH;
    }

    @Override
    public String getName() {
        return "name";
    }
}

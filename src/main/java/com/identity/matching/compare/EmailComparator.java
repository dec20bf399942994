package com.identity.matching.compare;

import com.identity.matching.api.MatchingOptions;
import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.rules.Normalizer;
import com.identity.matching.similarity.LevenshteinSimilarity;
import com.identity.matching.similarity.SimilarityAlgorithm;

import java.util.Collection;

/**
 * Compares an email address against a candidate's addresses.
 *
 * <p>An exact, case-insensitive match with any address is {@link FieldVerdict#PERFECT}.
 * Otherwise an address is {@link FieldVerdict#CLOSE} when it has the same local part and
 * a similar domain ({@code gmail.con} vs {@code gmail.com}), the same local part and the
 * same provider ({@code gmail.com} vs {@code gmail.co.uk}), or the same domain.</p>
 */
public class EmailComparator implements FieldComparator {

    private final Normalizer normalizer;
    private final SimilarityAlgorithm similarity;
    private final MatchingOptions options;

    public EmailComparator(Normalizer normalizer, MatchingOptions options) {
        this(normalizer, new LevenshteinSimilarity(), options);
    }

    public EmailComparator(Normalizer normalizer, SimilarityAlgorithm similarity, MatchingOptions options) {
        this.normalizer = normalizer;
        this.similarity = similarity;
        this.options = options;
    }

    @Override
    public FieldVerdict compare(String localValue, Collection<String> candidateValues) {
        String local = normalizer.normalizeEmail(localValue);
        if (local.isEmpty() || candidateValues == null || candidateValues.isEmpty()) {
            return FieldVerdict.NO_MATCH;
        }

        for (String candidate : candidateValues) {
            if (local.equals(normalizer.normalizeEmail(candidate))) {
                return FieldVerdict.PERFECT;
            }
        }

        EmailParts localParts = EmailParts.of(local);
        for (String candidate : candidateValues) {
            EmailParts candidateParts = EmailParts.of(normalizer.normalizeEmail(candidate));
            if (localParts.localPart().equals(candidateParts.localPart())) {
                if (similarity.compute(localParts.domain(), candidateParts.domain())
                        >= options.getEmailDomainThreshold()) {
                    return FieldVerdict.CLOSE;
                }
                if (!localParts.provider().isEmpty() && localParts.provider().equals(candidateParts.provider())) {
                    return FieldVerdict.CLOSE;
                }
            }
            if (!localParts.domain().isEmpty() && localParts.domain().equals(candidateParts.domain())) {
                return FieldVerdict.CLOSE;
            }
        }
        return FieldVerdict.NO_MATCH;
    }

    @Override
    public String getName() {
        return "email";
    }

    /**
     * An address split at its first {@code @}. The provider is the first label of the domain.
     */
    record EmailParts(String localPart, String domain, String provider) {

        static EmailParts of(String email) {
            String[] parts = email.split("@", -1);
            String domain = parts.length > 1 ? parts[1] : "";
            int dot = domain.indexOf('.');
            String provider = dot >= 0 ? domain.substring(0, dot) : domain;
            return new EmailParts(parts[0], domain, provider);
        }
    }
}

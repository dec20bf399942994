package com.identity.matching.compare;

import com.identity.matching.api.MatchingOptions;
import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.rules.Normalizer;

import java.util.Collection;

/**
 * Compares a phone number against a candidate's numbers.
 * Equal normalized numbers are {@link FieldVerdict#PERFECT}; numbers sharing the
 * trailing subscriber digits (seven by default) are {@link FieldVerdict#CLOSE}.
 */
public class PhoneComparator implements FieldComparator {

    private final Normalizer normalizer;
    private final int suffixLength;

    public PhoneComparator(Normalizer normalizer, MatchingOptions options) {
        this.normalizer = normalizer;
        this.suffixLength = options.getPhoneSuffixLength();
    }

    @Override
    public FieldVerdict compare(String localValue, Collection<String> candidateValues) {
        String local = normalizer.normalizePhone(localValue);
        if (local.isEmpty() || candidateValues == null || candidateValues.isEmpty()) {
            return FieldVerdict.NO_MATCH;
        }

        for (String candidate : candidateValues) {
            if (local.equals(normalizer.normalizePhone(candidate))) {
                return FieldVerdict.PERFECT;
            }
        }

        if (local.length() < suffixLength) {
            return FieldVerdict.NO_MATCH;
        }
        String localSuffix = suffix(local);
        for (String candidate : candidateValues) {
            String normalized = normalizer.normalizePhone(candidate);
            if (normalized.length() >= suffixLength && localSuffix.equals(suffix(normalized))) {
                return FieldVerdict.CLOSE;
            }
        }
        return FieldVerdict.NO_MATCH;
    }

    private String suffix(String digits) {
        return digits.substring(digits.length() - suffixLength);
    }

    @Override
    public String getName() {
        return "phone";
    }
}

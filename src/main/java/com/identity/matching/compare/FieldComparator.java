package com.identity.matching.compare;

import com.identity.matching.core.model.FieldVerdict;

import java.util.Collection;

/**
 * Compares one local field value against the values a candidate carries for the same field.
 */
public interface FieldComparator {

    /**
     * Returns the verdict for the local value against the candidate values.
     * An empty local value or an empty candidate collection yields {@link FieldVerdict#NO_MATCH}.
     *
     * @param localValue      the local record's value, may be null
     * @param candidateValues the candidate's values; a singleton for names
     */
    FieldVerdict compare(String localValue, Collection<String> candidateValues);

    /**
     * Returns the name of this comparator, used in log messages.
     */
    String getName();
}

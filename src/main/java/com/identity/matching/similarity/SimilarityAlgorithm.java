package com.identity.matching.similarity;

/**
 * String similarity measure used by the field comparators.
 * Implementations return a symmetric score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two already-normalized strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    String getName();
}

package com.identity.matching.similarity;

/**
 * Edit-distance similarity, {@code (longer - distance) / longer}.
 * Equal strings, two empty ones included, score 1.0. Empty against non-empty scores 0.0.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int longer = Math.max(s1.length(), s2.length());
        return (longer - distance(s1, s2)) / (double) longer;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Unit-cost insert/delete/substitute distance. Name tokens usually share a
     * prefix or suffix ("Jonathan"/"Jonathon"), which is skipped before filling a single row.
     */
    public static int distance(String a, String b) {
        int start = 0;
        int endA = a.length();
        int endB = b.length();
        while (start < endA && start < endB && a.charAt(start) == b.charAt(start)) {
            start++;
        }
        while (endA > start && endB > start && a.charAt(endA - 1) == b.charAt(endB - 1)) {
            endA--;
            endB--;
        }
        int lenA = endA - start;
        int lenB = endB - start;
        if (lenA == 0 || lenB == 0) {
            return lenA + lenB;
        }

        int[] row = new int[lenB + 1];
        for (int j = 0; j <= lenB; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= lenA; i++) {
            char ca = a.charAt(start + i - 1);
            int diagonal = row[0];
            row[0] = i;
            for (int j = 1; j <= lenB; j++) {
                int above = row[j];
                int substitute = diagonal + (ca == b.charAt(start + j - 1) ? 0 : 1);
                row[j] = Math.min(substitute, Math.min(above, row[j - 1]) + 1);
                diagonal = above;
            }
        }
        return row[lenB];
    }
}

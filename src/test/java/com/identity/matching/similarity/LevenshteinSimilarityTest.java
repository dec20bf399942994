package com.identity.matching.similarity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @ParameterizedTest
    @CsvSource({
            "kitten, sitting, 3",
            "smith, smyth, 1",
            "jon, jonathan, 5",
            "'', abc, 3",
            "flaw, lawn, 2",
            "same, same, 0"
    })
    void computesEditDistance(String a, String b, int expected) {
        assertEquals(expected, LevenshteinSimilarity.distance(a, b));
    }

    @Test
    void similarityIsNormalizedByLongerLength() {
        assertEquals(0.5, similarity.compute("robert", "rob"), 1e-9);
        assertEquals(0.8, similarity.compute("smith", "smyth"), 1e-9);
        assertEquals(0.375, similarity.compute("jon", "jonathan"), 1e-9);
    }

    @Test
    void identicalAndEmptyStrings() {
        assertEquals(1.0, similarity.compute("anne", "anne"));
        assertEquals(1.0, similarity.compute("", ""));
        assertEquals(0.0, similarity.compute("", "anne"));
        assertEquals(0.0, similarity.compute(null, "anne"));
    }

    @ParameterizedTest
    @CsvSource({
            "johnson, jonson",
            "gmail.com, gmail.con",
            "mary smith, smith mary",
            "a, abcdef",
            "katherine, catherine"
    })
    void similarityIsSymmetric(String a, String b) {
        assertEquals(similarity.compute(a, b), similarity.compute(b, a));
    }
}

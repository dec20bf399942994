package com.identity.matching.core.model;

import org.junit.jupiter.api.Test;

import static com.identity.matching.core.model.FieldVerdict.*;
import static org.junit.jupiter.api.Assertions.*;

class MatchCandidateTest {

    private final LocalRecord local = LocalRecord.builder().id("L1").firstName("Ann").lastName("Lee")
            .email("ann@x.org").build();
    private final CandidateRecord candidate = CandidateRecord.builder().externalId("P1").name("Ann Lee").build();

    @Test
    void absentFieldsAreForcedToNoMatch() {
        FieldVerdicts verdicts = new FieldVerdicts(PERFECT, PERFECT, PERFECT, true, false);

        assertEquals(PERFECT, verdicts.email());
        assertEquals(NO_MATCH, verdicts.phone());
        assertEquals(4, verdicts.rankSum());
    }

    @Test
    void perfectMatchRequiresEveryPopulatedFieldPerfect() {
        MatchCandidate perfect = new MatchCandidate(local, candidate,
                new FieldVerdicts(PERFECT, PERFECT, NO_MATCH, true, false), RecommendationTier.MATCH);
        MatchCandidate closeEmail = new MatchCandidate(local, candidate,
                new FieldVerdicts(PERFECT, CLOSE, NO_MATCH, true, false), RecommendationTier.MATCH);

        assertTrue(perfect.isPerfectMatch());
        assertFalse(closeEmail.isPerfectMatch());
    }

    @Test
    void noMatchHasNoCandidate() {
        MatchCandidate none = MatchCandidate.noMatch(local);

        assertFalse(none.hasCandidate());
        assertFalse(none.isPerfectMatch());
        assertTrue(none.getChosen().isEmpty());
        assertEquals(RecommendationTier.NO_MATCH, none.tier());
        assertEquals("L1", none.localId());
    }

    @Test
    void chosenCandidateCannotBeNoMatch() {
        assertThrows(IllegalArgumentException.class, () -> new MatchCandidate(local, candidate,
                FieldVerdicts.none(true, false), RecommendationTier.NO_MATCH));
    }

    @Test
    void verdictOrdering() {
        assertEquals(PERFECT, FieldVerdict.best(CLOSE, PERFECT));
        assertTrue(CLOSE.isAtLeast(CLOSE));
        assertFalse(NO_MATCH.isAtLeast(CLOSE));
        assertTrue(RecommendationTier.MATCH.isHigherThan(RecommendationTier.REVIEW));
    }
}

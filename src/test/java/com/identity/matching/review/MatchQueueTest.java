package com.identity.matching.review;

import com.identity.matching.core.model.CandidateRecord;
import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.core.model.FieldVerdicts;
import com.identity.matching.core.model.LocalRecord;
import com.identity.matching.core.model.MatchCandidate;
import com.identity.matching.core.model.RecommendationTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchQueueTest {

    private static MatchCandidate candidate(String localId) {
        return new MatchCandidate(
                LocalRecord.builder().id(localId).firstName("N").lastName(localId).build(),
                CandidateRecord.builder().externalId("P-" + localId).name("N " + localId).build(),
                new FieldVerdicts(FieldVerdict.CLOSE, FieldVerdict.PERFECT, FieldVerdict.NO_MATCH, true, false),
                RecommendationTier.MATCH);
    }

    private final MatchCandidate a = candidate("A");
    private final MatchCandidate b = candidate("B");
    private final MatchCandidate c = candidate("C");
    private final MatchCandidate d = candidate("D");

    @Test
    void emptyQueueHasNoCurrent() {
        MatchQueue queue = MatchQueue.empty();

        assertTrue(queue.isEmpty());
        assertTrue(queue.current().isEmpty());
        assertFalse(queue.next());
        assertFalse(queue.previous());
        assertThrows(IllegalStateException.class, queue::removeCurrent);
    }

    @Test
    void mergePutsPerfectFirstAndResetsCursor() {
        MatchQueue queue = new MatchQueue(List.of(a, b), List.of(c, d));
        queue.next();

        queue.mergePerfectIntoReview();

        assertEquals(List.of(a, b, c, d), queue.getReview());
        assertFalse(queue.hasPerfect());
        assertEquals(0, queue.getCursor());
    }

    @Test
    void removeCurrentKeepsOrderAndClamps() {
        MatchQueue queue = new MatchQueue(List.of(), List.of(a, b, c));
        queue.next();

        assertEquals(b, queue.removeCurrent());
        assertEquals(List.of(a, c), queue.getReview());
        assertEquals(c, queue.current().orElseThrow());

        assertEquals(c, queue.removeCurrent());
        assertEquals(0, queue.getCursor());
        assertEquals(a, queue.removeCurrent());
        assertTrue(queue.isEmpty());
    }

    @Test
    void removePerfect() {
        MatchQueue queue = new MatchQueue(List.of(a, b), List.of());

        assertTrue(queue.removePerfect(a));
        assertFalse(queue.removePerfect(c));
        assertEquals(List.of(b), queue.getPerfect());
    }

    @Test
    void bucketsAreReadOnlyViews() {
        MatchQueue queue = new MatchQueue(List.of(a), List.of(b));

        assertThrows(UnsupportedOperationException.class, () -> queue.getReview().clear());
        assertThrows(UnsupportedOperationException.class, () -> queue.getPerfect().add(c));
    }
}

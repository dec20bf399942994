package com.identity.matching.review;

import com.identity.matching.core.model.MatchCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The two buckets of a matching run and the review cursor.
 *
 * <p>{@code perfect} holds the results eligible for bulk approval, {@code review} the
 * ones the operator steps through. Both keep arrival order; removing an item never
 * reorders the rest. The cursor always points into {@code review} while it is non-empty.</p>
 *
 * <p>Not thread-safe: one queue belongs to one operator session.</p>
 */
public class MatchQueue {

    private final List<MatchCandidate> perfect;
    private final List<MatchCandidate> review;
    private int cursor;

    public MatchQueue(List<MatchCandidate> perfect, List<MatchCandidate> review) {
        this.perfect = new ArrayList<>(perfect);
        this.review = new ArrayList<>(review);
        this.cursor = 0;
    }

    public static MatchQueue empty() {
        return new MatchQueue(List.of(), List.of());
    }

    public List<MatchCandidate> getPerfect() {
        return Collections.unmodifiableList(perfect);
    }

    public List<MatchCandidate> getReview() {
        return Collections.unmodifiableList(review);
    }

    public boolean hasPerfect() {
        return !perfect.isEmpty();
    }

    public boolean isEmpty() {
        return perfect.isEmpty() && review.isEmpty();
    }

    /**
     * Moves every perfect item in front of the review items and resets the cursor.
     */
    public void mergePerfectIntoReview() {
        List<MatchCandidate> merged = new ArrayList<>(perfect.size() + review.size());
        merged.addAll(perfect);
        merged.addAll(review);
        perfect.clear();
        review.clear();
        review.addAll(merged);
        cursor = 0;
    }

    /**
     * Removes a perfect item after it was approved.
     */
    public boolean removePerfect(MatchCandidate candidate) {
        return perfect.remove(candidate);
    }

    public Optional<MatchCandidate> current() {
        return review.isEmpty() ? Optional.empty() : Optional.of(review.get(cursor));
    }

    public int getCursor() {
        return cursor;
    }

    public int reviewSize() {
        return review.size();
    }

    /**
     * Moves the cursor forward; stays on the last item.
     *
     * @return true if the cursor moved
     */
    public boolean next() {
        if (cursor < review.size() - 1) {
            cursor++;
            return true;
        }
        return false;
    }

    /**
     * Moves the cursor back; stays on the first item.
     *
     * @return true if the cursor moved
     */
    public boolean previous() {
        if (cursor > 0) {
            cursor--;
            return true;
        }
        return false;
    }

    /**
     * Removes the item under the cursor and clamps the cursor into range.
     */
    public MatchCandidate removeCurrent() {
        if (review.isEmpty()) {
            throw new IllegalStateException("Review queue is empty");
        }
        MatchCandidate removed = review.remove(cursor);
        if (cursor >= review.size()) {
            cursor = Math.max(0, review.size() - 1);
        }
        return removed;
    }
}

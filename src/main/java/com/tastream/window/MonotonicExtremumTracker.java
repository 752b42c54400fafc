package com.tastream.window;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window minimum or maximum backed by a monotonic deque.
 *
 * <p>Candidates are kept as (value, position) pairs ordered so that the front is always
 * the extremum of the window. A push drops every candidate from the back that the new value
 * dominates; {@link #evictBefore(long)} drops candidates from the front once their position
 * leaves the window. Each value enters and leaves the deque at most once, so both
 * operations are O(1) amortized.
 *
 * <p>Positions are supplied by the owner and must be non-decreasing across pushes.
 */
public final class MonotonicExtremumTracker {

    private final ExtremumOrder order;
    private final Deque<Candidate> candidates;

    public MonotonicExtremumTracker(ExtremumOrder order) {
        this.order = order;
        this.candidates = new ArrayDeque<>();
    }

    private MonotonicExtremumTracker(MonotonicExtremumTracker other) {
        this.order = other.order;
        // Candidate is immutable, sharing instances is safe
        this.candidates = new ArrayDeque<>(other.candidates);
    }

    public void push(double value, long position) {
        while (!candidates.isEmpty() && order.dominates(value, candidates.peekLast().value)) {
            candidates.pollLast();
        }
        candidates.addLast(new Candidate(value, position));
    }

    /** Drops front candidates whose position is strictly below {@code minPosition}. */
    public void evictBefore(long minPosition) {
        while (!candidates.isEmpty() && candidates.peekFirst().position < minPosition) {
            candidates.pollFirst();
        }
    }

    /** Current extremum, or {@link Double#NaN} if nothing has been pushed. */
    public double current() {
        Candidate front = candidates.peekFirst();
        return front == null ? Double.NaN : front.value;
    }

    public ExtremumOrder getOrder() {
        return order;
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public void reset() {
        candidates.clear();
    }

    public MonotonicExtremumTracker copy() {
        return new MonotonicExtremumTracker(this);
    }

    private static final class Candidate {
        private final double value;
        private final long position;

        private Candidate(double value, long position) {
            this.value = value;
            this.position = position;
        }
    }
}

package com.tastream.unit.window;

import static org.assertj.core.api.Assertions.assertThat;

import com.tastream.window.ExtremumOrder;
import com.tastream.window.MonotonicExtremumTracker;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for MonotonicExtremumTracker against a brute-force trailing window scan.
 */
class MonotonicExtremumTrackerTest {

    @Test
    @DisplayName("empty tracker reports no extremum")
    void emptyTrackerHasNoExtremum() {
        MonotonicExtremumTracker tracker = new MonotonicExtremumTracker(ExtremumOrder.MAX);

        assertThat(tracker.isEmpty()).isTrue();
        assertThat(tracker.current()).isNaN();
    }

    @Test
    @DisplayName("maximum matches brute force over every trailing window")
    void maximumMatchesBruteForce() {
        verifyAgainstBruteForce(ExtremumOrder.MAX);
    }

    @Test
    @DisplayName("minimum matches brute force over every trailing window")
    void minimumMatchesBruteForce() {
        verifyAgainstBruteForce(ExtremumOrder.MIN);
    }

    @Test
    @DisplayName("candidates dominated by a newer value are dropped")
    void dominatedCandidatesAreDropped() {
        MonotonicExtremumTracker tracker = new MonotonicExtremumTracker(ExtremumOrder.MAX);
        tracker.push(3.0, 0);
        tracker.push(2.0, 1);
        tracker.push(1.0, 2);
        assertThat(tracker.size()).isEqualTo(3);

        tracker.push(5.0, 3);

        assertThat(tracker.size()).isEqualTo(1);
        assertThat(tracker.current()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("aged-out front candidates are evicted")
    void agedOutCandidatesAreEvicted() {
        MonotonicExtremumTracker tracker = new MonotonicExtremumTracker(ExtremumOrder.MIN);
        tracker.push(1.0, 0);
        tracker.push(4.0, 1);
        tracker.push(2.0, 2);

        tracker.evictBefore(1);

        assertThat(tracker.current()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("copy and reset leave the other instance untouched")
    void copyIsIndependent() {
        MonotonicExtremumTracker tracker = new MonotonicExtremumTracker(ExtremumOrder.MAX);
        tracker.push(1.0, 0);

        MonotonicExtremumTracker copy = tracker.copy();
        copy.push(9.0, 1);
        tracker.reset();

        assertThat(tracker.isEmpty()).isTrue();
        assertThat(copy.current()).isEqualTo(9.0);
        assertThat(copy.getOrder()).isEqualTo(ExtremumOrder.MAX);
    }

    private static void verifyAgainstBruteForce(ExtremumOrder order) {
        Random random = new Random(42);
        for (int window = 1; window <= 7; window++) {
            MonotonicExtremumTracker tracker = new MonotonicExtremumTracker(order);
            double[] values = new double[200];
            for (int position = 0; position < values.length; position++) {
                // small integer range so ties are frequent
                values[position] = random.nextInt(10) - 5;
                tracker.push(values[position], position);
                tracker.evictBefore(position - window + 1);

                double expected = values[position];
                for (int j = Math.max(0, position - window + 1); j <= position; j++) {
                    expected = order == ExtremumOrder.MAX ? Math.max(expected, values[j]) : Math.min(expected, values[j]);
                }
                assertThat(tracker.current())
                        .as("%s window=%d position=%d", order, window, position)
                        .isEqualTo(expected);
                assertThat(tracker.size()).isLessThanOrEqualTo(window);
            }
        }
    }
}

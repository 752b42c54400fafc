package com.tastream.indicator.primitive;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.ExtremumOrder;
import com.tastream.window.MonotonicExtremumTracker;

/**
 * Returns the lowest value of the last {@code period} samples. Bars contribute their low.
 *
 * <p>Backed by a monotonic deque keyed on a feed counter, O(1) amortized per sample.
 */
public class Minimum implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 14;

    private final int period;
    private final MonotonicExtremumTracker tracker;
    private long position;
    private double current;

    public Minimum() {
        this(DEFAULT_PERIOD);
    }

    public Minimum(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.tracker = new MonotonicExtremumTracker(ExtremumOrder.MIN);
    }

    private Minimum(Minimum other) {
        this.period = other.period;
        this.tracker = other.tracker.copy();
        this.position = other.position;
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        tracker.push(input, position);
        tracker.evictBefore(position - period + 1);
        position++;
        current = tracker.current();
        return current;
    }

    @Override
    public double next(PriceBar bar) {
        return next(bar.getLow());
    }

    @Override
    public double lastValue() {
        return current;
    }

    @Override
    public int getPeriod() {
        return period;
    }

    @Override
    public void reset() {
        tracker.reset();
        position = 0;
        current = 0.0;
    }

    @Override
    public Minimum copy() {
        return new Minimum(this);
    }

    @Override
    public String getName() {
        return "MIN(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

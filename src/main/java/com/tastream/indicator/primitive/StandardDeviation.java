package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.RingBuffer;
import com.tastream.window.SumAccumulator;
import com.tastream.window.VarianceKind;
import java.util.Optional;

/**
 * Standard deviation of the last {@code period} values, from a running sum and sum of
 * squares. Population variance by default; pass {@link VarianceKind#SAMPLE} for the
 * Bessel-corrected estimate.
 */
public class StandardDeviation implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final VarianceKind varianceKind;
    private final RingBuffer<Double> window;
    private final SumAccumulator accumulator;
    private int evictionsSinceResync;
    private double current;

    public StandardDeviation() {
        this(DEFAULT_PERIOD);
    }

    public StandardDeviation(int period) {
        this(period, VarianceKind.POPULATION);
    }

    public StandardDeviation(int period, VarianceKind varianceKind) {
        this.period = Parameters.requirePositive("period", period);
        this.varianceKind = varianceKind;
        this.window = new RingBuffer<>(period);
        this.accumulator = new SumAccumulator();
    }

    private StandardDeviation(StandardDeviation other) {
        this.period = other.period;
        this.varianceKind = other.varianceKind;
        this.window = other.window.copy();
        this.accumulator = other.accumulator.copy();
        this.evictionsSinceResync = other.evictionsSinceResync;
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        Optional<Double> evicted = window.push(input);
        accumulator.onPush(input);
        if (evicted.isPresent()) {
            accumulator.onEvict(evicted.get());
            if (++evictionsSinceResync == period) {
                accumulator.resync(window);
                evictionsSinceResync = 0;
            }
        }
        current = Math.sqrt(accumulator.variance(varianceKind));
        return current;
    }

    /** Mean of the current window, as tracked alongside the deviation. */
    public double mean() {
        return accumulator.isEmpty() ? 0.0 : accumulator.mean();
    }

    @Override
    public double lastValue() {
        return current;
    }

    @Override
    public int getPeriod() {
        return period;
    }

    public VarianceKind getVarianceKind() {
        return varianceKind;
    }

    @Override
    public void reset() {
        window.reset();
        accumulator.reset();
        evictionsSinceResync = 0;
        current = 0.0;
    }

    @Override
    public StandardDeviation copy() {
        return new StandardDeviation(this);
    }

    @Override
    public String getName() {
        return "SD(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

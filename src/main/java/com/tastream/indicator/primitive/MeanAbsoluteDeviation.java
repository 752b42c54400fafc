package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.RingBuffer;

/**
 * Mean absolute deviation of the last {@code period} values around their mean.
 *
 * <p>The mean moves with every sample, so every deviation changes too: recomputed from the
 * window, O(period) per sample.
 */
public class MeanAbsoluteDeviation implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final RingBuffer<Double> window;
    private double current;

    public MeanAbsoluteDeviation() {
        this(DEFAULT_PERIOD);
    }

    public MeanAbsoluteDeviation(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.window = new RingBuffer<>(period);
    }

    private MeanAbsoluteDeviation(MeanAbsoluteDeviation other) {
        this.period = other.period;
        this.window = other.window.copy();
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        window.push(input);
        int n = window.size();

        double sum = 0.0;
        for (double value : window) {
            sum += value;
        }
        double mean = sum / n;

        double deviation = 0.0;
        for (double value : window) {
            deviation += Math.abs(value - mean);
        }
        current = deviation / n;
        return current;
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
        window.reset();
        current = 0.0;
    }

    @Override
    public MeanAbsoluteDeviation copy() {
        return new MeanAbsoluteDeviation(this);
    }

    @Override
    public String getName() {
        return "MAD(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

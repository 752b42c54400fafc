package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.RingBuffer;

/**
 * Kaufman's efficiency ratio over the last {@code period} changes: net change since the
 * value {@code period} samples back divided by the sum of absolute consecutive changes. 1 for a straight move, near 0 for noise, and 0
 * when the window has not moved at all.
 */
public class EfficiencyRatio implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 14;

    private final int period;
    private final RingBuffer<Double> window;
    private double current;

    public EfficiencyRatio() {
        this(DEFAULT_PERIOD);
    }

    public EfficiencyRatio(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.window = new RingBuffer<>(period + 1);
    }

    private EfficiencyRatio(EfficiencyRatio other) {
        this.period = other.period;
        this.window = other.window.copy();
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        window.push(input);
        double first = window.oldest();

        double volatility = 0.0;
        double previous = first;
        for (double value : window) {
            volatility += Math.abs(value - previous);
            previous = value;
        }

        current = volatility == 0.0 ? 0.0 : Math.abs(input - first) / volatility;
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
    public EfficiencyRatio copy() {
        return new EfficiencyRatio(this);
    }

    @Override
    public String getName() {
        return "ER(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

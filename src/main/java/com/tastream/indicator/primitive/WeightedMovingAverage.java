package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.RingBuffer;

/**
 * Linearly weighted moving average. The i-th oldest of the values held gets weight
 * {@code i + 1}, so the newest value weighs most. The sum is divided by {@code n(n+1)/2}
 * for the {@code n} values currently held.
 *
 * <p>Recomputed from the window on every sample, O(period).
 */
public class WeightedMovingAverage implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final RingBuffer<Double> window;
    private double current;

    public WeightedMovingAverage() {
        this(DEFAULT_PERIOD);
    }

    public WeightedMovingAverage(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.window = new RingBuffer<>(period);
    }

    private WeightedMovingAverage(WeightedMovingAverage other) {
        this.period = other.period;
        this.window = other.window.copy();
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        window.push(input);
        double weightedSum = 0.0;
        int weight = 1;
        for (double value : window) {
            weightedSum += weight++ * value;
        }
        int n = window.size();
        current = weightedSum / (n * (n + 1) / 2.0);
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
    public WeightedMovingAverage copy() {
        return new WeightedMovingAverage(this);
    }

    @Override
    public String getName() {
        return "WMA(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

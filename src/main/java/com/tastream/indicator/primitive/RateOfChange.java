package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.RingBuffer;

/**
 * Rate of change in percent against the value {@code period} samples back:
 * {@code (input - base) / base * 100}.
 *
 * <p>While fewer than {@code period} earlier values exist the base is the first value
 * fed. A base of exactly zero yields 0 rather than an infinite ratio.
 */
public class RateOfChange implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final RingBuffer<Double> previous;
    private double current;

    public RateOfChange() {
        this(DEFAULT_PERIOD);
    }

    public RateOfChange(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.previous = new RingBuffer<>(period);
    }

    private RateOfChange(RateOfChange other) {
        this.period = other.period;
        this.previous = other.previous.copy();
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        double base = previous.isEmpty() ? input : previous.oldest();
        previous.push(input);
        current = base == 0.0 ? 0.0 : (input - base) / base * 100.0;
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
        previous.reset();
        current = 0.0;
    }

    @Override
    public RateOfChange copy() {
        return new RateOfChange(this);
    }

    @Override
    public String getName() {
        return "ROC(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;

/**
 * Exponential moving average with smoothing factor {@code k = 2 / (period + 1)}.
 *
 * <p>The first output is the first input; afterwards
 * {@code ema = k * input + (1 - k) * previousEma}. Constant state, no window.
 *
 * <pre>{@code
 * ExponentialMovingAverage ema = new ExponentialMovingAverage(3);
 * ema.next(2.0);  // 2.0
 * ema.next(5.0);  // 3.5
 * ema.next(1.0);  // 2.25
 * ema.next(6.25); // 4.25
 * }</pre>
 */
public class ExponentialMovingAverage implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final double k;
    private double current;
    private boolean initialized;

    public ExponentialMovingAverage() {
        this(DEFAULT_PERIOD);
    }

    public ExponentialMovingAverage(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.k = 2.0 / (period + 1);
    }

    private ExponentialMovingAverage(ExponentialMovingAverage other) {
        this.period = other.period;
        this.k = other.k;
        this.current = other.current;
        this.initialized = other.initialized;
    }

    @Override
    public double next(double input) {
        if (initialized) {
            current = k * input + (1.0 - k) * current;
        } else {
            current = input;
            initialized = true;
        }
        return current;
    }

    @Override
    public double lastValue() {
        return current;
    }

    /** Smoothing factor applied to the newest value. */
    public double getSmoothingFactor() {
        return k;
    }

    @Override
    public int getPeriod() {
        return period;
    }

    @Override
    public void reset() {
        current = 0.0;
        initialized = false;
    }

    @Override
    public ExponentialMovingAverage copy() {
        return new ExponentialMovingAverage(this);
    }

    @Override
    public String getName() {
        return "EMA(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

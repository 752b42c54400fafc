package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.indicator.primitive.Maximum;
import com.tastream.indicator.primitive.Minimum;

/**
 * Fast stochastic oscillator (%K): where the close sits inside the range of the last
 * {@code period} samples, in percent. 50 when the range is empty (highest equals lowest).
 *
 * <p>Bars feed their low into the running minimum and their high into the running maximum;
 * bare values feed both.
 */
public class FastStochastic implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 14;

    private final int period;
    private final Minimum lowest;
    private final Maximum highest;
    private double current;

    public FastStochastic() {
        this(DEFAULT_PERIOD);
    }

    public FastStochastic(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.lowest = new Minimum(period);
        this.highest = new Maximum(period);
    }

    private FastStochastic(FastStochastic other) {
        this.period = other.period;
        this.lowest = other.lowest.copy();
        this.highest = other.highest.copy();
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        return update(lowest.next(input), highest.next(input), input);
    }

    @Override
    public double next(PriceBar bar) {
        return update(lowest.next(bar), highest.next(bar), bar.getClose());
    }

    private double update(double min, double max, double close) {
        double range = max - min;
        current = range == 0.0 ? 50.0 : (close - min) / range * 100.0;
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
        lowest.reset();
        highest.reset();
        current = 0.0;
    }

    @Override
    public FastStochastic copy() {
        return new FastStochastic(this);
    }

    @Override
    public String getName() {
        return "FAST_STOCH(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

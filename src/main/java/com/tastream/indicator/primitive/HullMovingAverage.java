package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;

/**
 * Hull moving average: {@code WMA(sqrt(n))} of the series {@code 2 * WMA(n/2) - WMA(n)}.
 *
 * <p>Owns its three weighted averages and feeds them in lockstep: half, full, then the
 * smoothing average. Requires {@code period >= 2} so the half-period average exists.
 */
public class HullMovingAverage implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final WeightedMovingAverage halfWma;
    private final WeightedMovingAverage fullWma;
    private final WeightedMovingAverage sqrtWma;

    public HullMovingAverage() {
        this(DEFAULT_PERIOD);
    }

    public HullMovingAverage(int period) {
        this.period = Parameters.requireAtLeast("period", period, 2);
        this.halfWma = new WeightedMovingAverage(period / 2);
        this.fullWma = new WeightedMovingAverage(period);
        this.sqrtWma = new WeightedMovingAverage((int) Math.floor(Math.sqrt(period)));
    }

    private HullMovingAverage(HullMovingAverage other) {
        this.period = other.period;
        this.halfWma = other.halfWma.copy();
        this.fullWma = other.fullWma.copy();
        this.sqrtWma = other.sqrtWma.copy();
    }

    @Override
    public double next(double input) {
        double half = halfWma.next(input);
        double full = fullWma.next(input);
        return sqrtWma.next(2.0 * half - full);
    }

    @Override
    public double lastValue() {
        return sqrtWma.lastValue();
    }

    @Override
    public int getPeriod() {
        return period;
    }

    @Override
    public void reset() {
        halfWma.reset();
        fullWma.reset();
        sqrtWma.reset();
    }

    @Override
    public HullMovingAverage copy() {
        return new HullMovingAverage(this);
    }

    @Override
    public String getName() {
        return "HMA(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + lastValue();
    }
}

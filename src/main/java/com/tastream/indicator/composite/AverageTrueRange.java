package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.indicator.primitive.ExponentialMovingAverage;
import com.tastream.indicator.primitive.TrueRange;

/**
 * Average true range: an EMA of {@link TrueRange}.
 */
public class AverageTrueRange implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 14;

    private final int period;
    private final TrueRange trueRange;
    private final ExponentialMovingAverage ema;

    public AverageTrueRange() {
        this(DEFAULT_PERIOD);
    }

    public AverageTrueRange(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.trueRange = new TrueRange();
        this.ema = new ExponentialMovingAverage(period);
    }

    private AverageTrueRange(AverageTrueRange other) {
        this.period = other.period;
        this.trueRange = other.trueRange.copy();
        this.ema = other.ema.copy();
    }

    @Override
    public double next(double input) {
        return ema.next(trueRange.next(input));
    }

    @Override
    public double next(PriceBar bar) {
        return ema.next(trueRange.next(bar));
    }

    @Override
    public double lastValue() {
        return ema.lastValue();
    }

    @Override
    public int getPeriod() {
        return period;
    }

    @Override
    public void reset() {
        trueRange.reset();
        ema.reset();
    }

    @Override
    public AverageTrueRange copy() {
        return new AverageTrueRange(this);
    }

    @Override
    public String getName() {
        return "ATR(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + lastValue();
    }
}

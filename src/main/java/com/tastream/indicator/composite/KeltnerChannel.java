package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.OutputIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.primitive.ExponentialMovingAverage;

/**
 * Keltner channel: an EMA middle line of the typical price with bands {@code multiplier}
 * average true ranges away. Bare values feed the EMA directly and the ATR with their
 * distance to the previous value.
 */
public class KeltnerChannel implements OutputIndicator<KeltnerChannelOutput>, Period {

    public static final int DEFAULT_PERIOD = 10;
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final int period;
    private final double multiplier;
    private final ExponentialMovingAverage ema;
    private final AverageTrueRange atr;
    private KeltnerChannelOutput current = KeltnerChannelOutput.ZERO;

    public KeltnerChannel() {
        this(DEFAULT_PERIOD, DEFAULT_MULTIPLIER);
    }

    public KeltnerChannel(int period, double multiplier) {
        this.period = Parameters.requirePositive("period", period);
        this.multiplier = Parameters.requireNonNegative("multiplier", multiplier);
        this.ema = new ExponentialMovingAverage(period);
        this.atr = new AverageTrueRange(period);
    }

    private KeltnerChannel(KeltnerChannel other) {
        this.period = other.period;
        this.multiplier = other.multiplier;
        this.ema = other.ema.copy();
        this.atr = other.atr.copy();
        this.current = other.current;
    }

    public KeltnerChannelOutput next(double input) {
        return bands(ema.next(input), atr.next(input));
    }

    public KeltnerChannelOutput next(PriceBar bar) {
        return bands(ema.next(bar.getTypicalPrice()), atr.next(bar));
    }

    private KeltnerChannelOutput bands(double middle, double averageTrueRange) {
        double width = averageTrueRange * multiplier;
        current = new KeltnerChannelOutput(middle + width, middle, middle - width);
        return current;
    }

    @Override
    public KeltnerChannelOutput lastValue() {
        return current;
    }

    @Override
    public int getPeriod() {
        return period;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public void reset() {
        ema.reset();
        atr.reset();
        current = KeltnerChannelOutput.ZERO;
    }

    @Override
    public KeltnerChannel copy() {
        return new KeltnerChannel(this);
    }

    @Override
    public String getName() {
        return "KC(" + period + ", " + multiplier + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

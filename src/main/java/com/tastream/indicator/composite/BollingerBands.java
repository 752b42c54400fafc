package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.OutputIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.primitive.SimpleMovingAverage;
import com.tastream.indicator.primitive.StandardDeviation;

/**
 * Bollinger bands: an SMA middle band with upper and lower bands {@code multiplier}
 * population standard deviations away. With a non-negative multiplier
 * {@code lower <= middle <= upper} always holds.
 */
public class BollingerBands implements OutputIndicator<BollingerBandsOutput>, Period {

    public static final int DEFAULT_PERIOD = 9;
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final int period;
    private final double multiplier;
    private final SimpleMovingAverage sma;
    private final StandardDeviation sd;
    private BollingerBandsOutput current = BollingerBandsOutput.ZERO;

    public BollingerBands() {
        this(DEFAULT_PERIOD, DEFAULT_MULTIPLIER);
    }

    public BollingerBands(int period, double multiplier) {
        this.period = Parameters.requirePositive("period", period);
        this.multiplier = Parameters.requireNonNegative("multiplier", multiplier);
        this.sma = new SimpleMovingAverage(period);
        this.sd = new StandardDeviation(period);
    }

    private BollingerBands(BollingerBands other) {
        this.period = other.period;
        this.multiplier = other.multiplier;
        this.sma = other.sma.copy();
        this.sd = other.sd.copy();
        this.current = other.current;
    }

    public BollingerBandsOutput next(double input) {
        double middle = sma.next(input);
        double width = sd.next(input) * multiplier;
        current = new BollingerBandsOutput(middle + width, middle, middle - width);
        return current;
    }

    public BollingerBandsOutput next(PriceBar bar) {
        return next(bar.getClose());
    }

    @Override
    public BollingerBandsOutput lastValue() {
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
        sma.reset();
        sd.reset();
        current = BollingerBandsOutput.ZERO;
    }

    @Override
    public BollingerBands copy() {
        return new BollingerBands(this);
    }

    @Override
    public String getName() {
        return "BB(" + period + ", " + multiplier + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

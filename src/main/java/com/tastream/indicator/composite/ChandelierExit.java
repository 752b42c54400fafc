package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.OutputIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.primitive.Maximum;
import com.tastream.indicator.primitive.Minimum;

/**
 * Chandelier exit: volatility-based trailing stops.
 *
 * <ul>
 *   <li>long exit = highest high over {@code period} - multiplier * ATR
 *   <li>short exit = lowest low over {@code period} + multiplier * ATR
 * </ul>
 *
 * <p>Children are fed ATR first, then the running maximum of highs and minimum of lows.
 */
public class ChandelierExit implements OutputIndicator<ChandelierExitOutput>, Period {

    public static final int DEFAULT_PERIOD = 22;
    public static final double DEFAULT_MULTIPLIER = 3.0;

    private final int period;
    private final double multiplier;
    private final AverageTrueRange atr;
    private final Maximum highest;
    private final Minimum lowest;
    private ChandelierExitOutput current = ChandelierExitOutput.ZERO;

    public ChandelierExit() {
        this(DEFAULT_PERIOD, DEFAULT_MULTIPLIER);
    }

    public ChandelierExit(int period, double multiplier) {
        this.period = Parameters.requirePositive("period", period);
        this.multiplier = Parameters.requireNonNegative("multiplier", multiplier);
        this.atr = new AverageTrueRange(period);
        this.highest = new Maximum(period);
        this.lowest = new Minimum(period);
    }

    private ChandelierExit(ChandelierExit other) {
        this.period = other.period;
        this.multiplier = other.multiplier;
        this.atr = other.atr.copy();
        this.highest = other.highest.copy();
        this.lowest = other.lowest.copy();
        this.current = other.current;
    }

    public ChandelierExitOutput next(PriceBar bar) {
        double width = atr.next(bar) * multiplier;
        double high = highest.next(bar);
        double low = lowest.next(bar);
        current = new ChandelierExitOutput(high - width, low + width);
        return current;
    }

    @Override
    public ChandelierExitOutput lastValue() {
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
        atr.reset();
        highest.reset();
        lowest.reset();
        current = ChandelierExitOutput.ZERO;
    }

    @Override
    public ChandelierExit copy() {
        return new ChandelierExit(this);
    }

    @Override
    public String getName() {
        return "CE(" + period + ", " + multiplier + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

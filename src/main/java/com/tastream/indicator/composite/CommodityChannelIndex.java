package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.BarIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.primitive.MeanAbsoluteDeviation;
import com.tastream.indicator.primitive.SimpleMovingAverage;

/**
 * Commodity channel index on the typical price {@code (high + low + close) / 3}:
 * {@code (tp - SMA(tp)) / (0.015 * MAD(tp))}, 0 when the mean absolute deviation is 0.
 */
public class CommodityChannelIndex implements BarIndicator<PriceBar>, Period {

    public static final int DEFAULT_PERIOD = 20;

    /** Lambert's constant, scales roughly 70-80% of values into [-100, 100]. */
    private static final double SCALE = 0.015;

    private final int period;
    private final SimpleMovingAverage sma;
    private final MeanAbsoluteDeviation mad;
    private double current;

    public CommodityChannelIndex() {
        this(DEFAULT_PERIOD);
    }

    public CommodityChannelIndex(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.sma = new SimpleMovingAverage(period);
        this.mad = new MeanAbsoluteDeviation(period);
    }

    private CommodityChannelIndex(CommodityChannelIndex other) {
        this.period = other.period;
        this.sma = other.sma.copy();
        this.mad = other.mad.copy();
        this.current = other.current;
    }

    @Override
    public double next(PriceBar bar) {
        double typicalPrice = bar.getTypicalPrice();
        double mean = sma.next(typicalPrice);
        double deviation = mad.next(typicalPrice);
        current = deviation == 0.0 ? 0.0 : (typicalPrice - mean) / (SCALE * deviation);
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
        sma.reset();
        mad.reset();
        current = 0.0;
    }

    @Override
    public CommodityChannelIndex copy() {
        return new CommodityChannelIndex(this);
    }

    @Override
    public String getName() {
        return "CCI(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

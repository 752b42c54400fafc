package com.tastream.indicator.primitive;

import com.tastream.domain.model.OhlcvBar;
import com.tastream.indicator.BarIndicator;

/**
 * On-balance volume: a running total that adds the bar's volume when the close rises,
 * subtracts it when the close falls and leaves it unchanged otherwise.
 *
 * <p>The previous close starts at 0, so the first bar with a positive close adds its
 * volume.
 */
public class OnBalanceVolume implements BarIndicator<OhlcvBar> {

    private double obv;
    private double previousClose;

    public OnBalanceVolume() {}

    private OnBalanceVolume(OnBalanceVolume other) {
        this.obv = other.obv;
        this.previousClose = other.previousClose;
    }

    @Override
    public double next(OhlcvBar bar) {
        if (bar.getClose() > previousClose) {
            obv += bar.getVolume();
        } else if (bar.getClose() < previousClose) {
            obv -= bar.getVolume();
        }
        previousClose = bar.getClose();
        return obv;
    }

    @Override
    public double lastValue() {
        return obv;
    }

    @Override
    public void reset() {
        obv = 0.0;
        previousClose = 0.0;
    }

    @Override
    public OnBalanceVolume copy() {
        return new OnBalanceVolume(this);
    }

    @Override
    public String getName() {
        return "OBV";
    }

    @Override
    public String toString() {
        return getName() + "=" + obv;
    }
}

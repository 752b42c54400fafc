package com.tastream.domain.model;

/**
 * Minimum capability a sample needs to feed range-based indicators: high, low and close.
 *
 * <p>Indicators that only need the close (SMA, EMA, RSI, ...) read {@link #getClose()};
 * range indicators (True Range, Stochastics, Chandelier Exit) read all three.
 */
public interface PriceBar {

    double getHigh();

    double getLow();

    double getClose();

    /** (high + low + close) / 3. */
    default double getTypicalPrice() {
        return (getHigh() + getLow() + getClose()) / 3.0;
    }
}

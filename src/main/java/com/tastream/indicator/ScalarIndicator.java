package com.tastream.indicator;

import com.tastream.domain.model.PriceBar;

/**
 * Indicator producing one {@code double} per sample, fed with bare values.
 *
 * <p>Bars are accepted as well: by default the close is fed. Indicators with range
 * semantics override {@link #next(PriceBar)} to use high and low.
 */
public interface ScalarIndicator extends Indicator {

    /** Feeds one value and returns the updated indicator value. */
    double next(double input);

    default double next(PriceBar bar) {
        return next(bar.getClose());
    }

    /** Most recent output without feeding; 0.0 before the first sample. */
    double lastValue();

    @Override
    ScalarIndicator copy();
}

package com.tastream.indicator;

import com.tastream.domain.model.PriceBar;

/**
 * Indicator producing one {@code double} per bar, for indicators that cannot work from a
 * bare value.
 *
 * @param <B> the minimum bar capability the indicator reads
 */
public interface BarIndicator<B extends PriceBar> extends Indicator {

    double next(B bar);

    /** Most recent output without feeding; 0.0 before the first bar. */
    double lastValue();

    @Override
    BarIndicator<B> copy();
}

package com.tastream.indicator;

/**
 * Indicator whose per-sample output is a small fixed-shape value object (MACD triple,
 * Bollinger bands, ...). Implementations expose their own {@code next(...)} overloads
 * returning {@code O}.
 *
 * @param <O> output type
 */
public interface OutputIndicator<O> extends Indicator {

    /** Most recent output without feeding; an all-zero output before the first sample. */
    O lastValue();

    @Override
    OutputIndicator<O> copy();
}

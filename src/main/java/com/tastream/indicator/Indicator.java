package com.tastream.indicator;

/**
 * Lifecycle contract shared by every indicator.
 *
 * <p>An indicator is constructed with validated parameters, mutated by a sequence of
 * {@code next(...)} calls and returned to its freshly constructed state by {@link #reset()}.
 * A freshly constructed indicator and one that has just been reset behave identically;
 * composites reset all the sub-indicators they own.
 *
 * <p>Instances are not thread-safe. Give every stream its own instance, using
 * {@link #copy()} to fan one configured indicator out to several streams.
 */
public interface Indicator {

    /** Returns the indicator to the state it had immediately after construction. */
    void reset();

    /**
     * Returns a deep copy: same parameters, same accumulated state, no mutable state
     * shared with this instance. Feeding the copy and the original the same samples yields
     * the same outputs.
     */
    Indicator copy();

    /** Short name with parameters, e.g. {@code SMA(9)} or {@code MACD(12, 26, 9)}. */
    String getName();
}

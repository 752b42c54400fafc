package com.tastream.indicator.composite;

import lombok.Value;

/**
 * Chandelier exit levels. {@code longExit} trails below the highest high,
 * {@code shortExit} trails above the lowest low.
 */
@Value
public class ChandelierExitOutput {

    public static final ChandelierExitOutput ZERO = new ChandelierExitOutput(0.0, 0.0);

    double longExit;
    double shortExit;
}

package com.tastream.indicator.composite;

import lombok.Value;

/** Slow stochastic step: raw %K and its moving average %D. */
@Value
public class StochasticOutput {

    public static final StochasticOutput ZERO = new StochasticOutput(0.0, 0.0);

    double k;
    double d;
}

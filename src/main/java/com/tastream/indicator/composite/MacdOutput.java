package com.tastream.indicator.composite;

import lombok.Value;

/** One MACD step. {@code histogram} is always exactly {@code macd - signal}. */
@Value
public class MacdOutput {

    public static final MacdOutput ZERO = new MacdOutput(0.0, 0.0, 0.0);

    double macd;
    double signal;
    double histogram;
}

package com.tastream.indicator.composite;

import lombok.Value;

@Value
public class BollingerBandsOutput {

    public static final BollingerBandsOutput ZERO = new BollingerBandsOutput(0.0, 0.0, 0.0);

    double upper;
    double middle;
    double lower;
}

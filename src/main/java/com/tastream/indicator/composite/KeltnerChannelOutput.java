package com.tastream.indicator.composite;

import lombok.Value;

@Value
public class KeltnerChannelOutput {

    public static final KeltnerChannelOutput ZERO = new KeltnerChannelOutput(0.0, 0.0, 0.0);

    double upper;
    double middle;
    double lower;
}

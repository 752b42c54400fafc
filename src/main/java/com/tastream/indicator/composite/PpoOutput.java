package com.tastream.indicator.composite;

import lombok.Value;

/** One PPO step: oscillator in percent of the slow EMA, its signal line and their difference. */
@Value
public class PpoOutput {

    public static final PpoOutput ZERO = new PpoOutput(0.0, 0.0, 0.0);

    double ppo;
    double signal;
    double histogram;
}

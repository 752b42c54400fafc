package com.tastream.config;

/**
 * Indicator types that can be declared in an indicator set configuration.
 *
 * <p>Each type maps to exactly one indicator class. Multi-output indicators (MACD, PPO,
 * slow stochastic, Bollinger, Keltner, Chandelier) produce one keyed value per output
 * field.
 */
public enum IndicatorType {
    SMA,
    EMA,
    WMA,
    HMA,
    MAXIMUM,
    MINIMUM,
    STANDARD_DEVIATION,
    MEAN_ABSOLUTE_DEVIATION,
    TRUE_RANGE,
    ROC,
    OBV,
    EFFICIENCY_RATIO,
    RSI,
    MACD,
    PPO,
    FAST_STOCHASTIC,
    SLOW_STOCHASTIC,
    CCI,
    MFI,
    ATR,
    BOLLINGER,
    KELTNER,
    CHANDELIER
}

package com.tastream.window;

/** Divisor used when turning a sum of squared deviations into a variance. */
public enum VarianceKind {
    /** Divide by n. */
    POPULATION,
    /** Divide by n - 1 (Bessel's correction). */
    SAMPLE
}

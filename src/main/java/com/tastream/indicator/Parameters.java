package com.tastream.indicator;

import com.tastream.exception.InvalidParameterException;
import java.util.Map;

/**
 * Constructor-time parameter checks. Each method returns the validated value so it can be
 * used inline in field initialisation.
 */
public final class Parameters {

    private Parameters() {}

    public static int requirePositive(String name, int value) {
        return requireAtLeast(name, value, 1);
    }

    public static int requireAtLeast(String name, int value, int min) {
        if (value < min) {
            throw new InvalidParameterException(
                    name + " must be at least " + min + " but was " + value, details(name, value));
        }
        return value;
    }

    public static double requireNonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(
                    name + " must be a finite non-negative number but was " + value, details(name, value));
        }
        return value;
    }

    /** Checks {@code lower < upper}, e.g. fast period below slow period. */
    public static void requireLessThan(String lowerName, int lower, String upperName, int upper) {
        if (lower >= upper) {
            throw new InvalidParameterException(
                    lowerName + " (" + lower + ") must be less than " + upperName + " (" + upper + ")",
                    Map.of("parameter", lowerName, "value", lower, upperName, upper));
        }
    }

    private static Map<String, Object> details(String name, Object value) {
        return Map.of("parameter", name, "value", value);
    }
}

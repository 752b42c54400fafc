package com.tastream.config;

import com.tastream.exception.InvalidParameterException;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

/**
 * Configuration for a single indicator within an indicator set.
 *
 * <p>Defines the indicator type and its parameters (e.g., period=14 for RSI,
 * multiplier=2.0 for Bollinger Bands). Parameters are stored as a flexible map
 * to accommodate varying indicator signatures without rigid schemas. An optional
 * {@code key} overrides the generated {@code TYPE:period} key.
 */
@Data
public class IndicatorDefinition {

    private IndicatorType type;
    private String key;
    private Map<String, Object> params = new HashMap<>();

    public static IndicatorDefinition of(IndicatorType type, Map<String, Object> params) {
        IndicatorDefinition definition = new IndicatorDefinition();
        definition.setType(type);
        definition.setParams(new HashMap<>(params));
        return definition;
    }

    public int getParamOrDefault(String name, int defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value instanceof Number number) {
                double numeric = number.doubleValue();
                if (numeric != Math.rint(numeric)) {
                    throw new NumberFormatException("not an integer: " + value);
                }
                return Math.toIntExact((long) numeric);
            }
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidParameterException(
                    type + " parameter '" + name + "' must be an integer but was " + value, e);
        }
    }

    public double getDoubleParamOrDefault(String name, double defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(
                    type + " parameter '" + name + "' must be a number but was " + value, e);
        }
    }
}

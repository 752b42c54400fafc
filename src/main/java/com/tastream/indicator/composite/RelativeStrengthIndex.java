package com.tastream.indicator.composite;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.indicator.primitive.ExponentialMovingAverage;

/**
 * Relative strength index, bounded to [0, 100].
 *
 * <p>Each sample's change against the previous one is split into a gain and a loss, both
 * non-negative, and each side is smoothed by its own EMA. The output is
 * {@code 100 - 100 / (1 + avgGain / avgLoss)}.
 *
 * <p>Degenerate cases: with no average loss the output is 100 when there is any average
 * gain, and 50 when neither side has moved (always the case for the first sample, which has
 * no previous value to compare with).
 */
public class RelativeStrengthIndex implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 14;

    private final int period;
    private final ExponentialMovingAverage averageGain;
    private final ExponentialMovingAverage averageLoss;
    private double previous;
    private boolean hasPrevious;
    private double current;

    public RelativeStrengthIndex() {
        this(DEFAULT_PERIOD);
    }

    public RelativeStrengthIndex(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.averageGain = new ExponentialMovingAverage(period);
        this.averageLoss = new ExponentialMovingAverage(period);
    }

    private RelativeStrengthIndex(RelativeStrengthIndex other) {
        this.period = other.period;
        this.averageGain = other.averageGain.copy();
        this.averageLoss = other.averageLoss.copy();
        this.previous = other.previous;
        this.hasPrevious = other.hasPrevious;
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        double gain = 0.0;
        double loss = 0.0;
        if (hasPrevious) {
            double delta = input - previous;
            gain = Math.max(delta, 0.0);
            loss = Math.max(-delta, 0.0);
        }
        previous = input;
        hasPrevious = true;

        double gainAverage = averageGain.next(gain);
        double lossAverage = averageLoss.next(loss);

        if (lossAverage == 0.0) {
            current = gainAverage > 0.0 ? 100.0 : 50.0;
        } else {
            double relativeStrength = gainAverage / lossAverage;
            current = 100.0 - 100.0 / (1.0 + relativeStrength);
        }
        return current;
    }

    @Override
    public double lastValue() {
        return current;
    }

    @Override
    public int getPeriod() {
        return period;
    }

    @Override
    public void reset() {
        averageGain.reset();
        averageLoss.reset();
        previous = 0.0;
        hasPrevious = false;
        current = 0.0;
    }

    @Override
    public RelativeStrengthIndex copy() {
        return new RelativeStrengthIndex(this);
    }

    @Override
    public String getName() {
        return "RSI(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

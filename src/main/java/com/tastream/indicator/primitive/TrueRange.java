package com.tastream.indicator.primitive;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.ScalarIndicator;

/**
 * True range: the greatest of {@code high - low}, {@code |high - previousClose|} and
 * {@code |low - previousClose|}.
 *
 * <p>The first bar has no previous close, so its true range is {@code high - low}. Fed with
 * bare values, the true range is the distance to the previous value (0 for the first).
 */
public class TrueRange implements ScalarIndicator {

    private double previousClose;
    private boolean hasPrevious;
    private double current;

    public TrueRange() {}

    private TrueRange(TrueRange other) {
        this.previousClose = other.previousClose;
        this.hasPrevious = other.hasPrevious;
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        current = hasPrevious ? Math.abs(input - previousClose) : 0.0;
        previousClose = input;
        hasPrevious = true;
        return current;
    }

    @Override
    public double next(PriceBar bar) {
        double range = bar.getHigh() - bar.getLow();
        if (hasPrevious) {
            double up = Math.abs(bar.getHigh() - previousClose);
            double down = Math.abs(bar.getLow() - previousClose);
            current = Math.max(range, Math.max(up, down));
        } else {
            current = range;
        }
        previousClose = bar.getClose();
        hasPrevious = true;
        return current;
    }

    @Override
    public double lastValue() {
        return current;
    }

    @Override
    public void reset() {
        previousClose = 0.0;
        hasPrevious = false;
        current = 0.0;
    }

    @Override
    public TrueRange copy() {
        return new TrueRange(this);
    }

    @Override
    public String getName() {
        return "TRUE_RANGE()";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

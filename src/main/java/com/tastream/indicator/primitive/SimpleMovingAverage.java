package com.tastream.indicator.primitive;

import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.window.RingBuffer;
import com.tastream.window.SumAccumulator;
import java.util.Optional;

/**
 * Simple moving average: the arithmetic mean of the last {@code period} values.
 *
 * <p>Until {@code period} values have been fed the mean covers however many values exist,
 * so there is no undefined warm-up output. O(1) per sample.
 *
 * <pre>{@code
 * SimpleMovingAverage sma = new SimpleMovingAverage(3);
 * sma.next(10.0); // 10.0
 * sma.next(11.0); // 10.5
 * sma.next(12.0); // 11.0
 * sma.next(13.0); // 12.0
 * }</pre>
 */
public class SimpleMovingAverage implements ScalarIndicator, Period {

    public static final int DEFAULT_PERIOD = 9;

    private final int period;
    private final RingBuffer<Double> window;
    private final SumAccumulator accumulator;
    private int evictionsSinceResync;
    private double current;

    public SimpleMovingAverage() {
        this(DEFAULT_PERIOD);
    }

    public SimpleMovingAverage(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.window = new RingBuffer<>(period);
        this.accumulator = new SumAccumulator();
    }

    private SimpleMovingAverage(SimpleMovingAverage other) {
        this.period = other.period;
        this.window = other.window.copy();
        this.accumulator = other.accumulator.copy();
        this.evictionsSinceResync = other.evictionsSinceResync;
        this.current = other.current;
    }

    @Override
    public double next(double input) {
        Optional<Double> evicted = window.push(input);
        accumulator.onPush(input);
        if (evicted.isPresent()) {
            accumulator.onEvict(evicted.get());
            if (++evictionsSinceResync == period) {
                accumulator.resync(window);
                evictionsSinceResync = 0;
            }
        }
        current = accumulator.mean();
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
        window.reset();
        accumulator.reset();
        evictionsSinceResync = 0;
        current = 0.0;
    }

    @Override
    public SimpleMovingAverage copy() {
        return new SimpleMovingAverage(this);
    }

    @Override
    public String getName() {
        return "SMA(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

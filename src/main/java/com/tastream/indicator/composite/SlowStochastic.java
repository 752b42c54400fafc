package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.OutputIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.indicator.primitive.SimpleMovingAverage;

/**
 * Slow stochastic oscillator: the fast %K smoothed by an SMA into %D.
 */
public class SlowStochastic implements OutputIndicator<StochasticOutput>, Period {

    public static final int DEFAULT_STOCHASTIC_PERIOD = 14;
    public static final int DEFAULT_SMOOTHING_PERIOD = 3;

    private final FastStochastic fastStochastic;
    private final SimpleMovingAverage smoothing;
    private StochasticOutput current = StochasticOutput.ZERO;

    public SlowStochastic() {
        this(DEFAULT_STOCHASTIC_PERIOD, DEFAULT_SMOOTHING_PERIOD);
    }

    public SlowStochastic(int stochasticPeriod, int smoothingPeriod) {
        Parameters.requirePositive("stochasticPeriod", stochasticPeriod);
        Parameters.requirePositive("smoothingPeriod", smoothingPeriod);
        this.fastStochastic = new FastStochastic(stochasticPeriod);
        this.smoothing = new SimpleMovingAverage(smoothingPeriod);
    }

    private SlowStochastic(SlowStochastic other) {
        this.fastStochastic = other.fastStochastic.copy();
        this.smoothing = other.smoothing.copy();
        this.current = other.current;
    }

    public StochasticOutput next(double input) {
        return smooth(fastStochastic.next(input));
    }

    public StochasticOutput next(PriceBar bar) {
        return smooth(fastStochastic.next(bar));
    }

    private StochasticOutput smooth(double k) {
        current = new StochasticOutput(k, smoothing.next(k));
        return current;
    }

    @Override
    public StochasticOutput lastValue() {
        return current;
    }

    @Override
    public int getPeriod() {
        return fastStochastic.getPeriod();
    }

    public int getSmoothingPeriod() {
        return smoothing.getPeriod();
    }

    @Override
    public void reset() {
        fastStochastic.reset();
        smoothing.reset();
        current = StochasticOutput.ZERO;
    }

    @Override
    public SlowStochastic copy() {
        return new SlowStochastic(this);
    }

    @Override
    public String getName() {
        return "SLOW_STOCH(" + getPeriod() + ", " + getSmoothingPeriod() + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

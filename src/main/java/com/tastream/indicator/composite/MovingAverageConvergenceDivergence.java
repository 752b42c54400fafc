package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.OutputIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.primitive.ExponentialMovingAverage;

/**
 * Moving average convergence/divergence.
 *
 * <ul>
 *   <li>macd = EMA(fast) - EMA(slow)
 *   <li>signal = EMA(signal) of macd
 *   <li>histogram = macd - signal
 * </ul>
 *
 * <p>The fast period must be strictly shorter than the slow one.
 */
public class MovingAverageConvergenceDivergence implements OutputIndicator<MacdOutput> {

    public static final int DEFAULT_FAST_PERIOD = 12;
    public static final int DEFAULT_SLOW_PERIOD = 26;
    public static final int DEFAULT_SIGNAL_PERIOD = 9;

    private final ExponentialMovingAverage fastEma;
    private final ExponentialMovingAverage slowEma;
    private final ExponentialMovingAverage signalEma;
    private MacdOutput current = MacdOutput.ZERO;

    public MovingAverageConvergenceDivergence() {
        this(DEFAULT_FAST_PERIOD, DEFAULT_SLOW_PERIOD, DEFAULT_SIGNAL_PERIOD);
    }

    public MovingAverageConvergenceDivergence(int fastPeriod, int slowPeriod, int signalPeriod) {
        Parameters.requirePositive("fastPeriod", fastPeriod);
        Parameters.requirePositive("slowPeriod", slowPeriod);
        Parameters.requirePositive("signalPeriod", signalPeriod);
        Parameters.requireLessThan("fastPeriod", fastPeriod, "slowPeriod", slowPeriod);
        this.fastEma = new ExponentialMovingAverage(fastPeriod);
        this.slowEma = new ExponentialMovingAverage(slowPeriod);
        this.signalEma = new ExponentialMovingAverage(signalPeriod);
    }

    private MovingAverageConvergenceDivergence(MovingAverageConvergenceDivergence other) {
        this.fastEma = other.fastEma.copy();
        this.slowEma = other.slowEma.copy();
        this.signalEma = other.signalEma.copy();
        this.current = other.current;
    }

    public MacdOutput next(double input) {
        double macd = fastEma.next(input) - slowEma.next(input);
        double signal = signalEma.next(macd);
        current = new MacdOutput(macd, signal, macd - signal);
        return current;
    }

    public MacdOutput next(PriceBar bar) {
        return next(bar.getClose());
    }

    @Override
    public MacdOutput lastValue() {
        return current;
    }

    public int getFastPeriod() {
        return fastEma.getPeriod();
    }

    public int getSlowPeriod() {
        return slowEma.getPeriod();
    }

    public int getSignalPeriod() {
        return signalEma.getPeriod();
    }

    @Override
    public void reset() {
        fastEma.reset();
        slowEma.reset();
        signalEma.reset();
        current = MacdOutput.ZERO;
    }

    @Override
    public MovingAverageConvergenceDivergence copy() {
        return new MovingAverageConvergenceDivergence(this);
    }

    @Override
    public String getName() {
        return "MACD(" + getFastPeriod() + ", " + getSlowPeriod() + ", " + getSignalPeriod() + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

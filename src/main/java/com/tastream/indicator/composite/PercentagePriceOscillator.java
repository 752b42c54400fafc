package com.tastream.indicator.composite;

import com.tastream.domain.model.PriceBar;
import com.tastream.indicator.OutputIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.primitive.ExponentialMovingAverage;

/**
 * Percentage price oscillator: MACD expressed as a percentage of the slow EMA, so values
 * are comparable across instruments with different price levels.
 *
 * <ul>
 *   <li>ppo = (EMA(fast) - EMA(slow)) / EMA(slow) * 100, 0 while the slow EMA is 0
 *   <li>signal = EMA(signal) of ppo
 *   <li>histogram = ppo - signal
 * </ul>
 */
public class PercentagePriceOscillator implements OutputIndicator<PpoOutput> {

    public static final int DEFAULT_FAST_PERIOD = 12;
    public static final int DEFAULT_SLOW_PERIOD = 26;
    public static final int DEFAULT_SIGNAL_PERIOD = 9;

    private final ExponentialMovingAverage fastEma;
    private final ExponentialMovingAverage slowEma;
    private final ExponentialMovingAverage signalEma;
    private PpoOutput current = PpoOutput.ZERO;

    public PercentagePriceOscillator() {
        this(DEFAULT_FAST_PERIOD, DEFAULT_SLOW_PERIOD, DEFAULT_SIGNAL_PERIOD);
    }

    public PercentagePriceOscillator(int fastPeriod, int slowPeriod, int signalPeriod) {
        Parameters.requirePositive("fastPeriod", fastPeriod);
        Parameters.requirePositive("slowPeriod", slowPeriod);
        Parameters.requirePositive("signalPeriod", signalPeriod);
        Parameters.requireLessThan("fastPeriod", fastPeriod, "slowPeriod", slowPeriod);
        this.fastEma = new ExponentialMovingAverage(fastPeriod);
        this.slowEma = new ExponentialMovingAverage(slowPeriod);
        this.signalEma = new ExponentialMovingAverage(signalPeriod);
    }

    private PercentagePriceOscillator(PercentagePriceOscillator other) {
        this.fastEma = other.fastEma.copy();
        this.slowEma = other.slowEma.copy();
        this.signalEma = other.signalEma.copy();
        this.current = other.current;
    }

    public PpoOutput next(double input) {
        double fast = fastEma.next(input);
        double slow = slowEma.next(input);
        double ppo = slow == 0.0 ? 0.0 : (fast - slow) / slow * 100.0;
        double signal = signalEma.next(ppo);
        current = new PpoOutput(ppo, signal, ppo - signal);
        return current;
    }

    public PpoOutput next(PriceBar bar) {
        return next(bar.getClose());
    }

    @Override
    public PpoOutput lastValue() {
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
        current = PpoOutput.ZERO;
    }

    @Override
    public PercentagePriceOscillator copy() {
        return new PercentagePriceOscillator(this);
    }

    @Override
    public String getName() {
        return "PPO(" + getFastPeriod() + ", " + getSlowPeriod() + ", " + getSignalPeriod() + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

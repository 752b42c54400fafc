package com.tastream.indicator.composite;

import com.tastream.domain.model.OhlcvBar;
import com.tastream.indicator.BarIndicator;
import com.tastream.indicator.Parameters;
import com.tastream.indicator.Period;
import com.tastream.window.RingBuffer;
import com.tastream.window.SumAccumulator;
import java.util.Optional;

/**
 * Money flow index: a volume-weighted RSI over the last {@code period} bars.
 *
 * <p>Each bar's raw money flow is {@code typicalPrice * volume}. It counts as positive flow
 * when the typical price rose against the previous bar, negative when it fell, and is
 * ignored when unchanged (always the case for the first bar). The output is
 * {@code 100 * positive / (positive + negative)} over the window, 50 when there is no flow
 * on either side.
 *
 * <p>The window stores signed flows; two running sums track each side so an eviction
 * subtracts the evicted flow from the side it was added to.
 */
public class MoneyFlowIndex implements BarIndicator<OhlcvBar>, Period {

    public static final int DEFAULT_PERIOD = 14;

    private final int period;
    private final RingBuffer<Double> flows;
    private final SumAccumulator positiveFlow;
    private final SumAccumulator negativeFlow;
    private int evictionsSinceResync;
    private double previousTypicalPrice;
    private boolean hasPrevious;
    private double current;

    public MoneyFlowIndex() {
        this(DEFAULT_PERIOD);
    }

    public MoneyFlowIndex(int period) {
        this.period = Parameters.requirePositive("period", period);
        this.flows = new RingBuffer<>(period);
        this.positiveFlow = new SumAccumulator();
        this.negativeFlow = new SumAccumulator();
    }

    private MoneyFlowIndex(MoneyFlowIndex other) {
        this.period = other.period;
        this.flows = other.flows.copy();
        this.positiveFlow = other.positiveFlow.copy();
        this.negativeFlow = other.negativeFlow.copy();
        this.evictionsSinceResync = other.evictionsSinceResync;
        this.previousTypicalPrice = other.previousTypicalPrice;
        this.hasPrevious = other.hasPrevious;
        this.current = other.current;
    }

    @Override
    public double next(OhlcvBar bar) {
        double typicalPrice = bar.getTypicalPrice();
        double flow = 0.0;
        if (hasPrevious) {
            double rawFlow = typicalPrice * bar.getVolume();
            if (typicalPrice > previousTypicalPrice) {
                flow = rawFlow;
            } else if (typicalPrice < previousTypicalPrice) {
                flow = -rawFlow;
            }
        }
        previousTypicalPrice = typicalPrice;
        hasPrevious = true;

        Optional<Double> evicted = flows.push(flow);
        add(flow);
        if (evicted.isPresent()) {
            remove(evicted.get());
            if (++evictionsSinceResync == period) {
                resync();
                evictionsSinceResync = 0;
            }
        }

        double positive = positiveFlow.sum();
        double negative = negativeFlow.sum();
        double total = positive + negative;
        current = total == 0.0 ? 50.0 : 100.0 * positive / total;
        return current;
    }

    private void add(double flow) {
        if (flow > 0.0) {
            positiveFlow.onPush(flow);
        } else if (flow < 0.0) {
            negativeFlow.onPush(-flow);
        }
    }

    private void remove(double flow) {
        if (flow > 0.0) {
            positiveFlow.onEvict(flow);
        } else if (flow < 0.0) {
            negativeFlow.onEvict(-flow);
        }
    }

    private void resync() {
        positiveFlow.reset();
        negativeFlow.reset();
        for (double flow : flows) {
            add(flow);
        }
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
        flows.reset();
        positiveFlow.reset();
        negativeFlow.reset();
        evictionsSinceResync = 0;
        previousTypicalPrice = 0.0;
        hasPrevious = false;
        current = 0.0;
    }

    @Override
    public MoneyFlowIndex copy() {
        return new MoneyFlowIndex(this);
    }

    @Override
    public String getName() {
        return "MFI(" + period + ")";
    }

    @Override
    public String toString() {
        return getName() + "=" + current;
    }
}

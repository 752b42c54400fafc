package com.tastream.unit.indicator.composite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tastream.exception.InvalidParameterException;
import com.tastream.indicator.composite.PercentagePriceOscillator;
import com.tastream.indicator.composite.PpoOutput;
import com.tastream.indicator.primitive.ExponentialMovingAverage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PercentagePriceOscillatorTest {

    @Test
    @DisplayName("fast period must be below slow period")
    void fastBelowSlow() {
        assertThatThrownBy(() -> new PercentagePriceOscillator(5, 5, 3))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("ppo is the EMA spread in percent of the slow EMA")
    void composesEmas() {
        PercentagePriceOscillator ppo = new PercentagePriceOscillator(2, 4, 3);
        ExponentialMovingAverage fast = new ExponentialMovingAverage(2);
        ExponentialMovingAverage slow = new ExponentialMovingAverage(4);
        ExponentialMovingAverage signal = new ExponentialMovingAverage(3);
        double[] inputs = {20, 22, 21, 25, 30, 28, 27};

        for (double input : inputs) {
            PpoOutput out = ppo.next(input);

            double f = fast.next(input);
            double s = slow.next(input);
            double expected = (f - s) / s * 100.0;
            assertThat(out.getPpo()).isEqualTo(expected);
            assertThat(out.getSignal()).isEqualTo(signal.next(expected));
            assertThat(out.getHistogram()).isEqualTo(out.getPpo() - out.getSignal());
        }
    }

    @Test
    @DisplayName("a zero slow average yields 0")
    void zeroSlowAverage() {
        PercentagePriceOscillator ppo = new PercentagePriceOscillator(2, 4, 3);

        PpoOutput out = ppo.next(0.0);

        assertThat(out.getPpo()).isEqualTo(0.0);
        assertThat(out.getHistogram()).isEqualTo(0.0);
        assertThat(ppo.getName()).isEqualTo("PPO(2, 4, 3)");
    }
}

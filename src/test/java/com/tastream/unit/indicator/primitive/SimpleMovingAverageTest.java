package com.tastream.unit.indicator.primitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tastream.domain.model.Bar;
import com.tastream.exception.InvalidParameterException;
import com.tastream.indicator.primitive.SimpleMovingAverage;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for SimpleMovingAverage.
 */
class SimpleMovingAverageTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("period 0 is rejected")
        void zeroPeriodRejected() {
            assertThatThrownBy(() -> new SimpleMovingAverage(0)).isInstanceOf(InvalidParameterException.class);
        }

        @Test
        @DisplayName("default period is 9")
        void defaultPeriod() {
            assertThat(new SimpleMovingAverage().getPeriod()).isEqualTo(9);
            assertThat(new SimpleMovingAverage().getName()).isEqualTo("SMA(9)");
        }
    }

    @Nested
    @DisplayName("Feeding")
    class Feeding {

        @Test
        @DisplayName("averages over a growing window, then the last N values")
        void growingThenSlidingWindow() {
            SimpleMovingAverage sma = new SimpleMovingAverage(4);

            assertThat(sma.next(4.0)).isEqualTo(4.0);
            assertThat(sma.next(5.0)).isEqualTo(4.5);
            assertThat(sma.next(6.0)).isEqualTo(5.0);
            assertThat(sma.next(6.0)).isEqualTo(5.25);
            assertThat(sma.next(6.0)).isEqualTo(5.75);
            assertThat(sma.next(6.0)).isEqualTo(6.0);
            assertThat(sma.next(2.0)).isEqualTo(5.0);
        }

        @Test
        @DisplayName("period 1 is the identity")
        void periodOneIsIdentity() {
            SimpleMovingAverage sma = new SimpleMovingAverage(1);
            Random random = new Random(1);

            for (int i = 0; i < 100; i++) {
                double value = random.nextDouble() * 1000 - 500;
                assertThat(sma.next(value)).isEqualTo(value);
            }
        }

        @Test
        @DisplayName("bars feed their close")
        void barsFeedClose() {
            SimpleMovingAverage sma = new SimpleMovingAverage(2);

            sma.next(Bar.of(1.0, 3.0, 0.5, 2.0, 10.0));
            double value = sma.next(Bar.of(2.0, 5.0, 1.0, 4.0, 10.0));

            assertThat(value).isEqualTo(3.0);
        }

        @Test
        @DisplayName("running mean stays accurate over a long stream of large values")
        void noDriftOverLongStream() {
            int period = 20;
            SimpleMovingAverage sma = new SimpleMovingAverage(period);
            Random random = new Random(99);
            double[] values = new double[50_000];

            for (int i = 0; i < values.length; i++) {
                values[i] = 1e9 + random.nextDouble() * 1e3;
                double actual = sma.next(values[i]);

                if (i % 997 == 0 && i >= period) {
                    double expected = 0.0;
                    for (int j = i - period + 1; j <= i; j++) {
                        expected += values[j];
                    }
                    expected /= period;
                    assertThat(actual).isCloseTo(expected, within(1e-4));
                }
            }
        }

        @Test
        @DisplayName("lastValue is idempotent and does not feed")
        void lastValueIsIdempotent() {
            SimpleMovingAverage sma = new SimpleMovingAverage(3);
            assertThat(sma.lastValue()).isZero();

            sma.next(3.0);
            sma.next(6.0);

            assertThat(sma.lastValue()).isEqualTo(4.5);
            assertThat(sma.lastValue()).isEqualTo(4.5);
            assertThat(sma.toString()).isEqualTo("SMA(3)=4.5");
        }
    }

    @Nested
    @DisplayName("Reset and copy")
    class ResetAndCopy {

        @Test
        @DisplayName("reset then replay reproduces the outputs exactly")
        void resetReplay() {
            SimpleMovingAverage sma = new SimpleMovingAverage(5);
            double[] inputs = randomInputs(60);
            double[] first = feed(sma, inputs);

            sma.reset();

            assertThat(feed(sma, inputs)).containsExactly(first);
        }

        @Test
        @DisplayName("copy continues the stream independently")
        void copyContinuesIndependently() {
            SimpleMovingAverage sma = new SimpleMovingAverage(3);
            sma.next(1.0);
            sma.next(2.0);

            SimpleMovingAverage copy = sma.copy();

            assertThat(copy.next(3.0)).isEqualTo(2.0);
            assertThat(sma.lastValue()).isEqualTo(1.5);
            assertThat(sma.next(3.0)).isEqualTo(2.0);
        }
    }

    private static double[] randomInputs(int count) {
        Random random = new Random(5);
        double[] inputs = new double[count];
        for (int i = 0; i < count; i++) {
            inputs[i] = 100 + random.nextGaussian() * 10;
        }
        return inputs;
    }

    private static double[] feed(SimpleMovingAverage sma, double[] inputs) {
        double[] outputs = new double[inputs.length];
        for (int i = 0; i < inputs.length; i++) {
            outputs[i] = sma.next(inputs[i]);
        }
        return outputs;
    }
}

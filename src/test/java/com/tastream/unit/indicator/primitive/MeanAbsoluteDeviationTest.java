package com.tastream.unit.indicator.primitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tastream.exception.InvalidParameterException;
import com.tastream.indicator.primitive.MeanAbsoluteDeviation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MeanAbsoluteDeviationTest {

    @Test
    @DisplayName("period 0 is rejected")
    void zeroPeriodRejected() {
        assertThatThrownBy(() -> new MeanAbsoluteDeviation(0)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("average distance from the window mean")
    void workedExample() {
        MeanAbsoluteDeviation mad = new MeanAbsoluteDeviation(5);

        assertThat(mad.next(1.5)).isEqualTo(0.0);
        assertThat(mad.next(4.0)).isCloseTo(1.25, within(1e-12));
        assertThat(mad.next(1.0)).isCloseTo(1.2222, within(1e-4));
    }

    @Test
    @DisplayName("only the last N values count")
    void slidesOverWindow() {
        MeanAbsoluteDeviation mad = new MeanAbsoluteDeviation(2);
        mad.next(100.0);
        mad.next(1.0);

        assertThat(mad.next(3.0)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("reset then replay reproduces the outputs exactly")
    void resetReplay() {
        MeanAbsoluteDeviation mad = new MeanAbsoluteDeviation(3);
        double[] inputs = {2.5, 7.0, 1.0, 9.5, 3.3};
        double[] first = new double[inputs.length];
        for (int i = 0; i < inputs.length; i++) {
            first[i] = mad.next(inputs[i]);
        }

        mad.reset();

        for (int i = 0; i < inputs.length; i++) {
            assertThat(mad.next(inputs[i])).isEqualTo(first[i]);
        }
    }
}

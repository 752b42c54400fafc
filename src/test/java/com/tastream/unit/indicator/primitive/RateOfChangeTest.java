package com.tastream.unit.indicator.primitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tastream.exception.InvalidParameterException;
import com.tastream.indicator.primitive.RateOfChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RateOfChangeTest {

    @Test
    @DisplayName("period 0 is rejected")
    void zeroPeriodRejected() {
        assertThatThrownBy(() -> new RateOfChange(0)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("percent change against the value three samples back")
    void workedExample() {
        RateOfChange roc = new RateOfChange(3);

        assertThat(roc.next(10.0)).isEqualTo(0.0);
        assertThat(roc.next(20.0)).isEqualTo(100.0);
        assertThat(roc.next(30.0)).isEqualTo(200.0);
        assertThat(roc.next(40.0)).isEqualTo(300.0);
        assertThat(roc.next(50.0)).isEqualTo(150.0);
    }

    @Test
    @DisplayName("a zero base yields 0")
    void zeroBase() {
        RateOfChange roc = new RateOfChange(1);

        assertThat(roc.next(0.0)).isEqualTo(0.0);
        assertThat(roc.next(5.0)).isEqualTo(0.0);
        assertThat(roc.next(10.0)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("copy carries the history")
    void copyCarriesHistory() {
        RateOfChange roc = new RateOfChange(3);
        roc.next(10.0);

        RateOfChange copy = roc.copy();

        assertThat(copy.next(15.0)).isEqualTo(50.0);
        assertThat(roc.lastValue()).isEqualTo(0.0);
    }
}

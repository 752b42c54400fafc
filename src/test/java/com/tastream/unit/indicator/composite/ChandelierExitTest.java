package com.tastream.unit.indicator.composite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tastream.domain.model.Bar;
import com.tastream.exception.InvalidParameterException;
import com.tastream.indicator.composite.ChandelierExit;
import com.tastream.indicator.composite.ChandelierExitOutput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChandelierExitTest {

    @Test
    @DisplayName("long exit hangs below the highest high, short exit above the lowest low")
    void workedExample() {
        ChandelierExit ce = new ChandelierExit(3, 2.0);

        ChandelierExitOutput first = ce.next(Bar.of(9.0, 10.0, 7.5, 9.0, 0.0));
        ChandelierExitOutput second = ce.next(Bar.of(9.0, 11.0, 9.0, 9.5, 0.0));
        ChandelierExitOutput third = ce.next(Bar.of(9.0, 9.0, 5.0, 8.0, 0.0));

        assertThat(first).isEqualTo(new ChandelierExitOutput(5.0, 12.5));
        assertThat(second).isEqualTo(new ChandelierExitOutput(6.5, 12.0));
        assertThat(third).isEqualTo(new ChandelierExitOutput(4.25, 11.75));
    }

    @Test
    @DisplayName("defaults are period 22 and multiplier 3")
    void defaults() {
        ChandelierExit ce = new ChandelierExit();

        assertThat(ce.getPeriod()).isEqualTo(22);
        assertThat(ce.getMultiplier()).isEqualTo(3.0);
        assertThat(ce.lastValue()).isEqualTo(ChandelierExitOutput.ZERO);
    }

    @Test
    @DisplayName("negative multiplier is rejected")
    void negativeMultiplier() {
        assertThatThrownBy(() -> new ChandelierExit(3, -0.5)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("period 0 is rejected")
    void zeroPeriodRejected() {
        assertThatThrownBy(() -> new ChandelierExit(0, 3.0)).isInstanceOf(InvalidParameterException.class);
    }
}

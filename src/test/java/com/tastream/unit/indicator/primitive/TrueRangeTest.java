package com.tastream.unit.indicator.primitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tastream.domain.model.Bar;
import com.tastream.indicator.primitive.TrueRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TrueRangeTest {

    @Test
    @DisplayName("bars: first is high - low, then the widest gap to the previous close")
    void barRanges() {
        TrueRange tr = new TrueRange();

        assertThat(tr.next(Bar.of(9.0, 10.0, 7.5, 9.0, 0.0))).isEqualTo(2.5);
        assertThat(tr.next(Bar.of(9.0, 11.0, 9.0, 9.5, 0.0))).isEqualTo(2.0);
        assertThat(tr.next(Bar.of(9.0, 9.0, 5.0, 8.0, 0.0))).isEqualTo(4.5);
    }

    @Test
    @DisplayName("scalars: distance to the previous value, first is 0")
    void scalarRanges() {
        TrueRange tr = new TrueRange();

        assertThat(tr.next(2.5)).isEqualTo(0.0);
        assertThat(tr.next(3.6)).isCloseTo(1.1, within(1e-12));
        assertThat(tr.next(3.3)).isCloseTo(0.3, within(1e-12));
    }

    @Test
    @DisplayName("reset forgets the previous close")
    void resetForgetsPreviousClose() {
        TrueRange tr = new TrueRange();
        tr.next(Bar.of(9.0, 10.0, 7.5, 9.0, 0.0));

        tr.reset();

        assertThat(tr.next(Bar.of(100.0, 101.0, 99.0, 100.0, 0.0))).isEqualTo(2.0);
        assertThat(tr.getName()).isEqualTo("TRUE_RANGE()");
    }
}

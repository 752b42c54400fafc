package com.tastream.unit.indicator.composite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tastream.domain.model.Bar;
import com.tastream.exception.InvalidParameterException;
import com.tastream.indicator.composite.CommodityChannelIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommodityChannelIndexTest {

    private static Bar flat(double price) {
        return Bar.of(price, price, price, price, 1.0);
    }

    @Test
    @DisplayName("distance of the typical price from its mean, scaled by the mean deviation")
    void workedExample() {
        CommodityChannelIndex cci = new CommodityChannelIndex(5);

        assertThat(cci.next(flat(1.0))).isEqualTo(0.0);
        assertThat(cci.next(flat(2.0))).isCloseTo(66.6667, within(1e-4));
        assertThat(cci.next(flat(3.0))).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("a constant series yields 0")
    void constantSeries() {
        CommodityChannelIndex cci = new CommodityChannelIndex();

        for (int i = 0; i < 30; i++) {
            assertThat(cci.next(flat(7.5))).isEqualTo(0.0);
        }
        assertThat(cci.getName()).isEqualTo("CCI(20)");
    }

    @Test
    @DisplayName("period 0 is rejected")
    void zeroPeriodRejected() {
        assertThatThrownBy(() -> new CommodityChannelIndex(0)).isInstanceOf(InvalidParameterException.class);
    }
}

package com.tastream.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tastream.domain.model.Bar;
import com.tastream.exception.DataItemException;
import com.tastream.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for Bar construction and validation.
 */
class BarTest {

    @Nested
    @DisplayName("Valid bars")
    class ValidBars {

        @Test
        @DisplayName("builder sets all fields")
        void builderSetsAllFields() {
            Bar bar = Bar.builder().open(10.0).high(12.0).low(9.5).close(11.0).volume(1500.0).build();

            assertThat(bar.getOpen()).isEqualTo(10.0);
            assertThat(bar.getHigh()).isEqualTo(12.0);
            assertThat(bar.getLow()).isEqualTo(9.5);
            assertThat(bar.getClose()).isEqualTo(11.0);
            assertThat(bar.getVolume()).isEqualTo(1500.0);
        }

        @Test
        @DisplayName("typical price is the mean of high, low and close")
        void typicalPrice() {
            Bar bar = Bar.of(10.0, 12.0, 9.0, 11.0, 0.0);

            assertThat(bar.getTypicalPrice()).isEqualTo((12.0 + 9.0 + 11.0) / 3.0);
        }

        @Test
        @DisplayName("a flat bar with zero volume is valid")
        void flatBarIsValid() {
            Bar bar = Bar.of(5.0, 5.0, 5.0, 5.0, 0.0);

            assertThat(bar.getHigh()).isEqualTo(bar.getLow());
        }

        @Test
        @DisplayName("bars with equal fields are equal")
        void valueEquality() {
            assertThat(Bar.of(1.0, 2.0, 0.5, 1.5, 10.0)).isEqualTo(Bar.of(1.0, 2.0, 0.5, 1.5, 10.0));
        }
    }

    @Nested
    @DisplayName("Invalid bars")
    class InvalidBars {

        @Test
        @DisplayName("missing field is reported as incomplete")
        void missingFieldIsIncomplete() {
            assertThatThrownBy(() -> Bar.builder().open(1.0).high(2.0).low(0.5).volume(1.0).build())
                    .isInstanceOf(DataItemException.class)
                    .hasMessageContaining("close")
                    .satisfies(e -> assertThat(((DataItemException) e).getErrorCode())
                            .isEqualTo(ErrorCode.DATA_ITEM_INCOMPLETE));
        }

        @Test
        @DisplayName("low above open is invalid")
        void lowAboveOpen() {
            assertInvalid(() -> Bar.of(1.0, 3.0, 1.5, 2.0, 0.0));
        }

        @Test
        @DisplayName("high below close is invalid")
        void highBelowClose() {
            assertInvalid(() -> Bar.of(1.0, 1.5, 0.5, 2.0, 0.0));
        }

        @Test
        @DisplayName("negative volume is invalid")
        void negativeVolume() {
            assertInvalid(() -> Bar.of(1.0, 2.0, 0.5, 1.5, -1.0));
        }

        @Test
        @DisplayName("non-finite price is invalid")
        void nonFinitePrice() {
            assertInvalid(() -> Bar.of(1.0, Double.POSITIVE_INFINITY, 0.5, 1.5, 1.0));
            assertInvalid(() -> Bar.of(Double.NaN, 2.0, 0.5, 1.5, 1.0));
        }

        private void assertInvalid(Runnable construction) {
            assertThatThrownBy(construction::run)
                    .isInstanceOf(DataItemException.class)
                    .satisfies(e -> assertThat(((DataItemException) e).getErrorCode())
                            .isEqualTo(ErrorCode.DATA_ITEM_INVALID));
        }
    }
}

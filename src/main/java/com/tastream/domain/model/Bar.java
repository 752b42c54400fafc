package com.tastream.domain.model;

import com.tastream.exception.DataItemException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable, validated OHLCV record fed into indicators.
 *
 * <p>All fields must be present and finite, {@code low <= min(open, close)},
 * {@code max(open, close) <= high} and {@code volume >= 0}. A missing field fails with
 * {@link com.tastream.exception.ErrorCode#DATA_ITEM_INCOMPLETE}; a violated invariant fails
 * with {@link com.tastream.exception.ErrorCode#DATA_ITEM_INVALID}.
 *
 * <pre>{@code
 * Bar bar = Bar.builder().open(10.0).high(12.0).low(9.5).close(11.0).volume(1500.0).build();
 * }</pre>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Bar implements OhlcvBar {

    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;

    @Builder
    private Bar(Double open, Double high, Double low, Double close, Double volume) {
        this.open = require("open", open);
        this.high = require("high", high);
        this.low = require("low", low);
        this.close = require("close", close);
        this.volume = require("volume", volume);
        validate();
    }

    public static Bar of(double open, double high, double low, double close, double volume) {
        return new Bar(open, high, low, close, volume);
    }

    private static double require(String field, Double value) {
        if (value == null) {
            throw DataItemException.incomplete(field);
        }
        return value;
    }

    private void validate() {
        if (!Double.isFinite(open)
                || !Double.isFinite(high)
                || !Double.isFinite(low)
                || !Double.isFinite(close)
                || !Double.isFinite(volume)) {
            throw DataItemException.invalid("Bar fields must be finite", fields());
        }
        if (low > Math.min(open, close) || high < Math.max(open, close)) {
            throw DataItemException.invalid("Bar violates low <= open/close <= high", fields());
        }
        if (volume < 0) {
            throw DataItemException.invalid("Bar volume must not be negative", fields());
        }
    }

    private Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("open", open);
        fields.put("high", high);
        fields.put("low", low);
        fields.put("close", close);
        fields.put("volume", volume);
        return fields;
    }
}

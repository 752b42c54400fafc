package com.tastream.service;

import com.tastream.config.IndicatorType;
import com.tastream.domain.model.OhlcvBar;
import com.tastream.indicator.Indicator;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * A configured indicator together with the key it is published under and the adapter that
 * feeds it one bar and reads back its output fields.
 */
@Getter
public class IndicatorBinding {

    /**
     * Feeds one bar into the bound indicator and returns its outputs by field name, in the
     * order of {@link IndicatorBinding#getOutputFields()}.
     */
    @FunctionalInterface
    public interface BarFeed {
        Map<String, Double> feed(OhlcvBar bar);
    }

    private final String key;
    private final IndicatorType type;
    private final Indicator indicator;
    private final List<String> outputFields;
    private final BarFeed feed;

    public IndicatorBinding(
            String key, IndicatorType type, Indicator indicator, List<String> outputFields, BarFeed feed) {
        this.key = key;
        this.type = type;
        this.indicator = indicator;
        this.outputFields = List.copyOf(outputFields);
        this.feed = feed;
    }

    public Map<String, Double> next(OhlcvBar bar) {
        return feed.feed(bar);
    }

    public void reset() {
        indicator.reset();
    }

    @Override
    public String toString() {
        return key + " -> " + indicator.getName();
    }
}

package com.tastream.service;

import com.tastream.config.IndicatorSetConfig;
import com.tastream.domain.model.OhlcvBar;
import com.tastream.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A keyed group of indicators computed over one bar stream.
 *
 * <p>Every bar is fed to every binding in registration order. Single-output indicators are
 * published under their key ({@code RSI:14}); multi-output indicators publish one entry per
 * field ({@code BOLLINGER:20:2.0:upper}, {@code BOLLINGER:20:2.0:middle}, ...).
 *
 * <p>Like the indicators it owns, a set is not thread-safe: one set per stream.
 */
public class IndicatorSet {

    private static final Logger log = LoggerFactory.getLogger(IndicatorSet.class);

    private final String name;
    private final Map<String, IndicatorBinding> bindings = new LinkedHashMap<>();
    private final Map<String, Double> latestValues = new LinkedHashMap<>();
    private long barCount;

    public IndicatorSet(String name, List<IndicatorBinding> bindings) {
        this.name = name;
        for (IndicatorBinding binding : bindings) {
            if (this.bindings.putIfAbsent(binding.getKey(), binding) != null) {
                throw new ConfigurationException(
                        "Duplicate indicator key '" + binding.getKey() + "' in set '" + name + "'");
            }
        }
        log.info("Indicator set '{}' initialized with {} indicators", name, this.bindings.size());
    }

    public static IndicatorSet fromConfig(IndicatorSetConfig config) {
        if (!config.isEnabled()) {
            log.info("Indicator set '{}' is disabled", config.getName());
            return new IndicatorSet(config.getName(), List.of());
        }
        return new IndicatorSet(config.getName(), IndicatorFactory.createAll(config.getIndicators()));
    }

    /**
     * Feeds one bar to every indicator and returns the flattened values of this step.
     *
     * @return indicator key (and field, for multi-output indicators) -> value, in registration order
     */
    public Map<String, Double> next(OhlcvBar bar) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (IndicatorBinding binding : bindings.values()) {
            Map<String, Double> outputs = binding.next(bar);
            if (binding.getOutputFields().size() == 1) {
                values.put(binding.getKey(), outputs.values().iterator().next());
            } else {
                for (Map.Entry<String, Double> output : outputs.entrySet()) {
                    values.put(binding.getKey() + ":" + output.getKey(), output.getValue());
                }
            }
        }
        barCount++;
        latestValues.clear();
        latestValues.putAll(values);
        return values;
    }

    /** Values produced by the most recent bar; empty before the first bar and after a reset. */
    public Map<String, Double> latestValues() {
        return Collections.unmodifiableMap(latestValues);
    }

    public Optional<Double> getValue(String key) {
        return Optional.ofNullable(latestValues.get(key));
    }

    public Optional<IndicatorBinding> getBinding(String key) {
        return Optional.ofNullable(bindings.get(key));
    }

    /** Resets every indicator in the set, as if no bar had been fed. */
    public void reset() {
        bindings.values().forEach(IndicatorBinding::reset);
        latestValues.clear();
        log.debug("Indicator set '{}' reset after {} bars", name, barCount);
        barCount = 0;
    }

    public String getName() {
        return name;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    public int size() {
        return bindings.size();
    }

    public long getBarCount() {
        return barCount;
    }
}

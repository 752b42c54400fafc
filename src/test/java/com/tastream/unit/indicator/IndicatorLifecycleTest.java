package com.tastream.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;

import com.tastream.config.IndicatorDefinition;
import com.tastream.config.IndicatorType;
import com.tastream.domain.model.Bar;
import com.tastream.service.IndicatorBinding;
import com.tastream.service.IndicatorFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Reset and copy behaviour shared by every indicator, exercised through the factory so that
 * each type is covered with its default parameters.
 */
class IndicatorLifecycleTest {

    private static final List<Bar> BARS = randomBars(80);

    @Test
    @DisplayName("reset then replay reproduces every output bit for bit")
    void resetReplay() {
        for (IndicatorType type : IndicatorType.values()) {
            IndicatorBinding binding = IndicatorFactory.create(IndicatorDefinition.of(type, Map.of()));
            List<Map<String, Double>> first = feed(binding, BARS);

            binding.reset();

            assertThat(feed(binding, BARS)).as(type.name()).isEqualTo(first);
        }
    }

    @Test
    @DisplayName("copy is independent of the original")
    void copyIndependence() {
        for (IndicatorType type : IndicatorType.values()) {
            IndicatorBinding binding = IndicatorFactory.create(IndicatorDefinition.of(type, Map.of()));
            feed(binding, BARS.subList(0, 40));
            String before = binding.getIndicator().toString();

            binding.getIndicator().copy().reset();

            assertThat(binding.getIndicator().toString()).as(type.name()).isEqualTo(before);
        }
    }

    @Test
    @DisplayName("outputs stay finite on valid bars")
    void finiteOutputs() {
        for (IndicatorType type : IndicatorType.values()) {
            IndicatorBinding binding = IndicatorFactory.create(IndicatorDefinition.of(type, Map.of()));

            for (Map<String, Double> step : feed(binding, BARS)) {
                assertThat(step.values()).as(type.name()).allMatch(Double::isFinite);
            }
        }
    }

    private static List<Map<String, Double>> feed(IndicatorBinding binding, List<Bar> bars) {
        List<Map<String, Double>> outputs = new ArrayList<>();
        for (Bar bar : bars) {
            outputs.add(binding.next(bar));
        }
        return outputs;
    }

    private static List<Bar> randomBars(int count) {
        Random random = new Random(2024);
        List<Bar> bars = new ArrayList<>();
        double close = 100.0;
        for (int i = 0; i < count; i++) {
            double open = close;
            close = Math.max(1.0, close + random.nextGaussian() * 2);
            double high = Math.max(open, close) + random.nextDouble();
            double low = Math.min(open, close) - random.nextDouble();
            bars.add(Bar.of(open, high, low, close, 1000 + random.nextInt(9000)));
        }
        return bars;
    }
}

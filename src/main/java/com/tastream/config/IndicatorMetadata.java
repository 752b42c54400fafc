package com.tastream.config;

import com.tastream.indicator.composite.AverageTrueRange;
import com.tastream.indicator.composite.BollingerBands;
import com.tastream.indicator.composite.ChandelierExit;
import com.tastream.indicator.composite.CommodityChannelIndex;
import com.tastream.indicator.composite.FastStochastic;
import com.tastream.indicator.composite.KeltnerChannel;
import com.tastream.indicator.composite.MoneyFlowIndex;
import com.tastream.indicator.composite.MovingAverageConvergenceDivergence;
import com.tastream.indicator.composite.PercentagePriceOscillator;
import com.tastream.indicator.composite.RelativeStrengthIndex;
import com.tastream.indicator.composite.SlowStochastic;
import com.tastream.indicator.primitive.EfficiencyRatio;
import com.tastream.indicator.primitive.ExponentialMovingAverage;
import com.tastream.indicator.primitive.HullMovingAverage;
import com.tastream.indicator.primitive.Maximum;
import com.tastream.indicator.primitive.MeanAbsoluteDeviation;
import com.tastream.indicator.primitive.Minimum;
import com.tastream.indicator.primitive.RateOfChange;
import com.tastream.indicator.primitive.SimpleMovingAverage;
import com.tastream.indicator.primitive.StandardDeviation;
import com.tastream.indicator.primitive.WeightedMovingAverage;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Describes an indicator type: display name, output range, output fields and default
 * parameters. Used to document what a configuration may declare and to key the values an
 * {@link com.tastream.service.IndicatorSet} produces.
 */
@Data
@Builder
public class IndicatorMetadata {

    public static final String VALUE = "value";

    private IndicatorType type;
    private String displayName;

    /** Minimum possible output value (e.g., 0 for RSI, null for unbounded). */
    private Double minValue;

    /** Maximum possible output value (e.g., 100 for RSI, null for unbounded). */
    private Double maxValue;

    /** Output field names, e.g. ["upper", "middle", "lower"]. Single-output indicators have ["value"]. */
    private List<String> outputFields;

    /** Default parameters for this indicator type. */
    private Map<String, Object> defaultParams;

    private static final Map<IndicatorType, IndicatorMetadata> BY_TYPE = index();

    public boolean isMultiOutput() {
        return outputFields.size() > 1;
    }

    public static IndicatorMetadata forType(IndicatorType type) {
        return BY_TYPE.get(type);
    }

    /**
     * Returns metadata for all supported indicator types.
     */
    public static List<IndicatorMetadata> allMetadata() {
        return List.copyOf(BY_TYPE.values());
    }

    private static Map<IndicatorType, IndicatorMetadata> index() {
        Map<IndicatorType, IndicatorMetadata> metadata = new EnumMap<>(IndicatorType.class);
        put(metadata, single(IndicatorType.SMA, "Simple Moving Average", null, null)
                .defaultParams(Map.of("period", SimpleMovingAverage.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.EMA, "Exponential Moving Average", null, null)
                .defaultParams(Map.of("period", ExponentialMovingAverage.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.WMA, "Weighted Moving Average", null, null)
                .defaultParams(Map.of("period", WeightedMovingAverage.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.HMA, "Hull Moving Average", null, null)
                .defaultParams(Map.of("period", HullMovingAverage.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.MAXIMUM, "Highest Value", null, null)
                .defaultParams(Map.of("period", Maximum.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.MINIMUM, "Lowest Value", null, null)
                .defaultParams(Map.of("period", Minimum.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.STANDARD_DEVIATION, "Standard Deviation", 0.0, null)
                .defaultParams(Map.of("period", StandardDeviation.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.MEAN_ABSOLUTE_DEVIATION, "Mean Absolute Deviation", 0.0, null)
                .defaultParams(Map.of("period", MeanAbsoluteDeviation.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.TRUE_RANGE, "True Range", 0.0, null).defaultParams(Map.of()));
        put(metadata, single(IndicatorType.ROC, "Rate of Change", null, null)
                .defaultParams(Map.of("period", RateOfChange.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.OBV, "On-Balance Volume", null, null).defaultParams(Map.of()));
        put(metadata, single(IndicatorType.EFFICIENCY_RATIO, "Efficiency Ratio", 0.0, 1.0)
                .defaultParams(Map.of("period", EfficiencyRatio.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.RSI, "Relative Strength Index", 0.0, 100.0)
                .defaultParams(Map.of("period", RelativeStrengthIndex.DEFAULT_PERIOD)));
        put(metadata, multi(IndicatorType.MACD, "MACD", List.of("macd", "signal", "histogram"))
                .defaultParams(Map.of(
                        "fastPeriod", MovingAverageConvergenceDivergence.DEFAULT_FAST_PERIOD,
                        "slowPeriod", MovingAverageConvergenceDivergence.DEFAULT_SLOW_PERIOD,
                        "signalPeriod", MovingAverageConvergenceDivergence.DEFAULT_SIGNAL_PERIOD)));
        put(metadata, multi(IndicatorType.PPO, "Percentage Price Oscillator", List.of("ppo", "signal", "histogram"))
                .defaultParams(Map.of(
                        "fastPeriod", PercentagePriceOscillator.DEFAULT_FAST_PERIOD,
                        "slowPeriod", PercentagePriceOscillator.DEFAULT_SLOW_PERIOD,
                        "signalPeriod", PercentagePriceOscillator.DEFAULT_SIGNAL_PERIOD)));
        put(metadata, single(IndicatorType.FAST_STOCHASTIC, "Fast Stochastic", 0.0, 100.0)
                .defaultParams(Map.of("period", FastStochastic.DEFAULT_PERIOD)));
        put(metadata, multi(IndicatorType.SLOW_STOCHASTIC, "Slow Stochastic", List.of("k", "d"))
                .minValue(0.0)
                .maxValue(100.0)
                .defaultParams(Map.of(
                        "period", SlowStochastic.DEFAULT_STOCHASTIC_PERIOD,
                        "smoothingPeriod", SlowStochastic.DEFAULT_SMOOTHING_PERIOD)));
        put(metadata, single(IndicatorType.CCI, "Commodity Channel Index", null, null)
                .defaultParams(Map.of("period", CommodityChannelIndex.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.MFI, "Money Flow Index", 0.0, 100.0)
                .defaultParams(Map.of("period", MoneyFlowIndex.DEFAULT_PERIOD)));
        put(metadata, single(IndicatorType.ATR, "Average True Range", 0.0, null)
                .defaultParams(Map.of("period", AverageTrueRange.DEFAULT_PERIOD)));
        put(metadata, multi(IndicatorType.BOLLINGER, "Bollinger Bands", List.of("upper", "middle", "lower"))
                .defaultParams(Map.of(
                        "period", BollingerBands.DEFAULT_PERIOD, "multiplier", BollingerBands.DEFAULT_MULTIPLIER)));
        put(metadata, multi(IndicatorType.KELTNER, "Keltner Channel", List.of("upper", "middle", "lower"))
                .defaultParams(Map.of(
                        "period", KeltnerChannel.DEFAULT_PERIOD, "multiplier", KeltnerChannel.DEFAULT_MULTIPLIER)));
        put(metadata, multi(IndicatorType.CHANDELIER, "Chandelier Exit", List.of("long", "short"))
                .defaultParams(Map.of(
                        "period", ChandelierExit.DEFAULT_PERIOD, "multiplier", ChandelierExit.DEFAULT_MULTIPLIER)));
        return metadata;
    }

    private static IndicatorMetadataBuilder single(
            IndicatorType type, String displayName, Double minValue, Double maxValue) {
        return IndicatorMetadata.builder()
                .type(type)
                .displayName(displayName)
                .minValue(minValue)
                .maxValue(maxValue)
                .outputFields(List.of(VALUE));
    }

    private static IndicatorMetadataBuilder multi(IndicatorType type, String displayName, List<String> fields) {
        return IndicatorMetadata.builder().type(type).displayName(displayName).outputFields(fields);
    }

    private static void put(Map<IndicatorType, IndicatorMetadata> metadata, IndicatorMetadataBuilder builder) {
        IndicatorMetadata built = builder.build();
        metadata.put(built.getType(), built);
    }
}

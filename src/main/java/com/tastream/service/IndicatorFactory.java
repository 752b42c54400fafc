package com.tastream.service;

import com.tastream.config.IndicatorDefinition;
import com.tastream.config.IndicatorMetadata;
import com.tastream.config.IndicatorType;
import com.tastream.domain.model.OhlcvBar;
import com.tastream.indicator.BarIndicator;
import com.tastream.indicator.ScalarIndicator;
import com.tastream.indicator.composite.AverageTrueRange;
import com.tastream.indicator.composite.BollingerBands;
import com.tastream.indicator.composite.BollingerBandsOutput;
import com.tastream.indicator.composite.ChandelierExit;
import com.tastream.indicator.composite.ChandelierExitOutput;
import com.tastream.indicator.composite.CommodityChannelIndex;
import com.tastream.indicator.composite.FastStochastic;
import com.tastream.indicator.composite.KeltnerChannel;
import com.tastream.indicator.composite.KeltnerChannelOutput;
import com.tastream.indicator.composite.MacdOutput;
import com.tastream.indicator.composite.MoneyFlowIndex;
import com.tastream.indicator.composite.MovingAverageConvergenceDivergence;
import com.tastream.indicator.composite.PercentagePriceOscillator;
import com.tastream.indicator.composite.PpoOutput;
import com.tastream.indicator.composite.RelativeStrengthIndex;
import com.tastream.indicator.composite.SlowStochastic;
import com.tastream.indicator.composite.StochasticOutput;
import com.tastream.indicator.primitive.EfficiencyRatio;
import com.tastream.indicator.primitive.ExponentialMovingAverage;
import com.tastream.indicator.primitive.HullMovingAverage;
import com.tastream.indicator.primitive.Maximum;
import com.tastream.indicator.primitive.MeanAbsoluteDeviation;
import com.tastream.indicator.primitive.Minimum;
import com.tastream.indicator.primitive.OnBalanceVolume;
import com.tastream.indicator.primitive.RateOfChange;
import com.tastream.indicator.primitive.SimpleMovingAverage;
import com.tastream.indicator.primitive.StandardDeviation;
import com.tastream.indicator.primitive.TrueRange;
import com.tastream.indicator.primitive.WeightedMovingAverage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates indicator instances from {@link IndicatorDefinition} configurations.
 *
 * <p>Every definition yields one {@link IndicatorBinding}. Missing parameters fall back to
 * the defaults listed in {@link IndicatorMetadata}; out-of-domain parameters fail with
 * {@link com.tastream.exception.InvalidParameterException} from the indicator constructor.
 *
 * <p>Keys follow {@code TYPE:period} ({@code MACD:12:26:9} for multi-period indicators,
 * {@code BOLLINGER:20:2.0} for band indicators, plain {@code TYPE} for parameterless ones)
 * unless the definition sets its own key.
 */
public final class IndicatorFactory {

    private static final Logger log = LoggerFactory.getLogger(IndicatorFactory.class);

    private IndicatorFactory() {}

    public static List<IndicatorBinding> createAll(List<IndicatorDefinition> definitions) {
        List<IndicatorBinding> bindings = new ArrayList<>(definitions.size());
        for (IndicatorDefinition definition : definitions) {
            bindings.add(create(definition));
        }
        log.debug("Created {} indicator bindings", bindings.size());
        return bindings;
    }

    public static IndicatorBinding create(IndicatorDefinition def) {
        IndicatorType type = def.getType();
        Map<String, Object> defaults = IndicatorMetadata.forType(type).getDefaultParams();
        List<String> fields = IndicatorMetadata.forType(type).getOutputFields();

        IndicatorBinding binding;
        switch (type) {
            case SMA -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new SimpleMovingAverage(period));
            }
            case EMA -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new ExponentialMovingAverage(period));
            }
            case WMA -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new WeightedMovingAverage(period));
            }
            case HMA -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new HullMovingAverage(period));
            }
            case MAXIMUM -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new Maximum(period));
            }
            case MINIMUM -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new Minimum(period));
            }
            case STANDARD_DEVIATION -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new StandardDeviation(period));
            }
            case MEAN_ABSOLUTE_DEVIATION -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new MeanAbsoluteDeviation(period));
            }
            case TRUE_RANGE -> binding = scalar(def, buildKey(type), new TrueRange());
            case ROC -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new RateOfChange(period));
            }
            case OBV -> binding = bar(def, buildKey(type), new OnBalanceVolume());
            case EFFICIENCY_RATIO -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new EfficiencyRatio(period));
            }
            case RSI -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new RelativeStrengthIndex(period));
            }
            case MACD -> {
                int fast = def.getParamOrDefault("fastPeriod", (Integer) defaults.get("fastPeriod"));
                int slow = def.getParamOrDefault("slowPeriod", (Integer) defaults.get("slowPeriod"));
                int signal = def.getParamOrDefault("signalPeriod", (Integer) defaults.get("signalPeriod"));
                MovingAverageConvergenceDivergence macd = new MovingAverageConvergenceDivergence(fast, slow, signal);
                binding = new IndicatorBinding(key(def, buildKey(type, fast, slow, signal)), type, macd, fields, b -> {
                    MacdOutput out = macd.next(b);
                    return values(fields, out.getMacd(), out.getSignal(), out.getHistogram());
                });
            }
            case PPO -> {
                int fast = def.getParamOrDefault("fastPeriod", (Integer) defaults.get("fastPeriod"));
                int slow = def.getParamOrDefault("slowPeriod", (Integer) defaults.get("slowPeriod"));
                int signal = def.getParamOrDefault("signalPeriod", (Integer) defaults.get("signalPeriod"));
                PercentagePriceOscillator ppo = new PercentagePriceOscillator(fast, slow, signal);
                binding = new IndicatorBinding(key(def, buildKey(type, fast, slow, signal)), type, ppo, fields, b -> {
                    PpoOutput out = ppo.next(b);
                    return values(fields, out.getPpo(), out.getSignal(), out.getHistogram());
                });
            }
            case FAST_STOCHASTIC -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new FastStochastic(period));
            }
            case SLOW_STOCHASTIC -> {
                int period = period(def, defaults);
                int smoothing = def.getParamOrDefault("smoothingPeriod", (Integer) defaults.get("smoothingPeriod"));
                SlowStochastic stochastic = new SlowStochastic(period, smoothing);
                binding = new IndicatorBinding(
                        key(def, buildKey(type, period, smoothing)), type, stochastic, fields, b -> {
                            StochasticOutput out = stochastic.next(b);
                            return values(fields, out.getK(), out.getD());
                        });
            }
            case CCI -> {
                int period = period(def, defaults);
                binding = bar(def, buildKey(type, period), new CommodityChannelIndex(period));
            }
            case MFI -> {
                int period = period(def, defaults);
                binding = bar(def, buildKey(type, period), new MoneyFlowIndex(period));
            }
            case ATR -> {
                int period = period(def, defaults);
                binding = scalar(def, buildKey(type, period), new AverageTrueRange(period));
            }
            case BOLLINGER -> {
                int period = period(def, defaults);
                double multiplier = multiplier(def, defaults);
                BollingerBands bands = new BollingerBands(period, multiplier);
                binding = new IndicatorBinding(key(def, bandKey(type, period, multiplier)), type, bands, fields, b -> {
                    BollingerBandsOutput out = bands.next(b);
                    return values(fields, out.getUpper(), out.getMiddle(), out.getLower());
                });
            }
            case KELTNER -> {
                int period = period(def, defaults);
                double multiplier = multiplier(def, defaults);
                KeltnerChannel channel = new KeltnerChannel(period, multiplier);
                binding = new IndicatorBinding(key(def, bandKey(type, period, multiplier)), type, channel, fields, b -> {
                    KeltnerChannelOutput out = channel.next(b);
                    return values(fields, out.getUpper(), out.getMiddle(), out.getLower());
                });
            }
            case CHANDELIER -> {
                int period = period(def, defaults);
                double multiplier = multiplier(def, defaults);
                ChandelierExit exit = new ChandelierExit(period, multiplier);
                binding = new IndicatorBinding(key(def, bandKey(type, period, multiplier)), type, exit, fields, b -> {
                    ChandelierExitOutput out = exit.next(b);
                    return values(fields, out.getLongExit(), out.getShortExit());
                });
            }
            default -> throw new IllegalStateException("Unhandled indicator type " + type);
        }

        log.debug("Bound {} to {}", binding.getKey(), binding.getIndicator().getName());
        return binding;
    }

    /**
     * Builds the key for an indicator.
     *
     * <p>Format: {@code TYPE}, {@code TYPE:period} or {@code TYPE:p1:p2:...}.
     */
    public static String buildKey(IndicatorType type, int... periods) {
        StringBuilder key = new StringBuilder(type.name());
        for (int period : periods) {
            key.append(':').append(period);
        }
        return key.toString();
    }

    /** Key for band indicators: {@code TYPE:period:multiplier}, e.g. {@code BOLLINGER:20:2.5}. */
    public static String bandKey(IndicatorType type, int period, double multiplier) {
        return buildKey(type, period) + ':' + multiplier;
    }

    private static IndicatorBinding scalar(IndicatorDefinition def, String key, ScalarIndicator indicator) {
        return new IndicatorBinding(
                key(def, key),
                def.getType(),
                indicator,
                List.of(IndicatorMetadata.VALUE),
                b -> Map.of(IndicatorMetadata.VALUE, indicator.next(b)));
    }

    private static IndicatorBinding bar(
            IndicatorDefinition def, String key, BarIndicator<? super OhlcvBar> indicator) {
        return new IndicatorBinding(
                key(def, key),
                def.getType(),
                indicator,
                List.of(IndicatorMetadata.VALUE),
                b -> Map.of(IndicatorMetadata.VALUE, indicator.next(b)));
    }

    private static String key(IndicatorDefinition def, String generated) {
        return def.getKey() != null && !def.getKey().isBlank() ? def.getKey() : generated;
    }

    private static int period(IndicatorDefinition def, Map<String, Object> defaults) {
        return def.getParamOrDefault("period", (Integer) defaults.get("period"));
    }

    private static double multiplier(IndicatorDefinition def, Map<String, Object> defaults) {
        return def.getDoubleParamOrDefault("multiplier", (Double) defaults.get("multiplier"));
    }

    private static Map<String, Double> values(List<String> fields, double... outputs) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < outputs.length; i++) {
            values.put(fields.get(i), outputs[i]);
        }
        return values;
    }
}

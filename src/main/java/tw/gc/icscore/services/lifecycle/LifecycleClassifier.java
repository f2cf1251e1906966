package tw.gc.icscore.services.lifecycle;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.enums.LifecycleStage;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * LifecycleClassifier
 *
 * Assigns a lifecycle stage from revenue growth, net margin and P/E, first match wins:
 * <ul>
 *   <li>revenue growth above the hypergrowth threshold: HYPERGROWTH</li>
 *   <li>revenue growth above the growth threshold: GROWTH</li>
 *   <li>revenue growth below the turnaround threshold: TURNAROUND (shrinking businesses included)</li>
 *   <li>cheap P/E with a healthy margin: VALUE</li>
 *   <li>anything else: MATURE</li>
 * </ul>
 * Missing inputs fall back to growth 0, margin 0 and the configured default P/E.
 */
@Service
@RequiredArgsConstructor
public class LifecycleClassifier {

    private static final Map<LifecycleStage, Map<String, Double>> WEIGHT_MULTIPLIERS = buildMultiplierTable();

    private final IcScoreProperties properties;

    public LifecycleClassification classify(MetricSnapshot fundamentals) {
        return classify(
            fundamentals.value(MetricNames.REVENUE_GROWTH_YOY),
            fundamentals.value(MetricNames.NET_MARGIN),
            fundamentals.value(MetricNames.PE_RATIO));
    }

    public LifecycleClassification classify(Double revenueGrowth, Double netMargin, Double peRatio) {
        IcScoreProperties.Lifecycle t = properties.getLifecycle();
        double growth = revenueGrowth == null ? 0.0 : revenueGrowth;
        double margin = netMargin == null ? 0.0 : netMargin;
        double pe = peRatio == null ? t.getDefaultPeRatio() : peRatio;

        Map<String, Double> inputs = Map.of(
            MetricNames.REVENUE_GROWTH_YOY, growth,
            MetricNames.NET_MARGIN, margin,
            MetricNames.PE_RATIO, pe);

        if (growth > t.getHypergrowthRevenueGrowth()) {
            double confidence = (growth - t.getHypergrowthRevenueGrowth()) / 50.0 + 0.7;
            return new LifecycleClassification(LifecycleStage.HYPERGROWTH, clamp(confidence), inputs);
        }
        if (growth > t.getGrowthRevenueGrowth()) {
            double band = t.getHypergrowthRevenueGrowth() - t.getGrowthRevenueGrowth();
            double confidence = 0.6 + (growth - t.getGrowthRevenueGrowth()) / (2.0 * band);
            return new LifecycleClassification(LifecycleStage.GROWTH, clamp(confidence), inputs);
        }
        if (growth < t.getTurnaroundRevenueGrowth()) {
            double confidence = Math.abs(growth) / 20.0 + 0.5;
            return new LifecycleClassification(LifecycleStage.TURNAROUND, clamp(confidence), inputs);
        }
        if (pe < t.getValuePeThreshold() && margin > t.getValueMarginThreshold()) {
            double peScore = (t.getValuePeThreshold() - pe) / t.getValuePeThreshold();
            double marginScore = Math.min(margin / 20.0, 0.5);
            return new LifecycleClassification(LifecycleStage.VALUE, clamp(0.5 + peScore * 0.3 + marginScore), inputs);
        }

        // typical profile: modest positive growth, profitable
        double confidence = growth > 0 && growth < 15 && margin > 0 ? 0.8 : 0.6;
        return new LifecycleClassification(LifecycleStage.MATURE, confidence, inputs);
    }

    /**
     * Factor weight multipliers for a stage. Factors not listed take 1.0.
     */
    public Map<String, Double> weightMultipliers(LifecycleStage stage) {
        return WEIGHT_MULTIPLIERS.getOrDefault(stage, Map.of());
    }

    public double multiplier(LifecycleStage stage, String factor) {
        return weightMultipliers(stage).getOrDefault(factor, 1.0);
    }

    private static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static Map<LifecycleStage, Map<String, Double>> buildMultiplierTable() {
        Map<LifecycleStage, Map<String, Double>> table = new EnumMap<>(LifecycleStage.class);
        table.put(LifecycleStage.HYPERGROWTH, Map.of(
            FactorNames.GROWTH, 1.5,
            FactorNames.MOMENTUM, 1.3,
            FactorNames.EARNINGS_REVISIONS, 1.3,
            FactorNames.SENTIMENT, 1.2,
            FactorNames.PROFITABILITY, 0.5,
            FactorNames.VALUE, 0.4,
            FactorNames.INTRINSIC_VALUE, 0.4,
            FactorNames.HISTORICAL_VALUE, 0.4,
            FactorNames.FINANCIAL_HEALTH, 0.8,
            FactorNames.DIVIDEND_QUALITY, 0.5));
        table.put(LifecycleStage.GROWTH, Map.of(
            FactorNames.GROWTH, 1.3,
            FactorNames.MOMENTUM, 1.2,
            FactorNames.EARNINGS_REVISIONS, 1.2,
            FactorNames.SENTIMENT, 1.1,
            FactorNames.PROFITABILITY, 0.8,
            FactorNames.VALUE, 0.7,
            FactorNames.INTRINSIC_VALUE, 0.8,
            FactorNames.HISTORICAL_VALUE, 0.8,
            FactorNames.DIVIDEND_QUALITY, 0.7));
        table.put(LifecycleStage.MATURE, Map.of(
            FactorNames.PROFITABILITY, 1.2,
            FactorNames.FINANCIAL_HEALTH, 1.2,
            FactorNames.VALUE, 1.1,
            FactorNames.INTRINSIC_VALUE, 1.1,
            FactorNames.HISTORICAL_VALUE, 1.2,
            FactorNames.DIVIDEND_QUALITY, 1.2,
            FactorNames.GROWTH, 0.7,
            FactorNames.MOMENTUM, 0.9));
        table.put(LifecycleStage.VALUE, Map.of(
            FactorNames.VALUE, 1.4,
            FactorNames.INTRINSIC_VALUE, 1.3,
            FactorNames.HISTORICAL_VALUE, 1.3,
            FactorNames.PROFITABILITY, 1.2,
            FactorNames.FINANCIAL_HEALTH, 1.1,
            FactorNames.DIVIDEND_QUALITY, 1.4,
            FactorNames.GROWTH, 0.5,
            FactorNames.MOMENTUM, 0.8));
        table.put(LifecycleStage.TURNAROUND, Map.of(
            FactorNames.FINANCIAL_HEALTH, 1.4,
            FactorNames.MOMENTUM, 1.3,
            FactorNames.SMART_MONEY, 1.3,
            FactorNames.EARNINGS_REVISIONS, 1.2,
            FactorNames.VALUE, 1.2,
            FactorNames.GROWTH, 0.6,
            FactorNames.PROFITABILITY, 0.7,
            FactorNames.DIVIDEND_QUALITY, 0.6));
        return Collections.unmodifiableMap(table);
    }
}

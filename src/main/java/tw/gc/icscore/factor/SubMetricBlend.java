package tw.gc.icscore.factor;

import tw.gc.icscore.enums.ScoreCategory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates the available sub-metrics of one factor evaluation and blends them with
 * weights redistributed over whatever turned out to be available. Local to one call.
 */
public final class SubMetricBlend {

    private final String factor;
    private final ScoreCategory category;
    private final Map<String, SupportingMetric> metrics = new LinkedHashMap<>();

    public SubMetricBlend(String factor, ScoreCategory category) {
        this.factor = factor;
        this.category = category;
    }

    public SubMetricBlend add(String metric, double rawValue, double score, double weight, boolean degraded) {
        if (weight > 0.0 && Double.isFinite(score)) {
            metrics.put(metric, new SupportingMetric(rawValue, ScoringFunctions.clamp(score), weight, degraded));
        }
        return this;
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    public FactorResult result() {
        if (metrics.isEmpty()) {
            return FactorResult.notComputable(factor, category);
        }
        double weighted = 0.0;
        double totalWeight = 0.0;
        boolean degraded = false;
        for (SupportingMetric m : metrics.values()) {
            weighted += m.score() * m.weight();
            totalWeight += m.weight();
            degraded |= m.degraded();
        }
        return FactorResult.of(factor, category, ScoringFunctions.clamp(weighted / totalWeight), metrics, degraded);
    }
}

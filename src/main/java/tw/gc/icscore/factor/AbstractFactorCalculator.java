package tw.gc.icscore.factor;

import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.statistics.MetricDistribution;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

import java.util.Optional;

/**
 * Base for calculators that rank sub-metrics against sector peers.
 */
public abstract class AbstractFactorCalculator implements FactorCalculator {

    private final String name;
    private final ScoreCategory category;

    protected AbstractFactorCalculator(String name, ScoreCategory category) {
        this.name = name;
        this.category = category;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ScoreCategory category() {
        return category;
    }

    protected SubMetricBlend newBlend() {
        return new SubMetricBlend(name, category);
    }

    /**
     * Adds the metric's sector percentile to the blend. Skipped when the ticker lacks the metric
     * or its sector has no usable distribution for it.
     */
    protected void addRanked(SubMetricBlend blend, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats,
                             String metric, double weight) {
        addRanked(blend, snapshot, sectorStats, metric, weight, false);
    }

    protected void addRankedInverted(SubMetricBlend blend, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats,
                                     String metric, double weight) {
        addRanked(blend, snapshot, sectorStats, metric, weight, true);
    }

    private void addRanked(SubMetricBlend blend, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats,
                           String metric, double weight, boolean lowerIsBetter) {
        Double raw = snapshot.value(metric);
        if (raw == null) {
            return;
        }
        addRankedValue(blend, snapshot, sectorStats, metric, raw, weight, lowerIsBetter);
    }

    protected void addRankedValue(SubMetricBlend blend, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats,
                                  String metric, double raw, double weight, boolean lowerIsBetter) {
        Optional<MetricDistribution> distribution = sectorStats.find(snapshot.sector(), metric)
            .filter(d -> d.sampleCount() > 0);
        if (distribution.isEmpty()) {
            return;
        }
        double percentile = distribution.get().percentileOf(raw);
        double score = lowerIsBetter ? 100.0 - percentile : percentile;
        blend.add(metric, raw, score, weight, distribution.get().lowConfidence());
    }

    /**
     * Adds a sub-metric scored on an absolute curve rather than against peers.
     */
    protected void addAbsolute(SubMetricBlend blend, String metric, Double raw, double score, double weight) {
        if (raw == null) {
            return;
        }
        blend.add(metric, raw, score, weight, false);
    }
}

package tw.gc.icscore.factor.impl;

import org.springframework.stereotype.Component;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.AbstractFactorCalculator;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.factor.SubMetricBlend;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relative value: every multiple ranked against the sector and inverted, cheaper scoring higher.
 * Non-positive multiples (losses, negative book) say nothing about cheapness and are skipped.
 */
@Component
public class ValueFactorCalculator extends AbstractFactorCalculator {

    private static final Map<String, Double> MULTIPLES = new LinkedHashMap<>();

    static {
        MULTIPLES.put(MetricNames.PE_RATIO, 0.35);
        MULTIPLES.put(MetricNames.PS_RATIO, 0.20);
        MULTIPLES.put(MetricNames.EV_EBITDA, 0.20);
        MULTIPLES.put(MetricNames.PB_RATIO, 0.15);
        MULTIPLES.put(MetricNames.PEG_RATIO, 0.10);
    }

    public ValueFactorCalculator() {
        super(FactorNames.VALUE, ScoreCategory.VALUATION);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        MULTIPLES.forEach((metric, weight) -> {
            Double multiple = snapshot.value(metric);
            if (multiple != null && multiple > 0) {
                addRankedValue(blend, snapshot, sectorStats, metric, multiple, weight, true);
            }
        });
        return blend.result();
    }
}

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

/**
 * Discount to fair value. The DCF upside comes from an external fair-value model.
 */
@Component
public class IntrinsicValueFactorCalculator extends AbstractFactorCalculator {

    public IntrinsicValueFactorCalculator() {
        super(FactorNames.INTRINSIC_VALUE, ScoreCategory.VALUATION);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.DCF_UPSIDE, 0.60);
        addRanked(blend, snapshot, sectorStats, MetricNames.EARNINGS_YIELD, 0.40);
        return blend.result();
    }
}

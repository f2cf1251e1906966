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
 * Trailing returns ranked against the sector. The 12-month leg skips the latest month to stay
 * clear of short-term reversal.
 */
@Component
public class MomentumFactorCalculator extends AbstractFactorCalculator {

    public MomentumFactorCalculator() {
        super(FactorNames.MOMENTUM, ScoreCategory.SIGNALS);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.RETURN_1M, 0.15);
        addRanked(blend, snapshot, sectorStats, MetricNames.RETURN_3M, 0.25);
        addRanked(blend, snapshot, sectorStats, MetricNames.RETURN_6M, 0.30);
        addRanked(blend, snapshot, sectorStats, MetricNames.RETURN_12M_EX_1M, 0.30);
        return blend.result();
    }
}

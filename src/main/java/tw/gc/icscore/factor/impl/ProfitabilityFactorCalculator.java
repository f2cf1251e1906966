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

@Component
public class ProfitabilityFactorCalculator extends AbstractFactorCalculator {

    public ProfitabilityFactorCalculator() {
        super(FactorNames.PROFITABILITY, ScoreCategory.QUALITY);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.NET_MARGIN, 0.30);
        addRanked(blend, snapshot, sectorStats, MetricNames.ROE, 0.30);
        addRanked(blend, snapshot, sectorStats, MetricNames.ROIC, 0.20);
        addRanked(blend, snapshot, sectorStats, MetricNames.GROSS_MARGIN, 0.20);
        return blend.result();
    }
}

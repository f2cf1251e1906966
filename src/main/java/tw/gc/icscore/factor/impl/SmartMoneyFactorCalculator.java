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
 * Analyst consensus, 13F institutional flows and insider net buying.
 */
@Component
public class SmartMoneyFactorCalculator extends AbstractFactorCalculator {

    public SmartMoneyFactorCalculator() {
        super(FactorNames.SMART_MONEY, ScoreCategory.SIGNALS);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.ANALYST_BUY_RATIO, 0.35);
        addRanked(blend, snapshot, sectorStats, MetricNames.INSTITUTIONAL_OWNERSHIP_CHANGE, 0.35);
        addRanked(blend, snapshot, sectorStats, MetricNames.INSIDER_NET_BUYING, 0.30);
        return blend.result();
    }
}

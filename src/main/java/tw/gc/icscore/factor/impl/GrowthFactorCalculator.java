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
 * Revenue, EPS and free-cash-flow growth against sector peers.
 * A swing from a loss to a profit scores the EPS leg at 100 instead of an undefined ratio.
 */
@Component
public class GrowthFactorCalculator extends AbstractFactorCalculator {

    static final double REVENUE_WEIGHT = 0.35;
    static final double EPS_WEIGHT = 0.35;
    static final double FCF_WEIGHT = 0.30;

    public GrowthFactorCalculator() {
        super(FactorNames.GROWTH, ScoreCategory.QUALITY);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.REVENUE_GROWTH_YOY, REVENUE_WEIGHT);

        Double epsCurrent = snapshot.value(MetricNames.EPS_CURRENT);
        Double epsPrior = snapshot.value(MetricNames.EPS_PRIOR_YEAR);
        if (epsPrior != null && epsCurrent != null && epsPrior < 0 && epsCurrent > 0) {
            addAbsolute(blend, MetricNames.EPS_GROWTH_YOY, epsCurrent, 100.0, EPS_WEIGHT);
        } else {
            addRanked(blend, snapshot, sectorStats, MetricNames.EPS_GROWTH_YOY, EPS_WEIGHT);
        }

        addRanked(blend, snapshot, sectorStats, MetricNames.FCF_GROWTH_YOY, FCF_WEIGHT);
        return blend.result();
    }
}

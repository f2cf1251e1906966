package tw.gc.icscore.factor.impl;

import org.springframework.stereotype.Component;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.AbstractFactorCalculator;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.factor.ScoringFunctions;
import tw.gc.icscore.factor.SubMetricBlend;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

/**
 * Direction and conviction of analyst EPS estimate changes.
 *
 * Magnitude: 90-day consensus change, -15% scores 0, flat 50, +15% 100.
 * Breadth: share of upward revisions among all revisions.
 * Recency: 30-day change against the 90-day change, a 10-point acceleration moving the score by 50.
 */
@Component
public class EarningsRevisionsFactorCalculator extends AbstractFactorCalculator {

    static final double MAGNITUDE_SPAN = 0.15;
    static final double RECENCY_SPAN = 0.10;

    static final double MAGNITUDE_WEIGHT = 0.50;
    static final double BREADTH_WEIGHT = 0.30;
    static final double RECENCY_WEIGHT = 0.20;

    public EarningsRevisionsFactorCalculator() {
        super(FactorNames.EARNINGS_REVISIONS, ScoreCategory.SIGNALS);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();

        Double change90 = snapshot.value(MetricNames.EPS_REVISION_90D);
        if (change90 != null) {
            addAbsolute(blend, MetricNames.EPS_REVISION_90D, change90,
                ScoringFunctions.centered(change90, MAGNITUDE_SPAN), MAGNITUDE_WEIGHT);
        }

        Double up = snapshot.value(MetricNames.REVISIONS_UP_90D);
        Double down = snapshot.value(MetricNames.REVISIONS_DOWN_90D);
        if (up != null || down != null) {
            double ups = up == null ? 0.0 : up;
            double downs = down == null ? 0.0 : down;
            double total = ups + downs;
            if (total > 0) {
                addAbsolute(blend, MetricNames.REVISIONS_UP_90D, ups, ups / total * 100.0, BREADTH_WEIGHT);
            }
        }

        Double change30 = snapshot.value(MetricNames.EPS_REVISION_30D);
        if (change30 != null || change90 != null) {
            double acceleration = (change30 == null ? 0.0 : change30) - (change90 == null ? 0.0 : change90);
            addAbsolute(blend, MetricNames.EPS_REVISION_30D, acceleration,
                ScoringFunctions.centered(acceleration, RECENCY_SPAN), RECENCY_WEIGHT);
        }
        return blend.result();
    }
}

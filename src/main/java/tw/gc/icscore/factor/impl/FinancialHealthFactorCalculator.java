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
 * Leverage (lower is better), liquidity scored on an optimal band, and interest coverage.
 */
@Component
public class FinancialHealthFactorCalculator extends AbstractFactorCalculator {

    static final double CURRENT_RATIO_FLOOR = 0.5;
    static final double CURRENT_RATIO_OPTIMUM = 2.0;
    static final double CURRENT_RATIO_CEILING = 5.0;

    public FinancialHealthFactorCalculator() {
        super(FactorNames.FINANCIAL_HEALTH, ScoreCategory.QUALITY);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRankedInverted(blend, snapshot, sectorStats, MetricNames.DEBT_TO_EQUITY, 0.40);

        Double currentRatio = snapshot.value(MetricNames.CURRENT_RATIO);
        if (currentRatio != null) {
            double score = ScoringFunctions.triangular(
                currentRatio, CURRENT_RATIO_FLOOR, CURRENT_RATIO_OPTIMUM, CURRENT_RATIO_CEILING);
            addAbsolute(blend, MetricNames.CURRENT_RATIO, currentRatio, score, 0.30);
        }

        addRanked(blend, snapshot, sectorStats, MetricNames.INTEREST_COVERAGE, 0.30);
        return blend.result();
    }
}

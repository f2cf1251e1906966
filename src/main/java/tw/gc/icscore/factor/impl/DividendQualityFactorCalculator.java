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
 * Income-mode factor. Stocks yielding under {@link #MIN_DIVIDEND_YIELD}% are not dividend payers:
 * the factor is not applicable to them, which is different from a missing yield.
 */
@Component
public class DividendQualityFactorCalculator extends AbstractFactorCalculator {

    static final double MIN_DIVIDEND_YIELD = 0.5;

    static final double PAYOUT_FLOOR = 0.0;
    static final double PAYOUT_OPTIMUM = 45.0;
    static final double PAYOUT_CEILING = 100.0;

    static final int KING_YEARS = 50;
    static final int ARISTOCRAT_YEARS = 25;
    static final int ACHIEVER_YEARS = 10;
    static final int CONTENDER_YEARS = 5;

    public DividendQualityFactorCalculator() {
        super(FactorNames.DIVIDEND_QUALITY, ScoreCategory.QUALITY);
    }

    @Override
    public boolean optional() {
        return true;
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        Double yield = snapshot.value(MetricNames.DIVIDEND_YIELD);
        if (yield == null) {
            return FactorResult.notComputable(name(), category());
        }
        if (yield < MIN_DIVIDEND_YIELD) {
            return FactorResult.notApplicable(name(), category());
        }

        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.DIVIDEND_YIELD, 0.25);

        Double payout = snapshot.value(MetricNames.PAYOUT_RATIO);
        if (payout != null) {
            addAbsolute(blend, MetricNames.PAYOUT_RATIO, payout,
                ScoringFunctions.triangular(payout, PAYOUT_FLOOR, PAYOUT_OPTIMUM, PAYOUT_CEILING), 0.25);
        }

        addRanked(blend, snapshot, sectorStats, MetricNames.DIVIDEND_GROWTH_5Y, 0.25);

        Double streak = snapshot.value(MetricNames.DIVIDEND_STREAK_YEARS);
        if (streak != null) {
            addAbsolute(blend, MetricNames.DIVIDEND_STREAK_YEARS, streak, streakScore(streak), 0.25);
        }
        return blend.result();
    }

    static double streakScore(double years) {
        if (years >= KING_YEARS) {
            return 100.0;
        }
        if (years >= ARISTOCRAT_YEARS) {
            return 90.0 + (years - ARISTOCRAT_YEARS) / (KING_YEARS - ARISTOCRAT_YEARS) * 10.0;
        }
        if (years >= ACHIEVER_YEARS) {
            return 70.0 + (years - ACHIEVER_YEARS) / (ARISTOCRAT_YEARS - ACHIEVER_YEARS) * 20.0;
        }
        if (years >= CONTENDER_YEARS) {
            return 50.0 + (years - CONTENDER_YEARS) / (ACHIEVER_YEARS - CONTENDER_YEARS) * 20.0;
        }
        return ScoringFunctions.clamp(years * 10.0);
    }
}

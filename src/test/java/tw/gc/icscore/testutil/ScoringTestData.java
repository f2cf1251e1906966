package tw.gc.icscore.testutil;

import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.FactorCalculator;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.factor.impl.DividendQualityFactorCalculator;
import tw.gc.icscore.factor.impl.EarningsRevisionsFactorCalculator;
import tw.gc.icscore.factor.impl.FinancialHealthFactorCalculator;
import tw.gc.icscore.factor.impl.GrowthFactorCalculator;
import tw.gc.icscore.factor.impl.HistoricalValueFactorCalculator;
import tw.gc.icscore.factor.impl.IntrinsicValueFactorCalculator;
import tw.gc.icscore.factor.impl.MomentumFactorCalculator;
import tw.gc.icscore.factor.impl.ProfitabilityFactorCalculator;
import tw.gc.icscore.factor.impl.SentimentFactorCalculator;
import tw.gc.icscore.factor.impl.SmartMoneyFactorCalculator;
import tw.gc.icscore.factor.impl.TechnicalFactorCalculator;
import tw.gc.icscore.factor.impl.ValueFactorCalculator;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.providers.MetricValue;
import tw.gc.icscore.services.statistics.MetricDistribution;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for metric snapshots, sector statistics and factor results used across scoring tests.
 *
 * The "linear" distribution has breakpoints 0/10/25/50/75/90/100, so a raw value between 0 and 100
 * ranks at exactly that percentile.
 */
public final class ScoringTestData {

    public static final String SECTOR = "Technology";
    public static final LocalDate AS_OF = LocalDate.of(2024, 6, 28);

    /** Every metric the calculators rank against sector peers */
    public static final List<String> RANKED_METRICS = List.of(
        MetricNames.REVENUE_GROWTH_YOY, MetricNames.EPS_GROWTH_YOY, MetricNames.FCF_GROWTH_YOY,
        MetricNames.NET_MARGIN, MetricNames.ROE, MetricNames.ROIC, MetricNames.GROSS_MARGIN,
        MetricNames.DEBT_TO_EQUITY, MetricNames.INTEREST_COVERAGE,
        MetricNames.DIVIDEND_YIELD, MetricNames.DIVIDEND_GROWTH_5Y,
        MetricNames.PE_RATIO, MetricNames.PS_RATIO, MetricNames.EV_EBITDA, MetricNames.PB_RATIO, MetricNames.PEG_RATIO,
        MetricNames.DCF_UPSIDE, MetricNames.EARNINGS_YIELD,
        MetricNames.ANALYST_BUY_RATIO, MetricNames.INSTITUTIONAL_OWNERSHIP_CHANGE, MetricNames.INSIDER_NET_BUYING,
        MetricNames.RETURN_1M, MetricNames.RETURN_3M, MetricNames.RETURN_6M, MetricNames.RETURN_12M_EX_1M,
        MetricNames.MACD_HISTOGRAM, MetricNames.PRICE_VS_SMA50, MetricNames.PRICE_VS_SMA200,
        MetricNames.NEWS_SENTIMENT, MetricNames.POSITIVE_ARTICLE_RATIO, MetricNames.SOCIAL_SENTIMENT);

    private ScoringTestData() {
    }

    public static MetricSnapshot snapshot(String ticker, Map<String, Double> metrics) {
        return snapshot(ticker, SECTOR, AS_OF, metrics);
    }

    public static MetricSnapshot snapshot(String ticker, String sector, LocalDate asOf, Map<String, Double> metrics) {
        Map<String, MetricValue> values = new HashMap<>();
        metrics.forEach((name, value) -> values.put(name, new MetricValue(value, asOf)));
        return new MetricSnapshot(ticker, sector, asOf, values, Map.of());
    }

    public static MetricSnapshot withHistory(MetricSnapshot base, String metric, List<Double> monthly) {
        List<MetricValue> series = new ArrayList<>();
        for (int i = 0; i < monthly.size(); i++) {
            series.add(new MetricValue(monthly.get(i), base.asOfDate().minusMonths(monthly.size() - i)));
        }
        Map<String, List<MetricValue>> history = new HashMap<>(base.history());
        history.put(metric, series);
        return new MetricSnapshot(base.ticker(), base.sector(), base.asOfDate(), base.metrics(), history);
    }

    public static MetricDistribution linearDistribution(String sector, String metric, boolean lowConfidence) {
        return new MetricDistribution(sector, metric, AS_OF, 0, 10, 25, 50, 75, 90, 100, 50, 28.87,
            lowConfidence ? 3 : 50, lowConfidence);
    }

    public static SectorStatisticsSnapshot linearStats() {
        return linearStats(SECTOR, false);
    }

    public static SectorStatisticsSnapshot linearStats(String sector, boolean lowConfidence) {
        Map<String, MetricDistribution> byMetric = new HashMap<>();
        RANKED_METRICS.forEach(m -> byMetric.put(m, linearDistribution(sector, m, lowConfidence)));
        return new SectorStatisticsSnapshot(AS_OF, Map.of(sector, byMetric));
    }

    /**
     * Metrics that make every one of the twelve factors computable.
     */
    public static Map<String, Double> completeMetrics() {
        Map<String, Double> m = new LinkedHashMap<>();
        RANKED_METRICS.forEach(name -> m.put(name, 60.0));
        m.put(MetricNames.EPS_CURRENT, 2.0);
        m.put(MetricNames.EPS_PRIOR_YEAR, 1.5);
        m.put(MetricNames.CURRENT_RATIO, 2.0);
        m.put(MetricNames.PAYOUT_RATIO, 45.0);
        m.put(MetricNames.DIVIDEND_STREAK_YEARS, 12.0);
        m.put(MetricNames.DIVIDEND_YIELD, 3.0);
        m.put(MetricNames.EPS_REVISION_90D, 0.05);
        m.put(MetricNames.EPS_REVISION_30D, 0.06);
        m.put(MetricNames.REVISIONS_UP_90D, 6.0);
        m.put(MetricNames.REVISIONS_DOWN_90D, 2.0);
        m.put(MetricNames.RSI_14, 55.0);
        m.put(MetricNames.PE_RATIO, 18.0);
        m.put(MetricNames.PS_RATIO, 4.0);
        m.put(MetricNames.REVENUE_GROWTH_YOY, 12.0);
        m.put(MetricNames.NET_MARGIN, 15.0);
        m.put(MetricNames.MARKET_CAP, 1.0e10);
        return m;
    }

    public static MetricSnapshot completeSnapshot(String ticker) {
        MetricSnapshot base = snapshot(ticker, completeMetrics());
        List<Double> peHistory = new ArrayList<>();
        List<Double> psHistory = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            peHistory.add(15.0 + i * 0.5);
            psHistory.add(3.0 + i * 0.1);
        }
        return withHistory(withHistory(base, MetricNames.PE_RATIO, peHistory), MetricNames.PS_RATIO, psHistory);
    }

    public static List<FactorCalculator> allCalculators() {
        return List.of(
            new GrowthFactorCalculator(),
            new ProfitabilityFactorCalculator(),
            new FinancialHealthFactorCalculator(),
            new DividendQualityFactorCalculator(),
            new ValueFactorCalculator(),
            new IntrinsicValueFactorCalculator(),
            new HistoricalValueFactorCalculator(),
            new SmartMoneyFactorCalculator(),
            new EarningsRevisionsFactorCalculator(),
            new MomentumFactorCalculator(),
            new TechnicalFactorCalculator(),
            new SentimentFactorCalculator());
    }

    public static FactorResult available(String factor, double score) {
        return FactorResult.of(factor, categoryOf(factor), score, Map.of(), false);
    }

    public static FactorResult missing(String factor) {
        return FactorResult.notComputable(factor, categoryOf(factor));
    }

    public static ScoreCategory categoryOf(String factor) {
        return switch (factor) {
            case FactorNames.GROWTH, FactorNames.PROFITABILITY, FactorNames.FINANCIAL_HEALTH,
                 FactorNames.DIVIDEND_QUALITY -> ScoreCategory.QUALITY;
            case FactorNames.VALUE, FactorNames.INTRINSIC_VALUE, FactorNames.HISTORICAL_VALUE -> ScoreCategory.VALUATION;
            default -> ScoreCategory.SIGNALS;
        };
    }
}

package tw.gc.icscore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.icscore.enums.ScoreEventType;
import tw.gc.icscore.factor.FactorNames;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Component
@ConfigurationProperties(prefix = "icscore")
public class IcScoreProperties {

    private Scoring scoring = new Scoring();
    private Sector sector = new Sector();
    private Lifecycle lifecycle = new Lifecycle();
    private Confidence confidence = new Confidence();
    private Stabilizer stabilizer = new Stabilizer();
    private Backtest backtest = new Backtest();
    private Peers peers = new Peers();

    /**
     * Base factor weights before lifecycle adjustment. Quality 36%, valuation 27%, signals 37%.
     */
    private Map<String, Double> weights = defaultWeights();

    @Data
    public static class Scoring {
        /** Worker threads for per-ticker scoring; 0 means one per available processor */
        private int poolSize = 0;
        /** Income mode: include dividend quality as an expected factor */
        private boolean dividendQualityEnabled = true;
        private long tickerTimeoutSeconds = 60;
    }

    @Data
    public static class Sector {
        /** Distributions with fewer samples are flagged low-confidence */
        private int minSampleSize = 5;
        private double winsorizeSigma = 3.0;
    }

    @Data
    public static class Lifecycle {
        private double hypergrowthRevenueGrowth = 50.0;
        private double growthRevenueGrowth = 20.0;
        private double turnaroundRevenueGrowth = -5.0;
        private double valuePeThreshold = 12.0;
        private double valueMarginThreshold = 5.0;
        private double defaultPeRatio = 20.0;
    }

    @Data
    public static class Confidence {
        private double highCompleteness = 90.0;
        private double mediumCompleteness = 70.0;
        private double lowCompleteness = 50.0;
        private List<String> coreQualityFactors = List.of(
            FactorNames.GROWTH, FactorNames.PROFITABILITY, FactorNames.FINANCIAL_HEALTH, FactorNames.DIVIDEND_QUALITY);
        private int minCoreQualityFactors = 3;
        private List<String> coreValuationFactors = List.of(FactorNames.VALUE, FactorNames.INTRINSIC_VALUE);
        private int minCoreValuationFactors = 1;
    }

    @Data
    public static class Stabilizer {
        private double alpha = 0.7;
        private double minChangeThreshold = 0.5;
        private Set<ScoreEventType> resetEvents = EnumSet.of(
            ScoreEventType.EARNINGS_RELEASE,
            ScoreEventType.ANALYST_RATING_CHANGE,
            ScoreEventType.INSIDER_TRADE_LARGE,
            ScoreEventType.DIVIDEND_ANNOUNCEMENT,
            ScoreEventType.ACQUISITION_NEWS,
            ScoreEventType.GUIDANCE_UPDATE);
    }

    @Data
    public static class Backtest {
        private double transactionCostBps = 10.0;
        private double slippageBps = 5.0;
        /** Periods scoring fewer tickers cannot be split into deciles and are skipped */
        private int minScoredTickers = 10;
        /** 0 means one per available processor */
        private int poolSize = 0;
    }

    @Data
    public static class Peers {
        /** Candidates must be within this band of the ticker's market cap */
        private double marketCapMinRatio = 0.25;
        private double marketCapMaxRatio = 4.0;
        private int defaultCount = 5;
    }

    public int effectivePoolSize(int configured) {
        return configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(FactorNames.PROFITABILITY, 0.11);
        weights.put(FactorNames.FINANCIAL_HEALTH, 0.09);
        weights.put(FactorNames.GROWTH, 0.12);
        weights.put(FactorNames.DIVIDEND_QUALITY, 0.04);
        weights.put(FactorNames.VALUE, 0.11);
        weights.put(FactorNames.INTRINSIC_VALUE, 0.09);
        weights.put(FactorNames.HISTORICAL_VALUE, 0.07);
        weights.put(FactorNames.MOMENTUM, 0.09);
        weights.put(FactorNames.SMART_MONEY, 0.09);
        weights.put(FactorNames.EARNINGS_REVISIONS, 0.08);
        weights.put(FactorNames.TECHNICAL, 0.06);
        weights.put(FactorNames.SENTIMENT, 0.05);
        return weights;
    }
}

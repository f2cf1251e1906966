package tw.gc.icscore.factor;

import java.util.List;

/**
 * Registered factor names. Weight tables, lifecycle multipliers and persisted records key on these.
 */
public final class FactorNames {

    public static final String GROWTH = "growth";
    public static final String PROFITABILITY = "profitability";
    public static final String FINANCIAL_HEALTH = "financial_health";
    public static final String DIVIDEND_QUALITY = "dividend_quality";

    public static final String VALUE = "value";
    public static final String INTRINSIC_VALUE = "intrinsic_value";
    public static final String HISTORICAL_VALUE = "historical_value";

    public static final String SMART_MONEY = "smart_money";
    public static final String EARNINGS_REVISIONS = "earnings_revisions";
    public static final String MOMENTUM = "momentum";
    public static final String TECHNICAL = "technical";
    public static final String SENTIMENT = "sentiment";

    /** Factors recomputed by an intraday price-sensitive refresh */
    public static final List<String> PRICE_SENSITIVE = List.of(VALUE, INTRINSIC_VALUE, MOMENTUM, TECHNICAL);

    private FactorNames() {
    }
}

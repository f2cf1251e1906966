package tw.gc.icscore.providers;

/**
 * Metric keys shared by the ingestion tables, the sector distributions and the factor calculators.
 * Percent-valued metrics are stored in percent (12.5 = 12.5%); revision changes and returns as fractions.
 */
public final class MetricNames {

    // growth
    public static final String REVENUE_GROWTH_YOY = "revenue_growth_yoy";
    public static final String EPS_GROWTH_YOY = "eps_growth_yoy";
    public static final String EPS_CURRENT = "eps_current";
    public static final String EPS_PRIOR_YEAR = "eps_prior_year";
    public static final String FCF_GROWTH_YOY = "fcf_growth_yoy";

    // profitability
    public static final String NET_MARGIN = "net_margin";
    public static final String ROE = "roe";
    public static final String ROIC = "roic";
    public static final String GROSS_MARGIN = "gross_margin";

    // financial health
    public static final String DEBT_TO_EQUITY = "debt_to_equity";
    public static final String CURRENT_RATIO = "current_ratio";
    public static final String INTEREST_COVERAGE = "interest_coverage";

    // dividends
    public static final String DIVIDEND_YIELD = "dividend_yield";
    public static final String PAYOUT_RATIO = "payout_ratio";
    public static final String DIVIDEND_GROWTH_5Y = "dividend_growth_5y";
    public static final String DIVIDEND_STREAK_YEARS = "dividend_streak_years";

    // valuation
    public static final String PE_RATIO = "pe_ratio";
    public static final String PS_RATIO = "ps_ratio";
    public static final String EV_EBITDA = "ev_ebitda";
    public static final String PB_RATIO = "pb_ratio";
    public static final String PEG_RATIO = "peg_ratio";
    public static final String DCF_UPSIDE = "dcf_upside";
    public static final String EARNINGS_YIELD = "earnings_yield";

    // smart money
    public static final String ANALYST_BUY_RATIO = "analyst_buy_ratio";
    public static final String INSTITUTIONAL_OWNERSHIP_CHANGE = "institutional_ownership_change";
    public static final String INSIDER_NET_BUYING = "insider_net_buying";

    // earnings revisions
    public static final String EPS_REVISION_90D = "eps_revision_90d";
    public static final String EPS_REVISION_30D = "eps_revision_30d";
    public static final String REVISIONS_UP_90D = "revisions_up_90d";
    public static final String REVISIONS_DOWN_90D = "revisions_down_90d";

    // momentum
    public static final String RETURN_1M = "return_1m";
    public static final String RETURN_3M = "return_3m";
    public static final String RETURN_6M = "return_6m";
    public static final String RETURN_12M_EX_1M = "return_12m_ex_1m";

    // technical
    public static final String RSI_14 = "rsi_14";
    public static final String MACD_HISTOGRAM = "macd_histogram";
    public static final String PRICE_VS_SMA50 = "price_vs_sma50";
    public static final String PRICE_VS_SMA200 = "price_vs_sma200";

    // sentiment
    public static final String NEWS_SENTIMENT = "news_sentiment";
    public static final String POSITIVE_ARTICLE_RATIO = "positive_article_ratio";
    public static final String SOCIAL_SENTIMENT = "social_sentiment";

    // market
    public static final String PRICE = "price";
    public static final String MARKET_CAP = "market_cap";

    private MetricNames() {
    }
}

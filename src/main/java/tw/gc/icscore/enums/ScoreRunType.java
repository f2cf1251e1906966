package tw.gc.icscore.enums;

public enum ScoreRunType {
    /** Daily recalculation of every factor after market close */
    FULL,
    /** Intraday refresh of price-driven factors only */
    PRICE_REFRESH
}

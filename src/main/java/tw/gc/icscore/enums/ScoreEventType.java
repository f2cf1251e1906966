package tw.gc.icscore.enums;

/**
 * Discrete events detected for a ticker. Only reset events bypass score smoothing.
 */
public enum ScoreEventType {
    EARNINGS_RELEASE(true),
    ANALYST_RATING_CHANGE(true),
    INSIDER_TRADE_LARGE(true),
    DIVIDEND_ANNOUNCEMENT(true),
    ACQUISITION_NEWS(true),
    GUIDANCE_UPDATE(true),
    STOCK_SPLIT(false),
    PRICE_BREAKOUT(false),
    TECHNICAL_SIGNAL(false);

    private final boolean resetByDefault;

    ScoreEventType(boolean resetByDefault) {
        this.resetByDefault = resetByDefault;
    }

    public boolean isResetByDefault() {
        return resetByDefault;
    }
}

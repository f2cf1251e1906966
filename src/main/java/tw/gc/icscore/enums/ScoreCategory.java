package tw.gc.icscore.enums;

public enum ScoreCategory {
    QUALITY,
    VALUATION,
    SIGNALS
}

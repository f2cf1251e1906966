package tw.gc.icscore.enums;

/**
 * Rating band derived from the displayed overall score.
 */
public enum ScoreRating {
    STRONG_BUY("Strong Buy", 80.0),
    BUY("Buy", 65.0),
    HOLD("Hold", 50.0),
    UNDERPERFORM("Underperform", 35.0),
    SELL("Sell", 0.0);

    private final String displayName;
    private final double threshold;

    ScoreRating(String displayName, double threshold) {
        this.displayName = displayName;
        this.threshold = threshold;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Highest band whose threshold the score reaches. Declared order is descending.
     */
    public static ScoreRating forScore(double score) {
        for (ScoreRating rating : values()) {
            if (score >= rating.threshold) {
                return rating;
            }
        }
        return SELL;
    }
}

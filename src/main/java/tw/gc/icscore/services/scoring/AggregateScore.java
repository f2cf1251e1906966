package tw.gc.icscore.services.scoring;

import tw.gc.icscore.enums.ConfidenceLevel;
import tw.gc.icscore.enums.ScoreCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * @param overallScore   displayable score, null when confidence is INSUFFICIENT
 * @param weightedScore  weighted mean of the available factors, kept for audit even when not displayable
 * @param categoryScores per-category weighted mean; categories without an available member are absent
 */
public record AggregateScore(
    Double overallScore,
    Double weightedScore,
    Map<ScoreCategory, Double> categoryScores,
    int availableFactors,
    int expectedFactors,
    double completenessPct,
    ConfidenceLevel confidence,
    boolean degraded
) {

    public AggregateScore {
        if (confidence == ConfidenceLevel.INSUFFICIENT && overallScore != null) {
            throw new IllegalArgumentException("An INSUFFICIENT aggregate carries no displayable score");
        }
        categoryScores = categoryScores == null || categoryScores.isEmpty()
            ? Collections.unmodifiableMap(new EnumMap<>(ScoreCategory.class))
            : Collections.unmodifiableMap(new EnumMap<>(categoryScores));
    }

    public boolean isDisplayable() {
        return overallScore != null;
    }

    public Double categoryScore(ScoreCategory category) {
        return categoryScores.get(category);
    }
}

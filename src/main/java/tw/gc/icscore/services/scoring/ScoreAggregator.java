package tw.gc.icscore.services.scoring;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.enums.ConfidenceLevel;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.FactorResult;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines factor results into category and overall scores, with weights redistributed over the
 * factors that are available, and grades how much of the expected input was present.
 *
 * Confidence is graded on completeness (High, Medium, Low, Insufficient), with a hard floor:
 * too few core quality or core valuation factors is INSUFFICIENT whatever the completeness.
 */
@Component
@RequiredArgsConstructor
public class ScoreAggregator {

    private final IcScoreProperties properties;

    /**
     * @param factorResults one result per evaluated factor; results for factors without a weight are ignored
     * @param weights       final (lifecycle-adjusted) weights of every expected factor
     */
    public AggregateScore aggregate(Collection<FactorResult> factorResults, Map<String, Double> weights) {
        Set<String> notApplicable = factorResults.stream()
            .filter(FactorResult::notApplicable)
            .map(FactorResult::factor)
            .filter(weights::containsKey)
            .collect(Collectors.toSet());
        List<FactorResult> expected = factorResults.stream()
            .filter(r -> weights.containsKey(r.factor()))
            .toList();
        List<FactorResult> available = expected.stream().filter(FactorResult::available).toList();

        Double weightedScore = weightedMean(available, weights);
        Map<ScoreCategory, Double> categoryScores = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory category : ScoreCategory.values()) {
            List<FactorResult> members = available.stream().filter(r -> r.category() == category).toList();
            Double categoryScore = weightedMean(members, weights);
            if (categoryScore != null) {
                categoryScores.put(category, categoryScore);
            }
        }

        int expectedCount = weights.size() - notApplicable.size();
        double completeness = expectedCount == 0 ? 0.0 : available.size() * 100.0 / expectedCount;
        boolean degraded = available.stream().anyMatch(FactorResult::degraded);

        ConfidenceLevel confidence = confidenceFor(completeness);
        if (!meetsCoreFloors(available, weights, notApplicable)) {
            confidence = ConfidenceLevel.INSUFFICIENT;
        }
        if (weightedScore == null) {
            confidence = ConfidenceLevel.INSUFFICIENT;
        }
        if (degraded && confidence.isDisplayable()) {
            confidence = confidence.downgrade();
        }

        Double overall = confidence.isDisplayable() ? weightedScore : null;
        return new AggregateScore(overall, weightedScore, categoryScores, available.size(), expectedCount,
            completeness, confidence, degraded);
    }

    ConfidenceLevel confidenceFor(double completenessPct) {
        IcScoreProperties.Confidence c = properties.getConfidence();
        if (completenessPct >= c.getHighCompleteness()) {
            return ConfidenceLevel.HIGH;
        }
        if (completenessPct >= c.getMediumCompleteness()) {
            return ConfidenceLevel.MEDIUM;
        }
        if (completenessPct >= c.getLowCompleteness()) {
            return ConfidenceLevel.LOW;
        }
        return ConfidenceLevel.INSUFFICIENT;
    }

    /**
     * Core factors that are not expected (dividend quality outside income mode) or do not apply to the
     * ticker (dividend quality for a non-payer) lower the required count by one each, so the floor still
     * tolerates the same number of gaps.
     */
    private boolean meetsCoreFloors(List<FactorResult> available, Map<String, Double> weights, Set<String> notApplicable) {
        IcScoreProperties.Confidence c = properties.getConfidence();
        return meetsFloor(available, weights, notApplicable, c.getCoreQualityFactors(), c.getMinCoreQualityFactors())
            && meetsFloor(available, weights, notApplicable, c.getCoreValuationFactors(), c.getMinCoreValuationFactors());
    }

    private boolean meetsFloor(List<FactorResult> available, Map<String, Double> weights, Set<String> notApplicable,
                               List<String> coreFactors, int configuredMinimum) {
        long notExpected = coreFactors.stream()
            .filter(f -> !weights.containsKey(f) || notApplicable.contains(f))
            .count();
        long required = Math.max(0, configuredMinimum - notExpected);
        long present = available.stream().filter(r -> coreFactors.contains(r.factor())).count();
        return present >= required;
    }

    private static Double weightedMean(List<FactorResult> results, Map<String, Double> weights) {
        double weighted = 0.0;
        double total = 0.0;
        for (FactorResult result : results) {
            double weight = weights.getOrDefault(result.factor(), 0.0);
            weighted += result.score() * weight;
            total += weight;
        }
        if (total <= 0.0) {
            return null;
        }
        return Math.max(0.0, Math.min(100.0, weighted / total));
    }
}

package tw.gc.icscore.services.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.enums.ConfidenceLevel;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.testutil.ScoringTestData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ScoreAggregator Tests")
class ScoreAggregatorTest {

    private IcScoreProperties properties;
    private ScoreAggregator aggregator;
    private Map<String, Double> weights;

    @BeforeEach
    void setUp() {
        properties = new IcScoreProperties();
        aggregator = new ScoreAggregator(properties);
        weights = properties.getWeights();
    }

    private List<FactorResult> results(double score, Set<String> missing) {
        List<FactorResult> results = new ArrayList<>();
        for (String factor : weights.keySet()) {
            results.add(missing.contains(factor) ? ScoringTestData.missing(factor) : ScoringTestData.available(factor, score));
        }
        return results;
    }

    @Nested
    @DisplayName("Weighted Score Tests")
    class WeightedScoreTests {

        @Test
        @DisplayName("Uniform factor scores aggregate to the same score")
        void uniformScores() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of()), weights);

            assertThat(aggregate.overallScore()).isCloseTo(60.0, within(1e-9));
            assertThat(aggregate.categoryScore(ScoreCategory.QUALITY)).isCloseTo(60.0, within(1e-9));
        }

        @Test
        @DisplayName("Overall score is a convex combination of the available factors")
        void convexCombination() {
            List<FactorResult> results = new ArrayList<>();
            double score = 5.0;
            for (String factor : weights.keySet()) {
                results.add(ScoringTestData.available(factor, score));
                score += 8.0;
            }

            AggregateScore aggregate = aggregator.aggregate(results, weights);

            assertThat(aggregate.overallScore()).isBetween(5.0, 93.0);
        }

        @Test
        @DisplayName("Missing factors are redistributed, not zero-filled")
        void redistributesMissing() {
            Map<String, Double> two = new LinkedHashMap<>();
            two.put(FactorNames.VALUE, 0.5);
            two.put(FactorNames.MOMENTUM, 0.5);
            properties.getConfidence().setMinCoreQualityFactors(0);

            AggregateScore aggregate = aggregator.aggregate(List.of(
                ScoringTestData.available(FactorNames.VALUE, 80.0),
                ScoringTestData.missing(FactorNames.MOMENTUM)), two);

            assertThat(aggregate.weightedScore()).isCloseTo(80.0, within(1e-9));
            assertThat(aggregate.completenessPct()).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("Category scores are absent when no member is available")
        void categoryAbsent() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of(
                FactorNames.SMART_MONEY, FactorNames.EARNINGS_REVISIONS, FactorNames.MOMENTUM,
                FactorNames.TECHNICAL, FactorNames.SENTIMENT)), weights);

            assertThat(aggregate.categoryScores()).doesNotContainKey(ScoreCategory.SIGNALS);
            assertThat(aggregate.categoryScore(ScoreCategory.VALUATION)).isNotNull();
        }
    }

    @Nested
    @DisplayName("Confidence Tests")
    class ConfidenceTests {

        @Test
        @DisplayName("All twelve factors is HIGH")
        void allPresentIsHigh() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of()), weights);

            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(aggregate.availableFactors()).isEqualTo(12);
            assertThat(aggregate.expectedFactors()).isEqualTo(12);
        }

        @Test
        @DisplayName("Nine of twelve is MEDIUM")
        void ninePresentIsMedium() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of(
                FactorNames.TECHNICAL, FactorNames.SENTIMENT, FactorNames.SMART_MONEY)), weights);

            assertThat(aggregate.completenessPct()).isCloseTo(75.0, within(1e-9));
            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        @DisplayName("Six of twelve is LOW but still displayable")
        void sixPresentIsLow() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of(
                FactorNames.TECHNICAL, FactorNames.SENTIMENT, FactorNames.SMART_MONEY,
                FactorNames.MOMENTUM, FactorNames.EARNINGS_REVISIONS, FactorNames.HISTORICAL_VALUE)), weights);

            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(aggregate.isDisplayable()).isTrue();
        }

        @Test
        @DisplayName("Below half the factors is INSUFFICIENT with no overall score")
        void fivePresentIsInsufficient() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of(
                FactorNames.TECHNICAL, FactorNames.SENTIMENT, FactorNames.SMART_MONEY,
                FactorNames.MOMENTUM, FactorNames.EARNINGS_REVISIONS, FactorNames.HISTORICAL_VALUE,
                FactorNames.INTRINSIC_VALUE)), weights);

            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.INSUFFICIENT);
            assertThat(aggregate.overallScore()).isNull();
            assertThat(aggregate.weightedScore()).isNotNull();
        }

        @Test
        @DisplayName("Only two core quality factors is INSUFFICIENT despite high completeness")
        void coreQualityFloor() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of(
                FactorNames.FINANCIAL_HEALTH, FactorNames.DIVIDEND_QUALITY)), weights);

            assertThat(aggregate.completenessPct()).isGreaterThan(80.0);
            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.INSUFFICIENT);
            assertThat(aggregate.isDisplayable()).isFalse();
        }

        @Test
        @DisplayName("No core valuation factor is INSUFFICIENT")
        void coreValuationFloor() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, Set.of(
                FactorNames.VALUE, FactorNames.INTRINSIC_VALUE)), weights);

            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.INSUFFICIENT);
        }

        @Test
        @DisplayName("Dividend quality outside income mode lowers the quality floor")
        void disabledCoreFactorLowersFloor() {
            Map<String, Double> withoutDividend = new LinkedHashMap<>(weights);
            withoutDividend.remove(FactorNames.DIVIDEND_QUALITY);
            List<FactorResult> results = results(60.0, Set.of(FactorNames.FINANCIAL_HEALTH));

            AggregateScore aggregate = aggregator.aggregate(results, withoutDividend);

            assertThat(aggregate.expectedFactors()).isEqualTo(11);
            assertThat(aggregate.availableFactors()).isEqualTo(10);
            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.HIGH);
        }

        @Test
        @DisplayName("Non-payer with one other quality factor missing keeps its score")
        void nonPayerLowersFloor() {
            List<FactorResult> results = new ArrayList<>(results(60.0, Set.of(FactorNames.FINANCIAL_HEALTH)));
            results.removeIf(r -> r.factor().equals(FactorNames.DIVIDEND_QUALITY));
            results.add(FactorResult.notApplicable(FactorNames.DIVIDEND_QUALITY, ScoreCategory.QUALITY));

            AggregateScore aggregate = aggregator.aggregate(results, weights);

            assertThat(aggregate.expectedFactors()).isEqualTo(11);
            assertThat(aggregate.availableFactors()).isEqualTo(10);
            assertThat(aggregate.completenessPct()).isGreaterThan(90.0);
            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(aggregate.overallScore()).isCloseTo(60.0, within(1e-9));
        }

        @Test
        @DisplayName("Non-payer still needs two of the remaining quality factors")
        void nonPayerWithTwoQualityGaps() {
            List<FactorResult> results = new ArrayList<>(results(60.0, Set.of(
                FactorNames.FINANCIAL_HEALTH, FactorNames.GROWTH)));
            results.removeIf(r -> r.factor().equals(FactorNames.DIVIDEND_QUALITY));
            results.add(FactorResult.notApplicable(FactorNames.DIVIDEND_QUALITY, ScoreCategory.QUALITY));

            AggregateScore aggregate = aggregator.aggregate(results, weights);

            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.INSUFFICIENT);
            assertThat(aggregate.overallScore()).isNull();
        }

        @Test
        @DisplayName("Ranking against a thin sector lowers confidence one step")
        void degradedDowngrades() {
            List<FactorResult> results = new ArrayList<>(results(60.0, Set.of(FactorNames.GROWTH)));
            results.removeIf(r -> r.factor().equals(FactorNames.GROWTH));
            results.add(FactorResult.of(FactorNames.GROWTH, ScoreCategory.QUALITY, 60.0, Map.of(), true));

            AggregateScore aggregate = aggregator.aggregate(results, weights);

            assertThat(aggregate.degraded()).isTrue();
            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        @DisplayName("Nothing available is INSUFFICIENT")
        void nothingAvailable() {
            AggregateScore aggregate = aggregator.aggregate(results(60.0, weights.keySet()), weights);

            assertThat(aggregate.confidence()).isEqualTo(ConfidenceLevel.INSUFFICIENT);
            assertThat(aggregate.weightedScore()).isNull();
            assertThat(aggregate.completenessPct()).isZero();
        }
    }
}

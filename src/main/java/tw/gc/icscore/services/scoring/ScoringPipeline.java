package tw.gc.icscore.services.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.exceptions.LookAheadViolationException;
import tw.gc.icscore.factor.FactorCalculator;
import tw.gc.icscore.factor.FactorRegistry;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.lifecycle.LifecycleClassification;
import tw.gc.icscore.services.lifecycle.LifecycleClassifier;
import tw.gc.icscore.services.lifecycle.WeightAdjuster;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Classify, weight, evaluate every registered factor, aggregate. Stateless; safe to call from
 * many worker threads at once as long as each call gets its own snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoringPipeline {

    private final FactorRegistry factorRegistry;
    private final LifecycleClassifier lifecycleClassifier;
    private final WeightAdjuster weightAdjuster;
    private final ScoreAggregator scoreAggregator;
    private final IcScoreProperties properties;

    public ScoringOutcome score(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        LifecycleClassification lifecycle = lifecycleClassifier.classify(snapshot);
        return rescore(ticker, snapshot, sectorStats, lifecycle, Map.of(), null);
    }

    /**
     * Scores with a fixed lifecycle classification, evaluating only the factors in {@code recompute}
     * and carrying the rest over from {@code carried}. A null {@code recompute} evaluates everything.
     */
    public ScoringOutcome rescore(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats,
                                  LifecycleClassification lifecycle, Map<String, FactorResult> carried,
                                  Collection<String> recompute) {
        Map<String, Double> weights = weightAdjuster.adjust(
            factorRegistry.baseWeights(properties.getWeights()), lifecycle.stage());

        List<FactorResult> results = new ArrayList<>(factorRegistry.expectedCount());
        for (FactorCalculator calculator : factorRegistry.all()) {
            FactorResult result;
            if (recompute == null || recompute.contains(calculator.name())) {
                result = evaluate(calculator, ticker, snapshot, sectorStats);
            } else {
                result = carried.getOrDefault(calculator.name(),
                    FactorResult.notComputable(calculator.name(), calculator.category()));
            }
            results.add(result.withWeight(weights.getOrDefault(calculator.name(), 0.0)));
        }

        AggregateScore aggregate = scoreAggregator.aggregate(results, weights);
        return new ScoringOutcome(ticker, snapshot.sector(), snapshot.asOfDate(), lifecycle, weights, results, aggregate);
    }

    /**
     * A calculator that blows up on bad data loses only its own factor.
     */
    private FactorResult evaluate(FactorCalculator calculator, String ticker, MetricSnapshot snapshot,
                                  SectorStatisticsSnapshot sectorStats) {
        try {
            return calculator.calculate(ticker, snapshot, sectorStats);
        } catch (LookAheadViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("⚠️ Factor {} failed for {}: {}", calculator.name(), ticker, e.getMessage());
            return FactorResult.notComputable(calculator.name(), calculator.category());
        }
    }
}

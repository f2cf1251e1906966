package tw.gc.icscore.services.scoring;

import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.services.lifecycle.LifecycleClassification;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Result of one pass of the scoring chain for one ticker, before smoothing and persistence.
 */
public record ScoringOutcome(
    String ticker,
    String sector,
    LocalDate asOfDate,
    LifecycleClassification lifecycle,
    Map<String, Double> weights,
    List<FactorResult> factorResults,
    AggregateScore aggregate
) {

    public ScoringOutcome {
        weights = Map.copyOf(weights);
        factorResults = List.copyOf(factorResults);
    }
}

package tw.gc.icscore.services.backtest;

import tw.gc.icscore.enums.PortfolioWeighting;
import tw.gc.icscore.enums.RebalanceFrequency;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregated decile backtest.
 *
 * @param topMinusBottomSpread annualized return of decile 10 minus decile 1
 * @param monotonicityPct      share of the nine adjacent decile pairs where the higher decile returned at least as much
 * @param hitRatePct           share of periods where deciles 6-10 beat deciles 1-5 on average
 * @param informationRatio     mean excess return of decile 10 over the benchmark divided by its standard deviation;
 *                             null without at least two benchmarked periods
 */
public record BacktestReport(
    String runId,
    LocalDate startDate,
    LocalDate endDate,
    RebalanceFrequency frequency,
    PortfolioWeighting weighting,
    int periodsEvaluated,
    int periodsSkipped,
    List<DecilePerformance> deciles,
    double topMinusBottomSpread,
    double monotonicityPct,
    double hitRatePct,
    Double informationRatio,
    Double benchmarkAnnualizedReturn
) {

    public BacktestReport {
        deciles = deciles == null ? List.of() : List.copyOf(deciles);
    }

    public DecilePerformance decile(int decile) {
        return deciles.stream()
            .filter(d -> d.decile() == decile)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No decile " + decile + " in report " + runId));
    }
}

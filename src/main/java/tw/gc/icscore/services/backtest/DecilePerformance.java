package tw.gc.icscore.services.backtest;

/**
 * Performance of one decile across all evaluated periods. Returns are fractions, net of costs.
 *
 * @param maxDrawdown largest peak-to-trough fall of the compounded curve, as a positive fraction
 * @param sharpeRatio mean period return over its sample standard deviation, annualized by the rebalance frequency
 */
public record DecilePerformance(
    int decile,
    int periods,
    double totalReturn,
    double annualizedReturn,
    double averagePeriodReturn,
    double sharpeRatio,
    double maxDrawdown,
    double averageTurnover,
    double averageHoldings
) {
}

package tw.gc.icscore.services.backtest;

import tw.gc.icscore.enums.PortfolioWeighting;
import tw.gc.icscore.enums.RebalanceFrequency;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * @param benchmarkLevels benchmark index level by date, supplied by the caller; may be empty
 * @param universe        tickers to consider; null means every ticker known on each rebalance date
 */
public record BacktestRequest(
    LocalDate startDate,
    LocalDate endDate,
    RebalanceFrequency frequency,
    PortfolioWeighting weighting,
    NavigableMap<LocalDate, Double> benchmarkLevels,
    List<String> universe
) {

    public BacktestRequest {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (!endDate.isAfter(startDate)) {
            throw new IllegalArgumentException("endDate " + endDate + " must be after startDate " + startDate);
        }
        if (frequency == null) {
            throw new IllegalArgumentException("frequency is required");
        }
        weighting = weighting == null ? PortfolioWeighting.EQUAL : weighting;
        benchmarkLevels = benchmarkLevels == null
            ? new TreeMap<>()
            : new TreeMap<>(benchmarkLevels);
        universe = universe == null ? null : List.copyOf(universe);
    }

    public static BacktestRequest of(LocalDate startDate, LocalDate endDate, RebalanceFrequency frequency) {
        return new BacktestRequest(startDate, endDate, frequency, PortfolioWeighting.EQUAL, null, null);
    }

    public BacktestRequest withBenchmark(NavigableMap<LocalDate, Double> levels) {
        return new BacktestRequest(startDate, endDate, frequency, weighting, levels, universe);
    }

    public BacktestRequest withUniverse(Collection<String> tickers) {
        return new BacktestRequest(startDate, endDate, frequency, weighting, benchmarkLevels, List.copyOf(tickers));
    }

    public BacktestRequest withWeighting(PortfolioWeighting mode) {
        return new BacktestRequest(startDate, endDate, frequency, mode, benchmarkLevels, universe);
    }

    /**
     * Benchmark return between two dates using the last level on or before each, or null if either is unknown.
     */
    public Double benchmarkReturn(LocalDate from, LocalDate to) {
        Map.Entry<LocalDate, Double> start = benchmarkLevels.floorEntry(from);
        Map.Entry<LocalDate, Double> end = benchmarkLevels.floorEntry(to);
        if (start == null || end == null || start.getValue() == null || end.getValue() == null || start.getValue() <= 0) {
            return null;
        }
        return end.getValue() / start.getValue() - 1.0;
    }
}

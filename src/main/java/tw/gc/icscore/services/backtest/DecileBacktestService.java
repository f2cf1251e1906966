package tw.gc.icscore.services.backtest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.BacktestPeriodResult;
import tw.gc.icscore.enums.PortfolioWeighting;
import tw.gc.icscore.enums.RebalanceFrequency;
import tw.gc.icscore.exceptions.LookAheadViolationException;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricRepository;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.providers.PointInTimeMetricRepository;
import tw.gc.icscore.repositories.BacktestPeriodResultRepository;
import tw.gc.icscore.services.scoring.ScoringOutcome;
import tw.gc.icscore.services.scoring.ScoringPipeline;
import tw.gc.icscore.services.statistics.SectorStatisticsService;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * DecileBacktestService
 *
 * Replays the scoring chain at each rebalance date, splits the scored universe into ten equal
 * buckets (decile 10 holds the highest scores) and measures each bucket's return to the next
 * rebalance date.
 *
 * <p>Every read made while scoring goes through a {@link PointInTimeMetricRepository} capped at
 * the rebalance date, so any future-dated metric throws instead of leaking into the score. Only
 * the realized forward prices are read past that date. Backtests rank raw (unsmoothed) scores.
 *
 * <p>Periods are independent and run in parallel; turnover and costs are applied afterwards in
 * period order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecileBacktestService {

    public static final int DECILES = 10;

    private final MetricRepository metricRepository;
    private final SectorStatisticsService sectorStatisticsService;
    private final ScoringPipeline scoringPipeline;
    private final BacktestPeriodResultRepository periodResultRepository;
    private final IcScoreProperties properties;

    public BacktestReport runBacktest(LocalDate startDate, LocalDate endDate, RebalanceFrequency frequency) {
        return runBacktest(BacktestRequest.of(startDate, endDate, frequency));
    }

    public BacktestReport runBacktest(BacktestRequest request) {
        String runId = generateBacktestRunId();
        List<RebalancePeriod> periods = RebalancePeriod.between(request.startDate(), request.endDate(), request.frequency());
        int poolSize = properties.effectivePoolSize(properties.getBacktest().getPoolSize());
        log.info("🔬 Backtest {}: {} {} periods from {} to {}, {} weighting, {} workers",
            runId, periods.size(), request.frequency(), request.startDate(), request.endDate(), request.weighting(), poolSize);

        List<PeriodEvaluation> evaluations = evaluateAll(periods, request, poolSize);
        List<PeriodEvaluation> evaluated = evaluations.stream().filter(e -> !e.skipped()).toList();
        int skipped = evaluations.size() - evaluated.size();

        List<BacktestPeriodResult> rows = buildPeriodRows(runId, evaluated, request);
        periodResultRepository.saveAll(rows);

        BacktestReport report = summarize(runId, request, evaluated, skipped, rows);
        log.info("✅ Backtest {} done: {} periods evaluated, {} skipped, D10-D1 spread {}, monotonicity {}%",
            runId, report.periodsEvaluated(), report.periodsSkipped(),
            String.format("%.4f", report.topMinusBottomSpread()), String.format("%.1f", report.monotonicityPct()));
        return report;
    }

    private List<PeriodEvaluation> evaluateAll(List<RebalancePeriod> periods, BacktestRequest request, int poolSize) {
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<CompletableFuture<PeriodEvaluation>> futures = periods.stream()
                .map(period -> CompletableFuture.supplyAsync(() -> evaluatePeriod(period, request), executor))
                .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof LookAheadViolationException violation) {
                log.error("❌ Backtest aborted: {}", violation.getMessage());
                throw violation;
            }
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    PeriodEvaluation evaluatePeriod(RebalancePeriod period, BacktestRequest request) {
        LocalDate asOf = period.start();
        MetricRepository pointInTime = new PointInTimeMetricRepository(metricRepository, asOf);
        SectorStatisticsSnapshot sectorStats = sectorStatisticsService.buildSnapshot(pointInTime, asOf);

        List<ScoredTicker> scored = new ArrayList<>();
        for (String ticker : universe(request, pointInTime, asOf)) {
            MetricSnapshot snapshot;
            try {
                snapshot = pointInTime.getTickerFundamentals(ticker, asOf);
            } catch (MetricRepositoryException e) {
                log.warn("⚠️ {} unavailable for period {}: {}", ticker, asOf, e.getMessage());
                continue;
            }
            ScoringOutcome outcome = scoringPipeline.score(ticker, snapshot, sectorStats);
            if (outcome.aggregate().isDisplayable()) {
                scored.add(new ScoredTicker(ticker, outcome.aggregate().overallScore(), snapshot.value(MetricNames.MARKET_CAP)));
            }
        }

        int minimum = Math.max(DECILES, properties.getBacktest().getMinScoredTickers());
        if (scored.size() < minimum) {
            log.warn("⚠️ Skipping period {} to {}: only {} scored tickers", period.start(), period.end(), scored.size());
            return PeriodEvaluation.skipped(period, scored.size());
        }

        scored.sort(Comparator.comparingDouble(ScoredTicker::score).thenComparing(ScoredTicker::ticker));
        Map<Integer, List<ScoredTicker>> buckets = new HashMap<>();
        int n = scored.size();
        for (int i = 0; i < n; i++) {
            int decile = i * DECILES / n + 1;
            buckets.computeIfAbsent(decile, d -> new ArrayList<>()).add(scored.get(i));
        }

        List<DecileHolding> holdings = new ArrayList<>(DECILES);
        for (int decile = 1; decile <= DECILES; decile++) {
            holdings.add(holdDecile(decile, buckets.getOrDefault(decile, List.of()), period, request.weighting()));
        }
        return new PeriodEvaluation(period, holdings, scored.size(), request.benchmarkReturn(period.start(), period.end()), false);
    }

    private List<String> universe(BacktestRequest request, MetricRepository pointInTime, LocalDate asOf) {
        if (request.universe() != null) {
            return request.universe();
        }
        Set<String> tickers = new TreeSet<>();
        for (String sector : pointInTime.listSectors(asOf)) {
            try {
                pointInTime.getSectorUniverse(sector, asOf).forEach(s -> tickers.add(s.ticker()));
            } catch (MetricRepositoryException e) {
                log.warn("⚠️ Sector {} unavailable for period {}: {}", sector, asOf, e.getMessage());
            }
        }
        return new ArrayList<>(tickers);
    }

    /**
     * Forward return from the rebalance date to the next. Holdings without both prices are left
     * out of the average; capitalization weighting falls back to equal weights without any known cap.
     */
    private DecileHolding holdDecile(int decile, List<ScoredTicker> members, RebalancePeriod period,
                                     PortfolioWeighting weighting) {
        double weightedReturn = 0.0;
        double totalWeight = 0.0;
        double equalSum = 0.0;
        int priced = 0;

        for (ScoredTicker member : members) {
            Optional<Double> forward = forwardReturn(member.ticker(), period);
            if (forward.isEmpty()) {
                continue;
            }
            priced++;
            equalSum += forward.get();
            if (weighting == PortfolioWeighting.MARKET_CAP && member.marketCap() != null && member.marketCap() > 0) {
                weightedReturn += forward.get() * member.marketCap();
                totalWeight += member.marketCap();
            }
        }

        double grossReturn;
        if (priced == 0) {
            grossReturn = 0.0;
        } else if (weighting == PortfolioWeighting.MARKET_CAP && totalWeight > 0) {
            grossReturn = weightedReturn / totalWeight;
        } else {
            grossReturn = equalSum / priced;
        }

        double avgScore = members.stream().mapToDouble(ScoredTicker::score).average().orElse(0.0);
        List<String> tickers = members.stream().map(ScoredTicker::ticker).toList();
        return new DecileHolding(decile, tickers, grossReturn, avgScore, priced);
    }

    private Optional<Double> forwardReturn(String ticker, RebalancePeriod period) {
        try {
            Optional<Double> entry = metricRepository.getPriceAsOf(ticker, period.start());
            Optional<Double> exit = metricRepository.getPriceAsOf(ticker, period.end());
            if (entry.isEmpty() || exit.isEmpty() || entry.get() <= 0) {
                return Optional.empty();
            }
            return Optional.of(exit.get() / entry.get() - 1.0);
        } catch (MetricRepositoryException e) {
            log.debug("No forward price for {} over {}: {}", ticker, period, e.getMessage());
            return Optional.empty();
        }
    }

    private List<BacktestPeriodResult> buildPeriodRows(String runId, List<PeriodEvaluation> evaluated, BacktestRequest request) {
        double costRate = (properties.getBacktest().getTransactionCostBps() + properties.getBacktest().getSlippageBps()) / 10_000.0;
        Map<Integer, Set<String>> previousHoldings = new HashMap<>();
        List<BacktestPeriodResult> rows = new ArrayList<>();

        for (PeriodEvaluation evaluation : evaluated) {
            for (DecileHolding holding : evaluation.holdings()) {
                Set<String> current = new HashSet<>(holding.tickers());
                Set<String> before = previousHoldings.get(holding.decile());
                double turnover = turnover(before, current);
                double net = holding.grossReturn() - costRate * turnover;
                Double benchmark = evaluation.benchmarkReturn();

                rows.add(BacktestPeriodResult.builder()
                    .backtestRunId(runId)
                    .periodStart(evaluation.period().start())
                    .periodEnd(evaluation.period().end())
                    .decile(holding.decile())
                    .holdings(String.join(",", holding.tickers()))
                    .holdingCount(holding.tickers().size())
                    .periodReturn(net)
                    .benchmarkReturn(benchmark)
                    .excessReturn(benchmark == null ? null : net - benchmark)
                    .avgScore(holding.avgScore())
                    .turnover(turnover)
                    .build());
                previousHoldings.put(holding.decile(), current);
            }
        }
        return rows;
    }

    /**
     * Share of current holdings that are new to the decile; a first period is fully bought in.
     */
    static double turnover(Set<String> previous, Set<String> current) {
        if (current.isEmpty()) {
            return 0.0;
        }
        if (previous == null) {
            return 1.0;
        }
        long added = current.stream().filter(t -> !previous.contains(t)).count();
        return (double) added / current.size();
    }

    private BacktestReport summarize(String runId, BacktestRequest request, List<PeriodEvaluation> evaluated,
                                     int skipped, List<BacktestPeriodResult> rows) {
        if (evaluated.isEmpty()) {
            log.warn("⚠️ Backtest {} evaluated no periods", runId);
            return new BacktestReport(runId, request.startDate(), request.endDate(), request.frequency(),
                request.weighting(), 0, skipped, List.of(), 0.0, 0.0, 0.0, null, null);
        }

        LocalDate firstStart = evaluated.get(0).period().start();
        LocalDate lastEnd = evaluated.get(evaluated.size() - 1).period().end();
        double years = ChronoUnit.DAYS.between(firstStart, lastEnd) / BacktestStatistics.DAYS_PER_YEAR;

        Map<Integer, List<BacktestPeriodResult>> byDecile = new HashMap<>();
        for (BacktestPeriodResult row : rows) {
            byDecile.computeIfAbsent(row.getDecile(), d -> new ArrayList<>()).add(row);
        }

        List<DecilePerformance> performance = new ArrayList<>(DECILES);
        for (int decile = 1; decile <= DECILES; decile++) {
            List<BacktestPeriodResult> decileRows = byDecile.getOrDefault(decile, List.of());
            List<Double> returns = decileRows.stream().map(BacktestPeriodResult::getPeriodReturn).toList();
            double total = BacktestStatistics.compound(returns);
            performance.add(new DecilePerformance(
                decile,
                returns.size(),
                total,
                BacktestStatistics.annualize(total, years),
                BacktestStatistics.mean(returns),
                BacktestStatistics.sharpe(returns, request.frequency().getPeriodsPerYear()),
                BacktestStatistics.maxDrawdown(returns),
                decileRows.stream().mapToDouble(BacktestPeriodResult::getTurnover).average().orElse(0.0),
                decileRows.stream().mapToInt(BacktestPeriodResult::getHoldingCount).average().orElse(0.0)));
        }

        double spread = performance.get(DECILES - 1).annualizedReturn() - performance.get(0).annualizedReturn();

        int monotonicPairs = 0;
        for (int i = 0; i < DECILES - 1; i++) {
            if (performance.get(i + 1).annualizedReturn() >= performance.get(i).annualizedReturn()) {
                monotonicPairs++;
            }
        }
        double monotonicity = monotonicPairs * 100.0 / (DECILES - 1);

        int hits = 0;
        List<Double> excess = new ArrayList<>();
        List<Double> benchmarkReturns = new ArrayList<>();
        for (PeriodEvaluation evaluation : evaluated) {
            List<BacktestPeriodResult> periodRows = rows.stream()
                .filter(r -> r.getPeriodStart().equals(evaluation.period().start()))
                .toList();
            double bottomHalf = periodRows.stream().filter(r -> r.getDecile() <= DECILES / 2)
                .mapToDouble(BacktestPeriodResult::getPeriodReturn).average().orElse(0.0);
            double topHalf = periodRows.stream().filter(r -> r.getDecile() > DECILES / 2)
                .mapToDouble(BacktestPeriodResult::getPeriodReturn).average().orElse(0.0);
            if (topHalf > bottomHalf) {
                hits++;
            }
            periodRows.stream()
                .filter(r -> r.getDecile() == DECILES && r.getExcessReturn() != null)
                .forEach(r -> excess.add(r.getExcessReturn()));
            if (evaluation.benchmarkReturn() != null) {
                benchmarkReturns.add(evaluation.benchmarkReturn());
            }
        }
        double hitRate = hits * 100.0 / evaluated.size();
        Double benchmarkAnnualized = benchmarkReturns.isEmpty()
            ? null
            : BacktestStatistics.annualize(BacktestStatistics.compound(benchmarkReturns), years);

        return new BacktestReport(runId, request.startDate(), request.endDate(), request.frequency(),
            request.weighting(), evaluated.size(), skipped, performance, spread, monotonicity, hitRate,
            BacktestStatistics.informationRatio(excess), benchmarkAnnualized);
    }

    private String generateBacktestRunId() {
        return "ICB-" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"))
            + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    record ScoredTicker(String ticker, double score, Double marketCap) {
    }

    record DecileHolding(int decile, List<String> tickers, double grossReturn, double avgScore, int pricedCount) {
    }

    record PeriodEvaluation(RebalancePeriod period, List<DecileHolding> holdings, int scoredTickers,
                            Double benchmarkReturn, boolean skipped) {

        static PeriodEvaluation skipped(RebalancePeriod period, int scoredTickers) {
            return new PeriodEvaluation(period, List.of(), scoredTickers, null, true);
        }
    }
}

package tw.gc.icscore.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.IcScoreRecord;
import tw.gc.icscore.entities.ScoreEvent;
import tw.gc.icscore.enums.ScoreRunType;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.providers.MetricRepository;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.providers.ScoreEventSource;
import tw.gc.icscore.repositories.IcScoreRecordRepository;
import tw.gc.icscore.services.lifecycle.LifecycleClassification;
import tw.gc.icscore.services.scoring.ScoreStabilizer;
import tw.gc.icscore.services.scoring.ScoringOutcome;
import tw.gc.icscore.services.scoring.ScoringPipeline;
import tw.gc.icscore.services.scoring.StabilizedScore;
import tw.gc.icscore.services.statistics.SectorStatisticsService;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * IcScoreService
 *
 * Entry points for an external scheduler:
 * <ul>
 *   <li>{@link #runDailyBatch(LocalDate)}: after market close, the whole universe</li>
 *   <li>{@link #runFullScore(String)}: one ticker, every factor</li>
 *   <li>{@link #runPriceSensitiveRefresh(String)}: intraday, price-driven factors only</li>
 * </ul>
 * Every run appends a new {@link IcScoreRecord}; earlier records are never touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IcScoreService {

    private final MetricRepository metricRepository;
    private final ScoreEventSource scoreEventSource;
    private final SectorStatisticsService sectorStatisticsService;
    private final ScoringPipeline scoringPipeline;
    private final ScoreStabilizer scoreStabilizer;
    private final ScoreExplainer scoreExplainer;
    private final SectorRankingService sectorRankingService;
    private final IcScoreRecordRepository recordRepository;
    private final IcScoreRecordMapper recordMapper;
    private final IcScoreProperties properties;

    public IcScoreRecord runFullScore(String ticker) {
        return runFullScore(ticker, LocalDate.now());
    }

    public IcScoreRecord runFullScore(String ticker, LocalDate asOfDate) {
        SectorStatisticsSnapshot sectorStats = sectorStatisticsService.precompute(asOfDate);
        IcScoreRecord record = scoreTicker(ticker, asOfDate, sectorStats);
        sectorRankingService.rankAgainstPeers(record);
        IcScoreRecord saved = recordRepository.save(record);
        log.info("🎯 {} IC Score {} ({}, {})", ticker, saved.getOverallScore(), saved.getConfidenceLevel(), saved.getLifecycleStage());
        return saved;
    }

    public IcScoreRecord runPriceSensitiveRefresh(String ticker) {
        return runPriceSensitiveRefresh(ticker, LocalDate.now());
    }

    /**
     * Recomputes only the price-driven factors and carries the previous record's other factor results
     * and lifecycle stage forward. Falls back to a full score when there is nothing to carry.
     */
    public IcScoreRecord runPriceSensitiveRefresh(String ticker, LocalDate asOfDate) {
        Optional<IcScoreRecord> previous = recordRepository.findFirstByTickerOrderByCalculatedAtDescIdDesc(ticker);
        Map<String, FactorResult> carried = previous.map(recordMapper::readFactorResults).orElse(Map.of());
        if (previous.isEmpty() || carried.isEmpty()) {
            log.info("No previous factor results for {}, running full score instead", ticker);
            return runFullScore(ticker, asOfDate);
        }

        IcScoreRecord prior = previous.get();
        SectorStatisticsSnapshot sectorStats = sectorStatisticsService.latestOnOrBefore(asOfDate);
        MetricSnapshot snapshot = loadFundamentals(ticker, asOfDate, prior.getSector());
        LifecycleClassification lifecycle = new LifecycleClassification(
            prior.getLifecycleStage(),
            prior.getLifecycleConfidence() == null ? 0.0 : prior.getLifecycleConfidence(),
            Map.of());

        ScoringOutcome outcome = scoringPipeline.rescore(
            ticker, snapshot, sectorStats, lifecycle, carried, FactorNames.PRICE_SENSITIVE);
        IcScoreRecord record = finish(outcome, previous, ScoreRunType.PRICE_REFRESH);
        sectorRankingService.rankAgainstPeers(record);
        return recordRepository.save(record);
    }

    /**
     * Explanation of the ticker's latest score change, with its factor-level drivers.
     */
    public Optional<ScoreExplanation> latestExplanation(String ticker) {
        return recordRepository.findFirstByTickerOrderByCalculatedAtDescIdDesc(ticker)
            .map(recordMapper::readExplanation);
    }

    public BatchRunSummary runDailyBatch(LocalDate asOfDate) {
        return runDailyBatch(asOfDate, discoverTickers(asOfDate));
    }

    /**
     * Sector statistics first (the barrier), then every ticker on a fixed pool. A ticker that throws
     * or times out is logged and skipped; its siblings carry on.
     */
    public BatchRunSummary runDailyBatch(LocalDate asOfDate, Collection<String> tickers) {
        long started = System.currentTimeMillis();
        SectorStatisticsSnapshot sectorStats = sectorStatisticsService.precompute(asOfDate);

        int poolSize = properties.effectivePoolSize(properties.getScoring().getPoolSize());
        long timeoutSeconds = properties.getScoring().getTickerTimeoutSeconds();
        log.info("🚀 Daily IC Score batch for {}: {} tickers on {} workers", asOfDate, tickers.size(), poolSize);

        Map<String, IcScoreRecord> scored = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            Map<String, CompletableFuture<IcScoreRecord>> futures = new LinkedHashMap<>();
            for (String ticker : tickers) {
                futures.put(ticker, CompletableFuture.supplyAsync(() -> scoreTicker(ticker, asOfDate, sectorStats), executor));
            }

            for (Map.Entry<String, CompletableFuture<IcScoreRecord>> entry : futures.entrySet()) {
                String ticker = entry.getKey();
                try {
                    scored.put(ticker, entry.getValue().get(timeoutSeconds, TimeUnit.SECONDS));
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    log.error("❌ Scoring timed out for {} after {}s", ticker, timeoutSeconds);
                    failed.add(ticker);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("❌ Scoring failed for {}: {}", ticker, cause.getMessage(), cause);
                    failed.add(ticker);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Daily IC Score batch interrupted", e);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        scored.values().stream()
            .filter(r -> r.getSector() != null)
            .collect(Collectors.groupingBy(IcScoreRecord::getSector))
            .values()
            .forEach(sectorRankingService::rank);
        recordRepository.saveAll(scored.values());

        int insufficient = (int) scored.values().stream().filter(r -> !r.hasDisplayableScore()).count();
        BatchRunSummary summary = new BatchRunSummary(asOfDate, tickers.size(), scored.size(), insufficient,
            failed, System.currentTimeMillis() - started);
        log.info("✅ Daily IC Score batch for {} done: {} scored, {} insufficient, {} failed in {} ms",
            asOfDate, summary.scored(), summary.insufficient(), summary.failed(), summary.elapsedMillis());
        return summary;
    }

    IcScoreRecord scoreTicker(String ticker, LocalDate asOfDate, SectorStatisticsSnapshot sectorStats) {
        Optional<IcScoreRecord> previous = recordRepository.findFirstByTickerOrderByCalculatedAtDescIdDesc(ticker);
        MetricSnapshot snapshot = loadFundamentals(ticker, asOfDate, previous.map(IcScoreRecord::getSector).orElse(null));
        ScoringOutcome outcome = scoringPipeline.score(ticker, snapshot, sectorStats);
        return finish(outcome, previous, ScoreRunType.FULL);
    }

    private IcScoreRecord finish(ScoringOutcome outcome, Optional<IcScoreRecord> previous, ScoreRunType runType) {
        String ticker = outcome.ticker();
        Double previousDisplayed = previous
            .filter(IcScoreRecord::hasDisplayableScore)
            .map(IcScoreRecord::getOverallScore)
            .orElse(null);

        StabilizedScore stabilized = null;
        if (outcome.aggregate().isDisplayable()) {
            List<ScoreEvent> events = previousDisplayed == null
                ? List.of()
                : loadEvents(ticker, eventWindowStart(previous.get().getAsOfDate(), outcome.asOfDate()));
            stabilized = scoreStabilizer.stabilize(outcome.aggregate().overallScore(), previousDisplayed, events);
        }

        ScoreExplanation explanation = scoreExplainer.explain(
            ticker,
            previousDisplayed,
            previous.map(recordMapper::readFactorResults).orElse(Map.of()),
            stabilized == null ? null : stabilized.score(),
            outcome.factorResults());

        return recordMapper.toRecord(outcome, stabilized,
            previous.map(IcScoreRecord::getOverallScore).orElse(null), runType, explanation);
    }

    /**
     * Events after the previous record's date count; a same-day rerun looks at the current day only.
     */
    static LocalDate eventWindowStart(LocalDate previousAsOf, LocalDate asOfDate) {
        if (previousAsOf == null || !previousAsOf.isBefore(asOfDate)) {
            return asOfDate;
        }
        return previousAsOf.plusDays(1);
    }

    private MetricSnapshot loadFundamentals(String ticker, LocalDate asOfDate, String knownSector) {
        try {
            MetricSnapshot snapshot = metricRepository.getTickerFundamentals(ticker, asOfDate);
            if (snapshot.sector() == null && knownSector != null) {
                return new MetricSnapshot(ticker, knownSector, asOfDate, snapshot.metrics(), snapshot.history());
            }
            return snapshot;
        } catch (MetricRepositoryException e) {
            log.warn("⚠️ Metrics unavailable for {} as of {}: {}", ticker, asOfDate, e.getMessage());
            return MetricSnapshot.empty(ticker, knownSector, asOfDate);
        }
    }

    private List<ScoreEvent> loadEvents(String ticker, LocalDate since) {
        try {
            return scoreEventSource.getEventsSince(ticker, since);
        } catch (MetricRepositoryException e) {
            log.warn("⚠️ Events unavailable for {} since {}, smoothing normally: {}", ticker, since, e.getMessage());
            return List.of();
        }
    }

    private List<String> discoverTickers(LocalDate asOfDate) {
        TreeSet<String> tickers = new TreeSet<>();
        for (String sector : metricRepository.listSectors(asOfDate)) {
            try {
                metricRepository.getSectorUniverse(sector, asOfDate).stream()
                    .map(MetricSnapshot::ticker)
                    .filter(Objects::nonNull)
                    .forEach(tickers::add);
            } catch (MetricRepositoryException e) {
                log.warn("⚠️ Skipping sector {} for {}: {}", sector, asOfDate, e.getMessage());
            }
        }
        return new ArrayList<>(tickers);
    }
}

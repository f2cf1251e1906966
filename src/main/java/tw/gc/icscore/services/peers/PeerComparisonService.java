package tw.gc.icscore.services.peers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.IcScoreRecord;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricRepository;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.repositories.IcScoreRecordRepository;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PeerComparisonService
 *
 * Finds the companies most like a ticker inside its sector and sets their latest IC Scores beside
 * its own. Candidates must fall inside the configured market-cap band; the rest are ordered by a
 * weighted similarity over market cap, revenue growth, net margin and P/E.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeerComparisonService {

    static final double MARKET_CAP_WEIGHT = 0.30;
    static final double REVENUE_GROWTH_WEIGHT = 0.20;
    static final double NET_MARGIN_WEIGHT = 0.20;
    static final double PE_RATIO_WEIGHT = 0.15;

    /** Percentage-point gaps at which growth and margin similarity reach zero */
    static final double REVENUE_GROWTH_SPAN = 50.0;
    static final double NET_MARGIN_SPAN = 30.0;

    static final double NEUTRAL_SIMILARITY = 0.5;

    private final MetricRepository metricRepository;
    private final IcScoreRecordRepository recordRepository;
    private final IcScoreProperties properties;

    public Optional<PeerComparison> compare(String ticker, LocalDate asOfDate) {
        return compare(ticker, asOfDate, properties.getPeers().getDefaultCount());
    }

    public Optional<PeerComparison> compare(String ticker, LocalDate asOfDate, int limit) {
        MetricSnapshot target;
        List<MetricSnapshot> universe;
        try {
            target = metricRepository.getTickerFundamentals(ticker, asOfDate);
            if (target.sector() == null) {
                log.warn("⚠️ No sector for {}, cannot pick peers", ticker);
                return Optional.empty();
            }
            universe = metricRepository.getSectorUniverse(target.sector(), asOfDate);
        } catch (MetricRepositoryException e) {
            log.warn("⚠️ Peer data unavailable for {} as of {}: {}", ticker, asOfDate, e.getMessage());
            return Optional.empty();
        }

        Double marketCap = target.value(MetricNames.MARKET_CAP);
        if (marketCap == null || marketCap <= 0) {
            log.warn("⚠️ No market cap for {}, cannot pick peers", ticker);
            return Optional.empty();
        }
        double minCap = marketCap * properties.getPeers().getMarketCapMinRatio();
        double maxCap = marketCap * properties.getPeers().getMarketCapMaxRatio();

        Optional<IcScoreRecord> targetRecord = recordRepository.findFirstByTickerOrderByCalculatedAtDescIdDesc(ticker);
        Double targetScore = targetRecord.filter(IcScoreRecord::hasDisplayableScore)
            .map(IcScoreRecord::getOverallScore)
            .orElse(null);

        List<PeerScore> peers = universe.stream()
            .filter(candidate -> !ticker.equals(candidate.ticker()))
            .filter(candidate -> {
                Double cap = candidate.value(MetricNames.MARKET_CAP);
                return cap != null && cap >= minCap && cap <= maxCap;
            })
            .map(candidate -> new Candidate(candidate, similarity(target, candidate)))
            .sorted(Comparator.comparingDouble((Candidate c) -> c.similarity().total()).reversed()
                .thenComparing(c -> c.snapshot().ticker()))
            .limit(Math.max(0, limit))
            .map(candidate -> toPeerScore(candidate, targetScore))
            .toList();

        log.debug("Found {} peers for {} in {}", peers.size(), ticker, target.sector());
        return Optional.of(new PeerComparison(
            ticker,
            target.sector(),
            targetScore,
            peers,
            targetRecord.map(IcScoreRecord::getSectorRank).orElse(null),
            targetRecord.map(IcScoreRecord::getSectorSize).orElse(null),
            targetRecord.map(IcScoreRecord::getSectorPercentile).orElse(null)));
    }

    private PeerScore toPeerScore(Candidate candidate, Double targetScore) {
        String peer = candidate.snapshot().ticker();
        Double peerScore = recordRepository.findFirstByTickerOrderByCalculatedAtDescIdDesc(peer)
            .filter(IcScoreRecord::hasDisplayableScore)
            .map(IcScoreRecord::getOverallScore)
            .orElse(null);
        Double delta = peerScore == null || targetScore == null ? null : peerScore - targetScore;
        return new PeerScore(peer, candidate.snapshot().value(MetricNames.MARKET_CAP),
            candidate.similarity().total(), candidate.similarity().factors(), peerScore, delta);
    }

    /**
     * Weighted mean over the dimensions both companies report; neutral when they share none.
     */
    static Similarity similarity(MetricSnapshot target, MetricSnapshot candidate) {
        Map<String, Double> factors = new LinkedHashMap<>();
        double weighted = 0.0;
        double totalWeight = 0.0;

        Double capA = target.value(MetricNames.MARKET_CAP);
        Double capB = candidate.value(MetricNames.MARKET_CAP);
        if (capA != null && capB != null && capA > 0 && capB > 0) {
            // a tenfold gap scores zero
            double sim = Math.max(0.0, 1.0 - Math.abs(Math.log10(capB / capA)));
            factors.put(MetricNames.MARKET_CAP, sim);
            weighted += sim * MARKET_CAP_WEIGHT;
            totalWeight += MARKET_CAP_WEIGHT;
        }

        Double growthA = target.value(MetricNames.REVENUE_GROWTH_YOY);
        Double growthB = candidate.value(MetricNames.REVENUE_GROWTH_YOY);
        if (growthA != null && growthB != null) {
            double sim = Math.max(0.0, 1.0 - Math.abs(growthA - growthB) / REVENUE_GROWTH_SPAN);
            factors.put(MetricNames.REVENUE_GROWTH_YOY, sim);
            weighted += sim * REVENUE_GROWTH_WEIGHT;
            totalWeight += REVENUE_GROWTH_WEIGHT;
        }

        Double marginA = target.value(MetricNames.NET_MARGIN);
        Double marginB = candidate.value(MetricNames.NET_MARGIN);
        if (marginA != null && marginB != null) {
            double sim = Math.max(0.0, 1.0 - Math.abs(marginA - marginB) / NET_MARGIN_SPAN);
            factors.put(MetricNames.NET_MARGIN, sim);
            weighted += sim * NET_MARGIN_WEIGHT;
            totalWeight += NET_MARGIN_WEIGHT;
        }

        Double peA = target.value(MetricNames.PE_RATIO);
        Double peB = candidate.value(MetricNames.PE_RATIO);
        if (peA != null && peB != null && peA > 0 && peB > 0) {
            // a threefold gap scores zero
            double ratio = Math.max(peA, peB) / Math.min(peA, peB);
            double sim = Math.max(0.0, 1.0 - (ratio - 1.0) / 2.0);
            factors.put(MetricNames.PE_RATIO, sim);
            weighted += sim * PE_RATIO_WEIGHT;
            totalWeight += PE_RATIO_WEIGHT;
        }

        double total = totalWeight > 0 ? weighted / totalWeight : NEUTRAL_SIMILARITY;
        return new Similarity(total, factors);
    }

    record Similarity(double total, Map<String, Double> factors) {
    }

    private record Candidate(MetricSnapshot snapshot, Similarity similarity) {
    }
}

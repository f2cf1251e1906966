package tw.gc.icscore.services.statistics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.SectorMetricDistribution;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricRepository;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.providers.MetricValue;
import tw.gc.icscore.repositories.SectorMetricDistributionRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * SectorStatisticsService
 *
 * Builds per-(sector, metric) percentile distributions from the sector universe and serves
 * percentile lookups against them. The daily {@link #precompute(LocalDate)} is the barrier
 * that completes before any ticker is scored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SectorStatisticsService {

    private final MetricRepository metricRepository;
    private final SectorMetricDistributionRepository distributionRepository;
    private final IcScoreProperties properties;

    /**
     * Drops null and non-finite values, clips the rest to mean +/- k population standard deviations,
     * then computes breakpoints on the clipped sample. Identical input always yields identical output.
     */
    public MetricDistribution computeDistribution(String sector, String metric, LocalDate asOfDate, Collection<Double> values) {
        double[] sample = values == null ? new double[0] : values.stream()
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .filter(Double::isFinite)
            .toArray();

        if (sample.length == 0) {
            return MetricDistribution.empty(sector, metric, asOfDate);
        }

        double[] winsorized = winsorize(sample, properties.getSector().getWinsorizeSigma());
        Arrays.sort(winsorized);

        boolean lowConfidence = winsorized.length < properties.getSector().getMinSampleSize();
        return new MetricDistribution(
            sector,
            metric,
            asOfDate,
            winsorized[0],
            percentile(winsorized, 10),
            percentile(winsorized, 25),
            percentile(winsorized, 50),
            percentile(winsorized, 75),
            percentile(winsorized, 90),
            winsorized[winsorized.length - 1],
            mean(winsorized),
            populationStdDev(winsorized),
            winsorized.length,
            lowConfidence
        );
    }

    public double percentileOf(MetricDistribution distribution, double value) {
        return distribution.percentileOf(value);
    }

    /**
     * Computes, persists and returns the day's distributions for every sector. Rows already
     * persisted for the date are reused as-is rather than rewritten.
     */
    @Transactional
    public SectorStatisticsSnapshot precompute(LocalDate asOfDate) {
        List<SectorMetricDistribution> existing = distributionRepository.findByAsOfDate(asOfDate);
        if (!existing.isEmpty()) {
            log.info("📊 Reusing {} sector distributions already computed for {}", existing.size(), asOfDate);
            return toSnapshot(asOfDate, existing.stream().map(MetricDistribution::fromEntity).toList());
        }

        SectorStatisticsSnapshot snapshot = buildSnapshot(metricRepository, asOfDate);
        List<SectorMetricDistribution> rows = new ArrayList<>();
        snapshot.distributions().values().forEach(byMetric -> byMetric.values().forEach(d -> rows.add(d.toEntity())));
        distributionRepository.saveAll(rows);

        log.info("📊 Sector statistics for {}: {} sectors, {} distributions", asOfDate, snapshot.sectorCount(), rows.size());
        return snapshot;
    }

    /**
     * Latest persisted distributions dated on or before {@code asOfDate}, computing them for
     * {@code asOfDate} when none exist yet. Intraday refreshes use this to stay on the daily snapshot.
     */
    @Transactional
    public SectorStatisticsSnapshot latestOnOrBefore(LocalDate asOfDate) {
        return distributionRepository.findLatestAsOfDateOnOrBefore(asOfDate)
            .map(date -> toSnapshot(date, distributionRepository.findByAsOfDate(date).stream()
                .map(MetricDistribution::fromEntity)
                .toList()))
            .orElseGet(() -> precompute(asOfDate));
    }

    /**
     * Builds a snapshot from any metric source without persisting it. Historical replays pass a
     * point-in-time guarded source here.
     */
    public SectorStatisticsSnapshot buildSnapshot(MetricRepository source, LocalDate asOfDate) {
        List<MetricDistribution> all = new ArrayList<>();
        for (String sector : source.listSectors(asOfDate)) {
            List<MetricSnapshot> universe;
            try {
                universe = source.getSectorUniverse(sector, asOfDate);
            } catch (MetricRepositoryException e) {
                log.warn("⚠️ Sector {} universe unavailable for {}: {}", sector, asOfDate, e.getMessage());
                continue;
            }

            Map<String, List<Double>> valuesByMetric = new TreeMap<>();
            for (MetricSnapshot company : universe) {
                for (Map.Entry<String, MetricValue> entry : company.metrics().entrySet()) {
                    if (MetricNames.PRICE.equals(entry.getKey())) {
                        continue;
                    }
                    valuesByMetric.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue().value());
                }
            }

            valuesByMetric.forEach((metric, values) -> {
                MetricDistribution distribution = computeDistribution(sector, metric, asOfDate, values);
                if (distribution.lowConfidence()) {
                    log.debug("Low-confidence distribution {}/{}: {} samples", sector, metric, distribution.sampleCount());
                }
                all.add(distribution);
            });
        }
        return toSnapshot(asOfDate, all);
    }

    private SectorStatisticsSnapshot toSnapshot(LocalDate asOfDate, List<MetricDistribution> distributions) {
        Map<String, Map<String, MetricDistribution>> bySector = new HashMap<>();
        for (MetricDistribution d : distributions) {
            bySector.computeIfAbsent(d.sector(), s -> new HashMap<>()).put(d.metricName(), d);
        }
        return new SectorStatisticsSnapshot(asOfDate, bySector);
    }

    static double[] winsorize(double[] sample, double sigmas) {
        double mean = mean(sample);
        double sd = populationStdDev(sample);
        double[] clipped = sample.clone();
        if (sd == 0.0) {
            return clipped;
        }
        double lower = mean - sigmas * sd;
        double upper = mean + sigmas * sd;
        for (int i = 0; i < clipped.length; i++) {
            clipped[i] = Math.max(lower, Math.min(upper, clipped[i]));
        }
        return clipped;
    }

    /**
     * Linear interpolation between closest ranks on a sorted sample.
     */
    static double percentile(double[] sorted, double pct) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double position = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double interpolated = sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
        return Math.max(sorted[lower], Math.min(sorted[upper], interpolated));
    }

    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double populationStdDev(double[] values) {
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.length);
    }
}

package tw.gc.icscore.services.statistics;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All sector distributions of one date. Built once per run and handed down the scoring chain;
 * historical replays build their own.
 */
public record SectorStatisticsSnapshot(LocalDate asOfDate, Map<String, Map<String, MetricDistribution>> distributions) {

    public SectorStatisticsSnapshot {
        Map<String, Map<String, MetricDistribution>> copy = new HashMap<>();
        if (distributions != null) {
            distributions.forEach((sector, byMetric) -> copy.put(sector, Map.copyOf(byMetric)));
        }
        distributions = Map.copyOf(copy);
    }

    public static SectorStatisticsSnapshot empty(LocalDate asOfDate) {
        return new SectorStatisticsSnapshot(asOfDate, Map.of());
    }

    public Optional<MetricDistribution> find(String sector, String metric) {
        if (sector == null) {
            return Optional.empty();
        }
        Map<String, MetricDistribution> byMetric = distributions.get(sector);
        return byMetric == null ? Optional.empty() : Optional.ofNullable(byMetric.get(metric));
    }

    public int sectorCount() {
        return distributions.size();
    }

    public int distributionCount() {
        return distributions.values().stream().mapToInt(Map::size).sum();
    }
}

package tw.gc.icscore.providers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time view of one ticker's metrics: the latest value of each metric known on
 * {@code asOfDate}, plus dated series for metrics whose own history matters (monthly P/E and P/S).
 */
public record MetricSnapshot(
    String ticker,
    String sector,
    LocalDate asOfDate,
    Map<String, MetricValue> metrics,
    Map<String, List<MetricValue>> history
) {

    public MetricSnapshot {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(asOfDate, "asOfDate");
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        history = history == null ? Map.of() : Map.copyOf(history);
    }

    public static MetricSnapshot empty(String ticker, String sector, LocalDate asOfDate) {
        return new MetricSnapshot(ticker, sector, asOfDate, Map.of(), Map.of());
    }

    /**
     * @return the metric value, or null when absent or not a finite number
     */
    public Double value(String metric) {
        MetricValue v = metrics.get(metric);
        if (v == null || !Double.isFinite(v.value())) {
            return null;
        }
        return v.value();
    }

    public boolean has(String metric) {
        return value(metric) != null;
    }

    public List<Double> series(String metric) {
        return history.getOrDefault(metric, List.of()).stream()
            .map(MetricValue::value)
            .filter(Double::isFinite)
            .toList();
    }

    public int size() {
        return metrics.size();
    }
}

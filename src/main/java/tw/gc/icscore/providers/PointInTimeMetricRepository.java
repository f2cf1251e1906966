package tw.gc.icscore.providers;

import lombok.Getter;
import tw.gc.icscore.exceptions.LookAheadViolationException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Guard for historical replays: every read is capped at a fixed cutoff date.
 *
 * Requests dated after the cutoff, and any returned value observed after the requested date,
 * throw {@link LookAheadViolationException}. Nothing is silently truncated.
 */
public class PointInTimeMetricRepository implements MetricRepository {

    private final MetricRepository delegate;
    @Getter
    private final LocalDate cutoff;

    public PointInTimeMetricRepository(MetricRepository delegate, LocalDate cutoff) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cutoff = Objects.requireNonNull(cutoff, "cutoff");
    }

    @Override
    public List<MetricSnapshot> getSectorUniverse(String sector, LocalDate asOfDate) {
        checkRequest("sector universe " + sector, asOfDate);
        List<MetricSnapshot> universe = delegate.getSectorUniverse(sector, asOfDate);
        universe.forEach(snapshot -> checkSnapshot(snapshot, asOfDate));
        return universe;
    }

    @Override
    public MetricSnapshot getTickerFundamentals(String ticker, LocalDate asOfDate) {
        checkRequest("fundamentals of " + ticker, asOfDate);
        MetricSnapshot snapshot = delegate.getTickerFundamentals(ticker, asOfDate);
        checkSnapshot(snapshot, asOfDate);
        return snapshot;
    }

    @Override
    public List<String> listSectors(LocalDate asOfDate) {
        checkRequest("sector list", asOfDate);
        return delegate.listSectors(asOfDate);
    }

    @Override
    public Optional<Double> getPriceAsOf(String ticker, LocalDate date) {
        checkRequest("price of " + ticker, date);
        return delegate.getPriceAsOf(ticker, date);
    }

    private void checkRequest(String what, LocalDate requested) {
        if (requested.isAfter(cutoff)) {
            throw new LookAheadViolationException(what, cutoff, requested);
        }
    }

    private void checkSnapshot(MetricSnapshot snapshot, LocalDate asOfDate) {
        for (Map.Entry<String, MetricValue> entry : snapshot.metrics().entrySet()) {
            checkObserved(snapshot.ticker() + "." + entry.getKey(), entry.getValue(), asOfDate);
        }
        for (Map.Entry<String, List<MetricValue>> entry : snapshot.history().entrySet()) {
            for (MetricValue value : entry.getValue()) {
                checkObserved(snapshot.ticker() + "." + entry.getKey() + " history", value, asOfDate);
            }
        }
    }

    private void checkObserved(String what, MetricValue value, LocalDate asOfDate) {
        if (value.observedOn().isAfter(asOfDate)) {
            throw new LookAheadViolationException(what, asOfDate, value.observedOn());
        }
    }
}

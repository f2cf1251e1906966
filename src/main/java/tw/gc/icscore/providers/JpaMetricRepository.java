package tw.gc.icscore.providers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.icscore.entities.MetricObservation;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.repositories.MetricObservationRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * MetricRepository backed by the {@code metric_observations} table.
 *
 * Rows are already ordered by date ascending, so the last row per metric wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMetricRepository implements MetricRepository {

    static final int HISTORY_YEARS = 5;
    private static final Set<String> HISTORY_METRICS = Set.of(MetricNames.PE_RATIO, MetricNames.PS_RATIO);

    private final MetricObservationRepository observationRepository;

    @Override
    @Transactional(readOnly = true)
    public List<MetricSnapshot> getSectorUniverse(String sector, LocalDate asOfDate) {
        List<MetricObservation> rows = load(() -> observationRepository.findSectorHistoryUpTo(sector, asOfDate),
            "sector universe " + sector);

        Map<String, Map<String, MetricValue>> byTicker = new LinkedHashMap<>();
        for (MetricObservation row : rows) {
            if (row.getValue() == null) {
                continue;
            }
            byTicker.computeIfAbsent(row.getTicker(), t -> new HashMap<>())
                .put(row.getMetricName(), new MetricValue(row.getValue(), row.getObservedOn()));
        }

        List<MetricSnapshot> universe = new ArrayList<>(byTicker.size());
        byTicker.forEach((ticker, metrics) -> universe.add(new MetricSnapshot(ticker, sector, asOfDate, metrics, Map.of())));
        log.debug("Loaded {} tickers for sector {} as of {}", universe.size(), sector, asOfDate);
        return universe;
    }

    @Override
    @Transactional(readOnly = true)
    public MetricSnapshot getTickerFundamentals(String ticker, LocalDate asOfDate) {
        List<MetricObservation> rows = load(() -> observationRepository.findHistoryUpTo(ticker, asOfDate),
            "fundamentals of " + ticker);

        LocalDate historyStart = asOfDate.minusYears(HISTORY_YEARS);
        Map<String, MetricValue> latest = new HashMap<>();
        Map<String, List<MetricValue>> history = new HashMap<>();
        String sector = null;

        for (MetricObservation row : rows) {
            if (row.getSector() != null) {
                sector = row.getSector();
            }
            if (row.getValue() == null) {
                continue;
            }
            MetricValue value = new MetricValue(row.getValue(), row.getObservedOn());
            latest.put(row.getMetricName(), value);
            if (HISTORY_METRICS.contains(row.getMetricName()) && row.getObservedOn().isAfter(historyStart)) {
                history.computeIfAbsent(row.getMetricName(), m -> new ArrayList<>()).add(value);
            }
        }
        return new MetricSnapshot(ticker, sector, asOfDate, latest, history);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> listSectors(LocalDate asOfDate) {
        return load(() -> observationRepository.findDistinctSectorsUpTo(asOfDate), "sector list");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Double> getPriceAsOf(String ticker, LocalDate date) {
        return load(() -> observationRepository
                .findFirstByTickerAndMetricNameAndObservedOnLessThanEqualOrderByObservedOnDesc(ticker, MetricNames.PRICE, date),
            "price of " + ticker)
            .map(MetricObservation::getValue);
    }

    private <T> T load(Supplier<T> query, String what) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new MetricRepositoryException("Failed to load " + what, e);
        }
    }
}

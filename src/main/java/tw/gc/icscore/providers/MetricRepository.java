package tw.gc.icscore.providers;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time metric source consumed by the engine.
 *
 * Implementations must honor {@code asOfDate} strictly: nothing observed after it may be returned.
 * Failures surface as {@link tw.gc.icscore.exceptions.MetricRepositoryException}.
 */
public interface MetricRepository {

    /**
     * Latest known metrics of every active company in the sector. History series are not required.
     */
    List<MetricSnapshot> getSectorUniverse(String sector, LocalDate asOfDate);

    /**
     * Latest known metrics of one ticker, with five years of monthly P/E and P/S history.
     */
    MetricSnapshot getTickerFundamentals(String ticker, LocalDate asOfDate);

    List<String> listSectors(LocalDate asOfDate);

    /**
     * Last close on or before {@code date}.
     */
    Optional<Double> getPriceAsOf(String ticker, LocalDate date);
}

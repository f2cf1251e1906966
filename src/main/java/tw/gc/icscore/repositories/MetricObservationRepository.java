package tw.gc.icscore.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.icscore.entities.MetricObservation;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Every query is bounded by {@code observedOn <= asOfDate}; nothing here may return a later row.
 */
@Repository
public interface MetricObservationRepository extends JpaRepository<MetricObservation, Long> {

    @Query("SELECT o FROM MetricObservation o WHERE o.ticker = :ticker AND o.observedOn <= :asOfDate " +
           "ORDER BY o.metricName ASC, o.observedOn ASC")
    List<MetricObservation> findHistoryUpTo(@Param("ticker") String ticker, @Param("asOfDate") LocalDate asOfDate);

    @Query("SELECT o FROM MetricObservation o WHERE o.sector = :sector AND o.observedOn <= :asOfDate " +
           "ORDER BY o.ticker ASC, o.metricName ASC, o.observedOn ASC")
    List<MetricObservation> findSectorHistoryUpTo(@Param("sector") String sector, @Param("asOfDate") LocalDate asOfDate);

    @Query("SELECT DISTINCT o.sector FROM MetricObservation o WHERE o.sector IS NOT NULL AND o.observedOn <= :asOfDate " +
           "ORDER BY o.sector ASC")
    List<String> findDistinctSectorsUpTo(@Param("asOfDate") LocalDate asOfDate);

    Optional<MetricObservation> findFirstByTickerAndMetricNameAndObservedOnLessThanEqualOrderByObservedOnDesc(
        String ticker, String metricName, LocalDate asOfDate);
}

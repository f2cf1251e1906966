package tw.gc.icscore.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.icscore.entities.SectorMetricDistribution;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface SectorMetricDistributionRepository extends JpaRepository<SectorMetricDistribution, Long> {

    List<SectorMetricDistribution> findByAsOfDate(LocalDate asOfDate);

    Optional<SectorMetricDistribution> findBySectorAndMetricNameAndAsOfDate(String sector, String metricName, LocalDate asOfDate);

    @Query("SELECT MAX(d.asOfDate) FROM SectorMetricDistribution d WHERE d.asOfDate <= :asOfDate")
    Optional<LocalDate> findLatestAsOfDateOnOrBefore(@Param("asOfDate") LocalDate asOfDate);

    long countByAsOfDate(LocalDate asOfDate);

    @Modifying
    @Query("DELETE FROM SectorMetricDistribution d WHERE d.asOfDate = :asOfDate")
    int deleteByAsOfDate(@Param("asOfDate") LocalDate asOfDate);
}

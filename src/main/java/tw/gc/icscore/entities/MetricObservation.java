package tw.gc.icscore.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * MetricObservation Entity
 *
 * One dated value of one metric for one ticker, as written by the ingestion pipelines.
 * Prices are stored under the {@code price} metric; own-history valuation series under {@code pe_ratio}/{@code ps_ratio}.
 */
@Entity
@Table(name = "metric_observations", indexes = {
    @Index(name = "idx_mo_ticker_metric_date", columnList = "ticker, metric_name, observed_on"),
    @Index(name = "idx_mo_sector_date", columnList = "sector, observed_on")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricObservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticker", nullable = false, length = 20)
    private String ticker;

    @Column(name = "sector", length = 100)
    private String sector;

    @Column(name = "metric_name", nullable = false, length = 60)
    private String metricName;

    @Column(name = "metric_value")
    private Double value;

    @Column(name = "observed_on", nullable = false)
    private LocalDate observedOn;
}

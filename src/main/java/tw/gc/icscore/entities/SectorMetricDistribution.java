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
import java.time.LocalDateTime;

/**
 * SectorMetricDistribution Entity
 *
 * Daily percentile breakpoints of one metric across one sector, computed on the winsorized sample.
 * A row is never updated; the next day's row supersedes it.
 */
@Entity
@Table(name = "sector_metric_distributions", indexes = {
    @Index(name = "idx_smd_sector_metric_date", columnList = "sector, metric_name, as_of_date", unique = true),
    @Index(name = "idx_smd_as_of_date", columnList = "as_of_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectorMetricDistribution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sector", nullable = false, length = 100)
    private String sector;

    @Column(name = "metric_name", nullable = false, length = 60)
    private String metricName;

    @Column(name = "as_of_date", nullable = false)
    private LocalDate asOfDate;

    @Column(name = "min_value")
    private double minValue;

    @Column(name = "p10")
    private double p10;

    @Column(name = "p25")
    private double p25;

    @Column(name = "p50")
    private double p50;

    @Column(name = "p75")
    private double p75;

    @Column(name = "p90")
    private double p90;

    @Column(name = "max_value")
    private double maxValue;

    @Column(name = "mean_value")
    private double meanValue;

    @Column(name = "std_dev")
    private double stdDev;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;

    /**
     * Sample count below the configured minimum; percentile lookups against this row are reduced-reliability.
     */
    @Column(name = "low_confidence", nullable = false)
    private boolean lowConfidence;

    @Column(name = "created_at")
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}

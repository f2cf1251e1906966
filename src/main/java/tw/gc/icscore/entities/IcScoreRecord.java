package tw.gc.icscore.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.icscore.enums.ConfidenceLevel;
import tw.gc.icscore.enums.LifecycleStage;
import tw.gc.icscore.enums.ScoreRating;
import tw.gc.icscore.enums.ScoreRunType;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * IcScoreRecord Entity
 *
 * One scoring run's output for one ticker. Every run inserts a new row so the full score
 * history stays queryable; rows are never updated except to attach the sector rank before
 * they are first saved.
 *
 * Factor results and the weights actually used are kept as JSON (TEXT) so nothing is lost
 * between the run and the audit trail.
 */
@Entity
@Table(name = "ic_score_records", indexes = {
    @Index(name = "idx_ic_score_ticker_calculated", columnList = "ticker, calculated_at"),
    @Index(name = "idx_ic_score_sector_date", columnList = "sector, as_of_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IcScoreRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticker", nullable = false, length = 20)
    private String ticker;

    @Column(name = "sector", length = 100)
    private String sector;

    @Column(name = "as_of_date", nullable = false)
    private LocalDate asOfDate;

    @Column(name = "calculated_at", nullable = false)
    @Builder.Default
    private LocalDateTime calculatedAt = LocalDateTime.now();

    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false, length = 20)
    private ScoreRunType runType;

    /** Displayed (smoothed) score; null whenever confidence is INSUFFICIENT */
    @Column(name = "overall_score")
    private Double overallScore;

    /** Pre-smoothing aggregate; null only when no factor was available */
    @Column(name = "raw_score")
    private Double rawScore;

    @Column(name = "previous_score")
    private Double previousScore;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "valuation_score")
    private Double valuationScore;

    @Column(name = "signals_score")
    private Double signalsScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating", length = 20)
    private ScoreRating rating;

    @Enumerated(EnumType.STRING)
    @Column(name = "lifecycle_stage", nullable = false, length = 20)
    private LifecycleStage lifecycleStage;

    @Column(name = "lifecycle_confidence")
    private Double lifecycleConfidence;

    @Column(name = "factor_results_json", columnDefinition = "TEXT")
    private String factorResultsJson;

    @Column(name = "weights_json", columnDefinition = "TEXT")
    private String weightsJson;

    @Column(name = "available_factors", nullable = false)
    private int availableFactors;

    @Column(name = "expected_factors", nullable = false)
    private int expectedFactors;

    @Column(name = "completeness_pct", nullable = false)
    private double completenessPct;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_level", nullable = false, length = 20)
    private ConfidenceLevel confidenceLevel;

    @Column(name = "sector_rank")
    private Integer sectorRank;

    @Column(name = "sector_size")
    private Integer sectorSize;

    @Column(name = "sector_percentile")
    private Double sectorPercentile;

    @Column(name = "smoothing_applied", nullable = false)
    private boolean smoothingApplied;

    /** Comma-separated event types that bypassed smoothing for this run */
    @Column(name = "reset_events", length = 500)
    private String resetEvents;

    @Column(name = "explanation", columnDefinition = "TEXT")
    private String explanation;

    /** Factor-level drivers of the change since the previous record, as JSON */
    @Column(name = "change_drivers_json", columnDefinition = "TEXT")
    private String changeDriversJson;

    public boolean hasDisplayableScore() {
        return overallScore != null && confidenceLevel != null && confidenceLevel.isDisplayable();
    }
}

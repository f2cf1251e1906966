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
 * BacktestPeriodResult Entity
 *
 * One decile portfolio held over one rebalance period of a backtest run.
 * Returns are fractions (0.05 = 5%) net of transaction cost and slippage.
 */
@Entity
@Table(name = "backtest_period_results", indexes = {
    @Index(name = "idx_bpr_run_id", columnList = "backtest_run_id"),
    @Index(name = "idx_bpr_run_period_decile", columnList = "backtest_run_id, period_start, decile", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestPeriodResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "backtest_run_id", nullable = false, length = 50)
    private String backtestRunId;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "decile", nullable = false)
    private int decile;

    /** Comma-separated tickers held */
    @Column(name = "holdings", columnDefinition = "TEXT")
    private String holdings;

    @Column(name = "holding_count", nullable = false)
    private int holdingCount;

    @Column(name = "period_return")
    private double periodReturn;

    @Column(name = "benchmark_return")
    private Double benchmarkReturn;

    @Column(name = "excess_return")
    private Double excessReturn;

    @Column(name = "avg_score")
    private double avgScore;

    /** Share of this decile's holdings that were not in the same decile last period; 1.0 on the first period */
    @Column(name = "turnover")
    private double turnover;

    @Column(name = "created_at")
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}

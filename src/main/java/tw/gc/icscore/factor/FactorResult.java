package tw.gc.icscore.factor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import tw.gc.icscore.enums.ScoreCategory;

import java.util.Map;
import java.util.Objects;

/**
 * Output of one factor calculator for one ticker and run.
 * A factor that could not be computed carries a null score and {@code available == false}; it is never zero-filled.
 * {@code notApplicable} marks a factor that does not apply to the ticker at all (a non-payer has no dividend
 * quality), as opposed to one whose inputs are missing.
 */
public record FactorResult(
    String factor,
    ScoreCategory category,
    Double score,
    double weight,
    Map<String, SupportingMetric> supportingMetrics,
    boolean available,
    boolean degraded,
    boolean notApplicable
) {

    public FactorResult {
        Objects.requireNonNull(factor, "factor");
        Objects.requireNonNull(category, "category");
        if (available && score == null) {
            throw new IllegalArgumentException("Available factor " + factor + " must carry a score");
        }
        if (!available && score != null) {
            throw new IllegalArgumentException("Unavailable factor " + factor + " must not carry a score");
        }
        if (available && notApplicable) {
            throw new IllegalArgumentException("Factor " + factor + " cannot be both scored and not applicable");
        }
        if (score != null && (score < 0.0 || score > 100.0 || score.isNaN())) {
            throw new IllegalArgumentException("Score for " + factor + " out of range: " + score);
        }
        supportingMetrics = supportingMetrics == null ? Map.of() : Map.copyOf(supportingMetrics);
    }

    public static FactorResult of(String factor, ScoreCategory category, double score,
                                  Map<String, SupportingMetric> supportingMetrics, boolean degraded) {
        return new FactorResult(factor, category, score, 0.0, supportingMetrics, true, degraded, false);
    }

    public static FactorResult notComputable(String factor, ScoreCategory category) {
        return new FactorResult(factor, category, null, 0.0, Map.of(), false, false, false);
    }

    public static FactorResult notApplicable(String factor, ScoreCategory category) {
        return new FactorResult(factor, category, null, 0.0, Map.of(), false, false, true);
    }

    public FactorResult withWeight(double nominalWeight) {
        return new FactorResult(factor, category, score, nominalWeight, supportingMetrics, available, degraded, notApplicable);
    }

    @JsonIgnore
    public boolean isNotComputable() {
        return !available;
    }
}

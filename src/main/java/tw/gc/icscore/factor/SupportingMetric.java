package tw.gc.icscore.factor;

/**
 * One sub-metric behind a factor score.
 *
 * @param rawValue  value as reported
 * @param score     0-100 contribution after sector ranking, inversion or range scoring
 * @param weight    weight within the factor before redistribution
 * @param degraded  ranked against a low-confidence sector distribution
 */
public record SupportingMetric(double rawValue, double score, double weight, boolean degraded) {
}

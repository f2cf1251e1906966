package tw.gc.icscore.factor;

/**
 * Absolute (non sector-relative) scoring curves shared by the calculators.
 */
public final class ScoringFunctions {

    private ScoringFunctions() {
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    /**
     * 100 at {@code optimum}, falling linearly to 0 at {@code floor} and at {@code ceiling}; 0 outside.
     */
    public static double triangular(double value, double floor, double optimum, double ceiling) {
        if (!(floor <= optimum && optimum <= ceiling) || floor == ceiling) {
            throw new IllegalArgumentException("Invalid triangle " + floor + "/" + optimum + "/" + ceiling);
        }
        if (value <= floor || value >= ceiling) {
            return value == optimum ? 100.0 : 0.0;
        }
        if (value <= optimum) {
            return 100.0 * (value - floor) / (optimum - floor);
        }
        return 100.0 * (ceiling - value) / (ceiling - optimum);
    }

    /**
     * Maps {@code value} linearly so that {@code -span} scores 0, zero scores 50 and {@code +span} scores 100.
     */
    public static double centered(double value, double span) {
        return clamp(50.0 + (value / span) * 50.0);
    }
}

package tw.gc.icscore.services;

import org.springframework.stereotype.Component;
import tw.gc.icscore.factor.FactorResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * ScoreExplainer
 *
 * Explains a score move in terms of the factors that moved it. A factor counts when it was
 * available in both runs and moved by at least {@link #SIGNIFICANT_DELTA} points; the five largest
 * weighted contributions are reported.
 */
@Component
public class ScoreExplainer {

    static final double SIGNIFICANT_DELTA = 3.0;
    static final double SIGNIFICANT_SCORE_MOVE = 3.0;
    static final double UNCHANGED_BAND = 0.5;
    static final int MAX_DRIVERS = 5;

    public ScoreExplanation explain(String ticker, Double previousScore, Map<String, FactorResult> previousFactors,
                                    Double currentScore, List<FactorResult> currentFactors) {
        if (currentScore == null) {
            return new ScoreExplanation(previousScore, null, 0.0, List.of(),
                ticker + "'s IC Score is not available: insufficient data");
        }
        if (previousScore == null) {
            return new ScoreExplanation(null, currentScore, 0.0, List.of(),
                String.format("%s's first IC Score: %.1f", ticker, currentScore));
        }

        List<FactorChange> changes = new ArrayList<>();
        for (FactorResult current : currentFactors) {
            FactorResult previous = previousFactors.get(current.factor());
            if (previous == null || !previous.available() || !current.available()) {
                continue;
            }
            double delta = current.score() - previous.score();
            if (Math.abs(delta) >= SIGNIFICANT_DELTA) {
                changes.add(new FactorChange(current.factor(), previous.score(), current.score(), delta,
                    current.weight(), delta * current.weight()));
            }
        }
        changes.sort(Comparator.comparingDouble((FactorChange c) -> Math.abs(c.contribution())).reversed());
        List<FactorChange> drivers = changes.size() > MAX_DRIVERS ? changes.subList(0, MAX_DRIVERS) : changes;

        double delta = currentScore - previousScore;
        return new ScoreExplanation(previousScore, currentScore, delta, drivers, summarize(ticker, delta, drivers));
    }

    private String summarize(String ticker, double delta, List<FactorChange> drivers) {
        if (drivers.isEmpty()) {
            if (Math.abs(delta) < UNCHANGED_BAND) {
                return ticker + "'s IC Score is unchanged";
            }
            return ticker + "'s IC Score " + (delta > 0 ? "improved slightly" : "declined slightly");
        }

        String direction;
        if (delta > SIGNIFICANT_SCORE_MOVE) {
            direction = "improved significantly";
        } else if (delta > 0) {
            direction = "improved";
        } else if (delta < -SIGNIFICANT_SCORE_MOVE) {
            direction = "declined significantly";
        } else {
            direction = "declined";
        }
        FactorChange top = drivers.get(0);
        return String.format("%s's IC Score %s (%+.1f points), primarily due to %s (%+.1f)",
            ticker, direction, delta, top.factor().replace('_', ' '), top.delta());
    }
}

package tw.gc.icscore.services;

import java.util.List;

public record ScoreExplanation(Double previousScore, Double currentScore, double delta,
                               List<FactorChange> drivers, String summary) {

    public ScoreExplanation {
        drivers = drivers == null ? List.of() : List.copyOf(drivers);
    }
}

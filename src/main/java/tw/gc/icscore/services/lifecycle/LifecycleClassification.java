package tw.gc.icscore.services.lifecycle;

import tw.gc.icscore.enums.LifecycleStage;

import java.util.Map;
import java.util.Objects;

/**
 * @param confidence 0-1, how squarely the inputs sit inside the stage's band
 * @param inputs     the values actually used after null defaults were applied
 */
public record LifecycleClassification(LifecycleStage stage, double confidence, Map<String, Double> inputs) {

    public LifecycleClassification {
        Objects.requireNonNull(stage, "stage");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }
}

package tw.gc.icscore.services.lifecycle;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.icscore.enums.LifecycleStage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies lifecycle multipliers to base factor weights and renormalizes the result to sum to 1.0.
 */
@Component
@RequiredArgsConstructor
public class WeightAdjuster {

    private final LifecycleClassifier lifecycleClassifier;

    public Map<String, Double> adjust(Map<String, Double> baseWeights, LifecycleStage stage) {
        if (baseWeights == null || baseWeights.isEmpty()) {
            throw new IllegalArgumentException("Base weights must not be empty");
        }

        Map<String, Double> adjusted = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> entry : baseWeights.entrySet()) {
            double base = entry.getValue() == null ? 0.0 : entry.getValue();
            if (base < 0.0) {
                throw new IllegalArgumentException("Negative base weight for " + entry.getKey() + ": " + base);
            }
            double weight = base * lifecycleClassifier.multiplier(stage, entry.getKey());
            adjusted.put(entry.getKey(), weight);
            total += weight;
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("Base weights sum to zero for stage " + stage);
        }

        final double sum = total;
        adjusted.replaceAll((factor, weight) -> weight / sum);
        return Collections.unmodifiableMap(adjusted);
    }
}

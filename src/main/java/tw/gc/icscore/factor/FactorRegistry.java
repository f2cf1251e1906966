package tw.gc.icscore.factor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.icscore.config.IcScoreProperties;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name to calculator lookup built from every {@link FactorCalculator} bean. Adding a factor means
 * adding a bean and a base weight; nothing downstream branches on factor names.
 */
@Slf4j
@Component
public class FactorRegistry {

    private final Map<String, FactorCalculator> calculators;

    public FactorRegistry(List<FactorCalculator> beans, IcScoreProperties properties) {
        Map<String, FactorCalculator> byName = new LinkedHashMap<>();
        for (FactorCalculator calculator : beans) {
            if (calculator.optional() && !isEnabled(calculator, properties)) {
                log.info("Factor {} disabled by configuration", calculator.name());
                continue;
            }
            if (!properties.getWeights().containsKey(calculator.name())) {
                throw new IllegalStateException("No base weight configured for factor " + calculator.name());
            }
            FactorCalculator previous = byName.put(calculator.name(), calculator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate factor calculator: " + calculator.name());
            }
        }
        this.calculators = Collections.unmodifiableMap(byName);
        log.info("🧮 Registered {} factor calculators: {}", calculators.size(), calculators.keySet());
    }

    public Collection<FactorCalculator> all() {
        return calculators.values();
    }

    public Optional<FactorCalculator> find(String name) {
        return Optional.ofNullable(calculators.get(name));
    }

    public boolean contains(String name) {
        return calculators.containsKey(name);
    }

    public int expectedCount() {
        return calculators.size();
    }

    /**
     * Configured base weights restricted to the registered factors.
     */
    public Map<String, Double> baseWeights(Map<String, Double> configured) {
        Map<String, Double> weights = new LinkedHashMap<>();
        calculators.keySet().forEach(name -> weights.put(name, configured.getOrDefault(name, 0.0)));
        return weights;
    }

    private static boolean isEnabled(FactorCalculator calculator, IcScoreProperties properties) {
        if (FactorNames.DIVIDEND_QUALITY.equals(calculator.name())) {
            return properties.getScoring().isDividendQualityEnabled();
        }
        return true;
    }
}

package tw.gc.icscore.factor.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.testutil.ScoringTestData;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TechnicalFactorCalculator Tests")
class TechnicalFactorCalculatorTest {

    private final TechnicalFactorCalculator calculator = new TechnicalFactorCalculator();

    @ParameterizedTest(name = "RSI {0} -> {1}")
    @CsvSource({"55, 100", "37.5, 50", "70, 50", "20, 0", "90, 0"})
    @DisplayName("RSI is scored on a band penalizing both oversold and overbought")
    void rsiBand(double rsi, double expected) {
        FactorResult result = calculator.calculate("2330", ScoringTestData.snapshot("2330", Map.of(
            MetricNames.RSI_14, rsi)), ScoringTestData.linearStats());

        assertThat(result.score()).isCloseTo(expected, within(1e-9));
    }
}

package tw.gc.icscore.services.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.ScoreEvent;
import tw.gc.icscore.enums.ScoreEventType;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ScoreStabilizer Tests")
class ScoreStabilizerTest {

    private ScoreStabilizer stabilizer;

    @BeforeEach
    void setUp() {
        stabilizer = new ScoreStabilizer(new IcScoreProperties());
    }

    private static ScoreEvent event(ScoreEventType type) {
        return ScoreEvent.builder()
            .ticker("2330")
            .eventType(type)
            .eventDate(LocalDate.of(2024, 7, 18))
            .build();
    }

    @Nested
    @DisplayName("Smoothing Tests")
    class SmoothingTests {

        @Test
        @DisplayName("Unchanged raw score stays put")
        void unchanged() {
            StabilizedScore result = stabilizer.stabilize(70.0, 70.0, List.of());

            assertThat(result.score()).isEqualTo(70.0);
            assertThat(result.smoothingApplied()).isTrue();
        }

        @Test
        @DisplayName("A one-point move is smoothed with alpha 0.7")
        void smoothsMove() {
            assertThat(stabilizer.stabilize(71.0, 70.0, List.of()).score()).isEqualTo(70.7);
        }

        @Test
        @DisplayName("A move under the minimum change keeps the previous score")
        void ignoresNoise() {
            assertThat(stabilizer.stabilize(70.2, 70.0, List.of()).score()).isEqualTo(70.0);
        }

        @Test
        @DisplayName("Large moves are damped, not blocked")
        void dampsLargeMove() {
            StabilizedScore result = stabilizer.stabilize(40.0, 80.0, List.of());

            assertThat(result.score()).isEqualTo(52.0);
            assertThat(result.rawScore()).isEqualTo(40.0);
            assertThat(result.previousScore()).isEqualTo(80.0);
        }

        @Test
        @DisplayName("Output is rounded to one decimal")
        void rounds() {
            assertThat(stabilizer.stabilize(73.33, 61.0, List.of()).score()).isEqualTo(69.6);
        }
    }

    @Nested
    @DisplayName("Bypass Tests")
    class BypassTests {

        @Test
        @DisplayName("First score for a ticker passes straight through")
        void firstScore() {
            StabilizedScore result = stabilizer.stabilize(64.27, null, List.of());

            assertThat(result.score()).isEqualTo(64.3);
            assertThat(result.priorState()).isEqualTo(ScoreStabilizer.State.UNSEEDED);
            assertThat(result.smoothingApplied()).isFalse();
        }

        @Test
        @DisplayName("A reset event lets the raw score through")
        void resetEvent() {
            StabilizedScore result = stabilizer.stabilize(50.0, 70.0, List.of(event(ScoreEventType.EARNINGS_RELEASE)));

            assertThat(result.score()).isEqualTo(50.0);
            assertThat(result.smoothingApplied()).isFalse();
            assertThat(result.resetEvents()).containsExactly(ScoreEventType.EARNINGS_RELEASE);
        }

        @Test
        @DisplayName("Non-reset events do not bypass smoothing")
        void nonResetEvent() {
            StabilizedScore result = stabilizer.stabilize(71.0, 70.0, List.of(event(ScoreEventType.PRICE_BREAKOUT)));

            assertThat(result.score()).isEqualTo(70.7);
            assertThat(result.resetEvents()).isEmpty();
        }

        @Test
        @DisplayName("Duplicate reset events are reported once")
        void distinctResets() {
            StabilizedScore result = stabilizer.stabilize(50.0, 70.0, List.of(
                event(ScoreEventType.GUIDANCE_UPDATE), event(ScoreEventType.GUIDANCE_UPDATE)));

            assertThat(result.resetEvents()).containsExactly(ScoreEventType.GUIDANCE_UPDATE);
        }
    }

    @Test
    @DisplayName("Reset event set is configurable")
    void configurableResets() {
        IcScoreProperties properties = new IcScoreProperties();
        properties.getStabilizer().getResetEvents().add(ScoreEventType.STOCK_SPLIT);
        ScoreStabilizer custom = new ScoreStabilizer(properties);

        assertThat(custom.stabilize(50.0, 70.0, List.of(event(ScoreEventType.STOCK_SPLIT))).smoothingApplied()).isFalse();
    }
}

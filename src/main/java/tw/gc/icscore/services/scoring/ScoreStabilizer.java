package tw.gc.icscore.services.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.icscore.config.IcScoreProperties;
import tw.gc.icscore.entities.ScoreEvent;
import tw.gc.icscore.enums.ScoreEventType;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ScoreStabilizer
 *
 * Exponential smoothing of the displayed score across runs:
 * {@code smoothed = alpha * raw + (1 - alpha) * previous}. Changes smaller than the minimum-change
 * floor keep the previous score. A reset event (earnings, rating change...) in the period passes the
 * raw score straight through, as does the very first score for a ticker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoreStabilizer {

    public enum State {
        /** No displayable previous score for the ticker */
        UNSEEDED,
        STABLE
    }

    private final IcScoreProperties properties;

    /**
     * @param previousScore last displayed score, or null if the ticker has none
     * @param events        events dated within the current period
     */
    public StabilizedScore stabilize(double rawScore, Double previousScore, Collection<ScoreEvent> events) {
        if (previousScore == null) {
            return new StabilizedScore(round(rawScore), rawScore, null, State.UNSEEDED, false, List.of());
        }

        List<ScoreEventType> resets = resetEventsIn(events);
        if (!resets.isEmpty()) {
            log.debug("Smoothing bypassed by {}", resets);
            return new StabilizedScore(round(rawScore), rawScore, previousScore, State.STABLE, false, resets);
        }

        IcScoreProperties.Stabilizer config = properties.getStabilizer();
        double smoothed = config.getAlpha() * rawScore + (1.0 - config.getAlpha()) * previousScore;
        double output = Math.abs(smoothed - previousScore) < config.getMinChangeThreshold() ? previousScore : smoothed;
        return new StabilizedScore(round(output), rawScore, previousScore, State.STABLE, true, List.of());
    }

    List<ScoreEventType> resetEventsIn(Collection<ScoreEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        Set<ScoreEventType> resetTypes = properties.getStabilizer().getResetEvents();
        return events.stream()
            .map(ScoreEvent::getEventType)
            .filter(Objects::nonNull)
            .filter(resetTypes::contains)
            .distinct()
            .toList();
    }

    static double round(double score) {
        return Math.round(score * 10.0) / 10.0;
    }
}

package tw.gc.icscore.services.scoring;

import tw.gc.icscore.enums.ScoreEventType;

import java.util.List;

/**
 * @param score            displayed score, one decimal
 * @param rawScore         input score before smoothing, unrounded
 * @param smoothingApplied false when the raw score went straight through (first score or reset event)
 * @param resetEvents      reset-eligible events seen in the period
 */
public record StabilizedScore(
    double score,
    double rawScore,
    Double previousScore,
    ScoreStabilizer.State priorState,
    boolean smoothingApplied,
    List<ScoreEventType> resetEvents
) {

    public StabilizedScore {
        resetEvents = resetEvents == null ? List.of() : List.copyOf(resetEvents);
    }
}

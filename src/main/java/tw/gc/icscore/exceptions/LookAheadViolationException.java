package tw.gc.icscore.exceptions;

import lombok.Getter;

import java.time.LocalDate;

/**
 * A historical run asked for, or was handed, data dated after its point-in-time cutoff.
 * Never recovered from: the backtest that triggers it is invalid.
 */
@Getter
public class LookAheadViolationException extends IllegalStateException {

    private final LocalDate cutoff;
    private final LocalDate requested;

    public LookAheadViolationException(String what, LocalDate cutoff, LocalDate requested) {
        super(String.format("Look-ahead violation: %s dated %s is after point-in-time cutoff %s", what, requested, cutoff));
        this.cutoff = cutoff;
        this.requested = requested;
    }
}

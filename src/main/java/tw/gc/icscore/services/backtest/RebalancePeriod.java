package tw.gc.icscore.services.backtest;

import tw.gc.icscore.enums.RebalanceFrequency;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Holding window from one rebalance date to the next. Scores are computed as of {@code start}.
 */
public record RebalancePeriod(LocalDate start, LocalDate end) {

    public RebalancePeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Period end " + end + " must be after start " + start);
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end);
    }

    /**
     * Consecutive periods covering [startDate, endDate]; the last one is cut short at {@code endDate}.
     */
    public static List<RebalancePeriod> between(LocalDate startDate, LocalDate endDate, RebalanceFrequency frequency) {
        List<RebalancePeriod> periods = new ArrayList<>();
        LocalDate current = startDate;
        while (current.isBefore(endDate)) {
            LocalDate next = frequency.next(current);
            if (next.isAfter(endDate)) {
                next = endDate;
            }
            periods.add(new RebalancePeriod(current, next));
            current = next;
        }
        return periods;
    }
}

package tw.gc.icscore.enums;

import java.time.LocalDate;

public enum RebalanceFrequency {
    DAILY(252),
    WEEKLY(52),
    MONTHLY(12),
    QUARTERLY(4);

    private final int periodsPerYear;

    RebalanceFrequency(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    /**
     * Next rebalance boundary after {@code current}. Monthly and quarterly boundaries
     * snap to the first day of the next month or quarter.
     */
    public LocalDate next(LocalDate current) {
        return switch (this) {
            case DAILY -> current.plusDays(1);
            case WEEKLY -> current.plusWeeks(1);
            case MONTHLY -> current.withDayOfMonth(1).plusMonths(1);
            case QUARTERLY -> {
                int quarterStartMonth = ((current.getMonthValue() - 1) / 3) * 3 + 1;
                yield LocalDate.of(current.getYear(), quarterStartMonth, 1).plusMonths(3);
            }
        };
    }
}

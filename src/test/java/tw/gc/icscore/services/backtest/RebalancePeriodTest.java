package tw.gc.icscore.services.backtest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.icscore.enums.RebalanceFrequency;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RebalancePeriod Tests")
class RebalancePeriodTest {

    @Test
    @DisplayName("Monthly periods snap to month starts and the last one is cut short")
    void monthlyPeriods() {
        List<RebalancePeriod> periods = RebalancePeriod.between(
            LocalDate.of(2023, 1, 15), LocalDate.of(2023, 4, 10), RebalanceFrequency.MONTHLY);

        assertThat(periods).containsExactly(
            new RebalancePeriod(LocalDate.of(2023, 1, 15), LocalDate.of(2023, 2, 1)),
            new RebalancePeriod(LocalDate.of(2023, 2, 1), LocalDate.of(2023, 3, 1)),
            new RebalancePeriod(LocalDate.of(2023, 3, 1), LocalDate.of(2023, 4, 1)),
            new RebalancePeriod(LocalDate.of(2023, 4, 1), LocalDate.of(2023, 4, 10)));
    }

    @Test
    @DisplayName("Consecutive periods share their boundary")
    void contiguous() {
        List<RebalancePeriod> periods = RebalancePeriod.between(
            LocalDate.of(2022, 1, 1), LocalDate.of(2023, 1, 1), RebalanceFrequency.QUARTERLY);

        assertThat(periods).hasSize(4);
        for (int i = 1; i < periods.size(); i++) {
            assertThat(periods.get(i).start()).isEqualTo(periods.get(i - 1).end());
        }
        assertThat(periods.get(0).days()).isEqualTo(90);
    }

    @Test
    @DisplayName("Empty range yields no periods")
    void emptyRange() {
        LocalDate day = LocalDate.of(2023, 5, 5);
        assertThat(RebalancePeriod.between(day, day, RebalanceFrequency.WEEKLY)).isEmpty();
    }

    @Test
    @DisplayName("End must be after start")
    void rejectsInvertedPeriod() {
        LocalDate day = LocalDate.of(2023, 5, 5);
        assertThatThrownBy(() -> new RebalancePeriod(day, day))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RebalancePeriod(null, day))
            .isInstanceOf(NullPointerException.class);
    }
}

package tw.gc.icscore.providers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.icscore.exceptions.LookAheadViolationException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PointInTimeMetricRepository Tests")
class PointInTimeMetricRepositoryTest {

    private static final LocalDate CUTOFF = LocalDate.of(2023, 3, 1);

    private MetricRepository delegate;
    private PointInTimeMetricRepository guard;

    @BeforeEach
    void setUp() {
        delegate = mock(MetricRepository.class);
        guard = new PointInTimeMetricRepository(delegate, CUTOFF);
    }

    private MetricSnapshot snapshotObservedOn(LocalDate observedOn) {
        return new MetricSnapshot("2330", "Semiconductors", CUTOFF,
            Map.of(MetricNames.ROE, new MetricValue(20.0, observedOn)), Map.of());
    }

    @Test
    @DisplayName("Reads on or before the cutoff pass through")
    void passThrough() {
        MetricSnapshot snapshot = snapshotObservedOn(CUTOFF.minusDays(10));
        when(delegate.getTickerFundamentals("2330", CUTOFF)).thenReturn(snapshot);
        when(delegate.listSectors(CUTOFF)).thenReturn(List.of("Semiconductors"));
        when(delegate.getPriceAsOf("2330", CUTOFF.minusDays(1))).thenReturn(Optional.of(500.0));

        assertThat(guard.getTickerFundamentals("2330", CUTOFF)).isSameAs(snapshot);
        assertThat(guard.listSectors(CUTOFF)).containsExactly("Semiconductors");
        assertThat(guard.getPriceAsOf("2330", CUTOFF.minusDays(1))).contains(500.0);
        assertThat(guard.getCutoff()).isEqualTo(CUTOFF);
    }

    @Test
    @DisplayName("Request dated after the cutoff throws before touching the delegate")
    void requestAfterCutoff() {
        assertThatThrownBy(() -> guard.getSectorUniverse("Semiconductors", CUTOFF.plusDays(1)))
            .isInstanceOf(LookAheadViolationException.class)
            .satisfies(e -> {
                LookAheadViolationException violation = (LookAheadViolationException) e;
                assertThat(violation.getCutoff()).isEqualTo(CUTOFF);
                assertThat(violation.getRequested()).isEqualTo(CUTOFF.plusDays(1));
            });
        assertThatThrownBy(() -> guard.getPriceAsOf("2330", CUTOFF.plusMonths(1)))
            .isInstanceOf(LookAheadViolationException.class);

        verifyNoInteractions(delegate);
    }

    @Test
    @DisplayName("Returned value observed after the requested date throws")
    void leakedMetric() {
        when(delegate.getTickerFundamentals("2330", CUTOFF.minusDays(5)))
            .thenReturn(snapshotObservedOn(CUTOFF.minusDays(2)));

        assertThatThrownBy(() -> guard.getTickerFundamentals("2330", CUTOFF.minusDays(5)))
            .isInstanceOf(LookAheadViolationException.class)
            .hasMessageContaining("2330.roe");
    }

    @Test
    @DisplayName("Leaked history point in a sector universe throws")
    void leakedHistory() {
        MetricSnapshot leaky = new MetricSnapshot("2454", "Semiconductors", CUTOFF,
            Map.of(MetricNames.ROE, new MetricValue(15.0, CUTOFF.minusDays(30))),
            Map.of(MetricNames.PE_RATIO, List.of(
                new MetricValue(14.0, CUTOFF.minusMonths(2)),
                new MetricValue(16.0, CUTOFF.plusDays(3)))));
        when(delegate.getSectorUniverse("Semiconductors", CUTOFF)).thenReturn(List.of(leaky));

        assertThatThrownBy(() -> guard.getSectorUniverse("Semiconductors", CUTOFF))
            .isInstanceOf(LookAheadViolationException.class)
            .hasMessageContaining("history");
    }

    @Test
    @DisplayName("Null delegate or cutoff is rejected")
    void rejectsNulls() {
        assertThatThrownBy(() -> new PointInTimeMetricRepository(null, CUTOFF))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new PointInTimeMetricRepository(delegate, null))
            .isInstanceOf(NullPointerException.class);
    }
}

package tw.gc.icscore.providers;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import tw.gc.icscore.entities.ScoreEvent;
import tw.gc.icscore.enums.ScoreEventType;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.repositories.ScoreEventRepository;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaScoreEventSourceTest {

    private static final LocalDate SINCE = LocalDate.of(2024, 6, 1);

    @Mock
    private ScoreEventRepository scoreEventRepository;

    @InjectMocks
    private JpaScoreEventSource eventSource;

    @Test
    void returnsEventsFromRepository() {
        ScoreEvent event = ScoreEvent.builder().ticker("2330").eventType(ScoreEventType.EARNINGS_RELEASE)
            .eventDate(SINCE.plusDays(3)).build();
        when(scoreEventRepository.findByTickerAndEventDateGreaterThanEqualOrderByEventDateAsc("2330", SINCE))
            .thenReturn(List.of(event));

        assertThat(eventSource.getEventsSince("2330", SINCE)).containsExactly(event);
    }

    @Test
    void wrapsDataAccessFailure() {
        when(scoreEventRepository.findByTickerAndEventDateGreaterThanEqualOrderByEventDateAsc("2330", SINCE))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> eventSource.getEventsSince("2330", SINCE))
            .isInstanceOf(MetricRepositoryException.class)
            .hasMessageContaining("2330")
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}

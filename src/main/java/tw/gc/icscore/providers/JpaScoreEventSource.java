package tw.gc.icscore.providers;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import tw.gc.icscore.entities.ScoreEvent;
import tw.gc.icscore.exceptions.MetricRepositoryException;
import tw.gc.icscore.repositories.ScoreEventRepository;

import java.time.LocalDate;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaScoreEventSource implements ScoreEventSource {

    private final ScoreEventRepository scoreEventRepository;

    @Override
    public List<ScoreEvent> getEventsSince(String ticker, LocalDate sinceDate) {
        try {
            return scoreEventRepository.findByTickerAndEventDateGreaterThanEqualOrderByEventDateAsc(ticker, sinceDate);
        } catch (DataAccessException e) {
            throw new MetricRepositoryException("Failed to load score events for " + ticker, e);
        }
    }
}

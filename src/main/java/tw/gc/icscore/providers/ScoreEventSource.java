package tw.gc.icscore.providers;

import tw.gc.icscore.entities.ScoreEvent;

import java.time.LocalDate;
import java.util.List;

public interface ScoreEventSource {

    /**
     * Events for the ticker dated on or after {@code sinceDate}, oldest first.
     */
    List<ScoreEvent> getEventsSince(String ticker, LocalDate sinceDate);
}

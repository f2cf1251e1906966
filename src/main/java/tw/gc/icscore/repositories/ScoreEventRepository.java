package tw.gc.icscore.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.icscore.entities.ScoreEvent;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ScoreEventRepository extends JpaRepository<ScoreEvent, Long> {

    List<ScoreEvent> findByTickerAndEventDateGreaterThanEqualOrderByEventDateAsc(String ticker, LocalDate since);
}

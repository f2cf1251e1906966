package tw.gc.icscore.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.icscore.entities.IcScoreRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface IcScoreRecordRepository extends JpaRepository<IcScoreRecord, Long> {

    Optional<IcScoreRecord> findFirstByTickerOrderByCalculatedAtDescIdDesc(String ticker);

    List<IcScoreRecord> findByTickerOrderByCalculatedAtAsc(String ticker);

    List<IcScoreRecord> findBySectorAndAsOfDate(String sector, LocalDate asOfDate);

    long countByAsOfDate(LocalDate asOfDate);
}

package tw.gc.icscore.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import tw.gc.icscore.entities.BacktestPeriodResult;

import java.util.List;

@Repository
public interface BacktestPeriodResultRepository extends JpaRepository<BacktestPeriodResult, Long> {

    List<BacktestPeriodResult> findByBacktestRunIdOrderByPeriodStartAscDecileAsc(String backtestRunId);

    List<BacktestPeriodResult> findByBacktestRunIdAndDecileOrderByPeriodStartAsc(String backtestRunId, int decile);

    @Query("SELECT DISTINCT r.backtestRunId FROM BacktestPeriodResult r")
    List<String> findDistinctBacktestRunIds();

    long countByBacktestRunId(String backtestRunId);

    void deleteByBacktestRunId(String backtestRunId);
}

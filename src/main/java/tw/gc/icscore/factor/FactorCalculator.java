package tw.gc.icscore.factor;

import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

/**
 * One scoring factor. Implementations are stateless Spring beans picked up by {@link FactorRegistry}.
 */
public interface FactorCalculator {

    String name();

    ScoreCategory category();

    /**
     * @return the factor result, or {@link FactorResult#notComputable} when no sub-metric is available
     */
    FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats);

    /**
     * Optional factors are only expected when enabled in configuration.
     */
    default boolean optional() {
        return false;
    }
}

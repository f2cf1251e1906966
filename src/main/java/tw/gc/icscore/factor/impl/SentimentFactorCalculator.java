package tw.gc.icscore.factor.impl;

import org.springframework.stereotype.Component;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.AbstractFactorCalculator;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.factor.SubMetricBlend;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

/**
 * Sentiment inputs are produced upstream; this only ranks them.
 */
@Component
public class SentimentFactorCalculator extends AbstractFactorCalculator {

    public SentimentFactorCalculator() {
        super(FactorNames.SENTIMENT, ScoreCategory.SIGNALS);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();
        addRanked(blend, snapshot, sectorStats, MetricNames.NEWS_SENTIMENT, 0.50);
        addRanked(blend, snapshot, sectorStats, MetricNames.POSITIVE_ARTICLE_RATIO, 0.30);
        addRanked(blend, snapshot, sectorStats, MetricNames.SOCIAL_SENTIMENT, 0.20);
        return blend.result();
    }
}

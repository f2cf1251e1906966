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

import java.util.List;

/**
 * Valuation against the company's own five-year monthly history rather than its peers:
 * trading near historical lows scores high. Thin-margin companies lean on P/S, since their P/E is noisy.
 */
@Component
public class HistoricalValueFactorCalculator extends AbstractFactorCalculator {

    static final int MIN_HISTORY_POINTS = 12;
    static final double LOW_MARGIN_THRESHOLD = 5.0;

    static final double PE_WEIGHT = 0.70;
    static final double PS_WEIGHT = 0.30;

    public HistoricalValueFactorCalculator() {
        super(FactorNames.HISTORICAL_VALUE, ScoreCategory.VALUATION);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        Double netMargin = snapshot.value(MetricNames.NET_MARGIN);
        boolean lowMargin = netMargin != null && netMargin < LOW_MARGIN_THRESHOLD;
        double peWeight = lowMargin ? PS_WEIGHT : PE_WEIGHT;
        double psWeight = lowMargin ? PE_WEIGHT : PS_WEIGHT;

        SubMetricBlend blend = newBlend();
        addAgainstOwnHistory(blend, snapshot, MetricNames.PE_RATIO, peWeight);
        addAgainstOwnHistory(blend, snapshot, MetricNames.PS_RATIO, psWeight);
        return blend.result();
    }

    private void addAgainstOwnHistory(SubMetricBlend blend, MetricSnapshot snapshot, String metric, double weight) {
        Double current = snapshot.value(metric);
        List<Double> history = snapshot.series(metric);
        if (current == null || current <= 0 || history.size() < MIN_HISTORY_POINTS) {
            return;
        }
        addAbsolute(blend, metric, current, 100.0 - percentileInHistory(current, history), weight);
    }

    /**
     * Share of historical observations strictly below {@code current}, 0-100.
     */
    static double percentileInHistory(double current, List<Double> history) {
        long below = history.stream().filter(v -> v < current).count();
        return (double) below / history.size() * 100.0;
    }
}

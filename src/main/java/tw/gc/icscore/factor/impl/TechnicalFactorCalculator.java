package tw.gc.icscore.factor.impl;

import org.springframework.stereotype.Component;
import tw.gc.icscore.enums.ScoreCategory;
import tw.gc.icscore.factor.AbstractFactorCalculator;
import tw.gc.icscore.factor.FactorNames;
import tw.gc.icscore.factor.FactorResult;
import tw.gc.icscore.factor.ScoringFunctions;
import tw.gc.icscore.factor.SubMetricBlend;
import tw.gc.icscore.providers.MetricNames;
import tw.gc.icscore.providers.MetricSnapshot;
import tw.gc.icscore.services.statistics.SectorStatisticsSnapshot;

/**
 * RSI scored on a band (oversold and overbought both penalized); MACD histogram and the
 * distance from the 50/200-day averages ranked against the sector.
 */
@Component
public class TechnicalFactorCalculator extends AbstractFactorCalculator {

    static final double RSI_FLOOR = 20.0;
    static final double RSI_OPTIMUM = 55.0;
    static final double RSI_CEILING = 85.0;

    public TechnicalFactorCalculator() {
        super(FactorNames.TECHNICAL, ScoreCategory.SIGNALS);
    }

    @Override
    public FactorResult calculate(String ticker, MetricSnapshot snapshot, SectorStatisticsSnapshot sectorStats) {
        SubMetricBlend blend = newBlend();

        Double rsi = snapshot.value(MetricNames.RSI_14);
        if (rsi != null) {
            addAbsolute(blend, MetricNames.RSI_14, rsi,
                ScoringFunctions.triangular(rsi, RSI_FLOOR, RSI_OPTIMUM, RSI_CEILING), 0.30);
        }
        addRanked(blend, snapshot, sectorStats, MetricNames.MACD_HISTOGRAM, 0.25);
        addRanked(blend, snapshot, sectorStats, MetricNames.PRICE_VS_SMA50, 0.25);
        addRanked(blend, snapshot, sectorStats, MetricNames.PRICE_VS_SMA200, 0.20);
        return blend.result();
    }
}

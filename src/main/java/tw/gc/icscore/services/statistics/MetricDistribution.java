package tw.gc.icscore.services.statistics;

import tw.gc.icscore.entities.SectorMetricDistribution;

import java.time.LocalDate;

/**
 * Immutable percentile breakpoints of one metric within one sector on one date.
 */
public record MetricDistribution(
    String sector,
    String metricName,
    LocalDate asOfDate,
    double min,
    double p10,
    double p25,
    double p50,
    double p75,
    double p90,
    double max,
    double mean,
    double stdDev,
    int sampleCount,
    boolean lowConfidence
) {

    private static final double[] BREAKPOINT_PCTS = {0, 10, 25, 50, 75, 90, 100};

    public MetricDistribution {
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0: " + sampleCount);
        }
        if (!(min <= p10 && p10 <= p25 && p25 <= p50 && p50 <= p75 && p75 <= p90 && p90 <= max)) {
            throw new IllegalArgumentException("Percentiles must be non-decreasing for " + sector + "/" + metricName);
        }
    }

    public static MetricDistribution empty(String sector, String metricName, LocalDate asOfDate) {
        return new MetricDistribution(sector, metricName, asOfDate, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, true);
    }

    /**
     * Position of {@code value} within this distribution, 0-100, interpolated linearly inside
     * whichever breakpoint segment (min, p10, p25, p50, p75, p90, max) contains it.
     * Always "higher value, higher percentile"; callers invert for lower-is-better metrics.
     * The minimum itself is percentile 0, also when every breakpoint is equal.
     */
    public double percentileOf(double value) {
        if (value <= min) {
            return 0.0;
        }
        if (value >= max) {
            return 100.0;
        }

        double[] breakpoints = {min, p10, p25, p50, p75, p90, max};
        for (int i = 0; i < breakpoints.length - 1; i++) {
            double lower = breakpoints[i];
            double upper = breakpoints[i + 1];
            if (value <= upper) {
                double lowerPct = BREAKPOINT_PCTS[i];
                if (upper == lower) {
                    return lowerPct;
                }
                double segmentPct = BREAKPOINT_PCTS[i + 1] - lowerPct;
                return lowerPct + segmentPct * (value - lower) / (upper - lower);
            }
        }
        return 100.0;
    }

    public SectorMetricDistribution toEntity() {
        return SectorMetricDistribution.builder()
            .sector(sector)
            .metricName(metricName)
            .asOfDate(asOfDate)
            .minValue(min)
            .p10(p10)
            .p25(p25)
            .p50(p50)
            .p75(p75)
            .p90(p90)
            .maxValue(max)
            .meanValue(mean)
            .stdDev(stdDev)
            .sampleCount(sampleCount)
            .lowConfidence(lowConfidence)
            .build();
    }

    public static MetricDistribution fromEntity(SectorMetricDistribution entity) {
        return new MetricDistribution(
            entity.getSector(),
            entity.getMetricName(),
            entity.getAsOfDate(),
            entity.getMinValue(),
            entity.getP10(),
            entity.getP25(),
            entity.getP50(),
            entity.getP75(),
            entity.getP90(),
            entity.getMaxValue(),
            entity.getMeanValue(),
            entity.getStdDev(),
            entity.getSampleCount(),
            entity.isLowConfidence()
        );
    }
}

package tw.gc.icscore.services.backtest;

import java.util.List;

/**
 * Return-series arithmetic for the decile report. Inputs are per-period fractional returns in time order.
 */
final class BacktestStatistics {

    static final double DAYS_PER_YEAR = 365.25;

    private BacktestStatistics() {
    }

    static double compound(List<Double> returns) {
        double growth = 1.0;
        for (double r : returns) {
            growth *= 1.0 + r;
        }
        return growth - 1.0;
    }

    static double annualize(double totalReturn, double years) {
        if (years <= 0.0) {
            return totalReturn;
        }
        if (totalReturn <= -1.0) {
            return -1.0;
        }
        return Math.pow(1.0 + totalReturn, 1.0 / years) - 1.0;
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / (values.size() - 1));
    }

    static double sharpe(List<Double> returns, int periodsPerYear) {
        double sd = sampleStdDev(returns);
        return sd == 0.0 ? 0.0 : mean(returns) / sd * Math.sqrt(periodsPerYear);
    }

    static double maxDrawdown(List<Double> returns) {
        double equity = 1.0;
        double peak = 1.0;
        double worst = 0.0;
        for (double r : returns) {
            equity *= 1.0 + r;
            peak = Math.max(peak, equity);
            worst = Math.max(worst, (peak - equity) / peak);
        }
        return worst;
    }

    /**
     * Mean over standard deviation; null when fewer than two observations or no dispersion.
     */
    static Double informationRatio(List<Double> excessReturns) {
        double sd = sampleStdDev(excessReturns);
        if (excessReturns.size() < 2 || sd == 0.0) {
            return null;
        }
        return mean(excessReturns) / sd;
    }
}

package com.sandy.adpulse.monitor.tools;

import java.util.ArrayList;
import java.util.List;

/**
 * Numeric primitives shared by the detection models and the significance engine.
 * <p>
 * All functions are pure. Degenerate input (empty series, zero variance, zero totals)
 * is answered with a neutral value instead of an exception.
 */
public final class StatSupport {

    /** Standard deviations below this are treated as zero. */
    private static final double STD_EPS = 1e-10;
    /** Lower clamp for the pooled standard error of the two-proportion test. */
    private static final double MIN_STANDARD_ERROR = 0.001;
    /** Minimum |before - after| slope difference counted as a trend change. */
    private static final double TREND_CHANGE_SLOPE = 0.1;

    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;
    private static final double P = 0.3275911;

    private StatSupport() {
    }

    public static double mean(double[] values) {
        if (values == null || values.length == 0) return 0d;
        double sum = 0d;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Population variance (divides by n).
     */
    public static double variance(double[] values) {
        if (values == null || values.length == 0) return 0d;
        double mean = mean(values);
        double sum = 0d;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.length;
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Absolute z-score of {@code value}; 0 when the standard deviation is (near) zero.
     */
    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev < STD_EPS) return 0d;
        return Math.abs((value - mean) / stdDev);
    }

    /**
     * Flags every element whose |z| exceeds {@code threshold}. The whole input is its own
     * baseline, so a single large outlier also widens the standard deviation it is measured by.
     */
    public static boolean[] detectOutliers(double[] values, double threshold) {
        boolean[] flags = new boolean[values.length];
        if (values.length == 0) return flags;
        double mean = mean(values);
        double stdDev = stdDev(values);
        for (int i = 0; i < values.length; i++) {
            flags[i] = zScore(values[i], mean, stdDev) > threshold;
        }
        return flags;
    }

    public static boolean[] detectOutliers(double[] values) {
        return detectOutliers(values, 2.5);
    }

    /**
     * Trailing moving average; the window shrinks at the start of the series.
     */
    public static double[] movingAverage(double[] values, int windowSize) {
        int window = Math.max(1, windowSize);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - window + 1);
            double sum = 0d;
            for (int j = start; j <= i; j++) sum += values[j];
            result[i] = sum / (i - start + 1);
        }
        return result;
    }

    /**
     * Compares the moving-average slope over the {@code windowSize} points before and after each
     * index in {@code [windowSize, n - windowSize)}.
     */
    public static TrendChanges detectTrendChange(double[] values, int windowSize) {
        List<Integer> points = new ArrayList<>();
        List<String> directions = new ArrayList<>();
        if (windowSize <= 0) {
            return new TrendChanges(points, directions);
        }
        double[] avg = movingAverage(values, windowSize);
        for (int i = windowSize; i < avg.length - windowSize; i++) {
            double before = (avg[i] - avg[i - windowSize]) / windowSize;
            double after = (avg[i + windowSize] - avg[i]) / windowSize;
            if (Math.abs(before - after) > TREND_CHANGE_SLOPE) {
                points.add(i);
                directions.add(after > before ? "upward" : "downward");
            }
        }
        return new TrendChanges(points, directions);
    }

    public static TrendChanges detectTrendChange(double[] values) {
        return detectTrendChange(values, 10);
    }

    /**
     * |current - expected| / |expected| * 100.
     * Near-zero expected values: 0 when current is near zero too, otherwise 100.
     */
    public static double deviationPercent(double current, double expected) {
        final double eps = 1e-6;
        if (Math.abs(expected) < eps) {
            return Math.abs(current) < eps ? 0d : 100d;
        }
        return Math.abs(current - expected) / Math.abs(expected) * 100.0;
    }

    /**
     * Abramowitz-Stegun 7.1.26 approximation, max error about 1.5e-7.
     */
    public static double erf(double x) {
        double sign = x < 0 ? -1 : 1;
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + P * ax);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-ax * ax);
        return sign * y;
    }

    public static double normalCdf(double x) {
        return 0.5 * (1 + erf(x / Math.sqrt(2)));
    }

    /**
     * Two-sided two-proportion z-test with a pooled standard error.
     * Totals are floored at 1 and the standard error at 0.001, no continuity correction.
     */
    public static ZTestResult twoProportionZTest(long controlSuccess, long controlTotal,
                                                 long treatSuccess, long treatTotal) {
        double cTotal = Math.max(controlTotal, 1);
        double tTotal = Math.max(treatTotal, 1);
        double controlRate = controlSuccess / cTotal;
        double treatRate = treatSuccess / tTotal;
        double pooled = (controlSuccess + treatSuccess) / (double) Math.max(controlTotal + treatTotal, 1);
        double standardError = Math.sqrt(pooled * (1 - pooled) * (1 / cTotal + 1 / tTotal));
        double z = Math.abs(treatRate - controlRate) / Math.max(standardError, MIN_STANDARD_ERROR);
        double pValue = 2 * (1 - normalCdf(Math.abs(z)));
        return new ZTestResult(pValue, z);
    }

    public record ZTestResult(double pValue, double zScore) {
    }

    public record TrendChanges(List<Integer> changePoints, List<String> directions) {
    }
}

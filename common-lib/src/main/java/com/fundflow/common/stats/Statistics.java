package com.fundflow.common.stats;

/**
 * Population statistics over fixed-size windows.
 *
 * <p>Every method guards its degenerate case (empty input, zero variance) and returns
 * {@code 0.0} instead of {@code NaN}. No state, no I/O.
 */
public final class Statistics {

    private Statistics() {}

    public static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) total += v;
        return total;
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        return sum(values) / values.length;
    }

    /** Standard deviation with divisor n. */
    public static double populationStdDev(double[] values) {
        int n = values.length;
        if (n == 0) return 0.0;
        double mean = mean(values);
        double variance = 0.0;
        for (double v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / n);
    }

    /**
     * Pearson correlation coefficient. Returns 0 when the series differ in length, are
     * empty, or either one is constant.
     */
    public static double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n == 0 || n != y.length) return 0.0;

        double xMean = mean(x);
        double yMean = mean(y);
        double numerator = 0.0;
        double xSquares  = 0.0;
        double ySquares  = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - xMean;
            double dy = y[i] - yMean;
            numerator += dx * dy;
            xSquares  += dx * dx;
            ySquares  += dy * dy;
        }

        double denominator = Math.sqrt(xSquares * ySquares);
        return denominator == 0.0 ? 0.0 : numerator / denominator;
    }

    /**
     * Ordinary least-squares fit of {@code y} against {@code x}.
     * A zero-variance {@code x} yields slope 0 and intercept {@code mean(y)}.
     */
    public static RegressionLine linearRegression(double[] x, double[] y) {
        int n = x.length;
        if (n == 0 || n != y.length) return RegressionLine.FLAT;

        double xMean = mean(x);
        double yMean = mean(y);
        double xx = 0.0;
        double yy = 0.0;
        double xy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - xMean;
            double dy = y[i] - yMean;
            xx += dx * dx;
            yy += dy * dy;
            xy += dx * dy;
        }

        double slope     = xx == 0.0 ? 0.0 : xy / xx;
        double intercept = yMean - slope * xMean;
        double root      = Math.sqrt(xx * yy);
        double r         = root == 0.0 ? 0.0 : xy / root;
        return new RegressionLine(slope, intercept, r);
    }

    /** Regression of {@code y} against its own index 0..n-1. */
    public static RegressionLine linearRegression(double[] y) {
        return linearRegression(indices(y.length), y);
    }

    /** Differences between consecutive values; length n-1, empty for n &lt; 2. */
    public static double[] deltas(double[] values) {
        if (values.length < 2) return new double[0];
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }

    /**
     * Fraction of consecutive steps where the value strictly rose. 1.0 means monotonically
     * rising; 0 for fewer than two values.
     */
    public static double risingFraction(double[] values) {
        if (values.length < 2) return 0.0;
        int rising = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[i - 1]) rising++;
        }
        return (double) rising / (values.length - 1);
    }

    /** The last {@code count} values, or all of them when fewer exist. */
    public static double[] tail(double[] values, int count) {
        int from = Math.max(0, values.length - count);
        double[] out = new double[values.length - from];
        System.arraycopy(values, from, out, 0, out.length);
        return out;
    }

    /** z-score with a zero deviation treated as 1, so the raw distance still shows. */
    public static double zScore(double value, double mean, double stdDev) {
        return (value - mean) / (stdDev == 0.0 ? 1.0 : stdDev);
    }

    private static double[] indices(int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = i;
        return x;
    }
}

package com.fundflow.common.stats;

/**
 * Result of a least-squares fit: {@code y = slope * x + intercept}, with Pearson {@code r}.
 */
public record RegressionLine(double slope, double intercept, double r) {

    static final RegressionLine FLAT = new RegressionLine(0.0, 0.0, 0.0);

    /** Fit quality regardless of sign, in [0, 1]. */
    public double strength() {
        return Math.abs(r);
    }

    public boolean isRising() {
        return slope > 0;
    }
}

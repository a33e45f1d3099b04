package com.example.gsiprojection.pricing;

/**
 * Standard normal cumulative distribution function using the Zelen &amp; Severo rational
 * approximation (Abramowitz &amp; Stegun 26.2.17). Absolute error is below 7.5e-8.
 *
 * Outside [-6, 6] the result is pinned to exactly 0.0 or 1.0 so the exponential term
 * never has to be evaluated for extreme arguments.
 */
public final class NormalApproximator {

    private static final double B1 = 0.319381530;
    private static final double B2 = -0.356563782;
    private static final double B3 = 1.781477937;
    private static final double B4 = -1.821255978;
    private static final double B5 = 1.330274429;
    private static final double P = 0.2316419;
    // 1 / sqrt(2 pi)
    private static final double C = 0.39894228;

    private static final double CLAMP = 6.0;

    private NormalApproximator() {
    }

    public static double cdf(double z) {
        if (z > CLAMP) return 1.0;
        if (z < -CLAMP) return 0.0;
        double a = Math.abs(z);
        double t = 1.0 / (1.0 + a * P);
        double density = C * Math.exp((-z * z) / 2.0);
        double poly = ((((B5 * t + B4) * t + B3) * t + B2) * t + B1) * t;
        double n = 1.0 - density * poly;
        return z < 0.0 ? 1.0 - n : n;
    }
}

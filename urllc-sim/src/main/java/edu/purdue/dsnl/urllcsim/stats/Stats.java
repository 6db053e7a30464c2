package edu.purdue.dsnl.urllcsim.stats;

import it.unimi.dsi.fastutil.doubles.DoubleList;

import java.util.Arrays;

/** Summary statistics with explicit zero results for empty inputs and zero denominators. */
public final class Stats {
    private Stats() {
    }

    public static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    public static double mean(DoubleList values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (int i = 0; i < values.size(); i++) {
            sum += values.getDouble(i);
        }
        return sum / values.size();
    }

    /**
     * Percentile by linear interpolation between closest ranks, {@code p} in {@code [0, 100]}. Returns 0 for an
     * empty list.
     */
    public static double percentile(DoubleList values, double p) {
        if (p < 0 || p > 100) {
            throw new IllegalArgumentException("Percentile must be within [0, 100], got " + p);
        }
        if (values.isEmpty()) {
            return 0.0;
        }
        double[] sorted = values.toDoubleArray();
        Arrays.sort(sorted);
        double rank = p / 100 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }

    /**
     * Jain's fairness index {@code (sum x)^2 / (n sum x^2)}. Within {@code [1/n, 1]} for non-negative inputs that are
     * not all zero; 0 for an empty or all-zero input.
     */
    public static double jainIndex(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        double sumSquares = 0;
        for (double v : values) {
            sum += v;
            sumSquares += v * v;
        }
        return ratio(sum * sum, values.length * sumSquares);
    }
}

package com.boxofficeintel.daily.service;

import java.util.List;

/**
 * Small statistics over already-filtered (null-free) series. Every method returns null when
 * the series is too short to define the statistic.
 */
final class SeriesStats {

    private SeriesStats() {
    }

    static Double mean(List<? extends Number> values) {
        if (values.isEmpty()) return null;
        double sum = 0.0;
        for (Number v : values) sum += v.doubleValue();
        return sum / values.size();
    }

    /** Sample standard deviation (n - 1 denominator), needs two points. */
    static Double sampleStdDev(List<? extends Number> values) {
        if (values.size() < 2) return null;
        double mean = mean(values);
        double squares = 0.0;
        for (Number v : values) {
            double d = v.doubleValue() - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (values.size() - 1));
    }

    static Double max(List<? extends Number> values) {
        Double best = null;
        for (Number v : values) {
            if (best == null || v.doubleValue() > best) best = v.doubleValue();
        }
        return best;
    }

    static Double min(List<? extends Number> values) {
        Double best = null;
        for (Number v : values) {
            if (best == null || v.doubleValue() < best) best = v.doubleValue();
        }
        return best;
    }

    /**
     * Ordinary least-squares slope of ys against xs. Needs three points and some spread in x.
     */
    static Double slope(List<? extends Number> xs, List<? extends Number> ys) {
        int n = Math.min(xs.size(), ys.size());
        if (n < 3) return null;
        double meanX = mean(xs.subList(0, n));
        double meanY = mean(ys.subList(0, n));
        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = xs.get(i).doubleValue() - meanX;
            covariance += dx * (ys.get(i).doubleValue() - meanY);
            varianceX += dx * dx;
        }
        if (varianceX == 0.0) return null;
        return covariance / varianceX;
    }
}

package com.chicu.cellfeatures.math;

/**
 * Линейная регрессия y = slope * x + intercept методом наименьших квадратов (polyfit deg=1).
 */
public record LinearFit(double slope, double intercept) {

    public static LinearFit of(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x/y разной длины: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            return new LinearFit(Double.NaN, Double.NaN);
        }

        double mx = Stats.mean(x);
        double my = Stats.mean(y);
        double sxx = 0, sxy = 0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - mx;
            sxx += dx * dx;
            sxy += dx * (y[i] - my);
        }
        if (sxx == 0) {
            return new LinearFit(Double.NaN, Double.NaN);
        }

        double slope = sxy / sxx;
        return new LinearFit(slope, my - slope * mx);
    }
}

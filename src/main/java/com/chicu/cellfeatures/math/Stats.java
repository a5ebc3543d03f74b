package com.chicu.cellfeatures.math;

import java.util.Arrays;

/**
 * Описательная статистика над double[] без внешних библиотек.
 *
 * Соглашения:
 * - variance: популяционная (ddof=0);
 * - skew: смещённая оценка m3 / m2^1.5;
 * - kurtosis(excess=true, bias=true): m4 / m2^2 - 3;
 * - pearsonKurtosisUnbiased: несмещённая оценка без вычитания 3.
 * Пустой вход → NaN (кроме sum*, там 0).
 */
public final class Stats {

    private Stats() {
    }

    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static double mean(double[] x) {
        if (x.length == 0) return Double.NaN;
        double sum = 0;
        for (double v : x) sum += v;
        return sum / x.length;
    }

    public static double nanMean(double[] x) {
        return mean(nonNaN(x));
    }

    public static double nanSum(double[] x) {
        double sum = 0;
        for (double v : x) {
            if (!Double.isNaN(v)) sum += v;
        }
        return sum;
    }

    public static double min(double[] x) {
        if (x.length == 0) return Double.NaN;
        double m = Double.POSITIVE_INFINITY;
        for (double v : x) m = Math.min(m, v);
        return m;
    }

    public static double max(double[] x) {
        if (x.length == 0) return Double.NaN;
        double m = Double.NEGATIVE_INFINITY;
        for (double v : x) m = Math.max(m, v);
        return m;
    }

    public static double nanMin(double[] x) {
        return min(nonNaN(x));
    }

    public static double nanMax(double[] x) {
        return max(nonNaN(x));
    }

    public static double median(double[] x) {
        if (x.length == 0) return Double.NaN;
        double[] s = x.clone();
        Arrays.sort(s);
        int mid = s.length / 2;
        return (s.length % 2 == 1) ? s[mid] : (s[mid - 1] + s[mid]) / 2.0;
    }

    public static double variance(double[] x) {
        return centralMoment(x, 2);
    }

    public static double nanVariance(double[] x) {
        return variance(nonNaN(x));
    }

    public static double skew(double[] x) {
        double m2 = centralMoment(x, 2);
        double m3 = centralMoment(x, 3);
        return m3 / Math.pow(m2, 1.5);
    }

    public static double kurtosis(double[] x) {
        double m2 = centralMoment(x, 2);
        double m4 = centralMoment(x, 4);
        return m4 / (m2 * m2) - 3.0;
    }

    /**
     * Kurtosis по Пирсону с поправкой на смещение (без вычитания 3).
     * Для n &lt; 4 поправка не определена: возвращаем смещённую оценку.
     */
    public static double pearsonKurtosisUnbiased(double[] x) {
        int n = x.length;
        double m2 = centralMoment(x, 2);
        double m4 = centralMoment(x, 4);
        double biased = m4 / (m2 * m2);
        if (n < 4) return biased;
        double excess = 1.0 / (n - 2) / (n - 3) * ((n * (double) n - 1.0) * biased - 3.0 * (n - 1) * (n - 1));
        return excess + 3.0;
    }

    public static double sumAbs(double[] x) {
        double s = 0;
        for (double v : x) s += Math.abs(v);
        return s;
    }

    public static double sumSquares(double[] x) {
        double s = 0;
        for (double v : x) s += v * v;
        return s;
    }

    /**
     * log10(|x|): «signed-log» преобразование признаков.
     */
    public static double signedLog(double x) {
        return Math.log10(Math.abs(x));
    }

    public static double centralMoment(double[] x, int order) {
        if (x.length == 0) return Double.NaN;
        double mean = mean(x);
        double acc = 0;
        for (double v : x) acc += Math.pow(v - mean, order);
        return acc / x.length;
    }

    private static double[] nonNaN(double[] x) {
        return Arrays.stream(x).filter(v -> !Double.isNaN(v)).toArray();
    }
}

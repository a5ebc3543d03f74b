package com.chicu.cellfeatures.math;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * GaussianPeakFitter
 * ==================
 * Аппроксимация кривой суммой гауссиан:
 *   y(x) = Σ a_k * exp(-(x - mu_k)^2 / (2 * sigma_k^2))
 *
 * 1) сглаживание скользящим средним и поиск пиков по prominence;
 * 2) начальное приближение из найденных пиков (высота, позиция, полуширина);
 * 3) уточнение всех параметров методом Левенберга–Марквардта по исходным точкам.
 *
 * Пики в результате отсортированы по центру.
 */
public final class GaussianPeakFitter {

    private static final double FWHM_TO_SIGMA = 2.0 * Math.sqrt(2.0 * Math.log(2.0));

    public record Peak(double amplitude, double center, double sigma) {}

    public record FitResult(List<Peak> peaks, double residualSumOfSquares, int iterations) {

        public static FitResult empty() {
            return new FitResult(List.of(), Double.NaN, 0);
        }
    }

    private final int smoothingWindow;
    private final double minProminenceFraction;
    private final int maxIterations;

    public GaussianPeakFitter() {
        this(5, 0.05, 200);
    }

    public GaussianPeakFitter(int smoothingWindow, double minProminenceFraction, int maxIterations) {
        this.smoothingWindow = Math.max(1, smoothingWindow | 1); // всегда нечётное
        this.minProminenceFraction = Math.max(0.0, minProminenceFraction);
        this.maxIterations = Math.max(1, maxIterations);
    }

    public FitResult fit(double[] xRaw, double[] yRaw, int maxPeaks) {
        if (xRaw.length != yRaw.length) {
            throw new IllegalArgumentException("x/y разной длины: " + xRaw.length + " vs " + yRaw.length);
        }
        if (maxPeaks <= 0) {
            throw new IllegalArgumentException("maxPeaks должен быть > 0, пришло: " + maxPeaks);
        }

        double[][] xy = sortedFinite(xRaw, yRaw);
        double[] x = xy[0];
        double[] y = xy[1];
        if (x.length < 3) {
            return FitResult.empty();
        }

        double[] smooth = movingAverage(y, smoothingWindow);
        List<Integer> peakIdx = findPeaks(smooth, maxPeaks);
        if (peakIdx.isEmpty()) {
            return FitResult.empty();
        }

        double[] p = initialGuess(x, smooth, peakIdx);
        int iterations = levenbergMarquardt(x, y, p);

        List<Peak> peaks = new ArrayList<>();
        for (int k = 0; k < p.length / 3; k++) {
            peaks.add(new Peak(p[3 * k], p[3 * k + 1], Math.abs(p[3 * k + 2])));
        }
        peaks.sort(Comparator.comparingDouble(Peak::center));

        return new FitResult(List.copyOf(peaks), cost(x, y, p), iterations);
    }

    // =====================================================================
    // ПОИСК ПИКОВ
    // =====================================================================

    static double[] movingAverage(double[] y, int window) {
        int half = window / 2;
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(y.length - 1, i + half);
            double sum = 0;
            for (int j = from; j <= to; j++) sum += y[j];
            out[i] = sum / (to - from + 1);
        }
        return out;
    }

    List<Integer> findPeaks(double[] s, int maxPeaks) {
        double top = Stats.max(s);
        if (!(top > 0)) return List.of();
        double minProminence = minProminenceFraction * top;

        List<double[]> candidates = new ArrayList<>(); // {index, prominence}
        for (int i = 1; i < s.length - 1; i++) {
            if (s[i] > s[i - 1] && s[i] >= s[i + 1]) {
                double prom = prominence(s, i);
                if (prom >= minProminence) {
                    candidates.add(new double[]{i, prom});
                }
            }
        }

        return candidates.stream()
                .sorted((a, b) -> Double.compare(b[1], a[1]))
                .limit(maxPeaks)
                .map(c -> (int) c[0])
                .sorted()
                .toList();
    }

    private static double prominence(double[] s, int i) {
        double leftMin = s[i];
        for (int j = i - 1; j >= 0 && s[j] <= s[i]; j--) leftMin = Math.min(leftMin, s[j]);
        double rightMin = s[i];
        for (int j = i + 1; j < s.length && s[j] <= s[i]; j++) rightMin = Math.min(rightMin, s[j]);
        return s[i] - Math.max(leftMin, rightMin);
    }

    private static double[] initialGuess(double[] x, double[] s, List<Integer> peakIdx) {
        double minSigma = 2.0 * medianStep(x);
        double fallbackSigma = (x[x.length - 1] - x[0]) / (10.0 * peakIdx.size());

        double[] p = new double[3 * peakIdx.size()];
        for (int k = 0; k < peakIdx.size(); k++) {
            int i = peakIdx.get(k);
            double half = s[i] / 2.0;
            int l = i;
            while (l > 0 && s[l] > half) l--;
            int r = i;
            while (r < s.length - 1 && s[r] > half) r++;

            double sigma = (x[r] - x[l]) / FWHM_TO_SIGMA;
            if (!(sigma > 0)) sigma = fallbackSigma;

            p[3 * k] = s[i];
            p[3 * k + 1] = x[i];
            p[3 * k + 2] = Math.max(sigma, minSigma > 0 ? minSigma : sigma);
        }
        return p;
    }

    private static double medianStep(double[] x) {
        double[] d = new double[x.length - 1];
        for (int i = 1; i < x.length; i++) d[i - 1] = x[i] - x[i - 1];
        return Stats.median(d);
    }

    // =====================================================================
    // ЛЕВЕНБЕРГ–МАРКВАРДТ
    // =====================================================================

    private int levenbergMarquardt(double[] x, double[] y, double[] p) {
        int m = p.length;
        double lambda = 1e-3;
        double current = cost(x, y, p);
        int it = 0;

        while (it < maxIterations) {
            it++;
            double[][] jtj = new double[m][m];
            double[] jtr = new double[m];
            double[] grad = new double[m];

            for (int i = 0; i < x.length; i++) {
                double residual = y[i] - model(x[i], p);
                jacobianRow(x[i], p, grad);
                for (int a = 0; a < m; a++) {
                    jtr[a] += grad[a] * residual;
                    for (int b = a; b < m; b++) jtj[a][b] += grad[a] * grad[b];
                }
            }
            for (int a = 0; a < m; a++) {
                for (int b = 0; b < a; b++) jtj[a][b] = jtj[b][a];
            }

            boolean improved = false;
            while (lambda < 1e12) {
                double[][] lhs = new double[m][];
                for (int a = 0; a < m; a++) {
                    lhs[a] = jtj[a].clone();
                    lhs[a][a] += lambda * Math.max(jtj[a][a], 1e-12);
                }
                double[] delta = solve(lhs, jtr.clone());
                if (delta == null) {
                    lambda *= 10;
                    continue;
                }

                double[] trial = p.clone();
                for (int a = 0; a < m; a++) trial[a] += delta[a];
                double trialCost = cost(x, y, trial);

                if (trialCost < current) {
                    double rel = (current - trialCost) / Math.max(current, 1e-300);
                    System.arraycopy(trial, 0, p, 0, m);
                    current = trialCost;
                    lambda = Math.max(lambda / 10, 1e-12);
                    improved = true;
                    if (rel < 1e-12) return it;
                    break;
                }
                lambda *= 10;
            }
            if (!improved) return it;
        }
        return it;
    }

    static double model(double x, double[] p) {
        double sum = 0;
        for (int k = 0; k < p.length; k += 3) {
            double sigma = p[k + 2];
            double d = x - p[k + 1];
            sum += p[k] * Math.exp(-d * d / (2 * sigma * sigma));
        }
        return sum;
    }

    private static void jacobianRow(double x, double[] p, double[] out) {
        for (int k = 0; k < p.length; k += 3) {
            double a = p[k];
            double mu = p[k + 1];
            double sigma = p[k + 2];
            double d = x - mu;
            double s2 = sigma * sigma;
            double e = Math.exp(-d * d / (2 * s2));
            out[k] = e;
            out[k + 1] = a * e * d / s2;
            out[k + 2] = a * e * d * d / (s2 * sigma);
        }
    }

    private static double cost(double[] x, double[] y, double[] p) {
        double c = 0;
        for (int i = 0; i < x.length; i++) {
            double r = y[i] - model(x[i], p);
            c += r * r;
        }
        return c;
    }

    /**
     * Гаусс с выбором главного элемента. null: если система вырождена.
     */
    static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int r = col + 1; r < n; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) pivot = r;
            }
            if (Math.abs(a[pivot][col]) < 1e-300 || !Double.isFinite(a[pivot][col])) return null;

            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int r = col + 1; r < n; r++) {
                double f = a[r][col] / a[col][col];
                if (f == 0) continue;
                for (int c = col; c < n; c++) a[r][c] -= f * a[col][c];
                b[r] -= f * b[col];
            }
        }

        double[] xSol = new double[n];
        for (int r = n - 1; r >= 0; r--) {
            double acc = b[r];
            for (int c = r + 1; c < n; c++) acc -= a[r][c] * xSol[c];
            xSol[r] = acc / a[r][r];
            if (!Double.isFinite(xSol[r])) return null;
        }
        return xSol;
    }

    private static double[][] sortedFinite(double[] x, double[] y) {
        Integer[] idx = new Integer[x.length];
        int n = 0;
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) idx[n++] = i;
        }
        Integer[] keep = Arrays.copyOf(idx, n);
        Arrays.sort(keep, Comparator.comparingDouble(i -> x[i]));

        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = x[keep[i]];
            ys[i] = y[keep[i]];
        }
        return new double[][]{xs, ys};
    }
}

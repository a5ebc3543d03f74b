package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.math.Stats;
import com.chicu.cellfeatures.table.DataTable;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Признаки релаксации напряжения в HPPC.
 *
 * Для каждого отрезка релаксации (окно SOC) считается время, за которое напряжение
 * проходит p% пути от начального V0 к конечному Vf; признак = t(HPPC #1) / t(HPPC #0).
 * Колонки по каждому проценту: var_p% и SOC90%_degradp% … SOC10%_degradp%.
 */
final class RelaxationFeatures {

    static final int[] PERCENTAGES = {50, 80, 99};
    static final int[] SOC_LABELS = {90, 80, 70, 60, 50, 40, 30, 20, 10};

    private RelaxationFeatures() {
    }

    static DataTable compute(DataTable diagnosticInterpolated) {
        double[][] ref = relaxationTimes(HppcFeatures.hppc(diagnosticInterpolated, 0));
        double[][] pos = relaxationTimes(HppcFeatures.hppc(diagnosticInterpolated, 1));

        Map<String, Double> row = new LinkedHashMap<>();
        for (int p = 0; p < PERCENTAGES.length; p++) {
            double[] ratio = new double[SOC_LABELS.length];
            for (int w = 0; w < SOC_LABELS.length; w++) {
                ratio[w] = pos[w][p] / ref[w][p];
            }
            row.put("var_" + PERCENTAGES[p] + "%", Stats.variance(Stats.finite(ratio)));
            for (int w = 0; w < SOC_LABELS.length; w++) {
                row.put("SOC" + SOC_LABELS[w] + "%_degrad" + PERCENTAGES[p] + "%", ratio[w]);
            }
        }
        return DataTable.ofRow(row);
    }

    /**
     * [окно][процент]; отсутствующие окна → NaN.
     */
    static double[][] relaxationTimes(HppcCycle cycle) {
        double[][] out = new double[SOC_LABELS.length][PERCENTAGES.length];
        for (double[] r : out) Arrays.fill(r, Double.NaN);

        List<HppcCycle.Segment> relax = cycle.relaxationSegments();
        for (int w = 0; w < Math.min(SOC_LABELS.length, relax.size()); w++) {
            double[] v = cycle.voltage(relax.get(w));
            double[] t = cycle.elapsed(relax.get(w));
            for (int p = 0; p < PERCENTAGES.length; p++) {
                out[w][p] = timeToFraction(t, v, PERCENTAGES[p] / 100.0);
            }
        }
        return out;
    }

    static double timeToFraction(double[] t, double[] v, double fraction) {
        if (v.length < 2) return Double.NaN;
        double v0 = v[0];
        double total = v[v.length - 1] - v0;
        if (total == 0 || !Double.isFinite(total)) return Double.NaN;

        for (int i = 0; i < v.length; i++) {
            if ((v[i] - v0) / total >= fraction) return t[i];
        }
        return Double.NaN;
    }
}

package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.math.Stats;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.table.DataTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Оконные статистики разряда между двумя вхождениями диагностического цикла.
 *
 * Вхождение начинается на строке start; окно разряда = строки [start + Q_seg + 1, start + 2·Q_seg)
 * (первые Q_seg точек интерполяции: заряд). Разность поэлементная, нечисловые отбрасываются.
 */
public final class FastChargeWindowStats {

    public static final String CYCLE_COMP_NUM = "cycle_comp_num";
    public static final String Q_SEG = "Q_seg";
    public static final String DIAGNOSTIC_CYCLE_TYPE = "diagnostic_cycle_type";

    static final List<Integer> DEFAULT_CYCLE_COMP_NUM = List.of(0, 1);
    static final int DEFAULT_Q_SEG = 500;

    private static final Map<String, ToDoubleFunction<double[]>> STATS = new LinkedHashMap<>();

    static {
        STATS.put("var", Stats::variance);
        STATS.put("min", Stats::min);
        STATS.put("mean", Stats::mean);
        STATS.put("skew", Stats::skew);
        STATS.put("kurtosis", Stats::pearsonKurtosisUnbiased);
        STATS.put("abs", Stats::sumAbs);
        STATS.put("square", Stats::sumSquares);
    }

    private FastChargeWindowStats() {
    }

    public static DataTable compute(DataTable diagnosticInterpolated, String cycleType,
                                    List<Integer> compare, int qSeg) {
        if (compare == null || compare.size() != 2) {
            throw new FeaturizationException("cycle_comp_num должен содержать два номера, пришло: " + compare);
        }
        if (qSeg <= 0) {
            throw new FeaturizationException("Q_seg должен быть > 0, пришло: " + qSeg);
        }

        List<int[]> blocks = DiagnosticCycles.occurrenceBlocks(diagnosticInterpolated, cycleType);
        int first = compare.get(0);
        int second = compare.get(1);
        if (Math.max(first, second) >= blocks.size() || Math.min(first, second) < 0) {
            throw new FeaturizationException("Нет вхождений " + compare + " цикла " + cycleType
                    + " (всего " + blocks.size() + ")");
        }

        int n = diagnosticInterpolated.rowCount();
        int startRef = blocks.get(first)[0];
        int startCmp = blocks.get(second)[0];

        Map<String, Double> row = new LinkedHashMap<>();
        put(row, "capacity", diagnosticInterpolated.numeric(RunColumns.DISCHARGE_CAPACITY), startRef, startCmp, qSeg, n);
        put(row, "energy", diagnosticInterpolated.numeric(RunColumns.DISCHARGE_ENERGY), startRef, startCmp, qSeg, n);
        put(row, "dQdV", diagnosticInterpolated.numeric(RunColumns.DISCHARGE_DQDV), startRef, startCmp, qSeg, n);
        return DataTable.ofRow(row);
    }

    private static void put(Map<String, Double> row, String quantity, double[] values,
                            int startRef, int startCmp, int qSeg, int n) {
        double[] diff = windowDifference(values, startRef, startCmp, qSeg, n);
        for (Map.Entry<String, ToDoubleFunction<double[]>> op : STATS.entrySet()) {
            double stat = diff.length == 0 ? Double.NaN : op.getValue().applyAsDouble(diff);
            row.put(op.getKey() + "_discharging_" + quantity, Stats.signedLog(stat));
        }
    }

    static double[] windowDifference(double[] values, int startRef, int startCmp, int qSeg, int n) {
        int fromRef = Math.min(n, startRef + qSeg + 1);
        int toRef = Math.min(n, startRef + 2 * qSeg);
        int fromCmp = Math.min(n, startCmp + qSeg + 1);
        int toCmp = Math.min(n, startCmp + 2 * qSeg);
        int len = Math.max(0, Math.min(toRef - fromRef, toCmp - fromCmp));

        double[] diff = new double[len];
        for (int i = 0; i < len; i++) diff[i] = values[fromCmp + i] - values[fromRef + i];
        return Stats.finite(diff);
    }
}

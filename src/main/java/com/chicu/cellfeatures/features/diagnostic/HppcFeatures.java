package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.DiagnosticCycleType;
import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.math.LinearFit;
import com.chicu.cellfeatures.math.Stats;
import com.chicu.cellfeatures.table.DataTable;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Признаки HPPC: изменение сопротивления, OCV, кривой разряда и коэффициента диффузии
 * между HPPC #0 (опорный) и HPPC #diagPos.
 */
final class HppcFeatures {

    static final int MAX_SOC_WINDOWS = 9;

    private static final String[] RESISTANCE_COLUMNS = {
            "r_c_0s", "r_c_3s", "r_c_end", "r_d_0s", "r_d_3s", "r_d_end"
    };
    private static final double PULSE_PROBE_SECONDS = 3.0;

    private HppcFeatures() {
    }

    /**
     * Сопротивления (54 колонки), var_ocv, статистики v_diff и D_0..D_8 одной строкой.
     */
    static DataTable compute(DataTable diagnosticInterpolated, int diagPos, int socWindow) {
        HppcCycle ref = hppc(diagnosticInterpolated, 0);
        HppcCycle pos = hppc(diagnosticInterpolated, diagPos);

        Map<String, Double> row = new LinkedHashMap<>();
        resistance(ref, pos, row);
        row.put("var_ocv", varOcv(ref, pos));
        voltageDifference(ref, pos, socWindow, row);
        diffusion(ref, pos, row);
        return DataTable.ofRow(row);
    }

    static HppcCycle hppc(DataTable diagnosticInterpolated, int n) {
        return HppcCycle.parse(DiagnosticCycles.occurrence(diagnosticInterpolated, DiagnosticCycleType.HPPC.label(), n));
    }

    // =====================================================================
    // СОПРОТИВЛЕНИЕ
    // =====================================================================

    private static void resistance(HppcCycle ref, HppcCycle pos, Map<String, Double> row) {
        double[][] r0 = resistanceMatrix(ref);
        double[][] r1 = resistanceMatrix(pos);
        for (int c = 0; c < RESISTANCE_COLUMNS.length; c++) {
            for (int w = 0; w < MAX_SOC_WINDOWS; w++) {
                row.put(RESISTANCE_COLUMNS[c] + w, r1[c][w] - r0[c][w]);
            }
        }
    }

    /**
     * [колонка][окно]; нет окна или импульса → NaN.
     */
    private static double[][] resistanceMatrix(HppcCycle cycle) {
        double[][] r = new double[RESISTANCE_COLUMNS.length][MAX_SOC_WINDOWS];
        for (double[] col : r) Arrays.fill(col, Double.NaN);

        List<HppcCycle.Window> windows = cycle.windows();
        for (int w = 0; w < Math.min(MAX_SOC_WINDOWS, windows.size()); w++) {
            HppcCycle.Window win = windows.get(w);
            double rest = cycle.lastVoltage(win.opening());
            if (win.chargePulse() != null) {
                fillPulse(cycle, win.chargePulse(), rest, r, 0, w);
            }
            if (win.dischargePulse() != null) {
                fillPulse(cycle, win.dischargePulse(), rest, r, 3, w);
            }
        }
        return r;
    }

    /**
     * R = (V - V_покоя) / I в начале импульса, через 3 с и в конце.
     */
    private static void fillPulse(HppcCycle cycle, HppcCycle.Segment pulse, double rest,
                                  double[][] r, int offset, int w) {
        int[] rows = {pulse.from(), cycle.rowAfter(pulse, PULSE_PROBE_SECONDS), pulse.to() - 1};
        for (int k = 0; k < rows.length; k++) {
            double i = cycle.current(rows[k]);
            r[offset + k][w] = i == 0 ? Double.NaN : (cycle.voltageAt(rows[k]) - rest) / i;
        }
    }

    // =====================================================================
    // OCV И КРИВАЯ РАЗРЯДА
    // =====================================================================

    private static double varOcv(HppcCycle ref, HppcCycle pos) {
        List<HppcCycle.Window> a = ref.windows();
        List<HppcCycle.Window> b = pos.windows();
        int n = Math.min(a.size(), b.size());
        if (n == 0) return Double.NaN;

        double[] diff = new double[n];
        for (int i = 0; i < n; i++) {
            diff[i] = pos.lastVoltage(b.get(i).relaxation()) - ref.lastVoltage(a.get(i).relaxation());
        }
        return Stats.variance(Stats.finite(diff));
    }

    private static void voltageDifference(HppcCycle ref, HppcCycle pos, int socWindow, Map<String, Double> row) {
        double[] vRef = ccVoltage(ref, socWindow);
        double[] vPos = ccVoltage(pos, socWindow);
        int n = Math.min(vRef.length, vPos.length);
        if (n == 0) {
            throw new FeaturizationException("Нет CC-разряда в окне SOC " + socWindow);
        }

        double[] diff = new double[n];
        for (int i = 0; i < n; i++) diff[i] = vPos[i] - vRef[i];
        diff = Stats.finite(diff);

        row.put("var(v_diff)", Stats.signedLog(Stats.variance(diff)));
        row.put("min(v_diff)", Stats.signedLog(Stats.min(diff)));
        row.put("mean(v_diff)", Stats.signedLog(Stats.mean(diff)));
        row.put("skew(v_diff)", Stats.signedLog(Stats.skew(diff)));
        row.put("kurtosis(v_diff)", Stats.signedLog(Stats.pearsonKurtosisUnbiased(diff)));
        row.put("sum(abs(v_diff))", Stats.signedLog(Stats.sumAbs(diff)));
        row.put("sum(square(v_diff))", Stats.signedLog(Stats.sumSquares(diff)));
    }

    /**
     * Напряжение CC-разряда окна socWindow; окна нет → последнее доступное.
     */
    private static double[] ccVoltage(HppcCycle cycle, int socWindow) {
        List<HppcCycle.Window> windows = cycle.windows().stream()
                .filter(w -> w.ccDischarge() != null)
                .toList();
        if (windows.isEmpty()) return new double[0];
        int idx = Math.max(0, Math.min(socWindow, windows.size() - 1));
        return cycle.voltage(windows.get(idx).ccDischarge());
    }

    // =====================================================================
    // ДИФФУЗИЯ
    // =====================================================================

    /**
     * D_i = наклон V от sqrt(t) релаксации окна i (diagPos) / тот же наклон опорного HPPC.
     */
    private static void diffusion(HppcCycle ref, HppcCycle pos, Map<String, Double> row) {
        List<HppcCycle.Window> a = ref.windows();
        List<HppcCycle.Window> b = pos.windows();
        for (int w = 0; w < MAX_SOC_WINDOWS; w++) {
            double s0 = w < a.size() ? sqrtSlope(ref, a.get(w).relaxation()) : Double.NaN;
            double s1 = w < b.size() ? sqrtSlope(pos, b.get(w).relaxation()) : Double.NaN;
            row.put("D_" + w, s1 / s0);
        }
    }

    private static double sqrtSlope(HppcCycle cycle, HppcCycle.Segment relaxation) {
        double[] t = cycle.elapsed(relaxation);
        double[] sqrt = new double[t.length];
        for (int i = 0; i < t.length; i++) sqrt[i] = Math.sqrt(t[i]);
        return LinearFit.of(sqrt, cycle.voltage(relaxation)).slope();
    }
}

package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.DiagnosticCycleType;
import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.math.GaussianPeakFitter;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.table.DataTable;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Параметры гауссовых пиков dQ/dV в RPT-цикле и их относительное изменение.
 *
 * Для опорного и более позднего вхождения RPT кривая dQ/dV (заряд или |разряд|) раскладывается
 * на maxPeaks гауссиан; признак = 1 + (later - ref) / ref по каждому параметру.
 * Колонки m{k}_amp|mu|sigma_{rpt}_{charge|discharge}; недостающие пики → NaN.
 */
final class PeakFitFeatures {

    private PeakFitFeatures() {
    }

    static int maxPeaks(String rptType, boolean charge) {
        DiagnosticCycleType type = DiagnosticCycleType.fromLabel(rptType)
                .filter(DiagnosticCycleType::isRpt)
                .orElseThrow(() -> new FeaturizationException("Неизвестный тип RPT: " + rptType));
        return switch (type) {
            case RPT_0_2C -> 4;
            case RPT_1C, RPT_2C -> charge ? 4 : 3;
            default -> throw new FeaturizationException("Неизвестный тип RPT: " + rptType);
        };
    }

    static DataTable compute(DataTable diagnosticInterpolated, int diagRef, int diagNr,
                             boolean charge, String rptType, GaussianPeakFitter fitter) {
        int maxPeaks = maxPeaks(rptType, charge);

        double[] ref = peakParameters(diagnosticInterpolated, diagRef, charge, rptType, maxPeaks, fitter);
        double[] later = peakParameters(diagnosticInterpolated, diagNr, charge, rptType, maxPeaks, fitter);

        String suffix = "_" + rptType + "_" + (charge ? RunColumns.STEP_CHARGE : RunColumns.STEP_DISCHARGE);
        String[] params = {"amp", "mu", "sigma"};

        Map<String, Double> row = new LinkedHashMap<>();
        for (int k = 0; k < maxPeaks; k++) {
            for (int j = 0; j < params.length; j++) {
                int i = 3 * k + j;
                row.put("m" + k + "_" + params[j] + suffix, 1 + (later[i] - ref[i]) / ref[i]);
            }
        }
        return DataTable.ofRow(row);
    }

    /**
     * {amp0, mu0, sigma0, amp1, ...} длиной 3*maxPeaks; не найденные пики → NaN.
     */
    static double[] peakParameters(DataTable diagnosticInterpolated, int occurrence, boolean charge,
                                   String rptType, int maxPeaks, GaussianPeakFitter fitter) {
        DataTable cycle = DiagnosticCycles.occurrence(diagnosticInterpolated, rptType, occurrence);
        String step = charge ? RunColumns.STEP_CHARGE : RunColumns.STEP_DISCHARGE;
        if (cycle.hasColumn(RunColumns.STEP_TYPE)) {
            String[] steps = cycle.text(RunColumns.STEP_TYPE);
            cycle = cycle.filter(i -> step.equals(steps[i]));
        }

        double[] x = cycle.numeric(RunColumns.VOLTAGE);
        double[] y = cycle.numeric(charge ? RunColumns.CHARGE_DQDV : RunColumns.DISCHARGE_DQDV);
        if (!charge) {
            for (int i = 0; i < y.length; i++) y[i] = Math.abs(y[i]);
        }

        double[] out = new double[3 * maxPeaks];
        Arrays.fill(out, Double.NaN);
        List<GaussianPeakFitter.Peak> peaks = fitter.fit(x, y, maxPeaks).peaks();
        for (int k = 0; k < Math.min(maxPeaks, peaks.size()); k++) {
            out[3 * k] = peaks.get(k).amplitude();
            out[3 * k + 1] = peaks.get(k).center();
            out[3 * k + 2] = peaks.get(k).sigma();
        }
        return out;
    }
}

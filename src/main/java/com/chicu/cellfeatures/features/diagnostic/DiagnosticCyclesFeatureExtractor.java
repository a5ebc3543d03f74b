package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.DiagnosticCycleType;
import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.math.GaussianPeakFitter;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Полный набор признаков по диагностическим циклам:
 * пики dQ/dV RPT + HPPC (сопротивление, OCV, v_diff, диффузия) + релаксация + оконные статистики разряда.
 */
@Slf4j
@Component
public class DiagnosticCyclesFeatureExtractor implements FeatureExtractor {

    public static final String DIAG_REF = "diag_ref";
    public static final String DIAG_NR = "diag_nr";
    public static final String CHARGE_Y_N = "charge_y_n";
    public static final String RPT_TYPE = "rpt_type";
    public static final String DIAG_POS = "diag_pos";
    public static final String SOC_WINDOW = "soc_window";

    private final GaussianPeakFitter fitter = new GaussianPeakFitter();

    @Override
    public FeatureType type() {
        return FeatureType.DIAGNOSTIC_CYCLES;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return DiagnosticCycles.hasExpectedCycleTypes(run)
                && DiagnosticCycles.relaxationViable(run,
                hp.getInt(DiagnosticCycles.N_SOC_WINDOWS, DiagnosticCycles.DEFAULT_N_SOC_WINDOWS));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        DataTable interp = run.diagnosticInterpolated();

        DataTable peaks = PeakFitFeatures.compute(interp,
                hp.getInt(DIAG_REF, 0),
                hp.getInt(DIAG_NR, 1),
                hp.getInt(CHARGE_Y_N, 1) == 1,
                hp.getString(RPT_TYPE, DiagnosticCycleType.RPT_0_2C.label()),
                fitter);
        DataTable hppc = HppcFeatures.compute(interp, hp.getInt(DIAG_POS, 1), hp.getInt(SOC_WINDOW, 8));
        DataTable relaxation = RelaxationFeatures.compute(interp);
        DataTable windows = FastChargeWindowStats.compute(interp,
                hp.getString(FastChargeWindowStats.DIAGNOSTIC_CYCLE_TYPE, DiagnosticCycleType.RPT_0_2C.label()),
                hp.getIntList(FastChargeWindowStats.CYCLE_COMP_NUM, FastChargeWindowStats.DEFAULT_CYCLE_COMP_NUM),
                hp.getInt(FastChargeWindowStats.Q_SEG, FastChargeWindowStats.DEFAULT_Q_SEG));

        DataTable out = peaks.concatColumns(hppc).concatColumns(relaxation).concatColumns(windows);
        log.debug("🔬 {}: {} признаков", run.barcode(), out.columnCount());
        return out;
    }
}

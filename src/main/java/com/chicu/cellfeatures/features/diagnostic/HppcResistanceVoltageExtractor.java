package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

/**
 * HPPC: сопротивление, var_ocv, v_diff и диффузия без остальных диагностических блоков.
 */
@Component
public class HppcResistanceVoltageExtractor implements FeatureExtractor {

    @Override
    public FeatureType type() {
        return FeatureType.HPPC_RESISTANCE_VOLTAGE;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return run != null && run.hasDiagnostics()
                && DiagnosticCycles.relaxationViable(run,
                hp.getInt(DiagnosticCycles.N_SOC_WINDOWS, DiagnosticCycles.DEFAULT_N_SOC_WINDOWS));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        return HppcFeatures.compute(run.diagnosticInterpolated(),
                hp.getInt(DiagnosticCyclesFeatureExtractor.DIAG_POS, 1),
                hp.getInt(DiagnosticCyclesFeatureExtractor.SOC_WINDOW, 8));
    }
}

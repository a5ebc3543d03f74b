package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

/**
 * Релаксация HPPC: отношения времён выхода на 50/80/99% конечного напряжения покоя
 * (2-й HPPC к 1-му) по окнам SOC, без остальных диагностических блоков.
 */
@Component
public class HppcRelaxationExtractor implements FeatureExtractor {

    @Override
    public FeatureType type() {
        return FeatureType.HPPC_RELAXATION;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return run != null && run.hasDiagnostics()
                && DiagnosticCycles.relaxationViable(run,
                hp.getInt(DiagnosticCycles.N_SOC_WINDOWS, DiagnosticCycles.DEFAULT_N_SOC_WINDOWS));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        return RelaxationFeatures.compute(run.diagnosticInterpolated());
    }
}

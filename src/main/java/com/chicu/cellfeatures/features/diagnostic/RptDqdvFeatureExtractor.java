package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.DiagnosticCycleType;
import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.math.GaussianPeakFitter;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

import static com.chicu.cellfeatures.features.diagnostic.DiagnosticCyclesFeatureExtractor.CHARGE_Y_N;
import static com.chicu.cellfeatures.features.diagnostic.DiagnosticCyclesFeatureExtractor.DIAG_NR;
import static com.chicu.cellfeatures.features.diagnostic.DiagnosticCyclesFeatureExtractor.DIAG_REF;
import static com.chicu.cellfeatures.features.diagnostic.DiagnosticCyclesFeatureExtractor.RPT_TYPE;

/**
 * Только блок пиков dQ/dV RPT-цикла.
 */
@Component
public class RptDqdvFeatureExtractor implements FeatureExtractor {

    private final GaussianPeakFitter fitter = new GaussianPeakFitter();

    @Override
    public FeatureType type() {
        return FeatureType.RPT_DQDV;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return DiagnosticCycles.hasExpectedCycleTypes(run);
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        return PeakFitFeatures.compute(run.diagnosticInterpolated(),
                hp.getInt(DIAG_REF, 0),
                hp.getInt(DIAG_NR, 1),
                hp.getInt(CHARGE_Y_N, 1) == 1,
                hp.getString(RPT_TYPE, DiagnosticCycleType.RPT_0_2C.label()),
                fitter);
    }
}

package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.DiagnosticCycleType;
import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

/**
 * Оконные статистики разряда (capacity / energy / dQdV) между двумя вхождениями выбранного цикла.
 */
@Component
public class DiagnosticSummaryStatsExtractor implements FeatureExtractor {

    @Override
    public FeatureType type() {
        return FeatureType.DIAGNOSTIC_SUMMARY_STATS;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return DiagnosticCycles.hasExpectedCycleTypes(run);
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        return FastChargeWindowStats.compute(run.diagnosticInterpolated(),
                hp.getString(FastChargeWindowStats.DIAGNOSTIC_CYCLE_TYPE, DiagnosticCycleType.RPT_0_2C.label()),
                hp.getIntList(FastChargeWindowStats.CYCLE_COMP_NUM, FastChargeWindowStats.DEFAULT_CYCLE_COMP_NUM),
                hp.getInt(FastChargeWindowStats.Q_SEG, FastChargeWindowStats.DEFAULT_Q_SEG));
    }
}

package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Доля оставшейся ёмкости/энергии по диагностическим циклам.
 *
 * Для каждой величины и каждого встретившегося cycle_type: строки
 * (cycle_index, fractional_metric, cycle_type, metric) по циклам с cycle_index &gt; cutoff;
 * fractional_metric = значение / значение первой строки diagnostic summary.
 */
@Component
public class DiagnosticPropertiesExtractor implements FeatureExtractor {

    public static final String QUANTITIES = "quantities";
    public static final String CYCLE_INDEX_CUTOFF = "cycle_index_cutoff";

    static final List<String> DEFAULT_QUANTITIES = List.of(
            RunColumns.DISCHARGE_ENERGY, RunColumns.DISCHARGE_CAPACITY);
    static final int DEFAULT_CYCLE_INDEX_CUTOFF = 100;

    static final String FRACTIONAL_METRIC = "fractional_metric";
    static final String METRIC = "metric";

    @Override
    public FeatureType type() {
        return FeatureType.DIAGNOSTIC_PROPERTIES;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return DiagnosticCycles.hasExpectedCycleTypes(run)
                && DiagnosticCycles.relaxationViable(run,
                hp.getInt(DiagnosticCycles.N_SOC_WINDOWS, DiagnosticCycles.DEFAULT_N_SOC_WINDOWS));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        DataTable summary = run.diagnosticSummary();
        List<String> quantities = hp.getStringList(QUANTITIES, DEFAULT_QUANTITIES);
        int cutoff = hp.getInt(CYCLE_INDEX_CUTOFF, DEFAULT_CYCLE_INDEX_CUTOFF);

        List<DataTable> parts = new ArrayList<>();
        for (String quantity : quantities) {
            for (String cycleType : summary.uniqueText(RunColumns.CYCLE_TYPE)) {
                parts.add(fractionalRemaining(summary, quantity, cycleType, cutoff));
            }
        }
        return DataTable.concatRows(parts);
    }

    static DataTable fractionalRemaining(DataTable summary, String quantity, String cycleType, int cutoff) {
        String[] types = summary.text(RunColumns.CYCLE_TYPE);
        double[] cycles = summary.numeric(RunColumns.CYCLE_INDEX);
        double[] values = summary.numeric(quantity);
        double first = values.length > 0 ? values[0] : Double.NaN;

        DataTable rows = summary.filter(i -> cycleType.equals(types[i]) && cycles[i] > cutoff);
        double[] fraction = rows.numeric(quantity);
        for (int i = 0; i < fraction.length; i++) fraction[i] = fraction[i] / first;

        return rows.select(List.of(RunColumns.CYCLE_INDEX))
                .withNumeric(FRACTIONAL_METRIC, fraction)
                .withText(RunColumns.CYCLE_TYPE, cycleType)
                .withText(METRIC, quantity);
    }
}

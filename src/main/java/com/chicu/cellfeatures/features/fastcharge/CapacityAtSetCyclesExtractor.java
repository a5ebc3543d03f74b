package com.chicu.cellfeatures.features.fastcharge;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Разрядная ёмкость на фиксированных циклах: строки summary с позициями
 * cycle_min, cycle_min + cycle_interval, ... (< cycle_max), колонки capacity_&lt;позиция&gt;.
 * Прогон короче позиции → NaN.
 */
@Component
public class CapacityAtSetCyclesExtractor implements FeatureExtractor {

    public static final String CYCLE_MIN = "cycle_min";
    public static final String CYCLE_MAX = "cycle_max";
    public static final String CYCLE_INTERVAL = "cycle_interval";

    static final int DEFAULT_CYCLE_MIN = 200;
    static final int DEFAULT_CYCLE_MAX = 1800;
    static final int DEFAULT_CYCLE_INTERVAL = 200;

    @Override
    public FeatureType type() {
        return FeatureType.CAPACITY_AT_SET_CYCLES;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return FastChargeChecks.hasEnoughCycles(run,
                hp.getInt(FastChargeChecks.INIT_PRED_CYCLE, FastChargeChecks.DEFAULT_INIT_PRED_CYCLE),
                hp.getInt(FastChargeChecks.FINAL_PRED_CYCLE, FastChargeChecks.DEFAULT_FINAL_PRED_CYCLE));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        int min = hp.getInt(CYCLE_MIN, DEFAULT_CYCLE_MIN);
        int max = hp.getInt(CYCLE_MAX, DEFAULT_CYCLE_MAX);
        int step = hp.getInt(CYCLE_INTERVAL, DEFAULT_CYCLE_INTERVAL);
        if (step <= 0) {
            throw new IllegalArgumentException("cycle_interval должен быть > 0, пришло: " + step);
        }
        if (min < 0) {
            throw new IllegalArgumentException("cycle_min должен быть ≥ 0, пришло: " + min);
        }

        double[] capacity = run.summary().numeric(RunColumns.DISCHARGE_CAPACITY);

        Map<String, Double> y = new LinkedHashMap<>();
        for (int c = min; c < max; c += step) {
            y.put("capacity_" + c, c < capacity.length ? capacity[c] : Double.NaN);
        }
        return DataTable.ofRow(y);
    }
}

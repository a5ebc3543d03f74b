package com.chicu.cellfeatures.features.fastcharge;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.math.Stats;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Номера циклов, на которых разрядная ёмкость впервые опускается ниже
 * threshold × номинал, для убывающей сетки порогов
 * round(arange(thresh_max_cap, thresh_min_cap, -interval_cap), 2).
 *
 * Ёмкость цикла: максимум discharge_capacity на разрядной половине интерполированного цикла,
 * номинал: медиана первых n_nominal_cycles циклов. Порог не достигнут → NaN.
 */
@Component
public class TrajectoryFastChargeExtractor implements FeatureExtractor {

    public static final String THRESH_MAX_CAP = "thresh_max_cap";
    public static final String THRESH_MIN_CAP = "thresh_min_cap";
    public static final String INTERVAL_CAP = "interval_cap";

    @Override
    public FeatureType type() {
        return FeatureType.TRAJECTORY_FAST_CHARGE;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return FastChargeChecks.hasEnoughCycles(run,
                hp.getInt(FastChargeChecks.INIT_PRED_CYCLE, FastChargeChecks.DEFAULT_INIT_PRED_CYCLE),
                hp.getInt(FastChargeChecks.FINAL_PRED_CYCLE, FastChargeChecks.DEFAULT_FINAL_PRED_CYCLE));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        List<Double> thresholds = thresholds(
                hp.getDouble(THRESH_MAX_CAP, 0.98),
                hp.getDouble(THRESH_MIN_CAP, 0.78),
                hp.getDouble(INTERVAL_CAP, 0.03));
        int nNominal = hp.getInt(DeltaQFastChargeExtractor.N_NOMINAL_CYCLES,
                DeltaQFastChargeExtractor.DEFAULT_N_NOMINAL_CYCLES);

        double[][] perCycle = capacityPerCycle(run.dischargeInterpolated());
        double[] cycles = perCycle[0];
        double[] capacity = perCycle[1];
        double nominal = Stats.median(Stats.finite(
                Arrays.copyOfRange(capacity, 0, Math.min(nNominal, capacity.length))));

        Map<String, Double> y = new LinkedHashMap<>();
        for (double t : thresholds) {
            y.put("capacity_" + label(t), firstCrossing(cycles, capacity, t * nominal));
        }
        return DataTable.ofRow(y);
    }

    static List<Double> thresholds(double max, double min, double step) {
        if (!(step > 0)) {
            throw new IllegalArgumentException("interval_cap должен быть > 0, пришло: " + step);
        }
        int n = (int) Math.ceil((max - min) / step);
        List<Double> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Math.round((max - i * step) * 100.0) / 100.0);
        }
        return out;
    }

    /**
     * Как str(float) в отчётах: 0.8 → "0.8", 0.98 → "0.98", 1 → "1.0".
     */
    static String label(double t) {
        String s = BigDecimal.valueOf(t).stripTrailingZeros().toPlainString();
        return s.contains(".") ? s : s + ".0";
    }

    private static double firstCrossing(double[] cycles, double[] capacity, double level) {
        if (!Double.isFinite(level)) return Double.NaN;
        for (int i = 0; i < cycles.length; i++) {
            if (capacity[i] < level) return cycles[i];
        }
        return Double.NaN;
    }

    private static double[][] capacityPerCycle(DataTable discharge) {
        if (discharge.isEmpty()) return new double[][]{new double[0], new double[0]};

        double[] cycleCol = discharge.numeric(RunColumns.CYCLE_INDEX);
        double[] q = discharge.numeric(RunColumns.DISCHARGE_CAPACITY);
        double[] cycles = discharge.uniqueSorted(RunColumns.CYCLE_INDEX);

        Map<Double, Double> max = new LinkedHashMap<>();
        for (int i = 0; i < cycleCol.length; i++) {
            if (Double.isNaN(q[i])) continue;
            max.merge(cycleCol[i], q[i], Math::max);
        }

        double[] capacity = new double[cycles.length];
        for (int i = 0; i < cycles.length; i++) {
            capacity[i] = max.getOrDefault(cycles[i], Double.NaN);
        }
        return new double[][]{cycles, capacity};
    }
}

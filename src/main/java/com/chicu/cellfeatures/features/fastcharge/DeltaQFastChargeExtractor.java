package com.chicu.cellfeatures.features.fastcharge;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureExtractor;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.math.LinearFit;
import com.chicu.cellfeatures.math.Stats;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Признаки ранней оценки деградации по регулярным циклам (так называемый ΔQ(V)).
 *
 * Позиции в summary: 0-based строки: «cycle_2» = строка 1, «cycle_100» = строка final-1.
 * Статистики ΔQ(V) = Q_d(цикл final-1) − Q_d(цикл init-1) берутся по разрядной половине
 * интерполированных циклов и проходят через log10|x|.
 */
@Component
public class DeltaQFastChargeExtractor implements FeatureExtractor {

    public static final String N_NOMINAL_CYCLES = "n_nominal_cycles";
    static final int DEFAULT_N_NOMINAL_CYCLES = 40;

    @Override
    public FeatureType type() {
        return FeatureType.DELTA_Q_FAST_CHARGE;
    }

    @Override
    public boolean validate(RunRecord run, FeatureHyperparameters hp) {
        return FastChargeChecks.hasEnoughCycles(run,
                hp.getInt(FastChargeChecks.INIT_PRED_CYCLE, FastChargeChecks.DEFAULT_INIT_PRED_CYCLE),
                hp.getInt(FastChargeChecks.FINAL_PRED_CYCLE, FastChargeChecks.DEFAULT_FINAL_PRED_CYCLE));
    }

    @Override
    public DataTable compute(RunRecord run, FeatureHyperparameters hp) {
        int initPred = hp.getInt(FastChargeChecks.INIT_PRED_CYCLE, FastChargeChecks.DEFAULT_INIT_PRED_CYCLE);
        int midPred = hp.getInt(FastChargeChecks.MID_PRED_CYCLE, FastChargeChecks.DEFAULT_MID_PRED_CYCLE);
        int finalPred = hp.getInt(FastChargeChecks.FINAL_PRED_CYCLE, FastChargeChecks.DEFAULT_FINAL_PRED_CYCLE);
        int nNominal = hp.getInt(N_NOMINAL_CYCLES, DEFAULT_N_NOMINAL_CYCLES);

        if (midPred <= 10 || finalPred <= midPred) {
            throw new FeaturizationException("Некорректные циклы анализа: mid=" + midPred + " final=" + finalPred);
        }

        DataTable summary = run.summary();
        if (summary.rowCount() < finalPred) {
            throw new FeaturizationException("В summary " + summary.rowCount()
                    + " строк, нужно минимум " + finalPred);
        }

        int iFinal = finalPred - 1;
        int iMid = midPred - 1;

        double[] qd = summary.numeric(RunColumns.DISCHARGE_CAPACITY);
        double[] ir = summary.numeric(RunColumns.DC_INTERNAL_RESISTANCE);

        Map<String, Double> x = new LinkedHashMap<>();

        x.put("discharge_capacity_cycle_2", qd[1]);

        double maxDiff = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < finalPred; i++) maxDiff = Math.max(maxDiff, qd[i] - qd[1]);
        x.put("max_discharge_capacity_difference", maxDiff);

        x.put("discharge_capacity_cycle_100", qd[iFinal]);

        x.put("integrated_time_temperature_cycles_1:100",
                Stats.nanSum(range(summary.numeric(RunColumns.TIME_TEMPERATURE_INTEGRATED), 0, finalPred)));

        x.put("charge_time_cycles_1:5",
                Stats.nanMean(range(summary.numeric(RunColumns.CHARGE_DURATION), 1, Math.min(6, summary.rowCount()))));

        putDeltaQStats(x, run.dischargeInterpolated(), iFinal, initPred - 1);

        x.put("max_temperature_cycles_1:100",
                Stats.nanMax(range(summary.numeric(RunColumns.TEMPERATURE_MAXIMUM), 1, finalPred)));
        x.put("min_temperature_cycles_1:100",
                Stats.nanMin(range(summary.numeric(RunColumns.TEMPERATURE_MINIMUM), 1, finalPred)));

        LinearFit early = LinearFit.of(positions(1, finalPred), range(qd, 1, finalPred));
        x.put("slope_discharge_capacity_cycle_number_2:100", early.slope());
        x.put("intercept_discharge_capacity_cycle_number_2:100", early.intercept());

        LinearFit late = LinearFit.of(positions(iMid, finalPred), range(qd, iMid, finalPred));
        x.put("slope_discharge_capacity_cycle_number_91:100", late.slope());
        x.put("intercept_discharge_capacity_cycle_number_91:100", late.intercept());

        // нулевое сопротивление = не измерено
        double[] irTrend = range(ir, 1, finalPred);
        for (int i = 0; i < irTrend.length; i++) {
            if (irTrend[i] == 0) irTrend[i] = Double.NaN;
        }
        x.put("min_internal_resistance_cycles_2:100", Stats.nanMin(irTrend));
        x.put("internal_resistance_cycle_2", ir[1]);
        x.put("internal_resistance_difference_cycles_2:100", ir[iFinal] - ir[1]);

        x.put("nominal_capacity_by_median", Stats.median(range(qd, 0, Math.min(nNominal, qd.length))));

        return DataTable.ofRow(x);
    }

    private static void putDeltaQStats(Map<String, Double> x, DataTable discharge, int finalCycle, int initCycle) {
        double[] qFinal = capacityAtCycle(discharge, finalCycle);
        double[] qInit = capacityAtCycle(discharge, initCycle);

        int n = Math.min(qFinal.length, qInit.length);
        double[] diff = new double[n];
        for (int i = 0; i < n; i++) diff[i] = qFinal[i] - qInit[i];

        // быстрый разряд в узком окне напряжений может не дать интерполированных точек
        double[] finite = Stats.finite(diff);
        boolean empty = finite.length == 0;

        x.put("abs_min_discharge_capacity_difference_cycles_2:100",
                empty ? Double.NaN : Stats.signedLog(Stats.min(finite)));
        x.put("abs_mean_discharge_capacity_difference_cycles_2:100",
                empty ? Double.NaN : Stats.signedLog(Stats.mean(finite)));
        x.put("abs_variance_discharge_capacity_difference_cycles_2:100",
                empty ? Double.NaN : Stats.signedLog(Stats.variance(finite)));
        x.put("abs_skew_discharge_capacity_difference_cycles_2:100",
                empty ? Double.NaN : Stats.signedLog(Stats.skew(finite)));
        x.put("abs_kurtosis_discharge_capacity_difference_cycles_2:100",
                empty ? Double.NaN : Stats.signedLog(Stats.kurtosis(finite)));
        x.put("abs_first_discharge_capacity_difference_cycles_2:100",
                empty ? Double.NaN : Stats.signedLog(diff[0]));
    }

    private static double[] capacityAtCycle(DataTable discharge, int cycle) {
        if (discharge.isEmpty()) return new double[0];
        double[] cycles = discharge.numeric(RunColumns.CYCLE_INDEX);
        double[] q = discharge.numeric(RunColumns.DISCHARGE_CAPACITY);
        return IntStream.range(0, cycles.length)
                .filter(i -> cycles[i] == cycle)
                .mapToDouble(i -> q[i])
                .toArray();
    }

    private static double[] range(double[] values, int from, int to) {
        return Arrays.copyOfRange(values, from, Math.max(from, Math.min(to, values.length)));
    }

    private static double[] positions(int from, int to) {
        double[] p = new double[to - from];
        for (int i = 0; i < p.length; i++) p[i] = from + i;
        return p;
    }
}

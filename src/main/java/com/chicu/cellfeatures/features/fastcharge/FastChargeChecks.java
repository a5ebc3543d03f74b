package com.chicu.cellfeatures.features.fastcharge;

import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;

/**
 * Общее предусловие вариантов регулярных быстрых зарядов (Delta-Q и траектория).
 */
public final class FastChargeChecks {

    public static final String INIT_PRED_CYCLE = "init_pred_cycle";
    public static final String MID_PRED_CYCLE = "mid_pred_cycle";
    public static final String FINAL_PRED_CYCLE = "final_pred_cycle";

    public static final int DEFAULT_INIT_PRED_CYCLE = 10;
    public static final int DEFAULT_MID_PRED_CYCLE = 91;
    public static final int DEFAULT_FINAL_PRED_CYCLE = 100;

    private FastChargeChecks() {
    }

    /**
     * max(cycle_index) > finalPredCycle и min(cycle_index) ≤ initPredCycle.
     * Без колонки cycle_index: просто строк больше, чем finalPredCycle.
     */
    public static boolean hasEnoughCycles(RunRecord run, int initPredCycle, int finalPredCycle) {
        if (run == null || run.summary() == null || run.summary().isEmpty()) return false;

        DataTable summary = run.summary();
        if (!summary.hasColumn(RunColumns.CYCLE_INDEX)) {
            return summary.rowCount() > finalPredCycle;
        }

        double[] cycles = summary.uniqueSorted(RunColumns.CYCLE_INDEX);
        if (cycles.length == 0) return false;
        return cycles[cycles.length - 1] > finalPredCycle && cycles[0] <= initPredCycle;
    }
}

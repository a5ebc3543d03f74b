package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.run.RunRecordFixtures;
import com.chicu.cellfeatures.table.DataTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastChargeWindowStatsTest {

    private final DataTable interp = RunRecordFixtures.diagnosticRun(8).diagnosticInterpolated();

    @Test
    void compute_shouldGiveSevenStatsPerDischargeQuantity() {
        DataTable x = FastChargeWindowStats.compute(interp, "rpt_0.2C", List.of(0, 1), RunRecordFixtures.RPT_HALF);

        assertEquals(21, x.columnCount());
        assertEquals(List.of("var_discharging_capacity", "min_discharging_capacity", "mean_discharging_capacity",
                        "skew_discharging_capacity", "kurtosis_discharging_capacity",
                        "abs_discharging_capacity", "square_discharging_capacity"),
                x.columnNames().subList(0, 7));
        // во втором вхождении ёмкость масштабирована на 0.95: минимум разности в конце разряда
        assertEquals(Math.log10(0.05 * 1.1), x.value("min_discharging_capacity", 0), 1e-9);
    }

    @Test
    void compute_shouldFail_whenOccurrenceMissing() {
        assertThrows(FeaturizationException.class,
                () -> FastChargeWindowStats.compute(interp, "rpt_0.2C", List.of(0, 5), RunRecordFixtures.RPT_HALF));
        assertThrows(FeaturizationException.class,
                () -> FastChargeWindowStats.compute(interp, "rpt_0.2C", List.of(0), RunRecordFixtures.RPT_HALF));
        assertThrows(FeaturizationException.class,
                () -> FastChargeWindowStats.compute(interp, "rpt_0.2C", List.of(0, 1), 0));
    }

    @Test
    void windowDifference_shouldClampToTable_andPairShorterWindow() {
        double[] values = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

        // опорное окно [3, 4), сравниваемое [8, 9)
        assertArrayEquals(new double[]{5}, FastChargeWindowStats.windowDifference(values, 0, 5, 2, 10));
        // сравниваемое окно целиком за концом таблицы
        assertEquals(0, FastChargeWindowStats.windowDifference(values, 0, 9, 2, 10).length);
    }

    @Test
    void occurrenceBlocks_shouldSplitByCycleIndex() {
        List<int[]> blocks = DiagnosticCycles.occurrenceBlocks(interp, "rpt_0.2C");

        assertEquals(3, blocks.size());
        assertEquals(2 * RunRecordFixtures.RPT_HALF, blocks.get(0)[1] - blocks.get(0)[0]);
    }
}

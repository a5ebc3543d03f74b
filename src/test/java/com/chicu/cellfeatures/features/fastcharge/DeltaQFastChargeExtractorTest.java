package com.chicu.cellfeatures.features.fastcharge;

import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.run.RunRecordFixtures;
import com.chicu.cellfeatures.table.DataTable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeltaQFastChargeExtractorTest {

    private final DeltaQFastChargeExtractor extractor = new DeltaQFastChargeExtractor();
    private final FeatureHyperparameters none = FeatureHyperparameters.none();

    @Test
    void validate_shouldReject_whenMaxCycleNotAboveFinalPredCycle() {
        assertFalse(extractor.validate(RunRecordFixtures.regularRun(100), none),
                "100 циклов мало: нужен цикл > 100");
        assertTrue(extractor.validate(RunRecordFixtures.regularRun(101), none));
    }

    @Test
    void validate_shouldReject_whenFirstCycleAfterInitPredCycle() {
        RunRecord run = RunRecordFixtures.regularRun(150);
        double[] cycles = run.summary().numeric(RunColumns.CYCLE_INDEX);
        DataTable late = run.summary().filter(i -> cycles[i] > 11);

        assertFalse(extractor.validate(run.toBuilder().summary(late).build(), none));
    }

    @Test
    void validate_shouldReject_whenSummaryMissing() {
        assertFalse(extractor.validate(RunRecord.builder().build(), none));
    }

    @Test
    void compute_shouldBuildSingleRow_withCapacityAnchors() {
        DataTable x = extractor.compute(RunRecordFixtures.regularRun(110), none);

        assertEquals(1, x.rowCount());
        assertEquals(21, x.columnCount());
        assertEquals(RunRecordFixtures.capacity(2), x.value("discharge_capacity_cycle_2", 0), 1e-12);
        assertEquals(RunRecordFixtures.capacity(100), x.value("discharge_capacity_cycle_100", 0), 1e-12);
        assertEquals(RunRecordFixtures.capacity(1) - RunRecordFixtures.capacity(2),
                x.value("max_discharge_capacity_difference", 0), 1e-12,
                "ёмкость только падает: максимум разницы даёт цикл 1");
        // наклон МНК квадратичной кривой на симметричной сетке = производная в середине (цикл 51)
        assertEquals(-0.0005 - 0.000004 * 51, x.value("slope_discharge_capacity_cycle_number_2:100", 0), 1e-9);
    }

    @Test
    void compute_shouldTakeDeltaQ_betweenInterpolatedCycles99And9() {
        DataTable x = extractor.compute(RunRecordFixtures.regularRun(110), none);

        // первая точка разрядной сетки: доля ёмкости = 1
        double expected = Math.log10(Math.abs(RunRecordFixtures.capacity(99) - RunRecordFixtures.capacity(9)));
        assertEquals(expected, x.value("abs_first_discharge_capacity_difference_cycles_2:100", 0), 1e-9);
        assertTrue(Double.isFinite(x.value("abs_variance_discharge_capacity_difference_cycles_2:100", 0)));
    }

    @Test
    void compute_shouldIgnoreZeroResistance_inMinimum() {
        DataTable x = extractor.compute(RunRecordFixtures.regularRun(110), none);
        assertEquals(0.02 + 0.00002, x.value("min_internal_resistance_cycles_2:100", 0), 1e-12);
    }

    @Test
    void compute_shouldFail_whenPredictionCyclesInconsistent() {
        FeatureHyperparameters bad = FeatureHyperparameters.of(Map.of(
                FastChargeChecks.MID_PRED_CYCLE, 100,
                FastChargeChecks.FINAL_PRED_CYCLE, 90));
        assertThrows(FeaturizationException.class,
                () -> extractor.compute(RunRecordFixtures.regularRun(110), bad));
    }
}

package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecordFixtures;
import com.chicu.cellfeatures.table.DataTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HppcCycleTest {

    private static HppcCycle firstHppc(int socWindows) {
        DataTable interp = RunRecordFixtures.diagnosticRun(socWindows).diagnosticInterpolated();
        return HppcFeatures.hppc(interp, 0);
    }

    @Test
    void relaxationSegments_shouldSkipRestAfterCvHold() {
        HppcCycle cycle = firstHppc(8);
        List<HppcCycle.Segment> relax = cycle.relaxationSegments();

        assertEquals(8, relax.size(), "по отрезку релаксации на окно SOC, первый не считается");
        relax.forEach(s -> assertEquals(2, s.stepIndex()));
        assertEquals(20, relax.get(0).length());
    }

    @Test
    void relaxationCounters_shouldMatchSocWindowCount_onRegularCycle() {
        double[] counters = firstHppc(8).relaxationCounters();

        assertEquals(8, counters.length);
        for (int i = 1; i < counters.length; i++) {
            assertTrue(counters[i] > counters[i - 1], "счётчики по возрастанию");
        }
    }

    @Test
    void relaxationCounters_shouldCountRepeatedCounterOnce_whenBlocksNotAdjacent() {
        // счётчик 2 у покоя встречается в двух разнесённых блоках
        DataTable cycle = DataTable.builder()
                .numeric(RunColumns.STEP_INDEX, new double[]{1, 2, 2, 3, 2, 3, 2})
                .numeric(RunColumns.STEP_INDEX_COUNTER, new double[]{1, 2, 2, 3, 2, 4, 5})
                .numeric(RunColumns.VOLTAGE, new double[]{4.2, 4.1, 4.1, 4.0, 4.05, 3.95, 4.0})
                .numeric(RunColumns.CURRENT, new double[]{0.1, 0, 0, -1, 0, -1, 0})
                .numeric(RunColumns.TEST_TIME, new double[]{0, 1, 2, 3, 4, 5, 6})
                .build();

        HppcCycle parsed = HppcCycle.parse(cycle);

        assertEquals(2, parsed.relaxationSegments().size(), "блоков релаксации после первого два");
        assertArrayEquals(new double[]{5}, parsed.relaxationCounters(), 0.0,
                "различных счётчиков после наименьшего только один");
    }

    @Test
    void windows_shouldPairPulsesWithOpeningAndClosingRest() {
        HppcCycle cycle = firstHppc(8);
        List<HppcCycle.Window> windows = cycle.windows();

        assertEquals(8, windows.size());
        HppcCycle.Window w0 = windows.get(0);
        assertEquals(3, w0.dischargePulse().stepIndex());
        assertEquals(4, w0.chargePulse().stepIndex());
        assertEquals(5, w0.ccDischarge().stepIndex());
        assertEquals(4.2, cycle.lastVoltage(w0.opening()), 1e-12, "покой после CV-удержания");
        assertSame(windows.get(1).opening(), w0.relaxation(), "закрывающая релаксация открывает следующее окно");
    }

    @Test
    void windows_shouldLeaveCcEmpty_whenOnlyOneNegativeSegment() {
        DataTable cycle = DataTable.builder()
                .numeric(RunColumns.STEP_INDEX, new double[]{1, 2, 2, 3, 3, 2, 2})
                .numeric(RunColumns.STEP_INDEX_COUNTER, new double[]{1, 2, 2, 3, 3, 4, 4})
                .numeric(RunColumns.VOLTAGE, new double[]{4.2, 4.1, 4.1, 4.0, 3.99, 4.05, 4.06})
                .numeric(RunColumns.CURRENT, new double[]{0.1, 0, 0, -1, -1, 0, 0})
                .numeric(RunColumns.TEST_TIME, new double[]{0, 1, 2, 3, 4, 5, 6})
                .build();

        List<HppcCycle.Window> windows = HppcCycle.parse(cycle).windows();

        assertEquals(1, windows.size());
        assertNotNull(windows.get(0).dischargePulse());
        assertNull(windows.get(0).chargePulse());
        assertNull(windows.get(0).ccDischarge());
    }

    @Test
    void rowAfter_shouldFallBackToLastRow_whenSegmentTooShort() {
        HppcCycle cycle = firstHppc(8);
        HppcCycle.Segment pulse = cycle.windows().get(0).dischargePulse();

        assertEquals(pulse.from() + 3, cycle.rowAfter(pulse, 3.0));
        assertEquals(pulse.to() - 1, cycle.rowAfter(pulse, 1_000.0));
    }
}

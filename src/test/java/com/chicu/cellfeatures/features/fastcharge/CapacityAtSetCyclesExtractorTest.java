package com.chicu.cellfeatures.features.fastcharge;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.run.RunRecordFixtures;
import com.chicu.cellfeatures.table.DataTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapacityAtSetCyclesExtractorTest {

    private final CapacityAtSetCyclesExtractor extractor = new CapacityAtSetCyclesExtractor();

    @Test
    void compute_shouldReadSummaryRows_andNaN_pastEndOfRun() {
        DataTable y = extractor.compute(RunRecordFixtures.regularRun(450), FeatureHyperparameters.none());

        assertEquals(List.of("capacity_200", "capacity_400", "capacity_600", "capacity_800",
                "capacity_1000", "capacity_1200", "capacity_1400", "capacity_1600"), y.columnNames());
        assertEquals(1, y.rowCount());
        // строка 200 summary: цикл 201
        assertEquals(RunRecordFixtures.capacity(201), y.value("capacity_200", 0), 1e-12);
        assertEquals(RunRecordFixtures.capacity(401), y.value("capacity_400", 0), 1e-12);
        assertTrue(Double.isNaN(y.value("capacity_600", 0)), "прогон короче 600 строк");
    }

    @Test
    void compute_shouldFollowCustomGrid() {
        FeatureHyperparameters hp = FeatureHyperparameters.of(Map.of(
                CapacityAtSetCyclesExtractor.CYCLE_MIN, 100,
                CapacityAtSetCyclesExtractor.CYCLE_MAX, 500,
                CapacityAtSetCyclesExtractor.CYCLE_INTERVAL, 100));

        DataTable y = extractor.compute(RunRecordFixtures.regularRun(450), hp);

        assertEquals(List.of("capacity_100", "capacity_200", "capacity_300", "capacity_400"), y.columnNames(),
                "cycle_max не входит");
    }

    @Test
    void compute_shouldReject_whenIntervalNotPositive() {
        FeatureHyperparameters bad = FeatureHyperparameters.of(Map.of(CapacityAtSetCyclesExtractor.CYCLE_INTERVAL, 0));

        assertThrows(IllegalArgumentException.class,
                () -> extractor.compute(RunRecordFixtures.regularRun(120), bad));
    }

    @Test
    void validate_shouldShareFastChargePrecondition() {
        assertEquals(FeatureType.CAPACITY_AT_SET_CYCLES, extractor.type());
        assertFalse(extractor.validate(RunRecordFixtures.regularRun(90), FeatureHyperparameters.none()));
        assertTrue(extractor.validate(RunRecordFixtures.regularRun(120), FeatureHyperparameters.none()));
    }
}

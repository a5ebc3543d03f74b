package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.table.DataTable;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FeatureNamingTest {

    @Test
    void runLabel_shouldStripDirectoryExtensionAndPipelineSuffix() {
        assertEquals("PreDiag_000240_000227",
                FeatureNaming.runLabel("/data/structure/PreDiag_000240_000227_structure.json"));
        assertEquals("FastCharge_000025_CH8",
                FeatureNaming.runLabel("C:\\runs\\FastCharge_000025_CH8_structure.json.gz"));
        assertEquals("run", FeatureNaming.runLabel("run.csv"));
    }

    @Test
    void featureName_shouldKeepDottedRunNamesApart() {
        String charge = FeatureNaming.featureName("/data/cellA.charge.json", FeatureType.DELTA_Q_FAST_CHARGE);
        String discharge = FeatureNaming.featureName("/data/cellA.discharge.json", FeatureType.DELTA_Q_FAST_CHARGE);

        assertNotEquals(charge, discharge, "точки внутри имени прогона не отрезаются");
        assertEquals("cellA.charge_features_DeltaQFastCharge", charge);
        assertEquals("cellA.v2", FeatureNaming.runLabel("/data/cellA.v2.JSON"));
        assertEquals("cellA.json", FeatureNaming.runLabel("cellA.json.json"), "расширение снимается один раз");
    }

    @Test
    void runLabel_shouldBeStable_overFeatureNames() {
        String input = "/data/PreDiag_000240_000227_structure.json";
        for (FeatureType t : FeatureType.values()) {
            String name = FeatureNaming.featureName(input, t);
            assertEquals(FeatureNaming.runLabel(input), FeatureNaming.runLabel(name),
                    "метка прогона должна восстанавливаться из имени признаков " + name);
        }
    }

    @Test
    void featureName_shouldDiffer_betweenVariantsOfSameRun() {
        String input = "PreDiag_000240_000227_structure.json";
        assertEquals("PreDiag_000240_000227_features_DeltaQFastCharge",
                FeatureNaming.featureName(input, FeatureType.DELTA_Q_FAST_CHARGE));
        assertNotEquals(FeatureNaming.featureName(input, FeatureType.DELTA_Q_FAST_CHARGE),
                FeatureNaming.featureName(input, FeatureType.TRAJECTORY_FAST_CHARGE));
    }

    @Test
    void runLabel_shouldReject_whenPathBlank() {
        assertThrows(IllegalArgumentException.class, () -> FeatureNaming.runLabel(" "));
        assertThrows(IllegalArgumentException.class, () -> FeatureNaming.runLabel(null));
    }

    @Test
    void featurePath_shouldNestUnderVariantTag() {
        FeatureTable table = new FeatureTable(FeatureType.HPPC_RELAXATION,
                "PreDiag_000240_features_HPPCRelaxationFeatures", null,
                DataTable.empty(), null);

        assertEquals("PreDiag_000240", table.runLabel(), "runLabel выводится из имени");
        assertEquals(Path.of("/f/HPPCRelaxationFeatures/PreDiag_000240_features_HPPCRelaxationFeatures.json"),
                FeatureNaming.featurePath(Path.of("/f"), table));
        assertEquals("PreDiag", FeatureNaming.project("PreDiag_000240"));
    }
}

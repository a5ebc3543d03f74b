package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.config.FeaturesConfig;
import com.chicu.cellfeatures.table.DataTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureTableStoreTest {

    @TempDir
    Path featureDir;

    private final FeatureTableStore store = new FeatureTableStore(FeaturesConfig.jsonMapper());

    private static FeatureTable table(String runLabel, FeatureType type, double value) {
        Map<String, Double> row = new LinkedHashMap<>();
        row.put("b_feature", value);
        row.put("a_feature", Double.NaN);
        return new FeatureTable(type, FeatureNaming.featureName(runLabel + "_structure.json", type), runLabel,
                DataTable.ofRow(row), new FeatureMetadata("EL1", "PreDiag_000240.000", "3"));
    }

    @Test
    void save_shouldWriteUnderVariantDirectory_andLoadBackEqual() {
        FeatureTable t = table("PreDiag_000240_000227", FeatureType.DELTA_Q_FAST_CHARGE, 0.5);

        Path saved = store.save(featureDir, t);

        assertEquals(featureDir.resolve("DeltaQFastCharge")
                .resolve("PreDiag_000240_000227_features_DeltaQFastCharge.json"), saved);
        assertTrue(Files.isRegularFile(saved));

        FeatureTable back = store.load(saved);
        assertEquals(t, back);
        assertEquals(List.of("b_feature", "a_feature"), back.data().columnNames(), "порядок колонок сохраняется");
    }

    @Test
    void save_shouldOverwrite_whenSameRunFeaturizedAgain() {
        store.save(featureDir, table("PreDiag_000240_000227", FeatureType.DELTA_Q_FAST_CHARGE, 0.5));
        Path saved = store.save(featureDir, table("PreDiag_000240_000227", FeatureType.DELTA_Q_FAST_CHARGE, 0.7));

        assertEquals(0.7, store.load(saved).data().value("b_feature", 0));
        assertEquals(1, store.list(featureDir, FeatureType.DELTA_Q_FAST_CHARGE, List.of("PreDiag")).size());
    }

    @Test
    void list_shouldFilterByProjectPrefix_andSortByName() {
        store.save(featureDir, table("PreDiag_000241", FeatureType.HPPC_RELAXATION, 1));
        store.save(featureDir, table("PreDiag_000240", FeatureType.HPPC_RELAXATION, 1));
        store.save(featureDir, table("FastCharge_000001", FeatureType.HPPC_RELAXATION, 1));
        store.save(featureDir, table("PreDiag_000240", FeatureType.DELTA_Q_FAST_CHARGE, 1));

        List<Path> files = store.list(featureDir, FeatureType.HPPC_RELAXATION, List.of("PreDiag"));

        assertEquals(2, files.size());
        assertTrue(files.get(0).getFileName().toString().startsWith("PreDiag_000240"));
        assertTrue(files.get(1).getFileName().toString().startsWith("PreDiag_000241"));
    }

    @Test
    void list_shouldReturnEmpty_whenVariantDirectoryMissing() {
        assertTrue(store.list(featureDir, FeatureType.RPT_DQDV, List.of("PreDiag")).isEmpty());
    }

    @Test
    void load_shouldWrapIoFailure() {
        assertThrows(UncheckedIOException.class, () -> store.load(featureDir.resolve("missing.json")));
    }
}

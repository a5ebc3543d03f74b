package com.chicu.cellfeatures.dataset;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.config.FeaturesConfig;
import com.chicu.cellfeatures.features.FeatureMetadata;
import com.chicu.cellfeatures.table.DataTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDatasetStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = FeaturesConfig.jsonMapper();
    private final TrainingDatasetStore store = new TrainingDatasetStore(mapper);

    private static TrainingDataset dataset() {
        DataTable data = DataTable.builder()
                .text(TrainingDataset.FILE_COLUMN, new String[]{"PreDiag_000240", "PreDiag_000241"})
                .numeric("discharge_capacity_cycle_2", new double[]{1.09, Double.NaN})
                .numeric("capacity_0.98", new double[]{87, 91})
                .build();
        Map<FeatureType, List<String>> sets = new LinkedHashMap<>();
        sets.put(FeatureType.DELTA_Q_FAST_CHARGE, List.of("discharge_capacity_cycle_2"));
        sets.put(FeatureType.TRAJECTORY_FAST_CHARGE, List.of("capacity_0.98"));
        return new TrainingDataset("fast_charge", data,
                List.of(new FeatureMetadata("EL150800460", "PreDiag_000240.000", "12")),
                List.of("PreDiag_000240", "PreDiag_000241"), sets);
    }

    @Test
    void save_shouldKeyFeatureSetsByVariantTag() throws Exception {
        Path saved = store.save(dir, dataset());

        JsonNode sets = mapper.readTree(Files.readString(saved)).get("feature_sets");
        assertTrue(sets.has("DeltaQFastCharge"), "ключ feature_sets: tag варианта");
        assertTrue(sets.has("TrajectoryFastCharge"));
        assertFalse(sets.has("DELTA_Q_FAST_CHARGE"), "имя константы в файл не попадает");
    }

    @Test
    void load_shouldRestoreDataset_savedEarlier() {
        TrainingDataset original = dataset();

        Path saved = store.save(dir, original);
        TrainingDataset loaded = store.load(saved);

        assertEquals(dir.resolve("fast_charge.json"), saved);
        assertEquals(original.data(), loaded.data(), "NaN переживает запись");
        assertEquals(original.featureSets(), loaded.featureSets());
        assertEquals(original.metadata(), loaded.metadata());
        assertEquals(original.filenames(), loaded.filenames());
    }

    @Test
    void load_shouldAcceptConstantNamesAsKeys() throws Exception {
        Path file = store.save(dir, dataset());
        Files.writeString(file, Files.readString(file).replace("\"DeltaQFastCharge\"", "\"DELTA_Q_FAST_CHARGE\""));

        TrainingDataset loaded = store.load(file);

        assertEquals(List.of("discharge_capacity_cycle_2"), loaded.featureSets().get(FeatureType.DELTA_Q_FAST_CHARGE));
    }

    @Test
    void load_shouldWrapIoFailure() {
        assertThrows(UncheckedIOException.class, () -> store.load(dir.resolve("missing.json")));
    }
}

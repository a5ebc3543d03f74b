package com.chicu.cellfeatures.smoke;

import com.chicu.cellfeatures.batch.FeaturizationBatchService;
import com.chicu.cellfeatures.batch.FeaturizeJob;
import com.chicu.cellfeatures.batch.FeaturizeManifest;
import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.dataset.JoinPolicy;
import com.chicu.cellfeatures.dataset.TrainingDataset;
import com.chicu.cellfeatures.dataset.TrainingDatasetBuilder;
import com.chicu.cellfeatures.dataset.TrainingDatasetStore;
import com.chicu.cellfeatures.dataset.split.SplitRequest;
import com.chicu.cellfeatures.dataset.split.TrainTestSplit;
import com.chicu.cellfeatures.dataset.split.TrainTestSplitter;
import com.chicu.cellfeatures.features.FeatureExtractorRegistry;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.run.RunRecordFixtures;
import com.chicu.cellfeatures.run.RunRecordLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class FeaturePipelineSmokeTest {

    @TempDir
    static Path dataShare;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("cellfeatures.storage.feature-dir", () -> dataShare.resolve("features").toString());
        registry.add("cellfeatures.storage.dataset-dir", () -> dataShare.resolve("datasets").toString());
        registry.add("cellfeatures.storage.parameters-dir", () -> dataShare.resolve("parameters").toString());
    }

    @Autowired FeatureExtractorRegistry registry;
    @Autowired FeaturizationBatchService batchService;
    @Autowired TrainingDatasetBuilder datasetBuilder;
    @Autowired TrainingDatasetStore datasetStore;
    @Autowired TrainTestSplitter splitter;
    @Autowired RunRecordLoader runLoader;
    @Autowired ObjectMapper objectMapper;

    @Test
    void shouldHaveAllExtractorsRegistered() {
        assertEquals(Set.of(FeatureType.values()), registry.types());
    }

    @Test
    void runRecord_shouldSurviveJsonRoundTrip() throws Exception {
        Path file = writeRun("PreDiag_000240_000001_structure.json", RunRecordFixtures.diagnosticRun(8));

        RunRecord back = runLoader.load(file);

        assertEquals(RunRecordFixtures.diagnosticRun(8), back);
        assertTrue(Files.readString(file).contains("\"cycles_interpolated\""));
    }

    @Test
    void featurizeThenBuildAndSplit_shouldProduceConsistentDataset() throws Exception {
        Path a = writeRun("PreDiag_000240_000227_structure.json", RunRecordFixtures.diagnosticRun(8));
        Path b = writeRun("PreDiag_000241_000228_structure.json", RunRecordFixtures.diagnosticRun(8));
        Path c = writeRun("PreDiag_000242_000229_structure.json", RunRecordFixtures.regularRun(90));

        FeaturizeManifest manifest = batchService.process(
                new FeaturizeJob(List.of(a.toString(), b.toString(), c.toString()), List.of(1, 2, 3), "test"));

        assertEquals(12, manifest.resultList().size());
        assertEquals(List.of("success", "success", "success", "success"), manifest.resultList().subList(0, 4));
        assertEquals(List.of("incomplete", "incomplete", "incomplete", "incomplete"),
                manifest.resultList().subList(8, 12), "90 циклов без диагностики ни на что не хватает");
        assertEquals(FeaturizeManifest.INSUFFICIENT_DATA, manifest.messageList().get(8).comment());

        TrainingDataset ds = datasetBuilder.fromFeatureFiles("smoke", List.of("PreDiag"),
                List.of(FeatureType.DELTA_Q_FAST_CHARGE, FeatureType.TRAJECTORY_FAST_CHARGE),
                dataShare.resolve("features"), JoinPolicy.INNER);

        assertEquals(List.of("PreDiag_000240_000227", "PreDiag_000241_000228"), ds.filenames());
        assertEquals(2, ds.metadata().size());
        assertEquals(21, ds.featureSets().get(FeatureType.DELTA_Q_FAST_CHARGE).size());

        Path saved = datasetStore.save(dataShare.resolve("datasets"), ds);
        TrainingDataset loaded = datasetStore.load(saved);
        assertEquals(ds.data(), loaded.data());
        assertEquals(ds.featureSets(), loaded.featureSets());

        TrainTestSplit split = splitter.split(loaded, SplitRequest.builder()
                .predictors(List.of("discharge_capacity_cycle_2"))
                .outcomes(List.of("capacity_0.98"))
                .testSize(0.5)
                .withParameters(true)
                .build());
        assertEquals(1, split.testRuns().size());
        assertEquals(1, split.trainRuns().size());
        assertTrue(split.testParameters().isEmpty(), "каталог параметров пуст");
    }

    private Path writeRun(String name, RunRecord run) throws Exception {
        Path dir = Files.createDirectories(dataShare.resolve("structure"));
        Path file = dir.resolve(name);
        objectMapper.writeValue(file.toFile(), run);
        return file;
    }
}

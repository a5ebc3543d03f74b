package com.chicu.cellfeatures.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * datasetDir/&lt;name&gt;.json
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainingDatasetStore {

    private final ObjectMapper objectMapper;

    public Path save(Path datasetDir, TrainingDataset dataset) {
        Path target = datasetDir.resolve(dataset.name() + ".json");
        try {
            Files.createDirectories(datasetDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), dataset);
            log.info("💾 Dataset saved: {} rows={} runs={}", target, dataset.data().rowCount(),
                    dataset.filenames().size());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось сохранить датасет " + target + ": " + e.getMessage(), e);
        }
    }

    public TrainingDataset load(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), TrainingDataset.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать датасет " + file + ": " + e.getMessage(), e);
        }
    }
}

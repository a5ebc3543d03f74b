package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Хранилище таблиц признаков: featureDir/&lt;tag&gt;/&lt;name&gt;.json.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureTableStore {

    private final ObjectMapper objectMapper;

    public Path save(Path featureDir, FeatureTable table) {
        Path target = FeatureNaming.featurePath(featureDir, table);
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), table);
            log.debug("💾 Features saved: {}", target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось сохранить признаки " + target + ": " + e.getMessage(), e);
        }
    }

    public FeatureTable load(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), FeatureTable.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать признаки " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Файлы варианта type, имя которых начинается с одного из projects. Порядок: по имени файла.
     */
    public List<Path> list(Path featureDir, FeatureType type, Collection<String> projects) {
        Path dir = featureDir.resolve(type.tag());
        if (!Files.isDirectory(dir)) {
            log.warn("⚠️ Нет каталога признаков {}", dir);
            return List.of();
        }

        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(FeatureNaming.FILE_EXTENSION))
                    .filter(p -> projects.stream().anyMatch(pr -> p.getFileName().toString().startsWith(pr)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать каталог " + dir + ": " + e.getMessage(), e);
        }
    }
}

package com.chicu.cellfeatures.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Загрузка структурированного прогона из JSON (формат стадии структурирования).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunRecordLoader {

    private final ObjectMapper objectMapper;

    public RunRecord load(Path path) {
        if (path == null) throw new IllegalArgumentException("path=null");
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new IOException("Файл прогона не найден: " + path));
        }

        try {
            RunRecord run = objectMapper.readValue(path.toFile(), RunRecord.class);
            if (run.summary() == null) {
                throw new IllegalStateException("В прогоне нет summary: " + path);
            }
            log.debug("📂 Run loaded: {} barcode={} cycles={}", path.getFileName(), run.barcode(),
                    run.summary().rowCount());
            return run;
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать прогон " + path + ": " + e.getMessage(), e);
        }
    }
}

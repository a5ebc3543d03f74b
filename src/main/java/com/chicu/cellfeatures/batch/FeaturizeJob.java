package com.chicu.cellfeatures.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Задание пакетной генерации признаков: пути прогонов + их id.
 * run_list может быть короче file_list (или отсутствовать): тогда id = null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeaturizeJob(
        @JsonProperty("file_list") List<String> fileList,
        @JsonProperty("run_list") List<Integer> runList,
        String mode
) {

    public FeaturizeJob {
        fileList = fileList == null ? List.of() : List.copyOf(fileList);
        runList = runList == null ? List.of() : runList.stream().toList();
    }

    public Integer runId(int i) {
        return i < runList.size() ? runList.get(i) : null;
    }

    /**
     * Строка с окончанием .json: путь к файлу, иначе сам JSON.
     */
    public static FeaturizeJob parse(String jsonOrPath, ObjectMapper mapper) {
        if (jsonOrPath == null || jsonOrPath.isBlank()) {
            throw new IllegalArgumentException("Пустое задание");
        }
        String s = jsonOrPath.trim();
        try {
            return s.endsWith(".json")
                    ? mapper.readValue(Path.of(s).toFile(), FeaturizeJob.class)
                    : mapper.readValue(s, FeaturizeJob.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать задание " + s + ": " + e.getMessage(), e);
        }
    }
}

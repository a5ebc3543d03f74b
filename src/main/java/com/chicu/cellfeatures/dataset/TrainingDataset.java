package com.chicu.cellfeatures.dataset;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureMetadata;
import com.chicu.cellfeatures.table.DataTable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Собранный датасет: одна строка на (прогон × строки признаков), ключ: колонка {@link #FILE_COLUMN}.
 *
 * @param filenames   метки прогонов в порядке появления в data
 * @param featureSets вариант → итоговые имена его колонок (после разрешения коллизий)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingDataset(
        String name,
        DataTable data,
        List<FeatureMetadata> metadata,
        List<String> filenames,
        @JsonProperty("feature_sets") Map<FeatureType, List<String>> featureSets
) {

    public static final String FILE_COLUMN = "file";

    public TrainingDataset {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name пустой");
        if (data == null) throw new IllegalArgumentException("data=null");
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
        filenames = filenames == null ? List.of() : List.copyOf(filenames);
        featureSets = featureSets == null ? Map.of() : featureSets;
    }
}

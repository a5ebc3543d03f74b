package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.table.DataTable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Результат одного экстрактора для одного прогона.
 *
 * @param featureType вариант экстрактора (по нему восстанавливаем тип при загрузке)
 * @param name        детерминированное имя = ключ хранения, см. {@link FeatureNaming}
 * @param runLabel    метка прогона: ключ join в датасете
 * @param data        строки признаков (обычно одна)
 * @param metadata    barcode / protocol / channel_id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureTable(
        FeatureType featureType,
        String name,
        String runLabel,
        DataTable data,
        FeatureMetadata metadata
) {

    public FeatureTable {
        Objects.requireNonNull(featureType, "featureType=null");
        Objects.requireNonNull(name, "name=null");
        Objects.requireNonNull(data, "data=null");
        if (runLabel == null || runLabel.isBlank()) {
            runLabel = FeatureNaming.runLabel(name);
        }
    }
}

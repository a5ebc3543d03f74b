package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.run.RunRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Метаданные таблицы признаков: переносятся из RunRecord без изменений.
 */
public record FeatureMetadata(
        String barcode,
        String protocol,
        @JsonProperty("channel_id") String channelId
) {

    public static FeatureMetadata of(RunRecord run) {
        return new FeatureMetadata(run.barcode(), run.protocol(), run.channelId());
    }
}

package com.chicu.cellfeatures.batch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Отчёт пакетного прогона: по записи на (прогон × вариант), списки выровнены по индексу.
 * file_list: путь к файлу признаков при успехе, иначе входной путь прогона.
 */
public record FeaturizeManifest(
        @JsonProperty("file_list") List<String> fileList,
        @JsonProperty("run_list") List<Integer> runList,
        @JsonProperty("result_list") List<String> resultList,
        @JsonProperty("message_list") List<Message> messageList
) {

    public static final String SUCCESS = "success";
    public static final String INCOMPLETE = "incomplete";
    public static final String INSUFFICIENT_DATA = "Insufficient or incorrect data for featurization";

    public record Message(String comment, String error) {

        public static Message ok() {
            return new Message("", "");
        }
    }
}

package com.chicu.cellfeatures.batch;

import com.chicu.cellfeatures.config.CellFeaturesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Запуск одного задания при старте: cellfeatures.batch.job=&lt;json | path.json&gt;.
 * Манифест печатается в stdout одной строкой JSON.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cellfeatures.batch", name = "job")
public class FeaturizeJobRunner implements ApplicationRunner {

    private final FeaturizationBatchService batchService;
    private final CellFeaturesProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        FeaturizeJob job = FeaturizeJob.parse(props.getBatch().getJob(), objectMapper);
        FeaturizeManifest manifest = batchService.process(job);
        System.out.println(objectMapper.writeValueAsString(manifest));
    }
}

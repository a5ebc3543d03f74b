package com.chicu.cellfeatures.batch;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.config.CellFeaturesProperties;
import com.chicu.cellfeatures.dataset.params.HyperparameterTable;
import com.chicu.cellfeatures.dataset.params.HyperparameterTableLoader;
import com.chicu.cellfeatures.features.FeatureExtractionService;
import com.chicu.cellfeatures.features.FeatureExtractorRegistry;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.features.FeatureTable;
import com.chicu.cellfeatures.features.FeatureTableStore;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.run.RunRecordLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Пакетная генерация признаков по заданию.
 *
 * Для каждого прогона и каждого варианта: ровно одна запись манифеста:
 * success (таблица сохранена), incomplete + comment (не хватает данных),
 * incomplete + error (ошибка чтения/расчёта). Ошибка одного прогона не останавливает пакет.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeaturizationBatchService {

    private final RunRecordLoader runLoader;
    private final FeatureExtractorRegistry registry;
    private final FeatureExtractionService extractionService;
    private final FeatureTableStore featureStore;
    private final HyperparameterTableLoader hyperparameterLoader;
    private final CellFeaturesProperties props;

    public FeaturizeManifest process(FeaturizeJob job) {
        if (job == null) throw new IllegalArgumentException("job=null");

        List<FeatureType> types = props.getBatch().getTypes();
        HyperparameterTable defaults = hyperparameterLoader.load(props.getHyperparametersLocation());
        Path featureDir = Path.of(props.getStorage().getFeatureDir());

        List<String> files = new ArrayList<>();
        List<Integer> runs = new ArrayList<>();
        List<String> results = new ArrayList<>();
        List<FeaturizeManifest.Message> messages = new ArrayList<>();

        log.info("🚀 Featurize job: runs={} variants={} mode={}", job.fileList().size(), types.size(), job.mode());

        for (int i = 0; i < job.fileList().size(); i++) {
            String path = job.fileList().get(i);
            Integer runId = job.runId(i);
            log.info("run_id={} featurizing={}", runId, path);

            RunRecord run;
            try {
                run = runLoader.load(Path.of(path));
            } catch (RuntimeException e) {
                log.error("❌ Не удалось загрузить прогон {}: {}", path, e.getMessage());
                for (FeatureType ignored : types) {
                    files.add(path);
                    runs.add(runId);
                    results.add(FeaturizeManifest.INCOMPLETE);
                    messages.add(new FeaturizeManifest.Message("", e.getMessage()));
                }
                continue;
            }

            for (FeatureType type : types) {
                runs.add(runId);
                try {
                    FeatureHyperparameters hp = defaults.resolve(type, null);
                    Optional<FeatureTable> table = extractionService.fromRun(registry.get(type), path, run, hp);
                    if (table.isPresent()) {
                        Path saved = featureStore.save(featureDir, table.get());
                        files.add(saved.toString());
                        results.add(FeaturizeManifest.SUCCESS);
                        messages.add(FeaturizeManifest.Message.ok());
                    } else {
                        files.add(path);
                        results.add(FeaturizeManifest.INCOMPLETE);
                        messages.add(new FeaturizeManifest.Message(FeaturizeManifest.INSUFFICIENT_DATA, ""));
                    }
                } catch (RuntimeException e) {
                    log.error("❌ {} для {} упал: {}", type.tag(), path, e.getMessage(), e);
                    files.add(path);
                    results.add(FeaturizeManifest.INCOMPLETE);
                    messages.add(new FeaturizeManifest.Message("", String.valueOf(e.getMessage())));
                }
            }
        }

        long ok = results.stream().filter(FeaturizeManifest.SUCCESS::equals).count();
        log.info("🏁 Featurize job done: success={} incomplete={}", ok, results.size() - ok);

        return new FeaturizeManifest(files, runs, results, messages);
    }
}

package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Единая процедура запуска экстрактора на прогоне:
 * validate → compute → metadata → name → {@link FeatureTable}.
 *
 * Optional.empty(): прогон не прошёл валидацию (исключение прогона, не ошибка).
 * Ошибки compute ({@link FeaturizationException} и прочие) пробрасываются.
 */
@Slf4j
@Service
public class FeatureExtractionService {

    public Optional<FeatureTable> fromRun(FeatureExtractor extractor,
                                          String inputPath,
                                          RunRecord run,
                                          FeatureHyperparameters hp) {
        if (extractor == null) throw new IllegalArgumentException("extractor=null");
        if (run == null) throw new IllegalArgumentException("run=null");

        FeatureHyperparameters params = hp != null ? hp : FeatureHyperparameters.none();

        if (!extractor.validate(run, params)) {
            log.warn("⏭️ {}: прогон {} не подходит для признаков, пропускаю", extractor.type().tag(), inputPath);
            return Optional.empty();
        }

        DataTable data = extractor.compute(run, params);
        String name = extractor.name(inputPath);

        FeatureTable table = new FeatureTable(
                extractor.type(),
                name,
                FeatureNaming.runLabel(inputPath),
                data,
                extractor.metadata(run)
        );

        log.info("✅ Features built: {} rows={} columns={}", name, data.rowCount(), data.columnCount());
        return Optional.of(table);
    }
}

package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;

/**
 * Контракт экстрактора признаков. Один бин на вариант {@link FeatureType}.
 *
 * Порядок вызова задаёт {@link FeatureExtractionService}: validate → compute → metadata → name.
 * Реализации без состояния.
 */
public interface FeatureExtractor {

    FeatureType type();

    /**
     * Хватает ли данных прогона для этого варианта.
     * false: прогон просто исключается (это не ошибка).
     */
    boolean validate(RunRecord run, FeatureHyperparameters hp);

    /**
     * Таблица признаков. Вызывается только после успешной validate.
     *
     * @throws FeaturizationException если вход некорректен, несмотря на валидацию
     */
    DataTable compute(RunRecord run, FeatureHyperparameters hp);

    default FeatureMetadata metadata(RunRecord run) {
        return FeatureMetadata.of(run);
    }

    default String name(String inputPath) {
        return FeatureNaming.featureName(inputPath, type());
    }
}

package com.chicu.cellfeatures.dataset.split;

import lombok.Builder;

import java.util.List;

/**
 * Параметры разбиения train/test.
 *
 * @param testSize       доля test, (0, 1); по умолчанию 0.4
 * @param seed           зерно перемешивания; по умолчанию 123
 * @param withParameters подтянуть параметры протокола для прогонов обеих частей
 */
@Builder
public record SplitRequest(
        List<String> predictors,
        List<String> outcomes,
        SplitMode mode,
        Double testSize,
        Long seed,
        boolean withParameters
) {

    public static final double DEFAULT_TEST_SIZE = 0.4;
    public static final long DEFAULT_SEED = 123L;

    public SplitRequest {
        if (predictors == null || predictors.isEmpty()) {
            throw new IllegalArgumentException("Укажите хотя бы одну колонку-предиктор");
        }
        if (outcomes == null || outcomes.isEmpty()) {
            throw new IllegalArgumentException("Укажите хотя бы одну колонку-цель");
        }
        predictors = List.copyOf(predictors);
        outcomes = List.copyOf(outcomes);
        if (mode == null) mode = SplitMode.BY_RUN;
        if (testSize == null) testSize = DEFAULT_TEST_SIZE;
        if (seed == null) seed = DEFAULT_SEED;
        if (!(testSize > 0 && testSize < 1)) {
            throw new IllegalArgumentException("testSize должен быть в (0, 1), пришло: " + testSize);
        }
    }

    public static SplitRequest of(List<String> predictors, List<String> outcomes) {
        return SplitRequest.builder().predictors(predictors).outcomes(outcomes).build();
    }
}

package com.chicu.cellfeatures.dataset.split;

import com.chicu.cellfeatures.table.DataTable;

import java.util.List;
import java.util.Map;

/**
 * Результат разбиения. *Parameters: параметры протокола по метке прогона
 * (прогоны без параметров отсутствуют; пусто, если параметры не запрашивались).
 */
public record TrainTestSplit(
        DataTable xTrain,
        DataTable xTest,
        DataTable yTrain,
        DataTable yTest,
        List<String> trainRuns,
        List<String> testRuns,
        Map<String, Map<String, String>> trainParameters,
        Map<String, Map<String, String>> testParameters
) {}

package com.chicu.cellfeatures.dataset.split;

import com.chicu.cellfeatures.dataset.TrainingDataset;
import com.chicu.cellfeatures.dataset.params.ProtocolParameterStore;
import com.chicu.cellfeatures.table.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.chicu.cellfeatures.dataset.TrainingDataset.FILE_COLUMN;

/**
 * Детерминированное разбиение датасета на train/test.
 *
 * BY_RUN: частичный Фишер–Йетс по filenames с Random(seed), round(testSize × runs) прогонов в test;
 * строки идут за своим прогоном. BY_ROW: перемешивание позиций строк, ceil(testSize × rows) в test.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainTestSplitter {

    private final ProtocolParameterStore parameterStore;

    public TrainTestSplit split(TrainingDataset dataset, SplitRequest request) {
        if (dataset == null) throw new IllegalArgumentException("dataset=null");
        if (request == null) throw new IllegalArgumentException("request=null");

        DataTable data = dataset.data();
        for (String c : request.predictors()) requireColumn(data, c);
        for (String c : request.outcomes()) requireColumn(data, c);

        int[][] parts = request.mode() == SplitMode.BY_ROW
                ? byRow(data.rowCount(), request.testSize(), request.seed())
                : byRun(dataset, request.testSize(), request.seed());

        DataTable train = data.rows(parts[0]);
        DataTable test = data.rows(parts[1]);

        List<String> trainRuns = runs(train);
        List<String> testRuns = runs(test);

        Map<String, Map<String, String>> trainParams = Map.of();
        Map<String, Map<String, String>> testParams = Map.of();
        if (request.withParameters()) {
            trainParams = parameters(trainRuns);
            testParams = parameters(testRuns);
        }

        log.info("✂️ Split {}: mode={} train rows={} runs={} | test rows={} runs={}",
                dataset.name(), request.mode(), train.rowCount(), trainRuns.size(),
                test.rowCount(), testRuns.size());

        return new TrainTestSplit(
                train.select(request.predictors()),
                test.select(request.predictors()),
                train.select(request.outcomes()),
                test.select(request.outcomes()),
                trainRuns,
                testRuns,
                trainParams,
                testParams
        );
    }

    // =====================================================================
    // РАЗБИЕНИЕ
    // =====================================================================

    static int[][] byRun(TrainingDataset dataset, double testSize, long seed) {
        List<String> runs = dataset.filenames();
        int testCount = (int) Math.min(runs.size(), Math.round(testSize * runs.size()));

        String[] shuffled = runs.toArray(new String[0]);
        Random rnd = new Random(seed);
        for (int i = 0; i < testCount; i++) {
            int j = i + rnd.nextInt(shuffled.length - i);
            String tmp = shuffled[i];
            shuffled[i] = shuffled[j];
            shuffled[j] = tmp;
        }
        Set<String> testRuns = new HashSet<>(Arrays.asList(shuffled).subList(0, testCount));

        String[] file = dataset.data().text(FILE_COLUMN);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (int i = 0; i < file.length; i++) {
            (testRuns.contains(file[i]) ? test : train).add(i);
        }
        return new int[][]{toArray(train), toArray(test)};
    }

    static int[][] byRow(int rows, double testSize, long seed) {
        int[] positions = new int[rows];
        for (int i = 0; i < rows; i++) positions[i] = i;

        Random rnd = new Random(seed);
        for (int i = rows - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = positions[i];
            positions[i] = positions[j];
            positions[j] = tmp;
        }

        int testCount = Math.min(rows, (int) Math.ceil(testSize * rows));
        int[] test = Arrays.copyOfRange(positions, 0, testCount);
        int[] train = Arrays.copyOfRange(positions, testCount, rows);
        Arrays.sort(test);
        Arrays.sort(train);
        return new int[][]{train, test};
    }

    // =====================================================================
    // ВСПОМОГАТЕЛЬНОЕ
    // =====================================================================

    private Map<String, Map<String, String>> parameters(List<String> runs) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (String run : runs) {
            parameterStore.lookup(run).ifPresentOrElse(
                    p -> out.put(run, p),
                    () -> log.warn("⚠️ Нет параметров протокола для {}", run));
        }
        return out;
    }

    private static List<String> runs(DataTable part) {
        return part.hasColumn(FILE_COLUMN) ? part.uniqueText(FILE_COLUMN) : List.of();
    }

    private static void requireColumn(DataTable data, String column) {
        if (!data.hasColumn(column)) {
            throw new IllegalArgumentException("В датасете нет колонки '" + column + "'");
        }
    }

    private static int[] toArray(List<Integer> list) {
        return list.stream().mapToInt(Integer::intValue).toArray();
    }
}

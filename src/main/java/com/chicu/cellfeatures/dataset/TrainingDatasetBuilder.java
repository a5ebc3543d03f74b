package com.chicu.cellfeatures.dataset;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.dataset.params.HyperparameterTable;
import com.chicu.cellfeatures.features.FeatureExtractionService;
import com.chicu.cellfeatures.features.FeatureExtractorRegistry;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.chicu.cellfeatures.features.FeatureMetadata;
import com.chicu.cellfeatures.features.FeatureTable;
import com.chicu.cellfeatures.features.FeatureTableStore;
import com.chicu.cellfeatures.features.fastcharge.TrajectoryFastChargeExtractor;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.run.RunRecordLoader;
import com.chicu.cellfeatures.table.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.chicu.cellfeatures.dataset.TrainingDataset.FILE_COLUMN;

/**
 * TrainingDatasetBuilder
 * ======================
 * Собирает датасет из таблиц признаков:
 * - по вариантам: строки всех прогонов подряд (+ колонка file = метка прогона);
 * - между вариантами: join по file (INNER по умолчанию, OUTER: частичные строки).
 *
 * Коллизия имён колонок: колонка более позднего варианта получает суффикс _&lt;tag&gt;.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDatasetBuilder {

    private final FeatureTableStore featureStore;
    private final RunRecordLoader runLoader;
    private final FeatureExtractorRegistry registry;
    private final FeatureExtractionService extractionService;

    // =====================================================================
    // ИЗ СОХРАНЁННЫХ ПРИЗНАКОВ
    // =====================================================================

    public TrainingDataset fromFeatureFiles(String name,
                                            Collection<String> projects,
                                            List<FeatureType> types,
                                            Path featureDir,
                                            JoinPolicy policy) {
        if (projects == null || projects.isEmpty()) {
            throw new IllegalArgumentException("Не задан ни один проект");
        }
        requireTypes(types);
        if (featureDir == null) throw new IllegalArgumentException("featureDir=null");

        Map<FeatureType, List<FeatureTable>> byType = new EnumMap<>(FeatureType.class);
        for (FeatureType type : types) {
            List<FeatureTable> tables = new ArrayList<>();
            for (Path file : featureStore.list(featureDir, type, projects)) {
                FeatureTable t = featureStore.load(file);
                if (t.featureType() != type) {
                    log.warn("⚠️ {}: в каталоге {} лежит таблица {}, пропускаю", file, type.tag(), t.featureType());
                    continue;
                }
                tables.add(t);
            }
            log.info("📂 {}: загружено таблиц {}", type.tag(), tables.size());
            byType.put(type, tables);
        }

        return assemble(name, types, byType, policy);
    }

    // =====================================================================
    // ИЗ ПРОГОНОВ (признаки считаются на лету)
    // =====================================================================

    public TrainingDataset fromRunRecords(String name,
                                          List<String> runFiles,
                                          List<FeatureType> types,
                                          Map<FeatureType, FeatureHyperparameters> explicit,
                                          HyperparameterTable defaults,
                                          JoinPolicy policy) {
        if (runFiles == null || runFiles.isEmpty()) {
            throw new IllegalArgumentException("Не задан ни один прогон");
        }
        requireTypes(types);

        // гиперпараметры проверяем до загрузки прогонов
        HyperparameterTable table = defaults != null ? defaults : HyperparameterTable.empty();
        Map<FeatureType, FeatureHyperparameters> resolved = new EnumMap<>(FeatureType.class);
        for (FeatureType type : types) {
            FeatureHyperparameters given = explicit != null ? explicit.get(type) : null;
            resolved.put(type, table.resolve(type, given));
        }

        Map<FeatureType, List<FeatureTable>> byType = new EnumMap<>(FeatureType.class);
        types.forEach(t -> byType.put(t, new ArrayList<>()));

        for (String file : runFiles) {
            RunRecord run = runLoader.load(Path.of(file));
            for (FeatureType type : types) {
                extractionService.fromRun(registry.get(type), file, run, resolved.get(type))
                        .ifPresent(byType.get(type)::add);
            }
        }

        return assemble(name, types, byType, policy);
    }

    // =====================================================================
    // МОДЕЛЬ ДЕГРАДАЦИИ (предикторы Delta-Q + цель)
    // =====================================================================

    /**
     * Предикторы Delta-Q и, кроме {@link DegradationTarget#NONE}, колонки цели.
     * Для CYCLE_LIFE траектория считается по одному порогу 0.8 с остальными параметрами из таблицы.
     * Колонки предикторов и цели: {@code featureSets} датасета по вариантам.
     */
    public TrainingDataset degradationModel(String name,
                                            List<String> runFiles,
                                            DegradationTarget target,
                                            HyperparameterTable defaults,
                                            JoinPolicy policy) {
        if (target == null) throw new IllegalArgumentException("target=null");

        List<FeatureType> types = new ArrayList<>();
        types.add(FeatureType.DELTA_Q_FAST_CHARGE);
        target.outcome().ifPresent(types::add);

        Map<FeatureType, FeatureHyperparameters> explicit = new EnumMap<>(FeatureType.class);
        if (target == DegradationTarget.CYCLE_LIFE) {
            explicit.put(FeatureType.TRAJECTORY_FAST_CHARGE, cycleLifeHyperparameters(defaults));
        }

        log.info("🧮 Degradation model: name={} target={} runs={}", name, target,
                runFiles == null ? 0 : runFiles.size());
        return fromRunRecords(name, runFiles, types, explicit, defaults, policy);
    }

    static FeatureHyperparameters cycleLifeHyperparameters(HyperparameterTable defaults) {
        FeatureHyperparameters base = (defaults != null ? defaults : HyperparameterTable.empty())
                .get(FeatureType.TRAJECTORY_FAST_CHARGE)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Нет гиперпараметров " + FeatureType.TRAJECTORY_FAST_CHARGE.tag() + " для срока службы"));

        double step = base.getDouble(TrajectoryFastChargeExtractor.INTERVAL_CAP, 0.03);
        Map<String, Object> values = new LinkedHashMap<>(base.asMap());
        values.put(TrajectoryFastChargeExtractor.THRESH_MAX_CAP, DegradationTarget.CYCLE_LIFE_THRESHOLD);
        // полшага ниже порога: в сетке остаётся ровно 0.8
        values.put(TrajectoryFastChargeExtractor.THRESH_MIN_CAP, DegradationTarget.CYCLE_LIFE_THRESHOLD - step / 2);
        return FeatureHyperparameters.of(values);
    }

    // =====================================================================
    // СБОРКА
    // =====================================================================

    TrainingDataset assemble(String name,
                             List<FeatureType> types,
                             Map<FeatureType, List<FeatureTable>> byType,
                             JoinPolicy policy) {
        JoinPolicy join = policy != null ? policy : JoinPolicy.INNER;

        DataTable merged = null;
        Map<FeatureType, List<String>> featureSets = new LinkedHashMap<>();
        Map<String, FeatureMetadata> metadataByRun = new LinkedHashMap<>();

        for (FeatureType type : new LinkedHashSet<>(types)) {
            List<FeatureTable> tables = byType.getOrDefault(type, List.of());
            DataTable stacked = stack(tables);
            tables.forEach(t -> {
                if (t.metadata() != null) metadataByRun.putIfAbsent(t.runLabel(), t.metadata());
            });

            if (merged == null) {
                merged = stacked;
                featureSets.put(type, featureColumns(stacked));
                continue;
            }

            Map<String, String> renames = new HashMap<>();
            for (String c : stacked.columnNames()) {
                if (!FILE_COLUMN.equals(c) && merged.hasColumn(c)) {
                    renames.put(c, c + "_" + type.tag());
                }
            }
            if (!renames.isEmpty()) {
                log.warn("⚠️ {}: совпадающие колонки переименованы: {}", type.tag(), renames.keySet());
                stacked = stacked.renameColumns(renames);
            }

            featureSets.put(type, featureColumns(stacked));
            merged = merge(merged, stacked, join);
        }

        if (merged == null) merged = DataTable.empty();

        List<String> filenames = merged.hasColumn(FILE_COLUMN) ? merged.uniqueText(FILE_COLUMN) : List.of();
        List<FeatureMetadata> metadata = filenames.stream()
                .map(metadataByRun::get)
                .filter(Objects::nonNull)
                .toList();

        log.info("📦 Dataset built: name={} rows={} columns={} runs={} policy={}",
                name, merged.rowCount(), merged.columnCount(), filenames.size(), join);

        return new TrainingDataset(name, merged, metadata, filenames, featureSets);
    }

    /**
     * Строки всех таблиц одного варианта подряд; file: первая колонка.
     */
    static DataTable stack(List<FeatureTable> tables) {
        List<DataTable> parts = new ArrayList<>();
        for (FeatureTable t : tables) {
            DataTable data = t.data();
            String[] file = new String[data.rowCount()];
            Arrays.fill(file, t.runLabel());
            parts.add(DataTable.builder().text(FILE_COLUMN, file).build()
                    .concatColumns(data.hasColumn(FILE_COLUMN) ? dropColumn(data, FILE_COLUMN) : data));
        }
        DataTable out = DataTable.concatRows(parts);
        if (out.columnNames().isEmpty()) {
            return DataTable.builder().text(FILE_COLUMN, new String[0]).build();
        }
        return out;
    }

    /**
     * Слияние по file: много-ко-многим, порядок строк левой таблицы.
     * OUTER добавляет строки без пары (левые на месте, правые в конце).
     */
    static DataTable merge(DataTable left, DataTable right, JoinPolicy policy) {
        String[] lKeys = left.text(FILE_COLUMN);
        String[] rKeys = right.text(FILE_COLUMN);

        Map<String, List<Integer>> rightByKey = new LinkedHashMap<>();
        for (int j = 0; j < rKeys.length; j++) {
            rightByKey.computeIfAbsent(rKeys[j], k -> new ArrayList<>()).add(j);
        }

        List<int[]> pairs = new ArrayList<>(); // {leftRow | -1, rightRow | -1}
        boolean[] rightUsed = new boolean[rKeys.length];
        for (int i = 0; i < lKeys.length; i++) {
            List<Integer> matches = rightByKey.get(lKeys[i]);
            if (matches == null) {
                if (policy == JoinPolicy.OUTER) pairs.add(new int[]{i, -1});
                continue;
            }
            for (int j : matches) {
                pairs.add(new int[]{i, j});
                rightUsed[j] = true;
            }
        }
        if (policy == JoinPolicy.OUTER) {
            for (int j = 0; j < rKeys.length; j++) {
                if (!rightUsed[j]) pairs.add(new int[]{-1, j});
            }
        }

        int n = pairs.size();
        String[] file = new String[n];
        for (int k = 0; k < n; k++) {
            int[] p = pairs.get(k);
            file[k] = p[0] >= 0 ? lKeys[p[0]] : rKeys[p[1]];
        }

        DataTable.Builder b = DataTable.builder().text(FILE_COLUMN, file);
        gather(left, pairs, 0, b);
        gather(right, pairs, 1, b);
        return b.build();
    }

    private static void gather(DataTable src, List<int[]> pairs, int side, DataTable.Builder b) {
        for (String c : src.columnNames()) {
            if (FILE_COLUMN.equals(c)) continue;
            if (src.isNumeric(c)) {
                double[] from = src.numeric(c);
                double[] to = new double[pairs.size()];
                for (int k = 0; k < to.length; k++) {
                    int row = pairs.get(k)[side];
                    to[k] = row >= 0 ? from[row] : Double.NaN;
                }
                b.numeric(c, to);
            } else {
                String[] from = src.text(c);
                String[] to = new String[pairs.size()];
                for (int k = 0; k < to.length; k++) {
                    int row = pairs.get(k)[side];
                    to[k] = row >= 0 ? from[row] : null;
                }
                b.text(c, to);
            }
        }
    }

    private static DataTable dropColumn(DataTable t, String column) {
        return t.select(t.columnNames().stream().filter(c -> !c.equals(column)).toList());
    }

    private static List<String> featureColumns(DataTable t) {
        return t.columnNames().stream().filter(c -> !FILE_COLUMN.equals(c)).toList();
    }

    private static void requireTypes(List<FeatureType> types) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("Не задан ни один вариант признаков");
        }
    }
}

package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Имена выходов экстракторов.
 *
 * Пример:
 *   /data/structure/PreDiag_000240_000227_structure.json
 *     → runLabel    = PreDiag_000240_000227
 *     → featureName = PreDiag_000240_000227_features_DeltaQFastCharge
 *     → файл        = featureDir/DeltaQFastCharge/PreDiag_000240_000227_features_DeltaQFastCharge.json
 *
 * Гарантии:
 * - разные варианты для одного прогона никогда не совпадают (tag входит в имя);
 * - имя зависит только от пути и варианта;
 * - runLabel(featureName(p, t)) == runLabel(p), повторный прогон перезаписывает тот же ключ.
 */
public final class FeatureNaming {

    public static final String FEATURES_INFIX = "_features_";
    public static final String FILE_EXTENSION = ".json";

    private static final List<String> PIPELINE_SUFFIXES = List.of(
            "_structure", "_structured", "_processed", "_interpolated"
    );

    private static final List<String> KNOWN_EXTENSIONS = List.of(".json.gz", ".json", ".csv");

    private FeatureNaming() {
    }

    /**
     * Метка прогона: имя файла без каталога, расширения и служебных суффиксов пайплайна.
     */
    public static String runLabel(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Пустой путь прогона");
        }

        String name = path.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);

        // только известные расширения и только одно: точки внутри имени прогона остаются
        String lower = name.toLowerCase(Locale.ROOT);
        for (String ext : KNOWN_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                name = name.substring(0, name.length() - ext.length());
                break;
            }
        }

        int infix = name.lastIndexOf(FEATURES_INFIX);
        if (infix > 0 && isFeatureTag(name.substring(infix + FEATURES_INFIX.length()))) {
            name = name.substring(0, infix);
        }

        for (String suffix : PIPELINE_SUFFIXES) {
            if (name.endsWith(suffix) && name.length() > suffix.length()) {
                name = name.substring(0, name.length() - suffix.length());
                break;
            }
        }

        if (name.isBlank()) {
            throw new IllegalArgumentException("Не удалось получить метку прогона из пути: " + path);
        }
        return name;
    }

    public static String featureName(String inputPath, FeatureType type) {
        if (type == null) throw new IllegalArgumentException("type=null");
        return runLabel(inputPath) + FEATURES_INFIX + type.tag();
    }

    public static Path featurePath(Path featureDir, FeatureTable table) {
        return featureDir.resolve(table.featureType().tag()).resolve(table.name() + FILE_EXTENSION);
    }

    /**
     * Проект = префикс метки до первого '_' (PreDiag_000240 → PreDiag).
     */
    public static String project(String runLabel) {
        int us = runLabel.indexOf('_');
        return us > 0 ? runLabel.substring(0, us) : runLabel;
    }

    private static boolean isFeatureTag(String s) {
        for (FeatureType t : FeatureType.values()) {
            if (t.tag().equals(s)) return true;
        }
        return false;
    }
}

package com.chicu.cellfeatures.dataset.params;

import com.chicu.cellfeatures.features.FeatureNaming;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Параметры протоколов из CSV-файлов каталога (по файлу на проект: PreDiag_parameters.csv, ...).
 *
 * Выбор файла: проект файла (имя до первого '_') должен быть префиксом метки прогона;
 * при нескольких кандидатах: самый длинный проект, затем лексикографически первое имя файла.
 * Выбор строки: seq_num = число в метке сразу после "&lt;проект&gt;_", иначе первая строка.
 */
@Slf4j
public class DirectoryProtocolParameterStore implements ProtocolParameterStore {

    static final String SEQ_NUM = "seq_num";

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema HEADER = CsvSchema.emptySchema().withHeader();

    private final Path directory;

    public DirectoryProtocolParameterStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<Map<String, String>> lookup(String runLabel) {
        if (runLabel == null || runLabel.isBlank()) return Optional.empty();

        Optional<Path> file = parameterFile(runLabel);
        if (file.isEmpty()) {
            log.debug("Нет файла параметров для {}", runLabel);
            return Optional.empty();
        }

        List<Map<String, String>> rows = read(file.get());
        if (rows.isEmpty()) return Optional.empty();

        String project = project(file.get());
        Integer seq = sequenceNumber(runLabel, project);
        if (seq != null) {
            for (Map<String, String> row : rows) {
                if (seq.equals(parseInt(row.get(SEQ_NUM)))) return Optional.of(row);
            }
        }
        return Optional.of(rows.get(0));
    }

    Optional<Path> parameterFile(String runLabel) {
        if (directory == null || !Files.isDirectory(directory)) return Optional.empty();

        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".csv"))
                    .filter(p -> runLabel.startsWith(project(p)))
                    .min(Comparator.<Path>comparingInt(p -> -project(p).length())
                            .thenComparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать каталог параметров " + directory
                    + ": " + e.getMessage(), e);
        }
    }

    static String project(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return FeatureNaming.project(name);
    }

    static Integer sequenceNumber(String runLabel, String project) {
        String prefix = project + "_";
        if (!runLabel.startsWith(prefix)) return null;
        String rest = runLabel.substring(prefix.length());
        int us = rest.indexOf('_');
        return parseInt(us >= 0 ? rest.substring(0, us) : rest);
    }

    private static Integer parseInt(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return (int) Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Map<String, String>> read(Path file) {
        try (MappingIterator<Map<String, String>> it = CSV.readerFor(Map.class).with(HEADER).readValues(file.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать параметры " + file + ": " + e.getMessage(), e);
        }
    }
}

package com.chicu.cellfeatures.dataset.params;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureHyperparameters;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Чтение таблицы гиперпараметров из YAML:
 *
 * <pre>
 * DeltaQFastCharge:
 *   init_pred_cycle: 10
 *   ...
 * </pre>
 *
 * Ключ верхнего уровня: tag варианта (или имя enum).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HyperparameterTableLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ResourceLoader resourceLoader;

    public HyperparameterTable load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Не найдена таблица гиперпараметров: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            HyperparameterTable table = parse(in);
            log.info("⚙️ Hyperparameters loaded: {} variants from {}", table.types().size(), location);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать " + location + ": " + e.getMessage(), e);
        }
    }

    static HyperparameterTable parse(InputStream in) throws IOException {
        Map<String, Map<String, Object>> raw = YAML.readValue(in, new TypeReference<LinkedHashMap<String, Map<String, Object>>>() {});
        Map<FeatureType, FeatureHyperparameters> out = new EnumMap<>(FeatureType.class);
        if (raw != null) {
            raw.forEach((tag, values) -> out.put(FeatureType.fromTag(tag), FeatureHyperparameters.of(values)));
        }
        return new HyperparameterTable(out);
    }
}

package com.chicu.cellfeatures.features;

import com.chicu.cellfeatures.common.enums.FeatureType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Все экстракторы контекста, по одному на {@link FeatureType}.
 */
@Slf4j
@Component
public class FeatureExtractorRegistry {

    private final Map<FeatureType, FeatureExtractor> extractors = new EnumMap<>(FeatureType.class);

    public FeatureExtractorRegistry(List<FeatureExtractor> extractorList) {
        for (FeatureExtractor e : extractorList) {
            FeatureType type = e.type();
            if (type == null) continue;

            FeatureExtractor prev = extractors.put(type, e);
            if (prev != null) {
                log.warn("⚠️ Найдено 2 экстрактора для {}: {} и {}. Использую последний.",
                        type, prev.getClass().getSimpleName(), e.getClass().getSimpleName());
            }
        }

        log.info("🧪 FeatureExtractorRegistry поднят. Экстракторов зарегистрировано: {}", extractors.size());
    }

    public FeatureExtractor get(FeatureType type) {
        FeatureExtractor e = extractors.get(type);
        if (e == null) {
            throw new IllegalArgumentException("Экстрактор для " + type + " не зарегистрирован");
        }
        return e;
    }

    public Set<FeatureType> types() {
        return Collections.unmodifiableSet(extractors.keySet());
    }
}

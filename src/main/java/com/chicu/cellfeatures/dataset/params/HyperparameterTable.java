package com.chicu.cellfeatures.dataset.params;

import com.chicu.cellfeatures.common.enums.FeatureType;
import com.chicu.cellfeatures.features.FeatureHyperparameters;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Таблица гиперпараметров по умолчанию: вариант → набор параметров.
 * Набор ключей записи в таблице = ожидаемые ключи для явных параметров этого варианта.
 */
public final class HyperparameterTable {

    private final Map<FeatureType, FeatureHyperparameters> defaults;

    public HyperparameterTable(Map<FeatureType, FeatureHyperparameters> defaults) {
        EnumMap<FeatureType, FeatureHyperparameters> copy = new EnumMap<>(FeatureType.class);
        if (defaults != null) copy.putAll(defaults);
        this.defaults = Collections.unmodifiableMap(copy);
    }

    public static HyperparameterTable empty() {
        return new HyperparameterTable(Map.of());
    }

    public boolean has(FeatureType type) {
        return defaults.containsKey(type);
    }

    public Optional<FeatureHyperparameters> get(FeatureType type) {
        return Optional.ofNullable(defaults.get(type));
    }

    public Set<FeatureType> types() {
        return defaults.keySet();
    }

    /**
     * explicit → значение из таблицы → none().
     *
     * @throws IllegalArgumentException если явная запись есть, а варианта в таблице нет,
     *                                  или набор ключей не совпадает с ожидаемым
     */
    public FeatureHyperparameters resolve(FeatureType type, FeatureHyperparameters explicit) {
        if (explicit == null) {
            return get(type).orElse(FeatureHyperparameters.none());
        }

        FeatureHyperparameters expected = defaults.get(type);
        if (expected == null) {
            throw new IllegalArgumentException("Для " + type.tag()
                    + " переданы гиперпараметры, но в таблице по умолчанию такого варианта нет");
        }
        if (!explicit.keys().equals(expected.keys())) {
            throw new IllegalArgumentException("Гиперпараметры " + type.tag() + " не совпадают с ожидаемыми: "
                    + explicit.keys() + " vs " + expected.keys());
        }
        return explicit;
    }
}

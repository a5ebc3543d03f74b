package com.chicu.cellfeatures.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Гиперпараметры одного варианта экстрактора (ключ → значение из YAML / явной записи).
 * Отсутствующий ключ → значение по умолчанию, которое передаёт сам экстрактор.
 */
public final class FeatureHyperparameters {

    private static final FeatureHyperparameters NONE = new FeatureHyperparameters(Map.of());

    private final Map<String, Object> values;

    private FeatureHyperparameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FeatureHyperparameters of(Map<String, ?> values) {
        return values == null || values.isEmpty() ? NONE : new FeatureHyperparameters(new LinkedHashMap<>(values));
    }

    public static FeatureHyperparameters none() {
        return NONE;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int getInt(String key, int def) {
        Object v = values.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.intValue();
        return Integer.parseInt(v.toString().trim());
    }

    public double getDouble(String key, double def) {
        Object v = values.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.doubleValue();
        return Double.parseDouble(v.toString().trim());
    }

    public String getString(String key, String def) {
        Object v = values.get(key);
        return v == null ? def : v.toString();
    }

    public List<Integer> getIntList(String key, List<Integer> def) {
        Object v = values.get(key);
        if (v == null) return def;
        if (v instanceof List<?> list) {
            return list.stream()
                    .map(o -> o instanceof Number n ? n.intValue() : Integer.parseInt(o.toString().trim()))
                    .toList();
        }
        throw new IllegalArgumentException("Гиперпараметр '" + key + "' должен быть списком, пришло: " + v);
    }

    public List<String> getStringList(String key, List<String> def) {
        Object v = values.get(key);
        if (v == null) return def;
        if (v instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(v.toString());
    }

    @Override
    public String toString() {
        return "FeatureHyperparameters" + values;
    }
}

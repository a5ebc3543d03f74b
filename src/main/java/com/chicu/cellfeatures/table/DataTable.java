package com.chicu.cellfeatures.table;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * DataTable
 * =========
 * Неизменяемая колоночная таблица: каждая колонка либо числовая (double[], NaN = пропуск),
 * либо текстовая (String[], null = пропуск). Порядок колонок сохраняется.
 *
 * Используется везде: таблицы RunRecord, выход экстракторов, итоговый датасет.
 */
@JsonAutoDetect(
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        fieldVisibility = JsonAutoDetect.Visibility.NONE
)
public final class DataTable {

    private final List<String> columns;
    private final Map<String, double[]> numeric;
    private final Map<String, String[]> text;
    private final int rowCount;

    private DataTable(List<String> columns,
                      Map<String, double[]> numeric,
                      Map<String, String[]> text,
                      int rowCount) {
        this.columns = List.copyOf(columns);
        this.numeric = numeric;
        this.text = text;
        this.rowCount = rowCount;
    }

    @JsonCreator
    public static DataTable fromJson(@JsonProperty("columns") List<String> columns,
                                     @JsonProperty("numeric") Map<String, double[]> numeric,
                                     @JsonProperty("text") Map<String, String[]> text) {
        Builder b = builder();
        Map<String, double[]> nums = numeric != null ? numeric : Map.of();
        Map<String, String[]> txt = text != null ? text : Map.of();

        List<String> order = columns != null ? columns : new ArrayList<>(nums.keySet());
        if (columns == null) order.addAll(txt.keySet());

        for (String c : order) {
            if (nums.containsKey(c)) {
                b.numeric(c, nums.get(c));
            } else if (txt.containsKey(c)) {
                b.text(c, txt.get(c));
            } else {
                throw new IllegalArgumentException("колонка без данных: " + c);
            }
        }
        return b.build();
    }

    public static DataTable empty() {
        return new DataTable(List.of(), Map.of(), Map.of(), 0);
    }

    /**
     * Одна строка из числовых значений (порядок ключей = порядок колонок).
     */
    public static DataTable ofRow(Map<String, Double> values) {
        Builder b = builder();
        values.forEach((k, v) -> b.numeric(k, new double[]{v != null ? v : Double.NaN}));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // =====================================================================
    // ДОСТУП
    // =====================================================================

    @JsonGetter("columns")
    public List<String> columnNames() {
        return columns;
    }

    @JsonGetter("numeric")
    Map<String, double[]> numericColumns() {
        return Collections.unmodifiableMap(numeric);
    }

    @JsonGetter("text")
    Map<String, String[]> textColumns() {
        return Collections.unmodifiableMap(text);
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public boolean hasColumn(String name) {
        return numeric.containsKey(name) || text.containsKey(name);
    }

    public boolean isNumeric(String name) {
        return numeric.containsKey(name);
    }

    public double[] numeric(String name) {
        double[] col = numeric.get(name);
        if (col == null) {
            throw new IllegalArgumentException("нет числовой колонки '" + name + "', есть: " + columns);
        }
        return col.clone();
    }

    public String[] text(String name) {
        String[] col = text.get(name);
        if (col == null) {
            throw new IllegalArgumentException("нет текстовой колонки '" + name + "', есть: " + columns);
        }
        return col.clone();
    }

    public double value(String name, int row) {
        double[] col = numeric.get(name);
        if (col == null) throw new IllegalArgumentException("нет числовой колонки '" + name + "'");
        return col[row];
    }

    public String textValue(String name, int row) {
        String[] col = text.get(name);
        if (col == null) throw new IllegalArgumentException("нет текстовой колонки '" + name + "'");
        return col[row];
    }

    /**
     * Уникальные значения текстовой колонки в порядке первого появления (null пропускаем).
     */
    public List<String> uniqueText(String name) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String v : text(name)) {
            if (v != null) out.add(v);
        }
        return List.copyOf(out);
    }

    /**
     * Уникальные конечные значения числовой колонки по возрастанию.
     */
    public double[] uniqueSorted(String name) {
        return Arrays.stream(numeric(name))
                .filter(Double::isFinite)
                .distinct()
                .sorted()
                .toArray();
    }

    // =====================================================================
    // ПРЕОБРАЗОВАНИЯ (всегда новая таблица)
    // =====================================================================

    public DataTable filter(IntPredicate rowPredicate) {
        int[] keep = new int[rowCount];
        int n = 0;
        for (int i = 0; i < rowCount; i++) {
            if (rowPredicate.test(i)) keep[n++] = i;
        }
        return rows(Arrays.copyOf(keep, n));
    }

    /**
     * Строки по позициям (позиции могут повторяться).
     */
    public DataTable rows(int[] positions) {
        Builder b = builder();
        for (String c : columns) {
            if (numeric.containsKey(c)) {
                double[] src = numeric.get(c);
                double[] dst = new double[positions.length];
                for (int i = 0; i < positions.length; i++) dst[i] = src[positions[i]];
                b.numeric(c, dst);
            } else {
                String[] src = text.get(c);
                String[] dst = new String[positions.length];
                for (int i = 0; i < positions.length; i++) dst[i] = src[positions[i]];
                b.text(c, dst);
            }
        }
        if (columns.isEmpty()) b.rowCount(positions.length);
        return b.build();
    }

    public DataTable select(Collection<String> names) {
        Builder b = builder();
        for (String c : names) {
            if (numeric.containsKey(c)) {
                b.numeric(c, numeric.get(c));
            } else if (text.containsKey(c)) {
                b.text(c, text.get(c));
            } else {
                throw new IllegalArgumentException("нет колонки '" + c + "', есть: " + columns);
            }
        }
        if (names.isEmpty()) b.rowCount(rowCount);
        return b.build();
    }

    public DataTable withText(String name, String constant) {
        String[] col = new String[rowCount];
        Arrays.fill(col, constant);
        return toBuilder().text(name, col).build();
    }

    public DataTable withNumeric(String name, double[] values) {
        return toBuilder().numeric(name, values).build();
    }

    public DataTable renameColumns(Map<String, String> renames) {
        Builder b = builder();
        for (String c : columns) {
            String target = renames.getOrDefault(c, c);
            if (numeric.containsKey(c)) b.numeric(target, numeric.get(c));
            else b.text(target, text.get(c));
        }
        if (columns.isEmpty()) b.rowCount(rowCount);
        return b.build();
    }

    /**
     * Склейка по колонкам (как concat axis=1): число строк должно совпадать.
     */
    public DataTable concatColumns(DataTable other) {
        if (other.columns.isEmpty()) return this;
        if (columns.isEmpty()) return other;
        if (other.rowCount != rowCount) {
            throw new IllegalArgumentException("разное число строк: " + rowCount + " vs " + other.rowCount);
        }
        Builder b = toBuilder();
        for (String c : other.columns) {
            if (hasColumn(c)) throw new IllegalArgumentException("дубль колонки при склейке: " + c);
            if (other.numeric.containsKey(c)) b.numeric(c, other.numeric.get(c));
            else b.text(c, other.text.get(c));
        }
        return b.build();
    }

    /**
     * Склейка по строкам: объединение колонок, недостающие ячейки = NaN / null.
     */
    public static DataTable concatRows(List<DataTable> tables) {
        List<DataTable> parts = tables.stream().filter(Objects::nonNull).toList();
        if (parts.isEmpty()) return empty();

        LinkedHashMap<String, Boolean> union = new LinkedHashMap<>(); // name -> numeric?
        int total = 0;
        for (DataTable t : parts) {
            total += t.rowCount;
            for (String c : t.columns) {
                Boolean prev = union.putIfAbsent(c, t.isNumeric(c));
                if (prev != null && prev != t.isNumeric(c)) {
                    throw new IllegalArgumentException("колонка '" + c + "' числовая и текстовая одновременно");
                }
            }
        }

        Builder b = builder();
        for (Map.Entry<String, Boolean> e : union.entrySet()) {
            String c = e.getKey();
            if (e.getValue()) {
                double[] dst = new double[total];
                int off = 0;
                for (DataTable t : parts) {
                    if (t.numeric.containsKey(c)) {
                        System.arraycopy(t.numeric.get(c), 0, dst, off, t.rowCount);
                    } else {
                        Arrays.fill(dst, off, off + t.rowCount, Double.NaN);
                    }
                    off += t.rowCount;
                }
                b.numeric(c, dst);
            } else {
                String[] dst = new String[total];
                int off = 0;
                for (DataTable t : parts) {
                    if (t.text.containsKey(c)) {
                        System.arraycopy(t.text.get(c), 0, dst, off, t.rowCount);
                    }
                    off += t.rowCount;
                }
                b.text(c, dst);
            }
        }
        if (union.isEmpty()) b.rowCount(total);
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = builder();
        for (String c : columns) {
            if (numeric.containsKey(c)) b.numeric(c, numeric.get(c));
            else b.text(c, text.get(c));
        }
        b.rowCount(rowCount);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTable other)) return false;
        if (rowCount != other.rowCount || !columns.equals(other.columns)) return false;
        for (String c : columns) {
            if (numeric.containsKey(c)) {
                if (!Arrays.equals(numeric.get(c), other.numeric.get(c))) return false;
            } else if (!Arrays.equals(text.get(c), other.text.get(c))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "DataTable{rows=" + rowCount + ", columns=" + columns + "}";
    }

    // =====================================================================
    // BUILDER
    // =====================================================================

    public static final class Builder {

        private final List<String> columns = new ArrayList<>();
        private final Map<String, double[]> numeric = new LinkedHashMap<>();
        private final Map<String, String[]> text = new LinkedHashMap<>();
        private int rowCount = -1;

        private Builder() {
        }

        public Builder numeric(String name, double[] values) {
            Objects.requireNonNull(values, "values=null для " + name);
            checkLength(name, values.length);
            if (text.remove(name) != null) columns.remove(name);
            if (numeric.put(name, values.clone()) == null) columns.add(name);
            return this;
        }

        public Builder text(String name, String[] values) {
            Objects.requireNonNull(values, "values=null для " + name);
            checkLength(name, values.length);
            if (numeric.remove(name) != null) columns.remove(name);
            if (text.put(name, values.clone()) == null) columns.add(name);
            return this;
        }

        Builder rowCount(int rows) {
            if (columns.isEmpty()) this.rowCount = rows;
            return this;
        }

        private void checkLength(String name, int len) {
            if (!columns.isEmpty() && rowCount >= 0 && len != rowCount) {
                throw new IllegalArgumentException(
                        "длина колонки '" + name + "'=" + len + ", ожидалось " + rowCount);
            }
            rowCount = len;
        }

        public DataTable build() {
            return new DataTable(columns, new LinkedHashMap<>(numeric), new LinkedHashMap<>(text),
                    Math.max(0, rowCount));
        }
    }
}

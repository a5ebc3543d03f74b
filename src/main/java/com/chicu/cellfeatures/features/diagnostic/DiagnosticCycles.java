package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.common.enums.DiagnosticCycleType;
import com.chicu.cellfeatures.features.FeaturizationException;
import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.run.RunRecord;
import com.chicu.cellfeatures.table.DataTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Общие операции над диагностическими циклами: проверки прогона и выбор вхождений.
 *
 * «Вхождение» типа: один диагностический цикл этого типа; n-е вхождение = n-й по возрастанию
 * cycle_index среди циклов этого типа (0-based).
 */
@Slf4j
public final class DiagnosticCycles {

    public static final String N_SOC_WINDOWS = "n_soc_windows";
    public static final int DEFAULT_N_SOC_WINDOWS = 8;

    private DiagnosticCycles() {
    }

    /**
     * Диагностические таблицы есть и набор cycle_type в summary в точности равен словарю.
     */
    public static boolean hasExpectedCycleTypes(RunRecord run) {
        if (run == null || !run.hasDiagnostics()) return false;
        if (!run.diagnosticSummary().hasColumn(RunColumns.CYCLE_TYPE)) return false;

        Set<String> present = new HashSet<>(run.diagnosticSummary().uniqueText(RunColumns.CYCLE_TYPE));
        return present.equals(DiagnosticCycleType.allLabels());
    }

    /**
     * Хватает ли релаксационных кривых для признаков релаксации:
     * в 1-м и 2-м HPPC должно быть не меньше nSocWindows различных step_index_counter релаксации
     * (наименьший, покой после CV-удержания, не считается). Иначе: false.
     */
    public static boolean relaxationViable(RunRecord run, int nSocWindows) {
        if (run == null || !run.hasDiagnostics()) return false;

        DataTable interp = run.diagnosticInterpolated();
        double[] hppcCycles = occurrenceCycles(interp, DiagnosticCycleType.HPPC.label());
        if (hppcCycles.length < 2) return false;

        for (int chosen = 0; chosen < 2; chosen++) {
            DataTable cycle = cycleRows(interp, DiagnosticCycleType.HPPC.label(), hppcCycles[chosen]);
            int count = HppcCycle.parse(cycle).relaxationCounters().length;
            if (count < nSocWindows) {
                log.debug("HPPC #{} (cycle {}): {} счётчиков релаксации < {}", chosen, hppcCycles[chosen],
                        count, nSocWindows);
                return false;
            }
        }
        return true;
    }

    /**
     * Отсортированные cycle_index всех циклов типа cycleType.
     */
    public static double[] occurrenceCycles(DataTable table, String cycleType) {
        if (table == null || !table.hasColumn(RunColumns.CYCLE_TYPE)) return new double[0];
        String[] types = table.text(RunColumns.CYCLE_TYPE);
        double[] cycles = table.numeric(RunColumns.CYCLE_INDEX);
        return IntStream.range(0, types.length)
                .filter(i -> cycleType.equals(types[i]))
                .mapToDouble(i -> cycles[i])
                .filter(Double::isFinite)
                .distinct()
                .sorted()
                .toArray();
    }

    /**
     * Строки n-го вхождения cycleType.
     *
     * @throws FeaturizationException если вхождения нет
     */
    public static DataTable occurrence(DataTable table, String cycleType, int n) {
        double[] cycles = occurrenceCycles(table, cycleType);
        if (n < 0 || n >= cycles.length) {
            throw new FeaturizationException("Нет вхождения #" + n + " цикла " + cycleType
                    + " (всего " + cycles.length + ")");
        }
        return cycleRows(table, cycleType, cycles[n]);
    }

    /**
     * Позиции начала непрерывных блоков строк (cycle_type, cycle_index) == cycleType.
     */
    public static List<int[]> occurrenceBlocks(DataTable table, String cycleType) {
        String[] types = table.text(RunColumns.CYCLE_TYPE);
        double[] cycles = table.numeric(RunColumns.CYCLE_INDEX);

        List<int[]> blocks = new ArrayList<>(); // {start, endExclusive}
        int start = -1;
        for (int i = 0; i < types.length; i++) {
            boolean match = cycleType.equals(types[i]);
            boolean continues = match && start >= 0 && cycles[i] == cycles[i - 1];
            if (start >= 0 && !continues) {
                blocks.add(new int[]{start, i});
                start = -1;
            }
            if (match && start < 0) start = i;
        }
        if (start >= 0) blocks.add(new int[]{start, types.length});
        return blocks;
    }

    private static DataTable cycleRows(DataTable table, String cycleType, double cycle) {
        String[] types = table.text(RunColumns.CYCLE_TYPE);
        double[] cycles = table.numeric(RunColumns.CYCLE_INDEX);
        return table.filter(i -> cycleType.equals(types[i]) && cycles[i] == cycle);
    }
}

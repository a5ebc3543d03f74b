package com.chicu.cellfeatures.features.diagnostic;

import com.chicu.cellfeatures.run.RunColumns;
import com.chicu.cellfeatures.table.DataTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Разбор одного HPPC-цикла на отрезки шагов.
 *
 * Отрезок = непрерывный блок строк с одним step_index_counter.
 * Шаг релаксации: второй по возрастанию step_index цикла. Первый отрезок релаксации
 * (сразу после CV-удержания) не считается: он «загрязнён» предыдущим зарядом.
 *
 * Окно SOC: всё, что лежит между двумя соседними релаксациями:
 *   открывающая релаксация + [разрядный импульс, зарядный импульс, CC-разряд до следующего SOC]
 *   + закрывающая релаксация.
 * Импульс определяется по знаку тока первого отрезка окна каждого знака;
 * CC-разряд: последний отрезок окна с отрицательным током.
 */
final class HppcCycle {

    record Segment(int stepIndex, double counter, int from, int to) {

        int length() {
            return to - from;
        }
    }

    /**
     * @param opening    релаксация перед окном (напряжение покоя для импульсов)
     * @param relaxation закрывающая релаксация окна
     */
    record Window(Segment opening, Segment dischargePulse, Segment chargePulse, Segment ccDischarge,
                  Segment relaxation) {}

    private final double[] voltage;
    private final double[] current;
    private final double[] time;
    private final List<Segment> segments;
    private final int relaxationStep;

    private HppcCycle(double[] voltage, double[] current, double[] time,
                      List<Segment> segments, int relaxationStep) {
        this.voltage = voltage;
        this.current = current;
        this.time = time;
        this.segments = segments;
        this.relaxationStep = relaxationStep;
    }

    static HppcCycle parse(DataTable cycle) {
        int n = cycle.rowCount();
        double[] steps = column(cycle, RunColumns.STEP_INDEX, n);
        double[] counters = cycle.hasColumn(RunColumns.STEP_INDEX_COUNTER)
                ? cycle.numeric(RunColumns.STEP_INDEX_COUNTER)
                : steps;

        List<Segment> segments = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= n; i++) {
            if (i == n || counters[i] != counters[i - 1] || steps[i] != steps[i - 1]) {
                if (i > start) {
                    segments.add(new Segment((int) steps[start], counters[start], start, i));
                }
                start = i;
            }
        }

        double[] distinctSteps = Arrays.stream(steps).filter(Double::isFinite).distinct().sorted().toArray();
        int relaxationStep = distinctSteps.length >= 2 ? (int) distinctSteps[1] : Integer.MIN_VALUE;

        return new HppcCycle(
                column(cycle, RunColumns.VOLTAGE, n),
                column(cycle, RunColumns.CURRENT, n),
                column(cycle, RunColumns.TEST_TIME, n),
                List.copyOf(segments),
                relaxationStep);
    }

    /**
     * Отрезки релаксации без первого.
     */
    List<Segment> relaxationSegments() {
        List<Segment> all = segments.stream().filter(s -> s.stepIndex() == relaxationStep).toList();
        return all.isEmpty() ? List.of() : all.subList(1, all.size());
    }

    /**
     * Различные step_index_counter шага релаксации по возрастанию, без наименьшего (покой после CV).
     * Счётчик, встретившийся в нескольких несмежных блоках, считается один раз.
     */
    double[] relaxationCounters() {
        double[] distinct = segments.stream()
                .filter(s -> s.stepIndex() == relaxationStep)
                .mapToDouble(Segment::counter)
                .filter(Double::isFinite)
                .distinct()
                .sorted()
                .toArray();
        return distinct.length == 0 ? distinct : Arrays.copyOfRange(distinct, 1, distinct.length);
    }

    List<Window> windows() {
        List<Window> out = new ArrayList<>();
        Segment opening = null;
        List<Segment> pending = new ArrayList<>();

        for (Segment s : segments) {
            if (s.stepIndex() == relaxationStep) {
                if (opening != null) out.add(window(opening, pending, s));
                opening = s;
                pending.clear();
            } else if (opening != null) {
                pending.add(s);
            }
        }
        return out;
    }

    private Window window(Segment opening, List<Segment> between, Segment relaxation) {
        Segment dPulse = null;
        Segment cPulse = null;
        Segment cc = null;
        for (Segment s : between) {
            double i = meanCurrent(s);
            if (i < 0) {
                if (dPulse == null) dPulse = s;
                cc = s;
            } else if (i > 0 && cPulse == null) {
                cPulse = s;
            }
        }
        if (cc == dPulse) cc = null;
        return new Window(opening, dPulse, cPulse, cc, relaxation);
    }

    // =====================================================================
    // ДОСТУП К ДАННЫМ
    // =====================================================================

    double[] voltage(Segment s) {
        return Arrays.copyOfRange(voltage, s.from(), s.to());
    }

    /**
     * Время от начала отрезка, секунды.
     */
    double[] elapsed(Segment s) {
        double[] t = new double[s.length()];
        for (int i = 0; i < t.length; i++) t[i] = time[s.from() + i] - time[s.from()];
        return t;
    }

    double lastVoltage(Segment s) {
        return voltage[s.to() - 1];
    }

    double current(int row) {
        return current[row];
    }

    double voltageAt(int row) {
        return voltage[row];
    }

    /**
     * Первая строка отрезка, для которой прошло ≥ seconds секунд; иначе последняя.
     */
    int rowAfter(Segment s, double seconds) {
        double t0 = time[s.from()];
        for (int i = s.from(); i < s.to(); i++) {
            if (time[i] - t0 >= seconds) return i;
        }
        return s.to() - 1;
    }

    private double meanCurrent(Segment s) {
        double sum = 0;
        for (int i = s.from(); i < s.to(); i++) sum += current[i];
        return sum / s.length();
    }

    private static double[] column(DataTable t, String name, int n) {
        if (t.hasColumn(name)) return t.numeric(name);
        double[] nan = new double[n];
        Arrays.fill(nan, Double.NaN);
        return nan;
    }
}

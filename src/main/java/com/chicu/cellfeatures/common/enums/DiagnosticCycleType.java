package com.chicu.cellfeatures.common.enums;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Закрытый словарь типов диагностических циклов (значения колонки cycle_type). */
public enum DiagnosticCycleType {
    RESET("reset"),
    HPPC("hppc"),
    RPT_0_2C("rpt_0.2C"),
    RPT_1C("rpt_1C"),
    RPT_2C("rpt_2C");

    private final String label;

    DiagnosticCycleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isRpt() {
        return this == RPT_0_2C || this == RPT_1C || this == RPT_2C;
    }

    public static Optional<DiagnosticCycleType> fromLabel(String label) {
        return Arrays.stream(values()).filter(t -> t.label.equals(label)).findFirst();
    }

    public static Set<String> allLabels() {
        return EnumSet.allOf(DiagnosticCycleType.class).stream()
                .map(DiagnosticCycleType::label)
                .collect(Collectors.toUnmodifiableSet());
    }
}

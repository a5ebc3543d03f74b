package com.chicu.cellfeatures.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Варианты экстракторов признаков. tag: стабильное имя варианта:
 * входит в имя выходного файла, в ключ таблицы гиперпараметров и в feature_sets датасета.
 * В JSON вариант пишется tag-ом, читается по tag или по имени константы.
 */
public enum FeatureType {

    DELTA_Q_FAST_CHARGE("DeltaQFastCharge"),
    TRAJECTORY_FAST_CHARGE("TrajectoryFastCharge"),
    DIAGNOSTIC_CYCLES("DiagnosticCyclesFeatures"),
    DIAGNOSTIC_PROPERTIES("DiagnosticProperties"),
    RPT_DQDV("RPTdQdVFeatures"),
    HPPC_RESISTANCE_VOLTAGE("HPPCResistanceVoltageFeatures"),
    HPPC_RELAXATION("HPPCRelaxationFeatures"),
    DIAGNOSTIC_SUMMARY_STATS("DiagnosticSummaryStats"),
    CAPACITY_AT_SET_CYCLES("CapacityAtSetCycles");

    private final String tag;

    FeatureType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static FeatureType fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(tag) || t.name().equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Неизвестный тип признаков: " + tag));
    }
}

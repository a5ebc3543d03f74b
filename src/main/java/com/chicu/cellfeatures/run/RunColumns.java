package com.chicu.cellfeatures.run;

/**
 * Имена колонок таблиц RunRecord (контракт со стадией структурирования).
 */
public final class RunColumns {

    private RunColumns() {
    }

    public static final String CYCLE_INDEX = "cycle_index";
    public static final String CYCLE_TYPE = "cycle_type";

    // ---- summary ----
    public static final String DISCHARGE_CAPACITY = "discharge_capacity";
    public static final String CHARGE_CAPACITY = "charge_capacity";
    public static final String DISCHARGE_ENERGY = "discharge_energy";
    public static final String CHARGE_ENERGY = "charge_energy";
    public static final String DC_INTERNAL_RESISTANCE = "dc_internal_resistance";
    public static final String TEMPERATURE_MAXIMUM = "temperature_maximum";
    public static final String TEMPERATURE_MINIMUM = "temperature_minimum";
    public static final String CHARGE_DURATION = "charge_duration";
    public static final String TIME_TEMPERATURE_INTEGRATED = "time_temperature_integrated";

    // ---- interpolated ----
    public static final String VOLTAGE = "voltage";
    public static final String DISCHARGE_DQDV = "discharge_dQdV";
    public static final String CHARGE_DQDV = "charge_dQdV";
    public static final String STEP_TYPE = "step_type";
    public static final String STEP_INDEX = "step_index";
    public static final String STEP_INDEX_COUNTER = "step_index_counter";
    public static final String TEST_TIME = "test_time";
    public static final String CURRENT = "current";

    public static final String STEP_CHARGE = "charge";
    public static final String STEP_DISCHARGE = "discharge";
}

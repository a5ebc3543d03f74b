package com.chicu.cellfeatures.run;

import com.chicu.cellfeatures.table.DataTable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Структурированная история циклирования одной ячейки (вход пайплайна, только чтение).
 *
 * diagnosticSummary / diagnosticInterpolated могут отсутствовать (null):
 * у прогонов без диагностических циклов.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunRecord(
        String barcode,
        String protocol,
        @JsonProperty("channel_id") String channelId,
        DataTable summary,
        @JsonProperty("cycles_interpolated") DataTable cyclesInterpolated,
        @JsonProperty("diagnostic_summary") DataTable diagnosticSummary,
        @JsonProperty("diagnostic_interpolated") DataTable diagnosticInterpolated
) {

    public boolean hasDiagnostics() {
        return diagnosticSummary != null && !diagnosticSummary.isEmpty()
                && diagnosticInterpolated != null && !diagnosticInterpolated.isEmpty();
    }

    /**
     * Интерполированные точки только разрядной половины циклов
     * (если step_type нет: таблица целиком).
     */
    public DataTable dischargeInterpolated() {
        if (cyclesInterpolated == null) return DataTable.empty();
        if (!cyclesInterpolated.hasColumn(RunColumns.STEP_TYPE)) return cyclesInterpolated;
        String[] stepType = cyclesInterpolated.text(RunColumns.STEP_TYPE);
        return cyclesInterpolated.filter(i -> RunColumns.STEP_DISCHARGE.equals(stepType[i]));
    }
}

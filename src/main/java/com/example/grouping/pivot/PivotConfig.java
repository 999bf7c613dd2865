package com.example.grouping.pivot;

import com.example.grouping.model.GroupingLevel;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declares a pivot table: row and column hierarchies, measures and filters.
 *
 * <pre>{@code
 * {"id": "sales",
 *  "rows":    [{"level": 1, "fields": ["region"]}],
 *  "columns": [{"level": 1, "fields": ["date"], "function": {"method": "time_period", "unit": "quarter"}}],
 *  "measures": [{"id": "revenue", "field": "amount", "type": "sum"}],
 *  "filters":  [{"field": "status", "type": "select", "selectedValues": ["completed"]}]}
 * }</pre>
 *
 * Sub totals and grand totals are on unless switched off.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotConfig(
        String id,
        String title,
        List<GroupingLevel> rows,
        List<GroupingLevel> columns,
        List<PivotMeasure> measures,
        List<PivotFilter> filters,
        boolean showSubTotals,
        boolean showGrandTotals
) {
    @JsonCreator
    public PivotConfig(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("rows") List<GroupingLevel> rows,
            @JsonProperty("columns") List<GroupingLevel> columns,
            @JsonProperty("measures") List<PivotMeasure> measures,
            @JsonProperty("filters") List<PivotFilter> filters,
            @JsonProperty("showSubTotals") Boolean showSubTotals,
            @JsonProperty("showGrandTotals") Boolean showGrandTotals
    ) {
        this(id, title, rows, columns, measures, filters,
                showSubTotals == null || showSubTotals,
                showGrandTotals == null || showGrandTotals);
    }

    public PivotConfig {
        rows = rows != null ? List.copyOf(rows) : List.of();
        columns = columns != null ? List.copyOf(columns) : List.of();
        measures = measures != null ? List.copyOf(measures) : List.of();
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public static PivotConfig of(List<GroupingLevel> rows, List<GroupingLevel> columns, List<PivotMeasure> measures) {
        return new PivotConfig("pivot", null, rows, columns, measures, List.of(), true, true);
    }

    public PivotConfig withFilters(List<PivotFilter> newFilters) {
        return new PivotConfig(id, title, rows, columns, measures, newFilters, showSubTotals, showGrandTotals);
    }

    public PivotConfig withTotals(boolean subTotals, boolean grandTotals) {
        return new PivotConfig(id, title, rows, columns, measures, filters, subTotals, grandTotals);
    }
}

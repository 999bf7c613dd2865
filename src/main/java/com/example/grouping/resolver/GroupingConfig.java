package com.example.grouping.resolver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Column-oriented configuration of a grouped view: {@code {"columns": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupingConfig(List<ColumnConfig> columns) {

    @JsonCreator
    public GroupingConfig(@JsonProperty("columns") List<ColumnConfig> columns) {
        this.columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public static GroupingConfig of(ColumnConfig... columns) {
        return new GroupingConfig(Arrays.asList(columns));
    }
}

package com.example.grouping.resolver;

import com.example.grouping.model.GroupingFunction;
import com.example.grouping.model.LevelSorting;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code grouping} block of a column configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnGrouping(
        int level,
        GroupingFunction function,
        String template,
        String separator,
        LevelSorting sorting
) {
    @JsonCreator
    public ColumnGrouping(
            @JsonProperty("level") int level,
            @JsonProperty("function") GroupingFunction function,
            @JsonProperty("template") String template,
            @JsonProperty("separator") String separator,
            @JsonProperty("sorting") LevelSorting sorting
    ) {
        this.level = level;
        this.function = function;
        this.template = template;
        this.separator = separator;
        this.sorting = sorting;
    }

    public static ColumnGrouping atLevel(int level) {
        return new ColumnGrouping(level, null, null, null, null);
    }

    public static ColumnGrouping atLevel(int level, GroupingFunction function) {
        return new ColumnGrouping(level, function, null, null, null);
    }

    public GroupingDeclaration toDeclaration(String columnId) {
        return new GroupingDeclaration(columnId, level, function, template, separator, sorting);
    }
}

package com.example.grouping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * One resolved grouping pass.
 *
 * <p>{@code level} identifies the pass, not a single field: every field
 * declared on the same level number is combined into one composite key.
 * Levels are processed in ascending {@code level} order; gaps are allowed.
 *
 * @param level     positive level number
 * @param fields    fields combined into the composite key, in declaration order
 * @param function  grouping function applied to those fields
 * @param template  optional {@code {field}} display template (multi-field composite only)
 * @param separator separator between field parts, {@code " + "} when unset
 * @param sorting   ordering of the produced groups
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupingLevel(
        int level,
        List<String> fields,
        GroupingFunction function,
        String template,
        String separator,
        LevelSorting sorting
) {
    public static final String DEFAULT_SEPARATOR = " + ";

    @JsonCreator
    public GroupingLevel(
            @JsonProperty("level") int level,
            @JsonProperty("fields") List<String> fields,
            @JsonProperty("function") GroupingFunction function,
            @JsonProperty("template") String template,
            @JsonProperty("separator") String separator,
            @JsonProperty("sorting") LevelSorting sorting
    ) {
        this.level = level;
        this.fields = fields != null ? List.copyOf(fields) : List.of();
        this.function = function != null ? function : GroupingFunction.byField();
        this.template = template;
        this.separator = separator != null ? separator : DEFAULT_SEPARATOR;
        this.sorting = sorting != null ? sorting : LevelSorting.none();
    }

    public static GroupingLevel byField(int level, String... fields) {
        return of(level, GroupingFunction.byField(), fields);
    }

    public static GroupingLevel of(int level, GroupingFunction function, String... fields) {
        return new GroupingLevel(level, Arrays.asList(fields), function, null, null, null);
    }

    public GroupingLevel withTemplate(String newTemplate) {
        return new GroupingLevel(level, fields, function, newTemplate, separator, sorting);
    }

    public GroupingLevel withSeparator(String newSeparator) {
        return new GroupingLevel(level, fields, function, template, newSeparator, sorting);
    }

    public GroupingLevel withSorting(LevelSorting newSorting) {
        return new GroupingLevel(level, fields, function, template, separator, newSorting);
    }

    public GroupingMethod method() {
        return function.method();
    }
}

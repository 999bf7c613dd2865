package com.example.grouping.resolver;

import com.example.grouping.model.GroupingFunction;
import com.example.grouping.model.LevelSorting;

/**
 * One column's request to take part in a grouping pass.
 *
 * <p>Several declarations may share a level number; the resolver merges them
 * into a single composite-key pass. Unset presentation options ({@code null})
 * let another declaration on the same level decide.
 *
 * @param column    field the column groups by
 * @param level     positive level number of the pass
 * @param function  grouping function, by-field when {@code null}
 * @param template  optional {@code {field}} template
 * @param separator optional separator between key parts
 * @param sorting   optional ordering of the produced groups
 */
public record GroupingDeclaration(
        String column,
        int level,
        GroupingFunction function,
        String template,
        String separator,
        LevelSorting sorting
) {
    public static GroupingDeclaration of(String column, int level) {
        return new GroupingDeclaration(column, level, null, null, null, null);
    }

    public static GroupingDeclaration of(String column, int level, GroupingFunction function) {
        return new GroupingDeclaration(column, level, function, null, null, null);
    }

    public GroupingDeclaration withTemplate(String newTemplate) {
        return new GroupingDeclaration(column, level, function, newTemplate, separator, sorting);
    }

    public GroupingDeclaration withSeparator(String newSeparator) {
        return new GroupingDeclaration(column, level, function, template, newSeparator, sorting);
    }

    public GroupingDeclaration withSorting(LevelSorting newSorting) {
        return new GroupingDeclaration(column, level, function, template, separator, newSorting);
    }
}

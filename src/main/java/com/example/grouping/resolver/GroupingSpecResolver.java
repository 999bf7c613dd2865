package com.example.grouping.resolver;

import com.example.grouping.aggregation.AggregationSpec;
import com.example.grouping.error.ConflictingGroupFunctionException;
import com.example.grouping.error.InvalidGroupingDeclarationException;
import com.example.grouping.error.UnknownGroupFunctionException;
import com.example.grouping.model.GroupingFunction;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.model.GroupingMethod;
import com.example.grouping.model.LevelSorting;
import com.example.grouping.registry.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns per-column grouping declarations into an ordered list of grouping passes.
 *
 * <p>Declarations sharing a level number are merged into one pass whose
 * fields are the union of the declared fields, in declaration order. Their
 * grouping functions must be equal. Template, separator and sorting come from
 * the first declaration on the level that sets them. Passes are returned in
 * ascending level order; gaps between level numbers are kept as they are.
 *
 * <p>All checks run here, before any record is processed:
 * <ul>
 *   <li>{@link ConflictingGroupFunctionException} for two different functions on one level</li>
 *   <li>{@link UnknownGroupFunctionException} for a custom function id that is not registered</li>
 *   <li>{@link InvalidGroupingDeclarationException} for a non-positive level, a level
 *       without fields or a numeric range with a non-positive step</li>
 * </ul>
 */
public class GroupingSpecResolver {

    private static final Logger logger = LoggerFactory.getLogger(GroupingSpecResolver.class);

    private final FunctionRegistry registry;

    public GroupingSpecResolver() {
        this(FunctionRegistry.global());
    }

    public GroupingSpecResolver(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolves column declarations into grouping passes.
     */
    public List<GroupingLevel> resolve(Collection<GroupingDeclaration> declarations) {
        List<GroupingLevel> levels = new ArrayList<>(declarations.size());
        for (GroupingDeclaration declaration : declarations) {
            if (declaration.column() == null || declaration.column().isBlank()) {
                throw new InvalidGroupingDeclarationException(
                        "Grouping declaration on level " + declaration.level() + " names no column");
            }
            levels.add(new GroupingLevel(declaration.level(), List.of(declaration.column()),
                    declaration.function(), declaration.template(), declaration.separator(), declaration.sorting()));
        }
        return resolveLevels(levels);
    }

    /**
     * Merges and orders already level-shaped declarations.
     */
    public List<GroupingLevel> resolveLevels(Collection<GroupingLevel> declared) {
        Map<Integer, MergedLevel> byLevel = new TreeMap<>();
        for (GroupingLevel level : declared) {
            if (level.level() <= 0) {
                throw new InvalidGroupingDeclarationException(
                        "Grouping level must be positive, got " + level.level() + " for " + level.fields());
            }
            byLevel.computeIfAbsent(level.level(), MergedLevel::new).merge(level);
        }

        List<GroupingLevel> resolved = new ArrayList<>(byLevel.size());
        for (MergedLevel merged : byLevel.values()) {
            GroupingLevel level = merged.toLevel();
            check(level);
            resolved.add(level);
        }
        logger.debug("Resolved {} declarations into {} grouping levels {}",
                declared.size(), resolved.size(), byLevel.keySet());
        return resolved;
    }

    /**
     * Resolves a column-oriented configuration into grouping levels and
     * aggregation specs with column defaults applied.
     */
    public GroupingPlan resolvePlan(GroupingConfig config) {
        return resolvePlan(config.columns());
    }

    public GroupingPlan resolvePlan(List<ColumnConfig> columns) {
        List<GroupingDeclaration> declarations = new ArrayList<>();
        List<AggregationSpec> specs = new ArrayList<>();
        for (ColumnConfig column : columns) {
            if (column.grouping() != null) {
                declarations.add(column.grouping().toDeclaration(column.id()));
            }
            for (AggregationSpec spec : column.aggregations()) {
                specs.add(spec.withColumnDefaults(column.id(), column.defaultTargetLevel()));
            }
        }
        return new GroupingPlan(resolve(declarations), specs);
    }

    private void check(GroupingLevel level) {
        GroupingFunction function = level.function();
        if (function.method() != GroupingMethod.CUSTOM && level.fields().isEmpty()) {
            throw new InvalidGroupingDeclarationException(
                    "Grouping level " + level.level() + " declares no fields");
        }
        switch (function.method()) {
            case NUMERIC_RANGE -> {
                if (!(function.step() > 0) || !Double.isFinite(function.step()) || !Double.isFinite(function.min())) {
                    throw new InvalidGroupingDeclarationException("Grouping level " + level.level()
                            + " declares a numeric range with min " + function.min() + " and step " + function.step());
                }
            }
            case CUSTOM -> {
                if (function.customId() == null || function.customId().isBlank()) {
                    throw new InvalidGroupingDeclarationException(
                            "Grouping level " + level.level() + " declares a custom function without id");
                }
                if (!registry.hasGroupFunction(function.customId())) {
                    throw new UnknownGroupFunctionException(function.customId());
                }
            }
            default -> {
            }
        }
    }

    /**
     * Declarations collected for one level number.
     */
    private static final class MergedLevel {
        private final int level;
        private final Set<String> fields = new LinkedHashSet<>();
        private GroupingFunction function;
        private String template;
        private String separator;
        private LevelSorting sorting;

        MergedLevel(int level) {
            this.level = level;
        }

        void merge(GroupingLevel declared) {
            if (function == null) {
                function = declared.function();
            } else if (!function.equals(declared.function())) {
                throw new ConflictingGroupFunctionException(level, "Grouping level " + level
                        + " declares both " + function + " and " + declared.function()
                        + " (fields " + fields + " and " + declared.fields() + ")");
            }
            fields.addAll(declared.fields());
            if (template == null) {
                template = declared.template();
            }
            if (separator == null && !GroupingLevel.DEFAULT_SEPARATOR.equals(declared.separator())) {
                separator = declared.separator();
            }
            if (sorting == null && !declared.sorting().isNone()) {
                sorting = declared.sorting();
            }
        }

        GroupingLevel toLevel() {
            return new GroupingLevel(level, new ArrayList<>(fields), function, template, separator, sorting);
        }
    }
}

package com.example.grouping.pivot;

import com.example.grouping.aggregation.AggregationEvaluator;
import com.example.grouping.aggregation.AggregationSpec;
import com.example.grouping.aggregation.AggregationWarning;
import com.example.grouping.error.InvalidAggregationSpecException;
import com.example.grouping.format.ValueFormatter;
import com.example.grouping.hierarchy.HierarchyBuilder;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.model.IndexSet;
import com.example.grouping.registry.FunctionRegistry;
import com.example.grouping.resolver.GroupingSpecResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Builds a pivot table from two independent hierarchies over the same records.
 *
 * <p>Filters run first; both trees are then built over the surviving records,
 * so a cell's records are the intersection of its row leaf's and column leaf's
 * member indices. Row totals ignore the column axis and column totals ignore
 * the row axis; both are produced for every non-root node. Grand totals cover
 * every surviving record. An axis without levels is a single leaf with the
 * empty path.
 */
public class PivotMatrixBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PivotMatrixBuilder.class);

    private final GroupingSpecResolver resolver;
    private final HierarchyBuilder hierarchyBuilder;
    private final AggregationEvaluator evaluator;

    public PivotMatrixBuilder() {
        this(FunctionRegistry.global());
    }

    public PivotMatrixBuilder(FunctionRegistry registry) {
        this.resolver = new GroupingSpecResolver(registry);
        this.hierarchyBuilder = new HierarchyBuilder(registry);
        this.evaluator = new AggregationEvaluator(registry);
    }

    /**
     * Validates the configuration, then filters, groups and aggregates.
     */
    public PivotTable build(List<DataRecord> records, PivotConfig config) {
        List<GroupingLevel> rowLevels = resolver.resolveLevels(config.rows());
        List<GroupingLevel> columnLevels = resolver.resolveLevels(config.columns());
        validateMeasures(config.measures());
        config.filters().forEach(PivotFilter::validate);

        List<DataRecord> filtered = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            if (config.filters().stream().allMatch(filter -> filter.test(record))) {
                filtered.add(record);
            }
        }

        GroupNode rowTree = hierarchyBuilder.build(filtered, rowLevels);
        GroupNode columnTree = hierarchyBuilder.build(filtered, columnLevels);
        List<AggregationWarning> warnings = new ArrayList<>();

        List<PivotCell> cells = buildMatrix(filtered, rowTree, columnTree, config.measures(), warnings::add);

        List<PivotCell> rowTotals = new ArrayList<>();
        List<PivotCell> columnTotals = new ArrayList<>();
        if (config.showSubTotals()) {
            for (GroupNode row : nonRoot(rowTree)) {
                for (PivotMeasure measure : config.measures()) {
                    rowTotals.add(cell(filtered, row.members(), row.path(), List.of(), measure, -1, -1,
                            warnings::add));
                }
            }
            for (GroupNode column : nonRoot(columnTree)) {
                for (PivotMeasure measure : config.measures()) {
                    columnTotals.add(cell(filtered, column.members(), List.of(), column.path(), measure, -1, -1,
                            warnings::add));
                }
            }
        }

        List<PivotCell> grandTotals = new ArrayList<>();
        if (config.showGrandTotals()) {
            IndexSet all = IndexSet.range(filtered.size());
            for (PivotMeasure measure : config.measures()) {
                grandTotals.add(cell(filtered, all, List.of(), List.of(), measure, -1, -1, warnings::add));
            }
        }

        PivotTable.Metadata metadata = new PivotTable.Metadata(rowTree.leaves().size(),
                columnTree.leaves().size(), config.measures().size(), filtered.size());
        logger.debug("Pivot '{}': {} of {} records after filters, {} rows x {} columns x {} measures, {} cells",
                config.id(), filtered.size(), records.size(), metadata.rowCount(), metadata.columnCount(),
                metadata.measureCount(), cells.size());

        return new PivotTable(config.id(), config.title(), rowTree, columnTree, cells,
                rowTotals, columnTotals, grandTotals, metadata, warnings);
    }

    /**
     * Computes every (row leaf, column leaf, measure) cell, rows outermost.
     *
     * @param records    the record store both trees index into
     * @param rowTree    root of the row hierarchy
     * @param columnTree root of the column hierarchy
     * @param measures   measures in declaration order
     * @param warnings   receives recoverable problems
     */
    public List<PivotCell> buildMatrix(List<DataRecord> records, GroupNode rowTree, GroupNode columnTree,
                                       List<PivotMeasure> measures, Consumer<AggregationWarning> warnings) {
        List<GroupNode> rows = rowTree.leaves();
        List<GroupNode> columns = columnTree.leaves();
        List<PivotCell> cells = new ArrayList<>(rows.size() * columns.size() * measures.size());
        for (int r = 0; r < rows.size(); r++) {
            GroupNode row = rows.get(r);
            for (int c = 0; c < columns.size(); c++) {
                GroupNode column = columns.get(c);
                IndexSet subset = row.members().intersect(column.members());
                for (int m = 0; m < measures.size(); m++) {
                    cells.add(cell(records, subset, row.path(), column.path(), measures.get(m),
                            r, c * measures.size() + m, warnings));
                }
            }
        }
        return cells;
    }

    private PivotCell cell(List<DataRecord> records, IndexSet subset, List<String> rowPath, List<String> columnPath,
                           PivotMeasure measure, int row, int column, Consumer<AggregationWarning> warnings) {
        List<String> location = new ArrayList<>(rowPath);
        location.addAll(columnPath);
        AggregationEvaluator.Measurement measurement =
                evaluator.measure(records, subset, measure.toSpec(), location, warnings);
        return new PivotCell(rowPath, columnPath, measure.id(), measurement.value(), measurement.valueCount(),
                ValueFormatter.format(measurement.value(), measure.format()), row, column);
    }

    private void validateMeasures(List<PivotMeasure> measures) {
        Set<String> ids = new HashSet<>();
        List<AggregationSpec> specs = new ArrayList<>(measures.size());
        for (PivotMeasure measure : measures) {
            if (measure.id() == null || measure.id().isBlank()) {
                throw new InvalidAggregationSpecException("Pivot measure on '" + measure.field() + "' has no id");
            }
            if (!ids.add(measure.id())) {
                throw new InvalidAggregationSpecException("Pivot measure id '" + measure.id() + "' is declared twice");
            }
            specs.add(measure.toSpec());
        }
        evaluator.validate(specs);
    }

    private static List<GroupNode> nonRoot(GroupNode tree) {
        List<GroupNode> nodes = tree.preOrder();
        return nodes.subList(1, nodes.size());
    }
}

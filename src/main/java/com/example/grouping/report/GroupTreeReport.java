package com.example.grouping.report;

import com.example.grouping.GroupingResult;
import com.example.grouping.aggregation.AggregationResult;
import com.example.grouping.aggregation.AggregationResultMap;
import com.example.grouping.model.GroupNode;
import com.example.grouping.pivot.PivotCell;
import com.example.grouping.pivot.PivotMeasure;
import com.example.grouping.pivot.PivotTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Renders grouping results and pivot tables as plain text.
 *
 * <p>Tree output indents two spaces per level. A node's header aggregates are
 * printed under its own line, before its children; footer aggregates follow
 * the children.
 * <pre>
 * Total (3)
 *   count: 3
 *   North (2)
 *     sum(amount): 30
 *   South (1)
 *     sum(amount): 5
 * </pre>
 */
public class GroupTreeReport {

    private static final String INDENT = "  ";
    private static final String ROOT_LABEL = "Total";
    private static final String PATH_SEPARATOR = " / ";

    public String render(GroupingResult result) {
        StringBuilder out = new StringBuilder();
        renderNode(result.root(), result.aggregations(), 0, out);
        return out.toString();
    }

    private void renderNode(GroupNode node, AggregationResultMap aggregations, int depth, StringBuilder out) {
        String indent = INDENT.repeat(depth);
        String name = node.isRoot() ? ROOT_LABEL : node.key();
        out.append(indent).append(name).append(" (").append(node.recordCount()).append(")\n");

        Map<String, AggregationResult> results = aggregations.resultsAt(node.path());
        appendResults(results, r -> r.position().inHeader(), indent + INDENT, out);
        for (GroupNode child : node.children()) {
            renderNode(child, aggregations, depth + 1, out);
        }
        appendResults(results, r -> r.position().inFooter(), indent + INDENT, out);
    }

    private static void appendResults(Map<String, AggregationResult> results, Predicate<AggregationResult> include,
                                      String indent, StringBuilder out) {
        for (AggregationResult result : results.values()) {
            if (include.test(result)) {
                out.append(indent).append(result.label()).append(": ").append(result.formatted()).append('\n');
            }
        }
    }

    /**
     * Renders the pivot matrix as a fixed-width grid, one line per row leaf,
     * followed by the grand totals.
     */
    public String render(PivotTable table, List<PivotMeasure> measures) {
        List<GroupNode> rows = table.rowTree().leaves();
        List<GroupNode> columns = table.columnTree().leaves();

        List<List<String>> grid = new ArrayList<>();
        List<String> header = new ArrayList<>();
        header.add("");
        for (GroupNode column : columns) {
            for (PivotMeasure measure : measures) {
                header.add(label(column.path(), measure, measures.size()));
            }
        }
        grid.add(header);

        for (GroupNode row : rows) {
            List<String> line = new ArrayList<>();
            line.add(row.path().isEmpty() ? ROOT_LABEL : String.join(PATH_SEPARATOR, row.path()));
            for (GroupNode column : columns) {
                for (PivotMeasure measure : measures) {
                    line.add(table.cell(row.path(), column.path(), measure.id())
                            .map(PivotCell::formattedValue)
                            .orElse(""));
                }
            }
            grid.add(line);
        }

        StringBuilder out = new StringBuilder();
        appendGrid(grid, out);
        for (PivotCell total : table.grandTotals()) {
            out.append(ROOT_LABEL).append(' ').append(total.measureId()).append(": ")
                    .append(total.formattedValue()).append('\n');
        }
        return out.toString();
    }

    private static String label(List<String> columnPath, PivotMeasure measure, int measureCount) {
        String column = columnPath.isEmpty() ? ROOT_LABEL : String.join(PATH_SEPARATOR, columnPath);
        return measureCount > 1 ? column + PATH_SEPARATOR + measure.label() : column;
    }

    private static void appendGrid(List<List<String>> grid, StringBuilder out) {
        int columns = grid.get(0).size();
        int[] widths = new int[columns];
        for (List<String> line : grid) {
            for (int i = 0; i < columns; i++) {
                widths[i] = Math.max(widths[i], line.get(i).length());
            }
        }
        for (List<String> line : grid) {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < columns; i++) {
                if (i > 0) {
                    text.append(" | ");
                }
                String cell = line.get(i);
                // labels left-aligned, values right-aligned
                text.append(pad(cell, widths[i], i > 0));
            }
            out.append(text.toString().stripTrailing()).append('\n');
        }
    }

    private static String pad(String text, int width, boolean alignRight) {
        String padding = " ".repeat(width - text.length());
        return alignRight ? padding + text : text + padding;
    }
}

package com.example.grouping.pivot;

import com.example.grouping.aggregation.AggregationWarning;
import com.example.grouping.model.GroupNode;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link PivotMatrixBuilder}: both header trees, the cell matrix,
 * totals and run metadata.
 */
public record PivotTable(
        String id,
        String title,
        GroupNode rowTree,
        GroupNode columnTree,
        List<PivotCell> cells,
        List<PivotCell> rowTotals,
        List<PivotCell> columnTotals,
        List<PivotCell> grandTotals,
        Metadata metadata,
        List<AggregationWarning> warnings
) {
    /**
     * @param rowCount     number of leaf rows
     * @param columnCount  number of leaf columns
     * @param measureCount number of measures
     * @param totalRecords records left after filtering
     */
    public record Metadata(int rowCount, int columnCount, int measureCount, int totalRecords) {
    }

    public PivotTable {
        cells = List.copyOf(cells);
        rowTotals = List.copyOf(rowTotals);
        columnTotals = List.copyOf(columnTotals);
        grandTotals = List.copyOf(grandTotals);
        warnings = List.copyOf(warnings);
    }

    public Optional<PivotCell> cell(List<String> rowPath, List<String> columnPath, String measureId) {
        return find(cells, rowPath, columnPath, measureId);
    }

    public Optional<PivotCell> rowTotal(List<String> rowPath, String measureId) {
        return find(rowTotals, rowPath, List.of(), measureId);
    }

    public Optional<PivotCell> columnTotal(List<String> columnPath, String measureId) {
        return find(columnTotals, List.of(), columnPath, measureId);
    }

    public Optional<PivotCell> grandTotal(String measureId) {
        return find(grandTotals, List.of(), List.of(), measureId);
    }

    private static Optional<PivotCell> find(List<PivotCell> source, List<String> rowPath, List<String> columnPath,
                                            String measureId) {
        return source.stream()
                .filter(cell -> cell.rowPath().equals(rowPath)
                        && cell.columnPath().equals(columnPath)
                        && cell.measureId().equals(measureId))
                .findFirst();
    }
}

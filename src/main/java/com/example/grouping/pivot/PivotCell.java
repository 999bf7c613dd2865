package com.example.grouping.pivot;

import java.util.List;

/**
 * One measure value at a row and column position.
 *
 * <p>Matrix cells carry leaf paths on both axes. Totals carry the empty path
 * on the axis they ignore, and {@code -1} as that axis's index.
 *
 * @param rowPath          path of the row node
 * @param columnPath       path of the column node
 * @param measureId        id of the measure
 * @param value            computed value, {@code null} when undefined
 * @param sourceValueCount number of values that fed the computation
 * @param formattedValue   value rendered with the measure's format
 * @param row              row index in the matrix
 * @param column           column index, {@code columnIndex * measureCount + measureIndex}
 */
public record PivotCell(
        List<String> rowPath,
        List<String> columnPath,
        String measureId,
        Double value,
        int sourceValueCount,
        String formattedValue,
        int row,
        int column
) {
    public PivotCell {
        rowPath = List.copyOf(rowPath);
        columnPath = List.copyOf(columnPath);
    }
}

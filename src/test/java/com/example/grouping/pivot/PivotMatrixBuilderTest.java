package com.example.grouping.pivot;

import com.example.grouping.aggregation.AggregationType;
import com.example.grouping.aggregation.AggregationWarning;
import com.example.grouping.error.InvalidAggregationSpecException;
import com.example.grouping.error.InvalidConditionException;
import com.example.grouping.format.CurrencyFormatSpec;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupingFunction;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.model.TimePeriod;
import com.example.grouping.registry.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PivotMatrixBuilder over a small order set.
 *
 * <h2>Orders</h2>
 * <table border="1">
 *   <tr><th>region</th><th>date</th><th>amount</th><th>status</th></tr>
 *   <tr><td>North</td><td>2024-01-15</td><td>100</td><td>completed</td></tr>
 *   <tr><td>North</td><td>2024-02-10</td><td>200</td><td>completed</td></tr>
 *   <tr><td>South</td><td>2024-01-20</td><td>50</td><td>pending</td></tr>
 *   <tr><td>North</td><td>2024-04-02</td><td>300</td><td>completed</td></tr>
 *   <tr><td>South</td><td>2024-05-05</td><td>150</td><td>completed</td></tr>
 * </table>
 *
 * <h2>Expected revenue</h2>
 * <table border="1">
 *   <tr><th></th><th>2024-Q1</th><th>2024-Q2</th><th>Total</th></tr>
 *   <tr><td>North</td><td>300</td><td>300</td><td>600</td></tr>
 *   <tr><td>South</td><td>50</td><td>150</td><td>200</td></tr>
 *   <tr><td>Total</td><td>350</td><td>450</td><td>800</td></tr>
 * </table>
 */
class PivotMatrixBuilderTest {

    private static final List<DataRecord> ORDERS = List.of(
            DataRecord.of("region", "North", "date", "2024-01-15", "amount", 100, "status", "completed"),
            DataRecord.of("region", "North", "date", "2024-02-10", "amount", 200, "status", "completed"),
            DataRecord.of("region", "South", "date", "2024-01-20", "amount", 50, "status", "pending"),
            DataRecord.of("region", "North", "date", "2024-04-02", "amount", 300, "status", "completed"),
            DataRecord.of("region", "South", "date", "2024-05-05", "amount", 150, "status", "completed"));

    private static final List<GroupingLevel> BY_REGION = List.of(GroupingLevel.byField(1, "region"));
    private static final List<GroupingLevel> BY_QUARTER = List.of(
            GroupingLevel.of(1, GroupingFunction.timePeriod(TimePeriod.QUARTER), "date"));

    private static final PivotMeasure REVENUE = PivotMeasure.of("revenue", AggregationType.SUM, "amount")
            .withFormat(new CurrencyFormatSpec("USD", 2));
    private static final PivotMeasure ORDER_COUNT = PivotMeasure.of("orders", AggregationType.COUNT, null);

    private PivotMatrixBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PivotMatrixBuilder(FunctionRegistry.withBuiltins());
    }

    // =========================================================================
    // CELLS
    // =========================================================================

    @Test
    @DisplayName("Should aggregate each cell over the intersection of its row and column")
    void shouldAggregateCells() {
        // Given
        PivotConfig config = PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE, ORDER_COUNT));

        // When
        PivotTable table = builder.build(ORDERS, config);

        // Then
        assertThat(table.cells()).hasSize(8);
        PivotCell northQ1 = table.cell(List.of("North"), List.of("2024-Q1"), "revenue").orElseThrow();
        assertThat(northQ1.value()).isEqualTo(300.0);
        assertThat(northQ1.sourceValueCount()).isEqualTo(2);
        assertThat(northQ1.formattedValue()).isEqualTo("$300.00");
        assertThat(table.cell(List.of("South"), List.of("2024-Q1"), "revenue").orElseThrow().value())
                .isEqualTo(50.0);
        assertThat(table.cell(List.of("South"), List.of("2024-Q2"), "orders").orElseThrow().value())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should index cells by row leaf and by column leaf times measure")
    void shouldIndexCells() {
        PivotTable table = builder.build(ORDERS, PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE, ORDER_COUNT)));

        PivotCell northQ2Orders = table.cell(List.of("North"), List.of("2024-Q2"), "orders").orElseThrow();
        assertThat(northQ2Orders.row()).isZero();
        assertThat(northQ2Orders.column()).isEqualTo(3);
        assertThat(table.cells().get(0).rowPath()).containsExactly("North");
        assertThat(table.cells().get(0).columnPath()).containsExactly("2024-Q1");
    }

    @Test
    @DisplayName("Should report leaf counts and surviving records in the metadata")
    void shouldReportMetadata() {
        PivotTable table = builder.build(ORDERS, PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE, ORDER_COUNT)));

        assertThat(table.metadata()).isEqualTo(new PivotTable.Metadata(2, 2, 2, 5));
        assertThat(table.rowTree().children()).extracting(node -> node.key()).containsExactly("North", "South");
    }

    @Test
    @DisplayName("Should treat an axis without levels as a single total column")
    void shouldHandleEmptyColumnAxis() {
        PivotTable table = builder.build(ORDERS, PivotConfig.of(BY_REGION, List.of(), List.of(REVENUE)));

        assertThat(table.cells()).hasSize(2);
        assertThat(table.cell(List.of("North"), List.of(), "revenue").orElseThrow().value()).isEqualTo(600.0);
        assertThat(table.metadata().columnCount()).isEqualTo(1);
    }

    // =========================================================================
    // TOTALS
    // =========================================================================

    @Nested
    class Totals {

        @Test
        @DisplayName("Should compute row, column and grand totals")
        void shouldComputeTotals() {
            PivotTable table = builder.build(ORDERS, PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE)));

            assertThat(table.rowTotal(List.of("North"), "revenue").orElseThrow().value()).isEqualTo(600.0);
            assertThat(table.rowTotal(List.of("South"), "revenue").orElseThrow().value()).isEqualTo(200.0);
            assertThat(table.columnTotal(List.of("2024-Q1"), "revenue").orElseThrow().value()).isEqualTo(350.0);
            assertThat(table.columnTotal(List.of("2024-Q2"), "revenue").orElseThrow().value()).isEqualTo(450.0);
            assertThat(table.grandTotal("revenue").orElseThrow().formattedValue()).isEqualTo("$800.00");
        }

        @Test
        @DisplayName("Should include intermediate nodes in totals of a nested axis")
        void shouldTotalIntermediateNodes() {
            List<GroupingLevel> regionThenStatus = List.of(
                    GroupingLevel.byField(1, "region"), GroupingLevel.byField(2, "status"));

            PivotTable table = builder.build(ORDERS, PivotConfig.of(regionThenStatus, BY_QUARTER, List.of(REVENUE)));

            assertThat(table.rowTotal(List.of("South"), "revenue").orElseThrow().value()).isEqualTo(200.0);
            assertThat(table.rowTotal(List.of("South", "pending"), "revenue").orElseThrow().value()).isEqualTo(50.0);
            assertThat(table.metadata().rowCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should omit totals that are switched off")
        void shouldOmitDisabledTotals() {
            PivotConfig config = PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE)).withTotals(false, false);

            PivotTable table = builder.build(ORDERS, config);

            assertThat(table.rowTotals()).isEmpty();
            assertThat(table.columnTotals()).isEmpty();
            assertThat(table.grandTotals()).isEmpty();
            assertThat(table.cells()).hasSize(4);
        }
    }

    // =========================================================================
    // FILTERS
    // =========================================================================

    @Test
    @DisplayName("Should filter records before building either axis")
    void shouldFilterFirst() {
        // Given
        PivotConfig config = PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE, ORDER_COUNT))
                .withFilters(List.of(PivotFilter.select("status", "completed")));

        // When
        PivotTable table = builder.build(ORDERS, config);

        // Then
        assertThat(table.metadata().totalRecords()).isEqualTo(4);
        PivotCell southQ1 = table.cell(List.of("South"), List.of("2024-Q1"), "orders").orElseThrow();
        assertThat(southQ1.value()).isZero();
        assertThat(table.grandTotal("revenue").orElseThrow().value()).isEqualTo(750.0);
    }

    @Test
    @DisplayName("Should combine range and date range filters")
    void shouldCombineFilters() {
        PivotConfig config = PivotConfig.of(BY_REGION, List.of(), List.of(ORDER_COUNT))
                .withFilters(List.of(
                        PivotFilter.range("amount", 100.0, null),
                        PivotFilter.dateRange("date", "2024-02-01", "2024-12-31")));

        PivotTable table = builder.build(ORDERS, config);

        assertThat(table.metadata().totalRecords()).isEqualTo(3);
        assertThat(table.cell(List.of("North"), List.of(), "orders").orElseThrow().value()).isEqualTo(2.0);
    }

    // =========================================================================
    // VALIDATION AND WARNINGS
    // =========================================================================

    @Test
    @DisplayName("Should reject measures declaring the same id twice")
    void shouldRejectDuplicateMeasureIds() {
        PivotConfig config = PivotConfig.of(BY_REGION, BY_QUARTER,
                List.of(REVENUE, PivotMeasure.of("revenue", AggregationType.AVG, "amount")));

        assertThatThrownBy(() -> builder.build(ORDERS, config))
                .isInstanceOf(InvalidAggregationSpecException.class)
                .hasMessageContaining("revenue");
    }

    @Test
    @DisplayName("Should reject a reversed range filter before grouping")
    void shouldRejectReversedRange() {
        PivotConfig config = PivotConfig.of(BY_REGION, BY_QUARTER, List.of(REVENUE))
                .withFilters(List.of(PivotFilter.range("amount", 500.0, 100.0)));

        assertThatThrownBy(() -> builder.build(ORDERS, config))
                .isInstanceOf(InvalidConditionException.class);
    }

    @Test
    @DisplayName("Should report 0 and a warning per cell for an unregistered custom measure")
    void shouldWarnForUnregisteredCustomMeasure() {
        PivotMeasure p90 = new PivotMeasure("p90", "amount", null, AggregationType.CUSTOM, "p90", null, null);
        PivotConfig config = PivotConfig.of(BY_REGION, List.of(), List.of(p90)).withTotals(false, false);

        PivotTable table = builder.build(ORDERS, config);

        assertThat(table.cell(List.of("North"), List.of(), "p90").orElseThrow().value()).isZero();
        assertThat(table.warnings())
                .extracting(AggregationWarning::path)
                .containsExactly(List.of("North"), List.of("South"));
    }
}

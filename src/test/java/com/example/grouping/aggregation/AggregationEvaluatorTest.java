package com.example.grouping.aggregation;

import com.example.grouping.condition.ConditionSpec;
import com.example.grouping.error.InvalidAggregationSpecException;
import com.example.grouping.error.InvalidConditionException;
import com.example.grouping.format.CurrencyFormatSpec;
import com.example.grouping.hierarchy.HierarchyBuilder;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.registry.FunctionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for AggregationEvaluator.
 *
 * <h2>Scopes</h2>
 * <table border="1">
 *   <tr><th>Scope</th><th>Attaches to</th><th>Records</th></tr>
 *   <tr><td>EXACT_LEVEL</td><td>every node of the target level</td><td>the node's members</td></tr>
 *   <tr><td>INCLUDE_SUBGROUPS</td><td>every node of the target level</td><td>the node's members (its whole subtree)</td></tr>
 *   <tr><td>CROSS_ALL_GROUPS, level 0</td><td>the root</td><td>every record</td></tr>
 *   <tr><td>CROSS_ALL_GROUPS, level k</td><td>every level-k node</td><td>running union up to that node</td></tr>
 * </table>
 *
 * <h2>Numeric semantics</h2>
 * <ul>
 *   <li>Non-numeric and missing values are left out silently</li>
 *   <li>Avg of nothing is 0, Min/Max of nothing is undefined</li>
 *   <li>Unregistered custom aggregations yield 0 and a warning</li>
 * </ul>
 */
class AggregationEvaluatorTest {

    private final FunctionRegistry registry = FunctionRegistry.withBuiltins();
    private final HierarchyBuilder builder = new HierarchyBuilder(registry);
    private final AggregationEvaluator evaluator = new AggregationEvaluator(registry);

    private static final List<DataRecord> SALES = List.of(
            DataRecord.of("region", "North", "amt", 10),
            DataRecord.of("region", "North", "amt", 20),
            DataRecord.of("region", "South", "amt", 5)
    );

    private static final List<DataRecord> EMPLOYEES = List.of(
            DataRecord.of("department", "Sales", "position", "Manager", "salary", 9000, "status", "active"),
            DataRecord.of("department", "Sales", "position", "Rep", "salary", 5000, "status", "active"),
            DataRecord.of("department", "Sales", "position", "Rep", "salary", 4000, "status", "left"),
            DataRecord.of("department", "IT", "position", "Engineer", "salary", 12000, "status", "active"),
            DataRecord.of("department", "IT", "position", "Engineer", "salary", "n/a", "status", "active")
    );

    private AggregationResultMap evaluate(List<DataRecord> records, List<GroupingLevel> levels,
                                          AggregationSpec... specs) {
        GroupNode root = builder.build(records, levels);
        return evaluator.evaluate(records, root, List.of(specs));
    }

    private static List<GroupingLevel> byRegion() {
        return List.of(GroupingLevel.byField(1, "region"));
    }

    private static List<GroupingLevel> byDepartmentAndPosition() {
        return List.of(GroupingLevel.byField(1, "department"), GroupingLevel.byField(2, "position"));
    }

    // =========================================================================
    // SCENARIOS
    // =========================================================================

    @Test
    @DisplayName("Should sum per region at level 1")
    void shouldSumPerRegion() {
        // When
        AggregationResultMap results = evaluate(SALES, byRegion(), AggregationSpec.sum("amt", 1));

        // Then
        assertThat(results.value(List.of("North"), "sum(amt)")).isEqualTo(30.0);
        assertThat(results.value(List.of("South"), "sum(amt)")).isEqualTo(5.0);
        assertThat(results.paths()).containsExactly(List.of("North"), List.of("South"));
    }

    @Test
    @DisplayName("Should compute one cross-group count over every record")
    void shouldCountAcrossAllGroups() {
        // When
        AggregationResultMap results = evaluate(SALES, byRegion(),
                AggregationSpec.count(0).withScope(AggregationScope.CROSS_ALL_GROUPS));

        // Then
        assertThat(results.size()).isEqualTo(1);
        assertThat(results.value(List.of(), "count")).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should give the same grand total whatever the tree shape")
    void shouldIgnoreTreeShapeForGrandTotal() {
        AggregationSpec total = AggregationSpec.sum("salary", 0).withScope(AggregationScope.CROSS_ALL_GROUPS);

        AggregationResultMap flat = evaluate(EMPLOYEES, List.of(), total);
        AggregationResultMap deep = evaluate(EMPLOYEES, byDepartmentAndPosition(), total);

        assertThat(flat.value(List.of(), "sum(salary)")).isEqualTo(30000.0);
        assertThat(deep.value(List.of(), "sum(salary)")).isEqualTo(30000.0);
    }

    // =========================================================================
    // SCOPES
    // =========================================================================

    @Nested
    @DisplayName("Scope rules")
    class Scopes {

        @Test
        @DisplayName("Should attach exact-level results only to nodes of the target level")
        void shouldAttachOnlyAtTargetLevel() {
            AggregationResultMap results = evaluate(EMPLOYEES, byDepartmentAndPosition(),
                    AggregationSpec.count(2));

            assertThat(results.paths()).containsExactly(
                    List.of("Sales", "Manager"), List.of("Sales", "Rep"), List.of("IT", "Engineer"));
            assertThat(results.value(List.of("Sales", "Rep"), "count")).isEqualTo(2.0);
            assertThat(results.find(List.of("Sales"), "count")).isEmpty();
        }

        /**
         * Re-aggregating a subtree equals aggregating its flattened records.
         */
        @Test
        @DisplayName("Should see every descendant record when including subgroups")
        void shouldIncludeSubgroups() {
            // When
            AggregationResultMap results = evaluate(EMPLOYEES, byDepartmentAndPosition(),
                    AggregationSpec.sum("salary", 1).withScope(AggregationScope.INCLUDE_SUBGROUPS),
                    AggregationSpec.sum("salary", 2).withLabel("leaf"));

            // Then
            double children = results.value(List.of("Sales", "Manager"), "leaf")
                    + results.value(List.of("Sales", "Rep"), "leaf");
            assertThat(results.value(List.of("Sales"), "sum(salary)")).isEqualTo(children).isEqualTo(18000.0);
            assertThat(results.value(List.of("IT"), "sum(salary)")).isEqualTo(12000.0);
        }

        @Test
        @DisplayName("Should derive a subtree average from sums and counts, not from child averages")
        void shouldNotAverageAverages() {
            AggregationResultMap results = evaluate(EMPLOYEES, byDepartmentAndPosition(),
                    AggregationSpec.avg("salary", 1).withScope(AggregationScope.INCLUDE_SUBGROUPS),
                    AggregationSpec.avg("salary", 2));

            // Manager avg 9000, Rep avg 4500: averaging those would give 6750
            assertThat(results.value(List.of("Sales"), "avg(salary)")).isEqualTo(6000.0);
        }

        @Test
        @DisplayName("Should attach running totals to every node of the target level")
        void shouldAccumulateAcrossGroupsOfLevel() {
            AggregationResultMap results = evaluate(EMPLOYEES, byDepartmentAndPosition(),
                    AggregationSpec.count(2).withScope(AggregationScope.CROSS_ALL_GROUPS).withLabel("running"));

            assertThat(results.value(List.of("Sales", "Manager"), "running")).isEqualTo(1.0);
            assertThat(results.value(List.of("Sales", "Rep"), "running")).isEqualTo(3.0);
            assertThat(results.value(List.of("IT", "Engineer"), "running")).isEqualTo(5.0);
            assertThat(results.find(List.of(), "running")).isEmpty();
        }

        @Test
        @DisplayName("Should attach target level 0 exact results to the root")
        void shouldAttachLevelZeroToRoot() {
            AggregationResultMap results = evaluate(SALES, byRegion(), AggregationSpec.max("amt", 0));

            assertThat(results.value(List.of(), "max(amt)")).isEqualTo(20.0);
        }
    }

    // =========================================================================
    // NUMERIC SEMANTICS
    // =========================================================================

    @Test
    @DisplayName("Should silently leave out values that are not numbers")
    void shouldExcludeNonNumericValues() {
        AggregationResultMap results = evaluate(EMPLOYEES, List.of(GroupingLevel.byField(1, "department")),
                AggregationSpec.avg("salary", 1),
                AggregationSpec.min("salary", 1),
                AggregationSpec.count(1));

        assertThat(results.value(List.of("IT"), "avg(salary)")).isEqualTo(12000.0);
        assertThat(results.value(List.of("IT"), "min(salary)")).isEqualTo(12000.0);
        assertThat(results.value(List.of("IT"), "count")).isEqualTo(2.0);
        assertThat(results.find(List.of("IT"), "avg(salary)").orElseThrow().recordCount()).isEqualTo(2);
        assertThat(results.warnings()).isEmpty();
    }

    /**
     * With no records the root is the only node: sums and counts are 0, the
     * average is 0 and the minimum is undefined.
     */
    @Test
    @DisplayName("Should return zeros for an empty record set")
    void shouldHandleEmptyRecordSet() {
        AggregationResultMap results = evaluate(List.of(), byRegion(),
                AggregationSpec.sum("amt", 0),
                AggregationSpec.count(0),
                AggregationSpec.avg("amt", 0),
                AggregationSpec.min("amt", 0),
                AggregationSpec.sum("amt", 1));

        assertThat(results.value(List.of(), "sum(amt)")).isEqualTo(0.0);
        assertThat(results.value(List.of(), "count")).isEqualTo(0.0);
        assertThat(results.value(List.of(), "avg(amt)")).isEqualTo(0.0);
        assertThat(results.find(List.of(), "min(amt)").orElseThrow().isEmpty()).isTrue();
        assertThat(results.find(List.of(), "min(amt)").orElseThrow().formatted()).isEmpty();
        assertThat(results.paths()).containsExactly(List.of());
    }

    @Test
    @DisplayName("Should count only records matching the condition")
    void shouldApplyCondition() {
        AggregationResultMap results = evaluate(EMPLOYEES, List.of(GroupingLevel.byField(1, "department")),
                AggregationSpec.count(1).withLabel("active").withCondition(ConditionSpec.eq("status", "active")),
                AggregationSpec.sum("salary", 1).withCondition(record -> "Rep".equals(record.get("position"))));

        assertThat(results.value(List.of("Sales"), "active")).isEqualTo(2.0);
        assertThat(results.value(List.of("IT"), "active")).isEqualTo(2.0);
        assertThat(results.value(List.of("Sales"), "sum(salary)")).isEqualTo(9000.0);
        assertThat(results.value(List.of("IT"), "sum(salary)")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should count distinct non-missing values")
    void shouldCountDistinct() {
        AggregationResultMap results = evaluate(EMPLOYEES, List.of(GroupingLevel.byField(1, "department")),
                AggregationSpec.countDistinct("position", 1));

        assertThat(results.value(List.of("Sales"), "count_distinct(position)")).isEqualTo(2.0);
        assertThat(results.value(List.of("IT"), "count_distinct(position)")).isEqualTo(1.0);
    }

    // =========================================================================
    // LABELS AND PRESENTATION
    // =========================================================================

    @Test
    @DisplayName("Should keep the later spec when two specs share a label on a node")
    void shouldLetLaterSpecWin() {
        AggregationResultMap results = evaluate(SALES, byRegion(),
                AggregationSpec.sum("amt", 1).withLabel("total"),
                AggregationSpec.max("amt", 1).withLabel("total"));

        assertThat(results.value(List.of("North"), "total")).isEqualTo(20.0);
        assertThat(results.resultsAt(List.of("North"))).hasSize(1);
    }

    @Test
    @DisplayName("Should copy position and format from the spec")
    void shouldCopyPresentation() {
        AggregationResultMap results = evaluate(SALES, byRegion(),
                AggregationSpec.sum("amt", 1)
                        .withPosition(DisplayPosition.FOOTER)
                        .withFormat(new CurrencyFormatSpec("USD", 2)));

        AggregationResult north = results.find(List.of("North"), "sum(amt)").orElseThrow();
        assertThat(north.position()).isEqualTo(DisplayPosition.FOOTER);
        assertThat(north.formatted()).isEqualTo("$30.00");
    }

    @Test
    @DisplayName("Should produce identical results on repeated runs")
    void shouldBeIdempotent() {
        AggregationSpec[] specs = {
                AggregationSpec.sum("salary", 1),
                AggregationSpec.count(2).withScope(AggregationScope.CROSS_ALL_GROUPS)
        };

        assertThat(evaluate(EMPLOYEES, byDepartmentAndPosition(), specs))
                .isEqualTo(evaluate(EMPLOYEES, byDepartmentAndPosition(), specs));
    }

    // =========================================================================
    // CUSTOM AGGREGATIONS
    // =========================================================================

    @Test
    @DisplayName("Should delegate to a registered custom aggregation")
    void shouldUseRegisteredCustomAggregation() {
        registry.registerAggregationFunction("p100", values -> values.stream().mapToDouble(v -> v).max().orElse(0));

        AggregationResultMap results = evaluate(EMPLOYEES, List.of(GroupingLevel.byField(1, "department")),
                AggregationSpec.custom("median", "salary", 1),
                AggregationSpec.custom("p100", "salary", 1));

        assertThat(results.value(List.of("Sales"), "median(salary)")).isEqualTo(5000.0);
        assertThat(results.value(List.of("Sales"), "p100(salary)")).isEqualTo(9000.0);
    }

    @Test
    @DisplayName("Should report an unregistered custom aggregation and substitute 0")
    void shouldRecoverFromUnregisteredCustomAggregation() {
        // When
        AggregationResultMap results = evaluate(SALES, byRegion(),
                AggregationSpec.custom("geometricMean", "amt", 1),
                AggregationSpec.sum("amt", 1));

        // Then
        assertThat(results.value(List.of("North"), "geometricMean(amt)")).isEqualTo(0.0);
        assertThat(results.value(List.of("North"), "sum(amt)")).isEqualTo(30.0);
        assertThat(results.warnings()).hasSize(2);
        assertThat(results.warnings().get(0).code())
                .isEqualTo(AggregationWarning.Code.UNREGISTERED_CUSTOM_AGGREGATION);
        assertThat(results.warnings().get(0).path()).containsExactly("North");
    }

    @Test
    @DisplayName("Should report a failing custom aggregation and substitute 0")
    void shouldRecoverFromFailingCustomAggregation() {
        registry.registerAggregationFunction("broken", values -> {
            throw new IllegalStateException("boom");
        });

        AggregationResultMap results = evaluate(SALES, List.of(), AggregationSpec.custom("broken", "amt", 0));

        assertThat(results.value(List.of(), "broken(amt)")).isEqualTo(0.0);
        assertThat(results.warnings()).singleElement()
                .satisfies(warning -> {
                    assertThat(warning.code()).isEqualTo(AggregationWarning.Code.CUSTOM_AGGREGATION_FAILED);
                    assertThat(warning.message()).contains("boom");
                });
    }

    // =========================================================================
    // VALIDATION
    // =========================================================================

    @Test
    @DisplayName("Should reject specs without a source field")
    void shouldRejectMissingSourceField() {
        assertThatThrownBy(() -> evaluate(SALES, byRegion(),
                new AggregationSpec(AggregationType.SUM, null, null, 1, null, null, null, null, null)))
                .isInstanceOf(InvalidAggregationSpecException.class)
                .hasMessageContaining("source field");
    }

    @Test
    @DisplayName("Should reject a malformed condition before reading any record")
    void shouldRejectMalformedConditionUpFront() {
        // Given a condition that would fail loudly if it were ever tested
        ConditionSpec malformed = new ConditionSpec("amt", "between", List.of(1, 2), null);

        // Then
        assertThatThrownBy(() -> evaluate(SALES, byRegion(), AggregationSpec.count(1).withCondition(malformed)))
                .isInstanceOf(InvalidConditionException.class)
                .hasMessageContaining("between");
    }

    @Test
    @DisplayName("Should give averages within floating point tolerance")
    void shouldAverageFractions() {
        List<DataRecord> records = List.of(DataRecord.of("v", 0.1), DataRecord.of("v", 0.2), DataRecord.of("v", "0.3"));

        AggregationResultMap results = evaluate(records, List.of(), AggregationSpec.avg("v", 0));

        assertThat(results.value(List.of(), "avg(v)")).isCloseTo(0.2, within(1e-9));
    }
}

package com.example.grouping;

import com.example.grouping.aggregation.AggregationEvaluator;
import com.example.grouping.aggregation.AggregationResultMap;
import com.example.grouping.aggregation.AggregationSpec;
import com.example.grouping.hierarchy.HierarchyBuilder;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.pivot.PivotConfig;
import com.example.grouping.pivot.PivotMatrixBuilder;
import com.example.grouping.pivot.PivotTable;
import com.example.grouping.registry.FunctionRegistry;
import com.example.grouping.resolver.GroupingConfig;
import com.example.grouping.resolver.GroupingDeclaration;
import com.example.grouping.resolver.GroupingPlan;
import com.example.grouping.resolver.GroupingSpecResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Synchronous entry point: resolve, validate, build the tree, aggregate.
 *
 * <p>Every configuration error is raised before the first record is read.
 * Runs share no mutable state, so one engine can serve concurrent callers.
 *
 * <pre>{@code
 * GroupingEngine engine = new GroupingEngine();
 * GroupingResult result = engine.process(records,
 *     List.of(GroupingDeclaration.of("region", 1)),
 *     List.of(AggregationSpec.sum("amount", 1)));
 * result.aggregations().value(List.of("North"), "sum(amount)"); // 30.0
 * }</pre>
 */
public class GroupingEngine {

    private static final Logger logger = LoggerFactory.getLogger(GroupingEngine.class);

    private final GroupingSpecResolver resolver;
    private final HierarchyBuilder hierarchyBuilder;
    private final AggregationEvaluator evaluator;
    private final PivotMatrixBuilder pivotBuilder;

    public GroupingEngine() {
        this(FunctionRegistry.global());
    }

    public GroupingEngine(FunctionRegistry registry) {
        this.resolver = new GroupingSpecResolver(registry);
        this.hierarchyBuilder = new HierarchyBuilder(registry);
        this.evaluator = new AggregationEvaluator(registry);
        this.pivotBuilder = new PivotMatrixBuilder(registry);
    }

    public GroupingResult process(List<DataRecord> records, GroupingConfig config) {
        return process(records, resolver.resolvePlan(config));
    }

    public GroupingResult process(List<DataRecord> records, Collection<GroupingDeclaration> declarations,
                                  List<AggregationSpec> specs) {
        return process(records, new GroupingPlan(resolver.resolve(declarations), specs));
    }

    public GroupingResult process(List<DataRecord> records, GroupingPlan plan) {
        List<GroupingLevel> levels = resolver.resolveLevels(plan.levels());
        evaluator.validate(plan.specs());

        GroupNode root = hierarchyBuilder.build(records, levels);
        AggregationResultMap aggregations = evaluator.evaluate(records, root, plan.specs());
        logger.debug("Processed {} records: {} top-level groups, {} aggregation results",
                records.size(), root.children().size(), aggregations.size());
        return new GroupingResult(root, levels, aggregations, records.size());
    }

    public PivotTable pivot(List<DataRecord> records, PivotConfig config) {
        return pivotBuilder.build(records, config);
    }
}

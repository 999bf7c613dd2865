package com.example.grouping.aggregation;

import com.example.grouping.condition.RecordCondition;
import com.example.grouping.error.InvalidAggregationSpecException;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.IndexSet;
import com.example.grouping.model.Values;
import com.example.grouping.registry.CustomAggregationFunction;
import com.example.grouping.registry.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Computes aggregation specs over a group tree.
 *
 * <p>Nodes are visited in pre-order and, per node, specs in declaration
 * order. Whether a spec attaches to a node is a direct comparison of the
 * node's level with the spec's target level:
 * <ul>
 *   <li>{@link AggregationScope#EXACT_LEVEL} and {@link AggregationScope#INCLUDE_SUBGROUPS}
 *       compute at every node of the target level over that node's members,
 *       which already include every descendant record.</li>
 *   <li>{@link AggregationScope#CROSS_ALL_GROUPS} with target level {@code 0}
 *       computes one value over the whole record set, attached to the root.</li>
 *   <li>{@link AggregationScope#CROSS_ALL_GROUPS} with target level {@code k > 0}
 *       attaches a running value to every level-k node: the aggregate over the
 *       members of that node and every level-k node visited before it.</li>
 * </ul>
 *
 * <p>Specs resolving to the same label on the same node overwrite each other,
 * later declaration wins. Values that cannot be read as numbers are left out
 * of numeric aggregates without notice. An unregistered or failing custom
 * aggregation yields {@code 0} and an {@link AggregationWarning}.
 */
public class AggregationEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(AggregationEvaluator.class);

    private static final Aggregator<DataRecord, long[], Long> RECORD_COUNT = Aggregator.of(
            () -> new long[1],
            (acc, record) -> acc[0]++,
            acc -> acc[0]
    );

    private final FunctionRegistry registry;

    public AggregationEvaluator() {
        this(FunctionRegistry.global());
    }

    public AggregationEvaluator(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Result of one spec over one record subset.
     *
     * @param value       computed value, {@code null} when undefined
     * @param recordCount records left after the condition was applied
     * @param valueCount  values that fed the computation
     */
    public record Measurement(Double value, int recordCount, int valueCount) {
    }

    /**
     * Checks every spec before any record is touched.
     *
     * @throws InvalidAggregationSpecException if a spec is incomplete
     * @throws com.example.grouping.error.InvalidConditionException if a condition is malformed
     */
    public void validate(Collection<AggregationSpec> specs) {
        for (AggregationSpec spec : specs) {
            if (spec == null) {
                throw new InvalidAggregationSpecException("Aggregation spec must not be null");
            }
            if (spec.type() == null) {
                throw new InvalidAggregationSpecException("Aggregation '" + spec.displayLabel() + "' has no type");
            }
            if (spec.type().requiresSourceField() && (spec.sourceField() == null || spec.sourceField().isBlank())) {
                throw new InvalidAggregationSpecException(
                        "Aggregation '" + spec.displayLabel() + "' of type " + spec.type() + " needs a source field");
            }
            if (spec.type() == AggregationType.CUSTOM && (spec.customId() == null || spec.customId().isBlank())) {
                throw new InvalidAggregationSpecException(
                        "Custom aggregation '" + spec.displayLabel() + "' has no function id");
            }
            if (spec.targetLevel() == null || spec.targetLevel() < 0) {
                throw new InvalidAggregationSpecException(
                        "Aggregation '" + spec.displayLabel() + "' needs a target level of 0 or more, got "
                                + spec.targetLevel());
            }
            if (spec.condition() != null) {
                spec.condition().validate();
            }
        }
    }

    /**
     * Validates the specs, then computes them over the tree built from {@code records}.
     *
     * @param records the record store the tree indexes into
     * @param root    root of the group tree
     * @param specs   specs in declaration order
     * @return results keyed by node path and label, with any warnings
     */
    public AggregationResultMap evaluate(List<DataRecord> records, GroupNode root, List<AggregationSpec> specs) {
        validate(specs);

        AggregationResultMap.Builder results = AggregationResultMap.builder();
        IndexSet everything = IndexSet.range(records.size());
        IndexSet[] running = new IndexSet[specs.size()];

        for (GroupNode node : root.preOrder()) {
            for (int i = 0; i < specs.size(); i++) {
                AggregationSpec spec = specs.get(i);
                int target = spec.targetLevel();
                IndexSet subset;
                if (spec.scope() == AggregationScope.CROSS_ALL_GROUPS) {
                    if (target == 0) {
                        if (!node.isRoot()) {
                            continue;
                        }
                        subset = everything;
                    } else {
                        if (node.isRoot() || node.level() != target) {
                            continue;
                        }
                        running[i] = running[i] == null ? node.members() : running[i].union(node.members());
                        subset = running[i];
                    }
                } else {
                    if (node.level() != target) {
                        continue;
                    }
                    subset = node.members();
                }

                Measurement measurement = measure(records, subset, spec, node.path(), results::warn);
                AggregationResult result = new AggregationResult(node.path(), spec.displayLabel(),
                        measurement.value(), measurement.recordCount(), spec.position(), spec.format(), spec);
                results.put(result).ifPresent(replaced ->
                        logger.debug("'{}' at {} declared more than once; keeping the later declaration",
                                replaced.label(), node.path()));
            }
        }

        AggregationResultMap map = results.build();
        logger.debug("Computed {} aggregation results for {} specs over {} records ({} warnings)",
                map.size(), specs.size(), records.size(), map.warnings().size());
        return map;
    }

    /**
     * Computes one spec over a subset of the record store.
     *
     * <p>The spec is assumed valid. Scope and target level are ignored: the
     * caller decides which records the value covers.
     *
     * @param records  the record store
     * @param subset   indices of the records to aggregate
     * @param spec     what to compute
     * @param path     node path the value is for, used in warnings
     * @param warnings receives recoverable problems
     */
    public Measurement measure(List<DataRecord> records, IndexSet subset, AggregationSpec spec,
                               List<String> path, Consumer<AggregationWarning> warnings) {
        List<DataRecord> working = select(records, subset, spec.condition());

        return switch (spec.type()) {
            case COUNT -> {
                long count = RECORD_COUNT.aggregate(working);
                yield new Measurement((double) count, working.size(), working.size());
            }
            case SUM, AVG, MIN, MAX -> {
                List<Double> values = numericValues(working, spec.sourceField());
                NumericStats stats = NumericStatsAggregator.toNumericStats().aggregate(values);
                Double value = switch (spec.type()) {
                    case SUM -> stats.sum();
                    case AVG -> stats.average();
                    case MIN -> stats.minOrNull();
                    default -> stats.maxOrNull();
                };
                yield new Measurement(value, working.size(), values.size());
            }
            case COUNT_DISTINCT -> {
                Set<String> distinct = new HashSet<>();
                int present = 0;
                for (DataRecord record : working) {
                    Object value = record.get(spec.sourceField());
                    if (!Values.isMissing(value)) {
                        distinct.add(Values.display(value));
                        present++;
                    }
                }
                yield new Measurement((double) distinct.size(), working.size(), present);
            }
            case CUSTOM -> {
                List<Double> values = numericValues(working, spec.sourceField());
                yield new Measurement(custom(spec, values, path, warnings), working.size(), values.size());
            }
        };
    }

    private double custom(AggregationSpec spec, List<Double> values, List<String> path,
                          Consumer<AggregationWarning> warnings) {
        Optional<CustomAggregationFunction> function = registry.aggregationFunction(spec.customId());
        if (function.isEmpty()) {
            logger.warn("Custom aggregation '{}' is not registered; '{}' at {} reported as 0",
                    spec.customId(), spec.displayLabel(), path);
            warnings.accept(new AggregationWarning(AggregationWarning.Code.UNREGISTERED_CUSTOM_AGGREGATION,
                    path, spec.displayLabel(), "Custom aggregation '" + spec.customId() + "' is not registered"));
            return 0.0;
        }
        try {
            return function.get().apply(List.copyOf(values));
        } catch (RuntimeException e) {
            logger.warn("Custom aggregation '{}' failed for '{}' at {}; reported as 0",
                    spec.customId(), spec.displayLabel(), path, e);
            warnings.accept(new AggregationWarning(AggregationWarning.Code.CUSTOM_AGGREGATION_FAILED,
                    path, spec.displayLabel(), "Custom aggregation '" + spec.customId() + "' failed: " + e.getMessage()));
            return 0.0;
        }
    }

    private static List<DataRecord> select(List<DataRecord> records, IndexSet subset, RecordCondition condition) {
        List<DataRecord> selected = new ArrayList<>(subset.size());
        for (int index : subset.toArray()) {
            DataRecord record = records.get(index);
            if (condition == null || condition.test(record)) {
                selected.add(record);
            }
        }
        return selected;
    }

    private static List<Double> numericValues(List<DataRecord> records, String field) {
        List<Double> values = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            OptionalDouble value = Values.toDouble(record.get(field));
            if (value.isPresent()) {
                values.add(value.getAsDouble());
            }
        }
        return values;
    }
}

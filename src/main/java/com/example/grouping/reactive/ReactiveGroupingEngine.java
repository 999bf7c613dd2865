package com.example.grouping.reactive;

import com.example.grouping.GroupingResult;
import com.example.grouping.aggregation.AggregationEvaluator;
import com.example.grouping.hierarchy.GroupBucket;
import com.example.grouping.hierarchy.HierarchyBuilder;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.model.IndexSet;
import com.example.grouping.registry.FunctionRegistry;
import com.example.grouping.resolver.GroupingPlan;
import com.example.grouping.resolver.GroupingSpecResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reactive facade that builds independent top-level groups in parallel.
 *
 * <p>Each level-1 subtree is built on the given scheduler. {@link Flux#flatMapSequential}
 * keeps the sibling order of the synchronous builder, so both produce equal
 * trees for the same input. Aggregation runs once over the assembled tree.
 *
 * <p>Example usage:
 * <pre>{@code
 * ReactiveGroupingEngine engine = new ReactiveGroupingEngine();
 *
 * engine.process(records, plan)
 *     .subscribe(result -> render(result.root()));
 *
 * // at most one computation per key, later subscribers share the result
 * GroupingResult result = engine.processCached("sales-2024", records, plan).block();
 * }</pre>
 */
public class ReactiveGroupingEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReactiveGroupingEngine.class);

    private final GroupingSpecResolver resolver;
    private final HierarchyBuilder hierarchyBuilder;
    private final AggregationEvaluator evaluator;
    private final Scheduler scheduler;
    private final ConcurrentMap<String, Mono<GroupingResult>> cache = new ConcurrentHashMap<>();

    public ReactiveGroupingEngine() {
        this(FunctionRegistry.global(), Schedulers.parallel());
    }

    /**
     * @param registry  functions available to custom levels and aggregations
     * @param scheduler scheduler the level-1 subtrees are built on
     */
    public ReactiveGroupingEngine(FunctionRegistry registry, Scheduler scheduler) {
        this.resolver = new GroupingSpecResolver(registry);
        this.hierarchyBuilder = new HierarchyBuilder(registry);
        this.evaluator = new AggregationEvaluator(registry);
        this.scheduler = scheduler;
    }

    /**
     * Validates the plan, builds the tree and aggregates.
     * Configuration errors are signalled as {@code onError} before any record is read.
     */
    public Mono<GroupingResult> process(List<DataRecord> records, GroupingPlan plan) {
        return Mono.fromCallable(() -> {
                    List<GroupingLevel> levels = resolver.resolveLevels(plan.levels());
                    evaluator.validate(plan.specs());
                    return levels;
                })
                .flatMap(levels -> buildTree(records, levels)
                        .map(root -> new GroupingResult(root, levels,
                                evaluator.evaluate(records, root, plan.specs()), records.size())));
    }

    /**
     * Builds the group tree, one level-1 subtree per task.
     *
     * @param levels resolved levels in ascending order
     */
    public Mono<GroupNode> buildTree(List<DataRecord> records, List<GroupingLevel> levels) {
        IndexSet all = IndexSet.range(records.size());
        if (levels.isEmpty()) {
            return Mono.fromCallable(() -> GroupNode.root(List.of(), all));
        }
        return Flux.defer(() -> Flux.fromIterable(hierarchyBuilder.partition(records, all, levels.get(0))))
                .flatMapSequential(bucket -> buildSubtree(records, bucket, levels))
                .collectList()
                .map(children -> GroupNode.root(children, all));
    }

    /**
     * Returns the result cached under {@code key}, computing it on first use.
     *
     * <p>Concurrent callers with the same key share a single computation. A
     * failed computation is evicted so that the next call retries. The key
     * must identify both the records and the plan.
     */
    public Mono<GroupingResult> processCached(String key, List<DataRecord> records, GroupingPlan plan) {
        return cache.computeIfAbsent(key, k -> {
            logger.debug("No cached grouping result for '{}'; computing", k);
            AtomicReference<Mono<GroupingResult>> self = new AtomicReference<>();
            Mono<GroupingResult> cached = process(records, plan)
                    .doOnError(e -> cache.remove(k, self.get()))
                    .cache();
            self.set(cached);
            return cached;
        });
    }

    public void evict(String key) {
        cache.remove(key);
    }

    public void clearCache() {
        cache.clear();
    }

    private Mono<GroupNode> buildSubtree(List<DataRecord> records, GroupBucket bucket, List<GroupingLevel> levels) {
        return Mono.fromCallable(() -> hierarchyBuilder.buildSubtree(records, List.of(), bucket, levels, 0))
                .subscribeOn(scheduler);
    }
}

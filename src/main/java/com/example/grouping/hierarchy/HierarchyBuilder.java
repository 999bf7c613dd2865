package com.example.grouping.hierarchy;

import com.example.grouping.error.UnknownGroupFunctionException;
import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupKeys;
import com.example.grouping.model.GroupNode;
import com.example.grouping.model.GroupingLevel;
import com.example.grouping.model.GroupingMethod;
import com.example.grouping.model.IndexSet;
import com.example.grouping.model.LevelSorting;
import com.example.grouping.registry.CustomGroupFunction;
import com.example.grouping.registry.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a group tree top-down, one grouping level at a time.
 *
 * <p>The root owns every record index. Each level partitions the members of
 * every current leaf by the level's composite key; children keep the order in
 * which their keys were first seen unless the level declares a sorting.
 * Grouping never fails on data: missing, non-numeric and unparseable values
 * land in sentinel buckets.
 *
 * <pre>{@code
 * GroupNode root = new HierarchyBuilder().build(records, List.of(
 *     GroupingLevel.byField(1, "region"),
 *     GroupingLevel.of(2, GroupingFunction.timePeriod(TimePeriod.QUARTER), "date")));
 * }</pre>
 */
public class HierarchyBuilder {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final FunctionRegistry registry;

    public HierarchyBuilder() {
        this(FunctionRegistry.global());
    }

    public HierarchyBuilder(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Builds the tree over all records.
     *
     * @param records the record store
     * @param levels  resolved levels in ascending order
     * @return the synthetic root
     */
    public GroupNode build(List<DataRecord> records, List<GroupingLevel> levels) {
        IndexSet all = IndexSet.range(records.size());
        GroupNode root = GroupNode.root(buildChildren(records, List.of(), all, levels, 0), all);
        if (logger.isDebugEnabled()) {
            logger.debug("Built group tree over {} records: {} levels, {} nodes",
                    records.size(), levels.size(), root.preOrder().size() - 1);
        }
        return root;
    }

    /**
     * Builds the subtree below one bucket of the level at {@code levelPosition}.
     *
     * <p>Subtrees of sibling buckets share no state and may be built concurrently.
     */
    public GroupNode buildSubtree(List<DataRecord> records, List<String> parentPath, GroupBucket bucket,
                                  List<GroupingLevel> levels, int levelPosition) {
        List<String> path = new ArrayList<>(parentPath.size() + 1);
        path.addAll(parentPath);
        path.add(bucket.key());
        List<GroupNode> children = buildChildren(records, path, bucket.members(), levels, levelPosition + 1);
        return new GroupNode(bucket.key(), path, levels.get(levelPosition).level(), levelPosition + 1,
                children, bucket.members());
    }

    /**
     * Partitions a set of members by one level's grouping function.
     *
     * @return non-empty buckets in first-seen order, or in the level's declared order
     */
    public List<GroupBucket> partition(List<DataRecord> records, IndexSet members, GroupingLevel level) {
        List<GroupBucket> buckets = level.method() == GroupingMethod.CUSTOM
                ? partitionCustom(records, members, level)
                : partitionByKey(records, members, level);
        return sort(buckets, level.sorting());
    }

    private List<GroupNode> buildChildren(List<DataRecord> records, List<String> path, IndexSet members,
                                          List<GroupingLevel> levels, int levelPosition) {
        if (levelPosition >= levels.size()) {
            return List.of();
        }
        List<GroupBucket> buckets = partition(records, members, levels.get(levelPosition));
        List<GroupNode> children = new ArrayList<>(buckets.size());
        for (GroupBucket bucket : buckets) {
            children.add(buildSubtree(records, path, bucket, levels, levelPosition));
        }
        return children;
    }

    private static List<GroupBucket> partitionByKey(List<DataRecord> records, IndexSet members, GroupingLevel level) {
        Map<String, IndexSet.Builder> groups = new LinkedHashMap<>();
        for (int index : members.toArray()) {
            String key = GroupKeyFunctions.key(records.get(index), level);
            groups.computeIfAbsent(key, k -> IndexSet.builder()).add(index);
        }
        List<GroupBucket> buckets = new ArrayList<>(groups.size());
        groups.forEach((key, builder) -> buckets.add(new GroupBucket(key, builder.build())));
        return buckets;
    }

    private List<GroupBucket> partitionCustom(List<DataRecord> records, IndexSet members, GroupingLevel level) {
        String id = level.function().customId();
        CustomGroupFunction function = registry.groupFunction(id)
                .orElseThrow(() -> new UnknownGroupFunctionException(id));

        List<DataRecord> subset = new ArrayList<>(members.size());
        // a record instance may occur more than once in the store
        Map<DataRecord, Deque<Integer>> positions = new IdentityHashMap<>();
        for (int index : members.toArray()) {
            DataRecord record = records.get(index);
            subset.add(record);
            positions.computeIfAbsent(record, r -> new ArrayDeque<>()).add(index);
        }

        Map<String, List<DataRecord>> grouped;
        try {
            grouped = function.group(List.copyOf(subset), level.fields(), level.function().params());
        } catch (RuntimeException e) {
            logger.warn("Custom group function '{}' failed on level {}; placing all {} records under '{}'",
                    id, level.level(), members.size(), GroupKeys.OTHER, e);
            grouped = null;
        }
        if (grouped == null) {
            grouped = Map.of();
        }

        Map<String, List<Integer>> assigned = new LinkedHashMap<>();
        int assignedCount = 0;
        for (Map.Entry<String, List<DataRecord>> group : grouped.entrySet()) {
            if (group.getValue() == null) {
                continue;
            }
            String key = group.getKey() != null ? group.getKey() : GroupKeys.MISSING;
            for (DataRecord record : group.getValue()) {
                Deque<Integer> free = positions.get(record);
                if (free == null || free.isEmpty()) {
                    continue;
                }
                assigned.computeIfAbsent(key, k -> new ArrayList<>()).add(free.poll());
                assignedCount++;
            }
        }

        if (assignedCount < members.size()) {
            List<Integer> other = assigned.computeIfAbsent(GroupKeys.OTHER, k -> new ArrayList<>());
            positions.values().forEach(other::addAll);
            logger.warn("Custom group function '{}' left {} of {} records unassigned on level {}; placed under '{}'",
                    id, members.size() - assignedCount, members.size(), level.level(), GroupKeys.OTHER);
        }

        List<GroupBucket> buckets = new ArrayList<>(assigned.size());
        assigned.forEach((key, indices) ->
                buckets.add(new GroupBucket(key, IndexSet.of(indices.stream().mapToInt(Integer::intValue).toArray()))));
        return buckets;
    }

    static List<GroupBucket> sort(List<GroupBucket> buckets, LevelSorting sorting) {
        if (sorting.isNone()) {
            return buckets;
        }
        List<GroupBucket> sorted = new ArrayList<>(buckets);
        if (!sorting.customOrder().isEmpty()) {
            List<String> order = sorting.customOrder();
            // unlisted keys rank after listed ones; the sort is stable
            sorted.sort(Comparator.comparingInt(bucket -> {
                int rank = order.indexOf(bucket.key());
                return rank >= 0 ? rank : order.size();
            }));
            return sorted;
        }
        Comparator<GroupBucket> byKey = Comparator.comparing(GroupBucket::key);
        sorted.sort(sorting.direction() == LevelSorting.Direction.DESC ? byKey.reversed() : byKey);
        return sorted;
    }
}

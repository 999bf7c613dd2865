package com.example.grouping.registry;

import com.example.grouping.model.DataRecord;
import com.example.grouping.model.GroupKeys;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Custom functions available in every registry created by {@link FunctionRegistry#withBuiltins()}.
 *
 * <h2>Group functions</h2>
 * <ul>
 *   <li>{@code categoryMapping}: maps the first field's value through the
 *       {@code mapping} parameter, keeping unmapped values as they are.</li>
 *   <li>{@code valueGroups}: assigns the first field's value to the first entry of
 *       {@code groups: [{label, values: [...]}]} listing it, {@code Other} otherwise.</li>
 * </ul>
 *
 * <h2>Aggregation functions</h2>
 * <ul>
 *   <li>{@code median}: middle value, mean of the two middle values for even counts.</li>
 *   <li>{@code range}: maximum minus minimum.</li>
 * </ul>
 * Both aggregations return {@code 0} for an empty input.
 */
public final class BuiltinFunctions {

    public static final String CATEGORY_MAPPING = "categoryMapping";
    public static final String VALUE_GROUPS = "valueGroups";
    public static final String MEDIAN = "median";
    public static final String RANGE = "range";

    private BuiltinFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.registerGroupFunction(CATEGORY_MAPPING, BuiltinFunctions::categoryMapping)
                .registerGroupFunction(VALUE_GROUPS, BuiltinFunctions::valueGroups)
                .registerAggregationFunction(MEDIAN, BuiltinFunctions::median)
                .registerAggregationFunction(RANGE, BuiltinFunctions::range);
    }

    static Map<String, List<DataRecord>> categoryMapping(
            List<DataRecord> records, List<String> fields, Map<String, Object> params) {
        String field = groupingField(fields, params);
        Map<?, ?> mapping = params.get("mapping") instanceof Map<?, ?> m ? m : Map.of();
        Map<String, List<DataRecord>> groups = new LinkedHashMap<>();
        for (DataRecord record : records) {
            String value = GroupKeys.part(record.get(field));
            Object mapped = mapping.get(value);
            String key = mapped != null ? GroupKeys.part(mapped) : value;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    static Map<String, List<DataRecord>> valueGroups(
            List<DataRecord> records, List<String> fields, Map<String, Object> params) {
        String field = groupingField(fields, params);
        List<?> declared = params.get("groups") instanceof List<?> l ? l : List.of();
        Map<String, List<DataRecord>> groups = new LinkedHashMap<>();
        for (DataRecord record : records) {
            String value = GroupKeys.part(record.get(field));
            String key = GroupKeys.OTHER;
            for (Object entry : declared) {
                if (entry instanceof Map<?, ?> group && listsValue(group.get("values"), value)) {
                    key = String.valueOf(group.get("label"));
                    break;
                }
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
    }

    static double range(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return max - min;
    }

    private static String groupingField(List<String> fields, Map<String, Object> params) {
        Object field = params.get("field");
        if (field != null) {
            return String.valueOf(field);
        }
        return fields.isEmpty() ? "" : fields.get(0);
    }

    private static boolean listsValue(Object values, String value) {
        if (!(values instanceof Collection<?> candidates)) {
            return false;
        }
        for (Object candidate : candidates) {
            if (GroupKeys.part(candidate).equals(value)) {
                return true;
            }
        }
        return false;
    }
}

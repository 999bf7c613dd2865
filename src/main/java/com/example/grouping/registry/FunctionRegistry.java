package com.example.grouping.registry;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of named custom grouping and aggregation functions.
 *
 * <p>Configuration refers to custom functions by id only; there is no way to
 * ship executable code inside a configuration. The process-wide instance
 * returned by {@link #global()} starts out with the {@link BuiltinFunctions}
 * and is meant to be populated once at startup. Engines can be handed a
 * separate registry, which is what tests do.
 *
 * <pre>{@code
 * FunctionRegistry.global()
 *     .registerGroupFunction("bySalaryLevel", (records, fields, params) -> ...)
 *     .registerAggregationFunction("p90", values -> ...);
 * }</pre>
 */
public final class FunctionRegistry {

    private static final FunctionRegistry GLOBAL = withBuiltins();

    private final ConcurrentMap<String, CustomGroupFunction> groupFunctions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CustomAggregationFunction> aggregationFunctions = new ConcurrentHashMap<>();

    /**
     * Returns the process-wide registry.
     */
    public static FunctionRegistry global() {
        return GLOBAL;
    }

    /**
     * Creates an independent registry holding only the built-in functions.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        BuiltinFunctions.registerAll(registry);
        return registry;
    }

    public FunctionRegistry registerGroupFunction(String id, CustomGroupFunction function) {
        groupFunctions.put(requireId(id), Objects.requireNonNull(function, "function must not be null"));
        return this;
    }

    public FunctionRegistry registerAggregationFunction(String id, CustomAggregationFunction function) {
        aggregationFunctions.put(requireId(id), Objects.requireNonNull(function, "function must not be null"));
        return this;
    }

    public Optional<CustomGroupFunction> groupFunction(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(groupFunctions.get(id));
    }

    public Optional<CustomAggregationFunction> aggregationFunction(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(aggregationFunctions.get(id));
    }

    public boolean hasGroupFunction(String id) {
        return groupFunction(id).isPresent();
    }

    public Set<String> groupFunctionIds() {
        return Set.copyOf(groupFunctions.keySet());
    }

    public Set<String> aggregationFunctionIds() {
        return Set.copyOf(aggregationFunctions.keySet());
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("function id must not be blank");
        }
        return id;
    }
}

package com.example.grouping.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregation results keyed by node path and label.
 *
 * <p>Paths and labels iterate in the order they were first computed (tree
 * pre-order, then spec declaration order). Immutable once built; recoverable
 * problems met during the run are available from {@link #warnings()}.
 */
public final class AggregationResultMap {

    private final Map<List<String>, Map<String, AggregationResult>> results;
    private final List<AggregationWarning> warnings;

    private AggregationResultMap(Map<List<String>, Map<String, AggregationResult>> results,
                                 List<AggregationWarning> warnings) {
        this.results = results;
        this.warnings = warnings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AggregationResult> find(List<String> path, String label) {
        return Optional.ofNullable(results.getOrDefault(path, Map.of()).get(label));
    }

    /**
     * Returns the value for a node and label, or {@code null} when there is
     * no such result or the result is undefined.
     */
    public Double value(List<String> path, String label) {
        return find(path, label).map(AggregationResult::value).orElse(null);
    }

    /**
     * Returns every result attached to a node, by label.
     */
    public Map<String, AggregationResult> resultsAt(List<String> path) {
        return results.getOrDefault(path, Map.of());
    }

    public Set<List<String>> paths() {
        return results.keySet();
    }

    public List<AggregationResult> all() {
        List<AggregationResult> all = new ArrayList<>();
        results.values().forEach(byLabel -> all.addAll(byLabel.values()));
        return all;
    }

    public int size() {
        return results.values().stream().mapToInt(Map::size).sum();
    }

    public List<AggregationWarning> warnings() {
        return warnings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AggregationResultMap other
                && results.equals(other.results)
                && warnings.equals(other.warnings);
    }

    @Override
    public int hashCode() {
        return 31 * results.hashCode() + warnings.hashCode();
    }

    @Override
    public String toString() {
        return "AggregationResultMap" + results;
    }

    public static final class Builder {
        private final Map<List<String>, Map<String, AggregationResult>> results = new LinkedHashMap<>();
        private final List<AggregationWarning> warnings = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a result, replacing any earlier result with the same path and label.
         *
         * @return the replaced result, if any
         */
        public Optional<AggregationResult> put(AggregationResult result) {
            Map<String, AggregationResult> byLabel =
                    results.computeIfAbsent(result.path(), path -> new LinkedHashMap<>());
            return Optional.ofNullable(byLabel.put(result.label(), result));
        }

        public Builder warn(AggregationWarning warning) {
            warnings.add(warning);
            return this;
        }

        public AggregationResultMap build() {
            Map<List<String>, Map<String, AggregationResult>> frozen = new LinkedHashMap<>();
            results.forEach((path, byLabel) ->
                    frozen.put(path, Collections.unmodifiableMap(new LinkedHashMap<>(byLabel))));
            return new AggregationResultMap(Collections.unmodifiableMap(frozen), List.copyOf(warnings));
        }
    }
}

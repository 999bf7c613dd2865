package com.example.grouping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A flat, ordered mapping of field name to scalar value.
 *
 * <p>Records are supplied by the caller and never mutated by the engine.
 * The field set need not be uniform across records: a missing key reads
 * as {@code null}.
 *
 * <p>Example:
 * <pre>{@code
 * DataRecord record = DataRecord.of("region", "North", "amount", 10);
 * Object region = record.get("region");   // "North"
 * Object missing = record.get("quarter"); // null
 * }</pre>
 */
public record DataRecord(Map<String, Object> fields) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public DataRecord(Map<String, Object> fields) {
        this.fields = fields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
                : Map.of();
    }

    /**
     * Creates a record from alternating field names and values.
     *
     * @param keysAndValues field name, value, field name, value, ...
     * @return a new record preserving the given field order
     */
    public static DataRecord of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keysAndValues must contain an even number of elements");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            fields.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return new DataRecord(fields);
    }

    @JsonValue
    @Override
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Returns the value of a field, or {@code null} when the field is absent.
     */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }
}

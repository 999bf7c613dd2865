package com.example.grouping.registry;

import com.example.grouping.model.DataRecord;

import java.util.List;
import java.util.Map;

/**
 * A named grouping function registered with a {@link FunctionRegistry}.
 *
 * <p>Receives the records of one parent group and returns their partition as
 * an ordered mapping of key to subset. The engine keeps the returned key order.
 * Records left out of every subset end up in the {@code Other} bucket; a record
 * returned under several keys stays in the first one.
 */
@FunctionalInterface
public interface CustomGroupFunction {

    /**
     * @param records records of the group being partitioned, in store order
     * @param fields  fields declared on the level
     * @param params  parameters declared with the function
     * @return ordered mapping of group key to records
     */
    Map<String, List<DataRecord>> group(List<DataRecord> records, List<String> fields, Map<String, Object> params);
}

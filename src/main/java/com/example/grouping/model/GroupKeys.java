package com.example.grouping.model;

import java.util.List;

/**
 * Sentinel keys and key rendering shared by every grouping function.
 */
public final class GroupKeys {

    /** Key part for a missing field value. */
    public static final String MISSING = "N/A";

    /** Bucket for values outside every declared range or group. */
    public static final String OTHER = "Other";

    /** Bucket for values that cannot be read as dates. */
    public static final String UNPARSED = "Unparsed";

    private GroupKeys() {
    }

    /**
     * Renders a single field value as a key part, {@link #MISSING} when absent.
     */
    public static String part(Object value) {
        return Values.isMissing(value) ? MISSING : Values.display(value);
    }

    /**
     * Joins key parts with a separator. Missing parts stay in place, so a
     * record lacking both fields of a two-field level keys as {@code "N/A + N/A"}.
     */
    public static String join(List<String> parts, String separator) {
        if (parts.isEmpty()) {
            return MISSING;
        }
        return String.join(separator, parts);
    }
}

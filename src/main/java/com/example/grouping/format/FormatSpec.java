package com.example.grouping.format;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Display format attached to an aggregation or pivot measure.
 *
 * <p>In JSON the {@code type} property selects the kind; unknown kinds fall
 * back to {@link PlainFormatSpec}.
 * <pre>{@code
 * {"type": "currency", "code": "USD", "precision": 2}
 * {"type": "number", "precision": 0, "thousandsSeparator": true, "suffix": " pcs"}
 * {"type": "percentage", "precision": 1}
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
        defaultImpl = PlainFormatSpec.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = NumberFormatSpec.class, name = "number"),
        @JsonSubTypes.Type(value = CurrencyFormatSpec.class, name = "currency"),
        @JsonSubTypes.Type(value = PercentageFormatSpec.class, name = "percentage"),
        @JsonSubTypes.Type(value = PlainFormatSpec.class, name = "plain")
})
public interface FormatSpec {
}

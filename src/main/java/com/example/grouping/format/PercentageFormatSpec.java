package com.example.grouping.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Percentage of a value already expressed in percent units ({@code 12.5 -> "12.50%"}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PercentageFormatSpec(int precision) implements FormatSpec {

    @JsonCreator
    public PercentageFormatSpec(@JsonProperty("precision") Integer precision) {
        this(precision != null ? precision : 2);
    }

    public PercentageFormatSpec(int precision) {
        this.precision = Math.max(0, precision);
    }
}

package com.example.grouping.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed-precision number, optionally grouped by thousands and wrapped in a prefix/suffix.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NumberFormatSpec(
        int precision,
        boolean thousandsSeparator,
        String prefix,
        String suffix
) implements FormatSpec {

    @JsonCreator
    public NumberFormatSpec(
            @JsonProperty("precision") Integer precision,
            @JsonProperty("thousandsSeparator") Boolean thousandsSeparator,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("suffix") String suffix
    ) {
        this(precision != null ? precision : 0,
                thousandsSeparator == null || thousandsSeparator,
                prefix,
                suffix);
    }

    public NumberFormatSpec(int precision, boolean thousandsSeparator, String prefix, String suffix) {
        this.precision = Math.max(0, precision);
        this.thousandsSeparator = thousandsSeparator;
        this.prefix = prefix != null ? prefix : "";
        this.suffix = suffix != null ? suffix : "";
    }

    public static NumberFormatSpec of(int precision, boolean thousandsSeparator) {
        return new NumberFormatSpec(precision, thousandsSeparator, "", "");
    }
}

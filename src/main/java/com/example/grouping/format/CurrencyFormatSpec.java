package com.example.grouping.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Currency amount with the symbol of an ISO 4217 code, grouped by thousands.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CurrencyFormatSpec(String code, int precision) implements FormatSpec {

    public static final String DEFAULT_CODE = "CNY";

    @JsonCreator
    public CurrencyFormatSpec(
            @JsonProperty("code") String code,
            @JsonProperty("precision") Integer precision
    ) {
        this(code, precision != null ? precision : 2);
    }

    public CurrencyFormatSpec(String code, int precision) {
        this.code = code != null && !code.isBlank() ? code : DEFAULT_CODE;
        this.precision = Math.max(0, precision);
    }
}

package com.example.grouping.format;

/**
 * Plain string conversion of the value.
 */
public record PlainFormatSpec() implements FormatSpec {
}

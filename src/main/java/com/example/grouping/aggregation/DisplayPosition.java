package com.example.grouping.aggregation;

/**
 * Where a renderer shows an aggregate relative to its group.
 */
public enum DisplayPosition {
    HEADER,
    FOOTER,
    BOTH;

    public boolean inHeader() {
        return this == HEADER || this == BOTH;
    }

    public boolean inFooter() {
        return this == FOOTER || this == BOTH;
    }
}

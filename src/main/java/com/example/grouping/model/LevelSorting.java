package com.example.grouping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordering of the groups produced by one level.
 *
 * <p>{@link Direction#NONE} keeps first-seen order. A non-empty
 * {@code customOrder} wins over the direction: listed keys come first in
 * list order, the rest follow in first-seen order.
 */
public record LevelSorting(
        Direction direction,
        List<String> customOrder
) {
    private static final LevelSorting NONE = new LevelSorting(Direction.NONE, List.of());

    public enum Direction {
        NONE,
        ASC,
        DESC
    }

    @JsonCreator
    public LevelSorting(
            @JsonProperty("direction") Direction direction,
            @JsonProperty("customOrder") List<String> customOrder
    ) {
        this.direction = direction != null ? direction : Direction.NONE;
        this.customOrder = customOrder != null ? List.copyOf(customOrder) : List.of();
    }

    public static LevelSorting none() {
        return NONE;
    }

    public static LevelSorting ascending() {
        return new LevelSorting(Direction.ASC, List.of());
    }

    public static LevelSorting descending() {
        return new LevelSorting(Direction.DESC, List.of());
    }

    public static LevelSorting custom(List<String> order) {
        return new LevelSorting(Direction.NONE, order);
    }

    public boolean isNone() {
        return direction == Direction.NONE && customOrder.isEmpty();
    }
}

package com.example.grouping.hierarchy;

import com.example.grouping.model.IndexSet;

/**
 * One group produced by partitioning a parent's members on a single level.
 */
public record GroupBucket(String key, IndexSet members) {
}

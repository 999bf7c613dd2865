package com.example.grouping.model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;

/**
 * Immutable, ascending set of indices into a record store.
 *
 * <p>Group nodes hold their members as an {@code IndexSet} so that pivot
 * cells can be computed by intersecting two sets instead of re-scanning
 * the raw records. Intersection and union are linear merges.
 */
public final class IndexSet implements Iterable<Integer> {

    private static final IndexSet EMPTY = new IndexSet(new int[0]);

    // strictly ascending
    private final int[] indices;

    private IndexSet(int[] indices) {
        this.indices = indices;
    }

    public static IndexSet empty() {
        return EMPTY;
    }

    /**
     * Returns the set {@code 0 .. size-1}.
     */
    public static IndexSet range(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        return size == 0 ? EMPTY : new IndexSet(IntStream.range(0, size).toArray());
    }

    /**
     * Creates a set from arbitrary indices; duplicates are collapsed.
     */
    public static IndexSet of(int... values) {
        if (values.length == 0) {
            return EMPTY;
        }
        int[] sorted = Arrays.stream(values).sorted().distinct().toArray();
        if (sorted[0] < 0) {
            throw new IllegalArgumentException("indices must not be negative: " + sorted[0]);
        }
        return new IndexSet(sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    /**
     * Returns the index at the given position in ascending order.
     */
    public int get(int position) {
        return indices[position];
    }

    public boolean contains(int index) {
        return Arrays.binarySearch(indices, index) >= 0;
    }

    public IndexSet intersect(IndexSet other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        int[] result = new int[Math.min(indices.length, other.indices.length)];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < indices.length && j < other.indices.length) {
            int a = indices[i];
            int b = other.indices[j];
            if (a == b) {
                result[n++] = a;
                i++;
                j++;
            } else if (a < b) {
                i++;
            } else {
                j++;
            }
        }
        return n == 0 ? EMPTY : new IndexSet(Arrays.copyOf(result, n));
    }

    public IndexSet union(IndexSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        int[] result = new int[indices.length + other.indices.length];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < indices.length || j < other.indices.length) {
            if (j >= other.indices.length || (i < indices.length && indices[i] < other.indices[j])) {
                result[n++] = indices[i++];
            } else if (i >= indices.length || other.indices[j] < indices[i]) {
                result[n++] = other.indices[j++];
            } else {
                result[n++] = indices[i];
                i++;
                j++;
            }
        }
        return new IndexSet(Arrays.copyOf(result, n));
    }

    public IntStream stream() {
        return Arrays.stream(indices);
    }

    public int[] toArray() {
        return indices.clone();
    }

    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<>() {
            private int position = 0;

            @Override
            public boolean hasNext() {
                return position < indices.length;
            }

            @Override
            public Integer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return indices[position++];
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof IndexSet other && Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indices);
    }

    @Override
    public String toString() {
        return Arrays.toString(indices);
    }

    /**
     * Collects indices appended in ascending order.
     */
    public static final class Builder {
        private int[] buffer = new int[8];
        private int size = 0;

        private Builder() {
        }

        public Builder add(int index) {
            if (index < 0) {
                throw new IllegalArgumentException("indices must not be negative: " + index);
            }
            if (size > 0 && buffer[size - 1] >= index) {
                throw new IllegalArgumentException(
                        "indices must be added in ascending order: " + index + " after " + buffer[size - 1]);
            }
            if (size == buffer.length) {
                buffer = Arrays.copyOf(buffer, size * 2);
            }
            buffer[size++] = index;
            return this;
        }

        public int size() {
            return size;
        }

        public IndexSet build() {
            return size == 0 ? EMPTY : new IndexSet(Arrays.copyOf(buffer, size));
        }
    }
}

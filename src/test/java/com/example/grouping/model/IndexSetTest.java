package com.example.grouping.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for IndexSet, the member representation of group nodes.
 *
 * <p>Pivot cells are computed by intersecting the member sets of a row leaf
 * and a column leaf, so intersection and union must be exact.
 */
class IndexSetTest {

    // =========================================================================
    // CONSTRUCTION
    // =========================================================================

    @Test
    @DisplayName("Should sort and deduplicate indices passed to of()")
    void shouldSortAndDeduplicate() {
        IndexSet set = IndexSet.of(5, 1, 3, 1, 5);

        assertThat(set.toArray()).containsExactly(1, 3, 5);
        assertThat(set.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should create the range 0..n-1")
    void shouldCreateRange() {
        assertThat(IndexSet.range(4).toArray()).containsExactly(0, 1, 2, 3);
        assertThat(IndexSet.range(0).isEmpty()).isTrue();
    }

    /**
     * The builder is used on hot paths and only accepts ascending input.
     */
    @Test
    @DisplayName("Should reject indices added out of order")
    void shouldRejectOutOfOrderBuilderInput() {
        IndexSet.Builder builder = IndexSet.builder().add(2);

        assertThatThrownBy(() -> builder.add(2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ascending");
    }

    @Test
    @DisplayName("Should reject negative indices")
    void shouldRejectNegativeIndices() {
        assertThatThrownBy(() -> IndexSet.of(-1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // SET OPERATIONS
    // =========================================================================

    @Test
    @DisplayName("Should intersect two sets")
    void shouldIntersect() {
        IndexSet a = IndexSet.of(0, 2, 4, 6, 8);
        IndexSet b = IndexSet.of(1, 2, 3, 6, 9);

        assertThat(a.intersect(b)).isEqualTo(IndexSet.of(2, 6));
        assertThat(a.intersect(IndexSet.empty()).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should union two sets without duplicates")
    void shouldUnion() {
        IndexSet a = IndexSet.of(0, 2, 4);
        IndexSet b = IndexSet.of(1, 2, 7);

        assertThat(a.union(b).toArray()).containsExactly(0, 1, 2, 4, 7);
        assertThat(a.union(IndexSet.empty())).isSameAs(a);
    }

    @Test
    @DisplayName("Should answer membership queries")
    void shouldAnswerContains() {
        IndexSet set = IndexSet.of(3, 10, 42);

        assertThat(set.contains(10)).isTrue();
        assertThat(set.contains(11)).isFalse();
        assertThat(set).containsExactly(3, 10, 42);
    }
}

package com.example.grouping.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a group tree.
 *
 * <p>The synthetic root has level {@code 0}, depth {@code 0} and an empty path.
 * Every other node carries the composite key produced by its grouping pass,
 * the declared level number of that pass, its depth (1 for the first actual
 * pass, 2 for the second, ...) and the indices of every record beneath it.
 *
 * <p>A parent's members are exactly the union of its children's members;
 * siblings are disjoint. Nodes are immutable once built.
 *
 * @param key      composite group key ({@link #ROOT_KEY} for the root)
 * @param path     keys from the first level down to this node, inclusive
 * @param level    declared grouping level that produced this node
 * @param depth    position of the producing pass in the ordered plan
 * @param children child nodes in build order
 * @param members  indices of the records belonging to this subtree
 */
public record GroupNode(
        String key,
        List<String> path,
        int level,
        int depth,
        List<GroupNode> children,
        IndexSet members
) {
    public static final String ROOT_KEY = "root";

    public GroupNode {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(members, "members must not be null");
        path = path != null ? List.copyOf(path) : List.of();
        children = children != null ? List.copyOf(children) : List.of();
        if (!children.isEmpty()) {
            int childTotal = children.stream().mapToInt(child -> child.members().size()).sum();
            if (childTotal != members.size()) {
                throw new IllegalArgumentException("children of '" + key + "' hold " + childTotal
                        + " records but the node holds " + members.size());
            }
        }
    }

    /**
     * Creates the synthetic root over the given top-level children.
     */
    public static GroupNode root(List<GroupNode> children, IndexSet members) {
        return new GroupNode(ROOT_KEY, List.of(), 0, 0, children, members);
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public int recordCount() {
        return members.size();
    }

    /**
     * Returns this node and all descendants, parents before children.
     */
    public List<GroupNode> preOrder() {
        List<GroupNode> nodes = new ArrayList<>();
        collectPreOrder(this, nodes);
        return nodes;
    }

    /**
     * Returns the leaves of this subtree depth-first in build order.
     * A node without children is its own single leaf.
     */
    public List<GroupNode> leaves() {
        List<GroupNode> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    public Optional<GroupNode> child(String childKey) {
        return children.stream().filter(child -> child.key().equals(childKey)).findFirst();
    }

    /**
     * Finds a descendant by its path relative to this node.
     */
    public Optional<GroupNode> find(List<String> relativePath) {
        GroupNode current = this;
        for (String segment : relativePath) {
            Optional<GroupNode> next = current.child(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    private static void collectPreOrder(GroupNode node, List<GroupNode> out) {
        out.add(node);
        for (GroupNode child : node.children) {
            collectPreOrder(child, out);
        }
    }

    private static void collectLeaves(GroupNode node, List<GroupNode> out) {
        if (node.isLeaf()) {
            out.add(node);
            return;
        }
        for (GroupNode child : node.children) {
            collectLeaves(child, out);
        }
    }
}

package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.HierarchyNode;

import java.util.*;
import java.util.function.Consumer;

/**
 * Depth-first walks over a built forest. Every node reachable through {@code subclasses} and
 * {@code instances} is visited once per occurrence, so a node shared under several parents is
 * visited at each of them.
 */
public final class HierarchyTraversal {
    private HierarchyTraversal() {}

    public static void forEachNode(Collection<HierarchyNode> roots, Consumer<HierarchyNode> visitor) {
        Deque<HierarchyNode> stack = new ArrayDeque<>();
        List<HierarchyNode> ordered = new ArrayList<>(roots);
        for (int i = ordered.size() - 1; i >= 0; i--) stack.push(ordered.get(i));

        while (!stack.isEmpty()) {
            HierarchyNode node = stack.pop();
            visitor.accept(node);
            pushReversed(stack, node.getSubclasses());
            pushReversed(stack, node.getInstances());
        }
    }

    /**
     * Number of node occurrences in the forest, circular markers included.
     */
    public static int countNodes(Collection<HierarchyNode> roots) {
        int[] count = {0};
        forEachNode(roots, n -> count[0]++);
        return count[0];
    }

    /**
     * Distinct identifiers present anywhere in the forest, sorted.
     */
    public static SortedSet<String> collectIds(Collection<HierarchyNode> roots) {
        SortedSet<String> ids = new TreeSet<>();
        forEachNode(roots, n -> ids.add(n.getId()));
        return ids;
    }

    private static void pushReversed(Deque<HierarchyNode> stack, List<HierarchyNode> children) {
        if (children == null) return;
        for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
    }
}

package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.HierarchyNode;

import java.util.*;

/**
 * Removes output-excluded entities from a built forest. Dropping an entry drops its whole
 * subtree; lists left empty are removed so they disappear from the serialized form.
 */
public final class HierarchyPruner {
    private HierarchyPruner() {}

    /**
     * Prunes {@code node} in place and returns it. The node itself is kept even if excluded;
     * callers filter excluded roots with {@link #pruneForest}.
     */
    public static HierarchyNode prune(HierarchyNode node, Set<String> exclusions) {
        if (node == null || exclusions.isEmpty()) return node;
        Deque<HierarchyNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            HierarchyNode current = stack.pop();
            current.setSubclasses(filter(current.getSubclasses(), exclusions));
            current.setInstances(filter(current.getInstances(), exclusions));
            if (current.getSubclasses() != null) current.getSubclasses().forEach(stack::push);
            if (current.getInstances() != null) current.getInstances().forEach(stack::push);
        }
        return node;
    }

    public static List<HierarchyNode> pruneForest(List<HierarchyNode> roots, Set<String> exclusions) {
        List<HierarchyNode> kept = new ArrayList<>();
        for (HierarchyNode root : roots) {
            if (!exclusions.contains(root.getId())) kept.add(prune(root, exclusions));
        }
        return kept;
    }

    private static List<HierarchyNode> filter(List<HierarchyNode> children, Set<String> exclusions) {
        if (children == null) return null;
        List<HierarchyNode> kept = new ArrayList<>(children.size());
        for (HierarchyNode child : children) {
            if (!exclusions.contains(child.getId())) kept.add(child);
        }
        return kept.isEmpty() ? null : kept;
    }
}

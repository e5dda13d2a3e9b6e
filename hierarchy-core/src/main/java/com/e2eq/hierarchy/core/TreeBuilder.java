package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.HierarchyNode;

import java.util.*;
import java.util.function.Consumer;

/**
 * Expands a root identifier into a nested {@link HierarchyNode}.
 * <p>
 * Cycle detection is scoped to the ancestors of the node being expanded, not to everything
 * built so far: an entity that is a kind of A and a kind of B appears under both, and only a
 * true ancestor cycle is cut, with a {@code "circular reference"} marker node. Expansion runs
 * on an explicit work stack, so long acyclic chains do not consume call stack.
 * </p>
 * <p>
 * With {@code shareSubtrees} enabled, a subtree that has been completely built is reused by
 * reference at later occurrences of the same identifier instead of being rebuilt. Only
 * completed subtrees are shared, which keeps the node graph acyclic.
 * </p>
 */
public final class TreeBuilder {
    private final RelationStore store;
    private final boolean shareSubtrees;
    private final Map<String, HierarchyNode> completed = new HashMap<>();

    public TreeBuilder(RelationStore store) {
        this(store, false);
    }

    public TreeBuilder(RelationStore store, boolean shareSubtrees) {
        this.store = Objects.requireNonNull(store, "store");
        this.shareSubtrees = shareSubtrees;
    }

    // finished is set only on the frame that closes a node in shared mode
    private record Frame(String id, AncestorPath path, Consumer<HierarchyNode> attach, HierarchyNode finished) {
        static Frame expand(String id, AncestorPath path, Consumer<HierarchyNode> attach) {
            return new Frame(id, path, attach, null);
        }

        static Frame close(String id, HierarchyNode node) {
            return new Frame(id, null, null, node);
        }
    }

    public HierarchyNode build(String rootId) {
        List<HierarchyNode> holder = new ArrayList<>(1);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(Frame.expand(rootId, AncestorPath.EMPTY, holder::add));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.finished() != null) {
                completed.put(frame.id(), frame.finished());
            } else {
                expand(frame, stack);
            }
        }
        return holder.get(0);
    }

    private void expand(Frame frame, Deque<Frame> stack) {
        String id = frame.id();
        if (frame.path().contains(id)) {
            frame.attach().accept(HierarchyNode.circularReference(id, store.labelOf(id)));
            return;
        }
        if (shareSubtrees) {
            HierarchyNode done = completed.get(id);
            if (done != null) {
                frame.attach().accept(done);
                return;
            }
        }

        HierarchyNode node = new HierarchyNode(id, store.labelOf(id));
        frame.attach().accept(node);
        AncestorPath path = frame.path().push(id);

        List<Frame> pending = new ArrayList<>();
        for (String child : sorted(store.childrenOf(id))) {
            pending.add(Frame.expand(child, path, node::addSubclass));
        }
        for (String instance : sorted(store.instancesOf(id))) {
            HierarchyNode instanceNode = new HierarchyNode(instance, store.labelOf(instance));
            // nested instances stay a flat id/label list
            for (String nested : sorted(store.instancesOf(instance))) {
                instanceNode.addInstance(new HierarchyNode(nested, store.labelOf(nested)));
            }
            for (String sub : sorted(store.childrenOf(instance))) {
                pending.add(Frame.expand(sub, path, instanceNode::addSubclass));
            }
            node.addInstance(instanceNode);
        }

        if (shareSubtrees) {
            stack.push(Frame.close(id, node));
        }
        // pushed in reverse so siblings are attached in identifier order
        for (int i = pending.size() - 1; i >= 0; i--) {
            stack.push(pending.get(i));
        }
    }

    private static List<String> sorted(Set<String> ids) {
        if (ids.isEmpty()) return List.of();
        List<String> list = new ArrayList<>(ids);
        Collections.sort(list);
        return list;
    }
}

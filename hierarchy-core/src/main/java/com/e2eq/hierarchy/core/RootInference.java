package com.e2eq.hierarchy.core;

import io.quarkus.logging.Log;

import java.util.*;

/**
 * Derives the forest roots from the relation graph.
 * <p>
 * Root selection runs in two phases: candidates are computed on the original edges, the
 * children of structurally excluded identifiers are detached, and the candidates are
 * recomputed on the detached graph because removing a node changes who counts as
 * parentless. A final demotion pass drops candidates that will already be reachable as an
 * instance of some class in the forest.
 * </p>
 */
public final class RootInference {
    private RootInference() {}

    /**
     * @param roots root identifiers ordered by label, ties by identifier
     * @param store the detached copy of the relation graph the tree builder must expand against
     */
    public record Result(List<String> roots, RelationStore store) {
        public Result {
            roots = List.copyOf(roots);
        }
    }

    public static Result infer(RelationStore store, HierarchyConfig config) {
        Set<String> structural = config.structuralExclusions();

        // phase one on the original graph; its result is superseded once exclusions are detached
        Set<String> firstPass = candidateRoots(store, config.seeds(), structural);
        Log.debugf("Root candidates before structural exclusion: %d", firstPass.size());

        RelationStore detached = store.copy();
        for (String excluded : structural) {
            Set<String> children = detached.detachChildren(excluded);
            if (!children.isEmpty()) {
                Log.debugf("Detached %d subclasses from excluded %s", children.size(), excluded);
            }
        }

        Set<String> roots = candidateRoots(detached, config.seeds(), structural);
        demoteReachableInstances(roots, detached, config);

        List<String> ordered = new ArrayList<>(roots);
        ordered.sort(byLabel(detached));
        return new Result(ordered, detached);
    }

    /**
     * Every identifier on either side of a subclass edge, every seed, and every class that owns instances.
     */
    static Set<String> classItems(RelationStore store, Collection<String> seeds) {
        Set<String> items = new HashSet<>();
        for (RelationStore.Edge e : store.subclassEdges()) {
            items.add(e.from());
            items.add(e.to());
        }
        items.addAll(seeds);
        for (RelationStore.Edge e : store.instanceEdges()) {
            items.add(e.to());
        }
        return items;
    }

    private static Set<String> candidateRoots(RelationStore store, List<String> seeds, Set<String> structural) {
        Set<String> candidates = new HashSet<>();
        for (String id : classItems(store, seeds)) {
            // parentless and owning at least one subclass or instance; bare orphans never become roots
            if (!store.hasParent(id) && (store.hasChildren(id) || store.hasInstances(id))) {
                candidates.add(id);
            }
        }
        for (String seed : seeds) {
            if (!store.hasParent(seed) && store.hasInstances(seed)) {
                candidates.add(seed);
            }
        }
        candidates.removeAll(structural);
        return candidates;
    }

    private static void demoteReachableInstances(Set<String> roots, RelationStore store, HierarchyConfig config) {
        Set<String> excluded = new HashSet<>(config.structuralExclusions());
        excluded.addAll(config.outputExclusions());

        Set<String> universe = classItems(store, config.seeds());
        universe.removeAll(excluded);

        for (Iterator<String> it = roots.iterator(); it.hasNext(); ) {
            String root = it.next();
            if (!store.isInstance(root) || store.hasChildren(root)) continue;

            Set<String> domainParents = new HashSet<>(store.classesOf(root));
            domainParents.removeAll(excluded);
            domainParents.retainAll(universe);
            if (!domainParents.isEmpty()) {
                Log.debugf("Demoting root %s, reachable as instance of %s", root, new TreeSet<>(domainParents));
                it.remove();
            }
        }
    }

    static Comparator<String> byLabel(RelationStore store) {
        return Comparator.comparing(store::labelOf).thenComparing(Comparator.naturalOrder());
    }
}

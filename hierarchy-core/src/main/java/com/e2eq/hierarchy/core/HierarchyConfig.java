package com.e2eq.hierarchy.core;

import java.util.*;

/**
 * Build configuration handed to the materializer.
 *
 * @param seeds                 identifiers the acquisition started from; kept as roots when they own instances
 * @param structuralExclusions  identifiers removed from the edge graph before root inference; their children float up
 * @param outputExclusions      identifiers whose subtrees are pruned from the rendered forest, in reporting order
 * @param shareSubtrees         reuse a completed subtree by reference instead of rebuilding it at every occurrence
 * @param source                free-form description of where the relations came from, reported in the metadata
 * @param propertiesUsed        relation property codes and their meaning, reported in the metadata
 */
public record HierarchyConfig(List<String> seeds,
                              Set<String> structuralExclusions,
                              List<String> outputExclusions,
                              boolean shareSubtrees,
                              String source,
                              Map<String, String> propertiesUsed) {

    public HierarchyConfig {
        seeds = seeds == null ? List.of() : List.copyOf(new LinkedHashSet<>(seeds));
        structuralExclusions = structuralExclusions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(structuralExclusions));
        outputExclusions = outputExclusions == null ? List.of() : List.copyOf(new LinkedHashSet<>(outputExclusions));
        propertiesUsed = propertiesUsed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(propertiesUsed));
    }

    public HierarchyConfig(List<String> seeds, Set<String> structuralExclusions, List<String> outputExclusions) {
        this(seeds, structuralExclusions, outputExclusions, false, null, Map.of());
    }

    public static HierarchyConfig empty() {
        return new HierarchyConfig(List.of(), Set.of(), List.of());
    }

    public Set<String> outputExclusionSet() {
        return new LinkedHashSet<>(outputExclusions);
    }

    public HierarchyConfig withShareSubtrees(boolean share) {
        return new HierarchyConfig(seeds, structuralExclusions, outputExclusions, share, source, propertiesUsed);
    }
}

package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.EntityRef;
import com.e2eq.hierarchy.model.HierarchyDocument;
import com.e2eq.hierarchy.model.HierarchyMetadata;
import com.e2eq.hierarchy.model.HierarchyNode;
import io.quarkus.logging.Log;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a populated {@link RelationStore} into a pruned forest: infers the roots, expands each
 * one, prunes output exclusions and reports the metadata block.
 */
public final class HierarchyMaterializer {
    private final HierarchyConfig config;

    public HierarchyMaterializer(HierarchyConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public HierarchyConfig getConfig() {
        return config;
    }

    public HierarchyDocument materialize(RelationStore store) {
        Log.infof("Total items: %d, subclass relationships: %d, instance relationships: %d",
                store.entityCount(), store.subclassEdgeCount(), store.instanceEdgeCount());

        RootInference.Result inferred = RootInference.infer(store, config);
        Log.infof("Root classes: %s", inferred.roots().stream()
                .map(r -> r + " (" + inferred.store().labelOf(r) + ")")
                .collect(Collectors.joining(", ", "[", "]")));

        Set<String> exclusions = config.outputExclusionSet();
        TreeBuilder builder = new TreeBuilder(inferred.store(), config.shareSubtrees());
        List<HierarchyNode> built = new ArrayList<>();
        for (String root : inferred.roots()) {
            if (!exclusions.contains(root)) built.add(builder.build(root));
        }
        List<HierarchyNode> forest = HierarchyPruner.pruneForest(built, exclusions);

        HierarchyMetadata metadata = describe(store, inferred.store(), forest);
        Log.infof("Materialized %d roots with %d nodes", metadata.rootCount(), metadata.nodeCount());
        return new HierarchyDocument(forest, metadata);
    }

    /**
     * Item and instance counts come from the store as supplied. The subclass count is taken from
     * {@code detached}, after structural exclusion has dropped the edges into excluded identifiers.
     */
    public HierarchyMetadata describe(RelationStore store, RelationStore detached, List<HierarchyNode> forest) {
        List<EntityRef> excluded = config.outputExclusions().stream()
                .map(id -> new EntityRef(id, store.labelOf(id)))
                .collect(Collectors.toList());
        return new HierarchyMetadata(
                config.source(),
                config.seeds().size(),
                store.entityCount(),
                detached.subclassEdgeCount(),
                store.instanceEdgeCount(),
                forest.size(),
                HierarchyTraversal.countNodes(forest),
                excluded,
                config.propertiesUsed()
        );
    }
}

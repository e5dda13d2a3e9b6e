package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.AttributeBundle;
import com.e2eq.hierarchy.model.HierarchyNode;
import io.quarkus.logging.Log;

import java.util.*;

/**
 * Attaches attribute bundles to the nodes of an already built forest by identifier.
 * <p>
 * Only non-empty attributes are attached and each one overwrites what the node carried, so
 * merging the same bundles again leaves the forest unchanged. Structure is never touched:
 * {@code id}, {@code label}, {@code subclasses} and {@code instances} stay as they are.
 * Identifiers without a bundle, and bundles for identifiers absent from the forest, are skipped.
 * </p>
 */
public final class EnrichmentMerger {
    private EnrichmentMerger() {}

    public static EnrichmentReport merge(HierarchyNode tree, Map<String, AttributeBundle> bundles) {
        return mergeForest(List.of(tree), bundles);
    }

    public static EnrichmentReport mergeForest(List<HierarchyNode> forest, Map<String, AttributeBundle> bundles) {
        Map<String, AttributeBundle> source = bundles == null ? Map.of() : bundles;
        int withData = (int) source.values().stream().filter(b -> b != null && b.hasData()).count();
        int[] enriched = {0};

        if (withData > 0) {
            HierarchyTraversal.forEachNode(forest, node -> {
                AttributeBundle bundle = source.get(node.getId());
                if (bundle != null && apply(node, bundle)) enriched[0]++;
            });
        }

        Log.infof("Got enrichment data for %d/%d bundles, enriched %d nodes", withData, source.size(), enriched[0]);
        return new EnrichmentReport(source.size(), withData, enriched[0]);
    }

    static boolean apply(HierarchyNode node, AttributeBundle bundle) {
        boolean changed = false;
        if (bundle.description() != null && !bundle.description().isEmpty()) {
            node.setDescription(bundle.description());
            changed = true;
        }
        if (!bundle.usedIn().isEmpty()) {
            node.setUsedIn(new ArrayList<>(bundle.usedIn()));
            changed = true;
        }
        if (!bundle.ieeeTerm().isEmpty()) {
            node.setIeeeTerm(new ArrayList<>(bundle.ieeeTerm()));
            changed = true;
        }
        if (!bundle.exactMatch().isEmpty()) {
            node.setExactMatch(new ArrayList<>(bundle.exactMatch()));
            changed = true;
        }
        if (!bundle.thumbnail().isEmpty()) {
            node.setThumbnail(new ArrayList<>(bundle.thumbnail()));
            changed = true;
        }
        return changed;
    }
}

package com.e2eq.hierarchy.io;

import com.e2eq.hierarchy.core.EnrichmentMerger;
import com.e2eq.hierarchy.core.EnrichmentReport;
import com.e2eq.hierarchy.core.HierarchyConfig;
import com.e2eq.hierarchy.core.HierarchyMaterializer;
import com.e2eq.hierarchy.core.HierarchyTraversal;
import com.e2eq.hierarchy.core.RelationStore;
import com.e2eq.hierarchy.model.AttributeBundle;
import com.e2eq.hierarchy.model.HierarchyDocument;
import io.quarkus.logging.Log;

import java.nio.file.Path;
import java.util.Map;

/**
 * File-to-file driver around the core: builds a hierarchy document from a relation snapshot,
 * and enriches a previously written document with attribute bundles.
 */
public final class HierarchyPipeline {

    private final RelationSnapshotLoader snapshotLoader;
    private final AttributeBundleLoader bundleLoader;
    private final HierarchyDocumentCodec codec;

    public HierarchyPipeline() {
        this(new RelationSnapshotLoader(), new AttributeBundleLoader(), new HierarchyDocumentCodec());
    }

    public HierarchyPipeline(RelationSnapshotLoader snapshotLoader, AttributeBundleLoader bundleLoader, HierarchyDocumentCodec codec) {
        this.snapshotLoader = snapshotLoader;
        this.bundleLoader = bundleLoader;
        this.codec = codec;
    }

    public HierarchyDocument build(Path snapshot, HierarchyConfig config, Path output) {
        RelationStore store = snapshotLoader.load(snapshot);
        HierarchyDocument document = new HierarchyMaterializer(config).materialize(store);
        codec.write(document, output);
        Log.infof("Written to %s", output);
        return document;
    }

    public EnrichmentReport enrich(Path hierarchy, Path bundles, Path output) {
        HierarchyDocument document = codec.read(hierarchy);
        Log.infof("Found %d unique items to enrich", HierarchyTraversal.collectIds(document.hierarchy()).size());

        Map<String, AttributeBundle> attributes = bundleLoader.load(bundles);
        EnrichmentReport report = EnrichmentMerger.mergeForest(document.hierarchy(), attributes);

        codec.write(document, output);
        Log.infof("Written to %s", output);
        return report;
    }
}

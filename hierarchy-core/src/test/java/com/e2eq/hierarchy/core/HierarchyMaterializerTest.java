package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.EntityRef;
import com.e2eq.hierarchy.model.HierarchyDocument;
import com.e2eq.hierarchy.model.HierarchyMetadata;
import com.e2eq.hierarchy.model.HierarchyNode;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyMaterializerTest {

    private static final List<String[]> SUBCLASS = List.of(
            new String[]{"Q2", "Q1"}, new String[]{"Q3", "Q1"}, new String[]{"Q4", "Q2"},
            new String[]{"Q8", "Q7"}, new String[]{"Q9", "Q8"}, new String[]{"Q7", "Q9"},
            new String[]{"Q10", "Q2"}, new String[]{"Q10", "Q7"});
    private static final List<String[]> INSTANCE = List.of(
            new String[]{"Q5", "Q4"}, new String[]{"Q6", "Q4"}, new String[]{"Q11", "Q10"},
            new String[]{"Q12", "Q5"});

    private static RelationStore store(long seed) {
        List<String[]> sub = new ArrayList<>(SUBCLASS);
        List<String[]> inst = new ArrayList<>(INSTANCE);
        Collections.shuffle(sub, new Random(seed));
        Collections.shuffle(inst, new Random(seed + 1));
        RelationStore store = new RelationStore();
        for (String[] e : sub) store.addSubclass(e[0], e[1]);
        for (String[] e : inst) store.addInstance(e[0], e[1]);
        store.putLabel("Q1", "device").putLabel("Q7", "material");
        return store;
    }

    @Test
    void testScenario() {
        RelationStore store = new RelationStore()
                .addSubclass("Q2", "Q1")
                .addSubclass("Q3", "Q1")
                .addSubclass("Q4", "Q2")
                .addInstance("Q5", "Q4");

        HierarchyDocument doc = new HierarchyMaterializer(new HierarchyConfig(List.of("Q1"), Set.of(), List.of()))
                .materialize(store);

        assertEquals(1, doc.hierarchy().size());
        HierarchyNode q1 = doc.hierarchy().get(0);
        assertEquals("Q1", q1.getId());
        assertEquals("Q2", q1.getSubclasses().get(0).getId());
        assertEquals("Q3", q1.getSubclasses().get(1).getId());
        HierarchyNode q4 = q1.getSubclasses().get(0).getSubclasses().get(0);
        assertEquals("Q4", q4.getId());
        assertEquals("Q5", q4.getInstances().get(0).getId());
    }

    @Test
    void testPruningScenario() {
        RelationStore store = new RelationStore()
                .addSubclass("Q2", "Q1")
                .addSubclass("Q3", "Q1")
                .addSubclass("Q4", "Q2")
                .addInstance("Q5", "Q4");

        HierarchyDocument doc = new HierarchyMaterializer(new HierarchyConfig(List.of("Q1"), Set.of(), List.of("Q2")))
                .materialize(store);

        HierarchyNode q1 = doc.hierarchy().get(0);
        assertEquals(1, q1.getSubclasses().size());
        assertEquals("Q3", q1.getSubclasses().get(0).getId());
        assertEquals(Set.of("Q1", "Q3"), HierarchyTraversal.collectIds(doc.hierarchy()));
    }

    @Test
    void testExcludedRootIsDropped() {
        HierarchyDocument doc = new HierarchyMaterializer(new HierarchyConfig(List.of(), Set.of(), List.of("Q1")))
                .materialize(store(1));

        assertTrue(doc.hierarchy().stream().noneMatch(n -> n.getId().equals("Q1")));
        assertEquals(doc.hierarchy().size(), doc.metadata().rootCount());
    }

    @Test
    void testDeterministicAcrossInsertionOrder() {
        HierarchyConfig config = new HierarchyConfig(List.of("Q1"), Set.of(), List.of("Q3"));
        String expected = HierarchyHasher.computeHash(new HierarchyMaterializer(config).materialize(store(0)).hierarchy());

        for (long seed = 1; seed < 10; seed++) {
            HierarchyDocument doc = new HierarchyMaterializer(config).materialize(store(seed));
            assertEquals(expected, HierarchyHasher.computeHash(doc.hierarchy()), "seed " + seed);
        }
    }

    @Test
    void testMetadataCounts() {
        RelationStore store = store(3).putLabel("Q3", "wood");
        HierarchyConfig config = new HierarchyConfig(List.of("Q1", "Q7"), Set.of(), List.of("Q3", "Q404"),
                false, "unit-test", Map.of("P1", "instance of"));

        HierarchyDocument doc = new HierarchyMaterializer(config).materialize(store);
        HierarchyMetadata meta = doc.metadata();

        assertEquals("unit-test", meta.source());
        assertEquals(2, meta.seedItems());
        assertEquals(12, meta.totalItemsDiscovered());
        assertEquals(8, meta.subclassRelationships());
        assertEquals(4, meta.instanceRelationships());
        assertEquals(doc.hierarchy().size(), meta.rootCount());
        assertEquals(HierarchyTraversal.countNodes(doc.hierarchy()), meta.nodeCount());
        assertEquals(List.of(new EntityRef("Q3", "wood"), new EntityRef("Q404", "Q404")), meta.manuallyExcluded());
        assertEquals(Map.of("P1", "instance of"), meta.propertiesUsed());
    }

    @Test
    void testSubclassCountExcludesDetachedEdges() {
        RelationStore store = new RelationStore()
                .addSubclass("Q1", "thing")
                .addSubclass("Q2", "Q1")
                .addSubclass("Q3", "Q1")
                .addInstance("Q5", "Q2");
        HierarchyConfig config = new HierarchyConfig(List.of(), Set.of("thing"), List.of());

        HierarchyMetadata meta = new HierarchyMaterializer(config).materialize(store).metadata();

        assertEquals(2, meta.subclassRelationships());
        assertEquals(1, meta.instanceRelationships());
        assertEquals(5, meta.totalItemsDiscovered());
        assertEquals(3, store.subclassEdgeCount());
    }

    @Test
    void testDeepChainHashes() {
        RelationStore store = new RelationStore();
        for (int i = 1; i <= 1500; i++) store.addSubclass("c" + i, "c" + (i - 1));

        HierarchyDocument doc = new HierarchyMaterializer(HierarchyConfig.empty()).materialize(store);

        assertEquals(1501, doc.metadata().nodeCount());
        assertEquals(64, HierarchyHasher.computeHash(doc.hierarchy()).length());
    }

    @Test
    void testSharedSubtreesProduceSameIdsAsReplication() {
        HierarchyConfig config = new HierarchyConfig(List.of("Q1"), Set.of(), List.of());
        HierarchyDocument replicated = new HierarchyMaterializer(config).materialize(store(2));
        HierarchyDocument shared = new HierarchyMaterializer(config.withShareSubtrees(true)).materialize(store(2));

        assertEquals(HierarchyTraversal.collectIds(replicated.hierarchy()), HierarchyTraversal.collectIds(shared.hierarchy()));
        assertEquals(replicated.hierarchy().size(), shared.hierarchy().size());
    }
}

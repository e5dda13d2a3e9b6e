package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.exceptions.MalformedEdgeException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class RelationStoreTest {

    @Test
    void testLabelDefaultsToIdentifier() {
        RelationStore store = new RelationStore().putLabel("Q1", "device");
        assertEquals("device", store.labelOf("Q1"));
        assertEquals("Q2", store.labelOf("Q2"));
    }

    @Test
    void testBlankLabelIsIgnored() {
        RelationStore store = new RelationStore().putLabel("Q1", "device").putLabel("Q1", " ");
        assertEquals("device", store.labelOf("Q1"));
        assertEquals("Q3", new RelationStore().putLabel("Q3", null).labelOf("Q3"));
    }

    @Test
    void testEdgesHaveSetSemantics() {
        RelationStore store = new RelationStore()
                .addSubclass("Q2", "Q1")
                .addSubclass("Q2", "Q1")
                .addInstance("Q5", "Q4")
                .addInstance("Q5", "Q4");

        assertEquals(1, store.subclassEdgeCount());
        assertEquals(1, store.instanceEdgeCount());
        assertEquals(Set.of("Q2"), store.childrenOf("Q1"));
        assertEquals(Set.of("Q1"), store.parentsOf("Q2"));
        assertEquals(Set.of("Q5"), store.instancesOf("Q4"));
        assertEquals(Set.of("Q4"), store.classesOf("Q5"));
    }

    @Test
    void testUnknownIdentifiersYieldEmptyResults() {
        RelationStore store = new RelationStore();
        assertTrue(store.childrenOf("nope").isEmpty());
        assertTrue(store.parentsOf("nope").isEmpty());
        assertTrue(store.instancesOf("nope").isEmpty());
        assertFalse(store.hasParent("nope"));
    }

    @Test
    void testSuperclassIsStoredAsSubclassEdge() {
        RelationStore store = new RelationStore().addSuperclass("Q1", "Q2");
        assertTrue(store.subclassEdges().contains(new RelationStore.Edge("Q2", "Q1")));
        assertEquals(Set.of("Q2"), store.childrenOf("Q1"));
    }

    @Test
    void testDetachChildrenRemovesEdgesIntoParent() {
        RelationStore store = new RelationStore()
                .addSubclass("Q2", "Q1")
                .addSubclass("Q3", "Q1")
                .addSubclass("Q3", "Q9");

        assertEquals(Set.of("Q2", "Q3"), store.detachChildren("Q1"));
        assertTrue(store.childrenOf("Q1").isEmpty());
        assertFalse(store.hasParent("Q2"));
        assertEquals(Set.of("Q9"), store.parentsOf("Q3"));
        assertEquals(1, store.subclassEdgeCount());
        assertTrue(store.detachChildren("Q1").isEmpty());
    }

    @Test
    void testCopyIsIndependent() {
        RelationStore store = new RelationStore().addSubclass("Q2", "Q1").putLabel("Q1", "device");
        RelationStore copy = store.copy();
        copy.detachChildren("Q1");

        assertEquals(Set.of("Q2"), store.childrenOf("Q1"));
        assertEquals("device", copy.labelOf("Q1"));
    }

    @Test
    void testMergeFromUnionsBatches() {
        RelationStore first = new RelationStore().addSubclass("Q2", "Q1").putLabel("Q1", "old");
        RelationStore second = new RelationStore().addSubclass("Q2", "Q1").addInstance("Q5", "Q2").putLabel("Q1", "device");

        first.mergeFrom(second);

        assertEquals(1, first.subclassEdgeCount());
        assertEquals(1, first.instanceEdgeCount());
        assertEquals("device", first.labelOf("Q1"));
        assertEquals(Set.of("Q1", "Q2", "Q5"), first.entityIds());
    }

    @Test
    void testMalformedEndpointFailsNamingTheEdge() {
        RelationStore store = new RelationStore();
        MalformedEdgeException ex = assertThrows(MalformedEdgeException.class,
                () -> store.addSubclass("Q 2", "Q1"));
        assertTrue(ex.getMessage().contains("subclassOf"));
        assertTrue(ex.getMessage().contains("'Q 2'"));
        assertEquals("Q1", ex.getTargetId());

        assertThrows(MalformedEdgeException.class, () -> store.addInstance(null, "Q1"));
        assertThrows(MalformedEdgeException.class, () -> store.addInstance("Q5", ""));
        assertEquals(0, store.subclassEdgeCount() + store.instanceEdgeCount());
    }
}

package com.e2eq.hierarchy.io;

import com.e2eq.hierarchy.core.RelationStore;
import com.e2eq.hierarchy.exceptions.MalformedEdgeException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RelationSnapshotLoaderTest {

    static Path fixture(String name) throws Exception {
        return Paths.get(RelationSnapshotLoaderTest.class.getResource("/fixtures/" + name).toURI());
    }

    private final RelationSnapshotLoader loader = new RelationSnapshotLoader();

    @Test
    void loadsJsonSnapshot() throws Exception {
        RelationStore store = loader.load(fixture("snapshot.json"));

        assertEquals(4, store.subclassEdgeCount());
        assertEquals(2, store.instanceEdgeCount());
        assertEquals(Set.of("Q2", "Q3"), store.childrenOf("Q1"));
        assertEquals("Gerät für Bühne", store.labelOf("Q6"));
        assertEquals("Q7", store.labelOf("Q7"));
    }

    @Test
    void loadsYamlSnapshot() throws Exception {
        RelationStore store = loader.load(fixture("snapshot.yaml"));

        assertEquals(Set.of("Q2"), store.childrenOf("Q1"));
        assertEquals(Set.of("Q5"), store.instancesOf("Q2"));
        assertEquals("device", store.labelOf("Q1"));
    }

    @Test
    void rejectsPairsWithWrongArity() throws Exception {
        Path bad = fixture("bad-snapshot.json");
        MalformedEdgeException ex = assertThrows(MalformedEdgeException.class, () -> loader.load(bad));
        assertTrue(ex.getMessage().contains("subclassOf"));
    }

    @Test
    void missingFileIsReported() {
        Path missing = Paths.get("does-not-exist.json");
        HierarchyIoException ex = assertThrows(HierarchyIoException.class, () -> loader.load(missing));
        assertEquals(missing, ex.getFile());
    }
}

package com.e2eq.hierarchy.runtime;

import com.e2eq.hierarchy.core.RelationStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyConfigProducerTest {

    @Test
    void producesConfigAndMaterializer() {
        HierarchyConfigProducer producer = new HierarchyConfigProducer("hierarchy/test-config.yaml");
        producer.init();

        assertEquals(List.of("Q1", "Q7"), producer.config().seeds());
        assertSame(producer.config(), producer.materializer().getConfig());

        RelationStore store = new RelationStore().addSubclass("Q2", "Q1").addSubclass("Q3", "Q1");
        assertEquals(List.of("Q2"), producer.materializer().materialize(store).hierarchy().get(0)
                .getSubclasses().stream().map(n -> n.getId()).toList());
    }

    @Test
    void missingResourceFailsFast() {
        HierarchyConfigProducer producer = new HierarchyConfigProducer("hierarchy/absent.yaml");
        IllegalStateException ex = assertThrows(IllegalStateException.class, producer::init);
        assertTrue(ex.getMessage().contains("hierarchy/absent.yaml"));
    }
}

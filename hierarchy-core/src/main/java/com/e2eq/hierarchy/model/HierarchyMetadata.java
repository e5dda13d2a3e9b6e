package com.e2eq.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Countable facts about one materialized forest, serialized next to it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"source", "seed_items", "total_items_discovered", "subclass_relationships",
        "instance_relationships", "root_count", "node_count", "manually_excluded", "properties_used"})
public record HierarchyMetadata(
        String source,
        @JsonProperty("seed_items") int seedItems,
        @JsonProperty("total_items_discovered") int totalItemsDiscovered,
        @JsonProperty("subclass_relationships") int subclassRelationships,
        @JsonProperty("instance_relationships") int instanceRelationships,
        @JsonProperty("root_count") int rootCount,
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("manually_excluded") List<EntityRef> manuallyExcluded,
        @JsonProperty("properties_used") Map<String, String> propertiesUsed
) {
    public HierarchyMetadata {
        manuallyExcluded = manuallyExcluded == null ? List.of() : List.copyOf(manuallyExcluded);
        propertiesUsed = propertiesUsed == null ? Map.of() : propertiesUsed;
    }
}

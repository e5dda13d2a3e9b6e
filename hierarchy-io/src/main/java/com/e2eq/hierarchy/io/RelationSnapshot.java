package com.e2eq.hierarchy.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Relations as delivered by the acquisition step: a label map and three lists of identifier pairs.
 * <ul>
 *   <li>{@code subclass_of}: {@code [child, parent]}</li>
 *   <li>{@code superclass_of}: {@code [parent, child]}</li>
 *   <li>{@code instance_of}: {@code [instance, class]}</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelationSnapshot(
        Map<String, String> labels,
        @JsonProperty("subclass_of") List<List<String>> subclassOf,
        @JsonProperty("superclass_of") List<List<String>> superclassOf,
        @JsonProperty("instance_of") List<List<String>> instanceOf
) {
    public RelationSnapshot {
        labels = labels == null ? Map.of() : labels;
        subclassOf = subclassOf == null ? List.of() : subclassOf;
        superclassOf = superclassOf == null ? List.of() : superclassOf;
        instanceOf = instanceOf == null ? List.of() : instanceOf;
    }
}

package com.e2eq.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * One entity in the materialized forest. Instance entries use the same shape: an instance may
 * carry its own instances and subclasses, and receives the enrichment attributes.
 * <p>
 * Empty lists and unset attributes are left out of the serialized form. {@code toString} leaves
 * the child lists out; {@code equals} and {@code hashCode} still compare whole subtrees.
 * </p>
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"id", "label", "note", "subclasses", "instances",
        "description", "used_in", "ieee_term", "exact_match", "thumbnail"})
public class HierarchyNode {

    public static final String CIRCULAR_REFERENCE = "circular reference";

    private String id;
    private String label;
    private String note;
    @ToString.Exclude
    private List<HierarchyNode> subclasses;
    @ToString.Exclude
    private List<HierarchyNode> instances;

    private String description;
    @JsonProperty("used_in")
    private List<EntityRef> usedIn;
    @JsonProperty("ieee_term")
    private List<String> ieeeTerm;
    @JsonProperty("exact_match")
    private List<String> exactMatch;
    private List<String> thumbnail;

    public HierarchyNode(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public static HierarchyNode circularReference(String id, String label) {
        HierarchyNode marker = new HierarchyNode(id, label);
        marker.setNote(CIRCULAR_REFERENCE);
        return marker;
    }

    @JsonIgnore
    public boolean isCircularReference() {
        return CIRCULAR_REFERENCE.equals(note);
    }

    public void addSubclass(HierarchyNode child) {
        if (subclasses == null) subclasses = new ArrayList<>();
        subclasses.add(child);
    }

    public void addInstance(HierarchyNode instance) {
        if (instances == null) instances = new ArrayList<>();
        instances.add(instance);
    }

    public boolean hasSubclasses() {
        return subclasses != null && !subclasses.isEmpty();
    }

    public boolean hasInstances() {
        return instances != null && !instances.isEmpty();
    }
}

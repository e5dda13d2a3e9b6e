package com.e2eq.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * A materialized forest together with its metadata block.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HierarchyDocument(List<HierarchyNode> hierarchy, HierarchyMetadata metadata) {
    public HierarchyDocument {
        hierarchy = hierarchy == null ? new ArrayList<>() : hierarchy;
    }
}

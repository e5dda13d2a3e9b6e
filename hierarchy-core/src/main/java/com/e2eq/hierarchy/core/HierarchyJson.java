package com.e2eq.hierarchy.core;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Jackson factories sized for materialized forests. Every tree level costs two nesting levels
 * in JSON (the node object and its {@code subclasses} array), so Jackson's default limit of
 * 1000 stops at roughly 500 levels.
 */
public final class HierarchyJson {
    private HierarchyJson() {}

    public static final int MAX_NESTING_DEPTH = 20_000;

    public static JsonFactory jsonFactory() {
        return JsonFactory.builder()
                .streamReadConstraints(readConstraints())
                .streamWriteConstraints(writeConstraints())
                .build();
    }

    public static YAMLFactory yamlFactory() {
        return YAMLFactory.builder()
                .streamReadConstraints(readConstraints())
                .streamWriteConstraints(writeConstraints())
                .build();
    }

    private static StreamReadConstraints readConstraints() {
        return StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build();
    }

    private static StreamWriteConstraints writeConstraints() {
        return StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build();
    }
}

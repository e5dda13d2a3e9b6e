package com.e2eq.hierarchy.model;

/**
 * An identifier with its display label, as used in {@code used_in} entries and in the
 * metadata's exclusion report.
 */
public record EntityRef(String id, String label) {
    public EntityRef {
        label = label == null ? "" : label;
    }
}

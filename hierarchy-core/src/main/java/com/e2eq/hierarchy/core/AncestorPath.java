package com.e2eq.hierarchy.core;

/**
 * Immutable list of the identifiers on the current expansion path, newest first.
 * Pushing returns a new path, so sibling branches never observe each other's ancestors.
 */
final class AncestorPath {
    static final AncestorPath EMPTY = new AncestorPath(null, null, 0);

    private final String id;
    private final AncestorPath parent;
    private final int depth;

    private AncestorPath(String id, AncestorPath parent, int depth) {
        this.id = id;
        this.parent = parent;
        this.depth = depth;
    }

    AncestorPath push(String next) {
        return new AncestorPath(next, this, depth + 1);
    }

    boolean contains(String candidate) {
        for (AncestorPath p = this; p.depth > 0; p = p.parent) {
            if (p.id.equals(candidate)) return true;
        }
        return false;
    }
}

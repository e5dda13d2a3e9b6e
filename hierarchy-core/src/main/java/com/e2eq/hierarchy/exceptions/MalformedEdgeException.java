package com.e2eq.hierarchy.exceptions;

/**
 * Thrown when a relation edge handed to the core has an endpoint that is not a
 * well-formed entity identifier.
 * <p>
 * Identifiers are opaque, but they must be non-blank and free of whitespace. Coercing a
 * malformed endpoint would silently attach nodes to the wrong place in the forest, so the
 * offending edge is reported instead.
 * </p>
 */
public class MalformedEdgeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String relation;
    private final String sourceId;
    private final String targetId;

    public MalformedEdgeException(String message) {
        super(message);
        this.relation = null;
        this.sourceId = null;
        this.targetId = null;
    }

    public MalformedEdgeException(String relation, String sourceId, String targetId) {
        super(buildMessage(relation, sourceId, targetId));
        this.relation = relation;
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    private static String buildMessage(String relation, String sourceId, String targetId) {
        return String.format(
            "Malformed %s edge (%s -> %s): endpoints must be non-blank identifiers without whitespace",
            relation, quote(sourceId), quote(targetId)
        );
    }

    private static String quote(String id) {
        return id == null ? "null" : "'" + id + "'";
    }

    /**
     * The relation kind of the rejected edge, e.g. {@code subclassOf}.
     */
    public String getRelation() {
        return relation;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }
}

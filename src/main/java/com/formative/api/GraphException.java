package com.formative.api;

import com.formative.graph.Edge;

/**
 * Raised when an edge assertion would make the causal graph structurally
 * invalid. The graph is left exactly as it was before the offending call.
 */
public final class GraphException extends CausalException {

    public enum Kind {
        SELF_LOOP, DUPLICATE_EDGE, CYCLE
    }

    private final Kind kind;
    private final Edge edge;

    public GraphException(Kind kind, Edge edge, String message) {
        super(message);
        this.kind = kind;
        this.edge = edge;
    }

    public Kind kind() {
        return kind;
    }

    /** The rejected edge. */
    public Edge edge() {
        return edge;
    }
}

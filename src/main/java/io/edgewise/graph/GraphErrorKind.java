package io.edgewise.graph;

public enum GraphErrorKind {
    UNKNOWN_VERTEX,
    DUPLICATE_VERTEX,
    UNKNOWN_EDGE,
    MALFORMED_INPUT,
    NOT_UNDIRECTED,
    DISCONNECTED,
    NO_PATH,
    NEGATIVE_WEIGHT,
    SELF_LOOP
}

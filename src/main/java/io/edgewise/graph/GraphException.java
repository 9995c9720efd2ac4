package io.edgewise.graph;

/**
 * Failure of a single graph operation. The graph an operation was applied to is left
 * exactly as it was before the call.
 */
public class GraphException extends Exception {
    private final GraphErrorKind kind;

    public GraphException(GraphErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GraphException(GraphErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GraphErrorKind getKind() {
        return kind;
    }

    public static GraphException unknownVertex(int vertexId) {
        return new GraphException(GraphErrorKind.UNKNOWN_VERTEX, "Vertex " + vertexId + " does not exist");
    }

    public static GraphException duplicateVertex(int vertexId) {
        return new GraphException(GraphErrorKind.DUPLICATE_VERTEX, "Vertex " + vertexId + " already exists");
    }

    public static GraphException unknownEdge(int sourceId, int destinationId) {
        return new GraphException(GraphErrorKind.UNKNOWN_EDGE,
                "No edge between " + sourceId + " and " + destinationId);
    }

    public static GraphException malformedInput(String message) {
        return new GraphException(GraphErrorKind.MALFORMED_INPUT, message);
    }

    public static GraphException malformedInput(String message, Throwable cause) {
        return new GraphException(GraphErrorKind.MALFORMED_INPUT, message, cause);
    }

    @Override
    public String toString() {
        return "GraphException{" +
                "kind=" + kind +
                ", message=" + getMessage() +
                '}';
    }
}

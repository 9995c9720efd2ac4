package io.edgewise.graph;

import java.util.List;
import java.util.OptionalDouble;

/**
 * In-memory graph store. Every mutation either applies completely or throws a
 * {@link GraphException} and leaves the graph untouched.
 */
public interface Graph {
    GraphMode getMode();

    boolean isDirected();

    int getNumberVertices();

    int getNumberEdges();

    boolean containsVertex(int vertexId);

    Graph addVertex(int vertexId) throws GraphException;

    Graph removeVertex(int vertexId) throws GraphException;

    Graph addEdge(int sourceId, int destinationId) throws GraphException;

    /**
     * Inserts the edge, or replaces the weight of the existing edge between the same
     * pair (unordered for undirected graphs). A replaced edge keeps its listing position.
     */
    Graph addEdge(int sourceId, int destinationId, double weight) throws GraphException;

    Graph removeEdge(int sourceId, int destinationId) throws GraphException;

    boolean hasEdge(int sourceId, int destinationId);

    OptionalDouble getWeight(int sourceId, int destinationId);

    // ascending
    int[] listVertices();

    // insertion order
    List<Edge> listEdges();

    /**
     * Edges incident to the vertex; for directed graphs only the arcs leaving it.
     */
    List<Edge> listEdges(int vertexId) throws GraphException;

    Edge getEdge(int edgeId);

    /**
     * Ids of the edges a traversal may follow out of the vertex, in listing order.
     * Undirected graphs report every incident edge.
     */
    int[] getOutgoingEdgeIds(int vertexId);

    /**
     * Ids of the edges a traversal may follow into the vertex, in listing order.
     * Undirected graphs report every incident edge.
     */
    int[] getIncomingEdgeIds(int vertexId);
}

package io.edgewise.graph;

public interface VertexNeighbourhood {
    // edge ids, ascending
    int[] getOutgoingEdges();
    int[] getIncomingEdges();

    // -1 when there is no such edge
    int getOutgoingEdge(int neighbourVertexId);
    int getIncomingEdge(int neighbourVertexId);

    void addOutgoingEdge(int neighbourVertexId, int edgeId);
    void addIncomingEdge(int neighbourVertexId, int edgeId);

    void removeOutgoingEdge(int neighbourVertexId);
    void removeIncomingEdge(int neighbourVertexId);
}

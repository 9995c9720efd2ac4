package io.edgewise.graph;

import com.google.common.base.Preconditions;

public abstract class AbstractGraph implements Graph {
    protected final GraphMode mode;

    protected int numVertices; // no default
    protected int numEdges; // no default

    protected AbstractGraph(GraphMode mode) {
        this.mode = Preconditions.checkNotNull(mode, "mode");
    }

    @Override
    public GraphMode getMode() {
        return mode;
    }

    @Override
    public boolean isDirected() {
        return mode == GraphMode.DIRECTED;
    }

    @Override
    public int getNumberVertices() {
        return numVertices;
    }

    @Override
    public int getNumberEdges() {
        return numEdges;
    }

    @Override
    public Graph addEdge(int sourceId, int destinationId) throws GraphException {
        return addEdge(sourceId, destinationId, Edge.DEFAULT_WEIGHT);
    }

    protected void checkVertexId(int vertexId) throws GraphException {
        if (vertexId < 0) {
            throw GraphException.malformedInput("Vertex ids must be non-negative, got " + vertexId);
        }
    }

    protected void checkWeight(double weight) throws GraphException {
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw GraphException.malformedInput("Edge weight must be a finite number, got " + weight);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "mode=" + mode +
                ", numVertices=" + numVertices +
                ", numEdges=" + numEdges +
                '}';
    }
}

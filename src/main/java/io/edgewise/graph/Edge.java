package io.edgewise.graph;

public class Edge {
    public static final int DEFAULT_EDGE_ID = -1;
    public static final double DEFAULT_WEIGHT = 1.0;

    private final int edgeId;
    private final int sourceVertexId;
    private final int destinationVertexId;
    private final double weight;

    public Edge(int sourceVertexId, int destinationVertexId) {
        this(DEFAULT_EDGE_ID, sourceVertexId, destinationVertexId, DEFAULT_WEIGHT);
    }

    public Edge(int sourceVertexId, int destinationVertexId, double weight) {
        this(DEFAULT_EDGE_ID, sourceVertexId, destinationVertexId, weight);
    }

    public Edge(int edgeId, int sourceVertexId, int destinationVertexId, double weight) {
        this.edgeId = edgeId;
        this.sourceVertexId = sourceVertexId;
        this.destinationVertexId = destinationVertexId;
        this.weight = weight;
    }

    /**
     * Position of this edge in the owning graph's edge listing.
     */
    public int getEdgeId() {
        return edgeId;
    }

    public int getSourceId() {
        return sourceVertexId;
    }

    public int getDestinationId() {
        return destinationVertexId;
    }

    public double getWeight() {
        return weight;
    }

    Edge withWeight(double newWeight) {
        return new Edge(edgeId, sourceVertexId, destinationVertexId, newWeight);
    }

    public boolean hasVertex(int vertexId) {
        return sourceVertexId == vertexId || destinationVertexId == vertexId;
    }

    /**
     * @param vertexId one of the endpoints of this edge
     * @return the endpoint that is not {@code vertexId}
     */
    public int getOtherEnd(int vertexId) {
        return sourceVertexId == vertexId ? destinationVertexId : sourceVertexId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Edge edge = (Edge) o;

        if (edgeId != edge.edgeId) return false;
        if (sourceVertexId != edge.sourceVertexId) return false;
        if (destinationVertexId != edge.destinationVertexId) return false;
        return Double.compare(weight, edge.weight) == 0;
    }

    @Override
    public int hashCode() {
        int result = edgeId;
        result = 31 * result + sourceVertexId;
        result = 31 * result + destinationVertexId;
        long bits = Double.doubleToLongBits(weight);
        result = 31 * result + (int) (bits ^ (bits >>> 32));
        return result;
    }

    @Override
    public String toString() {
        return "Edge{" +
                "edgeId=" + edgeId +
                ", sourceVertexId=" + sourceVertexId +
                ", destinationVertexId=" + destinationVertexId +
                ", weight=" + weight +
                '}';
    }
}

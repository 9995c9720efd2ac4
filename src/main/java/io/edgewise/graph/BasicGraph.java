package io.edgewise.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.koloboke.collect.map.hash.HashIntObjMap;
import com.koloboke.collect.map.hash.HashIntObjMaps;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Adjacency-map graph store. Vertices map to a {@link VertexNeighbourhood} holding, per
 * neighbour, the id of the connecting edge. Edges live in an id-indexed array; ids are
 * handed out in insertion order and never reused, which gives {@link #listEdges()} its
 * stable ordering.
 */
public class BasicGraph extends AbstractGraph {
    protected static final int INITIAL_ARRAY_SIZE = 16;

    protected Edge[] edgeIndexF;
    protected int nextEdgeId;

    protected HashIntObjMap<VertexNeighbourhood> vertexNeighbourhoods;

    public BasicGraph(GraphMode mode) {
        super(mode);
        reset();
    }

    public static BasicGraph create(GraphMode mode) {
        return new BasicGraph(mode);
    }

    /**
     * @return a graph with vertices {@code 0..size-1} and no edges
     */
    public static BasicGraph create(GraphMode mode, int size) throws GraphException {
        if (size < 0) {
            throw GraphException.malformedInput("Vertex count must be non-negative, got " + size);
        }

        BasicGraph graph = new BasicGraph(mode);

        for (int vertexId = 0; vertexId < size; ++vertexId) {
            graph.addVertex(vertexId);
        }

        return graph;
    }

    /**
     * Builds a graph with vertices {@code 0..vertexCount-1} and the given edges, applied in
     * sequence so that a repeated pair keeps the weight of its last definition. Endpoints
     * outside the declared range are rejected.
     */
    public static BasicGraph load(GraphMode mode, int vertexCount, List<EdgeDefinition> edges)
            throws GraphException {
        Preconditions.checkNotNull(edges, "edges");

        BasicGraph graph = create(mode, vertexCount);
        graph.ensureCanStoreNewEdges(edges.size());

        int position = 0;
        for (EdgeDefinition definition : edges) {
            ++position;

            int sourceId = definition.getSourceId();
            int destinationId = definition.getDestinationId();

            if (sourceId < 0 || sourceId >= vertexCount || destinationId < 0 || destinationId >= vertexCount) {
                throw GraphException.malformedInput("Edge #" + position + " " + definition
                        + " references a vertex outside 0.." + (vertexCount - 1));
            }

            graph.addEdge(sourceId, destinationId, definition.getWeight());
        }

        return graph;
    }

    protected void reset() {
        numVertices = 0;
        numEdges = 0;
        nextEdgeId = 0;
        edgeIndexF = null;
        vertexNeighbourhoods = HashIntObjMaps.newMutableMap();
    }

    private void ensureCanStoreNewEdges(int numEdgesToAdd) {
        if (edgeIndexF == null) {
            edgeIndexF = new Edge[Math.max(numEdgesToAdd, INITIAL_ARRAY_SIZE)];
        } else if (edgeIndexF.length < nextEdgeId + numEdgesToAdd) {
            int targetSize = nextEdgeId + numEdgesToAdd;
            edgeIndexF = Arrays.copyOf(edgeIndexF, getSizeWithPaddingWithoutOverflow(targetSize, edgeIndexF.length));
        }
    }

    protected void ensureCanStoreNewEdge() {
        ensureCanStoreNewEdges(1);
    }

    private int getSizeWithPaddingWithoutOverflow(int targetSize, int currentSize) {
        if (currentSize > targetSize) {
            return currentSize;
        }

        int sizeWithPadding = Math.max(currentSize, 1);

        while (true) {
            int previousSizeWithPadding = sizeWithPadding;

            // Multiply by 2
            sizeWithPadding <<= 1;

            // If we saw an overflow, return simple targetSize
            if (previousSizeWithPadding > sizeWithPadding) {
                return targetSize;
            }

            if (sizeWithPadding >= targetSize) {
                return sizeWithPadding;
            }
        }
    }

    @Override
    public boolean containsVertex(int vertexId) {
        return vertexNeighbourhoods.containsKey(vertexId);
    }

    @Override
    public Graph addVertex(int vertexId) throws GraphException {
        checkVertexId(vertexId);

        if (containsVertex(vertexId)) {
            throw GraphException.duplicateVertex(vertexId);
        }

        vertexNeighbourhoods.put(vertexId, createVertexNeighbourhood());
        ++numVertices;

        return this;
    }

    @Override
    public Graph removeVertex(int vertexId) throws GraphException {
        VertexNeighbourhood vertexNeighbourhood = getExistingNeighbourhood(vertexId);

        for (int edgeId : vertexNeighbourhood.getOutgoingEdges()) {
            removeEdgeById(edgeId);
        }

        for (int edgeId : vertexNeighbourhood.getIncomingEdges()) {
            removeEdgeById(edgeId);
        }

        vertexNeighbourhoods.remove(vertexId);
        --numVertices;

        return this;
    }

    @Override
    public Graph addEdge(int sourceId, int destinationId, double weight) throws GraphException {
        VertexNeighbourhood sourceNeighbourhood = getExistingNeighbourhood(sourceId);
        VertexNeighbourhood destinationNeighbourhood = getExistingNeighbourhood(destinationId);

        if (sourceId == destinationId) {
            throw new GraphException(GraphErrorKind.SELF_LOOP,
                    "Self loops are not supported (vertex " + sourceId + ")");
        }

        checkWeight(weight);

        int existingEdgeId = findEdgeId(sourceId, destinationId);

        if (existingEdgeId >= 0) {
            edgeIndexF[existingEdgeId] = edgeIndexF[existingEdgeId].withWeight(weight);
            return this;
        }

        ensureCanStoreNewEdge();

        int edgeId = nextEdgeId++;
        edgeIndexF[edgeId] = new Edge(edgeId, sourceId, destinationId, weight);
        sourceNeighbourhood.addOutgoingEdge(destinationId, edgeId);
        destinationNeighbourhood.addIncomingEdge(sourceId, edgeId);
        ++numEdges;

        return this;
    }

    @Override
    public Graph removeEdge(int sourceId, int destinationId) throws GraphException {
        int edgeId = findEdgeId(sourceId, destinationId);

        if (edgeId < 0) {
            throw GraphException.unknownEdge(sourceId, destinationId);
        }

        removeEdgeById(edgeId);

        return this;
    }

    private void removeEdgeById(int edgeId) {
        Edge edge = edgeIndexF[edgeId];

        if (edge == null) {
            // already gone, e.g. an undirected edge seen from both of its maps
            return;
        }

        vertexNeighbourhoods.get(edge.getSourceId()).removeOutgoingEdge(edge.getDestinationId());
        vertexNeighbourhoods.get(edge.getDestinationId()).removeIncomingEdge(edge.getSourceId());
        edgeIndexF[edgeId] = null;
        --numEdges;
    }

    /**
     * @return id of the edge for the pair, or -1 if there is none
     */
    protected int findEdgeId(int sourceId, int destinationId) {
        VertexNeighbourhood sourceNeighbourhood = vertexNeighbourhoods.get(sourceId);

        if (sourceNeighbourhood == null) {
            return -1;
        }

        int edgeId = sourceNeighbourhood.getOutgoingEdge(destinationId);

        if (edgeId < 0 && !isDirected()) {
            edgeId = sourceNeighbourhood.getIncomingEdge(destinationId);
        }

        return edgeId;
    }

    @Override
    public boolean hasEdge(int sourceId, int destinationId) {
        return findEdgeId(sourceId, destinationId) >= 0;
    }

    @Override
    public OptionalDouble getWeight(int sourceId, int destinationId) {
        int edgeId = findEdgeId(sourceId, destinationId);

        if (edgeId < 0) {
            return OptionalDouble.empty();
        }

        return OptionalDouble.of(edgeIndexF[edgeId].getWeight());
    }

    @Override
    public int[] listVertices() {
        int[] vertexIds = vertexNeighbourhoods.keySet().toIntArray();
        Arrays.sort(vertexIds);
        return vertexIds;
    }

    @Override
    public List<Edge> listEdges() {
        ImmutableList.Builder<Edge> edges = ImmutableList.builder();

        for (int edgeId = 0; edgeId < nextEdgeId; ++edgeId) {
            Edge edge = edgeIndexF[edgeId];

            if (edge != null) {
                edges.add(edge);
            }
        }

        return edges.build();
    }

    @Override
    public List<Edge> listEdges(int vertexId) throws GraphException {
        getExistingNeighbourhood(vertexId);

        ImmutableList.Builder<Edge> edges = ImmutableList.builder();

        for (int edgeId : getOutgoingEdgeIds(vertexId)) {
            edges.add(edgeIndexF[edgeId]);
        }

        return edges.build();
    }

    @Override
    public Edge getEdge(int edgeId) {
        if (edgeId < 0 || edgeId >= nextEdgeId) {
            return null;
        }

        return edgeIndexF[edgeId];
    }

    @Override
    public int[] getOutgoingEdgeIds(int vertexId) {
        VertexNeighbourhood vertexNeighbourhood = vertexNeighbourhoods.get(vertexId);

        if (vertexNeighbourhood == null) {
            return new int[0];
        }

        if (isDirected()) {
            return vertexNeighbourhood.getOutgoingEdges();
        }

        return getAllEdgeIds(vertexNeighbourhood);
    }

    @Override
    public int[] getIncomingEdgeIds(int vertexId) {
        VertexNeighbourhood vertexNeighbourhood = vertexNeighbourhoods.get(vertexId);

        if (vertexNeighbourhood == null) {
            return new int[0];
        }

        if (isDirected()) {
            return vertexNeighbourhood.getIncomingEdges();
        }

        return getAllEdgeIds(vertexNeighbourhood);
    }

    private static int[] getAllEdgeIds(VertexNeighbourhood vertexNeighbourhood) {
        int[] outgoing = vertexNeighbourhood.getOutgoingEdges();
        int[] incoming = vertexNeighbourhood.getIncomingEdges();

        int[] all = Arrays.copyOf(outgoing, outgoing.length + incoming.length);
        System.arraycopy(incoming, 0, all, outgoing.length, incoming.length);
        Arrays.sort(all);

        return all;
    }

    private VertexNeighbourhood getExistingNeighbourhood(int vertexId) throws GraphException {
        VertexNeighbourhood vertexNeighbourhood = vertexNeighbourhoods.get(vertexId);

        if (vertexNeighbourhood == null) {
            throw GraphException.unknownVertex(vertexId);
        }

        return vertexNeighbourhood;
    }

    protected VertexNeighbourhood createVertexNeighbourhood() {
        return new BasicVertexNeighbourhood();
    }
}

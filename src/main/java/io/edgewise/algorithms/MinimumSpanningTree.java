package io.edgewise.algorithms;

import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;
import io.edgewise.graph.Edge;
import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphErrorKind;
import io.edgewise.graph.GraphException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Prim's algorithm. Candidate edges are taken by weight, then by listing order.
 */
public final class MinimumSpanningTree {
    private static final Comparator<Edge> CANDIDATE_ORDER =
            Comparator.comparingDouble(Edge::getWeight).thenComparingInt(Edge::getEdgeId);

    private MinimumSpanningTree() {
    }

    public static SpanningTree mst(Graph graph, int start) throws GraphException {
        if (graph.isDirected()) {
            throw new GraphException(GraphErrorKind.NOT_UNDIRECTED,
                    "A minimum spanning tree needs an undirected graph");
        }

        if (!graph.containsVertex(start)) {
            throw GraphException.unknownVertex(start);
        }

        int targetSize = graph.getNumberVertices();

        HashIntSet inTree = HashIntSets.newMutableSet();
        List<Edge> treeEdges = new ArrayList<>();
        PriorityQueue<Edge> candidates = new PriorityQueue<>(CANDIDATE_ORDER);

        inTree.add(start);
        addCandidates(graph, start, inTree, candidates);

        while (!candidates.isEmpty() && inTree.size() < targetSize) {
            Edge candidate = candidates.poll();

            boolean sourceIn = inTree.contains(candidate.getSourceId());
            boolean destinationIn = inTree.contains(candidate.getDestinationId());

            if (sourceIn && destinationIn) {
                continue;
            }

            int from = sourceIn ? candidate.getSourceId() : candidate.getDestinationId();
            int added = candidate.getOtherEnd(from);

            treeEdges.add(new Edge(candidate.getEdgeId(), from, added, candidate.getWeight()));
            inTree.add(added);
            addCandidates(graph, added, inTree, candidates);
        }

        if (inTree.size() < targetSize) {
            throw new GraphException(GraphErrorKind.DISCONNECTED,
                    "Graph is disconnected: only " + inTree.size() + " of " + targetSize
                            + " vertices are reachable from " + start);
        }

        return new SpanningTree(start, treeEdges);
    }

    private static void addCandidates(Graph graph, int vertexId, HashIntSet inTree, PriorityQueue<Edge> candidates) {
        for (int edgeId : graph.getOutgoingEdgeIds(vertexId)) {
            Edge edge = graph.getEdge(edgeId);

            if (!inTree.contains(edge.getOtherEnd(vertexId))) {
                candidates.add(edge);
            }
        }
    }
}

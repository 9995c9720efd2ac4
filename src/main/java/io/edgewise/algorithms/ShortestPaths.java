package io.edgewise.algorithms;

import com.koloboke.collect.map.IntDoubleMap;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntDoubleMaps;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;
import io.edgewise.graph.Edge;
import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphErrorKind;
import io.edgewise.graph.GraphException;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Dijkstra over a binary heap. Neighbours are relaxed in edge listing order and only a
 * strictly shorter distance replaces a tentative one, so among equally short paths the
 * one discovered first wins. Heap ties are broken by insertion order.
 */
public final class ShortestPaths {
    private static final int NO_TARGET = -1;

    private ShortestPaths() {
    }

    public static Path shortestPath(Graph graph, int source, int target) throws GraphException {
        checkVertex(graph, source);
        checkVertex(graph, target);
        checkNonNegativeWeights(graph);

        if (source == target) {
            return new Path(new int[]{source}, 0.0);
        }

        DistanceTable table = run(graph, source, target);

        return table.pathTo(target);
    }

    public static DistanceTable distances(Graph graph, int source) throws GraphException {
        checkVertex(graph, source);
        checkNonNegativeWeights(graph);

        return run(graph, source, NO_TARGET);
    }

    private static DistanceTable run(Graph graph, int source, int target) {
        IntDoubleMap distances = HashIntDoubleMaps.newMutableMap();
        IntIntMap predecessors = HashIntIntMaps.getDefaultFactory().withDefaultValue(-1).newMutableMap();
        HashIntSet settled = HashIntSets.newMutableSet();

        PriorityQueue<QueueEntry> queue = new PriorityQueue<>(
                Comparator.comparingDouble(QueueEntry::getDistance).thenComparingLong(QueueEntry::getSequence));
        long sequence = 0;

        distances.put(source, 0.0);
        queue.add(new QueueEntry(source, 0.0, sequence++));

        while (!queue.isEmpty()) {
            QueueEntry current = queue.poll();
            int vertexId = current.getVertexId();

            if (!settled.add(vertexId)) {
                continue;
            }

            if (vertexId == target) {
                break;
            }

            for (int edgeId : graph.getOutgoingEdgeIds(vertexId)) {
                Edge edge = graph.getEdge(edgeId);
                int neighbourId = edge.getOtherEnd(vertexId);

                if (settled.contains(neighbourId)) {
                    continue;
                }

                double candidate = current.getDistance() + edge.getWeight();

                if (candidate < distances.getOrDefault(neighbourId, Double.POSITIVE_INFINITY)) {
                    distances.put(neighbourId, candidate);
                    predecessors.put(neighbourId, vertexId);
                    queue.add(new QueueEntry(neighbourId, candidate, sequence++));
                }
            }
        }

        return new DistanceTable(source, distances, predecessors);
    }

    private static void checkVertex(Graph graph, int vertexId) throws GraphException {
        if (!graph.containsVertex(vertexId)) {
            throw GraphException.unknownVertex(vertexId);
        }
    }

    private static void checkNonNegativeWeights(Graph graph) throws GraphException {
        for (Edge edge : graph.listEdges()) {
            if (edge.getWeight() < 0) {
                throw new GraphException(GraphErrorKind.NEGATIVE_WEIGHT,
                        "Edge " + edge.getSourceId() + " -> " + edge.getDestinationId() + " has negative weight "
                                + edge.getWeight() + "; shortest paths need non-negative weights");
            }
        }
    }

    private static final class QueueEntry {
        private final int vertexId;
        private final double distance;
        private final long sequence;

        private QueueEntry(int vertexId, double distance, long sequence) {
            this.vertexId = vertexId;
            this.distance = distance;
            this.sequence = sequence;
        }

        int getVertexId() {
            return vertexId;
        }

        double getDistance() {
            return distance;
        }

        long getSequence() {
            return sequence;
        }
    }
}

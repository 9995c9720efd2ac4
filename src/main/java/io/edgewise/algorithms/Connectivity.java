package io.edgewise.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;
import io.edgewise.graph.Edge;
import io.edgewise.graph.Graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Connectivity test and component enumeration under a fixed {@link ConnectivityPolicy}.
 * <p/>
 * Components come back with their members in ascending order, and ordered among
 * themselves by the vertex from which a scan in ascending id order first reaches them,
 * which is always their smallest member.
 */
public class Connectivity {
    private final ConnectivityPolicy policy;

    public Connectivity() {
        this(ConnectivityPolicy.WEAK);
    }

    public Connectivity(ConnectivityPolicy policy) {
        this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    public ConnectivityPolicy getPolicy() {
        return policy;
    }

    /**
     * The graph without vertices counts as connected.
     */
    public boolean isConnected(Graph graph) {
        int[] vertices = graph.listVertices();

        if (vertices.length == 0) {
            return true;
        }

        int root = vertices[0];

        if (policy == ConnectivityPolicy.STRONG && graph.isDirected()) {
            return reach(graph, root, true, false).size() == vertices.length
                    && reach(graph, root, false, true).size() == vertices.length;
        }

        return reach(graph, root, true, true).size() == vertices.length;
    }

    public List<List<Integer>> components(Graph graph) {
        if (policy == ConnectivityPolicy.STRONG && graph.isDirected()) {
            return strongComponents(graph);
        }

        return weakComponents(graph);
    }

    private List<List<Integer>> weakComponents(Graph graph) {
        ImmutableList.Builder<List<Integer>> components = ImmutableList.builder();
        HashIntSet visited = HashIntSets.newMutableSet();

        for (int vertexId : graph.listVertices()) {
            if (visited.contains(vertexId)) {
                continue;
            }

            HashIntSet component = reach(graph, vertexId, true, true);
            visited.addAll(component);
            components.add(sortedMembers(component.toIntArray()));
        }

        return components.build();
    }

    /**
     * Kosaraju: finishing order over forward edges, then sweeps over reversed edges in
     * reverse finishing order.
     */
    private List<List<Integer>> strongComponents(Graph graph) {
        int[] finishOrder = finishOrder(graph);

        HashIntSet assigned = HashIntSets.newMutableSet();
        List<List<Integer>> components = new ArrayList<>();

        for (int i = finishOrder.length - 1; i >= 0; --i) {
            int root = finishOrder[i];

            if (assigned.contains(root)) {
                continue;
            }

            List<Integer> members = new ArrayList<>();
            Deque<Integer> pending = new ArrayDeque<>();
            pending.push(root);
            assigned.add(root);

            while (!pending.isEmpty()) {
                int vertexId = pending.pop();
                members.add(vertexId);

                for (int edgeId : graph.getIncomingEdgeIds(vertexId)) {
                    int neighbourId = graph.getEdge(edgeId).getOtherEnd(vertexId);

                    if (assigned.add(neighbourId)) {
                        pending.push(neighbourId);
                    }
                }
            }

            components.add(sortedMembers(Ints.toArray(members)));
        }

        components.sort(Comparator.comparing(component -> component.get(0)));

        return ImmutableList.copyOf(components);
    }

    private static int[] finishOrder(Graph graph) {
        int[] vertices = graph.listVertices();
        int[] order = new int[vertices.length];
        int finished = 0;

        HashIntSet visited = HashIntSets.newMutableSet();
        Deque<Frame> stack = new ArrayDeque<>();

        for (int root : vertices) {
            if (!visited.add(root)) {
                continue;
            }

            stack.push(new Frame(root, graph.getOutgoingEdgeIds(root)));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();

                if (frame.next < frame.edgeIds.length) {
                    Edge edge = graph.getEdge(frame.edgeIds[frame.next++]);
                    int neighbourId = edge.getOtherEnd(frame.vertexId);

                    if (visited.add(neighbourId)) {
                        stack.push(new Frame(neighbourId, graph.getOutgoingEdgeIds(neighbourId)));
                    }
                } else {
                    stack.pop();
                    order[finished++] = frame.vertexId;
                }
            }
        }

        return order;
    }

    /**
     * Breadth-first search from {@code root} following outgoing and/or incoming edges.
     */
    private static HashIntSet reach(Graph graph, int root, boolean forward, boolean backward) {
        HashIntSet reached = HashIntSets.newMutableSet();
        Deque<Integer> queue = new ArrayDeque<>();

        reached.add(root);
        queue.add(root);

        while (!queue.isEmpty()) {
            int vertexId = queue.poll();

            if (forward) {
                enqueueNeighbours(graph, vertexId, graph.getOutgoingEdgeIds(vertexId), reached, queue);
            }

            if (backward) {
                enqueueNeighbours(graph, vertexId, graph.getIncomingEdgeIds(vertexId), reached, queue);
            }
        }

        return reached;
    }

    private static void enqueueNeighbours(Graph graph, int vertexId, int[] edgeIds,
                                          HashIntSet reached, Deque<Integer> queue) {
        for (int edgeId : edgeIds) {
            int neighbourId = graph.getEdge(edgeId).getOtherEnd(vertexId);

            if (reached.add(neighbourId)) {
                queue.add(neighbourId);
            }
        }
    }

    private static List<Integer> sortedMembers(int[] members) {
        Arrays.sort(members);
        return ImmutableList.copyOf(Ints.asList(members));
    }

    private static final class Frame {
        private final int vertexId;
        private final int[] edgeIds;
        private int next;

        private Frame(int vertexId, int[] edgeIds) {
            this.vertexId = vertexId;
            this.edgeIds = edgeIds;
        }
    }
}

package io.edgewise.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.edgewise.graph.Edge;

import java.util.List;

/**
 * Edges of a spanning tree in the order they were added, each oriented from the vertex
 * already in the tree to the vertex it brought in.
 */
public final class SpanningTree {
    private final int root;
    private final List<Edge> edges;
    private final double totalWeight;

    SpanningTree(int root, List<Edge> edges) {
        this.root = root;
        this.edges = ImmutableList.copyOf(edges);

        double sum = 0.0;
        for (Edge edge : this.edges) {
            sum += edge.getWeight();
        }
        this.totalWeight = sum;
    }

    public int getRoot() {
        return root;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public int getNumberEdges() {
        return edges.size();
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    /**
     * @param stepNumber 1-based
     */
    public Edge getStep(int stepNumber) {
        Preconditions.checkElementIndex(stepNumber - 1, edges.size(), "stepNumber");
        return edges.get(stepNumber - 1);
    }

    @Override
    public String toString() {
        return "SpanningTree{" +
                "root=" + root +
                ", edges=" + edges +
                ", totalWeight=" + totalWeight +
                '}';
    }
}

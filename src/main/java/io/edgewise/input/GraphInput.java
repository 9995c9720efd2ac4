package io.edgewise.input;

import com.google.common.collect.ImmutableList;
import io.edgewise.graph.EdgeDefinition;

import java.util.List;

/**
 * Declared vertex count plus the edge lines of a graph file, in file order.
 */
public final class GraphInput {
    private final int vertexCount;
    private final List<EdgeDefinition> edges;

    public GraphInput(int vertexCount, List<EdgeDefinition> edges) {
        this.vertexCount = vertexCount;
        this.edges = ImmutableList.copyOf(edges);
    }

    public int getVertexCount() {
        return vertexCount;
    }

    public List<EdgeDefinition> getEdges() {
        return edges;
    }

    @Override
    public String toString() {
        return "GraphInput{" +
                "vertexCount=" + vertexCount +
                ", edges=" + edges +
                '}';
    }
}

package io.edgewise.algorithms;

import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphMode;

/**
 * Overview of a graph: mode, sizes and connectivity under one policy.
 */
public final class GraphSummary {
    private final GraphMode mode;
    private final int numberVertices;
    private final int numberEdges;
    private final boolean connected;
    private final int numberComponents;
    private final ConnectivityPolicy policy;

    private GraphSummary(GraphMode mode, int numberVertices, int numberEdges, boolean connected,
                         int numberComponents, ConnectivityPolicy policy) {
        this.mode = mode;
        this.numberVertices = numberVertices;
        this.numberEdges = numberEdges;
        this.connected = connected;
        this.numberComponents = numberComponents;
        this.policy = policy;
    }

    public static GraphSummary of(Graph graph, Connectivity connectivity) {
        return new GraphSummary(
                graph.getMode(),
                graph.getNumberVertices(),
                graph.getNumberEdges(),
                connectivity.isConnected(graph),
                connectivity.components(graph).size(),
                connectivity.getPolicy());
    }

    public GraphMode getMode() {
        return mode;
    }

    public int getNumberVertices() {
        return numberVertices;
    }

    public int getNumberEdges() {
        return numberEdges;
    }

    public boolean isConnected() {
        return connected;
    }

    public int getNumberComponents() {
        return numberComponents;
    }

    public ConnectivityPolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return "GraphSummary{" +
                "mode=" + mode +
                ", numberVertices=" + numberVertices +
                ", numberEdges=" + numberEdges +
                ", connected=" + connected +
                ", numberComponents=" + numberComponents +
                ", policy=" + policy +
                '}';
    }
}

package io.edgewise.algorithms;

import io.edgewise.graph.BasicGraph;
import io.edgewise.graph.Edge;
import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphErrorKind;
import io.edgewise.graph.GraphException;
import io.edgewise.graph.GraphMode;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class MinimumSpanningTreeTest {
    private static final double DELTA = 1e-9;

    private static Graph weighted() throws GraphException {
        return BasicGraph.create(GraphMode.UNDIRECTED, 5)
                .addEdge(0, 1, 4)
                .addEdge(0, 2, 1)
                .addEdge(1, 2, 2.5)
                .addEdge(1, 3, 5.9)
                .addEdge(2, 3, 4.1)
                .addEdge(2, 4, 10)
                .addEdge(3, 4, 2);
    }

    private static void assertStep(Edge step, int from, int to, double weight) {
        assertEquals(step.getSourceId(), from, "from of " + step);
        assertEquals(step.getDestinationId(), to, "to of " + step);
        assertEquals(step.getWeight(), weight, DELTA);
    }

    @Test
    public void testPrimSteps() throws Exception {
        SpanningTree tree = MinimumSpanningTree.mst(weighted(), 0);

        assertEquals(tree.getRoot(), 0);
        assertEquals(tree.getNumberEdges(), 4);
        assertStep(tree.getStep(1), 0, 2, 1.0);
        assertStep(tree.getStep(2), 2, 1, 2.5);
        assertStep(tree.getStep(3), 2, 3, 4.1);
        assertStep(tree.getStep(4), 3, 4, 2.0);
        assertEquals(tree.getTotalWeight(), 9.6, DELTA);
    }

    @Test
    public void testTotalWeightIndependentOfStart() throws Exception {
        Graph graph = weighted();

        for (int start : graph.listVertices()) {
            SpanningTree tree = MinimumSpanningTree.mst(graph, start);

            assertEquals(tree.getNumberEdges(), graph.getNumberVertices() - 1);
            assertEquals(tree.getTotalWeight(), 9.6, DELTA);
        }
    }

    @Test
    public void testTreeEdgesBelongToGraph() throws Exception {
        Graph graph = weighted();
        SpanningTree tree = MinimumSpanningTree.mst(graph, 3);

        for (Edge edge : tree.getEdges()) {
            assertTrue(graph.hasEdge(edge.getSourceId(), edge.getDestinationId()), "Not in graph: " + edge);
            assertEquals(graph.getEdge(edge.getEdgeId()).getWeight(), edge.getWeight(), DELTA);
        }
    }

    @Test
    public void testTiesFollowEdgeInsertionOrder() throws Exception {
        Graph triangle = BasicGraph.create(GraphMode.UNDIRECTED, 3).addEdge(0, 1).addEdge(1, 2).addEdge(0, 2);

        SpanningTree tree = MinimumSpanningTree.mst(triangle, 0);

        assertStep(tree.getStep(1), 0, 1, 1.0);
        assertStep(tree.getStep(2), 1, 2, 1.0);
    }

    @Test
    public void testSingleVertex() throws Exception {
        SpanningTree tree = MinimumSpanningTree.mst(BasicGraph.create(GraphMode.UNDIRECTED, 1), 0);

        assertEquals(tree.getNumberEdges(), 0);
        assertEquals(tree.getTotalWeight(), 0.0, DELTA);
    }

    @Test
    public void testNegativeWeightsAllowed() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.UNDIRECTED, 3).addEdge(0, 1, -2).addEdge(1, 2, 3).addEdge(0, 2, 1);

        assertEquals(MinimumSpanningTree.mst(graph, 2).getTotalWeight(), -1.0, DELTA);
    }

    @Test
    public void testDirectedGraphRejected() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.DIRECTED, 2).addEdge(0, 1);

        GraphException e = expectThrows(GraphException.class, () -> MinimumSpanningTree.mst(graph, 0));

        assertEquals(e.getKind(), GraphErrorKind.NOT_UNDIRECTED);
    }

    @Test
    public void testUnknownStart() throws Exception {
        GraphException e = expectThrows(GraphException.class, () -> MinimumSpanningTree.mst(weighted(), 11));

        assertEquals(e.getKind(), GraphErrorKind.UNKNOWN_VERTEX);
    }

    @Test
    public void testDisconnected() throws Exception {
        Graph graph = weighted();
        graph.addVertex(5);

        GraphException e = expectThrows(GraphException.class, () -> MinimumSpanningTree.mst(graph, 0));

        assertEquals(e.getKind(), GraphErrorKind.DISCONNECTED);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testStepOutOfRange() throws Exception {
        MinimumSpanningTree.mst(weighted(), 0).getStep(5);
    }
}

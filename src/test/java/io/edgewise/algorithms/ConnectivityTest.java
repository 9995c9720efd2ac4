package io.edgewise.algorithms;

import io.edgewise.graph.BasicGraph;
import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphMode;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class ConnectivityTest {

    private static Graph cycleWithTail() throws Exception {
        return BasicGraph.create(GraphMode.DIRECTED, 4)
                .addEdge(0, 1)
                .addEdge(1, 2)
                .addEdge(2, 0)
                .addEdge(2, 3);
    }

    @Test
    public void testEmptyGraphIsConnected() {
        Graph graph = BasicGraph.create(GraphMode.UNDIRECTED);

        assertTrue(new Connectivity().isConnected(graph));
        assertTrue(new Connectivity().components(graph).isEmpty());
    }

    @Test
    public void testSingleVertex() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.DIRECTED, 1);

        assertTrue(new Connectivity(ConnectivityPolicy.STRONG).isConnected(graph));
        assertEquals(new Connectivity().components(graph), Arrays.asList(Collections.singletonList(0)));
    }

    @Test
    public void testTwoPairs() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.UNDIRECTED, 4).addEdge(0, 1).addEdge(2, 3);
        Connectivity connectivity = new Connectivity();

        assertFalse(connectivity.isConnected(graph));
        assertEquals(connectivity.components(graph), Arrays.asList(Arrays.asList(0, 1), Arrays.asList(2, 3)));
    }

    @Test
    public void testUndirectedComponentsOrdering() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.UNDIRECTED, 7)
                .addEdge(5, 1)
                .addEdge(3, 6)
                .addEdge(1, 4)
                .addEdge(6, 2);

        Connectivity connectivity = new Connectivity();
        List<List<Integer>> components = connectivity.components(graph);

        assertFalse(connectivity.isConnected(graph));
        assertEquals(components, Arrays.asList(
                Arrays.asList(0),
                Arrays.asList(1, 4, 5),
                Arrays.asList(2, 3, 6)));
    }

    @Test
    public void testComponentsPartitionVertices() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.DIRECTED, 9)
                .addEdge(0, 3)
                .addEdge(4, 3)
                .addEdge(7, 8)
                .addEdge(8, 1)
                .addEdge(1, 7)
                .addEdge(5, 6);

        for (ConnectivityPolicy policy : ConnectivityPolicy.values()) {
            int total = 0;
            boolean[] seen = new boolean[9];

            for (List<Integer> component : new Connectivity(policy).components(graph)) {
                for (int vertexId : component) {
                    assertFalse(seen[vertexId], "Vertex " + vertexId + " appears twice under " + policy);
                    seen[vertexId] = true;
                    ++total;
                }
            }

            assertEquals(total, 9);
        }
    }

    @Test
    public void testConnectedIffOneComponent() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.UNDIRECTED, 3).addEdge(0, 1);
        Connectivity connectivity = new Connectivity();

        assertFalse(connectivity.isConnected(graph));
        assertEquals(connectivity.components(graph).size(), 2);

        graph.addEdge(2, 1);

        assertTrue(connectivity.isConnected(graph));
        assertEquals(connectivity.components(graph).size(), 1);
    }

    @Test
    public void testWeakPolicyIgnoresDirection() throws Exception {
        Graph graph = cycleWithTail();
        Connectivity connectivity = new Connectivity(ConnectivityPolicy.WEAK);

        assertTrue(connectivity.isConnected(graph));
        assertEquals(connectivity.components(graph), Arrays.asList(Arrays.asList(0, 1, 2, 3)));
    }

    @Test
    public void testStrongComponents() throws Exception {
        Graph graph = cycleWithTail();
        Connectivity connectivity = new Connectivity(ConnectivityPolicy.STRONG);

        assertFalse(connectivity.isConnected(graph));
        assertEquals(connectivity.components(graph), Arrays.asList(
                Arrays.asList(0, 1, 2),
                Arrays.asList(3)));

        graph.addEdge(3, 1);

        assertTrue(connectivity.isConnected(graph));
        assertEquals(connectivity.components(graph).size(), 1);
    }

    @Test
    public void testStrongPolicyOnUndirectedGraph() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.UNDIRECTED, 4).addEdge(0, 1).addEdge(1, 2);

        Connectivity strong = new Connectivity(ConnectivityPolicy.STRONG);

        assertEquals(strong.components(graph), new Connectivity().components(graph));
        assertFalse(strong.isConnected(graph));
    }

    @Test
    public void testStrongChain() throws Exception {
        Graph graph = BasicGraph.create(GraphMode.DIRECTED, 3).addEdge(2, 1).addEdge(1, 0);

        assertEquals(new Connectivity(ConnectivityPolicy.STRONG).components(graph), Arrays.asList(
                Arrays.asList(0), Arrays.asList(1), Arrays.asList(2)));
    }

    @Test
    public void testPolicyLabels() {
        assertEquals(ConnectivityPolicy.fromLabel("Strong"), ConnectivityPolicy.STRONG);
        assertEquals(ConnectivityPolicy.fromLabel(" weak "), ConnectivityPolicy.WEAK);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownPolicyLabel() {
        ConnectivityPolicy.fromLabel("mostly");
    }

    @Test
    public void testSummary() throws Exception {
        GraphSummary summary = GraphSummary.of(cycleWithTail(), new Connectivity(ConnectivityPolicy.STRONG));

        assertEquals(summary.getMode(), GraphMode.DIRECTED);
        assertEquals(summary.getNumberVertices(), 4);
        assertEquals(summary.getNumberEdges(), 4);
        assertFalse(summary.isConnected());
        assertEquals(summary.getNumberComponents(), 2);
        assertEquals(summary.getPolicy(), ConnectivityPolicy.STRONG);
    }
}

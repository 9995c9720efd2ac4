package io.edgewise.input;

import io.edgewise.graph.BasicGraph;
import io.edgewise.graph.Edge;
import io.edgewise.graph.EdgeDefinition;
import io.edgewise.graph.GraphErrorKind;
import io.edgewise.graph.GraphException;
import io.edgewise.graph.GraphMode;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class GraphFileReaderTest {

    private GraphFileReader reader;

    @BeforeMethod
    public void setUp() {
        reader = new GraphFileReader();
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    private Path resource(String name) throws URISyntaxException {
        return Paths.get(getClass().getResource(name).toURI());
    }

    private void assertMalformed(String content, String expectedFragment) {
        GraphException e = expectThrows(GraphException.class, () -> reader.read(stream(content)));

        assertEquals(e.getKind(), GraphErrorKind.MALFORMED_INPUT);
        assertTrue(e.getMessage().contains(expectedFragment), e.getMessage());
    }

    @Test
    public void testReadWeightedAndUnweightedLines() throws Exception {
        GraphInput input = reader.read(stream("3\n0 1\n1 2 2.5\n"));

        assertEquals(input.getVertexCount(), 3);
        assertEquals(input.getEdges(), Arrays.asList(
                new EdgeDefinition(0, 1, 1.0),
                new EdgeDefinition(1, 2, 2.5)));
    }

    @Test
    public void testSkipsCommentsAndBlankLines() throws Exception {
        GraphInput input = reader.read(stream("# header\n\n  4  \n\t0\t3   -1.5\n# trailing\n\n"));

        assertEquals(input.getVertexCount(), 4);
        assertEquals(input.getEdges(), Arrays.asList(new EdgeDefinition(0, 3, -1.5)));
    }

    @Test
    public void testByteOrderMark() throws Exception {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "2\n0 1 3\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);

        GraphInput input = reader.read(new ByteArrayInputStream(content));

        assertEquals(input.getVertexCount(), 2);
        assertEquals(input.getEdges().size(), 1);
    }

    @Test
    public void testOnlyVertexCount() throws Exception {
        GraphInput input = reader.read(stream("0\n"));

        assertEquals(input.getVertexCount(), 0);
        assertTrue(input.getEdges().isEmpty());
    }

    @Test
    public void testEmptyInput() {
        assertMalformed("", "empty");
        assertMalformed("# nothing here\n\n", "empty");
    }

    @Test
    public void testMalformedLinesReportLineNumber() {
        assertMalformed("three\n", "Line 1: vertex count is not an integer: three");
        assertMalformed("3 4\n", "Line 1: expected a single vertex count");
        assertMalformed("-3\n", "Line 1: vertex count must be non-negative");
        assertMalformed("3\n0 1\n\n2\n", "Line 4: expected 'u v [weight]'");
        assertMalformed("3\n0 1 2 3\n", "Line 2: expected 'u v [weight]'");
        assertMalformed("3\n0 x\n", "Line 2: destination vertex is not an integer: x");
        assertMalformed("3\n1.5 2\n", "Line 2: source vertex is not an integer: 1.5");
        assertMalformed("3\n0 1 heavy\n", "Line 2: weight is not a number: heavy");
    }

    @Test
    public void testMissingFile() {
        GraphException e = expectThrows(GraphException.class,
                () -> reader.read(Paths.get("does", "not", "exist.txt")));

        assertEquals(e.getKind(), GraphErrorKind.MALFORMED_INPUT);
    }

    @Test
    public void testLoadUndirectedKeepsLastWeight() throws Exception {
        BasicGraph graph = reader.load(resource("/graphs/duplicates.txt"), GraphMode.UNDIRECTED);

        assertEquals(graph.listVertices(), new int[]{0, 1, 2, 3});
        assertEquals(graph.listEdges(), Arrays.asList(new Edge(0, 0, 1, 7.0), new Edge(1, 1, 2, 0.5)));
    }

    @Test
    public void testLoadDirectedKeepsOppositeArcs() throws Exception {
        BasicGraph graph = reader.load(resource("/graphs/duplicates.txt"), GraphMode.DIRECTED);

        assertEquals(graph.getNumberEdges(), 3);
        assertEquals(graph.getWeight(0, 1).getAsDouble(), 7.0);
        assertEquals(graph.getWeight(1, 2).getAsDouble(), 3.5);
        assertEquals(graph.getWeight(2, 1).getAsDouble(), 0.5);
    }

    @Test
    public void testLoadRejectsOutOfRangeEndpoint() {
        GraphException e = expectThrows(GraphException.class,
                () -> BasicGraph.load(GraphMode.DIRECTED, 2, reader.read(stream("2\n0 1\n1 2\n")).getEdges()));

        assertEquals(e.getKind(), GraphErrorKind.MALFORMED_INPUT);
    }

    @Test
    public void testLoadFixture() throws Exception {
        BasicGraph graph = reader.load(resource("/graphs/shortest-path.txt"), GraphMode.DIRECTED);

        assertEquals(graph.getNumberVertices(), 5);
        assertEquals(graph.getNumberEdges(), 7);
        assertEquals(graph.getWeight(2, 4).getAsDouble(), 10.0);
    }
}

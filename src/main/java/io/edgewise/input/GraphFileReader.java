package io.edgewise.input;

import io.edgewise.graph.BasicGraph;
import io.edgewise.graph.EdgeDefinition;
import io.edgewise.graph.GraphException;
import io.edgewise.graph.GraphMode;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Reads the line oriented graph format:
 * <pre>
 * n
 * u v [weight]
 * ...
 * </pre>
 * Blank lines and lines starting with {@code #} are skipped. Only the shape of each line
 * is checked here; vertex ranges, self loops and duplicates are left to
 * {@link BasicGraph#load}.
 */
public class GraphFileReader {
    private static final Logger LOG = Logger.getLogger(GraphFileReader.class);

    private static final String COMMENT_PREFIX = "#";

    public GraphInput read(Path filePath) throws GraphException {
        if (LOG.isInfoEnabled()) {
            LOG.info("Reading graph from " + filePath);
        }

        try (InputStream is = Files.newInputStream(filePath)) {
            return read(is);
        } catch (IOException e) {
            throw GraphException.malformedInput("Unable to read graph file " + filePath + ": " + e.getMessage(), e);
        }
    }

    public GraphInput read(InputStream is) throws GraphException {
        long start = 0;

        if (LOG.isInfoEnabled()) {
            start = System.currentTimeMillis();
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(new BOMInputStream(is), StandardCharsets.UTF_8));

        int vertexCount = -1;
        List<EdgeDefinition> edges = new ArrayList<>();

        try {
            String line = reader.readLine();
            int lineNumber = 1;

            while (line != null) {
                String trimmed = line.trim();

                if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                    StringTokenizer tokenizer = new StringTokenizer(trimmed);

                    if (vertexCount < 0) {
                        vertexCount = parseVertexCount(tokenizer, lineNumber);
                    } else {
                        edges.add(parseEdge(tokenizer, lineNumber));
                    }
                }

                line = reader.readLine();
                ++lineNumber;
            }
        } catch (IOException e) {
            throw GraphException.malformedInput("Unable to read graph input: " + e.getMessage(), e);
        }

        if (vertexCount < 0) {
            throw GraphException.malformedInput("Graph input is empty: expected the vertex count on the first line");
        }

        if (LOG.isInfoEnabled()) {
            LOG.info("Done in " + (System.currentTimeMillis() - start));
            LOG.info("Declared vertices: " + vertexCount);
            LOG.info("Edge lines: " + edges.size());
        }

        return new GraphInput(vertexCount, edges);
    }

    /**
     * Reads the file and builds the graph it describes.
     */
    public BasicGraph load(Path filePath, GraphMode mode) throws GraphException {
        GraphInput input = read(filePath);

        return BasicGraph.load(mode, input.getVertexCount(), input.getEdges());
    }

    private int parseVertexCount(StringTokenizer tokenizer, int lineNumber) throws GraphException {
        if (tokenizer.countTokens() != 1) {
            throw malformedLine(lineNumber, "expected a single vertex count");
        }

        int vertexCount = parseInt(tokenizer.nextToken(), lineNumber, "vertex count");

        if (vertexCount < 0) {
            throw malformedLine(lineNumber, "vertex count must be non-negative, got " + vertexCount);
        }

        return vertexCount;
    }

    private EdgeDefinition parseEdge(StringTokenizer tokenizer, int lineNumber) throws GraphException {
        int numTokens = tokenizer.countTokens();

        if (numTokens < 2 || numTokens > 3) {
            throw malformedLine(lineNumber, "expected 'u v [weight]'");
        }

        int sourceId = parseInt(tokenizer.nextToken(), lineNumber, "source vertex");
        int destinationId = parseInt(tokenizer.nextToken(), lineNumber, "destination vertex");

        if (!tokenizer.hasMoreTokens()) {
            return new EdgeDefinition(sourceId, destinationId);
        }

        String weightToken = tokenizer.nextToken();
        double weight;

        try {
            weight = Double.parseDouble(weightToken);
        } catch (NumberFormatException e) {
            throw malformedLine(lineNumber, "weight is not a number: " + weightToken);
        }

        return new EdgeDefinition(sourceId, destinationId, weight);
    }

    private int parseInt(String token, int lineNumber, String what) throws GraphException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw malformedLine(lineNumber, what + " is not an integer: " + token);
        }
    }

    private GraphException malformedLine(int lineNumber, String reason) {
        return GraphException.malformedInput("Line " + lineNumber + ": " + reason);
    }
}

package io.edgewise.shell;

import com.google.common.base.Preconditions;
import io.edgewise.algorithms.DistanceTable;
import io.edgewise.algorithms.GraphSummary;
import io.edgewise.algorithms.MinimumSpanningTree;
import io.edgewise.algorithms.Path;
import io.edgewise.algorithms.ShortestPaths;
import io.edgewise.algorithms.SpanningTree;
import io.edgewise.graph.Edge;
import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphException;
import io.edgewise.graph.GraphMode;
import org.apache.commons.lang.ArrayUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Line oriented front end over a {@link GraphSession}: one command per line, arguments
 * inline, results printed as plain text.
 */
public class GraphShell {
    private static final Logger LOG = Logger.getLogger(GraphShell.class);

    private static final String PROMPT = "graph> ";
    private static final String NO_GRAPH = "No graph yet: use 'create' or 'load' first";

    private final GraphSession session;
    private final PrintStream out;
    private final String numberFormat;

    private boolean showPrompt;

    public GraphShell(GraphSession session, PrintStream out, int precision) {
        Preconditions.checkArgument(precision >= 0, "precision must be non-negative");

        this.session = Preconditions.checkNotNull(session, "session");
        this.out = Preconditions.checkNotNull(out, "out");
        this.numberFormat = "%." + precision + "f";
    }

    public void setShowPrompt(boolean showPrompt) {
        this.showPrompt = showPrompt;
    }

    public void run(BufferedReader in) throws IOException {
        out.println("Edgewise graph shell. Type 'help' for the list of commands.");

        while (true) {
            if (showPrompt) {
                out.print(PROMPT);
                out.flush();
            }

            String line = in.readLine();

            if (line == null || !execute(line)) {
                break;
            }
        }
    }

    /**
     * @return false once the shell should stop
     */
    public boolean execute(String line) {
        String[] tokens = StringUtils.split(line);

        if (tokens == null || tokens.length == 0) {
            return true;
        }

        ShellCommand command = ShellCommand.fromName(tokens[0]);

        if (command == null) {
            out.println("Unknown command: " + tokens[0] + ". Type 'help' for the list of commands.");
            return true;
        }

        if (command == ShellCommand.EXIT) {
            return false;
        }

        String[] args = Arrays.copyOfRange(tokens, 1, tokens.length);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Executing " + command.getName() + " " + Arrays.toString(args));
        }

        try {
            dispatch(command, args);
        } catch (GraphException e) {
            LOG.debug("Command " + command.getName() + " failed", e);
            out.println("Error [" + e.getKind() + "]: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            out.println("Invalid arguments: " + e.getMessage());
            out.println("Usage: " + command.getUsage());
        }

        return true;
    }

    private void dispatch(ShellCommand command, String[] args) throws GraphException {
        switch (command) {
            case HELP:
                printHelp();
                return;
            case CREATE:
                create(args);
                return;
            case LOAD:
                load(args);
                return;
            default:
                break;
        }

        Graph graph = session.getGraph();

        if (graph == null) {
            out.println(NO_GRAPH);
            return;
        }

        switch (command) {
            case ADD_VERTEX:
                addVertex(graph, args);
                break;
            case ADD_EDGE:
                addEdge(graph, args);
                break;
            case REMOVE_VERTEX:
                removeVertex(graph, args);
                break;
            case REMOVE_EDGE:
                removeEdge(graph, args);
                break;
            case LIST_VERTICES:
                listVertices(graph);
                break;
            case LIST_EDGES:
                listEdges(graph, args);
                break;
            case CONNECTED:
                out.println(session.getConnectivity().isConnected(graph)
                        ? "Graph is connected" : "Graph is not connected");
                break;
            case COMPONENTS:
                components(graph);
                break;
            case SHORTEST_PATH:
                shortestPath(graph, args);
                break;
            case DISTANCES:
                distances(graph, args);
                break;
            case MST:
                mst(graph, args);
                break;
            case INFO:
                info(graph);
                break;
            default:
                throw new IllegalStateException("Unhandled command " + command);
        }
    }

    private void printHelp() {
        out.println("Commands:");

        for (ShellCommand command : ShellCommand.values()) {
            out.println("  " + StringUtils.rightPad(command.getUsage(), 42) + command.getDescription());
        }
    }

    private void create(String[] args) throws GraphException {
        expectArgs(args, 0, 2);

        GraphMode mode = session.getDefaultMode();
        int size = 0;

        for (String arg : args) {
            if (StringUtils.isNumeric(arg)) {
                size = parseInt(arg, "size");
            } else {
                mode = GraphMode.fromLabel(arg);
            }
        }

        session.create(mode, size);
        out.println("Created " + mode + " graph with " + size + " vertices");
    }

    private void load(String[] args) throws GraphException {
        expectArgs(args, 1, 2);

        GraphMode mode = args.length > 1 ? GraphMode.fromLabel(args[1]) : session.getDefaultMode();

        session.load(Paths.get(args[0]), mode);
        out.println("Loaded " + mode + " graph from " + args[0]);
        info(session.getGraph());
    }

    private void addVertex(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 1, 1);

        int vertexId = parseVertex(args[0]);

        graph.addVertex(vertexId);
        out.println("Vertex " + vertexId + " added");
    }

    private void removeVertex(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 1, 1);

        int vertexId = parseVertex(args[0]);

        graph.removeVertex(vertexId);
        out.println("Vertex " + vertexId + " removed together with its edges");
    }

    private void removeEdge(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 2, 2);

        int sourceId = parseVertex(args[0]);
        int destinationId = parseVertex(args[1]);

        graph.removeEdge(sourceId, destinationId);
        out.println("Edge " + sourceId + arrow(graph) + destinationId + " removed");
    }

    private void addEdge(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 2, 3);

        int sourceId = parseVertex(args[0]);
        int destinationId = parseVertex(args[1]);
        double weight = args.length > 2 ? parseDouble(args[2], "weight") : Edge.DEFAULT_WEIGHT;

        graph.addEdge(sourceId, destinationId, weight);
        out.println("Edge " + sourceId + arrow(graph) + destinationId + " (weight " + format(weight) + ") added");
    }

    private void listVertices(Graph graph) {
        int[] vertices = graph.listVertices();

        out.println("Vertices: " + StringUtils.join(ArrayUtils.toObject(vertices), ", "));
        out.println("Total vertices: " + vertices.length);
    }

    private void listEdges(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 0, 1);

        List<Edge> edges = args.length == 0 ? graph.listEdges() : graph.listEdges(parseVertex(args[0]));

        if (edges.isEmpty()) {
            out.println("No edges");
            return;
        }

        int number = 1;
        for (Edge edge : edges) {
            out.println(number++ + ". " + describe(graph, edge));
        }

        out.println("Total edges: " + edges.size());
    }

    private void components(Graph graph) {
        List<List<Integer>> components = session.getConnectivity().components(graph);

        int number = 1;
        for (List<Integer> component : components) {
            out.println("Component " + number++ + ": " + StringUtils.join(component, ", ")
                    + " (size " + component.size() + ")");
        }

        out.println("Total components: " + components.size());
    }

    private void shortestPath(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 2, 2);

        Path path = ShortestPaths.shortestPath(graph, parseVertex(args[0]), parseVertex(args[1]));

        out.println("Path: " + StringUtils.join(path.getVertices(), " -> "));
        out.println("Distance: " + format(path.getTotalWeight()));
    }

    private void distances(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 1, 1);

        int source = parseVertex(args[0]);
        DistanceTable table = ShortestPaths.distances(graph, source);

        out.println("Distances from " + source + ":");

        for (int vertexId : graph.listVertices()) {
            if (table.isReachable(vertexId)) {
                Path path = table.pathTo(vertexId);
                out.println("  " + vertexId + ": " + format(path.getTotalWeight())
                        + "  " + StringUtils.join(path.getVertices(), " -> "));
            } else {
                out.println("  " + vertexId + ": unreachable");
            }
        }
    }

    private void mst(Graph graph, String[] args) throws GraphException {
        expectArgs(args, 1, 1);

        SpanningTree tree = MinimumSpanningTree.mst(graph, parseVertex(args[0]));

        for (int step = 1; step <= tree.getNumberEdges(); ++step) {
            out.println("Step " + step + ": " + describe(graph, tree.getStep(step)));
        }

        out.println("Total weight: " + format(tree.getTotalWeight()));
    }

    private void info(Graph graph) {
        GraphSummary summary = GraphSummary.of(graph, session.getConnectivity());

        out.println("Mode: " + summary.getMode());
        out.println("Vertices: " + summary.getNumberVertices());
        out.println("Edges: " + summary.getNumberEdges());
        out.println("Connected: " + (summary.isConnected() ? "yes" : "no"));
        out.println("Components (" + summary.getPolicy() + "): " + summary.getNumberComponents());
    }

    private String describe(Graph graph, Edge edge) {
        return edge.getSourceId() + arrow(graph) + edge.getDestinationId() + " (" + format(edge.getWeight()) + ")";
    }

    private static String arrow(Graph graph) {
        return graph.isDirected() ? " -> " : " -- ";
    }

    private String format(double value) {
        return String.format(Locale.ROOT, numberFormat, value);
    }

    private static void expectArgs(String[] args, int min, int max) {
        if (args.length < min || args.length > max) {
            throw new IllegalArgumentException("expected " + (min == max ? String.valueOf(min) : min + " to " + max)
                    + " argument(s), got " + args.length);
        }
    }

    private static int parseVertex(String token) {
        return parseInt(token, "vertex");
    }

    private static int parseInt(String token, String what) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be an integer: " + token, e);
        }
    }

    private static double parseDouble(String token, String what) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be a number: " + token, e);
        }
    }
}

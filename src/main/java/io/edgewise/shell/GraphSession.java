package io.edgewise.shell;

import com.google.common.base.Preconditions;
import io.edgewise.algorithms.Connectivity;
import io.edgewise.conf.Configuration;
import io.edgewise.graph.BasicGraph;
import io.edgewise.graph.Graph;
import io.edgewise.graph.GraphException;
import io.edgewise.graph.GraphMode;
import io.edgewise.input.GraphFileReader;
import org.apache.log4j.Logger;

import java.nio.file.Path;

/**
 * The graph a shell works on. A new graph only replaces the current one once it has been
 * built completely.
 */
public class GraphSession {
    private static final Logger LOG = Logger.getLogger(GraphSession.class);

    private final GraphMode defaultMode;
    private final Connectivity connectivity;
    private final GraphFileReader reader;

    private Graph graph;

    public GraphSession(Configuration configuration) {
        this(configuration.getGraphMode(), new Connectivity(configuration.getConnectivityPolicy()), new GraphFileReader());
    }

    public GraphSession(GraphMode defaultMode, Connectivity connectivity, GraphFileReader reader) {
        this.defaultMode = Preconditions.checkNotNull(defaultMode, "defaultMode");
        this.connectivity = Preconditions.checkNotNull(connectivity, "connectivity");
        this.reader = Preconditions.checkNotNull(reader, "reader");
    }

    public boolean hasGraph() {
        return graph != null;
    }

    /**
     * @return the current graph, or null before the first create/load
     */
    public Graph getGraph() {
        return graph;
    }

    public GraphMode getDefaultMode() {
        return defaultMode;
    }

    public Connectivity getConnectivity() {
        return connectivity;
    }

    public Graph create(GraphMode mode, int size) throws GraphException {
        Graph created = BasicGraph.create(mode, size);
        graph = created;

        if (LOG.isDebugEnabled()) {
            LOG.debug("Created " + created);
        }

        return created;
    }

    public Graph load(Path filePath, GraphMode mode) throws GraphException {
        Graph loaded = reader.load(filePath, mode);
        graph = loaded;

        if (LOG.isInfoEnabled()) {
            LOG.info("Loaded " + loaded + " from " + filePath);
        }

        return loaded;
    }
}

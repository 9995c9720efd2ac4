package io.edgewise;

import io.edgewise.conf.Configuration;
import io.edgewise.graph.GraphException;
import io.edgewise.shell.GraphSession;
import io.edgewise.shell.GraphShell;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

public class EdgewiseRunner {
    /**
     * Class logger
     */
    private static final Logger LOG = Logger.getLogger(EdgewiseRunner.class);

    public int run(String[] args, InputStream in, PrintStream out) throws IOException {
        Configuration conf = new Configuration(args).load();

        Logger.getLogger("io.edgewise").setLevel(conf.isVerbose() ? Level.DEBUG : Level.WARN);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Starting with " + conf);
        }

        GraphSession session = new GraphSession(conf);
        GraphShell shell = new GraphShell(session, out, conf.getOutputPrecision());
        shell.setShowPrompt(System.console() != null);

        String inputGraphPath = conf.getInputGraphPath();

        if (inputGraphPath != null) {
            try {
                session.load(Paths.get(inputGraphPath), conf.getGraphMode());
                out.println("Loaded " + conf.getGraphMode() + " graph from " + inputGraphPath);
            } catch (GraphException e) {
                LOG.warn("Unable to preload " + inputGraphPath, e);
                out.println("Error [" + e.getKind() + "]: " + e.getMessage());
            }
        }

        shell.run(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));

        return 0;
    }

    /**
     * Execute EdgewiseRunner.
     *
     * @param args Typically command line arguments.
     * @throws Exception Any exceptions thrown.
     */
    public static void main(String[] args) throws Exception {
        System.exit(new EdgewiseRunner().run(args, System.in, System.out));
    }
}

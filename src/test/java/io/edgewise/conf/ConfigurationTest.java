package io.edgewise.conf;

import io.edgewise.algorithms.ConnectivityPolicy;
import io.edgewise.graph.GraphMode;
import org.testng.annotations.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class ConfigurationTest {

    @Test
    public void testDefaults() {
        Configuration conf = new Configuration(new String[0]).load();

        assertEquals(conf.getGraphMode(), GraphMode.UNDIRECTED);
        assertEquals(conf.getConnectivityPolicy(), ConnectivityPolicy.WEAK);
        assertEquals(conf.getOutputPrecision(), 2);
        assertFalse(conf.isVerbose());
        assertNull(conf.getInputGraphPath());
    }

    @Test
    public void testUserFileOverridesDefaults() {
        Configuration conf = new Configuration(new String[]{"-y", "edgewise-test.yaml"}).load();

        assertEquals(conf.getGraphMode(), GraphMode.DIRECTED);
        assertEquals(conf.getConnectivityPolicy(), ConnectivityPolicy.STRONG);
        assertEquals(conf.getOutputPrecision(), 3);
        assertTrue(conf.isVerbose());
        assertEquals(conf.get("not_a_setting"), 42);
    }

    @Test
    public void testLaterFilesWin() throws Exception {
        Path override = Files.createTempFile("edgewise-override", ".yaml");
        Files.write(override, "graph_mode: undirected\ninput_graph_path: /tmp/g.txt\n".getBytes(StandardCharsets.UTF_8));
        override.toFile().deleteOnExit();

        Configuration conf = new Configuration(
                new String[]{"-y", "edgewise-test.yaml", override.toString()}).load();

        assertEquals(conf.getGraphMode(), GraphMode.UNDIRECTED);
        assertEquals(conf.getConnectivityPolicy(), ConnectivityPolicy.STRONG);
        assertEquals(conf.getInputGraphPath(), "/tmp/g.txt");
    }

    @Test
    public void testEmptyUserFileIsIgnored() throws Exception {
        File empty = File.createTempFile("edgewise-empty", ".yaml");
        empty.deleteOnExit();

        Configuration conf = new Configuration(new String[]{"-y", empty.getAbsolutePath()}).load();

        assertEquals(conf.getGraphMode(), GraphMode.UNDIRECTED);
    }

    @Test
    public void testSetOverridesLoadedValue() {
        Configuration conf = new Configuration().load();
        conf.set(Configuration.CONF_OUTPUT_PRECISION, "4");

        assertEquals(conf.getOutputPrecision(), 4);
        assertEquals(conf.getInteger("missing", 7), Integer.valueOf(7));
        assertEquals(conf.getString("missing", "fallback"), "fallback");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMissingFile() {
        new Configuration(new String[]{"-y", "no-such-config.yaml"}).load();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidGraphMode() {
        Configuration conf = new Configuration().load();
        conf.set(Configuration.CONF_GRAPH_MODE, "bidirectional");

        conf.getGraphMode();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativePrecision() {
        Configuration conf = new Configuration().load();
        conf.set(Configuration.CONF_OUTPUT_PRECISION, -1);

        conf.getOutputPrecision();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonNumericPrecision() {
        Configuration conf = new Configuration().load();
        conf.set(Configuration.CONF_OUTPUT_PRECISION, "lots");

        conf.getOutputPrecision();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNotAMapping() throws Exception {
        Path list = Files.createTempFile("edgewise-list", ".yaml");
        Files.write(list, "- a\n- b\n".getBytes(StandardCharsets.UTF_8));
        list.toFile().deleteOnExit();

        new Configuration(new String[]{"-y", list.toString()}).load();
    }
}

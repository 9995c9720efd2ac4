package io.edgewise.conf;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.ByteStreams;
import io.edgewise.algorithms.ConnectivityPolicy;
import io.edgewise.graph.GraphMode;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML based config.
 * <p/>
 * {@value #DEFAULT_CONFIGURATION} is always read from the classpath first. User files
 * given with {@code -y} are layered on top in order; without {@code -y} an optional
 * {@value #DEFAULT_CUSTOM_CONFIGURATION} on the classpath is used.
 */
public class Configuration {
    private static final Logger LOG = Logger.getLogger(Configuration.class);

    private static final String DEFAULT_CONFIGURATION = "edgewise.default.yaml";
    private static final String DEFAULT_CUSTOM_CONFIGURATION = "edgewise.yaml";

    public static final String CONF_GRAPH_MODE = "graph_mode";
    public static final String CONF_GRAPH_MODE_DEFAULT = "undirected";
    public static final String CONF_CONNECTIVITY_POLICY = "connectivity_policy";
    public static final String CONF_CONNECTIVITY_POLICY_DEFAULT = "weak";
    public static final String CONF_INPUT_GRAPH_PATH = "input_graph_path";
    public static final String CONF_OUTPUT_PRECISION = "output_precision";
    public static final int CONF_OUTPUT_PRECISION_DEFAULT = 2;
    public static final String CONF_VERBOSE = "verbose";
    public static final boolean CONF_VERBOSE_DEFAULT = false;

    private static final Set<String> VALID_PROPERTIES = ImmutableSet.of(
            CONF_GRAPH_MODE,
            CONF_CONNECTIVITY_POLICY,
            CONF_INPUT_GRAPH_PATH,
            CONF_OUTPUT_PRECISION,
            CONF_VERBOSE);

    private static final Options CMDLINE_OPTIONS;

    static {
        CMDLINE_OPTIONS = new Options();
        Option option = new Option("y", "yaml", true,
                "YAML configuration file (defaults to " + DEFAULT_CUSTOM_CONFIGURATION + " on classpath)");
        option.setArgs(Option.UNLIMITED_VALUES);
        CMDLINE_OPTIONS.addOption(option);
    }

    private final Set<String> configurations;
    private final Set<String> optionalConfigurations;
    private final Map<String, Object> properties;

    public Configuration() {
        configurations = new LinkedHashSet<>();
        configurations.add(DEFAULT_CONFIGURATION);
        optionalConfigurations = new LinkedHashSet<>();
        properties = new LinkedHashMap<>();
    }

    public Configuration(String[] args) {
        this();

        List<String> userConfigs = findUserProvidedConfigs(args);

        if (userConfigs.isEmpty()) {
            optionalConfigurations.add(DEFAULT_CUSTOM_CONFIGURATION);
        } else {
            configurations.addAll(userConfigs);
        }
    }

    public Configuration load() {
        for (String configPath : configurations) {
            loadConfig(getConfigUrl(configPath));
        }

        for (String configPath : optionalConfigurations) {
            URL url = findConfigUrl(configPath);

            if (url != null) {
                loadConfig(url);
            } else {
                LOG.debug("No optional configuration found at " + configPath);
            }
        }

        warnAboutUnknownKeys();

        return this;
    }

    public Object get(String key) {
        return properties.get(key);
    }

    public void set(String key, Object value) {
        properties.put(key, value);
    }

    public String getString(String key, String defaultValue) {
        Object value = get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public Integer getInteger(String key, Integer defaultValue) {
        Object value = get(key);

        if (value == null) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for YAML property " + key + ": " + value, e);
        }
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = get(key);
        return value != null ? Boolean.valueOf(value.toString().trim()) : defaultValue;
    }

    public GraphMode getGraphMode() {
        return GraphMode.fromLabel(getString(CONF_GRAPH_MODE, CONF_GRAPH_MODE_DEFAULT));
    }

    public ConnectivityPolicy getConnectivityPolicy() {
        return ConnectivityPolicy.fromLabel(getString(CONF_CONNECTIVITY_POLICY, CONF_CONNECTIVITY_POLICY_DEFAULT));
    }

    /**
     * @return graph file to load when a session starts, or null
     */
    public String getInputGraphPath() {
        return getString(CONF_INPUT_GRAPH_PATH, null);
    }

    public int getOutputPrecision() {
        int precision = getInteger(CONF_OUTPUT_PRECISION, CONF_OUTPUT_PRECISION_DEFAULT);

        if (precision < 0) {
            throw new IllegalArgumentException("output_precision must be non-negative, got " + precision);
        }

        return precision;
    }

    public boolean isVerbose() {
        return getBoolean(CONF_VERBOSE, CONF_VERBOSE_DEFAULT);
    }

    private void warnAboutUnknownKeys() {
        for (String key : properties.keySet()) {
            if (!VALID_PROPERTIES.contains(key)) {
                LOG.warn("Invalid YAML key, ignoring: " + key);
            }
        }
    }

    private List<String> findUserProvidedConfigs(String[] args) {
        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine cmd = parser.parse(CMDLINE_OPTIONS, args);

            if (cmd.hasOption("y")) {
                return Arrays.asList(cmd.getOptionValues("y"));
            } else {
                return Collections.emptyList();
            }
        } catch (ParseException e) {
            throw new IllegalArgumentException("Unable to parse command line parameters", e);
        }
    }

    private void loadConfig(URL url) {
        try {
            LOG.info("Loading settings from " + url);

            byte[] configBytes;
            try {
                configBytes = readUrl(url);
            } catch (IOException e) {
                throw new IllegalStateException("Unable to read yaml config " + url, e);
            }

            Yaml yaml = new Yaml();
            Object result = yaml.load(new ByteArrayInputStream(configBytes));

            if (result == null) {
                return;
            }

            if (!(result instanceof Map)) {
                throw new IllegalArgumentException("Yaml config " + url + " is not a mapping");
            }

            for (Map.Entry<?, ?> entry : ((Map<?, ?>) result).entrySet()) {
                properties.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid yaml in " + url, e);
        }
    }

    private URL getConfigUrl(String urlStr) {
        URL url = findConfigUrl(urlStr);

        if (url == null) {
            throw new IllegalArgumentException("Unable to find yaml config file location: " + urlStr);
        }

        return url;
    }

    private URL findConfigUrl(String urlStr) {
        try {
            if (Files.isRegularFile(Paths.get(urlStr))) {
                return Paths.get(urlStr).toUri().toURL();
            }
        } catch (MalformedURLException | RuntimeException e) {
            LOG.debug("Not a local file: " + urlStr, e);
        }

        try {
            URL url = new URL(urlStr);
            url.openStream().close(); // catches well-formed but bogus URLs
            return url;
        } catch (IOException e) {
            ClassLoader loader = Configuration.class.getClassLoader();
            return loader.getResource(urlStr);
        }
    }

    private byte[] readUrl(URL url) throws IOException {
        try (InputStream is = url.openStream()) {
            return ByteStreams.toByteArray(is);
        }
    }

    @Override
    public String toString() {
        return "Configuration{" +
                "configurations=" + configurations +
                ", properties=" + properties +
                '}';
    }
}

package io.edgewise.graph;

/**
 * Whether edges of a graph are direction-sensitive. Fixed when the graph is created.
 */
public enum GraphMode {
    DIRECTED("directed"),
    UNDIRECTED("undirected");

    private final String label;

    GraphMode(String label) {
        this.label = label;
    }

    public static GraphMode fromLabel(String label) {
        for (GraphMode mode : values()) {
            if (mode.label.equalsIgnoreCase(label.trim())) {
                return mode;
            }
        }

        throw new IllegalArgumentException("Unknown graph mode: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}

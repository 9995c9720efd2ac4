package io.edgewise.algorithms;

/**
 * How directed graphs are split into components. Undirected graphs give the same answer
 * under both policies.
 */
public enum ConnectivityPolicy {
    /**
     * Edge direction is ignored.
     */
    WEAK("weak"),
    /**
     * Every vertex must reach every other vertex along edge direction.
     */
    STRONG("strong");

    private final String label;

    ConnectivityPolicy(String label) {
        this.label = label;
    }

    public static ConnectivityPolicy fromLabel(String label) {
        for (ConnectivityPolicy policy : values()) {
            if (policy.label.equalsIgnoreCase(label.trim())) {
                return policy;
            }
        }

        throw new IllegalArgumentException("Unknown connectivity policy: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}

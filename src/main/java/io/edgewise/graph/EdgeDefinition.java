package io.edgewise.graph;

/**
 * Raw {@code u v [weight]} tuple as read from an input description, before any
 * structural validation.
 */
public final class EdgeDefinition {
    private final int sourceId;
    private final int destinationId;
    private final double weight;

    public EdgeDefinition(int sourceId, int destinationId) {
        this(sourceId, destinationId, Edge.DEFAULT_WEIGHT);
    }

    public EdgeDefinition(int sourceId, int destinationId, double weight) {
        this.sourceId = sourceId;
        this.destinationId = destinationId;
        this.weight = weight;
    }

    public int getSourceId() {
        return sourceId;
    }

    public int getDestinationId() {
        return destinationId;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        EdgeDefinition that = (EdgeDefinition) o;

        return sourceId == that.sourceId
                && destinationId == that.destinationId
                && Double.compare(weight, that.weight) == 0;
    }

    @Override
    public int hashCode() {
        int result = sourceId;
        result = 31 * result + destinationId;
        long bits = Double.doubleToLongBits(weight);
        result = 31 * result + (int) (bits ^ (bits >>> 32));
        return result;
    }

    @Override
    public String toString() {
        return "(" + sourceId + ", " + destinationId + ", " + weight + ")";
    }
}

package io.edgewise.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.List;

/**
 * Vertices from source to target inclusive, with the summed weight of the edges between
 * them.
 */
public final class Path {
    private final int[] vertices;
    private final double totalWeight;

    public Path(int[] vertices, double totalWeight) {
        Preconditions.checkArgument(vertices.length > 0, "A path has at least one vertex");

        this.vertices = vertices.clone();
        this.totalWeight = totalWeight;
    }

    public List<Integer> getVertices() {
        return Ints.asList(vertices.clone());
    }

    public int getSource() {
        return vertices[0];
    }

    public int getTarget() {
        return vertices[vertices.length - 1];
    }

    public int getNumberEdges() {
        return vertices.length - 1;
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Path path = (Path) o;

        return Double.compare(totalWeight, path.totalWeight) == 0 && Arrays.equals(vertices, path.vertices);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(vertices);
        long bits = Double.doubleToLongBits(totalWeight);
        result = 31 * result + (int) (bits ^ (bits >>> 32));
        return result;
    }

    @Override
    public String toString() {
        return "Path{" +
                "vertices=" + Arrays.toString(vertices) +
                ", totalWeight=" + totalWeight +
                '}';
    }
}

package io.edgewise.algorithms;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.koloboke.collect.map.IntDoubleMap;
import com.koloboke.collect.map.IntIntMap;
import io.edgewise.graph.GraphErrorKind;
import io.edgewise.graph.GraphException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Single-source shortest distances. Only vertices reachable from the source have an
 * entry; anything else is reported as unreachable rather than given a distance.
 */
public final class DistanceTable {
    private final int source;
    private final IntDoubleMap distances;
    private final IntIntMap predecessors;

    DistanceTable(int source, IntDoubleMap distances, IntIntMap predecessors) {
        this.source = source;
        this.distances = distances;
        this.predecessors = predecessors;
    }

    public int getSource() {
        return source;
    }

    public boolean isReachable(int vertexId) {
        return distances.containsKey(vertexId);
    }

    public OptionalDouble getDistance(int vertexId) {
        if (!isReachable(vertexId)) {
            return OptionalDouble.empty();
        }

        return OptionalDouble.of(distances.get(vertexId));
    }

    /**
     * @return the vertex preceding {@code vertexId} on its shortest path; empty for the
     * source and for unreachable vertices
     */
    public OptionalInt getPredecessor(int vertexId) {
        int predecessor = predecessors.get(vertexId);

        if (predecessor < 0) {
            return OptionalInt.empty();
        }

        return OptionalInt.of(predecessor);
    }

    // ascending
    public int[] getReachableVertices() {
        int[] reachable = distances.keySet().toIntArray();
        Arrays.sort(reachable);
        return reachable;
    }

    public int size() {
        return distances.size();
    }

    public List<Entry> getEntries() {
        ImmutableList.Builder<Entry> entries = ImmutableList.builder();

        for (int vertexId : getReachableVertices()) {
            entries.add(new Entry(vertexId, distances.get(vertexId), getPredecessor(vertexId)));
        }

        return entries.build();
    }

    public Path pathTo(int target) throws GraphException {
        if (!isReachable(target)) {
            throw new GraphException(GraphErrorKind.NO_PATH,
                    "No path from " + source + " to " + target);
        }

        List<Integer> reversed = new ArrayList<>();
        int current = target;

        while (current >= 0) {
            reversed.add(current);
            current = predecessors.get(current);
        }

        Collections.reverse(reversed);

        return new Path(Ints.toArray(reversed), distances.get(target));
    }

    public static final class Entry {
        private final int vertexId;
        private final double distance;
        private final OptionalInt predecessor;

        Entry(int vertexId, double distance, OptionalInt predecessor) {
            this.vertexId = vertexId;
            this.distance = distance;
            this.predecessor = predecessor;
        }

        public int getVertexId() {
            return vertexId;
        }

        public double getDistance() {
            return distance;
        }

        public OptionalInt getPredecessor() {
            return predecessor;
        }

        @Override
        public String toString() {
            return "Entry{" +
                    "vertexId=" + vertexId +
                    ", distance=" + distance +
                    ", predecessor=" + predecessor +
                    '}';
        }
    }
}

package io.edgewise.graph;

import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import java.util.Arrays;

public class BasicVertexNeighbourhood implements VertexNeighbourhood {
    // Key = neighbour vertex id, Value = edge id that connects owner of neighbourhood with Key
    protected IntIntMap outgoingMap;
    protected IntIntMap incomingMap;

    public BasicVertexNeighbourhood() {
        this.outgoingMap = HashIntIntMaps.getDefaultFactory().withDefaultValue(-1).newMutableMap();
        this.incomingMap = HashIntIntMaps.getDefaultFactory().withDefaultValue(-1).newMutableMap();
    }

    @Override
    public int[] getOutgoingEdges() {
        return sortedEdgeIds(outgoingMap);
    }

    @Override
    public int[] getIncomingEdges() {
        return sortedEdgeIds(incomingMap);
    }

    private static int[] sortedEdgeIds(IntIntMap neighbourhoodMap) {
        int[] edgeIds = neighbourhoodMap.values().toIntArray();
        Arrays.sort(edgeIds);
        return edgeIds;
    }

    @Override
    public int getOutgoingEdge(int neighbourVertexId) {
        return outgoingMap.get(neighbourVertexId);
    }

    @Override
    public int getIncomingEdge(int neighbourVertexId) {
        return incomingMap.get(neighbourVertexId);
    }

    @Override
    public void addOutgoingEdge(int neighbourVertexId, int edgeId) {
        outgoingMap.put(neighbourVertexId, edgeId);
    }

    @Override
    public void addIncomingEdge(int neighbourVertexId, int edgeId) {
        incomingMap.put(neighbourVertexId, edgeId);
    }

    @Override
    public void removeOutgoingEdge(int neighbourVertexId) {
        outgoingMap.remove(neighbourVertexId);
    }

    @Override
    public void removeIncomingEdge(int neighbourVertexId) {
        incomingMap.remove(neighbourVertexId);
    }

    @Override
    public String toString() {
        return "BasicVertexNeighbourhood{" +
                "outgoingMap=" + outgoingMap +
                ", incomingMap=" + incomingMap +
                '}';
    }
}

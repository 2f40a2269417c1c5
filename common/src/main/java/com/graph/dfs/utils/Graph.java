package com.graph.dfs.utils;

import java.util.List;

/**
 * Immutable directed graph stored as one adjacency list per vertex id in {@code [0, n)}.
 * Duplicate edges and self-loops are kept as given.
 */
public class Graph {

    private final int[][] adjacency;
    private final long edgeCount;

    public Graph(int[][] adjacency) {
        int n = adjacency.length;
        this.adjacency = new int[n][];
        long edges = 0;
        for (int v = 0; v < n; v++) {
            int[] neighbors = adjacency[v] == null ? new int[0] : adjacency[v].clone();
            for (int neighbor : neighbors) {
                if (neighbor < 0 || neighbor >= n) {
                    throw new IllegalArgumentException("Edge " + v + " -> " + neighbor
                            + " leaves the vertex range [0, " + n + ")");
                }
            }
            this.adjacency[v] = neighbors;
            edges += neighbors.length;
        }
        this.edgeCount = edges;
    }

    public static Graph fromLists(List<List<Integer>> lists) {
        int[][] adjacency = new int[lists.size()][];
        for (int v = 0; v < lists.size(); v++) {
            adjacency[v] = lists.get(v).stream().mapToInt(Integer::intValue).toArray();
        }
        return new Graph(adjacency);
    }

    public int vertexCount() {
        return adjacency.length;
    }

    public long edgeCount() {
        return edgeCount;
    }

    /**
     * Neighbors of {@code vertex} in insertion order. The returned array is shared and must not be modified.
     */
    public int[] neighbors(int vertex) {
        return adjacency[vertex];
    }

    @Override
    public String toString() {
        return String.format("Graph[vertices:%d, edges:%d]", vertexCount(), edgeCount);
    }
}

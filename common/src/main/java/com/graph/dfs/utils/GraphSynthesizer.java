package com.graph.dfs.utils;

import com.graph.dfs.proto.GraphShape;

import java.util.Arrays;

// Built from the vertex count alone so every worker derives an identical copy.
public final class GraphSynthesizer {

    private GraphSynthesizer() {
    }

    public static Graph synthesize(GraphShape shape, int numVertices) {
        if (numVertices < 0) {
            throw new IllegalArgumentException("Vertex count must be non-negative, got " + numVertices);
        }
        switch (shape) {
            case WEAK_SCALING_RING:
                return weakScalingRing(numVertices);
            case MODULAR_FAN:
                return modularFan(numVertices);
            default:
                throw new IllegalArgumentException("Unsupported graph shape " + shape);
        }
    }

    /**
     * Every vertex {@code i} links to {@code (i + 7j) mod n} for {@code j = 1..3}.
     */
    public static Graph weakScalingRing(int numVertices) {
        int[][] adjacency = new int[numVertices][];
        for (int i = 0; i < numVertices; i++) {
            adjacency[i] = new int[3];
            for (int j = 1; j <= 3; j++) {
                adjacency[i][j - 1] = (int) ((i + j * 7L) % numVertices);
            }
        }
        return new Graph(adjacency);
    }

    /**
     * Vertex {@code i} links to {@code (7i + 13j) mod n} for {@code j = 1..2+(i mod 3)}, skipping self-loops.
     */
    public static Graph modularFan(int numVertices) {
        int[][] adjacency = new int[numVertices][];
        for (int i = 0; i < numVertices; i++) {
            int connections = 2 + (i % 3);
            int[] neighbors = new int[connections];
            int count = 0;
            for (int j = 1; j <= connections; j++) {
                int neighbor = (int) ((i * 7L + j * 13L) % numVertices);
                if (neighbor != i) {
                    neighbors[count++] = neighbor;
                }
            }
            adjacency[i] = Arrays.copyOf(neighbors, count);
        }
        return new Graph(adjacency);
    }
}

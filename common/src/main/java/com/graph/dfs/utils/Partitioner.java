package com.graph.dfs.utils;

/**
 * Static block partitioning of {@code [0, totalVertices)} over a fixed number of workers.
 *
 * The first {@code totalVertices % numWorkers} ranks get one extra vertex. Both directions
 * are recomputed from the formula on every call and must agree for every vertex.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static DomainInfo partition(int totalVertices, int rank, int numWorkers) {
        checkArguments(totalVertices, numWorkers);
        if (rank < 0 || rank >= numWorkers) {
            throw new IllegalArgumentException("Rank " + rank + " is outside [0, " + numWorkers + ")");
        }

        int baseSize = totalVertices / numWorkers;
        int remainder = totalVertices % numWorkers;

        int localSize;
        int startVertex;
        if (rank < remainder) {
            localSize = baseSize + 1;
            startVertex = rank * localSize;
        } else {
            localSize = baseSize;
            startVertex = remainder * (baseSize + 1) + (rank - remainder) * baseSize;
        }

        return new DomainInfo(rank, numWorkers, startVertex, startVertex + localSize);
    }

    /**
     * Returns the rank owning {@code vertex}. The vertex must lie in {@code [0, totalVertices)}.
     */
    public static int ownerOf(int vertex, int totalVertices, int numWorkers) {
        checkArguments(totalVertices, numWorkers);
        if (vertex < 0 || vertex >= totalVertices) {
            throw new IllegalArgumentException(
                    "Vertex " + vertex + " is outside [0, " + totalVertices + ")");
        }

        int baseSize = totalVertices / numWorkers;
        int remainder = totalVertices % numWorkers;

        int threshold = remainder * (baseSize + 1);
        if (vertex < threshold) {
            return vertex / (baseSize + 1);
        } else {
            return remainder + (vertex - threshold) / baseSize;
        }
    }

    /**
     * Checks that the ranges of all ranks tile {@code [0, totalVertices)} and that
     * {@link #ownerOf} maps the first and last vertex of every range back to its rank.
     *
     * @throws IllegalStateException if the two directions disagree
     */
    public static void verify(int totalVertices, int numWorkers) {
        int expectedStart = 0;
        for (int rank = 0; rank < numWorkers; rank++) {
            DomainInfo domain = partition(totalVertices, rank, numWorkers);
            if (domain.startVertex != expectedStart) {
                throw new IllegalStateException("Gap or overlap before " + domain);
            }
            if (!domain.isEmpty()) {
                int firstOwner = ownerOf(domain.startVertex, totalVertices, numWorkers);
                int lastOwner = ownerOf(domain.endVertex - 1, totalVertices, numWorkers);
                if (firstOwner != rank || lastOwner != rank) {
                    throw new IllegalStateException("Owner lookup disagrees with " + domain
                            + ": first vertex -> " + firstOwner + ", last vertex -> " + lastOwner);
                }
            }
            expectedStart = domain.endVertex;
        }
        if (expectedStart != totalVertices) {
            throw new IllegalStateException(
                    "Partitions cover " + expectedStart + " of " + totalVertices + " vertices");
        }
    }

    private static void checkArguments(int totalVertices, int numWorkers) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("At least one worker is required, got " + numWorkers);
        }
        if (totalVertices < 0) {
            throw new IllegalArgumentException("Vertex count must be non-negative, got " + totalVertices);
        }
    }
}

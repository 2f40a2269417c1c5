package com.graph.dfs.utils;

public class TraversalSummary {
    private final int numWorkers;
    private final int totalVertices;
    private final double maxElapsedSeconds;
    private final long totalVisited;
    private final boolean found;

    public TraversalSummary(int numWorkers, int totalVertices, double maxElapsedSeconds,
            long totalVisited, boolean found) {
        this.numWorkers = numWorkers;
        this.totalVertices = totalVertices;
        this.maxElapsedSeconds = maxElapsedSeconds;
        this.totalVisited = totalVisited;
        this.found = found;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public int getTotalVertices() {
        return totalVertices;
    }

    public int getVerticesPerWorker() {
        return numWorkers == 0 ? 0 : totalVertices / numWorkers;
    }

    public double getMaxElapsedSeconds() {
        return maxElapsedSeconds;
    }

    public long getTotalVisited() {
        return totalVisited;
    }

    public boolean isFound() {
        return found;
    }

    @Override
    public String toString() {
        return String.format("TraversalSummary[workers:%d, vertices:%d, time:%.6fs, visited:%d, found:%b]",
                numWorkers, totalVertices, maxElapsedSeconds, totalVisited, found);
    }
}

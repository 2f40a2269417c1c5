package com.graph.dfs.utils;

// Owned vertices are [startVertex, endVertex); empty when there are more workers than vertices.
public class DomainInfo {
    public final int rank;
    public final int numWorkers;
    public final int startVertex;
    public final int endVertex;
    public final int localSize;

    public DomainInfo(int rank, int numWorkers, int startVertex, int endVertex) {
        this.rank = rank;
        this.numWorkers = numWorkers;
        this.startVertex = startVertex;
        this.endVertex = endVertex;
        this.localSize = endVertex - startVertex;
    }

    public boolean isLocal(int vertex) {
        return vertex >= startVertex && vertex < endVertex;
    }

    public boolean isEmpty() {
        return localSize == 0;
    }

    @Override
    public String toString() {
        return String.format("DomainInfo[rank:%d/%d, vertices:[%d,%d), size:%d]",
                rank, numWorkers, startVertex, endVertex, localSize);
    }
}

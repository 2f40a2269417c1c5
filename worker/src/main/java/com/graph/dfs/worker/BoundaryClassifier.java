package com.graph.dfs.worker;

import com.graph.dfs.utils.DomainInfo;
import com.graph.dfs.utils.Graph;

import org.jgrapht.alg.util.Pair;

import java.util.Arrays;

/**
 * Splits a worker's owned range into interior vertices (every edge stays local)
 * and boundary vertices (at least one edge leaves the partition).
 */
public final class BoundaryClassifier {

    private BoundaryClassifier() {
    }

    /**
     * @return (interior, boundary), each in ascending vertex order
     */
    public static Pair<int[], int[]> classify(Graph graph, DomainInfo domain) {
        int[] interior = new int[domain.localSize];
        int[] boundary = new int[domain.localSize];
        int numInterior = 0;
        int numBoundary = 0;

        for (int v = domain.startVertex; v < domain.endVertex; v++) {
            if (isBoundaryVertex(graph, domain, v)) {
                boundary[numBoundary++] = v;
            } else {
                interior[numInterior++] = v;
            }
        }

        return new Pair<>(Arrays.copyOf(interior, numInterior), Arrays.copyOf(boundary, numBoundary));
    }

    public static boolean isBoundaryVertex(Graph graph, DomainInfo domain, int vertex) {
        if (!domain.isLocal(vertex)) {
            return false;
        }
        for (int neighbor : graph.neighbors(vertex)) {
            if (!domain.isLocal(neighbor)) {
                return true;
            }
        }
        return false;
    }
}

package com.graph.dfs.worker;

import com.graph.dfs.utils.DomainInfo;
import com.graph.dfs.utils.Graph;

import java.util.Arrays;
import java.util.Set;

/**
 * Depth-first traversal confined to the vertices one worker owns.
 *
 * Uses an explicit stack of (vertex, next neighbor index) frames, so the visit order is the same as
 * the recursive formulation while the depth is bounded by the local partition size rather than the
 * thread's call stack. Visited state is kept across calls: a worker runs many traversals (one per
 * interior, boundary and requested start vertex) against a single instance.
 */
public class LocalTraversal {

    private final Graph graph;
    private final DomainInfo domain;
    private final int target;
    private final int workPerVertex;

    // Sized over the whole graph so any vertex id can be checked directly.
    private final boolean[] visited;
    private final int[] visitOrder;
    private int visitedCount;

    private final int[] stackVertices;
    private final int[] stackCursors;

    private boolean found;
    private double workSink;

    public LocalTraversal(Graph graph, DomainInfo domain, int target, int workPerVertex) {
        this.graph = graph;
        this.domain = domain;
        this.target = target;
        this.workPerVertex = workPerVertex;
        this.visited = new boolean[graph.vertexCount()];
        this.visitOrder = new int[domain.localSize];
        int capacity = Math.max(1, domain.localSize);
        this.stackVertices = new int[capacity];
        this.stackCursors = new int[capacity];
    }

    /**
     * Traverses from {@code start}. Non-local neighbors are added to {@code externalReferences}
     * (when it is not null) and never entered.
     *
     * @return true if the target was reached during this call
     */
    public boolean traverse(int start, Set<Integer> externalReferences) {
        if (!domain.isLocal(start)) {
            throw new IllegalArgumentException("Vertex " + start + " is not owned by " + domain);
        }
        if (visited[start]) {
            return false;
        }
        if (enter(start)) {
            return true;
        }

        int depth = 0;
        stackVertices[depth] = start;
        stackCursors[depth] = 0;
        depth++;

        while (depth > 0) {
            int top = depth - 1;
            int[] neighbors = graph.neighbors(stackVertices[top]);
            if (stackCursors[top] == neighbors.length) {
                depth--;
                continue;
            }

            int neighbor = neighbors[stackCursors[top]++];
            if (domain.isLocal(neighbor)) {
                if (!visited[neighbor]) {
                    if (enter(neighbor)) {
                        return true;
                    }
                    stackVertices[depth] = neighbor;
                    stackCursors[depth] = 0;
                    depth++;
                }
            } else {
                if (neighbor < 0 || neighbor >= visited.length) {
                    throw new IllegalStateException("Malformed graph: vertex " + stackVertices[top]
                            + " links to " + neighbor + ", outside [0, " + visited.length + ")");
                }
                if (externalReferences != null) {
                    externalReferences.add(neighbor);
                }
            }
        }
        return false;
    }

    private boolean enter(int vertex) {
        visited[vertex] = true;
        visitOrder[visitedCount++] = vertex;

        if (vertex == target) {
            found = true;
            return true;
        }

        simulateWork(vertex);
        return false;
    }

    // Same arithmetic load per vertex as the reference benchmark.
    private void simulateWork(int vertex) {
        double work = 0;
        for (int i = 0; i < workPerVertex; i++) {
            work += ((long) vertex * i) % 100;
        }
        workSink += work;
    }

    public boolean isVisited(int vertex) {
        return visited[vertex];
    }

    public boolean isFound() {
        return found;
    }

    public int getVisitedCount() {
        return visitedCount;
    }

    public int[] getVisitOrder() {
        return Arrays.copyOf(visitOrder, visitedCount);
    }

    double getWorkSink() {
        return workSink;
    }
}

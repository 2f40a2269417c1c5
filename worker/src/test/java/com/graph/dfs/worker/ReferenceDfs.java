package com.graph.dfs.worker;

import com.graph.dfs.utils.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain recursive single-process DFS used as the expected result in tests. Starts from every
 * unvisited vertex in ascending order and stops everything once the target is reached.
 */
final class ReferenceDfs {

    private final Graph graph;
    private final int target;
    private final boolean[] visited;
    private final List<Integer> order = new ArrayList<>();
    private boolean found;

    private ReferenceDfs(Graph graph, int target) {
        this.graph = graph;
        this.target = target;
        this.visited = new boolean[graph.vertexCount()];
    }

    static List<Integer> visitOrder(Graph graph, int target) {
        ReferenceDfs dfs = new ReferenceDfs(graph, target);
        for (int v = 0; v < graph.vertexCount() && !dfs.found; v++) {
            if (!dfs.visited[v]) {
                dfs.visit(v);
            }
        }
        return dfs.order;
    }

    private boolean visit(int v) {
        visited[v] = true;
        order.add(v);
        if (v == target) {
            found = true;
            return true;
        }
        for (int neighbor : graph.neighbors(v)) {
            if (!visited[neighbor] && visit(neighbor)) {
                return true;
            }
        }
        return false;
    }
}

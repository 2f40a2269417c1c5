package com.graph.dfs.worker;

import com.graph.dfs.utils.DomainInfo;
import com.graph.dfs.utils.Graph;

import org.jgrapht.alg.util.Pair;

import java.util.TreeSet;

/**
 * Runs one worker's local phase: interior traversal overlapped with the halo announce phase,
 * then the boundary vertices, then the vertices other workers asked about.
 *
 * A worker that finds the target stops starting new traversals but still completes every
 * outstanding receive and send. Unless {@code broadcastFound} is set, the other workers are
 * not told and carry on with their own traversals.
 */
public class TraversalOrchestrator {

    private final Graph graph;
    private final DomainInfo domain;
    private final HaloExchange halo;
    private final LocalTraversal traversal;
    private final boolean broadcastFound;

    public TraversalOrchestrator(Graph graph, DomainInfo domain, HaloExchange halo,
            int target, int workPerVertex, boolean broadcastFound) {
        this.graph = graph;
        this.domain = domain;
        this.halo = halo;
        this.traversal = new LocalTraversal(graph, domain, target, workPerVertex);
        this.broadcastFound = broadcastFound;
    }

    public TraversalResult run() {
        Pair<int[], int[]> split = BoundaryClassifier.classify(graph, domain);
        int[] interior = split.getFirst();
        int[] boundary = split.getSecond();

        halo.announce(graph, boundary);

        for (int v : interior) {
            if (shouldStop()) {
                break;
            }
            visitFrom(v, null);
        }

        halo.awaitCounts();
        int[][] received = halo.fulfil();

        TreeSet<Integer> externalReferences = new TreeSet<>();
        for (int v : boundary) {
            if (shouldStop()) {
                break;
            }
            visitFrom(v, externalReferences);
        }

        int requestsReceived = 0;
        for (int[] payload : received) {
            requestsReceived += payload.length;
        }

        int requestsFulfilled = 0;
        outer:
        for (int srcRank = 0; srcRank < domain.numWorkers; srcRank++) {
            if (srcRank == domain.rank) {
                continue;
            }
            for (int v : received[srcRank]) {
                if (shouldStop()) {
                    break outer;
                }
                if (domain.isLocal(v) && !traversal.isVisited(v)) {
                    requestsFulfilled++;
                    visitFrom(v, null);
                }
            }
        }

        halo.awaitSends();

        return new TraversalResult(traversal.getVisitOrder(), traversal.isFound(), externalReferences.size(),
                halo.getRequestsSent(), requestsReceived, requestsFulfilled);
    }

    private void visitFrom(int v, TreeSet<Integer> externalReferences) {
        if (traversal.isVisited(v)) {
            return;
        }
        if (traversal.traverse(v, externalReferences) && broadcastFound) {
            halo.notifyFound();
        }
    }

    private boolean shouldStop() {
        return traversal.isFound() || (broadcastFound && halo.peerFound());
    }
}

package com.graph.dfs.worker;

import com.graph.dfs.proto.HaloTag;

import java.util.concurrent.CompletableFuture;

/**
 * Point-to-point channel between the workers of a cluster.
 *
 * Messages are matched by (run id, source rank, tag). Both operations return immediately;
 * a send's future completes once the buffer may be reused, a receive's future once the
 * matching message has arrived.
 */
public interface HaloTransport {

    int getRank();

    int getNumWorkers();

    CompletableFuture<Void> send(int runId, int destRank, HaloTag tag, int[] vertices);

    CompletableFuture<int[]> receive(int runId, int srcRank, HaloTag tag);

    /**
     * True once any peer has sent {@link HaloTag#FOUND} for this run.
     */
    boolean peerFound(int runId);

    /**
     * Drops whatever this worker still holds for a finished run.
     */
    void release(int runId);
}

package com.graph.dfs.worker;

import com.graph.dfs.proto.HaloMessage;
import com.graph.dfs.proto.HaloTag;
import com.graph.dfs.utils.WorkerClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;

// Incoming messages reach the mailbox through the worker's Deliver handler.
public class GrpcHaloTransport implements HaloTransport {

    private final int rank;
    private final List<WorkerClient> peers;
    private final HaloMailbox mailbox;

    /**
     * @param peers one client per rank; the entry at {@code rank} is never used
     */
    public GrpcHaloTransport(int rank, List<WorkerClient> peers, HaloMailbox mailbox) {
        this.rank = rank;
        this.peers = peers;
        this.mailbox = mailbox;
    }

    @Override
    public int getRank() {
        return rank;
    }

    @Override
    public int getNumWorkers() {
        return peers.size();
    }

    @Override
    public CompletableFuture<Void> send(int runId, int destRank, HaloTag tag, int[] vertices) {
        HaloMessage.Builder builder = HaloMessage.newBuilder()
                .setRunId(runId)
                .setSrcRank(rank)
                .setTag(tag);
        for (int vertex : vertices) {
            builder.addVertices(vertex);
        }
        return peers.get(destRank).deliver(builder.build()).thenApply(response -> null);
    }

    @Override
    public CompletableFuture<int[]> receive(int runId, int srcRank, HaloTag tag) {
        return mailbox.receive(runId, srcRank, tag);
    }

    @Override
    public boolean peerFound(int runId) {
        return mailbox.peerFound(runId);
    }

    @Override
    public void release(int runId) {
        mailbox.discard(runId);
    }
}

package com.graph.dfs.worker;

import com.graph.dfs.proto.HaloTag;

import java.util.concurrent.CompletableFuture;

public class InProcessHaloTransport implements HaloTransport {

    private final int rank;
    private final HaloMailbox[] mailboxes;

    public InProcessHaloTransport(int rank, HaloMailbox[] mailboxes) {
        this.rank = rank;
        this.mailboxes = mailboxes;
    }

    @Override
    public int getRank() {
        return rank;
    }

    @Override
    public int getNumWorkers() {
        return mailboxes.length;
    }

    @Override
    public CompletableFuture<Void> send(int runId, int destRank, HaloTag tag, int[] vertices) {
        try {
            mailboxes[destRank].deliver(runId, rank, tag, vertices.clone());
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<int[]> receive(int runId, int srcRank, HaloTag tag) {
        return mailboxes[rank].receive(runId, srcRank, tag);
    }

    @Override
    public boolean peerFound(int runId) {
        return mailboxes[rank].peerFound(runId);
    }

    @Override
    public void release(int runId) {
        mailboxes[rank].discard(runId);
    }
}

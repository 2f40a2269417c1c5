package com.graph.dfs.worker;

import com.graph.dfs.proto.HaloTag;
import com.graph.dfs.utils.DomainInfo;
import com.graph.dfs.utils.Graph;
import com.graph.dfs.utils.Partitioner;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * One worker's side of the two-phase halo exchange for a single run.
 *
 * <ol>
 * <li>{@link #announce}: post a COUNT receive for every peer, then send every peer the number of
 * its vertices this worker references, followed by the ids themselves when that number is non-zero.
 * Nothing blocks.</li>
 * <li>{@link #awaitCounts} then {@link #fulfil}: once all counts are known, post PAYLOAD receives
 * sized by them and wait for the payloads.</li>
 * </ol>
 *
 * Nothing is ever sent to or expected from the worker itself.
 */
public class HaloExchange {

    private final HaloTransport transport;
    private final int runId;
    private final DomainInfo domain;
    private final int totalVertices;

    private final List<CompletableFuture<int[]>> countReceives;
    private final List<CompletableFuture<Void>> sends = new ArrayList<>();
    private int[] announcedCounts;
    private int requestsSent;
    private boolean foundSent;

    public HaloExchange(HaloTransport transport, int runId, DomainInfo domain, int totalVertices) {
        if (transport.getNumWorkers() != domain.numWorkers) {
            throw new IllegalArgumentException("Transport connects " + transport.getNumWorkers()
                    + " workers but the partition expects " + domain.numWorkers);
        }
        this.transport = transport;
        this.runId = runId;
        this.domain = domain;
        this.totalVertices = totalVertices;
        this.countReceives = new ArrayList<>(domain.numWorkers);
    }

    /**
     * Distinct non-local neighbors of the given boundary vertices, in ascending order.
     */
    public static TreeSet<Integer> externalRequests(Graph graph, DomainInfo domain, int[] boundary) {
        TreeSet<Integer> external = new TreeSet<>();
        for (int v : boundary) {
            for (int neighbor : graph.neighbors(v)) {
                if (!domain.isLocal(neighbor)) {
                    external.add(neighbor);
                }
            }
        }
        return external;
    }

    /**
     * Groups requested vertices by owning rank. The entry for this worker stays empty.
     */
    public static int[][] groupByOwner(TreeSet<Integer> external, DomainInfo domain, int totalVertices) {
        List<List<Integer>> buffers = new ArrayList<>(domain.numWorkers);
        for (int i = 0; i < domain.numWorkers; i++) {
            buffers.add(new ArrayList<>());
        }
        for (int vertex : external) {
            int owner = Partitioner.ownerOf(vertex, totalVertices, domain.numWorkers);
            if (owner != domain.rank) {
                buffers.get(owner).add(vertex);
            }
        }

        int[][] grouped = new int[domain.numWorkers][];
        for (int i = 0; i < domain.numWorkers; i++) {
            grouped[i] = buffers.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return grouped;
    }

    public void announce(Graph graph, int[] boundary) {
        for (int srcRank = 0; srcRank < domain.numWorkers; srcRank++) {
            countReceives.add(srcRank == domain.rank
                    ? null
                    : transport.receive(runId, srcRank, HaloTag.COUNT));
        }

        int[][] sendBuffers = groupByOwner(externalRequests(graph, domain, boundary), domain, totalVertices);

        for (int destRank = 0; destRank < domain.numWorkers; destRank++) {
            if (destRank == domain.rank) {
                continue;
            }
            int size = sendBuffers[destRank].length;
            sends.add(transport.send(runId, destRank, HaloTag.COUNT, new int[] { size }));
            if (size > 0) {
                sends.add(transport.send(runId, destRank, HaloTag.PAYLOAD, sendBuffers[destRank]));
                requestsSent += size;
            }
        }
    }

    /**
     * Blocks until every peer's COUNT message has arrived.
     *
     * @return announced payload size per source rank (0 for this worker)
     */
    public int[] awaitCounts() {
        int[] counts = new int[domain.numWorkers];
        for (int srcRank = 0; srcRank < domain.numWorkers; srcRank++) {
            if (srcRank == domain.rank) {
                continue;
            }
            int[] message = await(countReceives.get(srcRank), "COUNT from worker-" + srcRank);
            if (message.length != 1 || message[0] < 0) {
                throw new IllegalStateException("Malformed COUNT message from worker-" + srcRank
                        + " for run " + runId);
            }
            counts[srcRank] = message[0];
        }
        announcedCounts = counts;
        return counts.clone();
    }

    /**
     * Posts PAYLOAD receives for every peer that announced a non-zero count and waits for all of them.
     *
     * @return requested vertex ids per source rank, empty where nothing was announced
     */
    public int[][] fulfil() {
        if (announcedCounts == null) {
            throw new IllegalStateException("Payload receives posted before the counts were known");
        }

        List<CompletableFuture<int[]>> payloadReceives = new ArrayList<>(domain.numWorkers);
        for (int srcRank = 0; srcRank < domain.numWorkers; srcRank++) {
            payloadReceives.add(srcRank != domain.rank && announcedCounts[srcRank] > 0
                    ? transport.receive(runId, srcRank, HaloTag.PAYLOAD)
                    : null);
        }

        int[][] received = new int[domain.numWorkers][];
        for (int srcRank = 0; srcRank < domain.numWorkers; srcRank++) {
            if (payloadReceives.get(srcRank) == null) {
                received[srcRank] = new int[0];
                continue;
            }
            int[] payload = await(payloadReceives.get(srcRank), "PAYLOAD from worker-" + srcRank);
            if (payload.length != announcedCounts[srcRank]) {
                throw new IllegalStateException("worker-" + srcRank + " announced " + announcedCounts[srcRank]
                        + " ids but sent " + payload.length);
            }
            received[srcRank] = payload;
        }
        return received;
    }

    /**
     * Tells every peer the target was found here. Only the first call sends anything.
     */
    public void notifyFound() {
        if (foundSent) {
            return;
        }
        foundSent = true;
        for (int destRank = 0; destRank < domain.numWorkers; destRank++) {
            if (destRank != domain.rank) {
                sends.add(transport.send(runId, destRank, HaloTag.FOUND, new int[0]));
            }
        }
    }

    public boolean peerFound() {
        return transport.peerFound(runId);
    }

    /**
     * Blocks until every send issued for this run has completed.
     */
    public void awaitSends() {
        for (CompletableFuture<Void> send : sends) {
            await(send, "send completion");
        }
    }

    public int getRequestsSent() {
        return requestsSent;
    }

    public int getPostedSends() {
        return sends.size();
    }

    private <T> T await(CompletableFuture<T> future, String what) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HaloExchangeException("Interrupted while waiting for " + what + " in run " + runId, e);
        } catch (ExecutionException e) {
            throw new HaloExchangeException("Failed waiting for " + what + " in run " + runId, e.getCause());
        }
    }
}

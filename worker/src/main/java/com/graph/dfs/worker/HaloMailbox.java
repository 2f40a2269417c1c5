package com.graph.dfs.worker;

import com.graph.dfs.proto.HaloTag;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Receiving side of one worker. A delivered message and the receive posted for it meet in the
 * same slot, whichever comes first.
 *
 * Runs are retired in increasing id order. Anything arriving for a run at or below the newest
 * retired id is dropped.
 */
public class HaloMailbox {

    private final ConcurrentHashMap<SlotKey, CompletableFuture<int[]>> slots = new ConcurrentHashMap<>();
    private final Set<Integer> foundRuns = ConcurrentHashMap.newKeySet();
    private final AtomicInteger retiredThrough = new AtomicInteger(Integer.MIN_VALUE);

    public void deliver(int runId, int srcRank, HaloTag tag, int[] vertices) {
        if (isRetired(runId)) {
            System.out.println("Dropping late " + tag + " message from worker-" + srcRank
                    + " for finished run " + runId);
            return;
        }
        if (tag == HaloTag.FOUND) {
            foundRuns.add(runId);
            // discard may have run between the check and the add
            if (isRetired(runId)) {
                foundRuns.remove(runId);
            }
            return;
        }
        SlotKey key = new SlotKey(runId, srcRank, tag);
        if (!slot(key).complete(vertices)) {
            throw new DuplicateMessageException("Duplicate " + tag + " message from worker-" + srcRank
                    + " for run " + runId);
        }
        if (isRetired(runId)) {
            slots.remove(key);
        }
    }

    public CompletableFuture<int[]> receive(int runId, int srcRank, HaloTag tag) {
        return slot(new SlotKey(runId, srcRank, tag));
    }

    public boolean peerFound(int runId) {
        return foundRuns.contains(runId);
    }

    /**
     * Retires {@code runId} and every older run, dropping whatever is still held for them.
     */
    public void discard(int runId) {
        int retired = retiredThrough.accumulateAndGet(runId, Math::max);
        slots.keySet().removeIf(key -> key.runId <= retired);
        foundRuns.removeIf(id -> id <= retired);
    }

    public boolean isRetired(int runId) {
        return runId <= retiredThrough.get();
    }

    public int size() {
        return slots.size();
    }

    private CompletableFuture<int[]> slot(SlotKey key) {
        return slots.computeIfAbsent(key, k -> new CompletableFuture<>());
    }

    private static final class SlotKey {
        private final int runId;
        private final int srcRank;
        private final HaloTag tag;

        SlotKey(int runId, int srcRank, HaloTag tag) {
            this.runId = runId;
            this.srcRank = srcRank;
            this.tag = tag;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SlotKey)) {
                return false;
            }
            SlotKey other = (SlotKey) o;
            return runId == other.runId && srcRank == other.srcRank && tag == other.tag;
        }

        @Override
        public int hashCode() {
            return Objects.hash(runId, srcRank, tag);
        }
    }
}

package com.graph.dfs.worker;

import com.graph.dfs.proto.HaloTag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HaloMailbox Tests")
class HaloMailboxTest {

    private final HaloMailbox mailbox = new HaloMailbox();

    @Test
    @DisplayName("A receive posted first should complete on delivery")
    void receiveBeforeDeliver() {
        CompletableFuture<int[]> receive = mailbox.receive(1, 2, HaloTag.COUNT);
        assertFalse(receive.isDone());

        mailbox.deliver(1, 2, HaloTag.COUNT, new int[] { 5 });

        assertArrayEquals(new int[] { 5 }, receive.join());
    }

    @Test
    @DisplayName("A message delivered first should wait for its receive")
    void deliverBeforeReceive() {
        mailbox.deliver(1, 0, HaloTag.PAYLOAD, new int[] { 7, 9 });

        assertArrayEquals(new int[] { 7, 9 }, mailbox.receive(1, 0, HaloTag.PAYLOAD).join());
    }

    @Test
    @DisplayName("Should match on source and tag")
    void shouldMatchOnSourceAndTag() {
        mailbox.deliver(1, 0, HaloTag.COUNT, new int[] { 1 });

        assertFalse(mailbox.receive(1, 0, HaloTag.PAYLOAD).isDone());
        assertFalse(mailbox.receive(1, 3, HaloTag.COUNT).isDone());
        assertTrue(mailbox.receive(1, 0, HaloTag.COUNT).isDone());
    }

    @Test
    @DisplayName("Should reject a second message for the same slot")
    void shouldRejectDuplicates() {
        mailbox.deliver(4, 1, HaloTag.COUNT, new int[] { 2 });

        assertThrows(DuplicateMessageException.class, () -> mailbox.deliver(4, 1, HaloTag.COUNT, new int[] { 3 }));
        assertArrayEquals(new int[] { 2 }, mailbox.receive(4, 1, HaloTag.COUNT).join());
    }

    @Test
    @DisplayName("Messages of different runs should not interfere")
    void runsShouldBeIsolated() {
        mailbox.deliver(1, 0, HaloTag.COUNT, new int[] { 1 });
        mailbox.deliver(2, 0, HaloTag.COUNT, new int[] { 2 });

        assertArrayEquals(new int[] { 1 }, mailbox.receive(1, 0, HaloTag.COUNT).join());
        assertArrayEquals(new int[] { 2 }, mailbox.receive(2, 0, HaloTag.COUNT).join());
    }

    @Test
    @DisplayName("FOUND should only flag its own run and may arrive more than once")
    void foundShouldFlagRun() {
        mailbox.deliver(3, 1, HaloTag.FOUND, new int[0]);
        mailbox.deliver(3, 2, HaloTag.FOUND, new int[0]);

        assertTrue(mailbox.peerFound(3));
        assertFalse(mailbox.peerFound(4));
        assertEquals(0, mailbox.size());
    }

    @Test
    @DisplayName("Discarding a run should drop only its state")
    void discardShouldDropRun() {
        mailbox.deliver(1, 0, HaloTag.COUNT, new int[] { 1 });
        mailbox.deliver(1, 0, HaloTag.FOUND, new int[0]);
        mailbox.deliver(2, 0, HaloTag.COUNT, new int[] { 1 });

        mailbox.discard(1);

        assertEquals(1, mailbox.size());
        assertFalse(mailbox.peerFound(1));
        assertTrue(mailbox.receive(2, 0, HaloTag.COUNT).isDone());
    }

    @Test
    @DisplayName("Messages arriving after a run was discarded should be dropped")
    void lateMessagesShouldBeDropped() {
        mailbox.discard(7);

        mailbox.deliver(7, 1, HaloTag.FOUND, new int[0]);
        assertDoesNotThrow(() -> mailbox.deliver(7, 1, HaloTag.COUNT, new int[] { 1 }));
        assertDoesNotThrow(() -> mailbox.deliver(7, 1, HaloTag.COUNT, new int[] { 1 }));

        assertFalse(mailbox.peerFound(7));
        assertEquals(0, mailbox.size());
        assertTrue(mailbox.isRetired(7));
    }

    @Test
    @DisplayName("Discarding a run should retire every older run too")
    void discardShouldRetireOlderRuns() {
        mailbox.deliver(3, 0, HaloTag.FOUND, new int[0]);
        mailbox.deliver(4, 0, HaloTag.COUNT, new int[] { 1 });

        mailbox.discard(5);
        mailbox.deliver(2, 0, HaloTag.FOUND, new int[0]);

        assertFalse(mailbox.peerFound(3));
        assertFalse(mailbox.peerFound(2));
        assertEquals(0, mailbox.size());
        assertFalse(mailbox.isRetired(6));
    }
}

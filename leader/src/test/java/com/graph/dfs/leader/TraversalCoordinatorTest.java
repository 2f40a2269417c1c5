package com.graph.dfs.leader;

import com.graph.dfs.proto.*;
import com.graph.dfs.utils.TraversalSummary;
import com.graph.dfs.utils.WorkerClient;

import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraversalCoordinator Tests")
class TraversalCoordinatorTest {

    private final List<Server> servers = new ArrayList<>();
    private final List<WorkerClient> clients = new ArrayList<>();
    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    /**
     * Stands in for a worker: records every call and answers Traverse with a fixed report.
     */
    private class FakeWorker extends GraphServiceGrpc.GraphServiceImplBase {
        final int rank;
        final List<RunConfig> prepared = Collections.synchronizedList(new ArrayList<>());
        TraversalReport report;
        Status traverseFailure;
        boolean traverseHangs;
        boolean prepareRefused;

        FakeWorker(int rank, int visited, boolean found, long elapsedNanos) {
            this.rank = rank;
            this.report = TraversalReport.newBuilder()
                    .setRank(rank)
                    .setVisitedCount(visited)
                    .setFound(found)
                    .setElapsedNanos(elapsedNanos)
                    .build();
        }

        @Override
        public void prepare(RunConfig request, StreamObserver<PrepareResponse> responseObserver) {
            events.add("prepare-" + rank);
            prepared.add(request);
            responseObserver.onNext(PrepareResponse.newBuilder()
                    .setSuccess(!prepareRefused)
                    .setRank(rank)
                    .build());
            responseObserver.onCompleted();
        }

        @Override
        public void traverse(TraverseRequest request, StreamObserver<TraversalReport> responseObserver) {
            events.add("traverse-" + rank + "-" + request.getRunId());
            if (traverseHangs) {
                return;
            }
            if (traverseFailure != null) {
                responseObserver.onError(traverseFailure.asRuntimeException());
                return;
            }
            responseObserver.onNext(report);
            responseObserver.onCompleted();
        }
    }

    private TraversalCoordinator coordinatorFor(FakeWorker... workers) throws Exception {
        String prefix = "coordinator-test-" + System.nanoTime() + "-";
        for (FakeWorker worker : workers) {
            String name = prefix + worker.rank;
            servers.add(InProcessServerBuilder.forName(name).addService(worker).build().start());
            clients.add(new WorkerClient(InProcessChannelBuilder.forName(name).build()));
        }
        return new TraversalCoordinator(new ArrayList<>(clients), 1000, GraphShape.MODULAR_FAN);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Server server : servers) {
            server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        }
        for (WorkerClient client : clients) {
            client.shutdown();
        }
    }

    @Test
    @DisplayName("Should reduce the reports of all workers")
    void shouldAggregateReports() throws Exception {
        TraversalCoordinator coordinator = coordinatorFor(
                new FakeWorker(0, 100, false, 2_000_000_000L),
                new FakeWorker(1, 40, true, 500_000_000L),
                new FakeWorker(2, 60, false, 3_000_000_000L));

        TraversalSummary summary = coordinator.run(new RunParameters(300, 150, false));

        assertEquals(3, summary.getNumWorkers());
        assertEquals(300, summary.getTotalVertices());
        assertEquals(200, summary.getTotalVisited());
        assertEquals(3.0, summary.getMaxElapsedSeconds(), 1e-9);
        assertTrue(summary.isFound());
    }

    @Test
    @DisplayName("Should prepare every worker before any traversal starts")
    void shouldPrepareBeforeTraversing() throws Exception {
        FakeWorker first = new FakeWorker(0, 1, false, 1);
        FakeWorker second = new FakeWorker(1, 1, false, 1);
        TraversalCoordinator coordinator = coordinatorFor(first, second);

        coordinator.run(new RunParameters(20, 5, true));

        assertEquals(List.of("prepare-0", "prepare-1"), events.subList(0, 2));
        assertEquals(4, events.size());

        RunConfig config = first.prepared.get(0);
        assertEquals(config, second.prepared.get(0));
        assertEquals(2, config.getNumWorkers());
        assertEquals(20, config.getTotalVertices());
        assertEquals(5, config.getTargetVertex());
        assertEquals(1000, config.getWorkPerVertex());
        assertEquals(GraphShape.MODULAR_FAN, config.getShape());
        assertTrue(config.getBroadcastFound());
        assertTrue(events.contains("traverse-0-" + config.getRunId()));
        assertTrue(events.contains("traverse-1-" + config.getRunId()));
    }

    @Test
    @DisplayName("Each run should get its own run id")
    void shouldUseFreshRunIds() throws Exception {
        FakeWorker worker = new FakeWorker(0, 1, false, 1);
        TraversalCoordinator coordinator = coordinatorFor(worker);

        coordinator.run(new RunParameters(10, 1, false));
        coordinator.run(new RunParameters(10, 1, false));

        assertNotEquals(worker.prepared.get(0).getRunId(), worker.prepared.get(1).getRunId());
    }

    @Test
    @DisplayName("A failing worker should abort the run without waiting for the others")
    void shouldAbortOnWorkerFailure() throws Exception {
        FakeWorker stuck = new FakeWorker(0, 1, false, 1);
        stuck.traverseHangs = true;
        FakeWorker failing = new FakeWorker(1, 1, false, 1);
        failing.traverseFailure = Status.INTERNAL.withDescription("halo exchange failed");
        TraversalCoordinator coordinator = coordinatorFor(stuck, failing);

        StatusRuntimeException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(StatusRuntimeException.class,
                        () -> coordinator.run(new RunParameters(10, 1, false))));

        assertEquals(Status.Code.INTERNAL, e.getStatus().getCode());
    }

    @Test
    @DisplayName("A worker refusing to prepare should abort before any traversal")
    void shouldAbortOnRefusedPrepare() throws Exception {
        FakeWorker refusing = new FakeWorker(0, 1, false, 1);
        refusing.prepareRefused = true;
        TraversalCoordinator coordinator = coordinatorFor(refusing, new FakeWorker(1, 1, false, 1));

        assertThrows(RuntimeException.class, () -> coordinator.run(new RunParameters(10, 1, false)));
        assertEquals(List.of("prepare-0"), events);
    }
}

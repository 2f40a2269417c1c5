package com.graph.dfs.worker;

import com.graph.dfs.proto.*;
import com.graph.dfs.utils.ClusterConfig;
import com.graph.dfs.utils.WorkerClient;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.util.ArrayList;
import java.util.List;

public class WorkerApp {

    public static void main(String[] args) throws Exception {
        ClusterConfig config = ClusterConfig.fromEnvironment();

        // Determine ID
        String hostname = java.net.InetAddress.getLocalHost().getHostName();
        int workerId;
        try {
            workerId = config.resolveWorkerId(hostname);
        } catch (IllegalArgumentException e) {
            System.err.println("Could not determine worker ID from WORKER_ID or hostname " + hostname
                    + ", defaulting to 0");
            workerId = 0;
        }
        System.out.println("Worker starting with ID " + workerId);

        int numWorkers = config.getNumWorkers();
        int port = config.getWorkerPort();
        if (workerId >= numWorkers) {
            throw new IllegalArgumentException("Worker ID " + workerId + " is outside [0, " + numWorkers + ")");
        }

        List<WorkerClient> peers = new ArrayList<>();
        for (int i = 0; i < numWorkers; i++) {
            String workerHost = i == workerId ? "localhost" : config.getWorkerHost(i);
            System.out.println("Connecting to peer worker " + i + " at " + workerHost + ":" + port);
            peers.add(new WorkerClient(workerHost, port));
        }

        HaloMailbox mailbox = new HaloMailbox();
        TraversalWorker worker = new TraversalWorker(new GrpcHaloTransport(workerId, peers, mailbox));

        Server server = ServerBuilder.forPort(port)
                .addService(new GraphServiceImpl(worker, mailbox))
                .maxInboundMessageSize(50 * 1024 * 1024) // 50 MB
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.shutdown();
            for (WorkerClient peer : peers) {
                peer.shutdown();
            }
        }));

        server.start();
        System.out.println("Worker " + workerId + " of " + numWorkers + " started on port " + port + "...");
        server.awaitTermination();
    }

    public static class GraphServiceImpl extends GraphServiceGrpc.GraphServiceImplBase {

        private final TraversalWorker worker;
        private final HaloMailbox mailbox;

        public GraphServiceImpl(TraversalWorker worker, HaloMailbox mailbox) {
            this.worker = worker;
            this.mailbox = mailbox;
        }

        @Override
        public void prepare(RunConfig request, StreamObserver<PrepareResponse> responseObserver) {
            System.out.println("Received Prepare request for run " + request.getRunId() + " ("
                    + request.getTotalVertices() + " vertices, target " + request.getTargetVertex() + ")");
            try {
                responseObserver.onNext(worker.prepare(request));
                responseObserver.onCompleted();
            } catch (RuntimeException e) {
                fail(responseObserver, "Prepare of run " + request.getRunId(), e);
            }
        }

        @Override
        public void traverse(TraverseRequest request, StreamObserver<TraversalReport> responseObserver) {
            System.out.println("Received Traverse request for run " + request.getRunId());
            try {
                responseObserver.onNext(worker.traverse(request.getRunId()));
                responseObserver.onCompleted();
            } catch (RuntimeException e) {
                fail(responseObserver, "Traversal of run " + request.getRunId(), e);
            }
        }

        @Override
        public void deliver(HaloMessage request, StreamObserver<DeliverResponse> responseObserver) {
            int[] vertices = request.getVerticesList().stream().mapToInt(Integer::intValue).toArray();
            try {
                mailbox.deliver(request.getRunId(), request.getSrcRank(), request.getTag(), vertices);
                responseObserver.onNext(DeliverResponse.newBuilder().setSuccess(true).build());
                responseObserver.onCompleted();
            } catch (RuntimeException e) {
                fail(responseObserver, "Delivery from worker-" + request.getSrcRank(), e);
            }
        }

        private void fail(StreamObserver<?> responseObserver, String what, RuntimeException e) {
            System.err.println(what + " failed on worker-" + worker.getRank() + ": " + e.getMessage());
            responseObserver.onError(statusFor(e)
                    .withDescription(what + " failed: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException());
        }

        static Status statusFor(RuntimeException e) {
            if (e instanceof IllegalArgumentException) {
                return Status.INVALID_ARGUMENT;
            }
            if (e instanceof DuplicateMessageException) {
                return Status.ALREADY_EXISTS;
            }
            if (e instanceof IllegalStateException) {
                return Status.FAILED_PRECONDITION;
            }
            return Status.INTERNAL;
        }
    }
}

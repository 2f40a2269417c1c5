package com.graph.dfs.utils;

import com.graph.dfs.proto.*;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.stub.StreamObserver;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class WorkerClient {

    private final ManagedChannel channel;
    private final GraphServiceGrpc.GraphServiceBlockingStub blockingStub;
    private final GraphServiceGrpc.GraphServiceStub asyncStub;

    public WorkerClient(String host, int port) {
        this(ManagedChannelBuilder.forAddress(host, port)
                .usePlaintext()
                .maxInboundMessageSize(50 * 1024 * 1024)
                .build());
    }

    public WorkerClient(ManagedChannel channel) {
        this.channel = channel;
        this.blockingStub = GraphServiceGrpc.newBlockingStub(channel);
        this.asyncStub = GraphServiceGrpc.newStub(channel);
    }

    public PrepareResponse prepare(RunConfig config) {
        // Workers may still be starting when the leader broadcasts the first run.
        return blockingStub.withWaitForReady().prepare(config);
    }

    /**
     * Starts the local phase of a prepared run without waiting for it.
     */
    public CompletableFuture<TraversalReport> traverse(int runId) {
        TraverseRequest request = TraverseRequest.newBuilder()
                .setRunId(runId)
                .build();
        CompletableFuture<TraversalReport> future = new CompletableFuture<>();
        asyncStub.traverse(request, new UnaryObserver<>(future));
        return future;
    }

    /**
     * Non-blocking send of a halo message. The future completes once the peer has stored it.
     */
    public CompletableFuture<DeliverResponse> deliver(HaloMessage message) {
        CompletableFuture<DeliverResponse> future = new CompletableFuture<>();
        asyncStub.deliver(message, new UnaryObserver<>(future));
        return future;
    }

    public void shutdown() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class UnaryObserver<T> implements StreamObserver<T> {
        private final CompletableFuture<T> future;

        UnaryObserver(CompletableFuture<T> future) {
            this.future = future;
        }

        @Override
        public void onNext(T value) {
            future.complete(value);
        }

        @Override
        public void onError(Throwable t) {
            future.completeExceptionally(t);
        }

        @Override
        public void onCompleted() {
            // Unary call: the value arrived in onNext.
        }
    }
}

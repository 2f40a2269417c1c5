package com.graph.dfs.leader;

import com.graph.dfs.proto.GraphShape;
import com.graph.dfs.proto.PrepareResponse;
import com.graph.dfs.proto.RunConfig;
import com.graph.dfs.proto.TraversalReport;
import com.graph.dfs.utils.ResultAggregator;
import com.graph.dfs.utils.TraversalSummary;
import com.graph.dfs.utils.WorkerClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one distributed traversal over all workers:
 * <ol>
 * <li>broadcast the run inputs with {@code Prepare} and wait for every worker (barrier before timing),</li>
 * <li>start {@code Traverse} on every worker at once and wait for all reports (barrier before aggregation),</li>
 * <li>reduce the reports.</li>
 * </ol>
 * Any worker failure aborts the run; no partial summary is produced.
 */
public class TraversalCoordinator {

    private final List<WorkerClient> workers;
    private final int workPerVertex;
    private final GraphShape shape;
    private final AtomicInteger nextRunId = new AtomicInteger((int) (System.currentTimeMillis() / 1000));

    public TraversalCoordinator(List<WorkerClient> workers, int workPerVertex, GraphShape shape) {
        this.workers = workers;
        this.workPerVertex = workPerVertex;
        this.shape = shape;
    }

    public int getNumWorkers() {
        return workers.size();
    }

    public TraversalSummary run(RunParameters parameters) {
        RunConfig config = RunConfig.newBuilder()
                .setRunId(nextRunId.getAndIncrement())
                .setNumWorkers(workers.size())
                .setTotalVertices(parameters.totalVertices)
                .setTargetVertex(parameters.target)
                .setShape(shape)
                .setBroadcastFound(parameters.broadcastFound)
                .setWorkPerVertex(workPerVertex)
                .build();

        System.out.println("Starting run " + config.getRunId() + " on " + workers.size() + " workers: " + parameters);

        for (int i = 0; i < workers.size(); i++) {
            PrepareResponse prepared = workers.get(i).prepare(config);
            if (!prepared.getSuccess()) {
                throw new RuntimeException("Failed to prepare worker-" + i + " for run " + config.getRunId());
            }
            System.out.println("Prepared worker-" + i + " owning [" + prepared.getStartVertex() + ", "
                    + prepared.getEndVertex() + ")");
        }

        List<TraversalReport> reports = awaitReports(config.getRunId());
        reports.sort(Comparator.comparingInt(TraversalReport::getRank));

        TraversalSummary summary = ResultAggregator.aggregate(config.getTotalVertices(), reports);
        System.out.println("Run " + config.getRunId() + " complete: " + summary);
        return summary;
    }

    private List<TraversalReport> awaitReports(int runId) {
        List<CompletableFuture<TraversalReport>> futures = new ArrayList<>();
        for (WorkerClient worker : workers) {
            futures.add(worker.traverse(runId));
        }

        // Completes on the first failure instead of waiting for peers that may never finish without it.
        CompletableFuture<Void> done = new CompletableFuture<>();
        for (CompletableFuture<TraversalReport> future : futures) {
            future.whenComplete((report, error) -> {
                if (error != null) {
                    done.completeExceptionally(error);
                }
            });
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        done.completeExceptionally(error);
                    } else {
                        done.complete(null);
                    }
                });

        try {
            done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for run " + runId + " to complete", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            System.err.println("Run " + runId + " aborted: " + cause.getMessage());
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException("Run " + runId + " aborted", cause);
        }

        List<TraversalReport> reports = new ArrayList<>();
        for (CompletableFuture<TraversalReport> future : futures) {
            reports.add(future.join());
        }
        return reports;
    }
}

package com.graph.dfs.worker;

import com.graph.dfs.proto.GraphShape;
import com.graph.dfs.proto.RunConfig;
import com.graph.dfs.proto.TraversalReport;
import com.graph.dfs.utils.ClusterConfig;
import com.graph.dfs.utils.Graph;
import com.graph.dfs.utils.ResultAggregator;
import com.graph.dfs.utils.ResultReporter;
import com.graph.dfs.utils.TraversalSummary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

// One thread per rank, sequenced like the leader: prepare all, traverse all, aggregate.
public class LocalCluster implements AutoCloseable {

    private final List<TraversalWorker> workers = new ArrayList<>();
    private final ExecutorService executor;
    private int nextRunId = 1;

    public LocalCluster(int numWorkers) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("At least one worker is required, got " + numWorkers);
        }
        HaloMailbox[] mailboxes = new HaloMailbox[numWorkers];
        for (int rank = 0; rank < numWorkers; rank++) {
            mailboxes[rank] = new HaloMailbox();
        }
        for (int rank = 0; rank < numWorkers; rank++) {
            workers.add(new TraversalWorker(new InProcessHaloTransport(rank, mailboxes)));
        }
        executor = Executors.newFixedThreadPool(numWorkers);
    }

    public int getNumWorkers() {
        return workers.size();
    }

    public RunConfig.Builder newRun(int totalVertices, int target) {
        return RunConfig.newBuilder()
                .setRunId(nextRunId++)
                .setNumWorkers(workers.size())
                .setTotalVertices(totalVertices)
                .setTargetVertex(target)
                .setShape(GraphShape.WEAK_SCALING_RING);
    }

    /**
     * Runs on a synthesized graph.
     *
     * @return one report per rank, in rank order
     */
    public List<TraversalReport> run(RunConfig config) {
        return run(config, null);
    }

    /**
     * Runs on the given graph, or on a synthesized one when {@code graph} is null.
     */
    public List<TraversalReport> run(RunConfig config, Graph graph) {
        for (TraversalWorker worker : workers) {
            if (graph == null) {
                worker.prepare(config);
            } else {
                worker.prepare(config, graph);
            }
        }

        CompletionService<TraversalReport> completion = new ExecutorCompletionService<>(executor);
        List<Future<TraversalReport>> futures = new ArrayList<>();
        for (TraversalWorker worker : workers) {
            futures.add(completion.submit(() -> worker.traverse(config.getRunId())));
        }

        // Taken in completion order so a failed rank aborts the run instead of leaving its peers waiting.
        TraversalReport[] reports = new TraversalReport[workers.size()];
        try {
            for (int i = 0; i < workers.size(); i++) {
                TraversalReport report = completion.take().get();
                reports[report.getRank()] = report;
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for run " + config.getRunId(), e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw new RuntimeException("Run " + config.getRunId() + " failed", e.getCause());
        }
        return Arrays.asList(reports);
    }

    private static void cancelAll(List<Future<TraversalReport>> futures) {
        for (Future<TraversalReport> future : futures) {
            future.cancel(true);
        }
    }

    public TraversalSummary runAndAggregate(RunConfig config) {
        return ResultAggregator.aggregate(config.getTotalVertices(), run(config));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Single-host weak-scaling run. {@code args[0]}: vertices per worker, {@code args[1]}: target vertex.
     */
    public static void main(String[] args) {
        ClusterConfig clusterConfig = ClusterConfig.fromEnvironment();
        int numWorkers = clusterConfig.getNumWorkers();
        clusterConfig.checkWorkerCount(numWorkers);

        int basePerWorker = args.length >= 1 ? Integer.parseInt(args[0]) : 10000;
        int totalVertices = basePerWorker * numWorkers;
        int target = args.length >= 2 ? Integer.parseInt(args[1]) : (int) (totalVertices * 0.84);

        System.out.println("Running " + numWorkers + " in-process workers over " + totalVertices
                + " vertices, target " + target);

        try (LocalCluster cluster = new LocalCluster(numWorkers)) {
            RunConfig config = cluster.newRun(totalVertices, target)
                    .setWorkPerVertex(clusterConfig.getWorkPerVertex())
                    .setBroadcastFound(clusterConfig.isBroadcastFound())
                    .build();
            ResultReporter.print(cluster.runAndAggregate(config), System.out);
        }
    }
}

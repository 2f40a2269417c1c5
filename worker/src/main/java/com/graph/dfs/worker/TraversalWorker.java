package com.graph.dfs.worker;

import com.graph.dfs.proto.GraphShape;
import com.graph.dfs.proto.PrepareResponse;
import com.graph.dfs.proto.RunConfig;
import com.graph.dfs.proto.TraversalReport;
import com.graph.dfs.utils.DomainInfo;
import com.graph.dfs.utils.Graph;
import com.graph.dfs.utils.GraphSynthesizer;
import com.graph.dfs.utils.Partitioner;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class TraversalWorker {

    private final HaloTransport transport;
    private final Map<Integer, PreparedRun> preparedRuns = new ConcurrentHashMap<>();

    // Run ids only grow; preparing a run expires every older run that was never traversed.
    private int newestRunId = Integer.MIN_VALUE;

    private GraphShape cachedShape;
    private int cachedVertices = -1;
    private Graph cachedGraph;

    private static class PreparedRun {
        final RunConfig config;
        final Graph graph;
        final DomainInfo domain;

        PreparedRun(RunConfig config, Graph graph, DomainInfo domain) {
            this.config = config;
            this.graph = graph;
            this.domain = domain;
        }
    }

    public TraversalWorker(HaloTransport transport) {
        this.transport = transport;
    }

    public int getRank() {
        return transport.getRank();
    }

    public PrepareResponse prepare(RunConfig config) {
        return prepare(config, graphFor(config.getShape(), config.getTotalVertices()));
    }

    /**
     * Prepares a run over a graph supplied by the caller instead of a synthesized one.
     * Every worker must be given an identical graph.
     */
    public synchronized PrepareResponse prepare(RunConfig config, Graph graph) {
        if (config.getNumWorkers() != transport.getNumWorkers()) {
            throw new IllegalArgumentException("Run " + config.getRunId() + " expects " + config.getNumWorkers()
                    + " workers, but this cluster has " + transport.getNumWorkers());
        }
        int totalVertices = config.getTotalVertices();
        if (graph.vertexCount() != totalVertices) {
            throw new IllegalArgumentException("Run " + config.getRunId() + " declares " + totalVertices
                    + " vertices but the graph has " + graph.vertexCount());
        }

        if (config.getRunId() <= newestRunId) {
            throw new IllegalStateException("Run " + config.getRunId() + " is not newer than run " + newestRunId
                    + " already prepared on worker-" + getRank());
        }

        Partitioner.verify(totalVertices, config.getNumWorkers());
        DomainInfo domain = Partitioner.partition(totalVertices, getRank(), config.getNumWorkers());

        expireRunsBefore(config.getRunId());
        newestRunId = config.getRunId();
        preparedRuns.put(config.getRunId(), new PreparedRun(config, graph, domain));

        System.out.println("worker-" + getRank() + " prepared run " + config.getRunId() + ": " + domain
                + " of " + graph);

        return PrepareResponse.newBuilder()
                .setSuccess(true)
                .setRank(domain.rank)
                .setStartVertex(domain.startVertex)
                .setEndVertex(domain.endVertex)
                .build();
    }

    public TraversalReport traverse(int runId) {
        PreparedRun run = preparedRuns.remove(runId);
        if (run == null) {
            throw new IllegalStateException("Run " + runId + " was not prepared on worker-" + getRank());
        }

        RunConfig config = run.config;
        try {
            HaloExchange halo = new HaloExchange(transport, runId, run.domain, run.graph.vertexCount());
            TraversalOrchestrator orchestrator = new TraversalOrchestrator(run.graph, run.domain, halo,
                    config.getTargetVertex(), config.getWorkPerVertex(), config.getBroadcastFound());

            long startTime = System.nanoTime();
            TraversalResult result = orchestrator.run();
            long elapsedNanos = System.nanoTime() - startTime;

            System.out.println("worker-" + getRank() + " finished run " + runId + ": visited "
                    + result.visitOrder.length + " vertices, found=" + result.found
                    + ", requests sent=" + result.requestsSent + ", received=" + result.requestsReceived);

            TraversalReport.Builder report = TraversalReport.newBuilder()
                    .setRank(getRank())
                    .setVisitedCount(result.visitOrder.length)
                    .setFound(result.found)
                    .setElapsedNanos(elapsedNanos)
                    .setRequestsSent(result.requestsSent)
                    .setRequestsReceived(result.requestsReceived)
                    .setRequestsFulfilled(result.requestsFulfilled)
                    .setExternalReferences(result.externalReferences);
            if (config.getRecordVisited()) {
                for (int v : result.visitOrder) {
                    report.addVisitOrder(v);
                }
            }
            return report.build();
        } finally {
            transport.release(runId);
        }
    }

    private void expireRunsBefore(int runId) {
        for (Integer staleRunId : new ArrayList<>(preparedRuns.keySet())) {
            if (staleRunId < runId && preparedRuns.remove(staleRunId) != null) {
                System.out.println("worker-" + getRank() + " dropping run " + staleRunId
                        + ", prepared but never traversed");
                transport.release(staleRunId);
            }
        }
    }

    public boolean isPrepared(int runId) {
        return preparedRuns.containsKey(runId);
    }

    private synchronized Graph graphFor(GraphShape shape, int numVertices) {
        if (cachedGraph == null || cachedShape != shape || cachedVertices != numVertices) {
            cachedGraph = GraphSynthesizer.synthesize(shape, numVertices);
            cachedShape = shape;
            cachedVertices = numVertices;
        }
        return cachedGraph;
    }
}

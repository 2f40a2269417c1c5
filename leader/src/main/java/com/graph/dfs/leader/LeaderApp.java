package com.graph.dfs.leader;

import com.graph.dfs.proto.GraphShape;
import com.graph.dfs.utils.ClusterConfig;
import com.graph.dfs.utils.ResultReporter;
import com.graph.dfs.utils.TraversalSummary;
import com.graph.dfs.utils.WorkerClient;

import io.javalin.Javalin;

import java.util.ArrayList;
import java.util.List;

public class LeaderApp {

    /**
     * {@code args[0]}: vertices per worker (the problem grows with the worker count),
     * {@code args[1]}: target vertex.
     */
    public static void main(String[] args) throws Exception {
        System.out.println("Leader starting...");

        ClusterConfig config = ClusterConfig.fromEnvironment();
        int numWorkers = config.getNumWorkers();
        config.checkWorkerCount(numWorkers);

        RunParameters initialRun = parseArgs(args, numWorkers, config.isBroadcastFound());

        List<WorkerClient> workerClients = new ArrayList<>();
        for (int i = 0; i < numWorkers; i++) {
            String host = config.getWorkerHost(i);
            System.out.println("Connecting to worker-" + i + " at " + host + ":" + config.getWorkerPort());
            workerClients.add(new WorkerClient(host, config.getWorkerPort()));
        }

        TraversalCoordinator coordinator = new TraversalCoordinator(
                workerClients, config.getWorkPerVertex(), GraphShape.WEAK_SCALING_RING);

        try {
            TraversalSummary summary = coordinator.run(initialRun);
            ResultReporter.print(summary, System.out);
        } catch (RuntimeException e) {
            System.err.println("Initial traversal aborted: " + e.getMessage());
        }

        ApiHandler apiHandler = new ApiHandler(coordinator);
        Javalin app = Javalin.create().start(config.getHttpPort());
        app.get("/traversal", apiHandler::handleTraversal);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            for (WorkerClient client : workerClients) {
                client.shutdown();
            }
        }));

        System.out.println("Leader ready. Serving traversal requests on port " + config.getHttpPort() + ".");
    }

    static RunParameters parseArgs(String[] args, int numWorkers, boolean broadcastFound) {
        return RunParameters.parse(
                args.length >= 1 ? args[0] : null,
                args.length >= 2 ? args[1] : null,
                String.valueOf(broadcastFound),
                numWorkers);
    }
}

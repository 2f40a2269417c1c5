package com.graph.dfs.leader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graph.dfs.utils.ResultReporter;
import com.graph.dfs.utils.TraversalSummary;
import io.grpc.StatusRuntimeException;
import io.javalin.http.Context;

import java.util.Collections;
import java.util.concurrent.locks.ReentrantLock;

public class ApiHandler {

    private final TraversalCoordinator coordinator;
    private final ReentrantLock lock = new ReentrantLock();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ApiHandler(TraversalCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public void handleTraversal(Context ctx) throws Exception {
        System.out.println("Received traversal request: " + ctx.queryParamMap());
        if (!lock.tryLock()) {
            System.out.println("Another traversal is already in progress. Rejecting this request.");
            ctx.status(503).json(
                    Collections.singletonMap("error", "Another traversal is already in progress. Please try again later."));
            return;
        }

        try {
            RunParameters parameters;
            try {
                parameters = RunParameters.parse(
                        ctx.queryParam("basePerWorker"),
                        ctx.queryParam("target"),
                        ctx.queryParam("broadcastFound"),
                        coordinator.getNumWorkers());
            } catch (IllegalArgumentException e) {
                System.out.println("Invalid traversal parameters: " + e.getMessage());
                ctx.status(400).json(Collections.singletonMap("error", e.getMessage()));
                return;
            }

            TraversalSummary summary = coordinator.run(parameters);
            ResultReporter.print(summary, System.out);

            ctx.contentType("application/json").result(objectMapper.writeValueAsString(toJson(summary)));
        } catch (StatusRuntimeException e) {
            ctx.status(500).json(Collections.singletonMap("error", "gRPC error: " + e.getStatus().toString()));
        } catch (RuntimeException e) {
            ctx.status(500).json(Collections.singletonMap("error", "Traversal aborted: " + e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    ObjectNode toJson(TraversalSummary summary) {
        ObjectNode node = objectMapper.valueToTree(summary);
        node.put("csv", ResultReporter.csvLine(summary));
        return node;
    }
}

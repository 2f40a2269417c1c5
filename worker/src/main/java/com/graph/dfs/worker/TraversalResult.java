package com.graph.dfs.worker;

public class TraversalResult {
    public final int[] visitOrder;
    public final boolean found;
    public final int externalReferences;
    public final int requestsSent;
    public final int requestsReceived;
    public final int requestsFulfilled;

    public TraversalResult(int[] visitOrder, boolean found, int externalReferences,
            int requestsSent, int requestsReceived, int requestsFulfilled) {
        this.visitOrder = visitOrder;
        this.found = found;
        this.externalReferences = externalReferences;
        this.requestsSent = requestsSent;
        this.requestsReceived = requestsReceived;
        this.requestsFulfilled = requestsFulfilled;
    }
}

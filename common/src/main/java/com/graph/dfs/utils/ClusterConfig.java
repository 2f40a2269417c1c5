package com.graph.dfs.utils;

import java.util.Map;

public class ClusterConfig {

    public static final int DEFAULT_WORK_PER_VERTEX = 1000;

    private final Map<String, String> env;

    public ClusterConfig(Map<String, String> env) {
        this.env = env;
    }

    public static ClusterConfig fromEnvironment() {
        return new ClusterConfig(System.getenv());
    }

    public int getNumWorkers() {
        return getInt("NUM_WORKERS", 1);
    }

    public int getMinWorkers() {
        return getInt("MIN_WORKERS", 1);
    }

    public int getWorkerPort() {
        return getInt("WORKER_PORT", 9090);
    }

    public int getHttpPort() {
        return getInt("HTTP_PORT", 8080);
    }

    public int getWorkPerVertex() {
        return getInt("WORK_PER_VERTEX", DEFAULT_WORK_PER_VERTEX);
    }

    public boolean isBroadcastFound() {
        return Boolean.parseBoolean(env.getOrDefault("BROADCAST_FOUND", "false"));
    }

    // Plain host names under docker-compose, the Kubernetes FQDN otherwise.
    public String getWorkerHost(int workerId) {
        String workerServiceName = env.getOrDefault("WORKER_SERVICE_NAME", "worker");
        String namespace = env.getOrDefault("NAMESPACE", "");
        if (namespace.isEmpty()) {
            return "worker-" + workerId;
        }
        return "worker-" + workerId + "." + workerServiceName + "." + namespace + ".svc.cluster.local";
    }

    /**
     * Resolves this worker's rank from {@code WORKER_ID}, falling back to the numeric suffix of the
     * host name (StatefulSet pods are named {@code worker-0}, {@code worker-1}, ...).
     */
    public int resolveWorkerId(String hostname) {
        String explicit = env.get("WORKER_ID");
        if (explicit != null && !explicit.isEmpty()) {
            return parseInt("WORKER_ID", explicit);
        }
        String[] parts = hostname.split("-");
        return parseInt("host name suffix", parts[parts.length - 1]);
    }

    /**
     * Checks the worker count against {@code MIN_WORKERS}.
     */
    public void checkWorkerCount(int numWorkers) {
        int minWorkers = getMinWorkers();
        if (numWorkers < Math.max(1, minWorkers)) {
            throw new IllegalArgumentException("This run needs at least " + Math.max(1, minWorkers)
                    + " workers, but " + numWorkers + " are configured");
        }
    }

    private int getInt(String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return parseInt(name, value);
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": '" + value + "'", e);
        }
    }
}

package com.graph.dfs.leader;

public class RunParameters {

    public static final int DEFAULT_BASE_PER_WORKER = 10000;
    public static final double DEFAULT_TARGET_FRACTION = 0.84;

    public final int totalVertices;
    public final int target;
    public final boolean broadcastFound;

    public RunParameters(int totalVertices, int target, boolean broadcastFound) {
        this.totalVertices = totalVertices;
        this.target = target;
        this.broadcastFound = broadcastFound;
    }

    /**
     * Any argument may be null to take its default: {@value #DEFAULT_BASE_PER_WORKER} vertices per worker,
     * target at 84% of the total, no found broadcast.
     *
     * @throws IllegalArgumentException for unparsable or negative values
     */
    public static RunParameters parse(String basePerWorker, String target, String broadcastFound, int numWorkers) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("At least one worker is required, got " + numWorkers);
        }

        int base = basePerWorker == null ? DEFAULT_BASE_PER_WORKER : parseNonNegative("basePerWorker", basePerWorker);
        long total = (long) base * numWorkers;
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Problem size " + total + " exceeds the supported vertex count");
        }
        int totalVertices = (int) total;

        int targetVertex = target == null
                ? (int) (totalVertices * DEFAULT_TARGET_FRACTION)
                : parseNonNegative("target", target);

        return new RunParameters(totalVertices, targetVertex, Boolean.parseBoolean(broadcastFound));
    }

    private static int parseNonNegative(String name, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid '" + name + "' parameter: '" + value + "'", e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException("'" + name + "' must be a non-negative integer, got " + parsed);
        }
        return parsed;
    }

    @Override
    public String toString() {
        return String.format("RunParameters[vertices:%d, target:%d, broadcastFound:%b]",
                totalVertices, target, broadcastFound);
    }
}

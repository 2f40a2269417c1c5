package com.graph.dfs.utils;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Renders a {@link TraversalSummary} as the human-readable results block followed by a CSV line
 * ({@code workers,vertices,maxSeconds,visited}) for collecting scaling data.
 */
public final class ResultReporter {

    private static final String RULE = "===========================================";

    private ResultReporter() {
    }

    public static String format(TraversalSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("Weak Scaling Results").append('\n');
        sb.append(RULE).append('\n');
        sb.append("Number of Processes: ").append(summary.getNumWorkers()).append('\n');
        sb.append("Problem Size (Vertices): ").append(summary.getTotalVertices()).append('\n');
        sb.append("Vertices per Process: ").append(summary.getVerticesPerWorker()).append('\n');
        sb.append(String.format(Locale.ROOT, "Execution Time: %.6f seconds\n", summary.getMaxElapsedSeconds()));
        sb.append(String.format(Locale.ROOT, "Execution Time: %.2f milliseconds\n",
                summary.getMaxElapsedSeconds() * 1000.0));
        sb.append("Vertices Visited: ").append(summary.getTotalVisited()).append('\n');
        sb.append("Target Found: ").append(summary.isFound() ? "yes" : "no").append('\n');
        sb.append(RULE).append('\n');
        sb.append(csvLine(summary)).append('\n');
        return sb.toString();
    }

    public static String csvLine(TraversalSummary summary) {
        return String.format(Locale.ROOT, "CSV: %d,%d,%.6f,%d",
                summary.getNumWorkers(),
                summary.getTotalVertices(),
                summary.getMaxElapsedSeconds(),
                summary.getTotalVisited());
    }

    public static void print(TraversalSummary summary, PrintStream out) {
        out.print(format(summary));
        out.flush();
    }
}

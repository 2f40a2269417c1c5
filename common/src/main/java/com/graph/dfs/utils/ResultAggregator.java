package com.graph.dfs.utils;

import com.graph.dfs.proto.TraversalReport;

import java.util.List;

public final class ResultAggregator {

    private ResultAggregator() {
    }

    public static TraversalSummary aggregate(int totalVertices, List<TraversalReport> reports) {
        long maxElapsedNanos = 0;
        long totalVisited = 0;
        boolean found = false;

        for (TraversalReport report : reports) {
            maxElapsedNanos = Math.max(maxElapsedNanos, report.getElapsedNanos());
            totalVisited += report.getVisitedCount();
            found |= report.getFound();
        }

        return new TraversalSummary(reports.size(), totalVertices, maxElapsedNanos / 1e9, totalVisited, found);
    }
}

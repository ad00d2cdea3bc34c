package io.swarmmesh.model;

public record NetworkMetrics(
        int totalNodes,
        int activeConnections,
        double averageLatencyMs,
        double networkHealth,
        int clusterCount,
        int bridgeCount,
        double messageThroughput,
        double errorRate,
        long computedAtMs
) {
    public static NetworkMetrics initial() {
        return new NetworkMetrics(0, 0, 0.0, 100.0, 0, 0, 0.0, 0.0, 0L);
    }
}

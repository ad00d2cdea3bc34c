package io.swarmmesh.transport;

public record TransportStats(
        String nodeId,
        int connectedPeers,
        int knownNodes,
        long messagesSent,
        long messagesReceived,
        long sendFailures,
        double averageLatencyMs,
        boolean running
) {
}

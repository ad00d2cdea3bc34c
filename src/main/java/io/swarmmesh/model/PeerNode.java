package io.swarmmesh.model;

import java.util.List;
import java.util.Map;

public record PeerNode(
        String id,
        String address,
        int port,
        List<String> capabilities,
        NodeStatus status,
        long lastSeenMs,
        Map<String, Object> metadata
) {
    public PeerNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("node id cannot be empty");
        }
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        status = status == null ? NodeStatus.ONLINE : status;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PeerNode discovered(String id, List<String> capabilities, long seenMs) {
        return new PeerNode(id, "unknown", 0, capabilities, NodeStatus.ONLINE, seenMs, Map.of());
    }

    public PeerNode withHeartbeat(NodeStatus newStatus, long seenMs) {
        return new PeerNode(id, address, port, capabilities, newStatus, seenMs, metadata);
    }

    public PeerNode withCapabilities(List<String> newCapabilities, long seenMs) {
        return new PeerNode(id, address, port, newCapabilities, status, seenMs, metadata);
    }
}

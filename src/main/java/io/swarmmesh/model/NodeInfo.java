package io.swarmmesh.model;

import io.swarmmesh.transport.TransportStats;

import java.util.List;
import java.util.Set;

public record NodeInfo(
        String id,
        String role,
        NodeState state,
        Set<String> connections,
        TransportStats networkStats,
        List<String> capabilities
) {
}

package io.swarmmesh.model;

import java.util.Map;
import java.util.Set;

/**
 * Read-only copy of the topology manager's registry.
 *
 * @param nodes       registered nodes keyed by id
 * @param connections directed adjacency: node id to the ids it has an edge to
 * @param clusters    cluster id to member ids, only components with two or more members
 * @param bridges     bridge node id to the cluster ids its neighbors belong to
 */
public record TopologySnapshot(
        Map<String, PeerNode> nodes,
        Map<String, Set<String>> connections,
        Map<String, Set<String>> clusters,
        Map<String, Set<String>> bridges
) {
}

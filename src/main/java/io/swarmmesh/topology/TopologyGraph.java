package io.swarmmesh.topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph algorithms over a directed adjacency map. Stateless; callers hold whatever lock guards the
 * maps they pass in.
 */
public final class TopologyGraph {
    public static final String CLUSTER_PREFIX = "cluster_";

    private TopologyGraph() {
    }

    /**
     * Connected components of the undirected view of {@code edges}. Only components with at least
     * two members are returned, numbered {@code cluster_1, cluster_2, ...} in the order their first
     * member appears in {@code nodes}. Members keep that order too.
     */
    public static Map<String, Set<String>> clusters(Collection<String> nodes, Map<String, Set<String>> edges) {
        Map<String, Set<String>> undirected = undirected(nodes, edges);
        Map<String, Integer> order = new HashMap<>();
        for (String node : nodes) {
            order.putIfAbsent(node, order.size());
        }
        Map<String, Set<String>> clusters = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        int next = 1;
        for (String start : nodes) {
            if (!visited.add(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                component.add(current);
                for (String neighbor : undirected.getOrDefault(current, Set.of())) {
                    if (visited.add(neighbor)) {
                        stack.push(neighbor);
                    }
                }
            }
            if (component.size() < 2) {
                continue;
            }
            component.sort((a, b) -> Integer.compare(
                    order.getOrDefault(a, Integer.MAX_VALUE),
                    order.getOrDefault(b, Integer.MAX_VALUE)));
            clusters.put(CLUSTER_PREFIX + next++, Collections.unmodifiableSet(new LinkedHashSet<>(component)));
        }
        return clusters;
    }

    /**
     * Nodes whose neighbors (either edge direction) belong to two or more distinct clusters, mapped
     * to those cluster ids. With component-based clusters every neighbor shares the node's own
     * cluster, so this is empty unless clusters were computed from another edge set.
     */
    public static Map<String, Set<String>> bridges(
            Collection<String> nodes,
            Map<String, Set<String>> edges,
            Map<String, Set<String>> clusters
    ) {
        Map<String, String> clusterOf = new HashMap<>();
        for (Map.Entry<String, Set<String>> cluster : clusters.entrySet()) {
            for (String member : cluster.getValue()) {
                clusterOf.put(member, cluster.getKey());
            }
        }
        Map<String, Set<String>> undirected = undirected(nodes, edges);
        Map<String, Set<String>> bridges = new LinkedHashMap<>();
        for (String node : nodes) {
            Set<String> touched = new LinkedHashSet<>();
            for (String neighbor : undirected.getOrDefault(node, Set.of())) {
                String clusterId = clusterOf.get(neighbor);
                if (clusterId != null) {
                    touched.add(clusterId);
                }
            }
            if (touched.size() >= 2) {
                bridges.put(node, Collections.unmodifiableSet(touched));
            }
        }
        return bridges;
    }

    /**
     * Breadth-first shortest path (edge count) following directed edges. Returns {@code [from]}
     * when both ends are the same registered node and null when either end is unknown or
     * {@code to} is unreachable.
     */
    public static List<String> shortestPath(
            Set<String> nodes,
            Map<String, Set<String>> edges,
            String from,
            String to
    ) {
        if (from == null || to == null || !nodes.contains(from) || !nodes.contains(to)) {
            return null;
        }
        if (from.equals(to)) {
            return List.of(from);
        }
        Map<String, String> parent = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(from);
        queue.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbor : edges.getOrDefault(current, Set.of())) {
                if (!nodes.contains(neighbor) || !visited.add(neighbor)) {
                    continue;
                }
                parent.put(neighbor, current);
                if (neighbor.equals(to)) {
                    LinkedList<String> path = new LinkedList<>();
                    for (String step = to; step != null; step = parent.get(step)) {
                        path.addFirst(step);
                    }
                    return List.copyOf(path);
                }
                queue.add(neighbor);
            }
        }
        return null;
    }

    static Map<String, Set<String>> undirected(Collection<String> nodes, Map<String, Set<String>> edges) {
        Set<String> known = new HashSet<>(nodes);
        Map<String, Set<String>> undirected = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : edges.entrySet()) {
            String from = entry.getKey();
            if (!known.contains(from)) {
                continue;
            }
            for (String to : entry.getValue()) {
                if (!known.contains(to) || from.equals(to)) {
                    continue;
                }
                undirected.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
                undirected.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
            }
        }
        return undirected;
    }
}

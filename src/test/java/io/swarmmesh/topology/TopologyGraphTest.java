package io.swarmmesh.topology;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class TopologyGraphTest {

    @Test
    void clustersAreConnectedComponentsWithoutSingletons() {
        List<String> nodes = List.of("a", "b", "c", "d", "e");
        Map<String, Set<String>> edges = edges("a-b", "c-d");

        Map<String, Set<String>> clusters = TopologyGraph.clusters(nodes, edges);

        Assertions.assertEquals(2, clusters.size());
        Assertions.assertEquals(Set.of("a", "b"), clusters.get("cluster_1"));
        Assertions.assertEquals(Set.of("c", "d"), clusters.get("cluster_2"));
        Assertions.assertTrue(clusters.values().stream().noneMatch(c -> c.contains("e")));
    }

    @Test
    void oneWayEdgeStillJoinsACluster() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        edges.put("a", new LinkedHashSet<>(Set.of("b")));

        Map<String, Set<String>> clusters = TopologyGraph.clusters(List.of("a", "b", "c"), edges);

        Assertions.assertEquals(Map.of("cluster_1", Set.of("a", "b")), clusters);
    }

    @Test
    void crossEdgeMergesTwoGroupsIntoOneCluster() {
        List<String> nodes = List.of("a", "b", "c", "d", "e");
        Map<String, Set<String>> edges = edges("a-b", "c-d", "b-c");

        Map<String, Set<String>> clusters = TopologyGraph.clusters(nodes, edges);

        Assertions.assertEquals(1, clusters.size());
        Assertions.assertEquals(Set.of("a", "b", "c", "d"), clusters.get("cluster_1"));
        Assertions.assertTrue(TopologyGraph.bridges(nodes, edges, clusters).isEmpty());
    }

    @Test
    void clustersPartitionTheNodes() {
        List<String> nodes = List.of("n1", "n2", "n3", "n4", "n5", "n6", "n7");
        Map<String, Set<String>> edges = edges("n1-n2", "n2-n3", "n4-n5", "n6-n6");

        Map<String, Set<String>> clusters = TopologyGraph.clusters(nodes, edges);

        Set<String> seen = new LinkedHashSet<>();
        for (Set<String> members : clusters.values()) {
            for (String member : members) {
                Assertions.assertTrue(seen.add(member), "node in two clusters: " + member);
            }
        }
        Assertions.assertEquals(Set.of("n1", "n2", "n3", "n4", "n5"), seen);
    }

    @Test
    void bridgeDetectedWhenNeighborsSpanTwoClusters() {
        List<String> nodes = List.of("a", "b", "x", "c", "d");
        Map<String, Set<String>> edges = edges("a-b", "c-d", "x-b", "x-c");
        Map<String, Set<String>> clusters = new LinkedHashMap<>();
        clusters.put("cluster_1", Set.of("a", "b"));
        clusters.put("cluster_2", Set.of("c", "d"));

        Map<String, Set<String>> bridges = TopologyGraph.bridges(nodes, edges, clusters);

        Assertions.assertEquals(Map.of("x", Set.of("cluster_1", "cluster_2")), bridges);
    }

    @Test
    void shortestPathFollowsDirectedEdges() {
        Set<String> nodes = Set.of("a", "b", "c", "d");
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        edges.put("a", new LinkedHashSet<>(List.of("b", "c")));
        edges.put("b", new LinkedHashSet<>(List.of("d")));
        edges.put("c", new LinkedHashSet<>(List.of("d")));
        edges.put("d", new LinkedHashSet<>(List.of("a")));

        Assertions.assertEquals(List.of("a", "b", "d"), TopologyGraph.shortestPath(nodes, edges, "a", "d"));
        Assertions.assertEquals(List.of("d", "a", "c"), TopologyGraph.shortestPath(nodes, edges, "d", "c"));
        Assertions.assertEquals(List.of("b"), TopologyGraph.shortestPath(nodes, edges, "b", "b"));
    }

    @Test
    void shortestPathReturnsNullWhenUnreachableOrUnknown() {
        Set<String> nodes = Set.of("a", "b", "c");
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        edges.put("a", new LinkedHashSet<>(List.of("b")));

        Assertions.assertNull(TopologyGraph.shortestPath(nodes, edges, "b", "a"));
        Assertions.assertNull(TopologyGraph.shortestPath(nodes, edges, "a", "c"));
        Assertions.assertNull(TopologyGraph.shortestPath(nodes, edges, "a", "zzz"));
        Assertions.assertNull(TopologyGraph.shortestPath(nodes, edges, "zzz", "zzz"));
    }

    @Test
    void shortestPathTerminatesOnCycles() {
        Set<String> nodes = Set.of("a", "b", "c", "d");
        Map<String, Set<String>> edges = edges("a-b", "b-c", "c-a");

        Assertions.assertNull(TopologyGraph.shortestPath(nodes, edges, "a", "d"));
        Assertions.assertEquals(2, TopologyGraph.shortestPath(nodes, edges, "a", "c").size());
    }

    private static Map<String, Set<String>> edges(String... links) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (String link : links) {
            String[] ends = link.split("-");
            edges.computeIfAbsent(ends[0], k -> new LinkedHashSet<>()).add(ends[1]);
            edges.computeIfAbsent(ends[1], k -> new LinkedHashSet<>()).add(ends[0]);
        }
        return edges;
    }
}

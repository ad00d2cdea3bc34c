package io.swarmmesh.topology;

import io.swarmmesh.agent.AgentCapabilities;
import io.swarmmesh.agent.AgentRole;
import io.swarmmesh.agent.PeerAgent;
import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.events.NetworkEvent;
import io.swarmmesh.events.NetworkEventType;
import io.swarmmesh.model.NetworkMetrics;
import io.swarmmesh.model.NodeInfo;
import io.swarmmesh.model.NodeState;
import io.swarmmesh.model.PeerNode;
import io.swarmmesh.model.TopologySnapshot;
import io.swarmmesh.transport.InMemoryNetwork;
import io.swarmmesh.transport.InMemoryTransport;
import io.swarmmesh.transport.MessageHandler;
import io.swarmmesh.transport.Transport;
import io.swarmmesh.transport.TransportListener;
import io.swarmmesh.transport.TransportStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;

final class TopologyManagerTest {
    private final List<NetworkEvent> events = new CopyOnWriteArrayList<>();
    private InMemoryNetwork network;
    private TopologyManager manager;

    @BeforeEach
    void setUp() {
        network = new InMemoryNetwork();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    @Test
    void chainFormsOneClusterAndSplitsWhenMiddleNodeLeaves() {
        manager = manager(0);
        register("A", "B", "C");
        Assertions.assertTrue(manager.connectAgents("A", "B"));
        Assertions.assertTrue(manager.connectAgents("B", "C"));

        TopologySnapshot topology = manager.getTopology();
        Assertions.assertEquals(1, topology.clusters().size());
        Assertions.assertEquals(Set.of("A", "B", "C"), topology.clusters().values().iterator().next());
        Assertions.assertTrue(topology.bridges().isEmpty());
        Assertions.assertEquals(List.of("A", "B", "C"), manager.findPath("A", "C"));

        manager.unregisterAgent("B");

        TopologySnapshot after = manager.getTopology();
        Assertions.assertEquals(0, after.clusters().size());
        Assertions.assertNull(manager.findPath("A", "C"));
        Assertions.assertNull(manager.getNodeInfo("B"));
        Assertions.assertFalse(after.nodes().containsKey("B"));
        Assertions.assertFalse(after.connections().containsKey("B"));
        for (Set<String> targets : after.connections().values()) {
            Assertions.assertFalse(targets.contains("B"));
        }
        Assertions.assertTrue(events.stream().anyMatch(e -> e.type() == NetworkEventType.NODE_REMOVED
                && "B".equals(e.payload().get("nodeId"))));
    }

    @Test
    void crossLinkMergesTwoClustersAndIsolatedNodeStaysOut() {
        manager = manager(0);
        register("A", "B", "C", "D");
        manager.connectAgents("A", "B");
        manager.connectAgents("C", "D");
        Assertions.assertEquals(2, manager.getTopology().clusters().size());

        manager.connectAgents("B", "C");
        register("E");

        TopologySnapshot topology = manager.getTopology();
        Assertions.assertEquals(1, topology.clusters().size());
        Assertions.assertEquals(Set.of("A", "B", "C", "D"), topology.clusters().get("cluster_1"));
        Assertions.assertTrue(topology.bridges().isEmpty());
        Assertions.assertEquals(5, topology.nodes().size());
        Assertions.assertNull(manager.findPath("A", "E"));
        Assertions.assertEquals(4, manager.findPath("A", "D").size());
    }

    @Test
    void registrationDialsUpToThreeEarlierAgents() {
        manager = manager(NetworkSettings.defaults().seedFanout());
        register("n1", "n2", "n3", "n4", "n5");

        Assertions.assertEquals(Set.of("n1", "n2", "n3"), manager.getNodeInfo("n5").connections());
        Assertions.assertEquals(Set.of("n2", "n3", "n4", "n5"), manager.getNodeInfo("n1").connections());
        Assertions.assertEquals(Set.of("n1", "n2", "n3"), manager.getNodeInfo("n4").connections());
        Assertions.assertEquals(NodeState.CONNECTED, manager.getNodeInfo("n5").state());
        TopologySnapshot topology = manager.getTopology();
        for (Map.Entry<String, Set<String>> entry : topology.connections().entrySet()) {
            for (String target : entry.getValue()) {
                Assertions.assertTrue(topology.connections().get(target).contains(entry.getKey()),
                        "missing reverse edge " + target + "->" + entry.getKey());
            }
        }
        Assertions.assertEquals(1, topology.clusters().size());
    }

    @Test
    void duplicateRegistrationIsRejected() {
        manager = manager(0);
        register("A");
        PeerAgent twin = agent("A", network.createTransport("A", NetworkSettings.defaults()));

        Assertions.assertThrows(IllegalArgumentException.class, () -> manager.registerAgent(twin));
        Assertions.assertEquals(List.of("A"), manager.registeredNodeIds());
        Assertions.assertFalse(twin.isRunning());
    }

    @Test
    void nodeInfoReportsRoleStatsAndCapabilities() {
        manager = manager(0);
        register("A", "B");
        manager.connectAgents("A", "B");

        NodeInfo info = manager.getNodeInfo("A");

        Assertions.assertEquals("A", info.id());
        Assertions.assertEquals("developer", info.role());
        Assertions.assertEquals(Set.of("B"), info.connections());
        Assertions.assertEquals(List.of("java"), info.capabilities());
        Assertions.assertTrue(info.networkStats().running());
        Assertions.assertEquals(1, info.networkStats().connectedPeers());
        PeerNode node = manager.getTopology().nodes().get("A");
        Assertions.assertEquals(InMemoryNetwork.ADDRESS, node.address());
        Assertions.assertNull(manager.getNodeInfo("missing"));
    }

    @Test
    void linksOpenedOutsideTheManagerAreTracked() {
        manager = manager(0);
        register("A", "B");
        PeerAgent a = manager.agent("A");
        PeerAgent b = manager.agent("B");

        Assertions.assertTrue(a.connectToPeer("B", b.transport().address(), b.transport().port()));
        Assertions.assertEquals(List.of("A", "B"), manager.findPath("A", "B"));
        Assertions.assertEquals(List.of("B", "A"), manager.findPath("B", "A"));

        b.disconnectFromPeer("A");
        Assertions.assertNull(manager.findPath("A", "B"));
        Assertions.assertTrue(manager.getTopology().clusters().isEmpty());
    }

    @Test
    void broadcastDeliversOnlyToConnectedPeers() {
        manager = manager(0);
        register("A", "B", "C", "D");
        manager.connectAgents("A", "B");
        manager.connectAgents("B", "C");
        AtomicInteger deliveries = new AtomicInteger();
        for (String id : List.of("A", "B", "C", "D")) {
            manager.agent(id).transport().onMessage("alert", m -> deliveries.incrementAndGet());
        }

        Assertions.assertEquals(4, manager.broadcastMessage("alert", Map.of("level", "high")));
        Assertions.assertEquals(4, deliveries.get());

        manager.disconnectAgents("B", "C");
        deliveries.set(0);
        Assertions.assertEquals(2, manager.broadcastMessage("alert", Map.of()));
        Assertions.assertEquals(2, deliveries.get());
    }

    @Test
    void emptyNetworkIsFullyHealthy() {
        manager = manager(0);

        NetworkMetrics metrics = manager.updateNetworkMetrics();

        Assertions.assertEquals(0, metrics.totalNodes());
        Assertions.assertEquals(100.0, metrics.networkHealth());
    }

    @Test
    void fullMeshAtTargetFanoutScoresHundred() {
        manager = manager(3);
        register("A", "B", "C", "D");

        NetworkMetrics metrics = manager.updateNetworkMetrics();

        Assertions.assertEquals(4, metrics.totalNodes());
        Assertions.assertEquals(12, metrics.activeConnections());
        Assertions.assertEquals(1, metrics.clusterCount());
        Assertions.assertEquals(100.0, metrics.networkHealth(), 1e-9);
        Assertions.assertEquals(0.0, metrics.errorRate(), 1e-9);
        Assertions.assertTrue(metrics.averageLatencyMs() >= 0.0);
        Assertions.assertEquals(metrics, manager.getMetrics());
        Assertions.assertTrue(events.stream().anyMatch(e -> e.type() == NetworkEventType.PERFORMANCE_METRIC));
        Assertions.assertTrue(events.stream().noneMatch(e -> e.type() == NetworkEventType.HEALTH_DEGRADED));
    }

    @Test
    void isolatedNodesDegradeHealth() {
        manager = manager(0);
        register("A", "B", "C");

        NetworkMetrics metrics = manager.updateNetworkMetrics();

        Assertions.assertEquals(25.0, metrics.networkHealth(), 1e-9);
        Assertions.assertTrue(events.stream().anyMatch(e -> e.type() == NetworkEventType.HEALTH_DEGRADED));
    }

    @Test
    void healthScoreStaysWithinBounds() {
        for (int nodes = 0; nodes <= 6; nodes++) {
            for (int edges = 0; edges <= nodes * (nodes - 1); edges++) {
                for (int clusters = 0; clusters <= 2; clusters++) {
                    double health = TopologyManager.networkHealth(nodes, edges, clusters, 3);
                    Assertions.assertTrue(health >= 0.0 && health <= 100.0, "health out of range: " + health);
                }
            }
        }
    }

    @Test
    void sendsToDroppedPeerAreRefusedWithoutSkewingErrorRate() {
        manager = manager(0);
        register("A", "B");
        manager.connectAgents("A", "B");
        PeerAgent a = manager.agent("A");
        manager.agent("B").transport().stop();

        Assertions.assertFalse(a.sendToPeer("B", "ping", Map.of()));
        NetworkMetrics metrics = manager.updateNetworkMetrics();

        Assertions.assertEquals(0.0, metrics.errorRate(), 1e-9);
        Assertions.assertEquals(0, metrics.activeConnections());
        Assertions.assertEquals(0, metrics.clusterCount());
    }

    @Test
    void healthCheckRestartsStoppedAgent() {
        manager = manager(0);
        register("A", "B");
        manager.connectAgents("A", "B");
        manager.agent("B").shutdown();
        Assertions.assertFalse(manager.agent("B").isRunning());

        List<String> removed = manager.performHealthChecks();

        Assertions.assertTrue(removed.isEmpty());
        Assertions.assertTrue(manager.agent("B").isRunning());
        Assertions.assertEquals(NodeState.CONNECTED, manager.getNodeInfo("B").state());
    }

    @Test
    void healthCheckRemovesAgentThatCannotRestart() {
        manager = manager(0);
        register("A");
        FlakyTransport flaky = new FlakyTransport(network.createTransport("B", NetworkSettings.defaults()));
        manager.registerAgent(agent("B", flaky));
        manager.connectAgents("A", "B");
        flaky.stop();
        flaky.failStarts = true;

        List<String> removed = manager.performHealthChecks();

        Assertions.assertEquals(List.of("B"), removed);
        Assertions.assertNull(manager.getNodeInfo("B"));
        Assertions.assertEquals(List.of("A"), manager.registeredNodeIds());
        Assertions.assertTrue(manager.getNodeInfo("A").connections().isEmpty());
    }

    @Test
    void restartFinishingAfterTimeoutLeavesNoTransportRunning() {
        NetworkSettings d = NetworkSettings.defaults();
        NetworkSettings quickRestart = new NetworkSettings(d.heartbeatIntervalMs(), d.discoveryIntervalMs(),
                d.metricsIntervalMs(), d.healthCheckIntervalMs(), d.connectTimeoutMs(), 50L,
                d.messageTtlSeconds(), 0, d.targetFanout(), d.healthDegradedThreshold());
        manager = new TopologyManager(quickRestart, events::add);
        register("A");
        FlakyTransport slow = new FlakyTransport(network.createTransport("B", NetworkSettings.defaults()));
        manager.registerAgent(agent("B", slow));
        slow.stop();
        slow.startDelayMs = 300L;

        List<String> removed = manager.performHealthChecks();

        Assertions.assertEquals(List.of("B"), removed);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> slow.completedStarts.get() >= 2 && !slow.isRunning());
        Assertions.assertEquals(1, network.boundEndpoints());
    }

    @Test
    void startAndStopPublishLifecycleEvents() {
        manager = manager(0);
        register("A");

        manager.start();
        manager.start();
        Assertions.assertTrue(manager.isStarted());
        manager.stop();

        Assertions.assertEquals(1, events.stream().filter(e -> e.type() == NetworkEventType.SYSTEM_STARTUP).count());
        Assertions.assertEquals(1, events.stream().filter(e -> e.type() == NetworkEventType.SYSTEM_SHUTDOWN).count());
        Assertions.assertTrue(manager.registeredNodeIds().isEmpty());
    }

    @Test
    void clusterChangesArePublished() {
        manager = manager(0);
        register("A", "B");
        events.clear();

        manager.connectAgents("A", "B");
        manager.updateClusters();

        List<NetworkEvent> changes = events.stream()
                .filter(e -> e.type() == NetworkEventType.CLUSTER_CHANGED)
                .toList();
        Assertions.assertEquals(1, changes.size());
        Assertions.assertEquals(1, changes.get(0).payload().get("clusterCount"));
    }

    @Test
    void concurrentRegistrationKeepsRegistryConsistent() throws Exception {
        manager = manager(3);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 24; i++) {
                String id = "node-" + i;
                futures.add(pool.submit(() -> manager.registerAgent(
                        agent(id, network.createTransport(id, NetworkSettings.defaults())))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        TopologySnapshot topology = manager.getTopology();
        Assertions.assertEquals(24, topology.nodes().size());
        Set<String> clustered = new java.util.HashSet<>();
        for (Set<String> members : topology.clusters().values()) {
            for (String member : members) {
                Assertions.assertTrue(clustered.add(member));
            }
        }
        for (Map.Entry<String, Set<String>> entry : topology.connections().entrySet()) {
            Assertions.assertTrue(topology.nodes().keySet().containsAll(entry.getValue()));
        }
    }

    private TopologyManager manager(int seedFanout) {
        return new TopologyManager(NetworkSettings.defaults().withSeedFanout(seedFanout), events::add);
    }

    private void register(String... ids) {
        for (String id : ids) {
            manager.registerAgent(agent(id, network.createTransport(id, NetworkSettings.defaults())));
        }
    }

    private PeerAgent agent(String id, Transport transport) {
        AgentCapabilities capabilities = AgentCapabilities.builder()
                .canExecuteCode(true)
                .specializedSkills(List.of("java"))
                .build();
        return new PeerAgent(AgentRole.DEVELOPER, capabilities, transport, null, events::add);
    }

    private static final class FlakyTransport implements Transport {
        private final InMemoryTransport delegate;
        private final AtomicInteger completedStarts = new AtomicInteger();
        private volatile boolean failStarts;
        private volatile long startDelayMs;

        FlakyTransport(InMemoryTransport delegate) {
            this.delegate = delegate;
        }

        @Override
        public String nodeId() {
            return delegate.nodeId();
        }

        @Override
        public String address() {
            return delegate.address();
        }

        @Override
        public int port() {
            return delegate.port();
        }

        @Override
        public void start() {
            if (failStarts) {
                throw new IllegalStateException("endpoint unavailable");
            }
            pauseIgnoringInterrupts(startDelayMs);
            delegate.start();
            completedStarts.incrementAndGet();
        }

        // Models a bind that does not react to interruption.
        private static void pauseIgnoringInterrupts(long millis) {
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
            boolean interrupted = false;
            while (System.nanoTime() < until) {
                try {
                    Thread.sleep(5L);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public void stop() {
            delegate.stop();
        }

        @Override
        public boolean isRunning() {
            return delegate.isRunning();
        }

        @Override
        public boolean connect(String peerId, String address, int port) {
            return delegate.connect(peerId, address, port);
        }

        @Override
        public void disconnect(String peerId) {
            delegate.disconnect(peerId);
        }

        @Override
        public boolean sendMessage(String to, String topic, Object payload) {
            return delegate.sendMessage(to, topic, payload);
        }

        @Override
        public int broadcast(String topic, Object payload) {
            return delegate.broadcast(topic, payload);
        }

        @Override
        public void onMessage(String topic, MessageHandler handler) {
            delegate.onMessage(topic, handler);
        }

        @Override
        public void advertiseCapabilities(List<String> capabilities) {
            delegate.advertiseCapabilities(capabilities);
        }

        @Override
        public List<String> connectedPeers() {
            return delegate.connectedPeers();
        }

        @Override
        public Collection<PeerNode> knownNodes() {
            return delegate.knownNodes();
        }

        @Override
        public TransportStats stats() {
            return delegate.stats();
        }

        @Override
        public void addListener(TransportListener listener) {
            delegate.addListener(listener);
        }

        @Override
        public void removeListener(TransportListener listener) {
            delegate.removeListener(listener);
        }
    }
}

package io.swarmmesh.topology;

import io.swarmmesh.agent.PeerAgent;
import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.events.EventPublisher;
import io.swarmmesh.events.NetworkEvent;
import io.swarmmesh.events.NetworkEventType;
import io.swarmmesh.model.NetworkMetrics;
import io.swarmmesh.model.NodeInfo;
import io.swarmmesh.model.NodeState;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.model.PeerNode;
import io.swarmmesh.model.TopologySnapshot;
import io.swarmmesh.transport.Transport;
import io.swarmmesh.transport.TransportListener;
import io.swarmmesh.transport.TransportStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of the agents taking part in one swarm, with the derived graph view: directed edges,
 * clusters, bridges and network metrics.
 *
 * <p>All registry state sits behind one read/write lock. Network work (connecting, restarting,
 * broadcasting) runs outside it, and events are published after the lock is released.
 */
public final class TopologyManager implements AutoCloseable {
    public static final String EVENT_SOURCE = "topology-manager";
    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    private final NetworkSettings settings;
    private final EventPublisher events;
    private final ReentrantReadWriteLock lock;
    private final Map<String, PeerAgent> agents;
    private final Map<String, NodeState> states;
    private final Map<String, Long> registeredAtMs;
    private final Map<String, Set<String>> edges;
    private final Map<String, TransportListener> edgeListeners;
    private final ExecutorService restartPool;
    private Map<String, Set<String>> clusters;
    private Map<String, Set<String>> bridges;
    private volatile NetworkMetrics metrics;
    private long lastSentTotal;
    private long lastSampleAtMs;
    private ScheduledExecutorService scheduler;

    public TopologyManager(NetworkSettings settings, EventPublisher events) {
        this.settings = settings == null ? NetworkSettings.defaults() : settings;
        this.events = events == null ? EventPublisher.NOOP : events;
        this.lock = new ReentrantReadWriteLock();
        this.agents = new LinkedHashMap<>();
        this.states = new LinkedHashMap<>();
        this.registeredAtMs = new LinkedHashMap<>();
        this.edges = new LinkedHashMap<>();
        this.edgeListeners = new LinkedHashMap<>();
        AtomicInteger restartThreads = new AtomicInteger(0);
        this.restartPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "swarmmesh-restart-" + restartThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.clusters = Map.of();
        this.bridges = Map.of();
        this.metrics = NetworkMetrics.initial();
        this.lastSentTotal = 0L;
        this.lastSampleAtMs = 0L;
    }

    public NetworkSettings settings() {
        return settings;
    }

    public synchronized void start() {
        if (scheduler != null) {
            log.info("Topology manager already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "swarmmesh-topology");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::safeMetrics,
                settings.metricsIntervalMs(), settings.metricsIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::safeHealthChecks,
                settings.healthCheckIntervalMs(), settings.healthCheckIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Topology manager started (metrics every {} ms, health checks every {} ms)",
                settings.metricsIntervalMs(), settings.healthCheckIntervalMs());
        events.publish(NetworkEvent.of(NetworkEventType.SYSTEM_STARTUP, EVENT_SOURCE, Map.of(
                "metricsIntervalMs", settings.metricsIntervalMs(),
                "healthCheckIntervalMs", settings.healthCheckIntervalMs()
        )));
    }

    /**
     * Cancels the periodic tasks, shuts every registered agent down and empties the registry.
     * {@code SYSTEM_SHUTDOWN} is only published when {@link #start()} ran before.
     */
    public synchronized void stop() {
        boolean wasStarted = scheduler != null;
        if (wasStarted) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        List<String> nodeIds = registeredNodeIds();
        for (String nodeId : nodeIds) {
            unregisterAgent(nodeId);
        }
        if (wasStarted) {
            log.info("Topology manager stopped");
            events.publish(NetworkEvent.of(NetworkEventType.SYSTEM_SHUTDOWN, EVENT_SOURCE, Map.of("nodes", nodeIds.size())));
        }
    }

    public synchronized boolean isStarted() {
        return scheduler != null;
    }

    @Override
    public void close() {
        stop();
        restartPool.shutdownNow();
    }

    /**
     * Adds the agent, starts it and links it to up to {@code seedFanout} agents registered before it.
     *
     * @throws IllegalArgumentException when an agent with the same id is already registered
     */
    public void registerAgent(PeerAgent agent) {
        Objects.requireNonNull(agent, "agent");
        String nodeId = agent.id();
        List<PeerAgent> seeds = new ArrayList<>();
        TransportListener listener = new EdgeSyncListener();
        lock.writeLock().lock();
        try {
            if (agents.containsKey(nodeId)) {
                throw new IllegalArgumentException("Agent already registered: " + nodeId);
            }
            for (PeerAgent existing : agents.values()) {
                if (seeds.size() >= settings.seedFanout()) {
                    break;
                }
                seeds.add(existing);
            }
            agents.put(nodeId, agent);
            states.put(nodeId, NodeState.REGISTERED);
            registeredAtMs.put(nodeId, Instant.now().toEpochMilli());
            edges.put(nodeId, new LinkedHashSet<>());
            edgeListeners.put(nodeId, listener);
        } finally {
            lock.writeLock().unlock();
        }

        agent.transport().addListener(listener);
        try {
            agent.initialize();
        } catch (RuntimeException e) {
            log.warn("Agent {} failed to initialize, dropping registration: {}", nodeId, e.getMessage());
            removeFromRegistry(nodeId);
            agent.transport().removeListener(listener);
            throw e;
        }

        int linked = connectToSeeds(agent, seeds);

        List<NetworkEvent> pending = new ArrayList<>();
        Set<String> connections;
        lock.writeLock().lock();
        try {
            if (!agents.containsKey(nodeId)) {
                return;
            }
            states.put(nodeId, NodeState.CONNECTED);
            recomputeLocked(pending);
            connections = Set.copyOf(edges.getOrDefault(nodeId, Set.of()));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered agent {} ({}) with {} seed links", nodeId, agent.role().wireName(), linked);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodeId", nodeId);
        payload.put("role", agent.role().wireName());
        payload.put("connections", connections);
        events.publish(NetworkEvent.of(NetworkEventType.AGENT_REGISTERED, EVENT_SOURCE, payload));
        publishAll(pending);
    }

    /**
     * Removes the node, its incident edges and every cluster or bridge reference in one locked
     * step, then stops its transport. Unknown ids are ignored.
     */
    public void unregisterAgent(String nodeId) {
        List<NetworkEvent> pending = new ArrayList<>();
        PeerAgent agent;
        TransportListener listener;
        lock.writeLock().lock();
        try {
            agent = agents.get(nodeId);
            if (agent == null) {
                return;
            }
            listener = edgeListeners.get(nodeId);
            removeLocked(nodeId);
            recomputeLocked(pending);
        } finally {
            lock.writeLock().unlock();
        }
        if (listener != null) {
            agent.transport().removeListener(listener);
        }
        try {
            agent.shutdown();
        } catch (RuntimeException e) {
            log.warn("Agent {} failed to shut down cleanly: {}", nodeId, e.getMessage());
        }
        log.info("Unregistered agent {}", nodeId);
        events.publish(NetworkEvent.of(NetworkEventType.NODE_REMOVED, EVENT_SOURCE, Map.of("nodeId", nodeId)));
        publishAll(pending);
    }

    /**
     * Opens a link from {@code fromId} to {@code toId} and records both edge directions.
     */
    public boolean connectAgents(String fromId, String toId) {
        PeerAgent from;
        PeerAgent to;
        lock.readLock().lock();
        try {
            from = agents.get(fromId);
            to = agents.get(toId);
        } finally {
            lock.readLock().unlock();
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both agents must be registered: " + fromId + ", " + toId);
        }
        if (!from.connectToPeer(toId, to.transport().address(), to.transport().port())) {
            return false;
        }
        addEdges(fromId, toId);
        return true;
    }

    public void disconnectAgents(String fromId, String toId) {
        PeerAgent from;
        PeerAgent to;
        lock.readLock().lock();
        try {
            from = agents.get(fromId);
            to = agents.get(toId);
        } finally {
            lock.readLock().unlock();
        }
        if (from != null) {
            from.disconnectFromPeer(toId);
        }
        if (to != null) {
            to.disconnectFromPeer(fromId);
        }
        removeEdges(fromId, toId);
    }

    /**
     * Recomputes clusters and bridges from the current edge set.
     */
    public Map<String, Set<String>> updateClusters() {
        List<NetworkEvent> pending = new ArrayList<>();
        Map<String, Set<String>> result;
        lock.writeLock().lock();
        try {
            recomputeLocked(pending);
            result = clusters;
        } finally {
            lock.writeLock().unlock();
        }
        publishAll(pending);
        return result;
    }

    public Map<String, Set<String>> identifyBridgeNodes() {
        lock.writeLock().lock();
        try {
            bridges = TopologyGraph.bridges(agents.keySet(), edges, clusters);
            return bridges;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> findPath(String fromNodeId, String toNodeId) {
        lock.readLock().lock();
        try {
            return TopologyGraph.shortestPath(agents.keySet(), edges, fromNodeId, toNodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public NetworkMetrics updateNetworkMetrics() {
        int totalNodes;
        int activeConnections = 0;
        int clusterCount;
        int bridgeCount;
        List<Transport> transports = new ArrayList<>();
        lock.readLock().lock();
        try {
            totalNodes = agents.size();
            for (Set<String> targets : edges.values()) {
                activeConnections += targets.size();
            }
            clusterCount = clusters.size();
            bridgeCount = bridges.size();
            for (PeerAgent agent : agents.values()) {
                transports.add(agent.transport());
            }
        } finally {
            lock.readLock().unlock();
        }

        long sent = 0L;
        long received = 0L;
        long failures = 0L;
        double weightedLatency = 0.0;
        for (Transport transport : transports) {
            TransportStats stats = transport.stats();
            sent += stats.messagesSent();
            failures += stats.sendFailures();
            received += stats.messagesReceived();
            weightedLatency += stats.averageLatencyMs() * stats.messagesReceived();
        }
        double averageLatency = received == 0L ? 0.0 : weightedLatency / received;
        long attempts = sent + failures;
        double errorRate = attempts == 0L ? 0.0 : (double) failures / attempts * 100.0;
        long nowMs = Instant.now().toEpochMilli();
        double throughput;
        synchronized (this) {
            long elapsedMs = lastSampleAtMs == 0L ? 0L : nowMs - lastSampleAtMs;
            throughput = elapsedMs <= 0L ? 0.0 : Math.max(0L, sent - lastSentTotal) * 1000.0 / elapsedMs;
            lastSentTotal = sent;
            lastSampleAtMs = nowMs;
        }
        double health = networkHealth(totalNodes, activeConnections, clusterCount, settings.targetFanout());
        NetworkMetrics next = new NetworkMetrics(totalNodes, activeConnections, averageLatency, health,
                clusterCount, bridgeCount, throughput, errorRate, nowMs);
        metrics = next;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("totalNodes", totalNodes);
        payload.put("activeConnections", activeConnections);
        payload.put("averageLatencyMs", averageLatency);
        payload.put("networkHealth", health);
        payload.put("errorRate", errorRate);
        events.publish(NetworkEvent.of(NetworkEventType.PERFORMANCE_METRIC, EVENT_SOURCE, payload));
        if (health < settings.healthDegradedThreshold()) {
            log.warn("Network health degraded to {} (threshold {})", health, settings.healthDegradedThreshold());
            events.publish(NetworkEvent.of(NetworkEventType.HEALTH_DEGRADED, EVENT_SOURCE, Map.of(
                    "networkHealth", health,
                    "threshold", settings.healthDegradedThreshold()
            )));
        }
        return next;
    }

    /**
     * Health score in [0, 100]: the mean of cluster presence (100 with at least one cluster, 50
     * without) and average directed connections per node against the target fan-out, capped at 100.
     * An empty network scores 100.
     */
    static double networkHealth(int totalNodes, int activeConnections, int clusterCount, int targetFanout) {
        if (totalNodes <= 0) {
            return 100.0;
        }
        double clusterHealth = clusterCount > 0 ? 100.0 : 50.0;
        double averageConnections = (double) activeConnections / totalNodes;
        double connectionHealth = Math.min(100.0, averageConnections / Math.max(1, targetFanout) * 100.0);
        return Math.max(0.0, Math.min(100.0, (clusterHealth + connectionHealth) / 2.0));
    }

    /**
     * Restarts every agent whose transport is down, once, within {@code restartTimeoutMs}. Agents
     * that stay down are unregistered.
     *
     * @return ids of the agents removed by this pass
     */
    public List<String> performHealthChecks() {
        Map<String, PeerAgent> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new LinkedHashMap<>(agents);
        } finally {
            lock.readLock().unlock();
        }
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, PeerAgent> entry : snapshot.entrySet()) {
            String nodeId = entry.getKey();
            PeerAgent agent = entry.getValue();
            if (agent.isRunning()) {
                continue;
            }
            if (!transition(nodeId, NodeState.RECONNECTING)) {
                continue;
            }
            log.warn("Agent {} is not running, attempting restart", nodeId);
            if (restartWithinTimeout(agent)) {
                transition(nodeId, NodeState.CONNECTED);
                reseed(agent);
                log.info("Agent {} restarted", nodeId);
            } else {
                log.warn("Agent {} failed to restart, unregistering", nodeId);
                unregisterAgent(nodeId);
                removed.add(nodeId);
            }
        }
        return removed;
    }

    public int broadcastMessage(String topic, Object payload) {
        List<PeerAgent> targets;
        lock.readLock().lock();
        try {
            targets = new ArrayList<>(agents.values());
        } finally {
            lock.readLock().unlock();
        }
        int total = 0;
        for (PeerAgent agent : targets) {
            try {
                total += agent.broadcastToPeers(topic, payload);
            } catch (RuntimeException e) {
                log.warn("Broadcast of {} from {} failed: {}", topic, agent.id(), e.getMessage());
            }
        }
        return total;
    }

    public TopologySnapshot getTopology() {
        lock.readLock().lock();
        try {
            Map<String, PeerNode> nodes = new LinkedHashMap<>();
            for (PeerAgent agent : agents.values()) {
                nodes.put(agent.id(), toPeerNode(agent));
            }
            return new TopologySnapshot(
                    Collections.unmodifiableMap(nodes),
                    copyOf(edges),
                    copyOf(clusters),
                    copyOf(bridges)
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    public NetworkMetrics getMetrics() {
        return metrics;
    }

    /**
     * @return the node's view, or null when no agent with that id is registered
     */
    public NodeInfo getNodeInfo(String nodeId) {
        PeerAgent agent;
        NodeState state;
        Set<String> connections;
        lock.readLock().lock();
        try {
            agent = agents.get(nodeId);
            if (agent == null) {
                return null;
            }
            state = states.get(nodeId);
            connections = Collections.unmodifiableSet(new LinkedHashSet<>(edges.getOrDefault(nodeId, Set.of())));
        } finally {
            lock.readLock().unlock();
        }
        return new NodeInfo(
                nodeId,
                agent.role().wireName(),
                state,
                connections,
                agent.networkStats(),
                agent.capabilities().specializedSkills()
        );
    }

    public List<String> registeredNodeIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(agents.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public PeerAgent agent(String nodeId) {
        lock.readLock().lock();
        try {
            return agents.get(nodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private int connectToSeeds(PeerAgent agent, List<PeerAgent> seeds) {
        int linked = 0;
        for (PeerAgent seed : seeds) {
            if (!seed.isRunning()) {
                continue;
            }
            if (agent.connectToPeer(seed.id(), seed.transport().address(), seed.transport().port())) {
                addEdges(agent.id(), seed.id());
                linked++;
            }
        }
        return linked;
    }

    private void reseed(PeerAgent agent) {
        List<PeerAgent> seeds = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (PeerAgent candidate : agents.values()) {
                if (seeds.size() >= settings.seedFanout()) {
                    break;
                }
                if (!candidate.id().equals(agent.id())) {
                    seeds.add(candidate);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        connectToSeeds(agent, seeds);
    }

    /**
     * Runs {@code agent.restart()} on the restart pool. On timeout the attempt is abandoned: the
     * worker is interrupted, the agent is shut down, and a restart that still completes later shuts
     * the agent down again instead of leaving its transport open.
     */
    private boolean restartWithinTimeout(PeerAgent agent) {
        AtomicBoolean abandoned = new AtomicBoolean(false);
        Future<?> restart = restartPool.submit(() -> {
            agent.restart();
            if (abandoned.get()) {
                log.info("Agent {} came back after its restart timed out, shutting it down", agent.id());
                agent.shutdown();
            }
        });
        try {
            restart.get(settings.restartTimeoutMs(), TimeUnit.MILLISECONDS);
            return agent.isRunning();
        } catch (TimeoutException e) {
            abandoned.set(true);
            restart.cancel(true);
            agent.shutdown();
            log.warn("Restart of agent {} timed out after {} ms", agent.id(), settings.restartTimeoutMs());
            return false;
        } catch (ExecutionException e) {
            log.warn("Restart of agent {} failed: {}", agent.id(), e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean transition(String nodeId, NodeState next) {
        lock.writeLock().lock();
        try {
            if (!agents.containsKey(nodeId)) {
                return false;
            }
            states.put(nodeId, next);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void addEdges(String a, String b) {
        List<NetworkEvent> pending = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (!agents.containsKey(a) || !agents.containsKey(b) || a.equals(b)) {
                return;
            }
            boolean changed = edges.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
            changed |= edges.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
            if (changed) {
                recomputeLocked(pending);
            }
        } finally {
            lock.writeLock().unlock();
        }
        publishAll(pending);
    }

    private void removeEdges(String a, String b) {
        List<NetworkEvent> pending = new ArrayList<>();
        lock.writeLock().lock();
        try {
            boolean changed = false;
            Set<String> fromA = edges.get(a);
            if (fromA != null) {
                changed = fromA.remove(b);
            }
            Set<String> fromB = edges.get(b);
            if (fromB != null) {
                changed |= fromB.remove(a);
            }
            if (changed) {
                recomputeLocked(pending);
            }
        } finally {
            lock.writeLock().unlock();
        }
        publishAll(pending);
    }

    private void removeFromRegistry(String nodeId) {
        List<NetworkEvent> pending = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (agents.containsKey(nodeId)) {
                removeLocked(nodeId);
                recomputeLocked(pending);
            }
        } finally {
            lock.writeLock().unlock();
        }
        publishAll(pending);
    }

    private void removeLocked(String nodeId) {
        agents.remove(nodeId);
        states.remove(nodeId);
        registeredAtMs.remove(nodeId);
        edgeListeners.remove(nodeId);
        edges.remove(nodeId);
        for (Set<String> targets : edges.values()) {
            targets.remove(nodeId);
        }
    }

    private void recomputeLocked(List<NetworkEvent> pending) {
        Map<String, Set<String>> next = TopologyGraph.clusters(agents.keySet(), edges);
        boolean changed = !partition(next).equals(partition(clusters));
        clusters = Collections.unmodifiableMap(next);
        bridges = Collections.unmodifiableMap(TopologyGraph.bridges(agents.keySet(), edges, clusters));
        if (changed) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("clusterCount", clusters.size());
            payload.put("clusters", copyOf(clusters));
            payload.put("bridgeCount", bridges.size());
            pending.add(NetworkEvent.of(NetworkEventType.CLUSTER_CHANGED, EVENT_SOURCE, payload));
        }
    }

    private static Set<Set<String>> partition(Map<String, Set<String>> clusterMap) {
        Set<Set<String>> members = new HashSet<>();
        for (Set<String> cluster : clusterMap.values()) {
            members.add(Set.copyOf(cluster));
        }
        return members;
    }

    private PeerNode toPeerNode(PeerAgent agent) {
        Transport transport = agent.transport();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("role", agent.role().wireName());
        metadata.put("state", states.get(agent.id()).name());
        long seenMs = registeredAtMs.getOrDefault(agent.id(), 0L);
        return new PeerNode(
                agent.id(),
                transport.address(),
                transport.port(),
                agent.capabilities().specializedSkills(),
                transport.isRunning() ? NodeStatus.ONLINE : NodeStatus.OFFLINE,
                seenMs,
                metadata
        );
    }

    private static Map<String, Set<String>> copyOf(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    private void publishAll(List<NetworkEvent> pending) {
        for (NetworkEvent event : pending) {
            events.publish(event);
        }
    }

    private void safeMetrics() {
        try {
            updateNetworkMetrics();
        } catch (RuntimeException e) {
            log.warn("Metrics update failed: {}", e.getMessage(), e);
        }
    }

    private void safeHealthChecks() {
        try {
            performHealthChecks();
        } catch (RuntimeException e) {
            log.warn("Health check pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Mirrors link changes reported by an agent's transport into the edge map, so peer-initiated
     * connects and dropped sockets show up in the topology.
     */
    private final class EdgeSyncListener implements TransportListener {
        @Override
        public void peerConnected(String nodeId, String peerId) {
            addEdges(nodeId, peerId);
        }

        @Override
        public void peerDisconnected(String nodeId, String peerId) {
            removeEdges(nodeId, peerId);
        }

        @Override
        public void connectionFailed(String nodeId, String peerId, Throwable cause) {
            events.publish(NetworkEvent.of(NetworkEventType.CONNECTION_FAILED, EVENT_SOURCE, Map.of(
                    "nodeId", nodeId,
                    "peerId", peerId,
                    "reason", cause == null || cause.getMessage() == null ? "unknown" : cause.getMessage()
            )));
        }
    }
}

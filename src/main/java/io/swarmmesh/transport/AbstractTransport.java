package io.swarmmesh.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.model.ConnectionStatus;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.NetworkMessage;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.model.PeerConnection;
import io.swarmmesh.model.PeerNode;
import io.swarmmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection bookkeeping, periodic announcements and inbound dispatch shared by every transport.
 *
 * <p>Subclasses supply the endpoint ({@link #openEndpoint()}, {@link #closeEndpoint()}) and the
 * dialer ({@link #dial}); accepted links are handed back through {@link #registerInbound} and
 * inbound frames through {@link #deliver}.
 */
public abstract class AbstractTransport implements Transport {
    public static final String HEARTBEAT_TOPIC = "heartbeat";
    public static final String DISCOVERY_TOPIC = "discovery_request";
    private static final List<String> DEFAULT_CAPABILITIES = List.of("agent", "task_processing");
    private static final Logger log = LoggerFactory.getLogger(AbstractTransport.class);

    private final String nodeId;
    private final NetworkSettings settings;
    private final ConcurrentMap<String, Link> links;
    private final ConcurrentMap<String, PeerNode> knownNodes;
    private final ConcurrentMap<String, MessageHandler> handlers;
    private final List<TransportListener> listeners;
    private final AtomicLong messagesSent;
    private final AtomicLong messagesReceived;
    private final AtomicLong sendFailures;
    private final AtomicLong latencyTotalMs;
    private final AtomicLong latencySamples;
    private final Object lifecycleLock;
    private volatile List<String> advertisedCapabilities;
    private volatile boolean running;
    private ScheduledExecutorService scheduler;

    protected AbstractTransport(String nodeId, NetworkSettings settings) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("transport node id cannot be empty");
        }
        this.nodeId = nodeId;
        this.settings = settings == null ? NetworkSettings.defaults() : settings;
        this.links = new ConcurrentHashMap<>();
        this.knownNodes = new ConcurrentHashMap<>();
        this.handlers = new ConcurrentHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
        this.messagesSent = new AtomicLong(0L);
        this.messagesReceived = new AtomicLong(0L);
        this.sendFailures = new AtomicLong(0L);
        this.latencyTotalMs = new AtomicLong(0L);
        this.latencySamples = new AtomicLong(0L);
        this.lifecycleLock = new Object();
        this.advertisedCapabilities = DEFAULT_CAPABILITIES;
        this.running = false;
    }

    protected abstract void openEndpoint() throws IOException;

    protected abstract void closeEndpoint();

    protected abstract Channel dial(String peerId, String address, int port, long timeoutMs) throws IOException;

    @Override
    public String nodeId() {
        return nodeId;
    }

    protected NetworkSettings settings() {
        return settings;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.info("Transport already running for node {}", nodeId);
                return;
            }
            try {
                openEndpoint();
            } catch (IOException e) {
                throw new RuntimeException("Failed to open transport endpoint for node " + nodeId, e);
            }
            running = true;
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "swarmmesh-transport-" + nodeId);
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleAtFixedRate(
                    this::safeHeartbeat,
                    settings.heartbeatIntervalMs(),
                    settings.heartbeatIntervalMs(),
                    TimeUnit.MILLISECONDS
            );
            scheduler.scheduleAtFixedRate(
                    this::safeDiscovery,
                    settings.discoveryIntervalMs(),
                    settings.discoveryIntervalMs(),
                    TimeUnit.MILLISECONDS
            );
        }
        log.info("Transport started for node {} at {}:{}", nodeId, address(), port());
        notifyListeners(l -> l.networkStarted(nodeId));
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
            for (String peerId : new ArrayList<>(links.keySet())) {
                disconnect(peerId);
            }
            links.clear();
            knownNodes.clear();
            closeEndpoint();
        }
        log.info("Transport stopped for node {}", nodeId);
        notifyListeners(l -> l.networkStopped(nodeId));
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean connect(String peerId, String address, int port) {
        if (peerId == null || peerId.isBlank() || nodeId.equals(peerId)) {
            IllegalArgumentException invalid = new IllegalArgumentException("Invalid peer id: " + peerId);
            log.warn("Node {} refused to connect to invalid peer id {}", nodeId, peerId);
            notifyListeners(l -> l.connectionFailed(nodeId, peerId, invalid));
            return false;
        }
        Link existing = links.get(peerId);
        if (existing != null && existing.connection().isConnected()) {
            log.debug("Node {} already connected to {}", nodeId, peerId);
            return true;
        }
        if (!running) {
            IllegalStateException notRunning = new IllegalStateException("transport not running");
            log.warn("Node {} cannot connect to {}: transport not running", nodeId, peerId);
            notifyListeners(l -> l.connectionFailed(nodeId, peerId, notRunning));
            return false;
        }
        Channel channel;
        try {
            channel = dial(peerId, address, port, settings.connectTimeoutMs());
        } catch (IOException | RuntimeException e) {
            log.warn("Node {} failed to connect to {} at {}:{}: {}", nodeId, peerId, address, port, e.getMessage());
            notifyListeners(l -> l.connectionFailed(nodeId, peerId, e));
            return false;
        }
        long nowMs = Instant.now().toEpochMilli();
        PeerConnection connection = new PeerConnection(peerId, address, port, ConnectionStatus.CONNECTED, nowMs);
        Link previous = links.put(peerId, new Link(connection, channel));
        if (previous != null && previous.channel() != channel) {
            previous.channel().close();
        }
        knownNodes.putIfAbsent(peerId, new PeerNode(peerId, address, port, List.of(), NodeStatus.ONLINE, nowMs, Map.of()));
        log.info("Node {} connected to peer {} at {}:{}", nodeId, peerId, address, port);
        notifyListeners(l -> l.peerConnected(nodeId, peerId));
        channel.activate();
        return true;
    }

    @Override
    public void disconnect(String peerId) {
        Link link = links.remove(peerId);
        if (link == null) {
            return;
        }
        link.connection().status(ConnectionStatus.DISCONNECTED);
        link.channel().close();
        log.info("Node {} disconnected from peer {}", nodeId, peerId);
        notifyListeners(l -> l.peerDisconnected(nodeId, peerId));
    }

    @Override
    public boolean sendMessage(String to, String topic, Object payload) {
        NetworkMessage message = NetworkMessage.create(
                nodeId,
                to,
                MessageType.DIRECT,
                topic,
                payload,
                Instant.now().toEpochMilli(),
                settings.messageTtlSeconds()
        );
        Link link = links.get(to);
        if (link == null || !link.connection().isConnected()) {
            log.warn("Node {} has no connection to peer {} for {}", nodeId, to, topic);
            return false;
        }
        return transmit(link, message);
    }

    @Override
    public int broadcast(String topic, Object payload) {
        return broadcast(MessageType.BROADCAST, topic, payload);
    }

    /**
     * Sends one heartbeat announcement to every connected peer.
     */
    public int announceHeartbeat() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodeId", nodeId);
        payload.put("timestamp", Instant.now().toEpochMilli());
        payload.put("status", NodeStatus.ONLINE.wireName());
        return broadcast(MessageType.HEARTBEAT, HEARTBEAT_TOPIC, payload);
    }

    /**
     * Sends one discovery announcement carrying the advertised capabilities to every connected peer.
     */
    public int announceDiscovery() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodeId", nodeId);
        payload.put("capabilities", advertisedCapabilities);
        payload.put("timestamp", Instant.now().toEpochMilli());
        return broadcast(MessageType.DISCOVERY, DISCOVERY_TOPIC, payload);
    }

    private int broadcast(MessageType type, String topic, Object payload) {
        NetworkMessage message = NetworkMessage.create(
                nodeId,
                NetworkMessage.BROADCAST_TARGET,
                type,
                topic,
                payload,
                Instant.now().toEpochMilli(),
                settings.messageTtlSeconds()
        );
        int sent = 0;
        for (Link link : links.values()) {
            if (link.connection().isConnected() && transmit(link, message)) {
                sent++;
            }
        }
        log.debug("Node {} broadcast {} to {} peers", nodeId, topic, sent);
        return sent;
    }

    private boolean transmit(Link link, NetworkMessage message) {
        try {
            link.channel().send(message);
            link.connection().touch(Instant.now().toEpochMilli());
            messagesSent.incrementAndGet();
            return true;
        } catch (IOException | RuntimeException e) {
            sendFailures.incrementAndGet();
            log.warn("Node {} failed to send {} to {}: {}", nodeId, message.topic(), link.connection().peerId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void onMessage(String topic, MessageHandler handler) {
        if (topic == null || topic.isBlank() || handler == null) {
            throw new IllegalArgumentException("message handler requires a topic and a handler");
        }
        MessageHandler previous = handlers.put(topic, handler);
        if (previous != null) {
            log.debug("Node {} replaced handler for {}", nodeId, topic);
        }
    }

    @Override
    public void advertiseCapabilities(List<String> capabilities) {
        this.advertisedCapabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    @Override
    public List<String> connectedPeers() {
        List<String> peers = new ArrayList<>();
        for (Map.Entry<String, Link> entry : links.entrySet()) {
            if (entry.getValue().connection().isConnected()) {
                peers.add(entry.getKey());
            }
        }
        return peers;
    }

    @Override
    public Collection<PeerNode> knownNodes() {
        return List.copyOf(knownNodes.values());
    }

    public Optional<PeerNode> knownNode(String peerId) {
        return Optional.ofNullable(knownNodes.get(peerId));
    }

    public Optional<PeerConnection> connection(String peerId) {
        Link link = links.get(peerId);
        return link == null ? Optional.empty() : Optional.of(link.connection());
    }

    @Override
    public TransportStats stats() {
        long samples = latencySamples.get();
        double averageLatency = samples == 0L ? 0.0 : (double) latencyTotalMs.get() / samples;
        return new TransportStats(
                nodeId,
                connectedPeers().size(),
                knownNodes.size(),
                messagesSent.get(),
                messagesReceived.get(),
                sendFailures.get(),
                averageLatency,
                running
        );
    }

    @Override
    public void addListener(TransportListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeListener(TransportListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records a link opened by a remote peer. Returns false when a live link to that peer already
     * exists, in which case the caller should close the new channel.
     */
    protected boolean registerInbound(String peerId, String address, int port, Channel channel) {
        if (!running || peerId == null || peerId.isBlank() || nodeId.equals(peerId)) {
            return false;
        }
        long nowMs = Instant.now().toEpochMilli();
        PeerConnection connection = new PeerConnection(peerId, address, port, ConnectionStatus.CONNECTED, nowMs);
        Link current = links.putIfAbsent(peerId, new Link(connection, channel));
        if (current != null && current.connection().isConnected()) {
            return false;
        }
        if (current != null) {
            links.put(peerId, new Link(connection, channel));
        }
        knownNodes.putIfAbsent(peerId, new PeerNode(peerId, address, port, List.of(), NodeStatus.ONLINE, nowMs, Map.of()));
        log.info("Node {} accepted peer {} from {}:{}", nodeId, peerId, address, port);
        notifyListeners(l -> l.peerConnected(nodeId, peerId));
        return true;
    }

    /**
     * Drops the link to a peer when its channel closed underneath us. Stale channels are ignored.
     */
    protected void linkLost(String peerId, Channel channel) {
        Link link = links.get(peerId);
        if (link == null || link.channel() != channel) {
            return;
        }
        if (links.remove(peerId, link)) {
            link.connection().status(ConnectionStatus.DISCONNECTED);
            log.info("Node {} lost link to peer {}", nodeId, peerId);
            notifyListeners(l -> l.peerDisconnected(nodeId, peerId));
        }
    }

    protected void deliver(String viaPeerId, NetworkMessage message) {
        if (!running || message == null) {
            return;
        }
        long nowMs = Instant.now().toEpochMilli();
        messagesReceived.incrementAndGet();
        latencyTotalMs.addAndGet(Math.max(0L, nowMs - message.timestampMs()));
        latencySamples.incrementAndGet();
        Link link = viaPeerId == null ? null : links.get(viaPeerId);
        if (link != null) {
            link.connection().touch(nowMs);
        }
        if (nodeId.equals(message.from()) && message.type() != MessageType.DIRECT) {
            return;
        }
        MessageType type = message.type() == null ? MessageType.DIRECT : message.type();
        switch (type) {
            case HEARTBEAT -> recordHeartbeat(message);
            case DISCOVERY -> recordDiscovery(message);
            case DIRECT, BROADCAST -> {
            }
        }
        MessageHandler handler = message.topic() == null ? null : handlers.get(message.topic());
        if (handler == null) {
            log.debug("Node {} has no handler for {}", nodeId, message.topic());
        } else {
            try {
                handler.handle(message);
            } catch (Exception e) {
                log.warn("Node {} handler for {} failed: {}", nodeId, message.topic(), e.getMessage(), e);
            }
        }
        notifyListeners(l -> l.messageReceived(nodeId, message));
    }

    private void recordHeartbeat(NetworkMessage message) {
        JsonNode payload = Jsons.toTree(message.payload());
        String peerId = payload.path("nodeId").asText(message.from());
        long seenMs = payload.path("timestamp").asLong(message.timestampMs());
        NodeStatus status = parseStatus(payload.path("status").asText(null));
        knownNodes.computeIfPresent(peerId, (id, node) -> seenMs >= node.lastSeenMs()
                ? node.withHeartbeat(status, seenMs)
                : node);
    }

    private void recordDiscovery(NetworkMessage message) {
        JsonNode payload = Jsons.toTree(message.payload());
        String peerId = payload.path("nodeId").asText(message.from());
        if (peerId == null || peerId.isBlank() || nodeId.equals(peerId)) {
            return;
        }
        long seenMs = payload.path("timestamp").asLong(message.timestampMs());
        List<String> capabilities = new ArrayList<>();
        payload.path("capabilities").forEach(c -> capabilities.add(c.asText()));
        knownNodes.compute(peerId, (id, node) -> {
            if (node == null) {
                return PeerNode.discovered(peerId, capabilities, seenMs);
            }
            return seenMs >= node.lastSeenMs() ? node.withCapabilities(capabilities, seenMs) : node;
        });
        log.debug("Node {} discovered peer {} with capabilities {}", nodeId, peerId, capabilities);
    }

    private NodeStatus parseStatus(String raw) {
        try {
            return NodeStatus.fromString(raw);
        } catch (IllegalArgumentException e) {
            log.debug("Node {} ignoring unknown heartbeat status {}", nodeId, raw);
            return NodeStatus.ONLINE;
        }
    }

    private void safeHeartbeat() {
        try {
            announceHeartbeat();
        } catch (RuntimeException e) {
            log.warn("Node {} heartbeat failed: {}", nodeId, e.getMessage());
        }
    }

    private void safeDiscovery() {
        try {
            announceDiscovery();
        } catch (RuntimeException e) {
            log.warn("Node {} discovery announcement failed: {}", nodeId, e.getMessage());
        }
    }

    private void notifyListeners(ListenerCall call) {
        for (TransportListener listener : listeners) {
            try {
                call.apply(listener);
            } catch (RuntimeException e) {
                log.warn("Transport listener failed on node {}: {}", nodeId, e.getMessage(), e);
            }
        }
    }

    @FunctionalInterface
    private interface ListenerCall {
        void apply(TransportListener listener);
    }

    /**
     * One open link to a peer, as seen by the concrete transport.
     */
    protected interface Channel {
        void send(NetworkMessage message) throws IOException;

        void close();

        /**
         * Called once a dialed link has been recorded. Inbound frames must not be read before this,
         * or an early close could not be matched to the link.
         */
        default void activate() {
        }
    }

    private record Link(PeerConnection connection, Channel channel) {
    }
}

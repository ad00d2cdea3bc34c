package io.swarmmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.events.EventPublisher;
import io.swarmmesh.events.NetworkEvent;
import io.swarmmesh.events.NetworkEventType;
import io.swarmmesh.model.NetworkMessage;
import io.swarmmesh.model.NodeStatus;
import io.swarmmesh.transport.AbstractTransport;
import io.swarmmesh.transport.Transport;
import io.swarmmesh.transport.TransportStats;
import io.swarmmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Binds an agent role, its capabilities and a local {@link TaskExecutor} to one {@link Transport}.
 *
 * <p>Outgoing intents (collaboration requests, task delegation, capability announcements) become
 * transport messages; inbound messages are answered from the agent's own capability profile.
 */
public final class PeerAgent {
    public static final String TOPIC_CAPABILITY_ANNOUNCEMENT = "capability_announcement";
    public static final String TOPIC_COLLABORATION_REQUEST = "collaboration_request";
    public static final String TOPIC_COLLABORATION_RESPONSE = "collaboration_response";
    public static final String TOPIC_TASK_DELEGATION = "task_delegation";
    public static final String TOPIC_TASK_COMPLETED = "task_completed";
    public static final String TOPIC_TASK_FAILED = "task_failed";
    public static final String TOPIC_TASK_DECLINED = "task_declined";
    public static final String TOPIC_DISCOVERY_RESPONSE = "discovery_response";
    private static final int MINUTES_PER_COMPLEXITY = 30;
    private static final Logger log = LoggerFactory.getLogger(PeerAgent.class);

    private final AgentRole role;
    private final AgentCapabilities capabilities;
    private final Transport transport;
    private final TaskExecutor executor;
    private final EventPublisher events;
    private final ConcurrentMap<String, PeerProfile> peerProfiles;
    private final ConcurrentMap<String, CollaborationRecord> collaborations;
    private final ConcurrentMap<String, DelegationRecord> delegations;

    public PeerAgent(
            AgentRole role,
            AgentCapabilities capabilities,
            Transport transport,
            TaskExecutor executor,
            EventPublisher events
    ) {
        this.role = Objects.requireNonNull(role, "role");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = executor == null ? new EchoTaskExecutor(transport.nodeId()) : executor;
        this.events = events == null ? EventPublisher.NOOP : events;
        this.peerProfiles = new ConcurrentHashMap<>();
        this.collaborations = new ConcurrentHashMap<>();
        this.delegations = new ConcurrentHashMap<>();
        transport.advertiseCapabilities(advertisedCapabilities(role, capabilities));
        registerHandlers();
    }

    public String id() {
        return transport.nodeId();
    }

    public AgentRole role() {
        return role;
    }

    public AgentCapabilities capabilities() {
        return capabilities;
    }

    public Transport transport() {
        return transport;
    }

    public boolean isRunning() {
        return transport.isRunning();
    }

    public void initialize() {
        transport.start();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", role.wireName());
        payload.put("address", transport.address());
        payload.put("port", transport.port());
        events.publish(NetworkEvent.of(NetworkEventType.AGENT_REGISTERED, id(), payload));
        log.info("Agent {} ({}) initialized at {}:{}", id(), role.wireName(), transport.address(), transport.port());
    }

    public void shutdown() {
        transport.stop();
        log.info("Agent {} shut down", id());
    }

    public void restart() {
        shutdown();
        initialize();
    }

    /**
     * Connects to a peer and introduces this agent with a capability announcement.
     */
    public boolean connectToPeer(String peerId, String address, int port) {
        if (!transport.connect(peerId, address, port)) {
            return false;
        }
        transport.sendMessage(peerId, TOPIC_CAPABILITY_ANNOUNCEMENT, ownProfilePayload());
        return true;
    }

    public void disconnectFromPeer(String peerId) {
        transport.disconnect(peerId);
    }

    public boolean sendToPeer(String peerId, String topic, Object payload) {
        return transport.sendMessage(peerId, topic, payload);
    }

    public int broadcastToPeers(String topic, Object payload) {
        return transport.broadcast(topic, payload);
    }

    public List<String> connectedPeers() {
        return transport.connectedPeers();
    }

    public TransportStats networkStats() {
        return transport.stats();
    }

    public Optional<PeerProfile> peerProfile(String peerId) {
        return Optional.ofNullable(peerProfiles.get(peerId));
    }

    public List<PeerProfile> peerProfiles() {
        return List.copyOf(peerProfiles.values());
    }

    public boolean requestCollaboration(String peerId, CollaborationType type, Map<String, Object> context) {
        Objects.requireNonNull(type, "type");
        String requestId = "collab_" + UUID.randomUUID();
        long nowMs = Instant.now().toEpochMilli();
        CollaborationRecord record = new CollaborationRecord(requestId, peerId, type, context,
                CollaborationStatus.PENDING, List.of(), nowMs);
        // Registered before sending: in-process peers may answer synchronously.
        collaborations.put(requestId, record);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", requestId);
        payload.put("type", type.wireName());
        payload.put("requester", id());
        payload.put("context", record.context());
        boolean sent = transport.sendMessage(peerId, TOPIC_COLLABORATION_REQUEST, payload);
        if (!sent) {
            collaborations.computeIfPresent(requestId, (k, r) -> r.withStatus(CollaborationStatus.FAILED));
            return false;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("requestId", requestId);
        event.put("peerId", peerId);
        event.put("type", type.wireName());
        events.publish(NetworkEvent.of(NetworkEventType.COLLABORATION_REQUEST, id(), event));
        return true;
    }

    public Optional<CollaborationRecord> collaboration(String requestId) {
        return Optional.ofNullable(collaborations.get(requestId));
    }

    public List<CollaborationRecord> collaborations() {
        return List.copyOf(collaborations.values());
    }

    public boolean delegateTask(String peerId, AgentTask task) {
        Objects.requireNonNull(task, "task");
        delegations.put(task.id(), DelegationRecord.sent(task.id(), peerId, Instant.now().toEpochMilli()));
        Map<String, Object> payload = task.toPayload();
        payload.put("delegatedBy", id());
        if (!transport.sendMessage(peerId, TOPIC_TASK_DELEGATION, payload)) {
            delegations.computeIfPresent(task.id(), (k, r) -> r.status() == DelegationStatus.SENT
                    ? r.resolve(DelegationStatus.FAILED, null, "delegation not delivered", Instant.now().toEpochMilli())
                    : r);
            return false;
        }
        log.info("Agent {} delegated task {} to {}", id(), task.id(), peerId);
        return true;
    }

    public Optional<DelegationRecord> delegation(String taskId) {
        return Optional.ofNullable(delegations.get(taskId));
    }

    /**
     * A task fits this agent when it is within the complexity ceiling and mentions one of the
     * agent's specialized skills in its title or description.
     */
    public boolean canHandleTask(AgentTask task) {
        if (task.complexity() > capabilities.maxComplexity()) {
            return false;
        }
        String text = (task.title() + " " + task.description()).toLowerCase(Locale.ROOT);
        for (String skill : capabilities.specializedSkills()) {
            if (skill != null && !skill.isBlank() && text.contains(skill.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs a task here, or forwards it to a connected peer whose announced ceiling covers it when
     * the task is beyond this agent. Without such a peer the task still runs locally.
     */
    public TaskResult processTask(AgentTask task) {
        if (task.complexity() > capabilities.maxComplexity()) {
            List<String> connected = transport.connectedPeers();
            for (PeerProfile profile : peerProfiles.values()) {
                if (profile.maxComplexity() >= task.complexity()
                        && connected.contains(profile.peerId())
                        && delegateTask(profile.peerId(), task)) {
                    return TaskResult.delegated(task.id(), profile.peerId());
                }
            }
            log.warn("Agent {} executing task {} locally above its complexity ceiling ({} > {}): no capable peer",
                    id(), task.id(), task.complexity(), capabilities.maxComplexity());
        }
        return TaskResult.local(task.id(), id(), executeLocally(task));
    }

    private AgentResult executeLocally(AgentTask task) {
        long startedNs = System.nanoTime();
        AgentResult result;
        try {
            result = executor.execute(task);
            if (result == null) {
                result = AgentResult.fail("executor returned no result");
            }
        } catch (Exception e) {
            log.warn("Agent {} failed task {}: {}", id(), task.id(), e.getMessage());
            result = AgentResult.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return result.withElapsed((System.nanoTime() - startedNs) / 1_000_000L);
    }

    private void registerHandlers() {
        transport.onMessage(TOPIC_CAPABILITY_ANNOUNCEMENT, this::handleAnnouncement);
        transport.onMessage(TOPIC_DISCOVERY_RESPONSE, this::cacheProfile);
        transport.onMessage(TOPIC_COLLABORATION_REQUEST, this::handleCollaborationRequest);
        transport.onMessage(TOPIC_COLLABORATION_RESPONSE, this::handleCollaborationResponse);
        transport.onMessage(TOPIC_TASK_DELEGATION, this::handleTaskDelegation);
        transport.onMessage(TOPIC_TASK_COMPLETED, m -> resolveDelegation(m, DelegationStatus.COMPLETED));
        transport.onMessage(TOPIC_TASK_FAILED, m -> resolveDelegation(m, DelegationStatus.FAILED));
        transport.onMessage(TOPIC_TASK_DECLINED, m -> resolveDelegation(m, DelegationStatus.DECLINED));
        transport.onMessage(AbstractTransport.HEARTBEAT_TOPIC, this::handleHeartbeat);
        transport.onMessage(AbstractTransport.DISCOVERY_TOPIC, this::handleDiscoveryRequest);
    }

    // A first announcement from a peer is answered once, so the dialed side is known too.
    private void handleAnnouncement(NetworkMessage message) {
        boolean firstContact = !peerProfiles.containsKey(message.from());
        cacheProfile(message);
        if (firstContact && !Jsons.toTree(message.payload()).path("reply").asBoolean(false)) {
            Map<String, Object> reply = ownProfilePayload();
            reply.put("reply", true);
            transport.sendMessage(message.from(), TOPIC_CAPABILITY_ANNOUNCEMENT, reply);
        }
    }

    private void cacheProfile(NetworkMessage message) {
        JsonNode payload = Jsons.toTree(message.payload());
        PeerProfile profile = PeerProfile.fromPayload(message.from(), payload, message.timestampMs());
        peerProfiles.merge(message.from(), profile,
                (current, incoming) -> incoming.lastSeenMs() >= current.lastSeenMs() ? incoming : current);
        log.debug("Agent {} cached profile of {} (maxComplexity={})", id(), message.from(), profile.maxComplexity());
    }

    private void handleHeartbeat(NetworkMessage message) {
        JsonNode payload = Jsons.toTree(message.payload());
        long seenMs = payload.path("timestamp").asLong(message.timestampMs());
        NodeStatus status;
        try {
            status = NodeStatus.fromString(payload.path("status").asText(null));
        } catch (IllegalArgumentException e) {
            status = NodeStatus.ONLINE;
        }
        NodeStatus nextStatus = status;
        peerProfiles.computeIfPresent(message.from(), (k, p) -> seenMs >= p.lastSeenMs()
                ? p.withHeartbeat(nextStatus, seenMs)
                : p);
    }

    private void handleDiscoveryRequest(NetworkMessage message) {
        transport.sendMessage(message.from(), TOPIC_DISCOVERY_RESPONSE, ownProfilePayload());
    }

    private void handleCollaborationRequest(NetworkMessage message) {
        JsonNode payload = Jsons.toTree(message.payload());
        String rawType = payload.path("type").asText(null);
        JsonNode context = payload.path("context");
        boolean canHelp;
        try {
            canHelp = evaluateCollaboration(CollaborationType.fromString(rawType), context);
        } catch (IllegalArgumentException e) {
            log.info("Agent {} declining collaboration from {}: {}", id(), message.from(), e.getMessage());
            canHelp = false;
        }
        int complexity = Math.max(1, context.path("complexity").asInt(1));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("requestId", payload.path("requestId").asText(null));
        response.put("canHelp", canHelp);
        response.put("status", canHelp ? "accepted" : "declined");
        response.put("skills", capabilities.specializedSkills());
        response.put("estimatedMinutes", MINUTES_PER_COMPLEXITY * complexity);
        transport.sendMessage(message.from(), TOPIC_COLLABORATION_RESPONSE, response);
        log.debug("Agent {} answered {} request from {}: {}", id(), rawType, message.from(), canHelp);
    }

    private boolean evaluateCollaboration(CollaborationType type, JsonNode context) {
        return switch (type) {
            case HELP -> {
                List<String> required = AgentTask.textList(context.path("requiredSkills"));
                boolean match = false;
                for (String skill : capabilities.specializedSkills()) {
                    if (required.contains(skill)) {
                        match = true;
                        break;
                    }
                }
                yield match;
            }
            case REVIEW -> capabilities.canReview();
            case DELEGATION -> capabilities.canExecuteCode();
            case CONSULTATION -> capabilities.canAnalyzeRequirements();
        };
    }

    private void handleCollaborationResponse(NetworkMessage message) {
        JsonNode payload = Jsons.toTree(message.payload());
        String requestId = payload.path("requestId").asText(null);
        if (requestId == null) {
            return;
        }
        CollaborationResponse response = new CollaborationResponse(
                requestId,
                message.from(),
                payload.path("canHelp").asBoolean(false),
                "accepted".equalsIgnoreCase(payload.path("status").asText("")),
                AgentTask.textList(payload.path("skills")),
                payload.path("estimatedMinutes").asInt(0),
                Instant.now().toEpochMilli()
        );
        CollaborationRecord updated = collaborations.computeIfPresent(requestId, (k, r) -> r.withResponse(response));
        if (updated == null) {
            log.debug("Agent {} ignored response for unknown collaboration {}", id(), requestId);
        }
    }

    private void handleTaskDelegation(NetworkMessage message) {
        AgentTask task = AgentTask.fromPayload(Jsons.toTree(message.payload()));
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("taskId", task.id());
        reply.put("agentId", id());
        if (!canHandleTask(task)) {
            reply.put("reason", task.complexity() > capabilities.maxComplexity()
                    ? "complexity exceeds capability"
                    : "no matching skills");
            transport.sendMessage(message.from(), TOPIC_TASK_DECLINED, reply);
            log.info("Agent {} declined task {} from {}", id(), task.id(), message.from());
            return;
        }
        AgentResult result = executeLocally(task);
        reply.put("elapsedMs", result.elapsedMs());
        if (result.success()) {
            reply.put("output", result.output());
            transport.sendMessage(message.from(), TOPIC_TASK_COMPLETED, reply);
        } else {
            reply.put("error", result.error());
            transport.sendMessage(message.from(), TOPIC_TASK_FAILED, reply);
        }
    }

    private void resolveDelegation(NetworkMessage message, DelegationStatus status) {
        JsonNode payload = Jsons.toTree(message.payload());
        String taskId = payload.path("taskId").asText(null);
        if (taskId == null) {
            return;
        }
        String output = payload.path("output").isMissingNode() ? null : payload.path("output").asText(null);
        String error = payload.has("error") ? payload.path("error").asText(null) : payload.path("reason").asText(null);
        DelegationRecord updated = delegations.computeIfPresent(taskId,
                (k, r) -> r.resolve(status, output, error, Instant.now().toEpochMilli()));
        if (updated == null) {
            log.debug("Agent {} got {} for unknown task {}", id(), message.topic(), taskId);
        } else {
            log.info("Agent {} task {} {} by {}", id(), taskId, status.name().toLowerCase(Locale.ROOT), message.from());
        }
    }

    private Map<String, Object> ownProfilePayload() {
        return PeerProfile.payloadOf(id(), role, capabilities, Instant.now().toEpochMilli());
    }

    private static List<String> advertisedCapabilities(AgentRole role, AgentCapabilities capabilities) {
        List<String> advertised = new ArrayList<>();
        advertised.add("agent");
        advertised.add("task_processing");
        advertised.add("role:" + role.wireName());
        advertised.addAll(capabilities.specializedSkills());
        return advertised;
    }
}

package io.swarmmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.model.NodeStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capability profile a peer announced about itself, cached by the receiving agent.
 */
public record PeerProfile(
        String peerId,
        String role,
        List<String> skills,
        List<String> domains,
        List<String> languages,
        List<String> frameworks,
        int maxComplexity,
        int parallelTasks,
        String collaborationStyle,
        NodeStatus status,
        long lastSeenMs
) {
    public PeerProfile {
        skills = skills == null ? List.of() : List.copyOf(skills);
        domains = domains == null ? List.of() : List.copyOf(domains);
        languages = languages == null ? List.of() : List.copyOf(languages);
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        status = status == null ? NodeStatus.ONLINE : status;
    }

    static Map<String, Object> payloadOf(String nodeId, AgentRole role, AgentCapabilities capabilities, long nowMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodeId", nodeId);
        payload.put("role", role.wireName());
        payload.put("skills", capabilities.specializedSkills());
        payload.put("domains", capabilities.domains());
        payload.put("languages", capabilities.languages());
        payload.put("frameworks", capabilities.frameworks());
        payload.put("maxComplexity", capabilities.maxComplexity());
        payload.put("parallelTasks", capabilities.parallelTasks());
        payload.put("collaborationStyle", capabilities.collaborationStyle());
        payload.put("timestamp", nowMs);
        return payload;
    }

    static PeerProfile fromPayload(String peerId, JsonNode payload, long fallbackSeenMs) {
        return new PeerProfile(
                peerId,
                payload.path("role").asText(null),
                AgentTask.textList(payload.path("skills")),
                AgentTask.textList(payload.path("domains")),
                AgentTask.textList(payload.path("languages")),
                AgentTask.textList(payload.path("frameworks")),
                payload.path("maxComplexity").asInt(0),
                payload.path("parallelTasks").asInt(1),
                payload.path("collaborationStyle").asText(null),
                NodeStatus.ONLINE,
                payload.path("timestamp").asLong(fallbackSeenMs)
        );
    }

    public PeerProfile withHeartbeat(NodeStatus nextStatus, long seenMs) {
        return new PeerProfile(peerId, role, skills, domains, languages, frameworks, maxComplexity,
                parallelTasks, collaborationStyle, nextStatus, seenMs);
    }
}

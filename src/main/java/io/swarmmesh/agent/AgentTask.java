package io.swarmmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record AgentTask(
        String id,
        String title,
        String description,
        TaskPriority priority,
        int complexity,
        List<String> requirements,
        List<String> constraints,
        Long deadlineMs
) {
    public AgentTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id cannot be empty");
        }
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        if (complexity < 1) {
            throw new IllegalArgumentException("task complexity must be >= 1");
        }
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public static AgentTask of(String title, String description, int complexity) {
        return new AgentTask("task_" + UUID.randomUUID(), title, description, TaskPriority.MEDIUM,
                complexity, List.of(), List.of(), null);
    }

    Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("title", title);
        payload.put("description", description);
        payload.put("priority", priority.wireName());
        payload.put("complexity", complexity);
        payload.put("requirements", requirements);
        payload.put("constraints", constraints);
        payload.put("deadline", deadlineMs);
        return payload;
    }

    static AgentTask fromPayload(JsonNode payload) {
        JsonNode deadline = payload.path("deadline");
        return new AgentTask(
                payload.path("id").asText(null),
                payload.path("title").asText(""),
                payload.path("description").asText(""),
                TaskPriority.fromString(payload.path("priority").asText(null)),
                Math.max(1, payload.path("complexity").asInt(1)),
                textList(payload.path("requirements")),
                textList(payload.path("constraints")),
                deadline.isNumber() ? deadline.asLong() : null
        );
    }

    static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        }
        return values;
    }
}

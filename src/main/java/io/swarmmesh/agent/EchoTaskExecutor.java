package io.swarmmesh.agent;

import io.swarmmesh.util.Jsons;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class EchoTaskExecutor implements TaskExecutor {
    private final String agentId;

    public EchoTaskExecutor(String agentId) {
        this.agentId = agentId;
    }

    @Override
    public AgentResult execute(AgentTask task) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("agent", agentId);
        output.put("timestamp", Instant.now().toString());
        output.put("taskId", task.id());
        output.put("title", task.title());
        output.put("complexity", task.complexity());
        return AgentResult.ok(Jsons.toCompactJson(output));
    }
}

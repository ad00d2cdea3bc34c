package io.swarmmesh.agent;

/**
 * What a {@link TaskExecutor} produced for one task. {@code elapsedMs} is stamped by the agent
 * that ran the executor; executors leave it at zero.
 */
public record AgentResult(
        boolean success,
        String output,
        String error,
        long elapsedMs
) {
    public static AgentResult ok(String output) {
        return new AgentResult(true, output, null, 0L);
    }

    public static AgentResult fail(String error) {
        return new AgentResult(false, null, error, 0L);
    }

    public AgentResult withElapsed(long elapsed) {
        return new AgentResult(success, output, error, Math.max(0L, elapsed));
    }
}

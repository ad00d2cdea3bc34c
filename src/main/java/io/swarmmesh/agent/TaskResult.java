package io.swarmmesh.agent;

/**
 * Outcome of {@link PeerAgent#processTask}: either forwarded to a peer or executed here.
 */
public record TaskResult(
        String taskId,
        String handledBy,
        boolean delegated,
        boolean success,
        String output,
        String error,
        long elapsedMs
) {
    public static TaskResult delegated(String taskId, String peerId) {
        return new TaskResult(taskId, peerId, true, true, null, null, 0L);
    }

    public static TaskResult local(String taskId, String nodeId, AgentResult result) {
        return new TaskResult(taskId, nodeId, false, result.success(), result.output(), result.error(),
                result.elapsedMs());
    }
}

package io.swarmmesh.agent;

/**
 * Local work performed by an agent once it has accepted a task.
 */
@FunctionalInterface
public interface TaskExecutor {
    AgentResult execute(AgentTask task) throws Exception;
}

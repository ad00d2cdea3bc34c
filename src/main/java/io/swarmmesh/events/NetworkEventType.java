package io.swarmmesh.events;

public enum NetworkEventType {
    AGENT_REGISTERED("agent_registered"),
    NODE_REMOVED("node_removed"),
    CLUSTER_CHANGED("cluster_changed"),
    HEALTH_DEGRADED("health_degraded"),
    SYSTEM_STARTUP("system_startup"),
    SYSTEM_SHUTDOWN("system_shutdown"),
    PERFORMANCE_METRIC("performance_metric"),
    COLLABORATION_REQUEST("collaboration_request"),
    CONNECTION_FAILED("connection_failed");

    private final String wireName;

    NetworkEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

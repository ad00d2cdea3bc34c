package io.swarmmesh.model;

public enum NodeStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    BUSY("busy");

    private final String wireName;

    NodeStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static NodeStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ONLINE;
        }
        for (NodeStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown node status: " + raw);
    }
}

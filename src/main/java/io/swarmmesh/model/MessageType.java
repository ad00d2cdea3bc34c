package io.swarmmesh.model;

public enum MessageType {
    DIRECT("direct"),
    BROADCAST("broadcast"),
    DISCOVERY("discovery"),
    HEARTBEAT("heartbeat");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DIRECT;
        }
        for (MessageType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}

package io.swarmmesh.agent;

public enum CollaborationType {
    HELP("help"),
    REVIEW("review"),
    DELEGATION("delegation"),
    CONSULTATION("consultation");

    private final String wireName;

    CollaborationType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CollaborationType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Collaboration type is required");
        }
        for (CollaborationType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown collaboration type: " + raw);
    }
}

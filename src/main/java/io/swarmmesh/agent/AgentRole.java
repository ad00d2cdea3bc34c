package io.swarmmesh.agent;

public enum AgentRole {
    COORDINATOR("coordinator"),
    ARCHITECT("architect"),
    ANALYST("analyst"),
    ENGINEER("engineer"),
    DEVELOPER("developer"),
    REVIEWER("reviewer"),
    OPTIMIZER("optimizer"),
    DEVOPS("devops"),
    SECURITY("security"),
    TESTING("testing"),
    UI_UX("ui_ux"),
    DATABASE("database"),
    API_SPECIALIST("api_specialist"),
    PERFORMANCE("performance"),
    DOCUMENTATION("documentation"),
    DEPLOYMENT("deployment"),
    MONITORING("monitoring"),
    AI_ML("ai_ml"),
    BLOCKCHAIN("blockchain"),
    MOBILE("mobile"),
    GAME_DEV("game_dev");

    private final String wireName;

    AgentRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AgentRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEVELOPER;
        }
        String normalized = raw.trim().replace('-', '_');
        for (AgentRole value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.wireName.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + raw);
    }
}

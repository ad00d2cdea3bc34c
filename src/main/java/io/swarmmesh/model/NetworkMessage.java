package io.swarmmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.util.Jsons;

import java.util.UUID;

public record NetworkMessage(
        String id,
        String from,
        String to,
        MessageType type,
        String topic,
        JsonNode payload,
        long timestampMs,
        long ttlSeconds
) {
    public static final String BROADCAST_TARGET = "broadcast";

    public static NetworkMessage create(
            String from,
            String to,
            MessageType type,
            String topic,
            Object payload,
            long nowMs,
            long ttlSeconds
    ) {
        return new NetworkMessage(
                "msg_" + UUID.randomUUID(),
                from,
                to,
                type,
                topic,
                Jsons.toTree(payload),
                nowMs,
                ttlSeconds
        );
    }

    @JsonIgnore
    public boolean isBroadcast() {
        return BROADCAST_TARGET.equals(to);
    }

    // Advisory only; delivery does not consult it.
    public boolean isExpired(long nowMs) {
        return ttlSeconds > 0 && nowMs - timestampMs > ttlSeconds * 1000L;
    }
}

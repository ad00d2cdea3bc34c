package io.swarmmesh.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NetworkEvent(
        NetworkEventType type,
        String source,
        Map<String, Object> payload,
        long timestampMs
) {
    public NetworkEvent {
        if (type == null) {
            throw new IllegalArgumentException("event type is required");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static NetworkEvent of(NetworkEventType type, String source, Map<String, Object> payload) {
        return new NetworkEvent(type, source, payload, Instant.now().toEpochMilli());
    }
}

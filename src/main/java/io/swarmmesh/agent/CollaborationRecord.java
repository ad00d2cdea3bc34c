package io.swarmmesh.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outgoing collaboration request and the replies collected for it. Copy-on-write.
 */
public record CollaborationRecord(
        String id,
        String peerId,
        CollaborationType type,
        Map<String, Object> context,
        CollaborationStatus status,
        List<CollaborationResponse> responses,
        long createdAtMs
) {
    public CollaborationRecord {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        responses = responses == null ? List.of() : List.copyOf(responses);
    }

    public CollaborationRecord withResponse(CollaborationResponse response) {
        List<CollaborationResponse> next = new ArrayList<>(responses);
        next.add(response);
        CollaborationStatus nextStatus = response.accepted() ? CollaborationStatus.ACCEPTED : status;
        return new CollaborationRecord(id, peerId, type, context, nextStatus, next, createdAtMs);
    }

    public CollaborationRecord withStatus(CollaborationStatus nextStatus) {
        return new CollaborationRecord(id, peerId, type, context, nextStatus, responses, createdAtMs);
    }
}

package io.swarmmesh.agent;

import java.util.List;

public record CollaborationResponse(
        String requestId,
        String peerId,
        boolean canHelp,
        boolean accepted,
        List<String> skills,
        int estimatedMinutes,
        long receivedAtMs
) {
    public CollaborationResponse {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}

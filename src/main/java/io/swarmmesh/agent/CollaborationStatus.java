package io.swarmmesh.agent;

public enum CollaborationStatus {
    PENDING,
    ACCEPTED,
    FAILED
}

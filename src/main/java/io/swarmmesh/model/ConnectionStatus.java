package io.swarmmesh.model;

public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED
}

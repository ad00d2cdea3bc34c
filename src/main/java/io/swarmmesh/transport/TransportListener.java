package io.swarmmesh.transport;

import io.swarmmesh.model.NetworkMessage;

/**
 * Callbacks for transport lifecycle and connectivity changes. Every method defaults to a no-op.
 */
public interface TransportListener {
    default void networkStarted(String nodeId) {
    }

    default void networkStopped(String nodeId) {
    }

    default void peerConnected(String nodeId, String peerId) {
    }

    default void peerDisconnected(String nodeId, String peerId) {
    }

    default void connectionFailed(String nodeId, String peerId, Throwable cause) {
    }

    default void messageReceived(String nodeId, NetworkMessage message) {
    }
}

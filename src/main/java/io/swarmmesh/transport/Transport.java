package io.swarmmesh.transport;

import io.swarmmesh.model.PeerNode;

import java.util.Collection;
import java.util.List;

/**
 * Per-node messaging endpoint.
 *
 * <p>Delivery is at-most-once, unordered and unacknowledged. Peer failures never surface as
 * exceptions: {@link #connect}, {@link #sendMessage} and {@link #broadcast} report them through
 * their return values and {@link TransportListener#connectionFailed}.
 */
public interface Transport extends AutoCloseable {
    String nodeId();

    String address();

    int port();

    void start();

    void stop();

    boolean isRunning();

    boolean connect(String peerId, String address, int port);

    void disconnect(String peerId);

    boolean sendMessage(String to, String topic, Object payload);

    int broadcast(String topic, Object payload);

    /**
     * Registers the handler for a topic, replacing any earlier one.
     */
    void onMessage(String topic, MessageHandler handler);

    /**
     * Capabilities carried by this node's periodic discovery announcements.
     */
    void advertiseCapabilities(List<String> capabilities);

    List<String> connectedPeers();

    Collection<PeerNode> knownNodes();

    TransportStats stats();

    void addListener(TransportListener listener);

    void removeListener(TransportListener listener);

    @Override
    default void close() {
        stop();
    }
}

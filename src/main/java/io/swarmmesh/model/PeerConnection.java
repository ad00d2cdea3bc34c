package io.swarmmesh.model;

/**
 * Transport-side connection entry. Status and activity change over the life of the link.
 */
public final class PeerConnection {
    private final String peerId;
    private final String address;
    private final int port;
    private volatile ConnectionStatus status;
    private volatile long lastActivityMs;

    public PeerConnection(String peerId, String address, int port, ConnectionStatus status, long lastActivityMs) {
        this.peerId = peerId;
        this.address = address;
        this.port = port;
        this.status = status;
        this.lastActivityMs = lastActivityMs;
    }

    public String peerId() {
        return peerId;
    }

    public String address() {
        return address;
    }

    public int port() {
        return port;
    }

    public ConnectionStatus status() {
        return status;
    }

    public void status(ConnectionStatus status) {
        this.status = status;
    }

    public long lastActivityMs() {
        return lastActivityMs;
    }

    public void touch(long nowMs) {
        this.lastActivityMs = nowMs;
    }

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }
}

package io.swarmmesh.transport;

import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.model.NetworkMessage;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class InMemoryTransport extends AbstractTransport {
    private final InMemoryNetwork network;
    private final int port;

    InMemoryTransport(String nodeId, NetworkSettings settings, InMemoryNetwork network, int port) {
        super(nodeId, settings);
        this.network = network;
        this.port = port;
    }

    @Override
    public String address() {
        return InMemoryNetwork.ADDRESS;
    }

    @Override
    public int port() {
        return port;
    }

    @Override
    protected void openEndpoint() {
        network.bind(this);
    }

    @Override
    protected void closeEndpoint() {
        network.unbind(this);
    }

    @Override
    protected Channel dial(String peerId, String address, int port, long timeoutMs) throws IOException {
        InMemoryTransport target = network.lookup(address, port);
        MemoryChannel outbound = new MemoryChannel(this, target);
        MemoryChannel inbound = new MemoryChannel(target, this);
        outbound.twin = inbound;
        inbound.twin = outbound;
        if (!target.registerInbound(nodeId(), address(), port(), inbound)) {
            throw new IOException("Peer " + target.nodeId() + " refused link from " + nodeId());
        }
        return outbound;
    }

    private void receive(String fromPeerId, NetworkMessage message) {
        deliver(fromPeerId, message);
    }

    /**
     * One direction of an in-memory link. Closing either side drops the link on both.
     */
    private final class MemoryChannel implements Channel {
        private final InMemoryTransport owner;
        private final InMemoryTransport remote;
        private final AtomicBoolean closed;
        private volatile MemoryChannel twin;

        MemoryChannel(InMemoryTransport owner, InMemoryTransport remote) {
            this.owner = owner;
            this.remote = remote;
            this.closed = new AtomicBoolean(false);
        }

        @Override
        public void send(NetworkMessage message) throws IOException {
            if (closed.get() || !remote.isRunning()) {
                throw new IOException("Link closed: " + owner.nodeId() + " -> " + remote.nodeId());
            }
            network.dispatch(() -> remote.receive(owner.nodeId(), message));
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                MemoryChannel other = twin;
                if (other != null) {
                    other.remoteClosed();
                }
            }
        }

        private void remoteClosed() {
            if (closed.compareAndSet(false, true)) {
                owner.linkLost(remote.nodeId(), this);
            }
        }
    }
}

package io.swarmmesh.transport;

import io.swarmmesh.config.NetworkSettings;

import java.net.ConnectException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local fabric that {@link InMemoryTransport}s bind to and dial through.
 *
 * <p>The default fabric delivers on the sender's thread, which keeps tests deterministic. Pass an
 * executor to decouple senders from receivers.
 */
public final class InMemoryNetwork {
    public static final String ADDRESS = "memory";
    private static final int FIRST_PORT = 20_000;

    private final ConcurrentMap<Integer, InMemoryTransport> endpoints;
    private final Set<Integer> unreachablePorts;
    private final Executor deliveryExecutor;
    private final AtomicInteger nextPort;

    public InMemoryNetwork() {
        this(Runnable::run);
    }

    public InMemoryNetwork(Executor deliveryExecutor) {
        this.endpoints = new ConcurrentHashMap<>();
        this.unreachablePorts = ConcurrentHashMap.newKeySet();
        this.deliveryExecutor = deliveryExecutor;
        this.nextPort = new AtomicInteger(FIRST_PORT);
    }

    public InMemoryTransport createTransport(String nodeId, NetworkSettings settings) {
        return new InMemoryTransport(nodeId, settings, this, nextPort.getAndIncrement());
    }

    /**
     * Makes dials to the given port fail, as if the endpoint were firewalled. Existing links stay up.
     */
    public void setReachable(int port, boolean reachable) {
        if (reachable) {
            unreachablePorts.remove(port);
        } else {
            unreachablePorts.add(port);
        }
    }

    public int boundEndpoints() {
        return endpoints.size();
    }

    void bind(InMemoryTransport transport) {
        InMemoryTransport current = endpoints.putIfAbsent(transport.port(), transport);
        if (current != null && current != transport) {
            throw new IllegalStateException("Port already bound in memory network: " + transport.port());
        }
    }

    void unbind(InMemoryTransport transport) {
        endpoints.remove(transport.port(), transport);
    }

    InMemoryTransport lookup(String address, int port) throws ConnectException {
        if (!ADDRESS.equals(address)) {
            throw new ConnectException("Unknown in-memory address: " + address);
        }
        if (unreachablePorts.contains(port)) {
            throw new ConnectException("Endpoint unreachable: " + address + ":" + port);
        }
        InMemoryTransport target = endpoints.get(port);
        if (target == null || !target.isRunning()) {
            throw new ConnectException("Connection refused: " + address + ":" + port);
        }
        return target;
    }

    void dispatch(Runnable delivery) {
        deliveryExecutor.execute(delivery);
    }
}

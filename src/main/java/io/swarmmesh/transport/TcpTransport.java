package io.swarmmesh.transport;

import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.model.NetworkMessage;
import io.swarmmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Socket transport. Each frame is one JSON object per line; the dialing side opens with a
 * {@code hello} frame so the acceptor can key the link by node id and reply over it.
 */
public final class TcpTransport extends AbstractTransport {
    private static final Logger log = LoggerFactory.getLogger(TcpTransport.class);
    private static final String KIND_HELLO = "hello";
    private static final String KIND_MESSAGE = "message";
    private static final int HELLO_READ_TIMEOUT_MS = 5_000;

    private final String bindHost;
    private final int requestedPort;
    private final AtomicInteger threadCounter;
    private volatile int boundPort;
    private ServerSocket serverSocket;
    private ExecutorService ioPool;

    public TcpTransport(String nodeId, String bindHost, int port, NetworkSettings settings) {
        super(nodeId, settings);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid transport port: " + port);
        }
        this.bindHost = bindHost == null || bindHost.isBlank() ? "127.0.0.1" : bindHost.trim();
        this.requestedPort = port;
        this.threadCounter = new AtomicInteger(0);
        this.boundPort = port;
    }

    @Override
    public String address() {
        return bindHost;
    }

    @Override
    public int port() {
        return boundPort;
    }

    @Override
    protected void openEndpoint() throws IOException {
        ServerSocket server = new ServerSocket();
        server.setReuseAddress(true);
        server.bind(new InetSocketAddress(bindHost, requestedPort));
        serverSocket = server;
        boundPort = server.getLocalPort();
        ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "swarmmesh-tcp-" + nodeId() + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ioPool.execute(() -> acceptLoop(server));
    }

    @Override
    protected void closeEndpoint() {
        ServerSocket server = serverSocket;
        serverSocket = null;
        if (server != null) {
            try {
                server.close();
            } catch (IOException e) {
                log.debug("Node {} failed to close server socket: {}", nodeId(), e.getMessage());
            }
        }
        ExecutorService pool = ioPool;
        ioPool = null;
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Override
    protected Channel dial(String peerId, String address, int port, long timeoutMs) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(address, port), (int) Math.min(Integer.MAX_VALUE, timeoutMs));
            socket.setTcpNoDelay(true);
            SocketChannel channel = new SocketChannel(socket);
            channel.writeFrame(WireFrame.hello(nodeId(), address(), port()));
            if (ioPool == null) {
                throw new IOException("transport is shutting down");
            }
            channel.onActivate(() -> startReader(peerId, channel));
            return channel;
        } catch (IOException e) {
            closeQuietly(socket);
            throw e;
        }
    }

    private void startReader(String peerId, SocketChannel channel) {
        ExecutorService pool = ioPool;
        if (pool != null) {
            try {
                pool.execute(() -> readLoop(peerId, channel));
                return;
            } catch (RejectedExecutionException e) {
                log.debug("Node {} reader pool rejected link to {}: {}", nodeId(), peerId, e.getMessage());
            }
        }
        linkLost(peerId, channel);
        channel.close();
    }

    private void acceptLoop(ServerSocket server) {
        while (!server.isClosed()) {
            Socket socket;
            try {
                socket = server.accept();
            } catch (SocketException closed) {
                break;
            } catch (IOException e) {
                log.warn("Node {} accept failed: {}", nodeId(), e.getMessage());
                continue;
            }
            ExecutorService pool = ioPool;
            if (pool == null) {
                closeQuietly(socket);
                break;
            }
            pool.execute(() -> handleInbound(socket));
        }
    }

    private void handleInbound(Socket socket) {
        SocketChannel channel;
        WireFrame hello;
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(HELLO_READ_TIMEOUT_MS);
            channel = new SocketChannel(socket);
            String line = channel.reader.readLine();
            hello = line == null ? null : Jsons.compact().readValue(line, WireFrame.class);
            socket.setSoTimeout(0);
        } catch (IOException e) {
            log.debug("Node {} dropped inbound socket before hello: {}", nodeId(), e.getMessage());
            closeQuietly(socket);
            return;
        }
        if (hello == null || !KIND_HELLO.equals(hello.kind()) || hello.nodeId() == null) {
            log.warn("Node {} rejected inbound socket without hello frame", nodeId());
            channel.close();
            return;
        }
        int peerPort = hello.port() == null ? 0 : hello.port();
        if (!registerInbound(hello.nodeId(), hello.address(), peerPort, channel)) {
            channel.close();
            return;
        }
        readLoop(hello.nodeId(), channel);
    }

    private void readLoop(String peerId, SocketChannel channel) {
        try {
            String line;
            while ((line = channel.reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WireFrame frame;
                try {
                    frame = Jsons.compact().readValue(line, WireFrame.class);
                } catch (IOException parseError) {
                    log.warn("Node {} dropped malformed frame from {}: {}", nodeId(), peerId, parseError.getMessage());
                    continue;
                }
                if (KIND_MESSAGE.equals(frame.kind()) && frame.message() != null) {
                    deliver(peerId, frame.message());
                }
            }
        } catch (IOException e) {
            log.debug("Node {} link to {} ended: {}", nodeId(), peerId, e.getMessage());
        } finally {
            linkLost(peerId, channel);
            channel.close();
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Socket close failed: {}", e.getMessage());
        }
    }

    private static final class SocketChannel implements Channel {
        private final Socket socket;
        private final BufferedReader reader;
        private final BufferedWriter writer;
        private volatile Runnable activation;

        SocketChannel(Socket socket) throws IOException {
            this.socket = socket;
            this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public void send(NetworkMessage message) throws IOException {
            writeFrame(WireFrame.message(message));
        }

        synchronized void writeFrame(WireFrame frame) throws IOException {
            if (socket.isClosed()) {
                throw new IOException("socket closed");
            }
            writer.write(Jsons.toCompactJson(frame));
            writer.write('\n');
            writer.flush();
        }

        void onActivate(Runnable action) {
            this.activation = action;
        }

        @Override
        public void activate() {
            Runnable action = activation;
            activation = null;
            if (action != null) {
                action.run();
            }
        }

        @Override
        public void close() {
            closeQuietly(socket);
        }
    }

    record WireFrame(String kind, String nodeId, String address, Integer port, NetworkMessage message) {
        static WireFrame hello(String nodeId, String address, int port) {
            return new WireFrame(KIND_HELLO, nodeId, address, port, null);
        }

        static WireFrame message(NetworkMessage message) {
            return new WireFrame(KIND_MESSAGE, null, null, null, message);
        }
    }
}

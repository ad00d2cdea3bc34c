package io.swarmmesh.transport;

import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.model.NetworkMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class TcpTransportTest {
    private final List<Transport> started = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (Transport transport : started) {
            transport.stop();
        }
    }

    @Test
    void messagesFlowBothWaysOverOneSocket() {
        TcpTransport a = start("a", NetworkSettings.defaults());
        TcpTransport b = start("b", NetworkSettings.defaults());
        List<NetworkMessage> atB = new CopyOnWriteArrayList<>();
        List<NetworkMessage> atA = new CopyOnWriteArrayList<>();
        b.onMessage("ping", m -> {
            atB.add(m);
            b.sendMessage(m.from(), "pong", Map.of("seq", m.payload().path("seq").asInt()));
        });
        a.onMessage("pong", atA::add);

        assertTrue(b.port() > 0);
        assertTrue(a.connect("b", b.address(), b.port()));
        await().atMost(Duration.ofSeconds(5)).until(() -> b.connectedPeers().contains("a"));

        assertTrue(a.sendMessage("b", "ping", Map.of("seq", 7)));

        await().atMost(Duration.ofSeconds(5)).until(() -> atA.size() == 1);
        assertEquals(1, atB.size());
        assertEquals("a", atB.get(0).from());
        assertEquals(7, atA.get(0).payload().path("seq").asInt());
        assertEquals("b", atA.get(0).from());
    }

    @Test
    void closedPortFailsWithinTheConnectTimeout() throws Exception {
        int freePort;
        try (ServerSocket probe = new ServerSocket(0)) {
            freePort = probe.getLocalPort();
        }
        TcpTransport a = start("a", NetworkSettings.defaults());
        List<String> failures = new CopyOnWriteArrayList<>();
        a.addListener(new TransportListener() {
            @Override
            public void connectionFailed(String nodeId, String peerId, Throwable cause) {
                failures.add(peerId);
            }
        });

        assertFalse(a.connect("ghost", "127.0.0.1", freePort));
        assertEquals(List.of("ghost"), failures);
        assertTrue(a.connectedPeers().isEmpty());
    }

    @Test
    void peerStopIsSeenAsDisconnect() {
        TcpTransport a = start("a", NetworkSettings.defaults());
        TcpTransport b = start("b", NetworkSettings.defaults());
        List<String> lost = new CopyOnWriteArrayList<>();
        a.addListener(new TransportListener() {
            @Override
            public void peerDisconnected(String nodeId, String peerId) {
                lost.add(peerId);
            }
        });
        assertTrue(a.connect("b", b.address(), b.port()));

        b.stop();

        await().atMost(Duration.ofSeconds(5)).until(() -> lost.contains("b"));
        assertTrue(a.connectedPeers().isEmpty());
        assertFalse(a.sendMessage("b", "late", Map.of()));
    }

    @Test
    void linkRefusedByAcceptorDoesNotStayConnected() {
        TcpTransport a = start("a", NetworkSettings.defaults());
        TcpTransport b = start("b", NetworkSettings.defaults());
        TcpTransport duplicate = start("a", NetworkSettings.defaults());
        List<String> lost = new CopyOnWriteArrayList<>();
        duplicate.addListener(new TransportListener() {
            @Override
            public void peerDisconnected(String nodeId, String peerId) {
                lost.add(peerId);
            }
        });
        assertTrue(a.connect("b", b.address(), b.port()));
        await().atMost(Duration.ofSeconds(5)).until(() -> b.connectedPeers().contains("a"));

        boolean dialed = duplicate.connect("b", b.address(), b.port());

        await().atMost(Duration.ofSeconds(5)).until(() -> duplicate.connectedPeers().isEmpty());
        if (dialed) {
            await().atMost(Duration.ofSeconds(5)).until(() -> lost.contains("b"));
        }
        assertFalse(duplicate.sendMessage("b", "late", Map.of()));
        assertEquals(List.of("a"), b.connectedPeers());
    }

    @Test
    void periodicHeartbeatsReachConnectedPeers() {
        NetworkSettings fast = NetworkSettings.defaults().withIntervals(50, 60_000, 60_000, 60_000);
        TcpTransport a = start("a", fast);
        TcpTransport b = start("b", fast);
        List<NetworkMessage> heartbeats = new CopyOnWriteArrayList<>();
        b.onMessage(AbstractTransport.HEARTBEAT_TOPIC, heartbeats::add);

        assertTrue(a.connect("b", b.address(), b.port()));

        await().atMost(Duration.ofSeconds(5)).until(() -> heartbeats.stream().anyMatch(m -> "a".equals(m.from())));
        NetworkMessage beat = heartbeats.stream().filter(m -> "a".equals(m.from())).findFirst().orElseThrow();
        assertEquals("online", beat.payload().path("status").asText());
        assertEquals("a", beat.payload().path("nodeId").asText());
    }

    @Test
    void broadcastCountsOnlyLivePeers() {
        TcpTransport hub = start("hub", NetworkSettings.defaults());
        TcpTransport p1 = start("p1", NetworkSettings.defaults());
        TcpTransport p2 = start("p2", NetworkSettings.defaults());
        List<String> received = new CopyOnWriteArrayList<>();
        p1.onMessage("news", m -> received.add("p1"));
        p2.onMessage("news", m -> received.add("p2"));
        assertTrue(hub.connect("p1", p1.address(), p1.port()));
        assertTrue(hub.connect("p2", p2.address(), p2.port()));
        hub.disconnect("p2");

        assertEquals(1, hub.broadcast("news", Map.of()));
        await().atMost(Duration.ofSeconds(5)).until(() -> received.contains("p1"));
        assertEquals(List.of("p1"), received);
    }

    private TcpTransport start(String nodeId, NetworkSettings settings) {
        TcpTransport transport = new TcpTransport(nodeId, "127.0.0.1", 0, settings);
        transport.start();
        started.add(transport);
        return transport;
    }
}

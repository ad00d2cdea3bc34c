package io.swarmmesh.cli;

import io.swarmmesh.agent.AgentCapabilities;
import io.swarmmesh.agent.AgentRole;
import io.swarmmesh.agent.EchoTaskExecutor;
import io.swarmmesh.agent.PeerAgent;
import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.events.EventPublisher;
import io.swarmmesh.transport.InMemoryNetwork;
import io.swarmmesh.transport.TcpTransport;
import io.swarmmesh.transport.Transport;
import io.swarmmesh.topology.TopologyManager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A swarm assembled in this process from command-line descriptors, torn down on close.
 *
 * <p>Agents are given as {@code id[:role[:skill+skill]]}, links as {@code a-b}.
 */
final class LocalSwarm implements AutoCloseable {
    private final TopologyManager manager;
    private final List<String> failedLinks;

    private LocalSwarm(TopologyManager manager, List<String> failedLinks) {
        this.manager = manager;
        this.failedLinks = failedLinks;
    }

    static LocalSwarm build(
            NetworkSettings settings,
            EventPublisher events,
            String transportKind,
            List<String> agentSpecs,
            List<String> linkSpecs
    ) {
        TopologyManager manager = new TopologyManager(settings, events);
        InMemoryNetwork network = new InMemoryNetwork();
        boolean tcp = "tcp".equals(transportKind == null ? "memory" : transportKind.trim().toLowerCase(Locale.ROOT));
        Map<String, PeerAgent> created = new LinkedHashMap<>();
        for (String spec : agentSpecs) {
            String[] parts = spec.trim().split(":");
            String id = parts[0].trim();
            if (id.isEmpty()) {
                throw new IllegalArgumentException("Invalid agent descriptor: " + spec);
            }
            AgentRole role = parts.length > 1 ? AgentRole.fromString(parts[1]) : AgentRole.DEVELOPER;
            List<String> skills = parts.length > 2 ? List.of(parts[2].split("\\+")) : List.of(role.wireName());
            Transport transport = tcp
                    ? new TcpTransport(id, "127.0.0.1", 0, settings)
                    : network.createTransport(id, settings);
            AgentCapabilities capabilities = AgentCapabilities.builder()
                    .canExecuteCode(true)
                    .canReview(role == AgentRole.REVIEWER)
                    .canAnalyzeRequirements(role == AgentRole.ANALYST || role == AgentRole.ARCHITECT)
                    .canCoordinate(role == AgentRole.COORDINATOR)
                    .specializedSkills(skills)
                    .build();
            created.put(id, new PeerAgent(role, capabilities, transport, new EchoTaskExecutor(id), events));
        }
        List<String> failed = new ArrayList<>();
        try {
            for (PeerAgent agent : created.values()) {
                manager.registerAgent(agent);
            }
            for (String link : linkSpecs) {
                String[] ends = link.trim().split("-", 2);
                if (ends.length != 2 || ends[0].isBlank() || ends[1].isBlank()) {
                    throw new IllegalArgumentException("Invalid link descriptor: " + link);
                }
                if (!manager.connectAgents(ends[0].trim(), ends[1].trim())) {
                    failed.add(link.trim());
                }
            }
        } catch (RuntimeException e) {
            manager.close();
            throw e;
        }
        manager.updateNetworkMetrics();
        return new LocalSwarm(manager, List.copyOf(failed));
    }

    TopologyManager manager() {
        return manager;
    }

    List<String> failedLinks() {
        return failedLinks;
    }

    @Override
    public void close() {
        manager.close();
    }
}

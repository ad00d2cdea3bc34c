package io.swarmmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.config.NetworkSettings;
import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.events.EventPublisher;
import io.swarmmesh.events.JournalEventPublisher;
import io.swarmmesh.model.NetworkMetrics;
import io.swarmmesh.model.NodeInfo;
import io.swarmmesh.observability.EventJournal;
import io.swarmmesh.observability.PrometheusFormatter;
import io.swarmmesh.topology.TopologyManager;
import io.swarmmesh.transport.TransportStats;
import io.swarmmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "swarmmesh",
        mixinStandardHelpOptions = true,
        description = "Assemble a local agent swarm and inspect its topology",
        subcommands = {
                SwarmMeshCommand.TopologyCommand.class,
                SwarmMeshCommand.MetricsCommand.class,
                SwarmMeshCommand.PathCommand.class,
                SwarmMeshCommand.NodeCommand.class,
                SwarmMeshCommand.BroadcastCommand.class,
                SwarmMeshCommand.JournalTailCommand.class,
                SwarmMeshCommand.JournalVerifyCommand.class
        }
)
public final class SwarmMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (settings file, event journal)", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace scope under the root", defaultValue = "default")
    String namespace;

    @Option(names = {"--agents"}, split = ",", description = "Agents as id[:role[:skill+skill]], comma separated")
    List<String> agents = new ArrayList<>();

    @Option(names = {"--links"}, split = ",", description = "Explicit links as a-b, comma separated")
    List<String> links = new ArrayList<>();

    @Option(names = {"--transport"}, defaultValue = "memory", description = "Transport: memory|tcp")
    String transport;

    @Option(names = {"--seed-fanout"}, description = "Peers each new agent dials on registration (default from settings)")
    Integer seedFanout;

    @Option(names = {"--journal"}, defaultValue = "false", description = "Append network events to the namespace journal")
    boolean journal;

    @Override
    public void run() {
        System.out.println("Use subcommands: topology | metrics | path | node | broadcast | journal-tail | journal-verify");
    }

    SwarmMeshConfig config() {
        return SwarmMeshConfig.fromRoot(root, namespace);
    }

    LocalSwarm swarm() {
        SwarmMeshConfig config = config();
        NetworkSettings settings = config.loadSettings();
        if (seedFanout != null) {
            settings = settings.withSeedFanout(seedFanout);
        }
        EventPublisher events = journal
                ? new JournalEventPublisher(new EventJournal(config.journalFile(), config.namespace()))
                : EventPublisher.NOOP;
        return LocalSwarm.build(settings, events, transport, agents, links);
    }

    @Command(name = "topology", description = "Print nodes, connections, clusters and bridges")
    static final class TopologyCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Override
        public Integer call() {
            try (LocalSwarm swarm = parent.swarm()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("topology", swarm.manager().getTopology());
                out.put("failedLinks", swarm.failedLinks());
                System.out.println(Jsons.toJson(out));
                return swarm.failedLinks().isEmpty() ? 0 : 1;
            }
        }
    }

    @Command(name = "metrics", description = "Print network metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print JSON instead of Prometheus text")
        boolean json;

        @Override
        public Integer call() {
            try (LocalSwarm swarm = parent.swarm()) {
                TopologyManager manager = swarm.manager();
                NetworkMetrics metrics = manager.getMetrics();
                if (json) {
                    System.out.println(Jsons.toJson(metrics));
                    return 0;
                }
                List<TransportStats> stats = new ArrayList<>();
                for (String nodeId : manager.registeredNodeIds()) {
                    NodeInfo info = manager.getNodeInfo(nodeId);
                    if (info != null) {
                        stats.add(info.networkStats());
                    }
                }
                String namespace = parent.config().namespace();
                System.out.print(PrometheusFormatter.format(metrics, stats,
                        SwarmMeshConfig.DEFAULT_NAMESPACE.equals(namespace) ? null : namespace));
                return 0;
            }
        }
    }

    @Command(name = "path", description = "Shortest path between two agents")
    static final class PathCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--from"}, required = true, description = "Source agent id")
        String from;

        @Option(names = {"--to"}, required = true, description = "Destination agent id")
        String to;

        @Override
        public Integer call() {
            try (LocalSwarm swarm = parent.swarm()) {
                List<String> path = swarm.manager().findPath(from, to);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("from", from);
                out.put("to", to);
                out.put("path", path);
                out.put("hops", path == null ? -1 : path.size() - 1);
                System.out.println(Jsons.toJson(out));
                return path == null ? 1 : 0;
            }
        }
    }

    @Command(name = "node", description = "Show one agent's connections, stats and capabilities")
    static final class NodeCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Agent id")
        String id;

        @Override
        public Integer call() {
            try (LocalSwarm swarm = parent.swarm()) {
                NodeInfo info = swarm.manager().getNodeInfo(id);
                if (info == null) {
                    System.out.println("Node not found: " + id);
                    return 1;
                }
                System.out.println(Jsons.toJson(info));
                return 0;
            }
        }
    }

    @Command(name = "broadcast", description = "Broadcast a message from every agent and print the delivery count")
    static final class BroadcastCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--topic"}, required = true, description = "Message topic")
        String topic;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON payload")
        String payload;

        @Override
        public Integer call() throws Exception {
            JsonNode body = Jsons.mapper().readTree(payload);
            try (LocalSwarm swarm = parent.swarm()) {
                int sent = swarm.manager().broadcastMessage(topic, body);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("topic", topic);
                out.put("sent", sent);
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "journal-tail", description = "Print the latest event journal rows")
    static final class JournalTailCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            SwarmMeshConfig config = parent.config();
            EventJournal journal = new EventJournal(config.journalFile(), config.namespace());
            for (JsonNode row : journal.tail(lines)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "journal-verify", description = "Verify the event journal hash chain")
    static final class JournalVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Override
        public Integer call() {
            SwarmMeshConfig config = parent.config();
            int verified = new EventJournal(config.journalFile(), config.namespace()).verify();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ok", verified >= 0);
            out.put("rows", Math.max(0, verified));
            out.put("file", config.journalFile().toString());
            System.out.println(Jsons.toJson(out));
            return verified >= 0 ? 0 : 1;
        }
    }
}

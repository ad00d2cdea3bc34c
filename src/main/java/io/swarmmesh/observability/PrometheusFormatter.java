package io.swarmmesh.observability;

import io.swarmmesh.model.NetworkMetrics;
import io.swarmmesh.transport.TransportStats;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(NetworkMetrics metrics) {
        return format(metrics, List.of(), null);
    }

    public static String format(NetworkMetrics metrics, Collection<TransportStats> nodeStats, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "swarmmesh_nodes_total", "Registered agent nodes", null, null, metrics.totalNodes());
        appendGauge(sb, "swarmmesh_connections_active", "Directed connection edges", null, null, metrics.activeConnections());
        appendGauge(sb, "swarmmesh_latency_avg_ms", "Average one-way delivery latency in milliseconds", null, null, metrics.averageLatencyMs());
        appendGauge(sb, "swarmmesh_network_health", "Network health score (0-100)", null, null, metrics.networkHealth());
        appendGauge(sb, "swarmmesh_clusters_total", "Connected clusters with two or more nodes", null, null, metrics.clusterCount());
        appendGauge(sb, "swarmmesh_bridges_total", "Nodes bridging more than one cluster", null, null, metrics.bridgeCount());
        appendGauge(sb, "swarmmesh_message_throughput", "Messages sent per second since the previous sample", null, null, metrics.messageThroughput());
        appendGauge(sb, "swarmmesh_error_rate_percent", "Failed sends as a percentage of send attempts", null, null, metrics.errorRate());
        if (nodeStats != null) {
            for (TransportStats stats : nodeStats) {
                appendGauge(sb, "swarmmesh_node_connected_peers", "Connected peers per node", "node", stats.nodeId(), stats.connectedPeers());
            }
            for (TransportStats stats : nodeStats) {
                appendGauge(sb, "swarmmesh_node_messages_sent", "Messages sent per node", "node", stats.nodeId(), stats.messagesSent());
            }
            for (TransportStats stats : nodeStats) {
                appendGauge(sb, "swarmmesh_node_send_failures", "Failed sends per node", "node", stats.nodeId(), stats.sendFailures());
            }
        }
        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        String escapedNs = escapeLabel(normalizedNamespace);
        StringBuilder withNamespace = new StringBuilder(base.length() + 128);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank() || line.startsWith("#")) {
                withNamespace.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            String value = line.substring(sep + 1);
            int brace = sample.indexOf('{');
            if (brace >= 0 && sample.endsWith("}")) {
                sample = sample.substring(0, brace + 1)
                        + "namespace=\"" + escapedNs + "\","
                        + sample.substring(brace + 1);
            } else {
                sample = sample + "{namespace=\"" + escapedNs + "\"}";
            }
            withNamespace.append(sample).append(' ').append(value).append('\n');
        }
        return withNamespace.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(formatValue(value)).append('\n');
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

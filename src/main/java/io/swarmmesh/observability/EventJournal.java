package io.swarmmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.events.NetworkEvent;
import io.swarmmesh.util.Hashing;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSONL journal of network events. Each row carries the hash of the previous row,
 * so truncation or edits show up in {@link #verify()}.
 */
public final class EventJournal {
    private final Path journalFile;
    private final String namespace;
    private String previousHash;

    public EventJournal(Path journalFile, String namespace) {
        this.journalFile = journalFile;
        this.namespace = SwarmMeshConfig.normalizeNamespace(namespace);
        try {
            Files.createDirectories(journalFile.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event journal: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void append(NetworkEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(event.timestampMs()).toString());
        row.put("namespace", namespace);
        row.put("type", event.type().wireName());
        row.put("source", event.source());
        row.put("payload", event.payload());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write event journal: " + journalFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = new ArrayList<>();
        for (String line : readLines()) {
            try {
                rows.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                throw new RuntimeException("Corrupt event journal row in " + journalFile, e);
            }
        }
        int from = Math.max(0, rows.size() - Math.max(0, limit));
        return List.copyOf(rows.subList(from, rows.size()));
    }

    /**
     * Recomputes the hash chain. Returns the number of verified rows, or -1 at the first broken link.
     */
    public synchronized int verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return -1;
            }
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return -1;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", node.path("timestamp").asText());
            row.put("namespace", node.path("namespace").asText());
            row.put("type", node.path("type").asText());
            row.put("source", node.path("source").isNull() ? null : node.path("source").asText());
            row.put("payload", node.path("payload"));
            row.put("prev_hash", expectedPrev);
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return -1;
            }
            expectedPrev = hash;
            checked++;
        }
        return checked;
    }

    private List<String> readLines() {
        if (!Files.exists(journalFile)) {
            return List.of();
        }
        try {
            List<String> lines = new ArrayList<>();
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    lines.add(line);
                }
            }
            return lines;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read event journal: " + journalFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Corrupt last row in event journal: " + journalFile, e);
        }
    }
}

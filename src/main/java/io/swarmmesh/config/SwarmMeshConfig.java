package io.swarmmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SwarmMeshConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "swarmmesh-settings.json";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_DISCOVERY_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_METRICS_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 3_000L;
    public static final long DEFAULT_RESTART_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_MESSAGE_TTL_SECONDS = 300L;
    public static final int DEFAULT_SEED_FANOUT = 3;
    public static final int DEFAULT_TARGET_FANOUT = 3;
    public static final int DEFAULT_HEALTH_DEGRADED_THRESHOLD = 50;
    private static final Pattern NAMESPACE_INVALID_CHARS = Pattern.compile("[^a-z0-9_.-]");
    private static final Pattern NAMESPACE_DASH_RUNS = Pattern.compile("-{2,}");

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public SwarmMeshConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static SwarmMeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static SwarmMeshConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = normalizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new SwarmMeshConfig(scoped, base, safeNamespace);
    }

    /**
     * Maps a user-supplied namespace to the form used for directory names, journal rows and metric
     * labels: lower case, characters outside {@code [a-z0-9_.-]} replaced by single dashes, no
     * leading dot. Blank input is the default namespace.
     */
    public static String normalizeNamespace(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        String value = NAMESPACE_INVALID_CHARS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        value = NAMESPACE_DASH_RUNS.matcher(value).replaceAll("-");
        return value.startsWith(".") ? "ns" + value : value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path journalRoot() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalRoot().resolve("events.jsonl");
    }

    public NetworkSettings loadSettings() {
        return NetworkSettings.load(settingsFile());
    }
}

package io.swarmmesh.config;

import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for transports and the topology manager.
 *
 * <p>Values come from an optional {@code swarmmesh-settings.json}; missing or
 * out-of-range fields fall back to the defaults in {@link SwarmMeshConfig}.
 */
public record NetworkSettings(
        long heartbeatIntervalMs,
        long discoveryIntervalMs,
        long metricsIntervalMs,
        long healthCheckIntervalMs,
        long connectTimeoutMs,
        long restartTimeoutMs,
        long messageTtlSeconds,
        int seedFanout,
        int targetFanout,
        int healthDegradedThreshold
) {
    public static NetworkSettings defaults() {
        return new NetworkSettings(
                SwarmMeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                SwarmMeshConfig.DEFAULT_DISCOVERY_INTERVAL_MS,
                SwarmMeshConfig.DEFAULT_METRICS_INTERVAL_MS,
                SwarmMeshConfig.DEFAULT_HEALTH_CHECK_INTERVAL_MS,
                SwarmMeshConfig.DEFAULT_CONNECT_TIMEOUT_MS,
                SwarmMeshConfig.DEFAULT_RESTART_TIMEOUT_MS,
                SwarmMeshConfig.DEFAULT_MESSAGE_TTL_SECONDS,
                SwarmMeshConfig.DEFAULT_SEED_FANOUT,
                SwarmMeshConfig.DEFAULT_TARGET_FANOUT,
                SwarmMeshConfig.DEFAULT_HEALTH_DEGRADED_THRESHOLD
        );
    }

    public static NetworkSettings load(Path file) {
        NetworkSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load network settings: " + file, e);
        }
    }

    static NetworkSettings fromFile(SettingsFile file, NetworkSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new NetworkSettings(
                sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 10L),
                sanitizeLong(file.discoveryIntervalMs(), defaults.discoveryIntervalMs(), 10L),
                sanitizeLong(file.metricsIntervalMs(), defaults.metricsIntervalMs(), 10L),
                sanitizeLong(file.healthCheckIntervalMs(), defaults.healthCheckIntervalMs(), 10L),
                sanitizeLong(file.connectTimeoutMs(), defaults.connectTimeoutMs(), 1L),
                sanitizeLong(file.restartTimeoutMs(), defaults.restartTimeoutMs(), 1L),
                sanitizeLong(file.messageTtlSeconds(), defaults.messageTtlSeconds(), 1L),
                sanitizeInt(file.seedFanout(), defaults.seedFanout(), 0),
                sanitizeInt(file.targetFanout(), defaults.targetFanout(), 1),
                Math.min(100, sanitizeInt(file.healthDegradedThreshold(), defaults.healthDegradedThreshold(), 0))
        );
    }

    public NetworkSettings withSeedFanout(int fanout) {
        return new NetworkSettings(
                heartbeatIntervalMs,
                discoveryIntervalMs,
                metricsIntervalMs,
                healthCheckIntervalMs,
                connectTimeoutMs,
                restartTimeoutMs,
                messageTtlSeconds,
                Math.max(0, fanout),
                targetFanout,
                healthDegradedThreshold
        );
    }

    public NetworkSettings withIntervals(long heartbeatMs, long discoveryMs, long metricsMs, long healthCheckMs) {
        return new NetworkSettings(
                Math.max(10L, heartbeatMs),
                Math.max(10L, discoveryMs),
                Math.max(10L, metricsMs),
                Math.max(10L, healthCheckMs),
                connectTimeoutMs,
                restartTimeoutMs,
                messageTtlSeconds,
                seedFanout,
                targetFanout,
                healthDegradedThreshold
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    record SettingsFile(
            Long heartbeatIntervalMs,
            Long discoveryIntervalMs,
            Long metricsIntervalMs,
            Long healthCheckIntervalMs,
            Long connectTimeoutMs,
            Long restartTimeoutMs,
            Long messageTtlSeconds,
            Integer seedFanout,
            Integer targetFanout,
            Integer healthDegradedThreshold
    ) {
    }
}

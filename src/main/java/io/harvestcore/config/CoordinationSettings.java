package io.harvestcore.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.harvestcore.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Numeric knobs consumed by the coordination core.
 *
 * <p>Each value resolves from an environment variable first, then from
 * {@code harvest-settings.json} in the data root, then from the built-in default.
 */
public record CoordinationSettings(
        long leaseTimeoutMs,
        double stuckThresholdPct,
        long stuckTimeoutMs,
        int circuitFailureThreshold,
        long circuitCooldownMs,
        long retryBaseDelayMs,
        long retryMaxDelayMs,
        long retryJitterMs,
        int maxAttempts,
        long heartbeatMinIntervalMs,
        int claimBatchSize,
        long pollIntervalMs,
        long watchdogIntervalMs,
        int subFetchParallelism
) {
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 300_000L;
    public static final double DEFAULT_STUCK_THRESHOLD_PCT = 99.5d;
    public static final long DEFAULT_STUCK_TIMEOUT_MS = 600_000L;
    public static final int DEFAULT_CIRCUIT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_CIRCUIT_COOLDOWN_MS = 60_000L;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 2_000L;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 120_000L;
    public static final long DEFAULT_RETRY_JITTER_MS = 250L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_HEARTBEAT_MIN_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_CLAIM_BATCH_SIZE = 10;
    public static final long DEFAULT_POLL_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 120_000L;
    public static final int DEFAULT_SUBFETCH_PARALLELISM = 4;

    public static final String ENV_PREFIX = "HARVEST_";

    public CoordinationSettings {
        requirePositive("leaseTimeoutMs", leaseTimeoutMs);
        if (stuckThresholdPct <= 0d || stuckThresholdPct > 100d) {
            throw new IllegalArgumentException("stuckThresholdPct must be in (0, 100], got " + stuckThresholdPct);
        }
        requirePositive("stuckTimeoutMs", stuckTimeoutMs);
        requirePositive("circuitFailureThreshold", circuitFailureThreshold);
        requirePositive("circuitCooldownMs", circuitCooldownMs);
        requirePositive("retryBaseDelayMs", retryBaseDelayMs);
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException("retryMaxDelayMs must be >= retryBaseDelayMs");
        }
        if (retryJitterMs < 0L) {
            throw new IllegalArgumentException("retryJitterMs must be >= 0");
        }
        requirePositive("maxAttempts", maxAttempts);
        if (heartbeatMinIntervalMs < 0L) {
            throw new IllegalArgumentException("heartbeatMinIntervalMs must be >= 0");
        }
        requirePositive("claimBatchSize", claimBatchSize);
        requirePositive("pollIntervalMs", pollIntervalMs);
        requirePositive("watchdogIntervalMs", watchdogIntervalMs);
        requirePositive("subFetchParallelism", subFetchParallelism);
    }

    public static CoordinationSettings defaults() {
        return new CoordinationSettings(
                DEFAULT_LEASE_TIMEOUT_MS,
                DEFAULT_STUCK_THRESHOLD_PCT,
                DEFAULT_STUCK_TIMEOUT_MS,
                DEFAULT_CIRCUIT_FAILURE_THRESHOLD,
                DEFAULT_CIRCUIT_COOLDOWN_MS,
                DEFAULT_RETRY_BASE_DELAY_MS,
                DEFAULT_RETRY_MAX_DELAY_MS,
                DEFAULT_RETRY_JITTER_MS,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_HEARTBEAT_MIN_INTERVAL_MS,
                DEFAULT_CLAIM_BATCH_SIZE,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_WATCHDOG_INTERVAL_MS,
                DEFAULT_SUBFETCH_PARALLELISM
        );
    }

    public static CoordinationSettings load(HarvestConfig config) {
        return load(config.settingsFile(), System.getenv());
    }

    public static CoordinationSettings load(Path settingsFile, Map<String, String> env) {
        SettingsFile file = readFile(settingsFile);
        CoordinationSettings d = defaults();
        return new CoordinationSettings(
                longValue(env, "LEASE_TIMEOUT_MS", file.leaseTimeoutMs(), d.leaseTimeoutMs()),
                doubleValue(env, "STUCK_THRESHOLD_PCT", file.stuckThresholdPct(), d.stuckThresholdPct()),
                longValue(env, "STUCK_TIMEOUT_MS", file.stuckTimeoutMs(), d.stuckTimeoutMs()),
                intValue(env, "CIRCUIT_FAILURE_THRESHOLD", file.circuitFailureThreshold(), d.circuitFailureThreshold()),
                longValue(env, "CIRCUIT_COOLDOWN_MS", file.circuitCooldownMs(), d.circuitCooldownMs()),
                longValue(env, "RETRY_BASE_DELAY_MS", file.retryBaseDelayMs(), d.retryBaseDelayMs()),
                longValue(env, "RETRY_MAX_DELAY_MS", file.retryMaxDelayMs(), d.retryMaxDelayMs()),
                longValue(env, "RETRY_JITTER_MS", file.retryJitterMs(), d.retryJitterMs()),
                intValue(env, "MAX_ATTEMPTS", file.maxAttempts(), d.maxAttempts()),
                longValue(env, "HEARTBEAT_MIN_INTERVAL_MS", file.heartbeatMinIntervalMs(), d.heartbeatMinIntervalMs()),
                intValue(env, "CLAIM_BATCH_SIZE", file.claimBatchSize(), d.claimBatchSize()),
                longValue(env, "POLL_INTERVAL_MS", file.pollIntervalMs(), d.pollIntervalMs()),
                longValue(env, "WATCHDOG_INTERVAL_MS", file.watchdogIntervalMs(), d.watchdogIntervalMs()),
                intValue(env, "SUBFETCH_PARALLELISM", file.subFetchParallelism(), d.subFetchParallelism())
        );
    }

    public Duration leaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }

    public Duration stuckTimeout() {
        return Duration.ofMillis(stuckTimeoutMs);
    }

    public Duration heartbeatMinInterval() {
        return Duration.ofMillis(heartbeatMinIntervalMs);
    }

    public Duration retryBaseDelay() {
        return Duration.ofMillis(retryBaseDelayMs);
    }

    public Duration retryMaxDelay() {
        return Duration.ofMillis(retryMaxDelayMs);
    }

    public CoordinationSettings withLeaseTimeoutMs(long value) {
        return new CoordinationSettings(value, stuckThresholdPct, stuckTimeoutMs, circuitFailureThreshold,
                circuitCooldownMs, retryBaseDelayMs, retryMaxDelayMs, retryJitterMs, maxAttempts,
                heartbeatMinIntervalMs, claimBatchSize, pollIntervalMs, watchdogIntervalMs, subFetchParallelism);
    }

    public CoordinationSettings withClaimBatchSize(int value) {
        return new CoordinationSettings(leaseTimeoutMs, stuckThresholdPct, stuckTimeoutMs, circuitFailureThreshold,
                circuitCooldownMs, retryBaseDelayMs, retryMaxDelayMs, retryJitterMs, maxAttempts,
                heartbeatMinIntervalMs, value, pollIntervalMs, watchdogIntervalMs, subFetchParallelism);
    }

    public CoordinationSettings withStuckTimeoutMs(long value) {
        return new CoordinationSettings(leaseTimeoutMs, stuckThresholdPct, value, circuitFailureThreshold,
                circuitCooldownMs, retryBaseDelayMs, retryMaxDelayMs, retryJitterMs, maxAttempts,
                heartbeatMinIntervalMs, claimBatchSize, pollIntervalMs, watchdogIntervalMs, subFetchParallelism);
    }

    public CoordinationSettings withStuckThresholdPct(double value) {
        return new CoordinationSettings(leaseTimeoutMs, value, stuckTimeoutMs, circuitFailureThreshold,
                circuitCooldownMs, retryBaseDelayMs, retryMaxDelayMs, retryJitterMs, maxAttempts,
                heartbeatMinIntervalMs, claimBatchSize, pollIntervalMs, watchdogIntervalMs, subFetchParallelism);
    }

    public CoordinationSettings withCircuit(int threshold, long cooldownMs) {
        return new CoordinationSettings(leaseTimeoutMs, stuckThresholdPct, stuckTimeoutMs, threshold,
                cooldownMs, retryBaseDelayMs, retryMaxDelayMs, retryJitterMs, maxAttempts,
                heartbeatMinIntervalMs, claimBatchSize, pollIntervalMs, watchdogIntervalMs, subFetchParallelism);
    }

    public CoordinationSettings withRetry(long baseDelayMs, long maxDelayMs, long jitterMs, int attempts) {
        return new CoordinationSettings(leaseTimeoutMs, stuckThresholdPct, stuckTimeoutMs, circuitFailureThreshold,
                circuitCooldownMs, baseDelayMs, maxDelayMs, jitterMs, attempts,
                heartbeatMinIntervalMs, claimBatchSize, pollIntervalMs, watchdogIntervalMs, subFetchParallelism);
    }

    private static SettingsFile readFile(Path settingsFile) {
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return SettingsFile.EMPTY;
        }
        try {
            return Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + settingsFile, e);
        }
    }

    private static long longValue(Map<String, String> env, String key, Long fromFile, long fallback) {
        String raw = env == null ? null : env.get(ENV_PREFIX + key);
        if (raw != null && !raw.isBlank()) {
            try {
                return Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + ENV_PREFIX + key + ": " + raw, e);
            }
        }
        return fromFile == null ? fallback : fromFile;
    }

    private static int intValue(Map<String, String> env, String key, Integer fromFile, int fallback) {
        long value = longValue(env, key, fromFile == null ? null : fromFile.longValue(), fallback);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(ENV_PREFIX + key + " out of range: " + value);
        }
        return (int) value;
    }

    private static double doubleValue(Map<String, String> env, String key, Double fromFile, double fallback) {
        String raw = env == null ? null : env.get(ENV_PREFIX + key);
        if (raw != null && !raw.isBlank()) {
            try {
                return Double.parseDouble(raw.trim().toLowerCase(Locale.ROOT).replace("%", ""));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + ENV_PREFIX + key + ": " + raw, e);
            }
        }
        return fromFile == null ? fallback : fromFile;
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0L) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long leaseTimeoutMs,
            Double stuckThresholdPct,
            Long stuckTimeoutMs,
            Integer circuitFailureThreshold,
            Long circuitCooldownMs,
            Long retryBaseDelayMs,
            Long retryMaxDelayMs,
            Long retryJitterMs,
            Integer maxAttempts,
            Long heartbeatMinIntervalMs,
            Integer claimBatchSize,
            Long pollIntervalMs,
            Long watchdogIntervalMs,
            Integer subFetchParallelism
    ) {
        static final SettingsFile EMPTY = new SettingsFile(
                null, null, null, null, null, null, null, null, null, null, null, null, null, null
        );
    }
}

package io.harvestcore.queue;

import io.harvestcore.observability.AuditLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Closed/open breaker for one upstream dependency. Opens after {@code threshold} consecutive
 * failures and closes again once {@code cooldown} has elapsed or a success is recorded.
 */
public final class CircuitBreaker {
    private final String name;
    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;
    private final AuditLogger auditLogger;

    private int consecutiveFailures;
    private long openUntilMs;
    private boolean open;

    public CircuitBreaker(String name, int threshold, Duration cooldown, Clock clock, AuditLogger auditLogger) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0");
        }
        this.name = name;
        this.threshold = threshold;
        this.cooldown = cooldown;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public String name() {
        return name;
    }

    public synchronized boolean allowRequest() {
        if (!open) {
            return true;
        }
        if (clock.millis() >= openUntilMs) {
            close("cooldown_elapsed");
            return true;
        }
        return false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (consecutiveFailures >= threshold) {
            boolean wasOpen = open;
            open = true;
            openUntilMs = clock.millis() + cooldown.toMillis();
            if (!wasOpen) {
                audit("circuit.open", "open");
            }
        }
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        if (open) {
            close("success");
        }
    }

    public synchronized Duration remainingCooldown() {
        if (!open) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.max(0L, openUntilMs - clock.millis()));
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(name, open, consecutiveFailures, open ? openUntilMs : null);
    }

    private void close(String reason) {
        open = false;
        consecutiveFailures = 0;
        openUntilMs = 0L;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of("circuit.close", name, "dependency", "closed", null, null, details));
        }
    }

    private void audit(String action, String result) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("consecutive_failures", consecutiveFailures);
        details.put("open_until_ms", openUntilMs);
        auditLogger.log(AuditLogger.AuditEvent.of(action, name, "dependency", result, null, null, details));
    }

    public record Snapshot(String name, boolean open, int consecutiveFailures, Long openUntilMs) {
    }
}

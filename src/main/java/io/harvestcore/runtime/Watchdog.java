package io.harvestcore.runtime;

import io.harvestcore.observability.AuditLogger;
import io.harvestcore.queue.StaleRecovery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Periodic stale-lease sweep, independent of any worker. Keeps a run moving when every
 * worker has died.
 */
public final class Watchdog implements AutoCloseable {
    private static final String ACTOR = "watchdog";

    private final CoordinationContext ctx;
    private final StaleRecovery recovery;
    private final Supplier<List<String>> runIds;
    private ScheduledExecutorService scheduler;

    public Watchdog(CoordinationContext ctx, StaleRecovery recovery, Supplier<List<String>> runIds) {
        this.ctx = ctx;
        this.recovery = recovery;
        this.runIds = runIds;
    }

    public void start() {
        start(ctx.settings().watchdogIntervalMs(), recovered -> {
        });
    }

    /**
     * Sweeps every {@code intervalMs}, handing each successful sweep's counts to
     * {@code onSweep}. A failed sweep is audited and the schedule keeps going.
     */
    public synchronized void start(long intervalMs, Consumer<Map<String, Integer>> onSweep) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "harvest-watchdog");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> tickQuietly(onSweep), 0L, intervalMs, TimeUnit.MILLISECONDS);
    }

    /** One sweep over every run; returns recovered counts per run. */
    public Map<String, Integer> tick() {
        Map<String, Integer> recovered = new LinkedHashMap<>();
        for (String runId : runIds.get()) {
            recovered.put(runId, recovery.sweep(runId, ctx.settings().leaseTimeout(), ctx.settings().stuckTimeout(), ACTOR));
        }
        return recovered;
    }

    private void tickQuietly(Consumer<Map<String, Integer>> onSweep) {
        // An exception escaping here would cancel the schedule.
        try {
            onSweep.accept(tick());
        } catch (RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                    "watchdog.sweep", ACTOR, "work_items", "error", null, null, details));
        }
    }

    @Override
    public synchronized void close() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler.awaitTermination(10, TimeUnit.SECONDS);
        scheduler = null;
    }
}

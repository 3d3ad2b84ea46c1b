package io.harvestcore.queue;

import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.ItemFilter;
import io.harvestcore.storage.ItemUpdate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns leaked work to the queue: expired leases of crashed workers, and the last few
 * items of a run that has stopped making progress near completion.
 */
public final class StaleRecovery {
    static final String LEASE_EXPIRED = "lease expired";
    static final String BUDGET_EXHAUSTED = "lease expired; retry budget exhausted";

    private final CoordinationContext ctx;
    private final WorkQueue queue;
    private final StuckDetector stuckDetector;

    public StaleRecovery(CoordinationContext ctx, WorkQueue queue, StuckDetector stuckDetector) {
        this.ctx = ctx;
        this.queue = queue;
        this.stuckDetector = stuckDetector;
    }

    public int sweep(String runId) {
        return sweep(runId, ctx.settings().leaseTimeout(), ctx.settings().stuckTimeout(), "sweeper");
    }

    public int sweep(String runId, Duration leaseTimeout, Duration stuckTimeout) {
        return sweep(runId, leaseTimeout, stuckTimeout, "sweeper");
    }

    public int sweep(String runId, Duration leaseTimeout, Duration stuckTimeout, String actor) {
        int recovered = reclaimExpired(runId, leaseTimeout, actor);
        QueueStats stats = queue.stats(runId);
        StuckDetector.Observation observation = stuckDetector.observe(stats, stuckTimeout.toMillis());
        if (observation.stuck()) {
            recovered += resolveStuck(runId, leaseTimeout, stats, observation.stalledForMs(), actor);
        }
        return recovered;
    }

    /** Stuck-near-completion remedy, applied without re-checking the detector. */
    public int resolveStuck(String runId, Duration leaseTimeout, QueueStats stats, long stalledForMs, String actor) {
        long nowMs = ctx.nowMs();
        int futureLeases = ctx.store().update(
                ItemFilter.forRun(runId).status(WorkItemStatus.PENDING).leaseAfter(nowMs),
                ItemUpdate.set().clearLease());
        int staleInProgress = ctx.store().update(
                ItemFilter.forRun(runId).status(WorkItemStatus.IN_PROGRESS).leaseBefore(nowMs - leaseTimeout.toMillis()),
                ItemUpdate.set().status(WorkItemStatus.PENDING).clearOwner().clearLease());
        stuckDetector.reset(runId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("remaining", stats.remaining());
        details.put("terminal_pct", stats.terminalPct());
        details.put("stalled_for_ms", stalledForMs);
        details.put("future_leases_cleared", futureLeases);
        details.put("in_progress_released", staleInProgress);
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "stuck.resolve", actor, "work_items", "resolved", runId, null, details));
        return futureLeases + staleInProgress;
    }

    private int reclaimExpired(String runId, Duration leaseTimeout, String actor) {
        long cutoffMs = ctx.nowMs() - leaseTimeout.toMillis();
        int maxAttempts = ctx.settings().maxAttempts();
        // An item whose lease already expired max_attempts times is poison.
        int failed = ctx.store().update(
                ItemFilter.forRun(runId)
                        .status(WorkItemStatus.IN_PROGRESS)
                        .leaseBefore(cutoffMs)
                        .leaseExpiriesAtLeast(maxAttempts),
                ItemUpdate.set()
                        .status(WorkItemStatus.FAILED)
                        .clearOwner()
                        .clearLease()
                        .incrementAttempts()
                        .incrementLeaseExpiries()
                        .lastError(BUDGET_EXHAUSTED));
        // The reclaim counts as an attempt while one is left to spend after it.
        int requeued = ctx.store().update(
                ItemFilter.forRun(runId)
                        .status(WorkItemStatus.IN_PROGRESS)
                        .leaseBefore(cutoffMs)
                        .attemptsBelow(maxAttempts - 1),
                ItemUpdate.set()
                        .status(WorkItemStatus.PENDING)
                        .clearOwner()
                        .clearLease()
                        .incrementAttempts()
                        .incrementLeaseExpiries()
                        .lastError(LEASE_EXPIRED));
        // On its final attempt the item goes back claimable with the count unchanged.
        requeued += ctx.store().update(
                ItemFilter.forRun(runId)
                        .status(WorkItemStatus.IN_PROGRESS)
                        .leaseBefore(cutoffMs),
                ItemUpdate.set()
                        .status(WorkItemStatus.PENDING)
                        .clearOwner()
                        .clearLease()
                        .incrementLeaseExpiries()
                        .lastError(LEASE_EXPIRED));
        // Pending rows that can never be claimed again would keep the run open forever.
        int stranded = ctx.store().update(
                ItemFilter.forRun(runId)
                        .status(WorkItemStatus.PENDING)
                        .attemptsAtLeast(maxAttempts),
                ItemUpdate.set()
                        .status(WorkItemStatus.FAILED)
                        .clearLease()
                        .lastError(BUDGET_EXHAUSTED));
        if (failed + requeued + stranded > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("requeued", requeued);
            details.put("failed", failed + stranded);
            details.put("lease_timeout_ms", leaseTimeout.toMillis());
            ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                    "lease.reclaim", actor, "work_items", "reclaimed", runId, null, details));
        }
        return requeued + failed + stranded;
    }
}

package io.harvestcore.queue;

import io.harvestcore.model.WorkItem;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.ItemFilter;
import io.harvestcore.storage.ItemUpdate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff for failed items. The delay is stored as a future lease time,
 * which keeps the item out of claims until it elapses.
 */
public final class RetryBackoff {
    private static final int MAX_SHIFT = 30;

    private final CoordinationContext ctx;
    private final WorkQueue queue;

    public RetryBackoff(CoordinationContext ctx, WorkQueue queue) {
        this.ctx = ctx;
        this.queue = queue;
    }

    public RequeueResolution requeue(WorkItem item, String owner, String error) {
        return requeue(item, owner, error,
                ctx.settings().retryBaseDelayMs(),
                ctx.settings().retryMaxDelayMs(),
                ctx.settings().maxAttempts());
    }

    /**
     * Schedules another attempt, or marks the item failed once this attempt uses up the
     * budget. With a non-null {@code owner} the write is fenced on that owner.
     */
    public RequeueResolution requeue(WorkItem item, String owner, String error,
                                     long baseDelayMs, long maxDelayMs, int maxAttempts) {
        if (item.attemptCount() + 1 >= maxAttempts) {
            boolean marked = owner == null
                    ? queue.markTerminal(item, WorkItemStatus.FAILED, error, null)
                    : queue.markTerminalOwned(item, owner, WorkItemStatus.FAILED, error, null);
            return marked ? RequeueResolution.exhausted() : RequeueResolution.staleLease();
        }
        long delayMs = delayFor(item.attemptCount(), baseDelayMs, maxDelayMs, ctx.settings().retryJitterMs());
        ItemFilter filter = ItemFilter.forRun(item.runId()).key(item.itemKey());
        if (owner == null) {
            filter.nonTerminal();
        } else {
            filter.status(WorkItemStatus.IN_PROGRESS).owner(owner);
        }
        ItemUpdate set = ItemUpdate.set()
                .status(WorkItemStatus.PENDING)
                .clearOwner()
                .leaseTime(ctx.nowMs() + delayMs)
                .incrementAttempts()
                .lastError(error);
        if (ctx.store().update(filter, set) == 0) {
            if (owner != null) {
                queue.recordLeaseConflict(item, owner, "requeue_after_lease_lost");
            }
            return RequeueResolution.staleLease();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", item.attemptCount() + 1);
        details.put("delay_ms", delayMs);
        if (error != null) {
            details.put("error", error);
        }
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "item.requeue", owner == null ? "queue" : owner, "work_items", "scheduled",
                item.runId(), item.itemKey(), details));
        return RequeueResolution.requeued(delayMs);
    }

    public long delayFor(int attempt) {
        return delayFor(attempt, ctx.settings().retryBaseDelayMs(), ctx.settings().retryMaxDelayMs(),
                ctx.settings().retryJitterMs());
    }

    /**
     * {@code min(max, base * 2^attempt + jitter)} with jitter below {@code min(jitterMax, base)},
     * so successive delays never shrink.
     */
    public static long delayFor(int attempt, long baseDelayMs, long maxDelayMs, long jitterMaxMs) {
        int shift = Math.max(0, Math.min(attempt, MAX_SHIFT));
        long exp = baseDelayMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseDelayMs << shift;
        if (exp >= maxDelayMs) {
            return maxDelayMs;
        }
        long jitterBound = Math.min(jitterMaxMs, baseDelayMs);
        long jitter = jitterBound <= 0 ? 0L : ThreadLocalRandom.current().nextLong(jitterBound);
        return Math.min(maxDelayMs, exp + jitter);
    }

    public record RequeueResolution(Outcome outcome, long delayMs) {
        public enum Outcome {
            REQUEUED,
            EXHAUSTED,
            STALE_LEASE
        }

        public static RequeueResolution requeued(long delayMs) {
            return new RequeueResolution(Outcome.REQUEUED, delayMs);
        }

        public static RequeueResolution exhausted() {
            return new RequeueResolution(Outcome.EXHAUSTED, 0L);
        }

        public static RequeueResolution staleLease() {
            return new RequeueResolution(Outcome.STALE_LEASE, 0L);
        }

        public boolean requeued() {
            return outcome == Outcome.REQUEUED;
        }
    }
}

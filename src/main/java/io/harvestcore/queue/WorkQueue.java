package io.harvestcore.queue;

import io.harvestcore.model.StoreException;
import io.harvestcore.model.WorkItem;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.ClaimOrder;
import io.harvestcore.storage.ItemFilter;
import io.harvestcore.storage.ItemUpdate;
import io.harvestcore.util.Jsons;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class WorkQueue {
    private final CoordinationContext ctx;

    public WorkQueue(CoordinationContext ctx) {
        this.ctx = ctx;
    }

    public int enqueue(String runId, Collection<String> itemKeys) {
        requireRunId(runId);
        return ctx.store().insertPending(runId, itemKeys);
    }

    public List<WorkItem> claim(String runId, String owner) {
        return claim(runId, ctx.settings().maxAttempts(), ctx.settings().claimBatchSize(), owner);
    }

    /**
     * Atomically takes up to {@code batchSize} claimable items for {@code owner}. A transient
     * store failure is retried once before it propagates.
     */
    public List<WorkItem> claim(String runId, int maxAttempts, int batchSize, String owner) {
        requireRunId(runId);
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }
        List<WorkItem> claimed;
        try {
            claimed = claimOnce(runId, maxAttempts, batchSize, owner);
        } catch (StoreException e) {
            if (!e.isTransient()) {
                throw e;
            }
            claimed = claimOnce(runId, maxAttempts, batchSize, owner);
        }
        if (!claimed.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("count", claimed.size());
            details.put("batch_size", batchSize);
            ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                    "queue.claim", owner, "work_items", "ok", runId, null, details));
        }
        return claimed;
    }

    private List<WorkItem> claimOnce(String runId, int maxAttempts, int batchSize, String owner) {
        long nowMs = ctx.nowMs();
        ItemFilter filter = ItemFilter.forRun(runId)
                .status(WorkItemStatus.PENDING)
                .leaseDue(nowMs)
                .attemptsBelow(maxAttempts);
        ItemUpdate set = ItemUpdate.set()
                .status(WorkItemStatus.IN_PROGRESS)
                .owner(owner)
                .leaseTime(nowMs);
        return ctx.store().claimBatch(filter, ClaimOrder.ATTEMPTS_THEN_KEY, batchSize, set);
    }

    /**
     * Moves a non-terminal item to {@code status}. Calling it again for an item that is
     * already terminal changes nothing.
     */
    public boolean markTerminal(WorkItem item, WorkItemStatus status, String error, Map<String, Object> resultFields) {
        ItemFilter filter = ItemFilter.forRun(item.runId()).key(item.itemKey()).nonTerminal();
        return applyTerminal(item, null, status, error, resultFields, filter);
    }

    /**
     * Owner-fenced terminal mark. Returns false, and records a lease conflict, when the item
     * is no longer {@code in_progress} under {@code owner}.
     */
    public boolean markTerminalOwned(WorkItem item, String owner, WorkItemStatus status, String error,
                                     Map<String, Object> resultFields) {
        ItemFilter filter = ItemFilter.forRun(item.runId())
                .key(item.itemKey())
                .status(WorkItemStatus.IN_PROGRESS)
                .owner(owner);
        return applyTerminal(item, owner, status, error, resultFields, filter);
    }

    private boolean applyTerminal(WorkItem item, String owner, WorkItemStatus status, String error,
                                  Map<String, Object> resultFields, ItemFilter filter) {
        if (status == null || !status.terminal()) {
            throw new IllegalArgumentException("markTerminal requires a terminal status, got " + status);
        }
        ItemUpdate set = ItemUpdate.set()
                .status(status)
                .clearOwner()
                .clearLease()
                .incrementAttempts()
                .lastError(error);
        if (resultFields != null && !resultFields.isEmpty()) {
            set.resultJson(Jsons.toCompactJson(resultFields));
        }
        int updated = ctx.store().update(filter, set);
        if (updated == 0) {
            if (owner != null) {
                recordLeaseConflict(item, owner, "terminal_after_lease_lost");
            }
            return false;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.dbValue());
        if (error != null) {
            details.put("error", error);
        }
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "item.terminal", owner == null ? "queue" : owner, "work_items", status.dbValue(),
                item.runId(), item.itemKey(), details));
        return true;
    }

    /**
     * Hands an owned item back as pending without spending an attempt.
     */
    public boolean release(WorkItem item, String owner, String reason) {
        ItemFilter filter = ItemFilter.forRun(item.runId())
                .key(item.itemKey())
                .status(WorkItemStatus.IN_PROGRESS)
                .owner(owner);
        ItemUpdate set = ItemUpdate.set()
                .status(WorkItemStatus.PENDING)
                .clearOwner()
                .clearLease()
                .lastError(reason);
        return ctx.store().update(filter, set) == 1;
    }

    public QueueStats stats(String runId) {
        requireRunId(runId);
        return QueueStats.fromCounts(runId, ctx.store().aggregateCounts("status", ItemFilter.forRun(runId)));
    }

    public List<WorkItem> find(String runId, WorkItemStatus status, int limit) {
        ItemFilter filter = ItemFilter.forRun(runId);
        if (status != null) {
            filter.status(status);
        }
        return ctx.store().find(filter, limit);
    }

    public Optional<WorkItem> get(String runId, String itemKey) {
        List<WorkItem> found = ctx.store().find(ItemFilter.forRun(runId).key(itemKey), 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    void recordLeaseConflict(WorkItem item, String owner, String eventType) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("event_type", eventType);
        details.put("expected_owner", owner);
        get(item.runId(), item.itemKey()).ifPresent(actual -> {
            details.put("actual_status", actual.status().dbValue());
            details.put("actual_owner", actual.owner());
        });
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "lease.conflict", owner, "work_items", "rejected", item.runId(), item.itemKey(), details));
    }

    private static void requireRunId(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
    }
}

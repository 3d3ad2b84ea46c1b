package io.harvestcore.queue;

import io.harvestcore.model.ItemRef;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.ItemFilter;
import io.harvestcore.storage.ItemUpdate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Refreshes the lease of long-running items. Touches closer together than the minimum
 * interval are dropped without a store write.
 */
public final class LeaseHeartbeat {
    private final CoordinationContext ctx;
    private final Map<ItemRef, Long> lastTouchMs = new ConcurrentHashMap<>();

    public LeaseHeartbeat(CoordinationContext ctx) {
        this.ctx = ctx;
    }

    public boolean touch(ItemRef item, String owner) {
        return touch(item, owner, ctx.settings().heartbeatMinInterval());
    }

    /** Returns true when the lease was written. */
    public boolean touch(ItemRef item, String owner, Duration minInterval) {
        long nowMs = ctx.nowMs();
        Long last = lastTouchMs.get(item);
        if (last != null && nowMs - last < minInterval.toMillis()) {
            return false;
        }
        lastTouchMs.put(item, nowMs);
        ItemFilter filter = ItemFilter.forRun(item.runId())
                .key(item.itemKey())
                .status(WorkItemStatus.IN_PROGRESS)
                .owner(owner);
        return ctx.store().update(filter, ItemUpdate.set().leaseTime(nowMs)) == 1;
    }

    public void forget(ItemRef item) {
        lastTouchMs.remove(item);
    }

    int tracked() {
        return lastTouchMs.size();
    }
}

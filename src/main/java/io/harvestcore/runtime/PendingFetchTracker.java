package io.harvestcore.runtime;

import io.harvestcore.model.ItemRef;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Outstanding sub-fetch count per item. Completions may arrive in any order; the item is
 * ready for its terminal mark once the count reaches zero.
 */
public final class PendingFetchTracker {
    private final Map<ItemRef, Integer> outstanding = new HashMap<>();

    public synchronized void register(ItemRef item, int count) {
        if (count <= 0) {
            return;
        }
        outstanding.merge(item, count, Integer::sum);
    }

    /**
     * Returns how many sub-fetches of the item are still running. A completion that arrives
     * after the worker gave up on the item and forgot it is ignored.
     */
    public synchronized int complete(ItemRef item) {
        Integer current = outstanding.get(item);
        if (current == null) {
            return 0;
        }
        int left = current - 1;
        if (left <= 0) {
            outstanding.remove(item);
            notifyAll();
            return 0;
        }
        outstanding.put(item, left);
        return left;
    }

    public synchronized int outstanding(ItemRef item) {
        return outstanding.getOrDefault(item, 0);
    }

    public synchronized boolean awaitDrained(ItemRef item, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (outstanding.containsKey(item)) {
            long leftNanos = deadline - System.nanoTime();
            if (leftNanos <= 0L) {
                return false;
            }
            long ms = Math.max(1L, leftNanos / 1_000_000L);
            wait(ms);
        }
        return true;
    }

    public synchronized void forget(ItemRef item) {
        if (outstanding.remove(item) != null) {
            notifyAll();
        }
    }

    public synchronized int totalOutstanding() {
        int n = 0;
        for (int v : outstanding.values()) {
            n += v;
        }
        return n;
    }
}

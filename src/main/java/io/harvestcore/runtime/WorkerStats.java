package io.harvestcore.runtime;

import java.util.concurrent.atomic.AtomicInteger;

public final class WorkerStats {
    private final AtomicInteger claimed = new AtomicInteger();
    private final AtomicInteger terminal = new AtomicInteger();
    private final AtomicInteger requeued = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger leaseConflicts = new AtomicInteger();
    private final AtomicInteger released = new AtomicInteger();
    private final AtomicInteger sweeps = new AtomicInteger();
    private final AtomicInteger storeRetries = new AtomicInteger();

    void claimed(int n) {
        claimed.addAndGet(n);
    }

    void terminal() {
        terminal.incrementAndGet();
    }

    void requeued() {
        requeued.incrementAndGet();
    }

    void failed() {
        failed.incrementAndGet();
    }

    void leaseConflict() {
        leaseConflicts.incrementAndGet();
    }

    void released() {
        released.incrementAndGet();
    }

    void swept() {
        sweeps.incrementAndGet();
    }

    void storeRetry() {
        storeRetries.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(claimed.get(), terminal.get(), requeued.get(), failed.get(),
                leaseConflicts.get(), released.get(), sweeps.get(), storeRetries.get());
    }

    /**
     * {@code terminal} counts terminal marks applied by this process, {@code failed} the
     * subset that ended as failed after exhausting retries.
     */
    public record Snapshot(
            int claimed,
            int terminal,
            int requeued,
            int failed,
            int leaseConflicts,
            int released,
            int sweeps,
            int storeRetries
    ) {
    }
}

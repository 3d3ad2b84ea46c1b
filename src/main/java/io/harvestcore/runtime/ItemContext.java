package io.harvestcore.runtime;

import io.harvestcore.model.ErrorKind;
import io.harvestcore.model.ItemRef;
import io.harvestcore.model.Result;
import io.harvestcore.model.WorkItem;
import io.harvestcore.queue.LeaseHeartbeat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * What an item processor sees of the worker that claimed the item.
 */
public final class ItemContext {
    private final WorkItem item;
    private final String owner;
    private final LeaseHeartbeat heartbeat;
    private final ExecutorService subFetchExecutor;
    private final PendingFetchTracker pendingFetches;
    private final List<Future<?>> submitted = new ArrayList<>();

    public ItemContext(WorkItem item, String owner, LeaseHeartbeat heartbeat,
                       ExecutorService subFetchExecutor, PendingFetchTracker pendingFetches) {
        this.item = item;
        this.owner = owner;
        this.heartbeat = heartbeat;
        this.subFetchExecutor = subFetchExecutor;
        this.pendingFetches = pendingFetches;
    }

    public WorkItem item() {
        return item;
    }

    public String itemKey() {
        return item.itemKey();
    }

    public String runId() {
        return item.runId();
    }

    public String owner() {
        return owner;
    }

    public int attempt() {
        return item.attemptCount();
    }

    /** Throttled lease refresh; safe to call often. */
    public boolean heartbeat() {
        return heartbeat.touch(item.ref(), owner);
    }

    /**
     * Starts one tracked sub-fetch. The worker holds the terminal mark until every
     * submitted sub-fetch has finished.
     */
    public <R> Future<Result<R>> submit(Callable<R> task) {
        ItemRef ref = item.ref();
        pendingFetches.register(ref, 1);
        try {
            Future<Result<R>> future = subFetchExecutor.submit(() -> runTracked(task));
            synchronized (submitted) {
                submitted.add(future);
            }
            return future;
        } catch (RuntimeException e) {
            pendingFetches.complete(ref);
            throw e;
        }
    }

    /**
     * Runs the tasks on the sub-fetch pool and waits for all of them. Results come back in
     * task order, whatever order they finished in.
     */
    public <R> List<Result<R>> fanOut(List<? extends Callable<R>> tasks) throws InterruptedException {
        List<Future<Result<R>>> futures = new ArrayList<>(tasks.size());
        for (Callable<R> task : tasks) {
            futures.add(submit(task));
        }
        List<Result<R>> out = new ArrayList<>(futures.size());
        for (Future<Result<R>> f : futures) {
            try {
                out.add(f.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                out.add(Result.fail(ErrorKind.of(cause), String.valueOf(cause.getMessage())));
            }
        }
        return out;
    }

    /** Cancels sub-fetches that have not finished; returns how many were still pending. */
    int cancelOutstanding() {
        int cancelled = 0;
        synchronized (submitted) {
            for (Future<?> f : submitted) {
                if (!f.isDone() && f.cancel(true)) {
                    cancelled++;
                }
            }
        }
        return cancelled;
    }

    private <R> Result<R> runTracked(Callable<R> task) {
        try {
            return Result.ok(task.call());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.transientFailure("interrupted");
        } catch (Exception e) {
            return Result.fail(ErrorKind.of(e), String.valueOf(e.getMessage()));
        } finally {
            try {
                heartbeat.touch(item.ref(), owner);
            } finally {
                pendingFetches.complete(item.ref());
            }
        }
    }
}

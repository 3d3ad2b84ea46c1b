package io.harvestcore.runtime;

import io.harvestcore.model.CompletionState;
import io.harvestcore.model.CoordinationException;
import io.harvestcore.model.ErrorKind;
import io.harvestcore.model.ItemRef;
import io.harvestcore.model.StoreException;
import io.harvestcore.model.WorkItem;
import io.harvestcore.queue.CircuitBreaker;
import io.harvestcore.queue.CompletionDetector;
import io.harvestcore.queue.RetryBackoff;
import io.harvestcore.scraper.ItemProcessor;
import io.harvestcore.scraper.ProcessingResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * One worker thread's loop: claim a batch, process each item, keep the lease alive, and
 * record the outcome. Empty claims trigger recovery and a completion check.
 */
public final class QueueWorker {
    private static final Duration SUBFETCH_DRAIN_TIMEOUT = Duration.ofMinutes(10);
    private static final Duration MIN_CIRCUIT_WAIT = Duration.ofMillis(50);

    private final QueueComponents components;
    private final CoordinationContext ctx;
    private final String runId;
    private final String workerId;
    private final ItemProcessor processor;
    private final CircuitBreaker breaker;
    private final ExecutorService subFetchExecutor;
    private final WorkerStats stats;
    private volatile boolean stopped;
    private Duration subFetchDrainTimeout = SUBFETCH_DRAIN_TIMEOUT;

    public QueueWorker(QueueComponents components, String runId, String workerId, ItemProcessor processor,
                       String dependency, ExecutorService subFetchExecutor, WorkerStats stats) {
        this.components = components;
        this.ctx = components.context();
        this.runId = runId;
        this.workerId = workerId;
        this.processor = processor;
        this.breaker = components.breakers().forDependency(dependency);
        this.subFetchExecutor = subFetchExecutor;
        this.stats = stats;
    }

    public String workerId() {
        return workerId;
    }

    public void stop() {
        stopped = true;
    }

    void subFetchDrainTimeout(Duration timeout) {
        this.subFetchDrainTimeout = timeout;
    }

    /** Works until the run is complete or the worker is stopped. */
    public CompletionState run() throws InterruptedException {
        return loop(false);
    }

    /** Works until nothing is claimable right now. */
    public CompletionState drain() throws InterruptedException {
        return loop(true);
    }

    private CompletionState loop(boolean exitWhenIdle) throws InterruptedException {
        CompletionState last = CompletionState.HAS_WORK;
        int storeFailures = 0;
        while (!stopped) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("worker " + workerId + " interrupted");
            }
            if (!breaker.allowRequest()) {
                Duration wait = breaker.remainingCooldown();
                ctx.sleeper().sleep(wait.compareTo(MIN_CIRCUIT_WAIT) < 0 ? MIN_CIRCUIT_WAIT : wait);
                continue;
            }
            List<WorkItem> batch;
            try {
                batch = components.queue().claim(runId, workerId);
                storeFailures = 0;
            } catch (StoreException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                // The queue already reconnected once; back off and try the whole claim again.
                breaker.recordFailure();
                stats.storeRetry();
                ctx.sleeper().sleep(Duration.ofMillis(components.backoff().delayFor(storeFailures++)));
                continue;
            }
            if (batch.isEmpty()) {
                components.recovery().sweep(runId, ctx.settings().leaseTimeout(), ctx.settings().stuckTimeout(), workerId);
                stats.swept();
                CompletionDetector.Snapshot snapshot = components.completion().evaluate(runId);
                last = snapshot.state();
                switch (snapshot.state()) {
                    case COMPLETE:
                        return last;
                    case STUCK:
                        components.recovery().resolveStuck(runId, ctx.settings().leaseTimeout(),
                                snapshot.stats(), snapshot.stalledForMs(), workerId);
                        continue;
                    case HAS_WORK:
                        continue;
                    case EMPTY_RETRYABLE:
                    default:
                        if (exitWhenIdle) {
                            return last;
                        }
                        ctx.sleeper().sleep(Duration.ofMillis(ctx.settings().pollIntervalMs()));
                        continue;
                }
            }
            stats.claimed(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                WorkItem item = batch.get(i);
                if (stopped || !breaker.allowRequest()) {
                    // Hand back the rest of the batch without spending attempts.
                    releaseRemaining(batch.subList(i, batch.size()), stopped ? "worker stopped" : "circuit open");
                    break;
                }
                try {
                    process(item);
                } catch (InterruptedException | RuntimeException e) {
                    releaseRemaining(batch.subList(i + 1, batch.size()), "worker aborted");
                    throw e;
                }
            }
        }
        return last;
    }

    void process(WorkItem item) throws InterruptedException {
        ItemRef ref = item.ref();
        ItemContext context = new ItemContext(item, workerId, components.heartbeat(), subFetchExecutor,
                components.pendingFetches());
        try {
            ProcessingResult result;
            try {
                result = processor.process(context);
                if (result == null) {
                    result = ProcessingResult.failed(ErrorKind.BUSINESS, "processor returned no result");
                }
            } catch (InterruptedException e) {
                components.queue().release(item, workerId, "worker interrupted");
                stats.released();
                throw e;
            } catch (Exception e) {
                result = ProcessingResult.failed(ErrorKind.of(e), e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (!components.pendingFetches().awaitDrained(ref, subFetchDrainTimeout)) {
                // Stragglers must not keep running against an item that goes back to the queue.
                int cancelled = context.cancelOutstanding();
                result = ProcessingResult.failed(ErrorKind.TRANSIENT,
                        "sub-fetches still outstanding, cancelled " + cancelled);
            }
            apply(item, result);
        } finally {
            components.heartbeat().forget(ref);
            components.pendingFetches().forget(ref);
        }
    }

    private void apply(WorkItem item, ProcessingResult result) {
        switch (result.disposition()) {
            case COMPLETED:
            case ZERO_RESULT:
                breaker.recordSuccess();
                markTerminal(item, result);
                return;
            case BLOCKED:
                markTerminal(item, result);
                return;
            case FAILED:
            default:
                break;
        }
        ErrorKind kind = result.errorKind() == null ? ErrorKind.BUSINESS : result.errorKind();
        if (kind == ErrorKind.FATAL) {
            components.queue().release(item, workerId, result.error());
            stats.released();
            throw new CoordinationException(ErrorKind.FATAL,
                    "Fatal failure processing " + item.ref() + ": " + result.error());
        }
        if (kind == ErrorKind.TRANSIENT) {
            breaker.recordFailure();
        }
        RetryBackoff.RequeueResolution resolution = components.backoff().requeue(item, workerId, result.error());
        switch (resolution.outcome()) {
            case REQUEUED:
                stats.requeued();
                break;
            case EXHAUSTED:
                stats.terminal();
                stats.failed();
                break;
            case STALE_LEASE:
            default:
                stats.leaseConflict();
                break;
        }
    }

    private void markTerminal(WorkItem item, ProcessingResult result) {
        boolean applied = components.queue().markTerminalOwned(
                item, workerId, result.disposition().terminalStatus(), result.error(), result.resultFields());
        if (applied) {
            stats.terminal();
        } else {
            stats.leaseConflict();
        }
    }

    private void releaseRemaining(List<WorkItem> rest, String reason) {
        for (WorkItem item : rest) {
            if (components.queue().release(item, workerId, reason)) {
                stats.released();
            }
        }
    }
}

package io.harvestcore.runtime;

import io.harvestcore.model.CompletionState;
import io.harvestcore.model.CoordinationException;
import io.harvestcore.model.ErrorKind;
import io.harvestcore.scraper.Claimable;
import io.harvestcore.scraper.ItemProcessor;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed number of identical queue workers for one run and joins them.
 */
public final class WorkerPool {
    private final QueueComponents components;
    private final int workers;
    private final int subFetchParallelism;
    private final String ownerPrefix;

    public WorkerPool(QueueComponents components, int workers) {
        this(components, workers, components.context().settings().subFetchParallelism(), defaultOwnerPrefix());
    }

    public WorkerPool(QueueComponents components, int workers, int subFetchParallelism, String ownerPrefix) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        if (subFetchParallelism <= 0) {
            throw new IllegalArgumentException("subFetchParallelism must be > 0");
        }
        this.components = components;
        this.workers = workers;
        this.subFetchParallelism = subFetchParallelism;
        this.ownerPrefix = ownerPrefix;
    }

    public RunSummary run(String runId, Claimable scraper) throws InterruptedException {
        return run(runId, scraper.itemProcessor(), scraper.dependency(), false);
    }

    public RunSummary drain(String runId, Claimable scraper) throws InterruptedException {
        return run(runId, scraper.itemProcessor(), scraper.dependency(), true);
    }

    /**
     * Starts the workers and waits for all of them. The first fatal failure stops the
     * remaining workers and is rethrown.
     */
    public RunSummary run(String runId, ItemProcessor processor, String dependency, boolean drainOnly)
            throws InterruptedException {
        WorkerStats stats = new WorkerStats();
        ExecutorService workerExecutor = Executors.newFixedThreadPool(workers, named("harvest-worker-" + runId));
        ExecutorService subFetchExecutor = Executors.newFixedThreadPool(subFetchParallelism, named("harvest-subfetch-" + runId));
        List<QueueWorker> queueWorkers = new ArrayList<>();
        List<Future<CompletionState>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                QueueWorker worker = new QueueWorker(components, runId, ownerPrefix + "-" + i, processor,
                        dependency, subFetchExecutor, stats);
                queueWorkers.add(worker);
                Callable<CompletionState> task = drainOnly ? worker::drain : worker::run;
                futures.add(workerExecutor.submit(task));
            }
            RuntimeException firstFailure = null;
            for (Future<CompletionState> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    for (QueueWorker w : queueWorkers) {
                        w.stop();
                    }
                    if (firstFailure == null) {
                        firstFailure = asRuntime(e.getCause());
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
        } catch (InterruptedException e) {
            for (QueueWorker w : queueWorkers) {
                w.stop();
            }
            workerExecutor.shutdownNow();
            throw e;
        } finally {
            shutdown(workerExecutor);
            shutdown(subFetchExecutor);
        }
        CompletionState finalState = components.completion().status(runId);
        return new RunSummary(runId, workers, finalState, stats.snapshot());
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new CoordinationException(ErrorKind.of(cause), "Worker failed: " + cause.getMessage(), cause);
    }

    private static void shutdown(ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static String defaultOwnerPrefix() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return host + "-" + ProcessHandle.current().pid();
    }

    public record RunSummary(String runId, int workers, CompletionState finalState, WorkerStats.Snapshot stats) {
    }
}

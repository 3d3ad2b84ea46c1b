package io.harvestcore.runtime;

import io.harvestcore.queue.CircuitBreakers;
import io.harvestcore.queue.CompletionDetector;
import io.harvestcore.queue.LeaseHeartbeat;
import io.harvestcore.queue.RetryBackoff;
import io.harvestcore.queue.StaleRecovery;
import io.harvestcore.queue.StuckDetector;
import io.harvestcore.queue.WorkQueue;

/**
 * Queue-side collaborators shared by every worker of a process.
 */
public record QueueComponents(
        CoordinationContext context,
        WorkQueue queue,
        LeaseHeartbeat heartbeat,
        StaleRecovery recovery,
        CompletionDetector completion,
        RetryBackoff backoff,
        CircuitBreakers breakers,
        PendingFetchTracker pendingFetches
) {
    public static QueueComponents create(CoordinationContext ctx) {
        WorkQueue queue = new WorkQueue(ctx);
        StuckDetector stuck = new StuckDetector(ctx);
        return new QueueComponents(
                ctx,
                queue,
                new LeaseHeartbeat(ctx),
                new StaleRecovery(ctx, queue, stuck),
                new CompletionDetector(ctx, queue, stuck),
                new RetryBackoff(ctx, queue),
                new CircuitBreakers(ctx),
                new PendingFetchTracker()
        );
    }
}

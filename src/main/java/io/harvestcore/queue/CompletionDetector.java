package io.harvestcore.queue;

import io.harvestcore.model.CompletionState;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.ItemFilter;

public final class CompletionDetector {
    private final CoordinationContext ctx;
    private final WorkQueue queue;
    private final StuckDetector stuckDetector;

    public CompletionDetector(CoordinationContext ctx, WorkQueue queue, StuckDetector stuckDetector) {
        this.ctx = ctx;
        this.queue = queue;
        this.stuckDetector = stuckDetector;
    }

    public CompletionState status(String runId) {
        return evaluate(runId).state();
    }

    /** STUCK is checked before HAS_WORK since it asks the caller to run recovery. */
    public Snapshot evaluate(String runId) {
        QueueStats stats = queue.stats(runId);
        if (stats.remaining() == 0) {
            stuckDetector.reset(runId);
            return new Snapshot(CompletionState.COMPLETE, stats, 0, 0L);
        }
        StuckDetector.Observation observation = stuckDetector.observe(stats);
        int claimable = claimableCount(runId);
        if (observation.stuck()) {
            return new Snapshot(CompletionState.STUCK, stats, claimable, observation.stalledForMs());
        }
        CompletionState state = claimable > 0 ? CompletionState.HAS_WORK : CompletionState.EMPTY_RETRYABLE;
        return new Snapshot(state, stats, claimable, observation.stalledForMs());
    }

    private int claimableCount(String runId) {
        ItemFilter filter = ItemFilter.forRun(runId)
                .status(WorkItemStatus.PENDING)
                .leaseDue(ctx.nowMs())
                .attemptsBelow(ctx.settings().maxAttempts());
        int n = 0;
        for (int c : ctx.store().aggregateCounts("status", filter).values()) {
            n += c;
        }
        return n;
    }

    public record Snapshot(CompletionState state, QueueStats stats, int claimable, long stalledForMs) {
    }
}

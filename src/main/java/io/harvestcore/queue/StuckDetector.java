package io.harvestcore.queue;

import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.StoreAdapter.StuckWatch;

import java.util.Optional;

/**
 * Tracks how long a nearly finished run has sat at the same remaining count. The first
 * observation is persisted so the timer survives worker restarts.
 */
public final class StuckDetector {
    private final CoordinationContext ctx;

    public StuckDetector(CoordinationContext ctx) {
        this.ctx = ctx;
    }

    public Observation observe(QueueStats stats) {
        return observe(stats, ctx.settings().stuckTimeoutMs());
    }

    public Observation observe(QueueStats stats, long stuckTimeoutMs) {
        String runId = stats.runId();
        if (stats.remaining() == 0 || stats.terminalPct() <= ctx.settings().stuckThresholdPct()) {
            ctx.store().clearStuckWatch(runId);
            return Observation.notNearCompletion();
        }
        long nowMs = ctx.nowMs();
        Optional<StuckWatch> existing = ctx.store().readStuckWatch(runId);
        if (existing.isEmpty() || existing.get().remaining() != stats.remaining()) {
            ctx.store().writeStuckWatch(new StuckWatch(runId, stats.remaining(), nowMs));
            return Observation.watching(0L);
        }
        long elapsed = nowMs - existing.get().sinceMs();
        return elapsed > stuckTimeoutMs ? Observation.stuck(elapsed) : Observation.watching(elapsed);
    }

    public void reset(String runId) {
        ctx.store().clearStuckWatch(runId);
    }

    public record Observation(State state, long stalledForMs) {
        public enum State {
            NOT_NEAR_COMPLETION,
            WATCHING,
            STUCK
        }

        static Observation notNearCompletion() {
            return new Observation(State.NOT_NEAR_COMPLETION, 0L);
        }

        static Observation watching(long elapsedMs) {
            return new Observation(State.WATCHING, elapsedMs);
        }

        static Observation stuck(long elapsedMs) {
            return new Observation(State.STUCK, elapsedMs);
        }

        public boolean stuck() {
            return state == State.STUCK;
        }
    }
}

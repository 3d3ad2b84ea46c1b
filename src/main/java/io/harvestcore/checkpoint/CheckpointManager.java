package io.harvestcore.checkpoint;

import io.harvestcore.model.RunStatus;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.runtime.CoordinationContext;
import io.harvestcore.storage.CheckpointStore;
import io.harvestcore.util.Jsons;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-run step checkpoints. A step counts as done only while its flag is set and,
 * when verification is requested, every declared output still exists on disk.
 */
public final class CheckpointManager {
    private final CoordinationContext ctx;
    private final CheckpointStore store;

    public CheckpointManager(CoordinationContext ctx, CheckpointStore store) {
        this.ctx = ctx;
        this.store = store;
    }

    public void markStepStarted(String runId, int stepNumber, String stepName) {
        requireStep(runId, stepNumber);
        ensureRun(runId);
        store.upsertStarted(runId, stepNumber, stepName, ctx.nowMs());
    }

    public StepRecord markStepComplete(String runId, int stepNumber, String stepName,
                                       List<Path> outputs, Map<String, Object> metadata) {
        return markStepComplete(runId, stepNumber, stepName, outputs, metadata, null);
    }

    /**
     * Records completion. Without an explicit {@code duration} it is measured from
     * {@link #markStepStarted}, or failing that from the previous step's completion.
     */
    public StepRecord markStepComplete(String runId, int stepNumber, String stepName,
                                       List<Path> outputs, Map<String, Object> metadata, Duration duration) {
        requireStep(runId, stepNumber);
        ensureRun(runId);
        long nowMs = ctx.nowMs();
        Long startedAtMs;
        long durationMs;
        if (duration != null) {
            durationMs = Math.max(0L, duration.toMillis());
            startedAtMs = nowMs - durationMs;
        } else {
            startedAtMs = store.findStep(runId, stepNumber)
                    .map(CheckpointStore.StepRow::startedAtMs)
                    .orElse(null);
            if (startedAtMs == null) {
                startedAtMs = previousCompletion(runId, stepNumber).orElse(nowMs);
            }
            durationMs = Math.max(0L, nowMs - startedAtMs);
        }
        List<String> outputStrings = new ArrayList<>();
        if (outputs != null) {
            for (Path p : outputs) {
                outputStrings.add(p.toString());
            }
        }
        CheckpointStore.StepRow row = new CheckpointStore.StepRow(
                runId, stepNumber, stepName, true, startedAtMs, nowMs, durationMs,
                Jsons.toCompactJson(outputStrings),
                Jsons.toCompactJson(metadata == null ? Map.of() : metadata)
        );
        store.upsertCompleted(row);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("step_number", stepNumber);
        details.put("step_name", stepName);
        details.put("duration_ms", durationMs);
        details.put("outputs", outputStrings.size());
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "checkpoint.step_complete", "checkpoint", "pipeline_steps", "ok", runId, null, details));
        return StepRecord.fromRow(row);
    }

    public boolean isStepComplete(String runId, int stepNumber) {
        return isStepComplete(runId, stepNumber, true, null);
    }

    /**
     * @param expectedOutputs {@code null} checks the outputs recorded with the step; an empty
     *                        list skips the file check
     */
    public boolean isStepComplete(String runId, int stepNumber, boolean verifyOutputs, List<Path> expectedOutputs) {
        Optional<CheckpointStore.StepRow> row = store.findStep(runId, stepNumber);
        if (row.isEmpty() || !row.get().completed()) {
            return false;
        }
        if (!verifyOutputs) {
            return true;
        }
        List<Path> toCheck = expectedOutputs != null
                ? expectedOutputs
                : StepRecord.fromRow(row.get()).outputPaths();
        List<String> missing = new ArrayList<>();
        for (Path p : toCheck) {
            if (!ctx.store().exists(p)) {
                missing.add(p.toString());
            }
        }
        if (missing.isEmpty()) {
            return true;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("step_number", stepNumber);
        details.put("step_name", row.get().stepName());
        details.put("missing_outputs", missing);
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "checkpoint.invalidated", "checkpoint", "pipeline_steps", "rerun", runId, null, details));
        return false;
    }

    /** Lowest step number from 0 that is not complete, verifying recorded outputs. */
    public int nextStep(String runId) {
        Map<Integer, CheckpointStore.StepRow> byNumber = new HashMap<>();
        for (CheckpointStore.StepRow row : store.listSteps(runId)) {
            byNumber.put(row.stepNumber(), row);
        }
        int step = 0;
        while (true) {
            CheckpointStore.StepRow row = byNumber.get(step);
            if (row == null || !row.completed() || !isStepComplete(runId, step, true, null)) {
                return step;
            }
            step++;
        }
    }

    public int clear(String runId) {
        int removed = store.deleteRun(runId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("steps_removed", removed);
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "checkpoint.clear", "checkpoint", "pipeline_steps", "ok", runId, null, details));
        return removed;
    }

    public List<StepRecord> steps(String runId) {
        List<StepRecord> out = new ArrayList<>();
        for (CheckpointStore.StepRow row : store.listSteps(runId)) {
            out.add(StepRecord.fromRow(row));
        }
        return out;
    }

    public PipelineTiming timing(String runId) {
        List<PipelineTiming.StepTiming> timings = new ArrayList<>();
        PipelineTiming.StepTiming slowest = null;
        long total = 0L;
        Long startedAt = null;
        Long completedAt = null;
        for (CheckpointStore.StepRow row : store.listSteps(runId)) {
            if (row.startedAtMs() != null && (startedAt == null || row.startedAtMs() < startedAt)) {
                startedAt = row.startedAtMs();
            }
            if (!row.completed() || row.durationMs() == null) {
                continue;
            }
            PipelineTiming.StepTiming t = new PipelineTiming.StepTiming(row.stepNumber(), row.stepName(), row.durationMs());
            timings.add(t);
            total += t.durationMs();
            if (slowest == null || t.durationMs() > slowest.durationMs()) {
                slowest = t;
            }
            if (row.completedAtMs() != null && (completedAt == null || row.completedAtMs() > completedAt)) {
                completedAt = row.completedAtMs();
            }
        }
        return new PipelineTiming(runId, total, slowest, timings, startedAt, completedAt);
    }

    public void markRunStatus(String runId, RunStatus status) {
        requireRunId(runId);
        store.upsertRunStatus(runId, status, ctx.nowMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.dbValue());
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "pipeline.status", "checkpoint", "pipeline_runs", status.dbValue(), runId, null, details));
    }

    public Optional<RunStatus> runStatus(String runId) {
        return store.findRun(runId).map(CheckpointStore.RunRow::status);
    }

    /**
     * Makes {@code owner} the only driver of the run. Another driver's lock is taken over
     * only once its heartbeat is older than the lease timeout.
     */
    public boolean tryAcquireRun(String runId, String owner) {
        requireRunId(runId);
        long nowMs = ctx.nowMs();
        boolean acquired = store.tryLockRun(runId, owner, nowMs, staleBefore(nowMs));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("owner", owner);
        if (!acquired) {
            store.findRun(runId).ifPresent(run -> {
                details.put("holder", run.driverOwner());
                details.put("heartbeat_at_ms", run.heartbeatAtMs());
            });
        }
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "pipeline.lock", owner, "pipeline_runs", acquired ? "acquired" : "rejected", runId, null, details));
        return acquired;
    }

    public boolean heartbeatRun(String runId, String owner) {
        return store.heartbeatRun(runId, owner, ctx.nowMs());
    }

    /**
     * Records the final status and drops the lock. Returns false when the lock was lost to
     * another driver, whose status is then left alone.
     */
    public boolean releaseRun(String runId, String owner, RunStatus status) {
        boolean released = store.unlockRun(runId, owner, status, ctx.nowMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.dbValue());
        details.put("owner", owner);
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "pipeline.status", owner, "pipeline_runs", released ? status.dbValue() : "lock_lost",
                runId, null, details));
        return released;
    }

    /** Marks a run left {@code running} by a dead driver as {@code resume}. */
    public boolean recoverIfStale(String runId) {
        requireRunId(runId);
        long nowMs = ctx.nowMs();
        Optional<CheckpointStore.RunRow> before = store.findRun(runId);
        if (!store.markStaleRunning(runId, staleBefore(nowMs), nowMs)) {
            return false;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        before.ifPresent(run -> {
            details.put("previous_owner", run.driverOwner());
            details.put("heartbeat_at_ms", run.heartbeatAtMs());
        });
        details.put("next_step", nextStep(runId));
        ctx.auditLogger().log(AuditLogger.AuditEvent.of(
                "pipeline.recover", "checkpoint", "pipeline_runs", RunStatus.RESUME.dbValue(), runId, null, details));
        return true;
    }

    /** True when the run exists, is not completed, and no live driver holds it. */
    public boolean isResumable(String runId) {
        Optional<CheckpointStore.RunRow> run = store.findRun(runId);
        if (run.isEmpty()) {
            return false;
        }
        return switch (run.get().status()) {
            case COMPLETED -> false;
            case RESUME, FAILED -> true;
            case RUNNING -> run.get().driverOwner() == null
                    || run.get().heartbeatAtMs() == null
                    || run.get().heartbeatAtMs() < staleBefore(ctx.nowMs());
        };
    }

    private long staleBefore(long nowMs) {
        return nowMs - ctx.settings().leaseTimeoutMs();
    }

    private void ensureRun(String runId) {
        if (store.findRun(runId).isEmpty()) {
            store.upsertRunStatus(runId, RunStatus.RUNNING, ctx.nowMs());
        }
    }

    private Optional<Long> previousCompletion(String runId, int stepNumber) {
        Long best = null;
        for (CheckpointStore.StepRow row : store.listSteps(runId)) {
            if (row.stepNumber() < stepNumber && row.completed() && row.completedAtMs() != null) {
                best = row.completedAtMs();
            }
        }
        return Optional.ofNullable(best);
    }

    private static void requireRunId(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
    }

    private static void requireStep(String runId, int stepNumber) {
        requireRunId(runId);
        if (stepNumber < 0) {
            throw new IllegalArgumentException("stepNumber must be >= 0, got " + stepNumber);
        }
    }
}

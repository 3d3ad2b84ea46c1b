package io.harvestcore.runtime;

import io.harvestcore.checkpoint.CheckpointManager;
import io.harvestcore.model.CoordinationException;
import io.harvestcore.model.ErrorKind;
import io.harvestcore.model.Result;
import io.harvestcore.model.RunStatus;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.scraper.PipelineStep;
import io.harvestcore.scraper.StepContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs pipeline steps in number order, skipping those whose checkpoint still holds. Only one
 * driver works a run at a time; a run whose driver died is taken over once its heartbeat
 * goes stale.
 */
public final class PipelineDriver {
    private final CheckpointManager checkpoints;
    private final QueueComponents components;
    private final WorkerPool workerPool;
    private final String driverId;

    public PipelineDriver(CheckpointManager checkpoints, QueueComponents components, WorkerPool workerPool) {
        this(checkpoints, components, workerPool,
                "driver-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8));
    }

    public PipelineDriver(CheckpointManager checkpoints, QueueComponents components, WorkerPool workerPool,
                          String driverId) {
        this.checkpoints = checkpoints;
        this.components = components;
        this.workerPool = workerPool;
        this.driverId = driverId;
    }

    public String driverId() {
        return driverId;
    }

    public PipelineOutcome run(String runId, List<PipelineStep> steps) {
        if (runId == null || runId.isBlank()) {
            throw new CoordinationException(ErrorKind.FATAL, "Pipeline run id is required");
        }
        checkpoints.recoverIfStale(runId);
        if (!checkpoints.tryAcquireRun(runId, driverId)) {
            throw new CoordinationException(ErrorKind.BUSINESS,
                    "Pipeline run " + runId + " is held by another live driver");
        }
        ScheduledExecutorService heartbeat = startHeartbeat(runId);
        try {
            return runSteps(runId, steps);
        } finally {
            heartbeat.shutdownNow();
        }
    }

    private PipelineOutcome runSteps(String runId, List<PipelineStep> steps) {
        List<PipelineStep> ordered = new ArrayList<>(steps);
        ordered.sort(Comparator.comparingInt(PipelineStep::number));

        List<Integer> skipped = new ArrayList<>();
        List<Integer> executed = new ArrayList<>();
        for (PipelineStep step : ordered) {
            checkpoints.heartbeatRun(runId, driverId);
            List<Path> expected = step.expectedOutputs().isEmpty() ? null : step.expectedOutputs();
            if (checkpoints.isStepComplete(runId, step.number(), true, expected)) {
                skipped.add(step.number());
                continue;
            }
            checkpoints.markStepStarted(runId, step.number(), step.name());
            Result<Map<String, Object>> result;
            try {
                result = step.execute(new StepContext(runId, step.number(), components.queue(), workerPool));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                checkpoints.releaseRun(runId, driverId, RunStatus.FAILED);
                throw new CoordinationException(ErrorKind.TRANSIENT, "Pipeline interrupted at step " + step.number(), e);
            } catch (Exception e) {
                checkpoints.releaseRun(runId, driverId, RunStatus.FAILED);
                throw new CoordinationException(ErrorKind.of(e),
                        "Step " + step.number() + " (" + step.name() + ") failed: " + e.getMessage(), e);
            }
            if (!result.ok()) {
                checkpoints.releaseRun(runId, driverId, RunStatus.FAILED);
                ErrorKind kind = result.errorKind().orElse(ErrorKind.BUSINESS);
                return PipelineOutcome.failed(runId, step.number(), kind, result.error(), skipped, executed);
            }
            checkpoints.markStepComplete(runId, step.number(), step.name(), step.expectedOutputs(),
                    result.value() == null ? Map.of() : result.value());
            executed.add(step.number());
        }
        checkpoints.releaseRun(runId, driverId, RunStatus.COMPLETED);
        return PipelineOutcome.completed(runId, skipped, executed);
    }

    private ScheduledExecutorService startHeartbeat(String runId) {
        long everyMs = Math.max(1_000L, components.context().settings().leaseTimeoutMs() / 3);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "harvest-pipeline-heartbeat-" + runId);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                checkpoints.heartbeatRun(runId, driverId);
            } catch (RuntimeException e) {
                // The next beat retries.
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
                components.context().auditLogger().log(AuditLogger.AuditEvent.of(
                        "pipeline.heartbeat", driverId, "pipeline_runs", "error", runId, null, details));
            }
        }, everyMs, everyMs, TimeUnit.MILLISECONDS);
        return scheduler;
    }

    public record PipelineOutcome(
            String runId,
            RunStatus status,
            Integer failedStep,
            ErrorKind errorKind,
            String error,
            List<Integer> skippedSteps,
            List<Integer> executedSteps
    ) {
        static PipelineOutcome completed(String runId, List<Integer> skipped, List<Integer> executed) {
            return new PipelineOutcome(runId, RunStatus.COMPLETED, null, null, null, List.copyOf(skipped), List.copyOf(executed));
        }

        static PipelineOutcome failed(String runId, int step, ErrorKind kind, String error,
                                      List<Integer> skipped, List<Integer> executed) {
            return new PipelineOutcome(runId, RunStatus.FAILED, step, kind, error, List.copyOf(skipped), List.copyOf(executed));
        }
    }
}

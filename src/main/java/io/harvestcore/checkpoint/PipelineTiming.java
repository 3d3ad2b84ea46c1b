package io.harvestcore.checkpoint;

import java.util.List;

public record PipelineTiming(
        String runId,
        long totalDurationMs,
        StepTiming slowestStep,
        List<StepTiming> steps,
        Long startedAtMs,
        Long completedAtMs
) {
    public record StepTiming(int stepNumber, String stepName, long durationMs) {
    }
}

package io.harvestcore.checkpoint;

import io.harvestcore.storage.CheckpointStore;
import io.harvestcore.util.Jsons;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record StepRecord(
        String runId,
        int stepNumber,
        String stepName,
        boolean completed,
        Long startedAtMs,
        Long completedAtMs,
        Long durationMs,
        List<String> outputs,
        Map<String, Object> metadata
) {
    static StepRecord fromRow(CheckpointStore.StepRow row) {
        return new StepRecord(
                row.runId(),
                row.stepNumber(),
                row.stepName(),
                row.completed(),
                row.startedAtMs(),
                row.completedAtMs(),
                row.durationMs(),
                Jsons.toStringList(row.outputsJson()),
                Jsons.toMap(row.metadataJson())
        );
    }

    public List<Path> outputPaths() {
        List<Path> out = new ArrayList<>(outputs.size());
        for (String p : outputs) {
            out.add(Paths.get(p));
        }
        return out;
    }
}

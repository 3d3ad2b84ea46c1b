package io.harvestcore.scraper;

import io.harvestcore.model.Result;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One numbered stage of a scraper pipeline. A successful result carries the metadata
 * stored with the checkpoint.
 */
public interface PipelineStep {
    int number();

    String name();

    /** Files the step must leave behind; a missing one makes the step run again. */
    default List<Path> expectedOutputs() {
        return List.of();
    }

    Result<Map<String, Object>> execute(StepContext context) throws Exception;
}

package io.harvestcore.scraper;

import java.util.List;

public interface Checkpointable extends Scraper {
    List<PipelineStep> steps();
}

package io.harvestcore.scraper;

import io.harvestcore.queue.WorkQueue;
import io.harvestcore.runtime.WorkerPool;

public record StepContext(String runId, int stepNumber, WorkQueue queue, WorkerPool workerPool) {
}

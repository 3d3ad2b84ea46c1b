/**
 * Runtime orchestration package.
 *
 * <p>{@link io.harvestcore.runtime.HarvestRuntime} owns the wiring; {@link io.harvestcore.runtime.QueueWorker}
 * and {@link io.harvestcore.runtime.WorkerPool} run the claim loop, and
 * {@link io.harvestcore.runtime.PipelineDriver} resumes pipelines from their checkpoints.
 */
package io.harvestcore.runtime;

/**
 * HarvestCore source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.harvestcore.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.harvestcore.cli.HarvestCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.harvestcore.runtime.HarvestRuntime} wires the store, queue, checkpoints and scrapers.</li>
 *   <li>{@code io.harvestcore.queue.WorkQueue} is the lease-based claim path.</li>
 *   <li>{@code io.harvestcore.checkpoint.CheckpointManager} records resumable pipeline progress.</li>
 * </ul>
 */
package io.harvestcore;

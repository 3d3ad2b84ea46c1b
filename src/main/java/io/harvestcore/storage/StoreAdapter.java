package io.harvestcore.storage;

import io.harvestcore.model.WorkItem;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence seam for the work queue. Implementations throw
 * {@link io.harvestcore.model.StoreException} tagged TRANSIENT or FATAL.
 */
public interface StoreAdapter {

    /**
     * Selects up to {@code limit} rows matching {@code filter} in {@code order} and applies
     * {@code set} to exactly those rows in one transaction. Concurrent callers never
     * receive the same row.
     */
    List<WorkItem> claimBatch(ItemFilter filter, ClaimOrder order, int limit, ItemUpdate set);

    int update(ItemFilter filter, ItemUpdate set);

    Map<String, Integer> aggregateCounts(String groupByColumn, ItemFilter filter);

    boolean exists(Path path);

    /** Inserts new pending items, ignoring keys already present in the run. */
    int insertPending(String runId, Collection<String> itemKeys);

    List<WorkItem> find(ItemFilter filter, int limit);

    Optional<StuckWatch> readStuckWatch(String runId);

    void writeStuckWatch(StuckWatch watch);

    void clearStuckWatch(String runId);

    record StuckWatch(String runId, int remaining, long sinceMs) {
    }
}

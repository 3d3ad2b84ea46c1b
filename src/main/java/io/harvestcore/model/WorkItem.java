package io.harvestcore.model;

import java.time.Instant;

public record WorkItem(
        String runId,
        String itemKey,
        WorkItemStatus status,
        String owner,
        Long leaseTimeMs,
        int attemptCount,
        int leaseExpiries,
        String lastError,
        String resultJson,
        long createdAtMs,
        long updatedAtMs
) {
    public ItemRef ref() {
        return new ItemRef(runId, itemKey);
    }

    public Instant leaseTime() {
        return leaseTimeMs == null ? null : Instant.ofEpochMilli(leaseTimeMs);
    }

    public boolean leaseExpired(long nowMs, long leaseTimeoutMs) {
        return leaseTimeMs != null && nowMs - leaseTimeMs >= leaseTimeoutMs;
    }
}

package io.harvestcore.storage;

import io.harvestcore.model.WorkItemStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Conjunction of predicates over {@code work_items}. Every filter is scoped to one run.
 */
public final class ItemFilter {
    private final String runId;
    private final List<String> clauses = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    private ItemFilter(String runId) {
        this.runId = runId;
        clauses.add("run_id=?");
        params.add(runId);
    }

    public static ItemFilter forRun(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        return new ItemFilter(runId);
    }

    public String runId() {
        return runId;
    }

    public ItemFilter status(WorkItemStatus status) {
        Objects.requireNonNull(status, "status");
        clauses.add("status=?");
        params.add(status.dbValue());
        return this;
    }

    public ItemFilter statusIn(Collection<WorkItemStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            throw new IllegalArgumentException("statuses must not be empty");
        }
        clauses.add("status IN (" + placeholders(statuses.size()) + ")");
        for (WorkItemStatus s : statuses) {
            params.add(s.dbValue());
        }
        return this;
    }

    public ItemFilter nonTerminal() {
        return statusIn(WorkItemStatus.activeStatuses());
    }

    public ItemFilter key(String itemKey) {
        clauses.add("item_key=?");
        params.add(itemKey);
        return this;
    }

    public ItemFilter owner(String owner) {
        clauses.add("owner=?");
        params.add(owner);
        return this;
    }

    /** Lease absent or not in the future: backoff has elapsed. */
    public ItemFilter leaseDue(long nowMs) {
        clauses.add("(lease_time_ms IS NULL OR lease_time_ms<=?)");
        params.add(nowMs);
        return this;
    }

    public ItemFilter leaseBefore(long cutoffMs) {
        clauses.add("lease_time_ms IS NOT NULL AND lease_time_ms<?");
        params.add(cutoffMs);
        return this;
    }

    public ItemFilter leaseAfter(long nowMs) {
        clauses.add("lease_time_ms IS NOT NULL AND lease_time_ms>?");
        params.add(nowMs);
        return this;
    }

    public ItemFilter attemptsBelow(int maxAttempts) {
        clauses.add("attempt_count<?");
        params.add(maxAttempts);
        return this;
    }

    public ItemFilter attemptsAtLeast(int attempts) {
        clauses.add("attempt_count>=?");
        params.add(attempts);
        return this;
    }

    public ItemFilter leaseExpiriesBelow(int limit) {
        clauses.add("lease_expiries<?");
        params.add(limit);
        return this;
    }

    public ItemFilter leaseExpiriesAtLeast(int limit) {
        clauses.add("lease_expiries>=?");
        params.add(limit);
        return this;
    }

    String whereSql() {
        return " WHERE " + String.join(" AND ", clauses);
    }

    List<Object> params() {
        return List.copyOf(params);
    }

    static String placeholders(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('?');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return whereSql().trim() + " " + params;
    }
}

package io.harvestcore.storage;

import io.harvestcore.model.WorkItemStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column assignments applied by {@link StoreAdapter#update} and {@link StoreAdapter#claimBatch}.
 * {@code updated_at_ms} is always stamped by the adapter.
 */
public final class ItemUpdate {
    private final Map<String, Object> assignments = new LinkedHashMap<>();
    private boolean incrementAttempts;
    private boolean incrementLeaseExpiries;

    public static ItemUpdate set() {
        return new ItemUpdate();
    }

    public ItemUpdate status(WorkItemStatus status) {
        assignments.put("status", status.dbValue());
        return this;
    }

    public ItemUpdate owner(String owner) {
        assignments.put("owner", owner);
        return this;
    }

    public ItemUpdate clearOwner() {
        assignments.put("owner", null);
        return this;
    }

    public ItemUpdate leaseTime(long leaseTimeMs) {
        assignments.put("lease_time_ms", leaseTimeMs);
        return this;
    }

    public ItemUpdate clearLease() {
        assignments.put("lease_time_ms", null);
        return this;
    }

    public ItemUpdate incrementAttempts() {
        this.incrementAttempts = true;
        return this;
    }

    public ItemUpdate incrementLeaseExpiries() {
        this.incrementLeaseExpiries = true;
        return this;
    }

    public ItemUpdate lastError(String error) {
        assignments.put("last_error", error);
        return this;
    }

    public ItemUpdate resultJson(String json) {
        assignments.put("result_json", json);
        return this;
    }

    public boolean isEmpty() {
        return assignments.isEmpty() && !incrementAttempts && !incrementLeaseExpiries;
    }

    String setSql() {
        List<String> parts = new ArrayList<>();
        for (String column : assignments.keySet()) {
            parts.add(column + "=?");
        }
        if (incrementAttempts) {
            parts.add("attempt_count=attempt_count+1");
        }
        if (incrementLeaseExpiries) {
            parts.add("lease_expiries=lease_expiries+1");
        }
        parts.add("updated_at_ms=?");
        return String.join(",", parts);
    }

    List<Object> params(long nowMs) {
        List<Object> out = new ArrayList<>(assignments.values());
        out.add(nowMs);
        return out;
    }

    @Override
    public String toString() {
        return assignments + (incrementAttempts ? " +attempt" : "") + (incrementLeaseExpiries ? " +lease_expiry" : "");
    }
}

package io.harvestcore.storage;

public enum ClaimOrder {
    /** Fewest attempts first so fresh work is not starved by retries, then by key for stable batches. */
    ATTEMPTS_THEN_KEY("attempt_count ASC, item_key ASC"),
    KEY("item_key ASC");

    private final String sql;

    ClaimOrder(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}

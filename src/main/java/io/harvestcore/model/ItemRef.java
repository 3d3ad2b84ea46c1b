package io.harvestcore.model;

import java.util.Objects;

/** Identity of one work item: the item key is unique within its run. */
public record ItemRef(String runId, String itemKey) {
    public ItemRef {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(itemKey, "itemKey");
    }

    @Override
    public String toString() {
        return runId + "/" + itemKey;
    }
}

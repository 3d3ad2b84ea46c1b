package io.harvestcore.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum WorkItemStatus {
    PENDING(false),
    IN_PROGRESS(false),
    COMPLETED(true),
    ZERO_RESULT(true),
    FAILED(true),
    BLOCKED(true);

    private final boolean terminal;

    WorkItemStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean terminal() {
        return terminal;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkItemStatus fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("work item status must not be blank");
        }
        return WorkItemStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public static Set<WorkItemStatus> terminalStatuses() {
        return EnumSet.of(COMPLETED, ZERO_RESULT, FAILED, BLOCKED);
    }

    public static Set<WorkItemStatus> activeStatuses() {
        return EnumSet.of(PENDING, IN_PROGRESS);
    }
}

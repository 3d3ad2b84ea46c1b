package io.harvestcore.model;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    /** Left running by a driver that stopped heartbeating; the next driver picks it up. */
    RESUME,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromDb(String raw) {
        return RunStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

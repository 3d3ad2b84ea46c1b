package io.harvestcore.runtime;

import io.harvestcore.config.CoordinationSettings;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.storage.StoreAdapter;

import java.time.Clock;
import java.util.Objects;

/**
 * Everything a coordination component needs, passed explicitly instead of held in globals.
 */
public record CoordinationContext(
        CoordinationSettings settings,
        StoreAdapter store,
        Clock clock,
        AuditLogger auditLogger,
        Sleeper sleeper
) {
    public CoordinationContext {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(auditLogger, "auditLogger");
        Objects.requireNonNull(sleeper, "sleeper");
    }

    public long nowMs() {
        return clock.millis();
    }

    public CoordinationContext withSettings(CoordinationSettings next) {
        return new CoordinationContext(next, store, clock, auditLogger, sleeper);
    }
}

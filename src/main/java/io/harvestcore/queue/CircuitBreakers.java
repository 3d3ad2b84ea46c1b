package io.harvestcore.queue;

import io.harvestcore.runtime.CoordinationContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** One breaker per named dependency, process-local. */
public final class CircuitBreakers {
    private final CoordinationContext ctx;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakers(CoordinationContext ctx) {
        this.ctx = ctx;
    }

    public CircuitBreaker forDependency(String dependency) {
        if (dependency == null || dependency.isBlank()) {
            throw new IllegalArgumentException("dependency must not be blank");
        }
        return breakers.computeIfAbsent(dependency, name -> new CircuitBreaker(
                name,
                ctx.settings().circuitFailureThreshold(),
                Duration.ofMillis(ctx.settings().circuitCooldownMs()),
                ctx.clock(),
                ctx.auditLogger()
        ));
    }

    public List<CircuitBreaker.Snapshot> snapshots() {
        List<CircuitBreaker.Snapshot> out = new ArrayList<>();
        for (CircuitBreaker b : breakers.values()) {
            out.add(b.snapshot());
        }
        return out;
    }
}

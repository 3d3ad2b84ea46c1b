package io.harvestcore.runtime;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        long ms = duration.toMillis();
        if (ms > 0) {
            Thread.sleep(ms);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}

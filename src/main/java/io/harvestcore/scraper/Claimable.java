package io.harvestcore.scraper;

/**
 * A scraper whose work is a queue of items claimed by worker threads.
 */
public interface Claimable extends Scraper {
    ItemProcessor itemProcessor();

    /** Name of the upstream dependency guarded by a circuit breaker. */
    default String dependency() {
        return name();
    }
}

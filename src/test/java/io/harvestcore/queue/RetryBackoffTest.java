package io.harvestcore.queue;

import io.harvestcore.model.WorkItem;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.runtime.HarvestFixture;
import io.harvestcore.storage.ItemFilter;
import io.harvestcore.storage.ItemUpdate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class RetryBackoffTest {

    @Test
    void delayDoublesUntilCapped() {
        Assertions.assertEquals(2_000L, RetryBackoff.delayFor(0, 2_000L, 60_000L, 0L));
        Assertions.assertEquals(4_000L, RetryBackoff.delayFor(1, 2_000L, 60_000L, 0L));
        Assertions.assertEquals(16_000L, RetryBackoff.delayFor(3, 2_000L, 60_000L, 0L));
        Assertions.assertEquals(60_000L, RetryBackoff.delayFor(5, 2_000L, 60_000L, 0L));
        Assertions.assertEquals(60_000L, RetryBackoff.delayFor(200, 2_000L, 60_000L, 0L));
    }

    @Test
    void jitterStaysBelowBaseAndNeverShrinksTheSequence() {
        for (int round = 0; round < 50; round++) {
            long previous = 0L;
            for (int attempt = 0; attempt < 6; attempt++) {
                long delay = RetryBackoff.delayFor(attempt, 1_000L, 30_000L, 5_000L);
                long floor = Math.min(30_000L, 1_000L << attempt);
                Assertions.assertTrue(delay >= floor, "delay " + delay + " below " + floor);
                Assertions.assertTrue(delay < floor + 1_000L || delay == 30_000L);
                Assertions.assertTrue(delay >= previous);
                previous = delay;
            }
        }
    }

    @Test
    void requeuedItemWaitsOutItsBackoff() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            WorkQueue queue = fx.components.queue();
            RetryBackoff backoff = fx.components.backoff();
            queue.enqueue("run-r", List.of("k1"));
            WorkItem item = queue.claim("run-r", 3, 1, "w1").get(0);

            RetryBackoff.RequeueResolution resolution = backoff.requeue(item, "w1", "HTTP 503");
            Assertions.assertTrue(resolution.requeued());
            Assertions.assertTrue(resolution.delayMs() >= 2_000L && resolution.delayMs() < 2_250L);

            WorkItem stored = queue.get("run-r", "k1").orElseThrow();
            Assertions.assertEquals(WorkItemStatus.PENDING, stored.status());
            Assertions.assertNull(stored.owner());
            Assertions.assertEquals(1, stored.attemptCount());
            Assertions.assertEquals("HTTP 503", stored.lastError());
            Assertions.assertEquals(fx.clock.millis() + resolution.delayMs(), stored.leaseTimeMs());

            Assertions.assertTrue(queue.claim("run-r", 3, 1, "w2").isEmpty());
            fx.clock.advance(Duration.ofMillis(resolution.delayMs()));
            Assertions.assertEquals(1, queue.claim("run-r", 3, 1, "w2").size());
            Assertions.assertEquals(1, fx.audit("item.requeue").size());
        }
    }

    @Test
    void lastAttemptMarksTheItemFailed() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            WorkQueue queue = fx.components.queue();
            queue.enqueue("run-r", List.of("k1"));
            fx.store.update(ItemFilter.forRun("run-r").key("k1"), ItemUpdate.set().incrementAttempts());
            fx.store.update(ItemFilter.forRun("run-r").key("k1"), ItemUpdate.set().incrementAttempts());
            WorkItem item = queue.claim("run-r", 3, 1, "w1").get(0);

            RetryBackoff.RequeueResolution resolution = fx.components.backoff().requeue(item, "w1", "still broken");
            Assertions.assertEquals(RetryBackoff.RequeueResolution.Outcome.EXHAUSTED, resolution.outcome());

            WorkItem stored = queue.get("run-r", "k1").orElseThrow();
            Assertions.assertEquals(WorkItemStatus.FAILED, stored.status());
            Assertions.assertEquals(3, stored.attemptCount());
            Assertions.assertEquals("still broken", stored.lastError());
        }
    }

    @Test
    void requeueAfterLosingTheLeaseIsRejected() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            WorkQueue queue = fx.components.queue();
            queue.enqueue("run-r", List.of("k1"));
            WorkItem item = queue.claim("run-r", 3, 1, "slow").get(0);
            fx.clock.advance(Duration.ofMinutes(6));
            fx.components.recovery().sweep("run-r");
            queue.claim("run-r", 3, 1, "fast");

            RetryBackoff.RequeueResolution resolution = fx.components.backoff().requeue(item, "slow", "timeout");
            Assertions.assertEquals(RetryBackoff.RequeueResolution.Outcome.STALE_LEASE, resolution.outcome());
            WorkItem stored = queue.get("run-r", "k1").orElseThrow();
            Assertions.assertEquals("fast", stored.owner());
            Assertions.assertEquals(WorkItemStatus.IN_PROGRESS, stored.status());
            Assertions.assertEquals(1, fx.audit("lease.conflict").size());
        }
    }
}

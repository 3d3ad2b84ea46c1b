package io.harvestcore.runtime;

import io.harvestcore.model.WorkItemStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class WatchdogTest {

    @Test
    void tickSweepsEveryRun() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            fx.components.queue().enqueue("run-a", List.of("a1", "a2"));
            fx.components.queue().enqueue("run-b", List.of("b1"));
            fx.components.queue().claim("run-a", "dead-worker");
            fx.components.queue().claim("run-b", "dead-worker");
            fx.clock.advance(Duration.ofMinutes(6));

            Watchdog watchdog = new Watchdog(fx.ctx, fx.components.recovery(), () -> List.of("run-a", "run-b"));
            Map<String, Integer> recovered = watchdog.tick();

            Assertions.assertEquals(Map.of("run-a", 2, "run-b", 1), recovered);
            Assertions.assertEquals(2, fx.components.queue().stats("run-a").count(WorkItemStatus.PENDING));
            Assertions.assertEquals("watchdog", fx.audit("lease.reclaim").get(0).get("actor"));
        }
    }

    @Test
    void scheduledSweepRunsUntilClosed() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            fx.components.queue().enqueue("run-a", List.of("a1"));
            fx.components.queue().claim("run-a", "dead-worker");
            fx.clock.advance(Duration.ofMinutes(6));

            Watchdog watchdog = new Watchdog(fx.ctx, fx.components.recovery(), () -> List.of("run-a"));
            try {
                watchdog.start();
                long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
                while (fx.components.queue().stats("run-a").count(WorkItemStatus.PENDING) == 0
                        && System.nanoTime() < deadline) {
                    Thread.sleep(20);
                }
            } finally {
                watchdog.close();
            }
            Assertions.assertEquals(1, fx.components.queue().stats("run-a").count(WorkItemStatus.PENDING));
        }
    }

    @Test
    void failingSweepIsRecordedAndDoesNotKillTheSchedule() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            Watchdog watchdog = new Watchdog(fx.ctx, fx.components.recovery(), () -> {
                throw new IllegalStateException("run list unavailable");
            });
            try {
                watchdog.start();
                long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
                while (fx.audit("watchdog.sweep").isEmpty() && System.nanoTime() < deadline) {
                    Thread.sleep(20);
                }
            } finally {
                watchdog.close();
            }
            List<Map<String, Object>> rows = fx.audit("watchdog.sweep");
            Assertions.assertFalse(rows.isEmpty());
            Assertions.assertEquals("error", rows.get(0).get("result"));
        }
    }

    @Test
    void scheduleReportsSweepsThatFollowAFailedOne() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            AtomicInteger calls = new AtomicInteger();
            Watchdog watchdog = new Watchdog(fx.ctx, fx.components.recovery(), () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("run list unavailable");
                }
                return List.of("run-a");
            });
            CountDownLatch reported = new CountDownLatch(2);
            try {
                watchdog.start(10L, recovered -> {
                    Assertions.assertEquals(Map.of("run-a", 0), recovered);
                    reported.countDown();
                });
                Assertions.assertTrue(reported.await(10, TimeUnit.SECONDS));
            } finally {
                watchdog.close();
            }
            Assertions.assertEquals(1, fx.audit("watchdog.sweep").size());
        }
    }
}

package io.harvestcore.runtime;

import io.harvestcore.model.ItemRef;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

final class PendingFetchTrackerTest {

    @Test
    void countsDownInAnyOrder() {
        PendingFetchTracker tracker = new PendingFetchTracker();
        ItemRef a = new ItemRef("run-1", "a");
        ItemRef b = new ItemRef("run-1", "b");
        tracker.register(a, 3);
        tracker.register(b, 1);
        Assertions.assertEquals(4, tracker.totalOutstanding());

        Assertions.assertEquals(2, tracker.complete(a));
        Assertions.assertEquals(0, tracker.complete(b));
        Assertions.assertEquals(1, tracker.complete(a));
        Assertions.assertEquals(0, tracker.complete(a));
        Assertions.assertEquals(0, tracker.outstanding(a));
        Assertions.assertEquals(0, tracker.totalOutstanding());
        Assertions.assertEquals(0, tracker.complete(a));
    }

    @Test
    void lateCompletionAfterForgetIsIgnored() {
        PendingFetchTracker tracker = new PendingFetchTracker();
        ItemRef ref = new ItemRef("run-1", "a");
        tracker.register(ref, 2);
        tracker.forget(ref);

        Assertions.assertEquals(0, tracker.complete(ref));
        Assertions.assertEquals(0, tracker.complete(ref));
        Assertions.assertEquals(0, tracker.totalOutstanding());

        tracker.register(ref, 1);
        Assertions.assertEquals(1, tracker.outstanding(ref));
    }

    @Test
    void awaitDrainedWakesWhenLastFetchCompletes() throws Exception {
        PendingFetchTracker tracker = new PendingFetchTracker();
        ItemRef ref = new ItemRef("run-1", "a");
        tracker.register(ref, 2);
        Assertions.assertFalse(tracker.awaitDrained(ref, Duration.ofMillis(20)));

        CountDownLatch started = new CountDownLatch(1);
        Thread completer = new Thread(() -> {
            started.countDown();
            tracker.complete(ref);
            tracker.complete(ref);
        });
        completer.start();
        started.await();
        Assertions.assertTrue(tracker.awaitDrained(ref, Duration.ofSeconds(10)));
        completer.join();
    }

    @Test
    void forgetReleasesWaiters() throws Exception {
        PendingFetchTracker tracker = new PendingFetchTracker();
        ItemRef ref = new ItemRef("run-1", "a");
        tracker.register(ref, 5);
        tracker.forget(ref);
        Assertions.assertTrue(tracker.awaitDrained(ref, Duration.ZERO));
    }
}

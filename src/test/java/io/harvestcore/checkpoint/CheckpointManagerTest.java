package io.harvestcore.checkpoint;

import io.harvestcore.model.RunStatus;
import io.harvestcore.runtime.HarvestFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

final class CheckpointManagerTest {

    @Test
    void completedStepIsSkippedOnResume() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            Path listing = writeFile(fx.root.resolve("out/listing.csv"), "id\n1\n");

            checkpoints.markStepStarted("run-1", 0, "discover");
            fx.clock.advance(Duration.ofSeconds(42));
            StepRecord record = checkpoints.markStepComplete("run-1", 0, "discover", List.of(listing), Map.of("rows", 1));
            Assertions.assertEquals(42_000L, record.durationMs());
            Assertions.assertEquals(1, record.metadata().get("rows"));

            CheckpointManager reopened = fx.checkpoints();
            Assertions.assertTrue(reopened.isStepComplete("run-1", 0));
            Assertions.assertEquals(1, reopened.nextStep("run-1"));
            Assertions.assertEquals(RunStatus.RUNNING, reopened.runStatus("run-1").orElseThrow());
        }
    }

    @Test
    void markingTwiceKeepsOneRow() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(), Map.of("pass", 1));
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(), Map.of("pass", 2));
            List<StepRecord> steps = checkpoints.steps("run-1");
            Assertions.assertEquals(1, steps.size());
            Assertions.assertEquals(2, steps.get(0).metadata().get("pass"));
        }
    }

    @Test
    void missingOutputInvalidatesTheStep() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            Path a = writeFile(fx.root.resolve("out/a.json"), "{}");
            Path b = writeFile(fx.root.resolve("out/b.json"), "{}");
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(a), null);
            checkpoints.markStepComplete("run-1", 1, "fetch", List.of(b), null);
            Assertions.assertEquals(2, checkpoints.nextStep("run-1"));

            Files.delete(b);
            Assertions.assertFalse(checkpoints.isStepComplete("run-1", 1));
            Assertions.assertTrue(checkpoints.isStepComplete("run-1", 1, false, null));
            Assertions.assertEquals(1, checkpoints.nextStep("run-1"));
            Assertions.assertFalse(fx.audit("checkpoint.invalidated").isEmpty());
        }
    }

    @Test
    void explicitExpectedOutputsOverrideRecordedOnes() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            Path gone = fx.root.resolve("out/never-written.csv");
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(gone), null);

            Assertions.assertFalse(checkpoints.isStepComplete("run-1", 0, true, null));
            Assertions.assertTrue(checkpoints.isStepComplete("run-1", 0, true, List.of()));
            Path present = writeFile(fx.root.resolve("out/present.csv"), "x");
            Assertions.assertTrue(checkpoints.isStepComplete("run-1", 0, true, List.of(present)));
        }
    }

    @Test
    void nextStepStopsAtTheFirstGap() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            Assertions.assertEquals(0, checkpoints.nextStep("run-1"));
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(), null);
            checkpoints.markStepComplete("run-1", 2, "parse", List.of(), null);
            Assertions.assertEquals(1, checkpoints.nextStep("run-1"));

            checkpoints.markStepStarted("run-1", 1, "fetch");
            Assertions.assertEquals(1, checkpoints.nextStep("run-1"));
            checkpoints.markStepComplete("run-1", 1, "fetch", List.of(), null);
            Assertions.assertEquals(3, checkpoints.nextStep("run-1"));
        }
    }

    @Test
    void restartingACompletedStepClearsItsFlag() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(), null);
            checkpoints.markStepStarted("run-1", 0, "discover");
            Assertions.assertFalse(checkpoints.isStepComplete("run-1", 0));
            Assertions.assertNull(checkpoints.steps("run-1").get(0).completedAtMs());
        }
    }

    @Test
    void timingSumsDurationsAndNamesTheSlowestStep() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            checkpoints.markStepStarted("run-1", 0, "discover");
            fx.clock.advance(Duration.ofSeconds(10));
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(), null);
            // No start mark: measured from the previous completion.
            fx.clock.advance(Duration.ofSeconds(90));
            checkpoints.markStepComplete("run-1", 1, "fetch", List.of(), null);
            checkpoints.markStepComplete("run-1", 2, "export", List.of(), null, Duration.ofSeconds(5));

            PipelineTiming timing = checkpoints.timing("run-1");
            Assertions.assertEquals(105_000L, timing.totalDurationMs());
            Assertions.assertEquals("fetch", timing.slowestStep().stepName());
            Assertions.assertEquals(3, timing.steps().size());
            Assertions.assertEquals(HarvestFixture.START.toEpochMilli(), timing.startedAtMs());
            Assertions.assertEquals(fx.clock.millis(), timing.completedAtMs());
        }
    }

    @Test
    void clearRemovesEveryStepOfTheRun() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            checkpoints.markStepComplete("run-1", 0, "discover", List.of(), null);
            checkpoints.markStepComplete("run-1", 1, "fetch", List.of(), null);
            checkpoints.markStepComplete("run-2", 0, "discover", List.of(), null);

            Assertions.assertEquals(2, checkpoints.clear("run-1"));
            Assertions.assertTrue(checkpoints.steps("run-1").isEmpty());
            Assertions.assertEquals(0, checkpoints.nextStep("run-1"));
            Assertions.assertEquals(1, checkpoints.steps("run-2").size());
            Assertions.assertEquals(1, fx.audit("checkpoint.clear").size());
        }
    }

    @Test
    void runStatusTransitionsArePersisted() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            Assertions.assertTrue(checkpoints.runStatus("run-1").isEmpty());
            checkpoints.markRunStatus("run-1", RunStatus.RUNNING);
            checkpoints.markRunStatus("run-1", RunStatus.COMPLETED);
            Assertions.assertEquals(RunStatus.COMPLETED, fx.checkpoints().runStatus("run-1").orElseThrow());
            Assertions.assertEquals(2, fx.audit("pipeline.status").size());
        }
    }

    @Test
    void runLockAdmitsOneLiveDriver() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            Assertions.assertTrue(checkpoints.tryAcquireRun("run-1", "driver-a"));
            Assertions.assertTrue(checkpoints.tryAcquireRun("run-1", "driver-a"));
            Assertions.assertFalse(checkpoints.tryAcquireRun("run-1", "driver-b"));
            Assertions.assertFalse(checkpoints.heartbeatRun("run-1", "driver-b"));
            Assertions.assertFalse(checkpoints.isResumable("run-1"));

            Map<String, Object> rejected = fx.audit("pipeline.lock").get(2);
            Assertions.assertEquals("rejected", rejected.get("result"));

            Assertions.assertFalse(checkpoints.releaseRun("run-1", "driver-b", RunStatus.FAILED));
            Assertions.assertEquals(RunStatus.RUNNING, checkpoints.runStatus("run-1").orElseThrow());
            Assertions.assertTrue(checkpoints.releaseRun("run-1", "driver-a", RunStatus.COMPLETED));
            Assertions.assertEquals(RunStatus.COMPLETED, checkpoints.runStatus("run-1").orElseThrow());
            Assertions.assertTrue(checkpoints.tryAcquireRun("run-1", "driver-b"));
        }
    }

    @Test
    void heartbeatKeepsTheLockAndSilenceLetsItGo() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CheckpointManager checkpoints = fx.checkpoints();
            checkpoints.tryAcquireRun("run-1", "driver-a");

            fx.clock.advance(Duration.ofMinutes(4));
            Assertions.assertTrue(checkpoints.heartbeatRun("run-1", "driver-a"));
            fx.clock.advance(Duration.ofMinutes(4));
            Assertions.assertFalse(checkpoints.recoverIfStale("run-1"));
            Assertions.assertFalse(checkpoints.tryAcquireRun("run-1", "driver-b"));

            fx.clock.advance(Duration.ofMinutes(2));
            Assertions.assertTrue(checkpoints.isResumable("run-1"));
            Assertions.assertTrue(checkpoints.recoverIfStale("run-1"));
            Assertions.assertEquals(RunStatus.RESUME, checkpoints.runStatus("run-1").orElseThrow());
            Assertions.assertEquals(1, fx.audit("pipeline.recover").size());
            Assertions.assertFalse(checkpoints.recoverIfStale("run-1"));

            Assertions.assertTrue(checkpoints.tryAcquireRun("run-1", "driver-b"));
            Assertions.assertFalse(checkpoints.heartbeatRun("run-1", "driver-a"));
            Assertions.assertFalse(checkpoints.releaseRun("run-1", "driver-a", RunStatus.FAILED));
            Assertions.assertEquals(RunStatus.RUNNING, checkpoints.runStatus("run-1").orElseThrow());
        }
    }

    @Test
    void negativeStepNumberIsRejected() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.checkpoints().markStepStarted("run-1", -1, "bad"));
        }
    }

    private static Path writeFile(Path path, String content) throws Exception {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}

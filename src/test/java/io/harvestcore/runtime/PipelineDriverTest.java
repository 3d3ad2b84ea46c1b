package io.harvestcore.runtime;

import io.harvestcore.checkpoint.CheckpointManager;
import io.harvestcore.model.CoordinationException;
import io.harvestcore.model.ErrorKind;
import io.harvestcore.model.Result;
import io.harvestcore.model.RunStatus;
import io.harvestcore.scraper.Claimable;
import io.harvestcore.scraper.ItemProcessor;
import io.harvestcore.scraper.PipelineStep;
import io.harvestcore.scraper.ProcessingResult;
import io.harvestcore.scraper.StepContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

final class PipelineDriverTest {

    @Test
    void resumedPipelineSkipsCompletedSteps() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            Path listing = fx.root.resolve("exports/listing.txt");
            AtomicInteger discoverRuns = new AtomicInteger();
            AtomicInteger fetchRuns = new AtomicInteger();
            List<PipelineStep> steps = List.of(
                    new DiscoverStep(listing, discoverRuns),
                    new FetchStep(fetchRuns)
            );

            PipelineDriver.PipelineOutcome first = driver(fx).run("run-p", steps);
            Assertions.assertEquals(RunStatus.COMPLETED, first.status());
            Assertions.assertEquals(List.of(0, 1), first.executedSteps());
            Assertions.assertEquals(3, fx.components.queue().stats("run-p").terminal());

            PipelineDriver.PipelineOutcome second = driver(fx).run("run-p", steps);
            Assertions.assertEquals(List.of(0, 1), second.skippedSteps());
            Assertions.assertTrue(second.executedSteps().isEmpty());
            Assertions.assertEquals(1, discoverRuns.get());
            Assertions.assertEquals(1, fetchRuns.get());

            Map<String, Object> metadata = fx.checkpoints().steps("run-p").get(1).metadata();
            Assertions.assertEquals(3, metadata.get("terminal"));
        }
    }

    @Test
    void deletedOutputMakesOnlyThatStepRunAgain() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            Path listing = fx.root.resolve("exports/listing.txt");
            AtomicInteger discoverRuns = new AtomicInteger();
            AtomicInteger fetchRuns = new AtomicInteger();
            List<PipelineStep> steps = List.of(new DiscoverStep(listing, discoverRuns), new FetchStep(fetchRuns));
            driver(fx).run("run-p", steps);

            Files.delete(listing);
            PipelineDriver.PipelineOutcome rerun = driver(fx).run("run-p", steps);
            Assertions.assertEquals(List.of(0), rerun.executedSteps());
            Assertions.assertEquals(List.of(1), rerun.skippedSteps());
            Assertions.assertEquals(2, discoverRuns.get());
            Assertions.assertTrue(Files.exists(listing));
        }
    }

    @Test
    void failedStepStopsThePipelineAndResumesThere() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            AtomicBoolean upstreamDown = new AtomicBoolean(true);
            AtomicInteger exportRuns = new AtomicInteger();
            List<PipelineStep> steps = List.of(
                    step(0, "discover", ctx -> Result.ok(Map.of())),
                    step(1, "fetch", ctx -> upstreamDown.get()
                            ? Result.transientFailure("portal offline")
                            : Result.ok(Map.of())),
                    step(2, "export", ctx -> {
                        exportRuns.incrementAndGet();
                        return Result.ok(Map.of());
                    })
            );

            PipelineDriver.PipelineOutcome failed = driver(fx).run("run-p", steps);
            Assertions.assertEquals(RunStatus.FAILED, failed.status());
            Assertions.assertEquals(1, failed.failedStep());
            Assertions.assertEquals(ErrorKind.TRANSIENT, failed.errorKind());
            Assertions.assertEquals(0, exportRuns.get());
            Assertions.assertEquals(RunStatus.FAILED, fx.checkpoints().runStatus("run-p").orElseThrow());
            Assertions.assertEquals(1, fx.checkpoints().nextStep("run-p"));

            upstreamDown.set(false);
            PipelineDriver.PipelineOutcome resumed = driver(fx).run("run-p", steps);
            Assertions.assertEquals(RunStatus.COMPLETED, resumed.status());
            Assertions.assertEquals(List.of(0), resumed.skippedSteps());
            Assertions.assertEquals(List.of(1, 2), resumed.executedSteps());
            Assertions.assertEquals(RunStatus.COMPLETED, fx.checkpoints().runStatus("run-p").orElseThrow());
        }
    }

    @Test
    void thrownExceptionIsWrappedAndMarksTheRunFailed() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            List<PipelineStep> steps = List.of(step(0, "discover", ctx -> {
                throw new IllegalStateException("bad config");
            }));
            CoordinationException e = Assertions.assertThrows(CoordinationException.class,
                    () -> driver(fx).run("run-p", steps));
            Assertions.assertEquals(ErrorKind.BUSINESS, e.kind());
            Assertions.assertEquals(RunStatus.FAILED, fx.checkpoints().runStatus("run-p").orElseThrow());
            Assertions.assertFalse(fx.checkpoints().isStepComplete("run-p", 0));
        }
    }

    @Test
    void secondDriverIsTurnedAwayWhileTheFirstIsAlive() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            AtomicInteger runs = new AtomicInteger();
            List<PipelineStep> steps = List.of(step(0, "discover", ctx -> {
                runs.incrementAndGet();
                return Result.ok(Map.of());
            }));
            Assertions.assertTrue(fx.checkpoints().tryAcquireRun("run-p", "driver-live"));

            CoordinationException e = Assertions.assertThrows(CoordinationException.class,
                    () -> driver(fx).run("run-p", steps));
            Assertions.assertEquals(ErrorKind.BUSINESS, e.kind());
            Assertions.assertEquals(0, runs.get());
            Assertions.assertEquals(RunStatus.RUNNING, fx.checkpoints().runStatus("run-p").orElseThrow());
        }
    }

    @Test
    void crashedDriverRunIsRecoveredAndResumed() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            AtomicInteger exportRuns = new AtomicInteger();
            List<PipelineStep> steps = List.of(
                    step(0, "discover", ctx -> Result.ok(Map.of())),
                    step(1, "export", ctx -> {
                        exportRuns.incrementAndGet();
                        return Result.ok(Map.of());
                    })
            );
            // A driver finished step 0 and died without releasing the run.
            CheckpointManager checkpoints = fx.checkpoints();
            Assertions.assertTrue(checkpoints.tryAcquireRun("run-p", "driver-dead"));
            checkpoints.markStepComplete("run-p", 0, "discover", List.of(), Map.of());
            fx.clock.advance(Duration.ofMinutes(6));

            PipelineDriver.PipelineOutcome resumed = new PipelineDriver(checkpoints, fx.components,
                    new WorkerPool(fx.components, 1, 1, "pipeline"), "driver-next").run("run-p", steps);

            Assertions.assertEquals(RunStatus.COMPLETED, resumed.status());
            Assertions.assertEquals(List.of(0), resumed.skippedSteps());
            Assertions.assertEquals(List.of(1), resumed.executedSteps());
            Assertions.assertEquals(1, exportRuns.get());
            Map<String, Object> recovered = fx.audit("pipeline.recover").get(0);
            Assertions.assertEquals("run-p", recovered.get("run_id"));
            Assertions.assertEquals(RunStatus.COMPLETED, checkpoints.runStatus("run-p").orElseThrow());
        }
    }

    private static PipelineDriver driver(HarvestFixture fx) {
        CheckpointManager checkpoints = fx.checkpoints();
        return new PipelineDriver(checkpoints, fx.components, new WorkerPool(fx.components, 2, 1, "pipeline"));
    }

    private interface StepBody {
        Result<Map<String, Object>> run(StepContext context) throws Exception;
    }

    private static PipelineStep step(int number, String name, StepBody body) {
        return new PipelineStep() {
            @Override
            public int number() {
                return number;
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public Result<Map<String, Object>> execute(StepContext context) throws Exception {
                return body.run(context);
            }
        };
    }

    private static final class DiscoverStep implements PipelineStep {
        private final Path listing;
        private final AtomicInteger runs;

        DiscoverStep(Path listing, AtomicInteger runs) {
            this.listing = listing;
            this.runs = runs;
        }

        @Override
        public int number() {
            return 0;
        }

        @Override
        public String name() {
            return "discover";
        }

        @Override
        public List<Path> expectedOutputs() {
            return List.of(listing);
        }

        @Override
        public Result<Map<String, Object>> execute(StepContext context) throws Exception {
            runs.incrementAndGet();
            Files.createDirectories(listing.getParent());
            Files.writeString(listing, "l-1\nl-2\nl-3\n", StandardCharsets.UTF_8);
            return Result.ok(Map.of("listings", 3));
        }
    }

    private static final class FetchStep implements PipelineStep, Claimable {
        private final AtomicInteger runs;

        FetchStep(AtomicInteger runs) {
            this.runs = runs;
        }

        @Override
        public int number() {
            return 1;
        }

        @Override
        public String name() {
            return "fetch";
        }

        @Override
        public ItemProcessor itemProcessor() {
            return ctx -> ProcessingResult.completed(Map.of("key", ctx.itemKey()));
        }

        @Override
        public Result<Map<String, Object>> execute(StepContext context) throws Exception {
            runs.incrementAndGet();
            context.queue().enqueue(context.runId(), List.of("l-1", "l-2", "l-3"));
            WorkerPool.RunSummary summary = context.workerPool().drain(context.runId(), this);
            return Result.ok(Map.of("terminal", summary.stats().terminal()));
        }
    }
}

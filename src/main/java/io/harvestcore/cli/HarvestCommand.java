package io.harvestcore.cli;

import io.harvestcore.checkpoint.CheckpointManager;
import io.harvestcore.config.HarvestConfig;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.runtime.HarvestRuntime;
import io.harvestcore.runtime.Watchdog;
import io.harvestcore.scraper.ScraperRegistry;
import io.harvestcore.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "harvest",
        mixinStandardHelpOptions = true,
        description = "HarvestCore work queue and pipeline checkpoint CLI",
        subcommands = {
                HarvestCommand.InitCommand.class,
                HarvestCommand.EnqueueCommand.class,
                HarvestCommand.StatusCommand.class,
                HarvestCommand.ItemsCommand.class,
                HarvestCommand.SweepCommand.class,
                HarvestCommand.WatchdogCommand.class,
                HarvestCommand.WorkCommand.class,
                HarvestCommand.PipelineCommand.class,
                HarvestCommand.CheckpointCommand.class,
                HarvestCommand.SettingsCommand.class,
                HarvestCommand.AuditTailCommand.class,
                HarvestCommand.SchemaMigrationsCommand.class
        }
)
public final class HarvestCommand implements Runnable {
    private final ScraperRegistry registry;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    public HarvestCommand() {
        this(ScraperRegistry.empty());
    }

    public HarvestCommand(ScraperRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | enqueue | status | items | sweep | watchdog | work | pipeline | checkpoint | settings | audit-tail | schema-migrations");
    }

    HarvestRuntime runtime() {
        HarvestRuntime runtime = HarvestRuntime.open(HarvestConfig.fromRoot(root), registry);
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Override
        public Integer call() {
            HarvestRuntime runtime = parent.runtime();
            System.out.println("Initialized HarvestCore at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Insert pending work items for a run")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--keys-file"}, description = "File with one item key per line")
        String keysFile;

        @Option(names = {"--key"}, description = "Item key (repeatable)")
        List<String> keys;

        @Override
        public Integer call() throws IOException {
            List<String> all = new ArrayList<>();
            if (keys != null) {
                all.addAll(keys);
            }
            if (keysFile != null && !keysFile.isBlank()) {
                for (String line : Files.readAllLines(Paths.get(keysFile), StandardCharsets.UTF_8)) {
                    String k = line.trim();
                    if (!k.isEmpty() && !k.startsWith("#")) {
                        all.add(k);
                    }
                }
            }
            if (all.isEmpty()) {
                System.err.println("No item keys given; use --key or --keys-file");
                return 2;
            }
            System.out.println(Jsons.toJson(parent.runtime().enqueue(runId, all)));
            return 0;
        }
    }

    @Command(name = "status", description = "Show queue counts and completion state of a run")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().completion(runId)));
            return 0;
        }
    }

    @Command(name = "items", description = "List work items of a run")
    static final class ItemsCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--status"}, description = "pending|in_progress|completed|zero_result|failed|blocked")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            WorkItemStatus filter = status == null || status.isBlank() ? null : WorkItemStatus.fromDb(status);
            System.out.println(Jsons.toJson(parent.runtime().items(runId, filter, limit)));
            return 0;
        }
    }

    @Command(name = "sweep", description = "Reclaim expired leases and resolve a stuck run once")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().sweep(runId)));
            return 0;
        }
    }

    @Command(name = "watchdog", description = "Periodically sweep one or more runs")
    static final class WatchdogCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id (repeatable)")
        List<String> runIds;

        @Option(names = {"--interval-ms"}, defaultValue = "-1",
                description = "Interval between sweeps (-1 uses settings)")
        long intervalMs;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single sweep and exit")
        boolean once;

        @Option(names = {"--sweeps"}, defaultValue = "0",
                description = "Exit after this many successful sweeps (0 runs until interrupted)")
        int sweeps;

        @Override
        public Integer call() throws Exception {
            HarvestRuntime runtime = parent.runtime();
            Watchdog watchdog = runtime.watchdog(runIds);
            if (once) {
                System.out.println(Jsons.toJson(watchdog.tick()));
                return 0;
            }
            long everyMs = intervalMs > 0 ? intervalMs : runtime.settings().watchdogIntervalMs();
            CountDownLatch done = new CountDownLatch(sweeps > 0 ? sweeps : 1);
            try (watchdog) {
                watchdog.start(everyMs, recovered -> {
                    System.out.println(Jsons.toCompactJson(recovered));
                    if (sweeps > 0) {
                        done.countDown();
                    }
                });
                done.await();
            }
            return 0;
        }
    }

    @Command(name = "work", description = "Run queue workers of a registered scraper")
    static final class WorkCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--scraper"}, required = true, description = "Registered scraper name")
        String scraper;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--workers"}, defaultValue = "4", description = "Worker threads")
        int workers;

        @Option(names = {"--drain"}, defaultValue = "false", description = "Exit once nothing is claimable")
        boolean drain;

        @Override
        public Integer call() throws Exception {
            System.out.println(Jsons.toJson(parent.runtime().runQueue(scraper, runId, workers, drain)));
            return 0;
        }
    }

    @Command(name = "pipeline", description = "Run or resume the pipeline of a registered scraper")
    static final class PipelineCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--scraper"}, required = true, description = "Registered scraper name")
        String scraper;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--workers"}, defaultValue = "4", description = "Worker threads for queue steps")
        int workers;

        @Override
        public Integer call() {
            var outcome = parent.runtime().runPipeline(scraper, runId, workers);
            System.out.println(Jsons.toJson(outcome));
            return outcome.failedStep() == null ? 0 : 1;
        }
    }

    @Command(name = "checkpoint", description = "Inspect or clear pipeline checkpoints of a run")
    static final class CheckpointCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--clear"}, defaultValue = "false", description = "Delete every step record of the run")
        boolean clear;

        @Option(names = {"--timing"}, defaultValue = "false", description = "Print timing summary")
        boolean timing;

        @Override
        public Integer call() {
            CheckpointManager checkpoints = parent.runtime().checkpoints();
            if (clear) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("runId", runId);
                out.put("stepsRemoved", checkpoints.clear(runId));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
            if (timing) {
                System.out.println(Jsons.toJson(checkpoints.timing(runId)));
                return 0;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("runId", runId);
            out.put("status", checkpoints.runStatus(runId).map(s -> s.dbValue()).orElse(null));
            out.put("resumable", checkpoints.isResumable(runId));
            out.put("nextStep", checkpoints.nextStep(runId));
            out.put("steps", checkpoints.steps(runId));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective coordination settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().settings()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Option(names = {"--action"}, description = "Only rows with this action")
        String action;

        @Override
        public Integer call() {
            var rows = parent.runtime().context().auditLogger().tail(lines, action);
            for (Map<String, Object> row : rows) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        HarvestCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().database().listSchemaMigrations(limit)));
            return 0;
        }
    }
}

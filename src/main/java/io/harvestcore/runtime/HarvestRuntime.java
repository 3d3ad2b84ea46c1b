package io.harvestcore.runtime;

import io.harvestcore.checkpoint.CheckpointManager;
import io.harvestcore.config.CoordinationSettings;
import io.harvestcore.config.HarvestConfig;
import io.harvestcore.model.WorkItem;
import io.harvestcore.model.WorkItemStatus;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.queue.CompletionDetector;
import io.harvestcore.queue.QueueStats;
import io.harvestcore.scraper.Checkpointable;
import io.harvestcore.scraper.Claimable;
import io.harvestcore.scraper.ScraperRegistry;
import io.harvestcore.storage.CheckpointStore;
import io.harvestcore.storage.Database;
import io.harvestcore.storage.SqliteStoreAdapter;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires store, queue, checkpoints and scrapers for one data root.
 */
public final class HarvestRuntime {
    private final HarvestConfig config;
    private final Database database;
    private final CoordinationContext context;
    private final QueueComponents components;
    private final CheckpointManager checkpoints;
    private final ScraperRegistry registry;

    public HarvestRuntime(HarvestConfig config, CoordinationSettings settings, ScraperRegistry registry,
                          Clock clock, Sleeper sleeper) {
        this.config = config;
        this.database = new Database(config);
        this.registry = registry;
        AuditLogger auditLogger = new AuditLogger(config.auditFile(), clock);
        this.context = new CoordinationContext(settings, new SqliteStoreAdapter(database, clock), clock, auditLogger, sleeper);
        this.components = QueueComponents.create(context);
        this.checkpoints = new CheckpointManager(context, new CheckpointStore(database));
    }

    public static HarvestRuntime open(HarvestConfig config, ScraperRegistry registry) {
        return new HarvestRuntime(config, CoordinationSettings.load(config), registry, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public void init() {
        database.init();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("settings_file", config.settingsFile().toString());
        details.put("settings", context.settings());
        context.auditLogger().log(AuditLogger.AuditEvent.of(
                "settings.load", "runtime", "settings", "ok", null, null, details));
    }

    public HarvestConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public CoordinationContext context() {
        return context;
    }

    public CoordinationSettings settings() {
        return context.settings();
    }

    public QueueComponents components() {
        return components;
    }

    public CheckpointManager checkpoints() {
        return checkpoints;
    }

    public ScraperRegistry registry() {
        return registry;
    }

    public EnqueueOutcome enqueue(String runId, Collection<String> itemKeys) {
        int inserted = components.queue().enqueue(runId, itemKeys);
        return new EnqueueOutcome(runId, itemKeys.size(), inserted);
    }

    public QueueStats stats(String runId) {
        return components.queue().stats(runId);
    }

    public CompletionDetector.Snapshot completion(String runId) {
        return components.completion().evaluate(runId);
    }

    public List<WorkItem> items(String runId, WorkItemStatus status, int limit) {
        return components.queue().find(runId, status, limit);
    }

    public SweepOutcome sweep(String runId) {
        int recovered = components.recovery().sweep(runId);
        return new SweepOutcome(runId, recovered, components.completion().evaluate(runId));
    }

    public WorkerPool workerPool(int workers) {
        return new WorkerPool(components, workers);
    }

    public WorkerPool.RunSummary runQueue(String scraperName, String runId, int workers, boolean drainOnly)
            throws InterruptedException {
        Claimable scraper = registry.claimable(scraperName);
        WorkerPool pool = workerPool(workers);
        return drainOnly ? pool.drain(runId, scraper) : pool.run(runId, scraper);
    }

    public PipelineDriver.PipelineOutcome runPipeline(String scraperName, String runId, int workers) {
        Checkpointable scraper = registry.checkpointable(scraperName);
        PipelineDriver driver = new PipelineDriver(checkpoints, components, workerPool(workers));
        return driver.run(runId, scraper.steps());
    }

    public Watchdog watchdog(List<String> runIds) {
        List<String> fixed = List.copyOf(runIds);
        return new Watchdog(context, components.recovery(), () -> fixed);
    }

    public record EnqueueOutcome(String runId, int requested, int inserted) {
    }

    public record SweepOutcome(String runId, int recovered, CompletionDetector.Snapshot completion) {
    }
}

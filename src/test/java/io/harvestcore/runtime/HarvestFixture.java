package io.harvestcore.runtime;

import io.harvestcore.checkpoint.CheckpointManager;
import io.harvestcore.config.CoordinationSettings;
import io.harvestcore.config.HarvestConfig;
import io.harvestcore.observability.AuditLogger;
import io.harvestcore.storage.CheckpointStore;
import io.harvestcore.storage.Database;
import io.harvestcore.storage.SqliteStoreAdapter;
import io.harvestcore.storage.StoreAdapter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Temp-directory database plus a hand-driven clock. Sleeping advances the clock instead of
 * blocking, so retry and poll waits cost no wall time.
 */
public final class HarvestFixture implements AutoCloseable {
    public static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    public final Path root;
    public final HarvestConfig config;
    public final MutableClock clock;
    public final Database database;
    public final SqliteStoreAdapter store;
    public final AuditLogger auditLogger;
    public final CoordinationContext ctx;
    public final QueueComponents components;

    private HarvestFixture(Path root, CoordinationSettings settings) {
        this.root = root;
        this.config = HarvestConfig.fromRoot(root.toString());
        this.clock = MutableClock.startingAt(START);
        this.database = new Database(config);
        database.init();
        this.store = new SqliteStoreAdapter(database, clock);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.ctx = new CoordinationContext(settings, store, clock, auditLogger, clock::advance);
        this.components = QueueComponents.create(ctx);
    }

    public static HarvestFixture create() throws IOException {
        return create(CoordinationSettings.defaults());
    }

    public static HarvestFixture create(CoordinationSettings settings) throws IOException {
        return new HarvestFixture(Files.createTempDirectory("harvestcore-test-"), settings);
    }

    public CheckpointManager checkpoints() {
        return new CheckpointManager(ctx, new CheckpointStore(database));
    }

    /** Queue components sharing this fixture's clock and audit log but reading through {@code other}. */
    public QueueComponents componentsOver(StoreAdapter other) {
        return QueueComponents.create(new CoordinationContext(ctx.settings(), other, clock, auditLogger, clock::advance));
    }

    public List<Map<String, Object>> audit(String action) {
        return auditLogger.tail(Integer.MAX_VALUE, action);
    }

    @Override
    public void close() throws IOException {
        deleteRecursively(root);
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

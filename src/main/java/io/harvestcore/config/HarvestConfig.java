package io.harvestcore.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class HarvestConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "harvest.db";
    public static final String SETTINGS_FILE_NAME = "harvest-settings.json";

    private final Path rootDir;

    public HarvestConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static HarvestConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new HarvestConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}

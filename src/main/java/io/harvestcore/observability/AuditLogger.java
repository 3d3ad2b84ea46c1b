package io.harvestcore.observability;

import io.harvestcore.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends one JSON object per coordination event to {@code audit/audit.log}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("run_id", event.runId());
        row.put("item_key", event.itemKey());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /** Most recent rows, oldest first, optionally restricted to one action. */
    public synchronized List<Map<String, Object>> tail(int limit, String action) {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<Map<String, Object>> out = new ArrayList<>();
            for (int i = lines.size() - 1; i >= 0 && out.size() < limit; i--) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                Map<String, Object> row = Jsons.toMap(line);
                if (action == null || action.equals(row.get("action"))) {
                    out.add(0, row);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String runId,
            String itemKey,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String runId,
                String itemKey,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, runId, itemKey, details == null ? Map.of() : details);
        }
    }
}

package io.harvestcore.storage;

import io.harvestcore.model.RunStatus;
import io.harvestcore.model.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to {@code pipeline_runs} and {@code pipeline_steps}.
 */
public final class CheckpointStore {
    private static final String STEP_COLUMNS =
            "run_id,step_number,step_name,completed,started_at_ms,completed_at_ms,duration_ms,outputs_json,metadata_json";

    private final Database database;

    public CheckpointStore(Database database) {
        this.database = database;
    }

    public void upsertStarted(String runId, int stepNumber, String stepName, long startedAtMs) {
        String sql = """
                INSERT INTO pipeline_steps(run_id,step_number,step_name,completed,started_at_ms)
                VALUES(?,?,?,0,?)
                ON CONFLICT(run_id,step_number) DO UPDATE SET step_name=excluded.step_name,completed=0,
                    started_at_ms=excluded.started_at_ms,completed_at_ms=NULL,duration_ms=NULL
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setInt(2, stepNumber);
            ps.setString(3, stepName);
            ps.setLong(4, startedAtMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from("Failed mark step started", e);
        }
    }

    public void upsertCompleted(StepRow row) {
        String sql = """
                INSERT INTO pipeline_steps(run_id,step_number,step_name,completed,started_at_ms,completed_at_ms,duration_ms,outputs_json,metadata_json)
                VALUES(?,?,?,1,?,?,?,?,?)
                ON CONFLICT(run_id,step_number) DO UPDATE SET
                    step_name=excluded.step_name,
                    completed=1,
                    started_at_ms=excluded.started_at_ms,
                    completed_at_ms=excluded.completed_at_ms,
                    duration_ms=excluded.duration_ms,
                    outputs_json=excluded.outputs_json,
                    metadata_json=excluded.metadata_json
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, row.runId());
            ps.setInt(2, row.stepNumber());
            ps.setString(3, row.stepName());
            setNullableLong(ps, 4, row.startedAtMs());
            setNullableLong(ps, 5, row.completedAtMs());
            setNullableLong(ps, 6, row.durationMs());
            ps.setString(7, row.outputsJson());
            ps.setString(8, row.metadataJson());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from("Failed mark step complete", e);
        }
    }

    public Optional<StepRow> findStep(String runId, int stepNumber) {
        String sql = "SELECT " + STEP_COLUMNS + " FROM pipeline_steps WHERE run_id=? AND step_number=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setInt(2, stepNumber);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readStep(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed read step", e);
        }
    }

    public List<StepRow> listSteps(String runId) {
        String sql = "SELECT " + STEP_COLUMNS + " FROM pipeline_steps WHERE run_id=? ORDER BY step_number ASC";
        List<StepRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readStep(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw StoreException.from("Failed list steps", e);
        }
    }

    /** Returns the number of step rows removed. */
    public int deleteRun(String runId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement steps = c.prepareStatement("DELETE FROM pipeline_steps WHERE run_id=?");
                 PreparedStatement run = c.prepareStatement("DELETE FROM pipeline_runs WHERE run_id=?")) {
                steps.setString(1, runId);
                int removed = steps.executeUpdate();
                run.setString(1, runId);
                run.executeUpdate();
                c.commit();
                return removed;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed clear checkpoint", e);
        }
    }

    public void upsertRunStatus(String runId, RunStatus status, long nowMs) {
        String sql = """
                INSERT INTO pipeline_runs(run_id,status,created_at_ms,updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(run_id) DO UPDATE SET status=excluded.status,updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, status.dbValue());
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from("Failed set run status", e);
        }
    }

    public Optional<RunRow> findRun(String runId) {
        String sql = "SELECT run_id,status,driver_owner,heartbeat_at_ms,created_at_ms,updated_at_ms FROM pipeline_runs WHERE run_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new RunRow(
                        rs.getString("run_id"),
                        RunStatus.fromDb(rs.getString("status")),
                        rs.getString("driver_owner"),
                        nullableLong(rs, "heartbeat_at_ms"),
                        rs.getLong("created_at_ms"),
                        rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed read run status", e);
        }
    }

    /**
     * Takes the driver lock of a run. Succeeds when the run is new, not running, already
     * held by {@code owner}, or held by a driver whose heartbeat is older than
     * {@code staleBeforeMs}.
     */
    public boolean tryLockRun(String runId, String owner, long nowMs, long staleBeforeMs) {
        String insert = """
                INSERT OR IGNORE INTO pipeline_runs(run_id,status,driver_owner,heartbeat_at_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?)
                """;
        String takeOver = """
                UPDATE pipeline_runs SET status=?,driver_owner=?,heartbeat_at_ms=?,updated_at_ms=?
                WHERE run_id=? AND (status<>? OR driver_owner IS NULL OR driver_owner=?
                    OR heartbeat_at_ms IS NULL OR heartbeat_at_ms<?)
                """;
        String running = RunStatus.RUNNING.dbValue();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(insert);
                 PreparedStatement up = c.prepareStatement(takeOver)) {
                ins.setString(1, runId);
                ins.setString(2, running);
                ins.setString(3, owner);
                ins.setLong(4, nowMs);
                ins.setLong(5, nowMs);
                ins.setLong(6, nowMs);
                boolean acquired = ins.executeUpdate() == 1;
                if (!acquired) {
                    up.setString(1, running);
                    up.setString(2, owner);
                    up.setLong(3, nowMs);
                    up.setLong(4, nowMs);
                    up.setString(5, runId);
                    up.setString(6, running);
                    up.setString(7, owner);
                    up.setLong(8, staleBeforeMs);
                    acquired = up.executeUpdate() == 1;
                }
                c.commit();
                return acquired;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed lock pipeline run", e);
        }
    }

    public boolean heartbeatRun(String runId, String owner, long nowMs) {
        String sql = "UPDATE pipeline_runs SET heartbeat_at_ms=?,updated_at_ms=? WHERE run_id=? AND driver_owner=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, runId);
            ps.setString(4, owner);
            ps.setString(5, RunStatus.RUNNING.dbValue());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw StoreException.from("Failed heartbeat pipeline run", e);
        }
    }

    /** Drops the lock held by {@code owner} and records the final status. */
    public boolean unlockRun(String runId, String owner, RunStatus status, long nowMs) {
        String sql = "UPDATE pipeline_runs SET status=?,driver_owner=NULL,updated_at_ms=? WHERE run_id=? AND driver_owner=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            ps.setLong(2, nowMs);
            ps.setString(3, runId);
            ps.setString(4, owner);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw StoreException.from("Failed unlock pipeline run", e);
        }
    }

    /** Turns a {@code running} row without a live heartbeat into {@code resume}. */
    public boolean markStaleRunning(String runId, long staleBeforeMs, long nowMs) {
        String sql = """
                UPDATE pipeline_runs SET status=?,driver_owner=NULL,updated_at_ms=?
                WHERE run_id=? AND status=? AND (heartbeat_at_ms IS NULL OR heartbeat_at_ms<?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, RunStatus.RESUME.dbValue());
            ps.setLong(2, nowMs);
            ps.setString(3, runId);
            ps.setString(4, RunStatus.RUNNING.dbValue());
            ps.setLong(5, staleBeforeMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw StoreException.from("Failed recover pipeline run", e);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.INTEGER);
        } else {
            ps.setLong(idx, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static StepRow readStep(ResultSet rs) throws SQLException {
        return new StepRow(
                rs.getString("run_id"),
                rs.getInt("step_number"),
                rs.getString("step_name"),
                rs.getInt("completed") == 1,
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "completed_at_ms"),
                nullableLong(rs, "duration_ms"),
                rs.getString("outputs_json"),
                rs.getString("metadata_json")
        );
    }

    public record StepRow(
            String runId,
            int stepNumber,
            String stepName,
            boolean completed,
            Long startedAtMs,
            Long completedAtMs,
            Long durationMs,
            String outputsJson,
            String metadataJson
    ) {
    }

    public record RunRow(
            String runId,
            RunStatus status,
            String driverOwner,
            Long heartbeatAtMs,
            long createdAtMs,
            long updatedAtMs
    ) {
    }
}

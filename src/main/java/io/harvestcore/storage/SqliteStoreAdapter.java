package io.harvestcore.storage;

import io.harvestcore.model.StoreException;
import io.harvestcore.model.WorkItem;
import io.harvestcore.model.WorkItemStatus;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public final class SqliteStoreAdapter implements StoreAdapter {
    private static final String ITEM_COLUMNS =
            "run_id,item_key,status,owner,lease_time_ms,attempt_count,lease_expiries,last_error,result_json,created_at_ms,updated_at_ms";
    private static final Set<String> GROUPABLE_COLUMNS = Set.of("status", "owner", "attempt_count");

    private final Database database;
    private final Clock clock;

    public SqliteStoreAdapter(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public Database database() {
        return database;
    }

    @Override
    public List<WorkItem> claimBatch(ItemFilter filter, ClaimOrder order, int limit, ItemUpdate set) {
        if (limit <= 0) {
            return List.of();
        }
        String token = UUID.randomUUID().toString();
        // The UPDATE is the first statement so the write lock is held before any row is read.
        String claim = "UPDATE work_items SET " + set.setSql() + ",claim_token=? WHERE rowid IN ("
                + "SELECT rowid FROM work_items" + filter.whereSql()
                + " ORDER BY " + order.sql() + " LIMIT ?)";
        String select = "SELECT " + ITEM_COLUMNS + " FROM work_items WHERE claim_token=? ORDER BY " + order.sql();
        long nowMs = clock.millis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(claim);
                 PreparedStatement ps = c.prepareStatement(select)) {
                int idx = bind(up, 1, set.params(nowMs));
                up.setString(idx++, token);
                idx = bind(up, idx, filter.params());
                up.setInt(idx, limit);
                int claimed = up.executeUpdate();
                List<WorkItem> out = new ArrayList<>(claimed);
                if (claimed > 0) {
                    ps.setString(1, token);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            out.add(readItem(rs));
                        }
                    }
                }
                c.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed claim work items", e);
        }
    }

    @Override
    public int update(ItemFilter filter, ItemUpdate set) {
        if (set.isEmpty()) {
            throw new IllegalArgumentException("update must set at least one column");
        }
        String sql = "UPDATE work_items SET " + set.setSql() + filter.whereSql();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = bind(ps, 1, set.params(clock.millis()));
            bind(ps, idx, filter.params());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from("Failed update work items", e);
        }
    }

    @Override
    public Map<String, Integer> aggregateCounts(String groupByColumn, ItemFilter filter) {
        if (!GROUPABLE_COLUMNS.contains(groupByColumn)) {
            throw new IllegalArgumentException("Unsupported group-by column: " + groupByColumn);
        }
        String sql = "SELECT " + groupByColumn + " AS grp,COUNT(*) AS n FROM work_items"
                + filter.whereSql() + " GROUP BY " + groupByColumn;
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, 1, filter.params());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString("grp");
                    out.put(key == null ? "" : key, rs.getInt("n"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw StoreException.from("Failed aggregate work items", e);
        }
    }

    @Override
    public boolean exists(Path path) {
        return path != null && Files.exists(path);
    }

    @Override
    public int insertPending(String runId, Collection<String> itemKeys) {
        if (itemKeys == null || itemKeys.isEmpty()) {
            return 0;
        }
        String sql = "INSERT OR IGNORE INTO work_items(run_id,item_key,status,attempt_count,created_at_ms,updated_at_ms) VALUES(?,?,?,0,?,?)";
        long nowMs = clock.millis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int inserted = 0;
                for (String key : itemKeys) {
                    if (key == null || key.isBlank()) {
                        continue;
                    }
                    ps.setString(1, runId);
                    ps.setString(2, key);
                    ps.setString(3, WorkItemStatus.PENDING.dbValue());
                    ps.setLong(4, nowMs);
                    ps.setLong(5, nowMs);
                    inserted += ps.executeUpdate();
                }
                c.commit();
                return inserted;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed insert pending items", e);
        }
    }

    @Override
    public List<WorkItem> find(ItemFilter filter, int limit) {
        String sql = "SELECT " + ITEM_COLUMNS + " FROM work_items" + filter.whereSql()
                + " ORDER BY item_key ASC LIMIT ?";
        List<WorkItem> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = bind(ps, 1, filter.params());
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readItem(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw StoreException.from("Failed find work items", e);
        }
    }

    @Override
    public Optional<StuckWatch> readStuckWatch(String runId) {
        String sql = "SELECT run_id,remaining,since_ms FROM stuck_watch WHERE run_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StuckWatch(rs.getString("run_id"), rs.getInt("remaining"), rs.getLong("since_ms")));
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed read stuck watch", e);
        }
    }

    @Override
    public void writeStuckWatch(StuckWatch watch) {
        String sql = """
                INSERT INTO stuck_watch(run_id,remaining,since_ms) VALUES(?,?,?)
                ON CONFLICT(run_id) DO UPDATE SET remaining=excluded.remaining,since_ms=excluded.since_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, watch.runId());
            ps.setInt(2, watch.remaining());
            ps.setLong(3, watch.sinceMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from("Failed write stuck watch", e);
        }
    }

    @Override
    public void clearStuckWatch(String runId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM stuck_watch WHERE run_id=?")) {
            ps.setString(1, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from("Failed clear stuck watch", e);
        }
    }

    private static int bind(PreparedStatement ps, int start, List<Object> params) throws SQLException {
        int idx = start;
        for (Object p : params) {
            ps.setObject(idx++, p);
        }
        return idx;
    }

    private static WorkItem readItem(ResultSet rs) throws SQLException {
        long lease = rs.getLong("lease_time_ms");
        Long leaseTime = rs.wasNull() ? null : lease;
        return new WorkItem(
                rs.getString("run_id"),
                rs.getString("item_key"),
                WorkItemStatus.fromDb(rs.getString("status")),
                rs.getString("owner"),
                leaseTime,
                rs.getInt("attempt_count"),
                rs.getInt("lease_expiries"),
                rs.getString("last_error"),
                rs.getString("result_json"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}

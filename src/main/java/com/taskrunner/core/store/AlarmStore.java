package com.taskrunner.core.store;

import com.taskrunner.core.scheduling.Alarm;
import com.taskrunner.core.scheduling.AlarmKey;
import com.taskrunner.core.scheduling.AlarmKind;
import com.taskrunner.core.scheduling.OwnerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable alarm table. One row per (owner type, owner id, kind); setting an alarm
 * overwrites the previous fire time for that slot.
 * <p>
 * Claims are optimistic: an alarm is leased by moving {@code fire_at} forward only if it
 * still holds the value the claimer read, and released by deleting it only if nobody
 * re-armed it in the meantime. Re-arming always clears the lease flag, so a handler that
 * re-arms at exactly the lease expiry still keeps its alarm.
 */
public class AlarmStore {

    private static final Logger log = LoggerFactory.getLogger(AlarmStore.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS alarms (
                owner_type VARCHAR(16) NOT NULL,
                owner_id   VARCHAR(64) NOT NULL,
                kind       VARCHAR(32) NOT NULL,
                fire_at    BIGINT NOT NULL,
                leased     BOOLEAN NOT NULL DEFAULT FALSE,
                PRIMARY KEY (owner_type, owner_id, kind)
            )
            """;

    private static final String UPDATE_SQL = """
            UPDATE alarms SET fire_at = ?, leased = FALSE WHERE owner_type = ? AND owner_id = ? AND kind = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO alarms (fire_at, owner_type, owner_id, kind) VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_SQL = """
            SELECT fire_at FROM alarms WHERE owner_type = ? AND owner_id = ? AND kind = ?
            """;

    private static final String LEASE_SQL = """
            UPDATE alarms SET fire_at = ?, leased = TRUE
            WHERE owner_type = ? AND owner_id = ? AND kind = ? AND fire_at = ?
            """;

    private static final String RELEASE_SQL = """
            DELETE FROM alarms WHERE owner_type = ? AND owner_id = ? AND kind = ? AND fire_at = ? AND leased = TRUE
            """;

    private static final String DELETE_SQL = """
            DELETE FROM alarms WHERE owner_type = ? AND owner_id = ? AND kind = ?
            """;

    private static final String DELETE_OWNER_SQL = """
            DELETE FROM alarms WHERE owner_type = ? AND owner_id = ?
            """;

    private static final String SELECT_DUE_SQL = """
            SELECT owner_type, owner_id, kind, fire_at FROM alarms WHERE fire_at <= ? ORDER BY fire_at LIMIT ?
            """;

    private static final String COUNT_DUE_SQL = """
            SELECT COUNT(*) FROM alarms WHERE fire_at <= ?
            """;

    private final DataSource dataSource;

    public AlarmStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TABLE_SQL,
                    "CREATE INDEX IF NOT EXISTS idx_alarms_fire_at ON alarms (fire_at)")) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Alarm table ensured");
        }
    }

    /** Arms (or re-arms) the alarm for {@code key}. */
    public void set(AlarmKey key, Instant fireAt) {
        try (Connection conn = dataSource.getConnection()) {
            if (write(conn, UPDATE_SQL, key, fireAt) == 1) {
                return;
            }
            try {
                write(conn, INSERT_SQL, key, fireAt);
            } catch (SQLException e) {
                if (!JdbcSupport.isConstraintViolation(e)) {
                    throw e;
                }
                // concurrent insert for the same slot; last writer wins
                write(conn, UPDATE_SQL, key, fireAt);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to set alarm " + key, e);
        }
    }

    public Optional<Instant> find(AlarmKey key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            bindKey(stmt, 1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(Instant.ofEpochMilli(rs.getLong(1)));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read alarm " + key, e);
        }
        return Optional.empty();
    }

    /**
     * Leases a due alarm by pushing its fire time to {@code leaseUntil}.
     *
     * @return {@code false} if the alarm was re-armed, cancelled or leased by someone else
     */
    public boolean lease(AlarmKey key, Instant expectedFireAt, Instant leaseUntil) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LEASE_SQL)) {
            stmt.setLong(1, leaseUntil.toEpochMilli());
            bindKey(stmt, 2, key);
            stmt.setLong(5, expectedFireAt.toEpochMilli());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to lease alarm " + key, e);
        }
    }

    /** Deletes a leased alarm, unless it was re-armed since the lease was taken. */
    public boolean release(AlarmKey key, Instant expectedFireAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(RELEASE_SQL)) {
            bindKey(stmt, 1, key);
            stmt.setLong(4, expectedFireAt.toEpochMilli());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to release alarm " + key, e);
        }
    }

    public void delete(AlarmKey key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            bindKey(stmt, 1, key);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to delete alarm " + key, e);
        }
    }

    public void deleteAll(OwnerType ownerType, String ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_OWNER_SQL)) {
            stmt.setString(1, ownerType.name());
            stmt.setString(2, ownerId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to delete alarms of " + ownerType.unitKey(ownerId), e);
        }
    }

    public List<Alarm> findDue(Instant now, int limit) {
        List<Alarm> alarms = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_DUE_SQL)) {
            stmt.setLong(1, now.toEpochMilli());
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    AlarmKey key = new AlarmKey(
                            OwnerType.valueOf(rs.getString("owner_type")),
                            rs.getString("owner_id"),
                            AlarmKind.valueOf(rs.getString("kind")));
                    alarms.add(new Alarm(key, Instant.ofEpochMilli(rs.getLong("fire_at"))));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read due alarms", e);
        }
        return alarms;
    }

    /** Number of alarms that should have fired by {@code cutoff}. */
    public int countDue(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_DUE_SQL)) {
            stmt.setLong(1, cutoff.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count due alarms", e);
        }
    }

    private static int write(Connection conn, String sql, AlarmKey key, Instant fireAt) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, fireAt.toEpochMilli());
            bindKey(stmt, 2, key);
            return stmt.executeUpdate();
        }
    }

    private static void bindKey(PreparedStatement stmt, int startIndex, AlarmKey key) throws SQLException {
        stmt.setString(startIndex, key.ownerType().name());
        stmt.setString(startIndex + 1, key.ownerId());
        stmt.setString(startIndex + 2, key.kind().name());
    }
}

package com.taskrunner.core.store;

import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeHealth;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for {@link Node} rows.
 * <p>
 * Status writes are conditional on the expected current status. They are meant to be
 * called only from the node's own lifecycle manager; everything else reads.
 */
public class NodeStore {

    private static final Logger log = LoggerFactory.getLogger(NodeStore.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS nodes (
                id                VARCHAR(64) PRIMARY KEY,
                user_id           VARCHAR(255) NOT NULL,
                status            VARCHAR(32) NOT NULL,
                vm_size           VARCHAR(16) NOT NULL,
                location          VARCHAR(64) NOT NULL,
                provider_id       VARCHAR(255),
                ip_address        VARCHAR(64),
                health            VARCHAR(32) NOT NULL,
                cpu_percent       DOUBLE PRECISION,
                memory_percent    DOUBLE PRECISION,
                last_heartbeat_at BIGINT,
                warm_since        BIGINT,
                auto_provisioned  BOOLEAN NOT NULL,
                error_message     VARCHAR(65535),
                created_at        BIGINT NOT NULL,
                updated_at        BIGINT NOT NULL
            )
            """;

    private static final String INSERT_SQL = """
            INSERT INTO nodes (id, user_id, status, vm_size, location, provider_id, ip_address, health,
                               cpu_percent, memory_percent, last_heartbeat_at, warm_since, auto_provisioned,
                               error_message, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String MARK_WARM_SQL = """
            UPDATE nodes SET status = 'warm', warm_since = ?, updated_at = ?
            WHERE id = ? AND status = 'running'
            """;

    private static final String CLAIM_WARM_SQL = """
            UPDATE nodes SET status = 'running', warm_since = NULL, updated_at = ?
            WHERE id = ? AND status = 'warm'
            """;

    private static final String MARK_PROVISIONED_SQL = """
            UPDATE nodes SET status = 'running', provider_id = ?, ip_address = ?, updated_at = ?
            WHERE id = ? AND status = 'provisioning'
            """;

    private static final String SET_PROVIDER_ID_SQL = """
            UPDATE nodes SET provider_id = ?, ip_address = ?, updated_at = ? WHERE id = ?
            """;

    private static final String HEARTBEAT_SQL = """
            UPDATE nodes SET cpu_percent = ?, memory_percent = ?, health = ?, last_heartbeat_at = ?
            WHERE id = ?
            """;

    private static final String HEALTH_SQL = """
            UPDATE nodes SET health = ? WHERE id = ? AND health <> ?
            """;

    private final DataSource dataSource;
    private final Clock clock;

    public NodeStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TABLE_SQL,
                    "CREATE INDEX IF NOT EXISTS idx_nodes_user_status ON nodes (user_id, status)")) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Node table ensured");
        }
    }

    public void insert(Node node) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, node.id());
            stmt.setString(2, node.userId());
            stmt.setString(3, node.status().wireName());
            stmt.setString(4, node.size().wireName());
            stmt.setString(5, node.location());
            stmt.setString(6, node.providerId());
            stmt.setString(7, node.ipAddress());
            stmt.setString(8, node.health().wireName());
            JdbcSupport.setDouble(stmt, 9, node.cpuPercent());
            JdbcSupport.setDouble(stmt, 10, node.memoryPercent());
            JdbcSupport.setInstant(stmt, 11, node.lastHeartbeatAt());
            JdbcSupport.setInstant(stmt, 12, node.warmSince());
            stmt.setBoolean(13, node.autoProvisioned());
            stmt.setString(14, node.errorMessage());
            JdbcSupport.setInstant(stmt, 15, node.createdAt());
            JdbcSupport.setInstant(stmt, 16, node.updatedAt());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert node " + node.id(), e);
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────

    public Optional<Node> findById(String nodeId) {
        return query("SELECT * FROM nodes WHERE id = ?", stmt -> stmt.setString(1, nodeId)).stream().findFirst();
    }

    public List<Node> findByUser(String userId) {
        return query("SELECT * FROM nodes WHERE user_id = ? ORDER BY created_at", stmt -> stmt.setString(1, userId));
    }

    public List<Node> findByUserAndStatus(String userId, NodeStatus status) {
        return query("SELECT * FROM nodes WHERE user_id = ? AND status = ? ORDER BY created_at", stmt -> {
            stmt.setString(1, userId);
            stmt.setString(2, status.wireName());
        });
    }

    public List<Node> findByStatuses(Collection<NodeStatus> statuses) {
        List<String> names = statuses.stream().map(NodeStatus::wireName).toList();
        return query("SELECT * FROM nodes WHERE status IN (" + JdbcSupport.placeholders(names.size())
                + ") ORDER BY created_at", stmt -> JdbcSupport.bindAll(stmt, 1, names));
    }

    /** Warm nodes whose {@code warmSince} is older than the cutoff. */
    public List<Node> findWarmSince(Instant cutoff) {
        return query("SELECT * FROM nodes WHERE status = 'warm' AND warm_since < ? ORDER BY warm_since",
                stmt -> JdbcSupport.setInstant(stmt, 1, cutoff));
    }

    /** Auto-provisioned nodes created before the cutoff that are not yet stopped. */
    public List<Node> findAutoProvisionedCreatedBefore(Instant cutoff) {
        return query("""
                SELECT * FROM nodes
                WHERE auto_provisioned = TRUE AND status <> 'stopped' AND created_at < ?
                ORDER BY created_at
                """, stmt -> JdbcSupport.setInstant(stmt, 1, cutoff));
    }

    /** Nodes counting against the user's node limit: everything not on its way out. */
    public int countOwnedByUser(String userId) {
        String sql = "SELECT COUNT(*) FROM nodes WHERE user_id = ? AND status NOT IN ('destroying', 'stopped')";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count nodes for user " + userId, e);
        }
    }

    // ── Conditional lifecycle writes ────────────────────────────────────

    public boolean markWarm(String nodeId) {
        Instant now = clock.instant();
        return update(MARK_WARM_SQL, stmt -> {
            JdbcSupport.setInstant(stmt, 1, now);
            JdbcSupport.setInstant(stmt, 2, now);
            stmt.setString(3, nodeId);
        });
    }

    /** Atomic warm to running flip; exactly one of any number of concurrent callers wins. */
    public boolean claimWarm(String nodeId) {
        return update(CLAIM_WARM_SQL, stmt -> {
            JdbcSupport.setInstant(stmt, 1, clock.instant());
            stmt.setString(2, nodeId);
        });
    }

    public boolean markProvisioned(String nodeId, String providerId, String ipAddress) {
        return update(MARK_PROVISIONED_SQL, stmt -> {
            stmt.setString(1, providerId);
            stmt.setString(2, ipAddress);
            JdbcSupport.setInstant(stmt, 3, clock.instant());
            stmt.setString(4, nodeId);
        });
    }

    /** Records the provider handle as soon as it is known, before the node is running. */
    public void setProviderId(String nodeId, String providerId, String ipAddress) {
        update(SET_PROVIDER_ID_SQL, stmt -> {
            stmt.setString(1, providerId);
            stmt.setString(2, ipAddress);
            JdbcSupport.setInstant(stmt, 3, clock.instant());
            stmt.setString(4, nodeId);
        });
    }

    /**
     * Moves the node to {@code to} if its status is one of {@code from}. Leaving warm clears
     * {@code warmSince}; a non-null error message is recorded.
     */
    public boolean updateStatus(String nodeId, Collection<NodeStatus> from, NodeStatus to, String errorMessage) {
        List<String> names = from.stream().map(NodeStatus::wireName).toList();
        String sql = "UPDATE nodes SET status = ?, warm_since = NULL, error_message = COALESCE(?, error_message), "
                + "updated_at = ? WHERE id = ? AND status IN (" + JdbcSupport.placeholders(names.size()) + ")";
        return update(sql, stmt -> {
            stmt.setString(1, to.wireName());
            stmt.setString(2, errorMessage);
            JdbcSupport.setInstant(stmt, 3, clock.instant());
            stmt.setString(4, nodeId);
            JdbcSupport.bindAll(stmt, 5, names);
        });
    }

    public boolean recordHeartbeat(String nodeId, Double cpuPercent, Double memoryPercent, NodeHealth health) {
        return update(HEARTBEAT_SQL, stmt -> {
            JdbcSupport.setDouble(stmt, 1, cpuPercent);
            JdbcSupport.setDouble(stmt, 2, memoryPercent);
            stmt.setString(3, health.wireName());
            JdbcSupport.setInstant(stmt, 4, clock.instant());
            stmt.setString(5, nodeId);
        });
    }

    public boolean updateHealth(String nodeId, NodeHealth health) {
        return update(HEALTH_SQL, stmt -> {
            stmt.setString(1, health.wireName());
            stmt.setString(2, nodeId);
            stmt.setString(3, health.wireName());
        });
    }

    // ── Internals ────────────────────────────────────────────────────────

    private boolean update(String sql, JdbcSupport.Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Node update failed", e);
        }
    }

    private List<Node> query(String sql, JdbcSupport.Binder binder) {
        List<Node> nodes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    nodes.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Node query failed", e);
        }
        return nodes;
    }

    private static Node fromResultSet(ResultSet rs) throws SQLException {
        return new Node(
                rs.getString("id"),
                rs.getString("user_id"),
                NodeStatus.fromWireName(rs.getString("status")),
                NodeSize.fromWireName(rs.getString("vm_size")),
                rs.getString("location"),
                rs.getString("provider_id"),
                rs.getString("ip_address"),
                NodeHealth.fromWireName(rs.getString("health")),
                JdbcSupport.getDouble(rs, "cpu_percent"),
                JdbcSupport.getDouble(rs, "memory_percent"),
                JdbcSupport.getInstant(rs, "last_heartbeat_at"),
                JdbcSupport.getInstant(rs, "warm_since"),
                rs.getBoolean("auto_provisioned"),
                rs.getString("error_message"),
                JdbcSupport.getInstant(rs, "created_at"),
                JdbcSupport.getInstant(rs, "updated_at"));
    }
}

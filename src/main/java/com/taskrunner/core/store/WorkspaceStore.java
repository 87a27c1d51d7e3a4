package com.taskrunner.core.store;

import com.taskrunner.core.model.Workspace;
import com.taskrunner.core.model.WorkspaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for {@link Workspace} rows.
 */
public class WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS workspaces (
                id              VARCHAR(64) PRIMARY KEY,
                node_id         VARCHAR(64) NOT NULL,
                user_id         VARCHAR(255) NOT NULL,
                task_id         VARCHAR(64),
                status          VARCHAR(32) NOT NULL,
                chat_session_id VARCHAR(64),
                error_message   VARCHAR(65535),
                created_at      BIGINT NOT NULL,
                updated_at      BIGINT NOT NULL
            )
            """;

    private static final String INSERT_SQL = """
            INSERT INTO workspaces (id, node_id, user_id, task_id, status, chat_session_id, error_message,
                                    created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String COUNT_ACTIVE_SQL = """
            SELECT COUNT(*) FROM workspaces WHERE node_id = ? AND status IN ('creating', 'running')
            """;

    private static final String SET_SESSION_SQL = """
            UPDATE workspaces SET chat_session_id = ?, updated_at = ? WHERE id = ?
            """;

    private final DataSource dataSource;
    private final Clock clock;

    public WorkspaceStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TABLE_SQL,
                    "CREATE INDEX IF NOT EXISTS idx_workspaces_node ON workspaces (node_id, status)")) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Workspace table ensured");
        }
    }

    public void insert(Workspace workspace) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, workspace.id());
            stmt.setString(2, workspace.nodeId());
            stmt.setString(3, workspace.userId());
            stmt.setString(4, workspace.taskId());
            stmt.setString(5, workspace.status().wireName());
            stmt.setString(6, workspace.chatSessionId());
            stmt.setString(7, workspace.errorMessage());
            JdbcSupport.setInstant(stmt, 8, workspace.createdAt());
            JdbcSupport.setInstant(stmt, 9, workspace.updatedAt());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert workspace " + workspace.id(), e);
        }
    }

    public Optional<Workspace> findById(String workspaceId) {
        return query("SELECT * FROM workspaces WHERE id = ?", stmt -> stmt.setString(1, workspaceId))
                .stream().findFirst();
    }

    public List<Workspace> findByNode(String nodeId) {
        return query("SELECT * FROM workspaces WHERE node_id = ? ORDER BY created_at", stmt -> stmt.setString(1, nodeId));
    }

    /** Workspaces still occupying the node ({@code creating} or {@code running}). */
    public int countActiveOnNode(String nodeId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_ACTIVE_SQL)) {
            stmt.setString(1, nodeId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count workspaces on node " + nodeId, e);
        }
    }

    /**
     * Conditional status change. Used both by callbacks (creating to running/error) and by
     * cleanup, where winning the update is what entitles the caller to stop the workspace remotely.
     */
    public boolean updateStatus(String workspaceId, Collection<WorkspaceStatus> from, WorkspaceStatus to,
                                String errorMessage) {
        List<String> names = from.stream().map(WorkspaceStatus::wireName).toList();
        String sql = "UPDATE workspaces SET status = ?, error_message = COALESCE(?, error_message), updated_at = ? "
                + "WHERE id = ? AND status IN (" + JdbcSupport.placeholders(names.size()) + ")";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, to.wireName());
            stmt.setString(2, errorMessage);
            JdbcSupport.setInstant(stmt, 3, clock.instant());
            stmt.setString(4, workspaceId);
            JdbcSupport.bindAll(stmt, 5, names);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update workspace " + workspaceId, e);
        }
    }

    public void setChatSession(String workspaceId, String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SET_SESSION_SQL)) {
            stmt.setString(1, sessionId);
            JdbcSupport.setInstant(stmt, 2, clock.instant());
            stmt.setString(3, workspaceId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to set session on workspace " + workspaceId, e);
        }
    }

    private List<Workspace> query(String sql, JdbcSupport.Binder binder) {
        List<Workspace> workspaces = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    workspaces.add(new Workspace(
                            rs.getString("id"),
                            rs.getString("node_id"),
                            rs.getString("user_id"),
                            rs.getString("task_id"),
                            WorkspaceStatus.fromWireName(rs.getString("status")),
                            rs.getString("chat_session_id"),
                            rs.getString("error_message"),
                            JdbcSupport.getInstant(rs, "created_at"),
                            JdbcSupport.getInstant(rs, "updated_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Workspace query failed", e);
        }
        return workspaces;
    }
}

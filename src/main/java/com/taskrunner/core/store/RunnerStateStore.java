package com.taskrunner.core.store;

import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.CallbackKind;
import com.taskrunner.core.model.CallbackReceipt;
import com.taskrunner.core.model.RunnerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable scratch state of the per-task orchestrator units plus the log of every
 * callback they received. Only the owning unit writes a task's runner state.
 */
public class RunnerStateStore {

    private static final Logger log = LoggerFactory.getLogger(RunnerStateStore.class);

    private static final String CREATE_STATE_SQL = """
            CREATE TABLE IF NOT EXISTS task_runner_state (
                task_id              VARCHAR(64) PRIMARY KEY,
                retry_count          INT NOT NULL DEFAULT 0,
                step_started_at      BIGINT,
                pending_signal       VARCHAR(32),
                pending_workspace_id VARCHAR(64),
                pending_detail       VARCHAR(65535),
                pending_since        BIGINT
            )
            """;

    private static final String CREATE_CALLBACKS_SQL = """
            CREATE TABLE IF NOT EXISTS task_callbacks (
                id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                task_id      VARCHAR(64) NOT NULL,
                workspace_id VARCHAR(64),
                kind         VARCHAR(32) NOT NULL,
                disposition  VARCHAR(32) NOT NULL,
                detail       VARCHAR(65535),
                received_at  BIGINT NOT NULL
            )
            """;

    private static final String UPDATE_STATE_SQL = """
            UPDATE task_runner_state
            SET retry_count = ?, step_started_at = ?, pending_signal = ?, pending_workspace_id = ?,
                pending_detail = ?, pending_since = ?
            WHERE task_id = ?
            """;

    private static final String INSERT_STATE_SQL = """
            INSERT INTO task_runner_state (retry_count, step_started_at, pending_signal, pending_workspace_id,
                                           pending_detail, pending_since, task_id)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_STATE_SQL = """
            SELECT * FROM task_runner_state WHERE task_id = ?
            """;

    private static final String DELETE_STATE_SQL = """
            DELETE FROM task_runner_state WHERE task_id = ?
            """;

    private static final String INSERT_CALLBACK_SQL = """
            INSERT INTO task_callbacks (task_id, workspace_id, kind, disposition, detail, received_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_CALLBACKS_SQL = """
            SELECT * FROM task_callbacks WHERE task_id = ? ORDER BY id
            """;

    private final DataSource dataSource;
    private final Clock clock;

    public RunnerStateStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_STATE_SQL, CREATE_CALLBACKS_SQL,
                    "CREATE INDEX IF NOT EXISTS idx_task_callbacks_task ON task_callbacks (task_id)")) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Runner state tables ensured");
        }
    }

    public Optional<RunnerState> find(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_STATE_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    String signal = rs.getString("pending_signal");
                    return Optional.of(new RunnerState(
                            rs.getString("task_id"),
                            rs.getInt("retry_count"),
                            JdbcSupport.getInstant(rs, "step_started_at"),
                            signal == null ? null : CallbackKind.valueOf(signal),
                            rs.getString("pending_workspace_id"),
                            rs.getString("pending_detail"),
                            JdbcSupport.getInstant(rs, "pending_since")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read runner state for task " + taskId, e);
        }
        return Optional.empty();
    }

    public void save(RunnerState state) {
        try (Connection conn = dataSource.getConnection()) {
            if (write(conn, UPDATE_STATE_SQL, state) == 0) {
                write(conn, INSERT_STATE_SQL, state);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to save runner state for task " + state.taskId(), e);
        }
    }

    public void delete(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_STATE_SQL)) {
            stmt.setString(1, taskId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to delete runner state for task " + taskId, e);
        }
    }

    // ── Callback receipts ───────────────────────────────────────────────

    public void recordCallback(String taskId, String workspaceId, CallbackKind kind,
                               CallbackDisposition disposition, String detail) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_CALLBACK_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, workspaceId);
            stmt.setString(3, kind.name());
            stmt.setString(4, disposition.name());
            stmt.setString(5, detail);
            JdbcSupport.setInstant(stmt, 6, clock.instant());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to record callback for task " + taskId, e);
        }
    }

    public List<CallbackReceipt> findCallbacks(String taskId) {
        List<CallbackReceipt> receipts = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CALLBACKS_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    receipts.add(new CallbackReceipt(
                            rs.getLong("id"),
                            rs.getString("task_id"),
                            rs.getString("workspace_id"),
                            CallbackKind.valueOf(rs.getString("kind")),
                            CallbackDisposition.valueOf(rs.getString("disposition")),
                            rs.getString("detail"),
                            JdbcSupport.getInstant(rs, "received_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read callbacks for task " + taskId, e);
        }
        return receipts;
    }

    private static int write(Connection conn, String sql, RunnerState state) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, state.retryCount());
            JdbcSupport.setInstant(stmt, 2, state.stepStartedAt());
            stmt.setString(3, state.pendingSignal() == null ? null : state.pendingSignal().name());
            stmt.setString(4, state.pendingWorkspaceId());
            stmt.setString(5, state.pendingDetail());
            JdbcSupport.setInstant(stmt, 6, state.pendingSince());
            stmt.setString(7, state.taskId());
            return stmt.executeUpdate();
        }
    }
}

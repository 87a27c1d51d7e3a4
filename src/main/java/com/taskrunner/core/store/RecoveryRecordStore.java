package com.taskrunner.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.NodeHealth;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.model.RecoveryRecord;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.model.WorkspaceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persists the diagnostic snapshots taken by the recovery sweeper. The free-form
 * {@code details} map is stored as JSON.
 */
public class RecoveryRecordStore {

    private static final Logger log = LoggerFactory.getLogger(RecoveryRecordStore.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS recovery_records (
                id                       VARCHAR(64) PRIMARY KEY,
                task_id                  VARCHAR(64) NOT NULL,
                task_status              VARCHAR(32) NOT NULL,
                execution_step           VARCHAR(32) NOT NULL,
                elapsed_ms               BIGINT NOT NULL,
                threshold_ms             BIGINT NOT NULL,
                reason                   VARCHAR(65535) NOT NULL,
                workspace_id             VARCHAR(64),
                workspace_status         VARCHAR(32),
                node_id                  VARCHAR(64),
                node_status              VARCHAR(32),
                node_health              VARCHAR(32),
                auto_provisioned_node_id VARCHAR(64),
                retry_count              INT NOT NULL,
                outcome                  VARCHAR(32) NOT NULL,
                details                  VARCHAR(65535),
                created_at               BIGINT NOT NULL
            )
            """;

    private static final String INSERT_SQL = """
            INSERT INTO recovery_records (id, task_id, task_status, execution_step, elapsed_ms, threshold_ms, reason,
                                          workspace_id, workspace_status, node_id, node_status, node_health,
                                          auto_provisioned_node_id, retry_count, outcome, details, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_OUTCOME_SQL = """
            UPDATE recovery_records SET outcome = ? WHERE id = ?
            """;

    private static final String SELECT_BY_TASK_SQL = """
            SELECT * FROM recovery_records WHERE task_id = ? ORDER BY created_at
            """;

    private static final String SELECT_RECENT_SQL = """
            SELECT * FROM recovery_records ORDER BY created_at DESC LIMIT ?
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public RecoveryRecordStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Recovery record table ensured");
        }
    }

    public void insert(RecoveryRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, record.id());
            stmt.setString(2, record.taskId());
            stmt.setString(3, record.taskStatus().wireName());
            stmt.setString(4, record.executionStep().wireName());
            stmt.setLong(5, record.elapsed().toMillis());
            stmt.setLong(6, record.threshold().toMillis());
            stmt.setString(7, record.reason());
            stmt.setString(8, record.workspaceId());
            stmt.setString(9, record.workspaceStatus() == null ? null : record.workspaceStatus().wireName());
            stmt.setString(10, record.nodeId());
            stmt.setString(11, record.nodeStatus() == null ? null : record.nodeStatus().wireName());
            stmt.setString(12, record.nodeHealth() == null ? null : record.nodeHealth().wireName());
            stmt.setString(13, record.autoProvisionedNodeId());
            stmt.setInt(14, record.retryCount());
            stmt.setString(15, record.outcome().name());
            stmt.setString(16, serializeDetails(record.details()));
            JdbcSupport.setInstant(stmt, 17, record.createdAt());
            stmt.executeUpdate();
            log.debug("Saved recovery record '{}' for task '{}'", record.id(), record.taskId());
        } catch (SQLException e) {
            throw new StoreException("Failed to insert recovery record for task " + record.taskId(), e);
        }
    }

    public void updateOutcome(String recordId, RecoveryRecord.Outcome outcome) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_OUTCOME_SQL)) {
            stmt.setString(1, outcome.name());
            stmt.setString(2, recordId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to update recovery record " + recordId, e);
        }
    }

    public List<RecoveryRecord> findByTask(String taskId) {
        return query(SELECT_BY_TASK_SQL, stmt -> stmt.setString(1, taskId));
    }

    public List<RecoveryRecord> findRecent(int limit) {
        return query(SELECT_RECENT_SQL, stmt -> stmt.setInt(1, limit));
    }

    private List<RecoveryRecord> query(String sql, JdbcSupport.Binder binder) {
        List<RecoveryRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Recovery record query failed", e);
        }
        return records;
    }

    private RecoveryRecord fromResultSet(ResultSet rs) throws SQLException {
        String workspaceStatus = rs.getString("workspace_status");
        String nodeStatus = rs.getString("node_status");
        String nodeHealth = rs.getString("node_health");
        return new RecoveryRecord(
                rs.getString("id"),
                rs.getString("task_id"),
                TaskStatus.fromWireName(rs.getString("task_status")),
                ExecutionStep.fromWireName(rs.getString("execution_step")),
                Duration.ofMillis(rs.getLong("elapsed_ms")),
                Duration.ofMillis(rs.getLong("threshold_ms")),
                rs.getString("reason"),
                rs.getString("workspace_id"),
                workspaceStatus == null ? null : WorkspaceStatus.fromWireName(workspaceStatus),
                rs.getString("node_id"),
                nodeStatus == null ? null : NodeStatus.fromWireName(nodeStatus),
                nodeHealth == null ? null : NodeHealth.fromWireName(nodeHealth),
                rs.getString("auto_provisioned_node_id"),
                rs.getInt("retry_count"),
                RecoveryRecord.Outcome.valueOf(rs.getString("outcome")),
                deserializeDetails(rs.getString("details")),
                JdbcSupport.getInstant(rs, "created_at"));
    }

    private String serializeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize recovery details", e);
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable recovery details: {}", e.getMessage());
            return Map.of("raw", json);
        }
    }
}

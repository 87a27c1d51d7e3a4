package com.taskrunner.core.store;

import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.model.TaskStatusEvent;
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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for {@link Task} rows, their dependency edges and the append-only
 * {@link TaskStatusEvent} log.
 * <p>
 * Every mutation is a conditional update keyed on the expected current status (and,
 * for step changes, the expected current step). Methods return {@code false} when
 * zero rows were affected: the caller lost a race and must abort without side effects.
 * A status change and its audit event are written in one transaction.
 */
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private static final String CREATE_TASKS_SQL = """
            CREATE TABLE IF NOT EXISTS tasks (
                id                       VARCHAR(64) PRIMARY KEY,
                user_id                  VARCHAR(255) NOT NULL,
                title                    VARCHAR(512),
                prompt                   VARCHAR(65535) NOT NULL,
                repository               VARCHAR(1024) NOT NULL,
                branch                   VARCHAR(255),
                vm_size                  VARCHAR(16),
                vm_location              VARCHAR(64),
                preferred_node_id        VARCHAR(64),
                priority                 INT NOT NULL DEFAULT 0,
                status                   VARCHAR(32) NOT NULL,
                execution_step           VARCHAR(32) NOT NULL,
                node_id                  VARCHAR(64),
                workspace_id             VARCHAR(64),
                session_id               VARCHAR(64),
                auto_provisioned_node_id VARCHAR(64),
                output_branch            VARCHAR(255),
                output_pr_url            VARCHAR(1024),
                error_message            VARCHAR(65535),
                created_at               BIGINT NOT NULL,
                updated_at               BIGINT NOT NULL,
                started_at               BIGINT,
                completed_at             BIGINT
            )
            """;

    private static final String CREATE_EVENTS_SQL = """
            CREATE TABLE IF NOT EXISTS task_status_events (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                task_id     VARCHAR(64) NOT NULL,
                from_status VARCHAR(32),
                to_status   VARCHAR(32) NOT NULL,
                actor       VARCHAR(64) NOT NULL,
                reason      VARCHAR(65535),
                created_at  BIGINT NOT NULL
            )
            """;

    private static final String CREATE_DEPENDENCIES_SQL = """
            CREATE TABLE IF NOT EXISTS task_dependencies (
                task_id            VARCHAR(64) NOT NULL,
                depends_on_task_id VARCHAR(64) NOT NULL,
                created_at         BIGINT NOT NULL,
                PRIMARY KEY (task_id, depends_on_task_id)
            )
            """;

    private static final List<String> CREATE_INDEXES_SQL = List.of(
            "CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks (status)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_user ON tasks (user_id)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_workspace ON tasks (workspace_id)",
            "CREATE INDEX IF NOT EXISTS idx_task_events_task ON task_status_events (task_id)");

    private static final String INSERT_TASK_SQL = """
            INSERT INTO tasks (id, user_id, title, prompt, repository, branch, vm_size, vm_location,
                               preferred_node_id, priority, status, execution_step, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_EVENT_SQL = """
            INSERT INTO task_status_events (task_id, from_status, to_status, actor, reason, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_DEPENDENCY_SQL = """
            INSERT INTO task_dependencies (task_id, depends_on_task_id, created_at) VALUES (?, ?, ?)
            """;

    private static final String SELECT_COLUMNS = "SELECT * FROM tasks ";

    private static final String SELECT_DEPENDENCIES_SQL = """
            SELECT depends_on_task_id FROM task_dependencies WHERE task_id = ? ORDER BY depends_on_task_id
            """;

    private static final String SELECT_USER_EDGES_SQL = """
            SELECT d.task_id, d.depends_on_task_id
            FROM task_dependencies d JOIN tasks t ON t.id = d.task_id
            WHERE t.user_id = ?
            """;

    private static final String SELECT_EVENTS_SQL = """
            SELECT * FROM task_status_events WHERE task_id = ? ORDER BY id
            """;

    private static final String ADVANCE_STEP_SQL = """
            UPDATE tasks SET execution_step = ?, updated_at = ?
            WHERE id = ? AND status = ? AND execution_step = ?
            """;

    private static final String TRANSITION_SQL = """
            UPDATE tasks SET status = ?, execution_step = ?, updated_at = ?,
                             started_at = COALESCE(?, started_at)
            WHERE id = ? AND status = ? AND execution_step = ?
            """;

    private static final String ENQUEUE_SQL = """
            UPDATE tasks SET status = 'queued', updated_at = ? WHERE id = ? AND status = 'draft'
            """;

    private static final String FINISH_SQL = """
            UPDATE tasks SET status = ?, updated_at = ?, completed_at = ?,
                             error_message = COALESCE(?, error_message),
                             output_branch = COALESCE(?, output_branch),
                             output_pr_url = COALESCE(?, output_pr_url)
            WHERE id = ? AND status = ?
            """;

    private static final String REQUEUE_SQL = """
            UPDATE tasks SET status = 'queued', execution_step = 'node_selection', updated_at = ?,
                             node_id = NULL, workspace_id = NULL, session_id = NULL,
                             auto_provisioned_node_id = NULL, output_pr_url = NULL, error_message = NULL,
                             started_at = NULL, completed_at = NULL
            WHERE id = ? AND status = ?
            """;

    private static final String ASSIGN_NODE_SQL = """
            UPDATE tasks SET node_id = ?, auto_provisioned_node_id = COALESCE(?, auto_provisioned_node_id)
            WHERE id = ? AND status = ? AND execution_step = ?
            """;

    private static final String ASSIGN_WORKSPACE_SQL = """
            UPDATE tasks SET workspace_id = ?, output_branch = ?
            WHERE id = ? AND status = ? AND execution_step = ?
            """;

    private static final String ASSIGN_SESSION_SQL = """
            UPDATE tasks SET session_id = ? WHERE id = ? AND status = ? AND execution_step = ?
            """;

    private static final String RECORD_OUTPUTS_SQL = """
            UPDATE tasks SET output_branch = COALESCE(?, output_branch), output_pr_url = COALESCE(?, output_pr_url)
            WHERE id = ? AND status = ?
            """;

    private final DataSource dataSource;
    private final Clock clock;

    public TaskStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Creates the task tables if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TASKS_SQL, CREATE_EVENTS_SQL, CREATE_DEPENDENCIES_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            for (String sql : CREATE_INDEXES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Task tables ensured");
        }
    }

    // ── Creation ─────────────────────────────────────────────────────────

    /**
     * Inserts a new task with its dependency edges and the creation event.
     */
    public void insert(Task task, String actor) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
                    stmt.setString(1, task.id());
                    stmt.setString(2, task.userId());
                    stmt.setString(3, task.title());
                    stmt.setString(4, task.prompt());
                    stmt.setString(5, task.repository());
                    stmt.setString(6, task.branch());
                    stmt.setString(7, task.vmSize() == null ? null : task.vmSize().wireName());
                    stmt.setString(8, task.vmLocation());
                    stmt.setString(9, task.preferredNodeId());
                    stmt.setInt(10, task.priority());
                    stmt.setString(11, task.status().wireName());
                    stmt.setString(12, task.executionStep().wireName());
                    JdbcSupport.setInstant(stmt, 13, task.createdAt());
                    JdbcSupport.setInstant(stmt, 14, task.updatedAt());
                    stmt.executeUpdate();
                }
                for (String dependency : task.dependencies()) {
                    insertDependency(conn, task.id(), dependency, task.createdAt());
                }
                insertEvent(conn, task.id(), null, task.status(), actor, "created", task.createdAt());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert task " + task.id(), e);
        }
    }

    public void addDependency(String taskId, String dependsOnTaskId) {
        try (Connection conn = dataSource.getConnection()) {
            insertDependency(conn, taskId, dependsOnTaskId, clock.instant());
        } catch (SQLException e) {
            if (JdbcSupport.isConstraintViolation(e)) {
                log.debug("Dependency {} -> {} already present", taskId, dependsOnTaskId);
                return;
            }
            throw new StoreException("Failed to add dependency " + taskId + " -> " + dependsOnTaskId, e);
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────

    public Optional<Task> findById(String taskId) {
        List<Task> tasks = query(SELECT_COLUMNS + "WHERE id = ?", stmt -> stmt.setString(1, taskId));
        return tasks.stream().findFirst();
    }

    public Optional<Task> findByWorkspaceId(String workspaceId) {
        List<Task> tasks = query(SELECT_COLUMNS + "WHERE workspace_id = ?", stmt -> stmt.setString(1, workspaceId));
        return tasks.stream().findFirst();
    }

    public List<Task> findByStatuses(Collection<TaskStatus> statuses) {
        List<String> names = statuses.stream().map(TaskStatus::wireName).toList();
        String sql = SELECT_COLUMNS + "WHERE status IN (" + JdbcSupport.placeholders(names.size())
                + ") ORDER BY priority DESC, created_at";
        return query(sql, stmt -> JdbcSupport.bindAll(stmt, 1, names));
    }

    public List<Task> findByUser(String userId) {
        return query(SELECT_COLUMNS + "WHERE user_id = ? ORDER BY created_at DESC", stmt -> stmt.setString(1, userId));
    }

    /** Non-terminal tasks currently assigned to the node, whether or not they have a workspace yet. */
    public int countActiveOnNode(String nodeId) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE node_id = ? AND status IN ('queued', 'delegated', 'in_progress')";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, nodeId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks on node " + nodeId, e);
        }
    }

    /** Current statuses of the given tasks; ids that do not exist are absent from the result. */
    public Map<String, TaskStatus> findStatuses(Collection<String> taskIds) {
        Map<String, TaskStatus> statuses = new HashMap<>();
        if (taskIds.isEmpty()) {
            return statuses;
        }
        String sql = "SELECT id, status FROM tasks WHERE id IN (" + JdbcSupport.placeholders(taskIds.size()) + ")";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            JdbcSupport.bindAll(stmt, 1, taskIds);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    statuses.put(rs.getString("id"), TaskStatus.fromWireName(rs.getString("status")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read task statuses", e);
        }
        return statuses;
    }

    /**
     * Adjacency list of every dependency edge between the user's tasks
     * (task id to the ids it depends on).
     */
    public Map<String, List<String>> findDependencyGraph(String userId) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_USER_EDGES_SQL)) {
            stmt.setString(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    graph.computeIfAbsent(rs.getString("task_id"), k -> new ArrayList<>())
                            .add(rs.getString("depends_on_task_id"));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read dependency graph for user " + userId, e);
        }
        return graph;
    }

    public List<TaskStatusEvent> findEvents(String taskId) {
        List<TaskStatusEvent> events = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_EVENTS_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_status");
                    events.add(new TaskStatusEvent(
                            rs.getLong("id"),
                            rs.getString("task_id"),
                            from == null ? null : TaskStatus.fromWireName(from),
                            TaskStatus.fromWireName(rs.getString("to_status")),
                            rs.getString("actor"),
                            rs.getString("reason"),
                            JdbcSupport.getInstant(rs, "created_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read events for task " + taskId, e);
        }
        return events;
    }

    // ── Conditional step and status updates ─────────────────────────────

    /**
     * Moves the execution step forward within the current status.
     *
     * @return {@code false} if the task no longer has {@code status} and {@code from}
     */
    public boolean advanceStep(String taskId, TaskStatus status, ExecutionStep from, ExecutionStep to) {
        requireAdvance(from, to);
        if (to.boundStatus() != status) {
            throw new IllegalArgumentException("Step " + to.wireName() + " requires status " + to.boundStatus().wireName());
        }
        return update(ADVANCE_STEP_SQL, stmt -> {
            stmt.setString(1, to.wireName());
            JdbcSupport.setInstant(stmt, 2, clock.instant());
            stmt.setString(3, taskId);
            stmt.setString(4, status.wireName());
            stmt.setString(5, from.wireName());
        }, null);
    }

    /**
     * Changes status and step together, e.g. queued/node_agent_ready to
     * delegated/workspace_creation. Entering {@code in_progress} stamps {@code startedAt}.
     */
    public boolean transition(String taskId, TaskStatus from, TaskStatus to, ExecutionStep fromStep,
                              ExecutionStep toStep, String actor, String reason) {
        requireEdge(from, to);
        requireAdvance(fromStep, toStep);
        if (toStep.boundStatus() != to) {
            throw new IllegalArgumentException("Step " + toStep.wireName() + " requires status " + toStep.boundStatus().wireName());
        }
        Instant now = clock.instant();
        return update(TRANSITION_SQL, stmt -> {
            stmt.setString(1, to.wireName());
            stmt.setString(2, toStep.wireName());
            JdbcSupport.setInstant(stmt, 3, now);
            JdbcSupport.setInstant(stmt, 4, to == TaskStatus.IN_PROGRESS ? now : null);
            stmt.setString(5, taskId);
            stmt.setString(6, from.wireName());
            stmt.setString(7, fromStep.wireName());
        }, new PendingEvent(taskId, from, to, actor, reason, now));
    }

    public boolean enqueue(String taskId, String actor, String reason) {
        Instant now = clock.instant();
        return update(ENQUEUE_SQL, stmt -> {
            JdbcSupport.setInstant(stmt, 1, now);
            stmt.setString(2, taskId);
        }, new PendingEvent(taskId, TaskStatus.DRAFT, TaskStatus.QUEUED, actor, reason, now));
    }

    /**
     * Moves the task into a terminal status. The execution step is left untouched so the
     * step at the time of failure remains visible. {@code null} arguments keep existing values.
     */
    public boolean finish(String taskId, TaskStatus from, TaskStatus to, String errorMessage,
                          String outputBranch, String outputPrUrl, String actor, String reason) {
        if (!to.isTerminal()) {
            throw new IllegalArgumentException(to.wireName() + " is not a terminal status");
        }
        requireEdge(from, to);
        Instant now = clock.instant();
        return update(FINISH_SQL, stmt -> {
            stmt.setString(1, to.wireName());
            JdbcSupport.setInstant(stmt, 2, now);
            JdbcSupport.setInstant(stmt, 3, now);
            stmt.setString(4, errorMessage);
            stmt.setString(5, outputBranch);
            stmt.setString(6, outputPrUrl);
            stmt.setString(7, taskId);
            stmt.setString(8, from.wireName());
        }, new PendingEvent(taskId, from, to, actor, reason, now));
    }

    /**
     * Reactivates a failed or cancelled task: back to queued at node_selection with
     * every per-attempt field cleared.
     */
    public boolean requeue(String taskId, TaskStatus from, String actor, String reason) {
        requireEdge(from, TaskStatus.QUEUED);
        Instant now = clock.instant();
        return update(REQUEUE_SQL, stmt -> {
            JdbcSupport.setInstant(stmt, 1, now);
            stmt.setString(2, taskId);
            stmt.setString(3, from.wireName());
        }, new PendingEvent(taskId, from, TaskStatus.QUEUED, actor, reason, now));
    }

    // ── Conditional field writes ────────────────────────────────────────

    public boolean assignNode(String taskId, TaskStatus status, ExecutionStep step, String nodeId,
                              String autoProvisionedNodeId) {
        return update(ASSIGN_NODE_SQL, stmt -> {
            stmt.setString(1, nodeId);
            stmt.setString(2, autoProvisionedNodeId);
            stmt.setString(3, taskId);
            stmt.setString(4, status.wireName());
            stmt.setString(5, step.wireName());
        }, null);
    }

    public boolean assignWorkspace(String taskId, TaskStatus status, ExecutionStep step, String workspaceId,
                                   String outputBranch) {
        return update(ASSIGN_WORKSPACE_SQL, stmt -> {
            stmt.setString(1, workspaceId);
            stmt.setString(2, outputBranch);
            stmt.setString(3, taskId);
            stmt.setString(4, status.wireName());
            stmt.setString(5, step.wireName());
        }, null);
    }

    public boolean assignSession(String taskId, TaskStatus status, ExecutionStep step, String sessionId) {
        return update(ASSIGN_SESSION_SQL, stmt -> {
            stmt.setString(1, sessionId);
            stmt.setString(2, taskId);
            stmt.setString(3, status.wireName());
            stmt.setString(4, step.wireName());
        }, null);
    }

    public boolean recordOutputs(String taskId, TaskStatus status, String outputBranch, String outputPrUrl) {
        return update(RECORD_OUTPUTS_SQL, stmt -> {
            stmt.setString(1, outputBranch);
            stmt.setString(2, outputPrUrl);
            stmt.setString(3, taskId);
            stmt.setString(4, status.wireName());
        }, null);
    }

    // ── Internals ────────────────────────────────────────────────────────

    private record PendingEvent(String taskId, TaskStatus from, TaskStatus to, String actor, String reason,
                                Instant at) {}

    private boolean update(String sql, JdbcSupport.Binder binder, PendingEvent event) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int rows;
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    binder.bind(stmt);
                    rows = stmt.executeUpdate();
                }
                if (rows == 1 && event != null) {
                    insertEvent(conn, event.taskId(), event.from(), event.to(), event.actor(), event.reason(), event.at());
                }
                conn.commit();
                return rows == 1;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Conditional task update failed", e);
        }
    }

    private List<Task> query(String sql, JdbcSupport.Binder binder) {
        List<Task> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                binder.bind(stmt);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        tasks.add(fromResultSet(rs));
                    }
                }
            }
            List<Task> withDependencies = new ArrayList<>(tasks.size());
            for (Task task : tasks) {
                withDependencies.add(task.withDependencies(loadDependencies(conn, task.id())));
            }
            return withDependencies;
        } catch (SQLException e) {
            throw new StoreException("Task query failed", e);
        }
    }

    private List<String> loadDependencies(Connection conn, String taskId) throws SQLException {
        List<String> dependencies = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_DEPENDENCIES_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    dependencies.add(rs.getString(1));
                }
            }
        }
        return dependencies;
    }

    private static void insertDependency(Connection conn, String taskId, String dependsOn, Instant at) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_DEPENDENCY_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, dependsOn);
            JdbcSupport.setInstant(stmt, 3, at);
            stmt.executeUpdate();
        }
    }

    private static void insertEvent(Connection conn, String taskId, TaskStatus from, TaskStatus to, String actor,
                                    String reason, Instant at) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_EVENT_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, from == null ? null : from.wireName());
            stmt.setString(3, to.wireName());
            stmt.setString(4, actor);
            stmt.setString(5, reason);
            JdbcSupport.setInstant(stmt, 6, at);
            stmt.executeUpdate();
        }
    }

    private static void requireEdge(TaskStatus from, TaskStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal status edge " + from.wireName() + " -> " + to.wireName());
        }
    }

    private static void requireAdvance(ExecutionStep from, ExecutionStep to) {
        if (!from.canAdvanceTo(to)) {
            throw new IllegalArgumentException("Illegal step edge " + from.wireName() + " -> " + to.wireName());
        }
    }

    private static Task fromResultSet(ResultSet rs) throws SQLException {
        String size = rs.getString("vm_size");
        return new Task(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("title"),
                rs.getString("prompt"),
                rs.getString("repository"),
                rs.getString("branch"),
                size == null ? null : NodeSize.fromWireName(size),
                rs.getString("vm_location"),
                rs.getString("preferred_node_id"),
                rs.getInt("priority"),
                TaskStatus.fromWireName(rs.getString("status")),
                ExecutionStep.fromWireName(rs.getString("execution_step")),
                rs.getString("node_id"),
                rs.getString("workspace_id"),
                rs.getString("session_id"),
                rs.getString("auto_provisioned_node_id"),
                rs.getString("output_branch"),
                rs.getString("output_pr_url"),
                rs.getString("error_message"),
                List.of(),
                JdbcSupport.getInstant(rs, "created_at"),
                JdbcSupport.getInstant(rs, "updated_at"),
                JdbcSupport.getInstant(rs, "started_at"),
                JdbcSupport.getInstant(rs, "completed_at"));
    }
}

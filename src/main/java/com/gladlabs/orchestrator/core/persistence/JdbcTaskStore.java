package com.gladlabs.orchestrator.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.InvalidTransitionException;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.PhaseStatus;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC-backed {@link TaskStore}.
 * <p>
 * One {@code orchestration_tasks} row per execution, with JSON text columns for the
 * input, result, error and phase results; one {@code orchestration_phase_attempts} row per
 * attempt keyed by {@code (execution_id, phase_name, attempt_number)}. Status writes are
 * conditional on the stored status so the state machine holds across processes.
 * The SQL runs on PostgreSQL and H2.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    static final String TASKS_TABLE = "orchestration_tasks";
    static final String ATTEMPTS_TABLE = "orchestration_phase_attempts";

    private static final String CREATE_TASKS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(64)  NOT NULL PRIMARY KEY,
                workflow_id      VARCHAR(255) NOT NULL,
                status           VARCHAR(32)  NOT NULL,
                input            TEXT,
                result           TEXT,
                error            TEXT,
                phase_results    TEXT,
                tags             TEXT,
                current_phase    VARCHAR(255),
                completed_phases INT          NOT NULL DEFAULT 0,
                total_phases     INT          NOT NULL DEFAULT 0,
                retry_count      INT          NOT NULL DEFAULT 0,
                created_at       TIMESTAMP    NOT NULL,
                started_at       TIMESTAMP,
                completed_at     TIMESTAMP
            )
            """.formatted(TASKS_TABLE);

    private static final String CREATE_ATTEMPTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                execution_id   VARCHAR(64)  NOT NULL,
                phase_name     VARCHAR(255) NOT NULL,
                attempt_number INT          NOT NULL,
                status         VARCHAR(32)  NOT NULL,
                provider_id    VARCHAR(255),
                quality_score  DOUBLE PRECISION,
                error_kind     VARCHAR(64),
                error_message  TEXT,
                duration_ms    BIGINT       NOT NULL,
                recorded_at    TIMESTAMP    NOT NULL,
                PRIMARY KEY (execution_id, phase_name, attempt_number)
            )
            """.formatted(ATTEMPTS_TABLE);

    private static final String TASK_COLUMNS = """
            id, workflow_id, status, input, result, error, phase_results, tags, current_phase,
            completed_phases, total_phases, retry_count, created_at, started_at, completed_at""";

    private static final String INSERT_TASK_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TASKS_TABLE, TASK_COLUMNS);

    private static final String SELECT_TASK_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(TASK_COLUMNS, TASKS_TABLE);

    private static final String SELECT_RECENT_SQL = """
            SELECT %s FROM %s ORDER BY created_at DESC LIMIT ?
            """.formatted(TASK_COLUMNS, TASKS_TABLE);

    private static final String SELECT_BY_STATUS_SQL = """
            SELECT %s FROM %s WHERE status = ? ORDER BY created_at ASC
            """.formatted(TASK_COLUMNS, TASKS_TABLE);

    private static final String CLAIM_SQL = """
            UPDATE %s SET status = ?, started_at = ? WHERE id = ? AND status = ?
            """.formatted(TASKS_TABLE);

    /** Followed by a status IN (...) list of the valid predecessors of the target status. */
    private static final String UPDATE_SQL_PREFIX = """
            UPDATE %s SET status = ?, result = ?, error = ?, phase_results = ?, current_phase = ?,
                completed_phases = ?, total_phases = ?, retry_count = ?, started_at = ?, completed_at = ?
            WHERE id = ? AND status IN\s""".formatted(TASKS_TABLE);

    private static final String INSERT_ATTEMPT_SQL = """
            INSERT INTO %s (execution_id, phase_name, attempt_number, status, provider_id, quality_score,
                            error_kind, error_message, duration_ms, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(ATTEMPTS_TABLE);

    private static final String SELECT_ATTEMPTS_SQL = """
            SELECT execution_id, phase_name, attempt_number, status, provider_id, quality_score,
                   error_kind, error_message, duration_ms, recorded_at
            FROM %s
            WHERE execution_id = ?
            ORDER BY recorded_at ASC, phase_name ASC, attempt_number ASC
            """.formatted(ATTEMPTS_TABLE);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, PhaseResult>> RESULTS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTaskStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates both tables if they do not already exist. Called once during startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement tasks = conn.prepareStatement(CREATE_TASKS_SQL);
             PreparedStatement attempts = conn.prepareStatement(CREATE_ATTEMPTS_SQL)) {
            tasks.execute();
            attempts.execute();
            log.info("Task store tables '{}' and '{}' ensured", TASKS_TABLE, ATTEMPTS_TABLE);
        }
    }

    @Override
    public Task create(Task task) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
            stmt.setString(1, task.id());
            stmt.setString(2, task.workflowId());
            stmt.setString(3, task.status().value());
            stmt.setString(4, toJson(task.input()));
            stmt.setString(5, task.result() == null ? null : toJson(task.result()));
            stmt.setString(6, task.error() == null ? null : toJson(task.error()));
            stmt.setString(7, toJson(task.phaseResults()));
            stmt.setString(8, toJson(task.tags()));
            stmt.setString(9, task.currentPhase());
            stmt.setInt(10, task.completedPhases());
            stmt.setInt(11, task.totalPhases());
            stmt.setInt(12, task.retryCount());
            stmt.setTimestamp(13, timestamp(task.createdAt()));
            stmt.setTimestamp(14, timestamp(task.startedAt()));
            stmt.setTimestamp(15, timestamp(task.completedAt()));
            stmt.executeUpdate();
            log.debug("Created task {} for workflow {}", task.id(), task.workflowId());
            return task;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to create task " + task.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Task> find(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_TASK_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(taskFrom(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to load task " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Task> claim(String id, Instant startedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CLAIM_SQL)) {
            stmt.setString(1, TaskStatus.PROCESSING.value());
            stmt.setTimestamp(2, timestamp(startedAt));
            stmt.setString(3, id);
            stmt.setString(4, TaskStatus.PENDING.value());
            if (stmt.executeUpdate() == 0) {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to claim task " + id + ": " + e.getMessage(), e);
        }
        return find(id);
    }

    @Override
    public Task update(Task task) {
        List<TaskStatus> predecessors = Arrays.stream(TaskStatus.values())
                .filter(s -> s.canTransitionTo(task.status()))
                .toList();
        if (predecessors.isEmpty()) {
            TaskStatus current = find(task.id()).map(Task::status).orElse(task.status());
            throw new InvalidTransitionException(task.id(), current, task.status());
        }
        String sql = UPDATE_SQL_PREFIX + predecessors.stream().map(s -> "?")
                .collect(Collectors.joining(", ", "(", ")"));
        int updated;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, task.status().value());
            stmt.setString(2, task.result() == null ? null : toJson(task.result()));
            stmt.setString(3, task.error() == null ? null : toJson(task.error()));
            stmt.setString(4, toJson(task.phaseResults()));
            stmt.setString(5, task.currentPhase());
            stmt.setInt(6, task.completedPhases());
            stmt.setInt(7, task.totalPhases());
            stmt.setInt(8, task.retryCount());
            stmt.setTimestamp(9, timestamp(task.startedAt()));
            stmt.setTimestamp(10, timestamp(task.completedAt()));
            stmt.setString(11, task.id());
            int index = 12;
            for (TaskStatus predecessor : predecessors) {
                stmt.setString(index++, predecessor.value());
            }
            updated = stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to update task " + task.id() + ": " + e.getMessage(), e);
        }
        if (updated == 0) {
            Task current = find(task.id())
                    .orElseThrow(() -> new TaskStoreException("Task not found: " + task.id()));
            throw new InvalidTransitionException(task.id(), current.status(), task.status());
        }
        return task;
    }

    @Override
    public List<Task> list(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            return tasksFrom(stmt);
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list tasks: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_STATUS_SQL)) {
            stmt.setString(1, status.value());
            return tasksFrom(stmt);
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list " + status.value() + " tasks: " + e.getMessage(), e);
        }
    }

    @Override
    public void recordAttempt(PhaseAttemptRecord attempt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_ATTEMPT_SQL)) {
            stmt.setString(1, attempt.executionId());
            stmt.setString(2, attempt.phaseName());
            stmt.setInt(3, attempt.attemptNumber());
            stmt.setString(4, attempt.status().value());
            stmt.setString(5, attempt.providerId());
            if (attempt.qualityScore() != null) {
                stmt.setDouble(6, attempt.qualityScore());
            } else {
                stmt.setNull(6, Types.DOUBLE);
            }
            stmt.setString(7, attempt.errorKind() == null ? null : attempt.errorKind().label());
            stmt.setString(8, attempt.errorMessage());
            stmt.setLong(9, attempt.durationMs());
            stmt.setTimestamp(10, timestamp(attempt.recordedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to record attempt " + attempt.attemptNumber() + " of "
                    + attempt.phaseName() + " for " + attempt.executionId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<PhaseAttemptRecord> attempts(String executionId) {
        List<PhaseAttemptRecord> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ATTEMPTS_SQL)) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    double score = rs.getDouble("quality_score");
                    Double qualityScore = rs.wasNull() ? null : score;
                    String kind = rs.getString("error_kind");
                    rows.add(new PhaseAttemptRecord(
                            rs.getString("execution_id"),
                            rs.getString("phase_name"),
                            rs.getInt("attempt_number"),
                            PhaseStatus.fromValue(rs.getString("status")),
                            rs.getString("provider_id"),
                            qualityScore,
                            kind == null ? null : ErrorKind.fromLabel(kind),
                            rs.getString("error_message"),
                            rs.getLong("duration_ms"),
                            instant(rs.getTimestamp("recorded_at"))));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to load attempts for " + executionId + ": " + e.getMessage(), e);
        }
        return rows;
    }

    @Override
    public boolean isHealthy() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return false;
        }
    }

    private List<Task> tasksFrom(PreparedStatement stmt) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tasks.add(taskFrom(rs));
            }
        }
        return tasks;
    }

    private Task taskFrom(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        String result = rs.getString("result");
        String error = rs.getString("error");
        String phaseResults = rs.getString("phase_results");
        String tags = rs.getString("tags");
        return new Task(
                id,
                TaskStatus.fromValue(rs.getString("status")),
                rs.getString("workflow_id"),
                fromJson(id, rs.getString("input"), MAP_TYPE),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("started_at")),
                instant(rs.getTimestamp("completed_at")),
                rs.getInt("retry_count"),
                result == null ? null : fromJson(id, result, MAP_TYPE),
                error == null ? null : fromJson(id, error, new TypeReference<TaskError>() {}),
                rs.getString("current_phase"),
                rs.getInt("completed_phases"),
                rs.getInt("total_phases"),
                phaseResults == null ? null : fromJson(id, phaseResults, RESULTS_TYPE),
                tags == null ? null : fromJson(id, tags, TAGS_TYPE));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to serialize " + value.getClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String taskId, String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Corrupt JSON column for task " + taskId + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}

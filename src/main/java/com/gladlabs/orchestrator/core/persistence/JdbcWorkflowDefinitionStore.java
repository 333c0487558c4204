package com.gladlabs.orchestrator.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.workflow.WorkflowDefinitionStore;
import com.gladlabs.orchestrator.core.workflow.WorkflowTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link WorkflowDefinitionStore}.
 * <p>
 * Custom definitions live in {@code custom_workflows}, one row each, with the phases and
 * tags as JSON text. Built-in templates are never written to the table; they are served
 * from {@link WorkflowTemplates} and their ids are reserved.
 */
public class JdbcWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowDefinitionStore.class);

    static final String TABLE = "custom_workflows";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64)  NOT NULL PRIMARY KEY,
                name        VARCHAR(255) NOT NULL,
                description TEXT,
                phases      TEXT         NOT NULL,
                owner_id    VARCHAR(255),
                tags        TEXT,
                is_template BOOLEAN      NOT NULL DEFAULT FALSE,
                created_at  TIMESTAMP    NOT NULL,
                updated_at  TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE);

    private static final String COLUMNS = "id, name, description, phases, owner_id, tags, is_template";

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE, COLUMNS);

    private static final String UPDATE_SQL = """
            UPDATE %s SET name = ?, description = ?, phases = ?, owner_id = ?, tags = ?, is_template = ?,
                updated_at = ?
            WHERE id = ?
            """.formatted(TABLE);

    private static final String SELECT_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s ORDER BY id ASC
            """.formatted(COLUMNS, TABLE);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE);

    private static final TypeReference<List<PhaseConfig>> PHASES_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Map<String, WorkflowDefinition> templates = new LinkedHashMap<>();

    public JdbcWorkflowDefinitionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        WorkflowTemplates.all().forEach(t -> templates.put(t.id(), t));
    }

    /**
     * Creates the table if it does not already exist. Called once during startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Workflow definition table '{}' ensured", TABLE);
        }
    }

    @Override
    public WorkflowDefinition save(WorkflowDefinition definition) {
        WorkflowDefinition toSave = definition.id() == null || definition.id().isBlank()
                ? definition.withId(UUID.randomUUID().toString())
                : definition;
        rejectTemplate(toSave.id(), "replaced");
        if (updateRow(toSave)) {
            log.debug("Replaced workflow {}", toSave.id());
            return toSave;
        }
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, toSave.id());
            stmt.setString(2, toSave.name());
            stmt.setString(3, toSave.description());
            stmt.setString(4, toJson(toSave.phases()));
            stmt.setString(5, toSave.ownerId());
            stmt.setString(6, toJson(toSave.tags()));
            stmt.setBoolean(7, toSave.isTemplate());
            stmt.setTimestamp(8, Timestamp.from(now));
            stmt.setTimestamp(9, Timestamp.from(now));
            stmt.executeUpdate();
            log.debug("Inserted workflow {}", toSave.id());
            return toSave;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to save workflow " + toSave.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<WorkflowDefinition> find(String id) {
        WorkflowDefinition template = templates.get(id);
        if (template != null) {
            return Optional.of(template);
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(definitionFrom(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to load workflow " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<WorkflowDefinition> list() {
        List<WorkflowDefinition> all = new ArrayList<>(templates.values());
        all.sort((a, b) -> a.id().compareTo(b.id()));
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                all.add(definitionFrom(rs));
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list workflows: " + e.getMessage(), e);
        }
        return all;
    }

    @Override
    public Optional<WorkflowDefinition> update(String id, WorkflowDefinition definition) {
        rejectTemplate(id, "replaced");
        WorkflowDefinition updated = definition.withId(id);
        return updateRow(updated) ? Optional.of(updated) : Optional.empty();
    }

    @Override
    public boolean delete(String id) {
        rejectTemplate(id, "deleted");
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, id);
            boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                log.debug("Deleted workflow {}", id);
            }
            return deleted;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to delete workflow " + id + ": " + e.getMessage(), e);
        }
    }

    private boolean updateRow(WorkflowDefinition definition) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, definition.name());
            stmt.setString(2, definition.description());
            stmt.setString(3, toJson(definition.phases()));
            stmt.setString(4, definition.ownerId());
            stmt.setString(5, toJson(definition.tags()));
            stmt.setBoolean(6, definition.isTemplate());
            stmt.setTimestamp(7, Timestamp.from(Instant.now()));
            stmt.setString(8, definition.id());
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to update workflow " + definition.id() + ": " + e.getMessage(), e);
        }
    }

    private void rejectTemplate(String id, String action) {
        if (templates.containsKey(id)) {
            throw new IllegalArgumentException("Built-in template cannot be " + action + ": " + id);
        }
    }

    private WorkflowDefinition definitionFrom(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        String tags = rs.getString("tags");
        return new WorkflowDefinition(
                id,
                rs.getString("name"),
                rs.getString("description"),
                fromJson(id, rs.getString("phases"), PHASES_TYPE),
                rs.getString("owner_id"),
                rs.getBoolean("is_template"),
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

    private <T> T fromJson(String workflowId, String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Corrupt JSON column for workflow " + workflowId + ": "
                    + e.getOriginalMessage(), e);
        }
    }
}

package com.gladlabs.orchestrator.core.persistence;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.InvalidTransitionException;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.PhaseStatus;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.TaskStateMachine;
import com.gladlabs.orchestrator.core.model.TaskStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs {@link JdbcTaskStore} against an in-memory H2 database.
 */
class JdbcTaskStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private JdbcTaskStore store;

    @BeforeEach
    void setUp() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:tasks-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        store = new JdbcTaskStore(dataSource);
        store.createTables();
    }

    private static Task pending(String id, Instant createdAt) {
        return Task.pending(id, "blog_post",
                Map.of("topic", "tides", "keywords", List.of("moon", "ocean")),
                3, List.of("science"), createdAt);
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws SQLException {
        store.createTables();
        assertTrue(store.isHealthy());
    }

    @Test
    @DisplayName("create then find round-trips every column")
    void roundTrip() {
        store.create(pending("a", T0));

        Task loaded = store.find("a").orElseThrow();
        assertEquals(TaskStatus.PENDING, loaded.status());
        assertEquals("blog_post", loaded.workflowId());
        assertEquals("tides", loaded.input().get("topic"));
        assertEquals(List.of("moon", "ocean"), loaded.input().get("keywords"));
        assertEquals(List.of("science"), loaded.tags());
        assertEquals(3, loaded.totalPhases());
        assertEquals(T0, loaded.createdAt());
        assertNull(loaded.startedAt());
        assertNull(loaded.result());
        assertTrue(loaded.phaseResults().isEmpty());
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    @DisplayName("duplicate create surfaces as a store error")
    void duplicateCreate() {
        store.create(pending("a", T0));
        assertThrows(TaskStoreException.class, () -> store.create(pending("a", T0)));
    }

    @Nested
    @DisplayName("Status updates")
    class Updates {

        @Test
        @DisplayName("claim succeeds once and stamps startedAt")
        void claimOnce() {
            store.create(pending("a", T0));

            Task claimed = store.claim("a", T0.plusSeconds(1)).orElseThrow();
            assertEquals(TaskStatus.PROCESSING, claimed.status());
            assertEquals(T0.plusSeconds(1), claimed.startedAt());
            assertTrue(store.claim("a", T0.plusSeconds(2)).isEmpty());
        }

        @Test
        @DisplayName("progress and completion persist phase results and the final result")
        void progressThenComplete() {
            store.create(pending("a", T0));
            Task claimed = store.claim("a", T0).orElseThrow();

            Map<String, PhaseResult> results = new LinkedHashMap<>();
            results.put("research", PhaseResult.succeeded("research", "notes", null, 1, 40, "local"));
            results.put("image", PhaseResult.skipped("image",
                    TaskError.of(ErrorKind.CHAIN_EXHAUSTED, "no image model").forPhase("image", 2), 2, 15));
            Task progressed = store.update(claimed.withProgress("image", results, 1));

            Task midway = store.find("a").orElseThrow();
            assertEquals("image", midway.currentPhase());
            assertEquals(2, midway.completedPhases());
            assertEquals(1, midway.retryCount());
            assertEquals(List.of("research", "image"), List.copyOf(midway.phaseResults().keySet()));
            PhaseResult image = midway.phaseResults().get("image");
            assertEquals(PhaseStatus.SKIPPED, image.status());
            assertEquals(ErrorKind.CHAIN_EXHAUSTED, image.error().kind());
            assertEquals("notes", midway.phaseResults().get("research").output());

            store.update(TaskStateMachine.complete(progressed, Map.of("final_output", "post"), T0.plusSeconds(9)));
            Task done = store.find("a").orElseThrow();
            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals("post", done.result().get("final_output"));
            assertEquals(T0.plusSeconds(9), done.completedAt());
        }

        @Test
        @DisplayName("a terminal row cannot be overwritten")
        void terminalIsFinal() {
            store.create(pending("a", T0));
            Task claimed = store.claim("a", T0).orElseThrow();
            store.update(TaskStateMachine.cancel(claimed, T0.plusSeconds(1)));

            var ex = assertThrows(InvalidTransitionException.class,
                    () -> store.update(TaskStateMachine.fail(claimed,
                            TaskError.of(ErrorKind.INTERNAL, "late"), T0.plusSeconds(2))));
            assertEquals(TaskStatus.CANCELLED, ex.getCurrentStatus());

            Task stored = store.find("a").orElseThrow();
            assertEquals(TaskStatus.CANCELLED, stored.status());
            assertEquals(ErrorKind.CANCELLED, stored.error().kind());
        }

        @Test
        @DisplayName("updating a missing task is a store error")
        void missingTask() {
            Task ghost = TaskStateMachine.start(pending("ghost", T0), T0);
            assertThrows(TaskStoreException.class, () -> store.update(ghost));
        }
    }

    @Test
    @DisplayName("list and findByStatus order by creation time")
    void ordering() {
        store.create(pending("old", T0));
        store.create(pending("mid", T0.plusSeconds(10)));
        store.create(pending("new", T0.plusSeconds(20)));
        store.claim("mid", T0.plusSeconds(30));

        assertEquals(List.of("new", "mid", "old"), store.list(10).stream().map(Task::id).toList());
        assertEquals(List.of("new"), store.list(1).stream().map(Task::id).toList());
        assertEquals(List.of("old", "new"),
                store.findByStatus(TaskStatus.PENDING).stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("attempts keep nullable score and error kind")
    void attempts() {
        store.recordAttempt(new PhaseAttemptRecord("a", "draft", 1, PhaseStatus.FAILED, "local", null,
                ErrorKind.PHASE_TIMEOUT, "timed out after 1s", 1000, T0));
        store.recordAttempt(new PhaseAttemptRecord("a", "draft", 2, PhaseStatus.SUCCEEDED, "cloud", 0.82,
                null, null, 350, T0.plusSeconds(2)));

        List<PhaseAttemptRecord> rows = store.attempts("a");
        assertEquals(2, rows.size());
        PhaseAttemptRecord failed = rows.get(0);
        assertEquals(ErrorKind.PHASE_TIMEOUT, failed.errorKind());
        assertNull(failed.qualityScore());
        assertEquals(PhaseStatus.FAILED, failed.status());
        PhaseAttemptRecord ok = rows.get(1);
        assertEquals(0.82, ok.qualityScore(), 1e-9);
        assertNull(ok.errorKind());
        assertEquals("cloud", ok.providerId());
        assertEquals(T0.plusSeconds(2), ok.recordedAt());
    }

    @Test
    @DisplayName("isHealthy is false when no connection can be opened")
    void unhealthy() throws SQLException {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("connection refused"));

        JdbcTaskStore unreachable = new JdbcTaskStore(broken);
        assertFalse(unreachable.isHealthy());
        assertThrows(TaskStoreException.class, () -> unreachable.find("a"));
    }

    @Test
    @DisplayName("config picks the JDBC store only when a DataSource exists")
    @SuppressWarnings("unchecked")
    void configSelection() throws SQLException {
        var config = new TaskStoreConfig();
        ObjectProvider<DataSource> none = mock(ObjectProvider.class);
        assertInstanceOf(InMemoryTaskStore.class, config.taskStore(none));

        JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:config-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        ObjectProvider<DataSource> some = mock(ObjectProvider.class);
        when(some.getIfAvailable()).thenReturn(h2);
        assertInstanceOf(JdbcTaskStore.class, config.taskStore(some));
    }
}

package com.gladlabs.orchestrator.core.persistence;

import com.gladlabs.orchestrator.core.workflow.InMemoryWorkflowDefinitionStore;
import com.gladlabs.orchestrator.core.workflow.WorkflowDefinitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link TaskStore} and {@link WorkflowDefinitionStore} beans.
 * <p>
 * When a {@link DataSource} is available (PostgreSQL configured), the JDBC stores are
 * created and their tables ensured. Otherwise in-memory stores are used, which are
 * suitable for development and tests but do not survive restarts.
 */
@Configuration
public class TaskStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskStoreConfig.class);

    @Bean
    public TaskStore taskStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource available = dataSource.getIfAvailable();
        if (available != null) {
            log.info("Configuring JDBC task store");
            var store = new JdbcTaskStore(available);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory task store (executions will not persist across restarts)");
        return new InMemoryTaskStore();
    }

    @Bean
    public WorkflowDefinitionStore workflowDefinitionStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource available = dataSource.getIfAvailable();
        if (available != null) {
            log.info("Configuring JDBC workflow definition store");
            var store = new JdbcWorkflowDefinitionStore(available);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory workflow definition store");
        return new InMemoryWorkflowDefinitionStore();
    }
}

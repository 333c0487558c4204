package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Definition store held in memory, seeded with {@link WorkflowTemplates}. Used when no
 * database is configured; custom definitions are lost on restart.
 */
public class InMemoryWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowDefinitionStore.class);

    private final ConcurrentHashMap<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    public InMemoryWorkflowDefinitionStore() {
        WorkflowTemplates.all().forEach(t -> definitions.put(t.id(), t));
        log.info("Registered {} built-in workflow templates", definitions.size());
    }

    @Override
    public WorkflowDefinition save(WorkflowDefinition definition) {
        WorkflowDefinition toSave = definition.id() == null || definition.id().isBlank()
                ? definition.withId(UUID.randomUUID().toString())
                : definition;
        WorkflowDefinition existing = definitions.get(toSave.id());
        if (existing != null && existing.isTemplate()) {
            throw new IllegalArgumentException("Built-in template cannot be replaced: " + toSave.id());
        }
        definitions.put(toSave.id(), toSave);
        return toSave;
    }

    @Override
    public Optional<WorkflowDefinition> find(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    @Override
    public List<WorkflowDefinition> list() {
        List<WorkflowDefinition> all = new ArrayList<>(definitions.values());
        all.sort(Comparator.comparing(WorkflowDefinition::isTemplate).reversed()
                .thenComparing(WorkflowDefinition::id));
        return all;
    }

    @Override
    public Optional<WorkflowDefinition> update(String id, WorkflowDefinition definition) {
        WorkflowDefinition existing = definitions.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        if (existing.isTemplate()) {
            throw new IllegalArgumentException("Built-in template cannot be replaced: " + id);
        }
        WorkflowDefinition updated = definition.withId(id);
        definitions.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public boolean delete(String id) {
        WorkflowDefinition existing = definitions.get(id);
        if (existing == null) {
            return false;
        }
        if (existing.isTemplate()) {
            throw new IllegalArgumentException("Built-in template cannot be deleted: " + id);
        }
        return definitions.remove(id) != null;
    }
}

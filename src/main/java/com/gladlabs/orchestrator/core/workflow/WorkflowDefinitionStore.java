package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Stores workflow definitions, including the built-in templates.
 */
public interface WorkflowDefinitionStore {

    /**
     * Saves the definition, assigning an id when it has none. A custom definition with the
     * same id is replaced.
     *
     * @throws IllegalArgumentException when the id belongs to a built-in template
     */
    WorkflowDefinition save(WorkflowDefinition definition);

    Optional<WorkflowDefinition> find(String id);

    /** Templates first, then custom definitions by id. */
    List<WorkflowDefinition> list();

    /**
     * Replaces an existing custom definition, keeping its id.
     *
     * @return the stored definition, or empty when no definition has this id
     * @throws IllegalArgumentException when the definition is a built-in template
     */
    Optional<WorkflowDefinition> update(String id, WorkflowDefinition definition);

    /**
     * @return false when no such definition exists
     * @throws IllegalArgumentException when the definition is a built-in template
     */
    boolean delete(String id);
}

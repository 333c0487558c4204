package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * User-authored (or built-in template) ordered list of phases.
 *
 * @param id          definition id
 * @param name        display name
 * @param description free text
 * @param phases      phases in execution order
 * @param ownerId     author, null for built-in templates
 * @param isTemplate  true for built-in templates
 * @param tags        labels copied onto every execution
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowDefinition(
    String id,
    String name,
    String description,
    List<PhaseConfig> phases,
    @JsonProperty("owner_id") String ownerId,
    @JsonProperty("is_template") boolean isTemplate,
    List<String> tags
) implements Serializable {

    public WorkflowDefinition {
        phases = phases == null ? List.of() : List.copyOf(phases);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public WorkflowDefinition withId(String newId) {
        return new WorkflowDefinition(newId, name, description, phases, ownerId, isTemplate, tags);
    }

    public WorkflowDefinition withPhases(List<PhaseConfig> newPhases) {
        return new WorkflowDefinition(id, name, description, newPhases, ownerId, isTemplate, tags);
    }
}

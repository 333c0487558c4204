package com.gladlabs.orchestrator.dispatch.api;

import com.gladlabs.orchestrator.core.engine.ExecutionService;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.workflow.AvailablePhase;
import com.gladlabs.orchestrator.core.workflow.ValidationReport;
import com.gladlabs.orchestrator.core.workflow.WorkflowNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Workflow definitions and the phase catalog.
 */
@RestController
@RequestMapping("/api/v1")
public class WorkflowController {

    private final ExecutionService executionService;

    public WorkflowController(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @GetMapping("/phases")
    public List<AvailablePhase> listPhases() {
        return executionService.listAvailablePhases();
    }

    @GetMapping("/workflows")
    public List<WorkflowDefinition> listWorkflows() {
        return executionService.listWorkflows();
    }

    @GetMapping("/workflows/{id}")
    public WorkflowDefinition getWorkflow(@PathVariable String id) {
        return executionService.findWorkflow(id).orElseThrow(() -> new WorkflowNotFoundException(id));
    }

    /**
     * POST /api/v1/workflows: Store a custom definition; 400 with the report when invalid.
     */
    @PostMapping("/workflows")
    public ResponseEntity<WorkflowDefinition> registerWorkflow(@RequestBody WorkflowDefinition definition) {
        return ResponseEntity.status(HttpStatus.CREATED).body(executionService.registerWorkflow(definition));
    }

    /**
     * PUT /api/v1/workflows/{id}: Replace a custom definition; templates are read-only.
     */
    @PutMapping("/workflows/{id}")
    public WorkflowDefinition updateWorkflow(@PathVariable String id, @RequestBody WorkflowDefinition definition) {
        return executionService.updateWorkflow(id, definition);
    }

    /**
     * DELETE /api/v1/workflows/{id}: 204 when removed, 404 when unknown.
     */
    @DeleteMapping("/workflows/{id}")
    public ResponseEntity<Void> deleteWorkflow(@PathVariable String id) {
        executionService.deleteWorkflow(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/workflows/validate: Always 200; validity is in the body.
     */
    @PostMapping("/workflows/validate")
    public ValidationReport validate(@RequestBody WorkflowDefinition definition) {
        return executionService.validateWorkflowDefinition(definition);
    }
}

package com.gladlabs.orchestrator.dispatch.api;

import com.gladlabs.orchestrator.core.engine.CancelResult;
import com.gladlabs.orchestrator.core.engine.ExecutionService;
import com.gladlabs.orchestrator.core.engine.ExecutionStatusView;
import com.gladlabs.orchestrator.core.engine.ExecutionTicket;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for execution lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final ExecutionService executionService;
    private final SseStreamingService sseStreamingService;

    public ExecutionController(ExecutionService executionService, SseStreamingService sseStreamingService) {
        this.executionService = executionService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/executions: Start a workflow. Runs asynchronously; returns 202.
     */
    @PostMapping
    public ResponseEntity<?> createExecution(@RequestBody ExecutionRequest request) {
        if (request.workflowId() == null || request.workflowId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "workflow_id is required",
                    "kind", "ValidationFailure"));
        }
        ExecutionTicket ticket = executionService.createExecution(request.workflowId(),
                request.input() == null ? Map.of() : request.input());
        log.info("Accepted execution {} for workflow {}", ticket.executionId(), request.workflowId());
        return ResponseEntity.accepted().body(ticket);
    }

    /**
     * GET /api/v1/executions: Most recent executions first.
     */
    @GetMapping
    public List<ExecutionStatusView> listExecutions(@RequestParam(defaultValue = "50") int limit) {
        return executionService.listExecutions(limit);
    }

    @GetMapping("/{id}")
    public ExecutionStatusView getExecution(@PathVariable String id) {
        return executionService.getExecutionStatus(id);
    }

    /**
     * GET /api/v1/executions/{id}/attempts: Phase attempt audit trail.
     */
    @GetMapping("/{id}/attempts")
    public List<PhaseAttemptRecord> getAttempts(@PathVariable String id) {
        return executionService.getAttempts(id);
    }

    /**
     * POST /api/v1/executions/{id}/cancel: 200 when accepted, 409 when the execution already finished.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<CancelResult> cancel(@PathVariable String id) {
        CancelResult result = executionService.cancelExecution(id);
        return result.accepted() ? ResponseEntity.ok(result) : ResponseEntity.status(409).body(result);
    }

    /**
     * GET /api/v1/executions/{id}/events: Server-sent events for one execution. A finished
     * execution gets its final status and the stream closes.
     */
    @GetMapping(value = "/{id}/events", produces = "text/event-stream")
    public SseEmitter streamEvents(@PathVariable String id) {
        executionService.getExecutionStatus(id);
        SseEmitter emitter = sseStreamingService.createEmitter(id);
        // read again after subscribing so a terminal event published in between is not lost
        ExecutionStatusView current = executionService.getExecutionStatus(id);
        if (current.status().isTerminal()) {
            sseStreamingService.sendFinalStatus(emitter, current);
        }
        return emitter;
    }
}

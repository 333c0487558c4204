package com.gladlabs.orchestrator.dispatch.api;

import com.gladlabs.orchestrator.core.engine.ExecutionNotFoundException;
import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;
import com.gladlabs.orchestrator.core.workflow.WorkflowNotFoundException;
import com.gladlabs.orchestrator.core.workflow.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestration exceptions to {@code {error, kind, errors?}} bodies. No stack traces
 * reach the caller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(WorkflowValidationException e) {
        Map<String, Object> body = body(e.getMessage(), e.kind());
        body.put("errors", e.getReport().errors());
        body.put("warnings", e.getReport().warnings());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({WorkflowNotFoundException.class, ExecutionNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(OrchestrationException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(e.getMessage(), e.kind()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(body(e.getMessage(), ErrorKind.VALIDATION_FAILURE));
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<Map<String, Object>> orchestration(OrchestrationException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(e.getMessage(), e.kind()));
    }

    private static Map<String, Object> body(String message, ErrorKind kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("kind", kind.label());
        return body;
    }
}

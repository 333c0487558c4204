package com.gladlabs.orchestrator.core.model;

/**
 * Base class for orchestration failures. Each subclass maps onto one {@link ErrorKind}
 * so failures can be converted into a {@link TaskError} at the workflow boundary.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public TaskError toTaskError() {
        return TaskError.of(kind(), getMessage());
    }
}

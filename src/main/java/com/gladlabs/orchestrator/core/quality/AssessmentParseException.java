package com.gladlabs.orchestrator.core.quality;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

/**
 * Thrown when a QA response cannot be parsed into a {@link QualityAssessment}.
 */
public class AssessmentParseException extends OrchestrationException {

    public AssessmentParseException(String message) {
        super(message);
    }

    public AssessmentParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_FAILURE;
    }
}

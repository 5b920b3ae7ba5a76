package com.phonepe.contextspace.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Internal error codes. Recoverable errors are absorbed by the pipeline, the rest are surfaced to the caller.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    EMBEDDING_FAILURE("Embedding generation failed. Error: %s", false),
    STORE_READ_FAILURE("Read from %s failed. Error: %s", true),
    STORE_WRITE_FAILURE("Write to %s failed. Error: %s", false),
    VALIDATION_FAILURE("Invalid value for field %s: %s", false),
    RESOLUTION_FAILURE("Identity resolution failed. Error: %s", true),
    ESCALATION_STORE_FAILURE("Escalation ticket could not be stored. Error: %s", false),
    SERIALIZATION_FAILURE("Error serializing object. Error: %s", false),
    INVALID_STATE_TRANSITION("Ticket %s cannot move from %s to %s", false),
    NOT_FOUND("%s not found", false),
    ;

    private final String message;
    private final boolean recoverable;
}

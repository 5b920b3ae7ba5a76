package com.phonepe.contextspace.core.errors;

import lombok.Getter;

/**
 * Raised when an inbound request is rejected before any store is touched
 */
@Getter
public class ValidationException extends ContextSpaceException {
    private final String field;

    public ValidationException(String field, String reason) {
        super(ErrorType.VALIDATION_FAILURE, ErrorType.VALIDATION_FAILURE.getMessage().formatted(field, reason), null);
        this.field = field;
    }

    public static ValidationException blank(String field) {
        return new ValidationException(field, "must not be blank");
    }
}

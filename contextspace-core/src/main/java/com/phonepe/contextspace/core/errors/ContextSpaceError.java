package com.phonepe.contextspace.core.errors;

import lombok.Value;

/**
 * Caller visible error. Internals are reduced to an error code, only validation failures name the field.
 */
@Value
public class ContextSpaceError {
    public static final String GENERIC_MESSAGE = "Request could not be processed";

    String message;
    ErrorType code;
    StoreType store;
    String field;

    public static ContextSpaceError from(Throwable throwable) {
        if (throwable instanceof ValidationException validation) {
            return new ContextSpaceError(GENERIC_MESSAGE, validation.getErrorType(), null, validation.getField());
        }
        if (throwable instanceof ContextSpaceException contextSpaceException) {
            return new ContextSpaceError(GENERIC_MESSAGE,
                                         contextSpaceException.getErrorType(),
                                         contextSpaceException.getStoreType(),
                                         null);
        }
        if (throwable != null && throwable.getCause() != null && throwable.getCause() != throwable) {
            return from(throwable.getCause());
        }
        return new ContextSpaceError(GENERIC_MESSAGE, null, null, null);
    }
}

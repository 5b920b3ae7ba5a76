package com.phonepe.contextspace.core.errors;

import lombok.Getter;

/**
 * Base exception for all failures raised by context space components
 */
@Getter
public class ContextSpaceException extends RuntimeException {
    private final ErrorType errorType;
    private final StoreType storeType;

    public ContextSpaceException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, null, message, cause);
    }

    public ContextSpaceException(ErrorType errorType, StoreType storeType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.storeType = storeType;
    }

    public static ContextSpaceException embeddingFailure(Throwable cause) {
        return new ContextSpaceException(ErrorType.EMBEDDING_FAILURE,
                                         ErrorType.EMBEDDING_FAILURE.getMessage().formatted(rootMessage(cause)),
                                         cause);
    }

    public static ContextSpaceException readFailure(StoreType store, Throwable cause) {
        return new ContextSpaceException(ErrorType.STORE_READ_FAILURE,
                                         store,
                                         ErrorType.STORE_READ_FAILURE.getMessage()
                                                 .formatted(store.getDisplayName(), rootMessage(cause)),
                                         cause);
    }

    public static ContextSpaceException writeFailure(StoreType store, Throwable cause) {
        return new ContextSpaceException(ErrorType.STORE_WRITE_FAILURE,
                                         store,
                                         ErrorType.STORE_WRITE_FAILURE.getMessage()
                                                 .formatted(store.getDisplayName(), rootMessage(cause)),
                                         cause);
    }

    public static ContextSpaceException writeFailure(StoreType store, String reason) {
        return new ContextSpaceException(ErrorType.STORE_WRITE_FAILURE,
                                         store,
                                         ErrorType.STORE_WRITE_FAILURE.getMessage()
                                                 .formatted(store.getDisplayName(), reason),
                                         null);
    }

    public static ContextSpaceException escalationStoreFailure(Throwable cause) {
        return new ContextSpaceException(ErrorType.ESCALATION_STORE_FAILURE,
                                         StoreType.ESCALATIONS,
                                         ErrorType.ESCALATION_STORE_FAILURE.getMessage().formatted(rootMessage(cause)),
                                         cause);
    }

    public static ContextSpaceException serializationFailure(Throwable cause) {
        return new ContextSpaceException(ErrorType.SERIALIZATION_FAILURE,
                                         ErrorType.SERIALIZATION_FAILURE.getMessage().formatted(rootMessage(cause)),
                                         cause);
    }

    public static ContextSpaceException notFound(String what) {
        return new ContextSpaceException(ErrorType.NOT_FOUND, ErrorType.NOT_FOUND.getMessage().formatted(what), null);
    }

    /**
     * Walks down to the innermost cause and returns its message
     */
    public static String rootMessage(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        var current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}

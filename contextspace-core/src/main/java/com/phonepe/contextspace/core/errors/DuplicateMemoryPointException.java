package com.phonepe.contextspace.core.errors;

import lombok.Getter;

/**
 * Raised by a long term memory store when a point with the same id was already inserted
 */
@Getter
public class DuplicateMemoryPointException extends ContextSpaceException {
    private final String pointId;

    public DuplicateMemoryPointException(String pointId) {
        super(ErrorType.STORE_WRITE_FAILURE,
              StoreType.LONG_TERM_MEMORY,
              ErrorType.STORE_WRITE_FAILURE.getMessage()
                      .formatted(StoreType.LONG_TERM_MEMORY.getDisplayName(),
                                 "Memory point %s already exists".formatted(pointId)),
              null);
        this.pointId = pointId;
    }
}

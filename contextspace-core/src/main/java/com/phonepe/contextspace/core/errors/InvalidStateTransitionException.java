package com.phonepe.contextspace.core.errors;

import com.phonepe.contextspace.core.model.EscalationStatus;

/**
 * Raised when a ticket is asked to move backwards in its lifecycle
 */
public class InvalidStateTransitionException extends ContextSpaceException {
    public InvalidStateTransitionException(String ticketId, EscalationStatus from, EscalationStatus to) {
        super(ErrorType.INVALID_STATE_TRANSITION,
              ErrorType.INVALID_STATE_TRANSITION.getMessage().formatted(ticketId, from, to),
              null);
    }
}

package com.example.rentalrepairs.exception;

import com.example.rentalrepairs.model.enums.TenantRequestStatus;

/**
 * The target status is not a successor of the current one. Valid callers never get here; it
 * points at stale data or a programming error.
 */
public class IllegalStatusTransitionException extends InvariantViolationException {

    private final TenantRequestStatus from;
    private final TenantRequestStatus to;

    public IllegalStatusTransitionException(Object requestId, TenantRequestStatus from, TenantRequestStatus to) {
        super(from.isTerminal() ? InvariantRule.TERMINAL_REQUEST_IMMUTABLE : InvariantRule.STATUS_TRANSITION,
                "TenantRequest", requestId,
                "Cannot transition request " + requestId + " from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public TenantRequestStatus getFrom() {
        return from;
    }

    public TenantRequestStatus getTo() {
        return to;
    }
}

package com.example.rentalrepairs.exception;

import com.example.rentalrepairs.model.enums.RequestAction;

/**
 * The acting principal has no relationship to the request that permits the action.
 * Expected during normal use; kept apart from invariant violations so callers answer "forbidden".
 */
public class AuthorizationException extends DomainException {

    private final RequestAction action;
    private final String userId;

    public AuthorizationException(RequestAction action, String userId, String aggregateType, Object aggregateId) {
        super("User " + userId + " is not allowed to " + action + " " + aggregateType + " " + aggregateId,
                aggregateType, aggregateId);
        this.action = action;
        this.userId = userId;
    }

    public RequestAction getAction() {
        return action;
    }

    public String getUserId() {
        return userId;
    }
}

package com.example.rentalrepairs.security;

import com.example.rentalrepairs.exception.AuthorizationException;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.enums.RequestAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Who may do what to a tenant request.
 *
 * <ul>
 *   <li>tenants submit requests and view their own;</li>
 *   <li>the property's superintendent or the system reviews, assigns, declines, escalates and
 *       resolves escalations;</li>
 *   <li>only the assigned worker or the superintendent starts and completes work.</li>
 * </ul>
 */
@Component
public class RequestAuthorizationPolicy {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthorizationPolicy.class);

    public boolean isAllowed(Principal principal, RequestAction action, TenantRequest request) {
        UUID propertyId = request.getPropertyId();
        return switch (action) {
            case SUBMIT -> principal.isTenant(request.getTenantId());
            case VIEW -> principal.isTenant(request.getTenantId())
                    || principal.manages(propertyId)
                    || principal.isWorker(request.getAssignedWorkerId())
                    || principal.isSystem();
            case REVIEW, ASSIGN, DECLINE, ESCALATE, RESOLVE_ESCALATION ->
                    principal.manages(propertyId) || principal.isSystem();
            case START_WORK, COMPLETE_WORK ->
                    principal.isWorker(request.getAssignedWorkerId()) || principal.manages(propertyId);
        };
    }

    public void authorize(Principal principal, RequestAction action, TenantRequest request) {
        if (!isAllowed(principal, action, request)) {
            log.warn("Authorization denied: user={} action={} request={}", principal.userId(), action, request.getId());
            throw new AuthorizationException(action, principal.userId(), "TenantRequest", request.getId());
        }
    }

    /**
     * Filing happens before a request exists, so it is checked against the tenancy alone.
     */
    public void authorizeSubmission(Principal principal, UUID propertyId, UUID tenantId) {
        if (!principal.isTenant(tenantId)) {
            log.warn("Authorization denied: user={} action={} property={}", principal.userId(), RequestAction.SUBMIT, propertyId);
            throw new AuthorizationException(RequestAction.SUBMIT, principal.userId(), "Property", propertyId);
        }
    }
}

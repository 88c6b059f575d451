package com.example.rentalrepairs.security;

import com.example.rentalrepairs.TestFixtures;
import com.example.rentalrepairs.exception.AuthorizationException;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.enums.PrincipalRole;
import com.example.rentalrepairs.model.enums.RequestAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static com.example.rentalrepairs.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestAuthorizationPolicyTest {

    private final RequestAuthorizationPolicy policy = new RequestAuthorizationPolicy();

    private TenantRequest request;
    private UUID workerId;
    private Principal tenant;
    private Principal superintendent;
    private Principal assignedWorker;
    private Principal otherWorker;
    private Principal system;
    private Principal stranger;

    @BeforeEach
    void setUp() {
        request = TestFixtures.plumbingRequest();
        workerId = UUID.randomUUID();
        tenant = new Principal("ann@elm.example", Set.of(PrincipalRole.TENANT), Set.of(request.getTenantId()), null, Set.of());
        superintendent = new Principal(TestFixtures.SUPERINTENDENT, Set.of(PrincipalRole.SUPERINTENDENT), Set.of(), null,
                Set.of(request.getPropertyId()));
        assignedWorker = new Principal("pat@crew.example", Set.of(PrincipalRole.WORKER), Set.of(), workerId, Set.of());
        otherWorker = new Principal("eli@crew.example", Set.of(PrincipalRole.WORKER), Set.of(), UUID.randomUUID(), Set.of());
        system = new Principal("system", Set.of(PrincipalRole.SYSTEM), Set.of(), null, Set.of());
        stranger = Principal.anonymous("nobody@example.com");
    }

    @Test
    void superintendentAndSystem_manageTheRequest() {
        for (RequestAction action : new RequestAction[]{RequestAction.REVIEW, RequestAction.ASSIGN,
                RequestAction.DECLINE, RequestAction.ESCALATE, RequestAction.RESOLVE_ESCALATION}) {
            assertThat(policy.isAllowed(superintendent, action, request)).as(action.name()).isTrue();
            assertThat(policy.isAllowed(system, action, request)).as(action.name()).isTrue();
            assertThat(policy.isAllowed(tenant, action, request)).as(action.name()).isFalse();
            assertThat(policy.isAllowed(assignedWorker, action, request)).as(action.name()).isFalse();
        }
    }

    @Test
    void onlyAssignedWorkerOrSuperintendent_performWork() {
        request.assign(workerId, TestFixtures.SUPERINTENDENT, NOW);

        assertThat(policy.isAllowed(assignedWorker, RequestAction.START_WORK, request)).isTrue();
        assertThat(policy.isAllowed(superintendent, RequestAction.COMPLETE_WORK, request)).isTrue();
        assertThat(policy.isAllowed(otherWorker, RequestAction.START_WORK, request)).isFalse();
        assertThat(policy.isAllowed(tenant, RequestAction.COMPLETE_WORK, request)).isFalse();
        assertThat(policy.isAllowed(system, RequestAction.START_WORK, request)).isFalse();
    }

    @Test
    void view_isLimitedToPartiesOfTheRequest() {
        request.assign(workerId, TestFixtures.SUPERINTENDENT, NOW);

        assertThat(policy.isAllowed(tenant, RequestAction.VIEW, request)).isTrue();
        assertThat(policy.isAllowed(superintendent, RequestAction.VIEW, request)).isTrue();
        assertThat(policy.isAllowed(assignedWorker, RequestAction.VIEW, request)).isTrue();
        assertThat(policy.isAllowed(system, RequestAction.VIEW, request)).isTrue();
        assertThat(policy.isAllowed(otherWorker, RequestAction.VIEW, request)).isFalse();
        assertThat(policy.isAllowed(stranger, RequestAction.VIEW, request)).isFalse();
    }

    @Test
    void authorize_throwsWithActionAndUser() {
        assertThatThrownBy(() -> policy.authorize(stranger, RequestAction.ASSIGN, request))
                .isInstanceOf(AuthorizationException.class)
                .hasMessageContaining("nobody@example.com")
                .extracting("action").isEqualTo(RequestAction.ASSIGN);
    }

    @Test
    void authorizeSubmission_requiresTheTenancy() {
        policy.authorizeSubmission(tenant, request.getPropertyId(), request.getTenantId());

        assertThatThrownBy(() -> policy.authorizeSubmission(superintendent, request.getPropertyId(), request.getTenantId()))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> policy.authorizeSubmission(tenant, request.getPropertyId(), UUID.randomUUID()))
                .isInstanceOf(AuthorizationException.class);
    }
}

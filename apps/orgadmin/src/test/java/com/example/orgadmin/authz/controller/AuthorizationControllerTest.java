package com.example.orgadmin.authz.controller;

import com.example.orgadmin.authz.actor.ActorResolver;
import com.example.orgadmin.authz.dto.PermissionCheckRequest;
import com.example.orgadmin.authz.dto.PermissionCheckRequest.PermissionTuple;
import com.example.orgadmin.authz.engine.PolicyEvaluator;
import com.example.orgadmin.authz.exception.MissingActorException;
import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.AuthorizationResult;
import com.example.orgadmin.authz.model.Decision;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.PermissionDecision;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.service.PermissionCacheInvalidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static com.example.orgadmin.util.ActorTestBuilder.anActor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthorizationController")
class AuthorizationControllerTest {

    private static final Actor ACTOR = anActor().withId("u1").build();

    @Mock
    private PolicyEvaluator policyEvaluator;

    @Mock
    private PermissionCacheInvalidator cacheInvalidator;

    @Mock
    private ActorResolver actorResolver;

    private AuthorizationController controller;
    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        controller = new AuthorizationController(policyEvaluator, cacheInvalidator, actorResolver);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/permissions/check").build());
    }

    @Nested
    @DisplayName("POST /api/permissions/check")
    class Check {

        @Test
        @DisplayName("should report per-tuple decisions and denied reasons")
        void shouldReportDecisions() {
            PermissionCheckRequest request = new PermissionCheckRequest(
                    List.of(new PermissionTuple("user", "READ", "OWN"), new PermissionTuple("user", "DELETE", null)),
                    new PermissionCheckRequest.ResourceIds(Map.of("id", "u1"), null, null));
            RequiredPermission read = RequiredPermission.of("user", "READ", "OWN");
            RequiredPermission delete = RequiredPermission.of("user", "DELETE");
            when(actorResolver.resolve(exchange)).thenReturn(Mono.just(ACTOR));
            when(policyEvaluator.evaluate(eq(ACTOR), eq(List.of(read, delete)), any()))
                    .thenReturn(Mono.just(AuthorizationResult.of(List.of(
                            new PermissionDecision(read, Decision.allow(DecisionSource.SCOPE_OWNERSHIP, "Allowed by OWN scope")),
                            new PermissionDecision(delete, Decision.deny(DecisionSource.DEFAULT, "no permission for user:DELETE"))))));

            StepVerifier.create(controller.check(request, exchange))
                    .assertNext(response -> {
                        assertThat(response.allowed()).isFalse();
                        assertThat(response.deniedReasons()).containsExactly("no permission for user:DELETE");
                        assertThat(response.decisions()).hasSize(2);
                        assertThat(response.decisions().get(0).scope()).isEqualTo("OWN");
                        assertThat(response.decisions().get(0).source()).isEqualTo("SCOPE_OWNERSHIP");
                        assertThat(response.decisions().get(1).scope()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail with MissingActorException without actor")
        void shouldRequireActor() {
            PermissionCheckRequest request = new PermissionCheckRequest(
                    List.of(new PermissionTuple("user", "READ", null)), null);
            when(actorResolver.resolve(exchange)).thenReturn(Mono.empty());

            StepVerifier.create(controller.check(request, exchange))
                    .expectError(MissingActorException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("cache endpoints")
    class CacheEndpoints {

        @Test
        @DisplayName("should invalidate a user's decisions and answer 204")
        void shouldInvalidateUser() {
            when(cacheInvalidator.invalidateUserCache("u9")).thenReturn(Mono.empty());

            StepVerifier.create(controller.invalidateUserCache("u9", exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT))
                    .verifyComplete();
            verify(cacheInvalidator).invalidateUserCache("u9");
        }

        @Test
        @DisplayName("should invalidate the holders of a role")
        void shouldInvalidateRoleHolders() {
            when(cacheInvalidator.onRolePermissionsChanged("instructor")).thenReturn(Mono.empty());

            StepVerifier.create(controller.invalidateRoleCache("instructor", exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should invalidate every decision")
        void shouldInvalidateAll() {
            when(cacheInvalidator.invalidateAllCache()).thenReturn(Mono.empty());

            StepVerifier.create(controller.invalidateAllCache(exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT))
                    .verifyComplete();
        }
    }
}

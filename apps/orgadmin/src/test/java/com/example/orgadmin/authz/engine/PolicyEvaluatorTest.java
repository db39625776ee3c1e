package com.example.orgadmin.authz.engine;

import com.example.orgadmin.authz.audit.DecisionEvent;
import com.example.orgadmin.authz.bypass.BypassAuthorityCheck;
import com.example.orgadmin.authz.cache.DecisionCache;
import com.example.orgadmin.authz.cache.InMemoryDecisionCacheStore;
import com.example.orgadmin.authz.exception.AuthorizationUnavailableException;
import com.example.orgadmin.authz.exception.DataStoreUnavailableException;
import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.AuthorizationResult;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.PermissionScope;
import com.example.orgadmin.authz.model.RequestResourceIds;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.scope.DepartmentOwnershipResolver;
import com.example.orgadmin.authz.scope.SchoolOwnershipResolver;
import com.example.orgadmin.authz.scope.ScopeOwnershipChecker;
import com.example.orgadmin.authz.scope.UserOwnershipResolver;
import com.example.orgadmin.authz.service.PermissionCacheInvalidator;
import com.example.orgadmin.authz.source.DirectUserPermissionSource;
import com.example.orgadmin.authz.source.PositionPermissionSource;
import com.example.orgadmin.authz.source.RolePermissionSource;
import com.example.orgadmin.authz.source.UserOverrideSource;
import com.example.orgadmin.config.properties.AuthzProperties;
import com.example.orgadmin.datastore.OrganizationDataStore;
import com.example.orgadmin.observability.metrics.AuthorizationMetrics;
import com.example.orgadmin.observability.metrics.CacheMetricsService;
import com.example.orgadmin.util.InMemoryPermissionDataStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.example.orgadmin.util.ActorTestBuilder.anActor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PolicyEvaluator")
class PolicyEvaluatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private OrganizationDataStore organizationDataStore;

    private InMemoryPermissionDataStore store;
    private DecisionCache decisionCache;
    private List<DecisionEvent> recorded;
    private SimpleMeterRegistry meterRegistry;
    private PolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new InMemoryPermissionDataStore();
        meterRegistry = new SimpleMeterRegistry();
        AuthzProperties properties = AuthzProperties.defaults();
        decisionCache = new DecisionCache(
                new InMemoryDecisionCacheStore(1_000, Ticker.systemTicker()),
                properties,
                new ObjectMapper(),
                new CacheMetricsService(meterRegistry));
        ScopeOwnershipChecker ownershipChecker = new ScopeOwnershipChecker(
                List.of(new UserOwnershipResolver(organizationDataStore),
                        new DepartmentOwnershipResolver(organizationDataStore),
                        new SchoolOwnershipResolver()),
                properties);
        recorded = new CopyOnWriteArrayList<>();

        evaluator = new PolicyEvaluator(
                new UserOverrideSource(store),
                new DirectUserPermissionSource(store),
                new RolePermissionSource(store),
                new PositionPermissionSource(),
                ownershipChecker,
                new BypassAuthorityCheck(store, decisionCache),
                decisionCache,
                new AuthorizationMetrics(meterRegistry),
                CLOCK,
                recorded::add);
    }

    private AuthorizationResult evaluate(Actor actor, RequiredPermission... permissions) {
        return evaluator.evaluate(actor, List.of(permissions)).block();
    }

    @Nested
    @DisplayName("source precedence")
    class Precedence {

        @Test
        @DisplayName("should deny with override reason even when a role grants ALL")
        void shouldDenyWithOverrideReasonEvenWhenRoleGrantsAll() {
            store.withOverride("u2", "role", "DELETE", false)
                    .withRoleGrant("r-admin", "role", "DELETE", PermissionScope.ALL)
                    .withMembership("u2", "r-admin");

            AuthorizationResult result = evaluate(anActor().withId("u2").build(),
                    RequiredPermission.of("role", "DELETE", "ALL"));

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedReasons()).containsExactly("Denied by user override for role:DELETE");
            assertThat(result.decisions().get(0).decision().source()).isEqualTo(DecisionSource.USER_OVERRIDE);
        }

        @Test
        @DisplayName("should deny with override reason even with a direct grant")
        void shouldDenyWithOverrideReasonEvenWithDirectGrant() {
            store.withOverride("u1", "school", "UPDATE", false)
                    .withDirectGrant("u1", "school", "UPDATE");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("school", "UPDATE"));

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedReasons()).containsExactly("Denied by user override for school:UPDATE");
        }

        @Test
        @DisplayName("should allow by override without consulting lower sources")
        void shouldAllowByOverride() {
            store.withOverride("u1", "school", "UPDATE", true);

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("school", "UPDATE"));

            assertThat(result.allowed()).isTrue();
            assertThat(result.decisions().get(0).decision().reason()).isEqualTo("Allowed by user override");
        }

        @Test
        @DisplayName("should allow by direct grant regardless of requested scope")
        void shouldAllowByDirectGrantRegardlessOfScope() {
            store.withDirectGrant("u1", "department", "READ");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("department", "READ", "ALL"));

            assertThat(result.allowed()).isTrue();
            assertThat(result.decisions().get(0).decision().reason()).isEqualTo("Allowed by direct user permission");
            assertThat(result.decisions().get(0).decision().source()).isEqualTo(DecisionSource.DIRECT_PERMISSION);
        }

        @Test
        @DisplayName("should deny unscoped request nobody grants")
        void shouldDenyUnscopedRequestNobodyGrants() {
            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("audit", "EXPORT"));

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedReasons()).containsExactly("no permission for audit:EXPORT");
            assertThat(result.decisions().get(0).decision().source()).isEqualTo(DecisionSource.DEFAULT);
        }
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @BeforeEach
        void grantSchoolScopedDepartmentUpdate() {
            store.withRoleGrant("R1", "department", "UPDATE", PermissionScope.SCHOOL)
                    .withMembership("U1", "R1");
        }

        @Test
        @DisplayName("SCHOOL role grant should satisfy a DEPARTMENT request")
        void schoolGrantShouldSatisfyDepartmentRequest() {
            Actor actor = anActor().withId("U1").withSchoolId("S1").build();

            AuthorizationResult result = evaluator.evaluate(actor,
                            List.of(RequiredPermission.of("department", "UPDATE", "DEPARTMENT")),
                            RequestResourceIds.ofParam("id", "D1"))
                    .block();

            assertThat(result.allowed()).isTrue();
            assertThat(result.decisions().get(0).decision().reason()).isEqualTo("Allowed by role permission");
            verifyNoInteractions(organizationDataStore);
        }

        @Test
        @DisplayName("SCHOOL role grant should not satisfy an ALL request")
        void schoolGrantShouldNotSatisfyAllRequest() {
            Actor actor = anActor().withId("U1").withSchoolId("S1").build();

            AuthorizationResult result = evaluator.evaluate(actor,
                            List.of(RequiredPermission.of("department", "UPDATE", "ALL")),
                            RequestResourceIds.ofParam("id", "D1"))
                    .block();

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedMessage()).contains("no permission for department:UPDATE");
        }
    }

    @Nested
    @DisplayName("bypass authority")
    class Bypass {

        @Test
        @DisplayName("should allow every tuple for a hierarchy level 0 role holder")
        void shouldAllowEverythingForLevel0() {
            store.withMembership("root", "superadmin").withLevel0Role("superadmin")
                    .withOverride("root", "school", "DELETE", false);

            AuthorizationResult result = evaluate(anActor().withId("root").build(),
                    RequiredPermission.of("school", "DELETE", "ALL"),
                    RequiredPermission.of("anything", "ANY"));

            assertThat(result.allowed()).isTrue();
            assertThat(result.decisions()).allSatisfy(d -> {
                assertThat(d.decision().source()).isEqualTo(DecisionSource.BYPASS);
                assertThat(d.decision().reason()).isEqualTo("bypass: hierarchy level 0");
            });
            assertThat(recorded).hasSize(2);
            assertThat(meterRegistry.counter("authz.bypass").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should consult the store once per bypass TTL")
        void shouldCacheBypassFlag() {
            store.withMembership("root", "superadmin").withLevel0Role("superadmin");
            Actor actor = anActor().withId("root").build();

            evaluate(actor, RequiredPermission.of("school", "READ"));
            int lookupsAfterFirst = store.lookups();
            evaluate(actor, RequiredPermission.of("school", "READ"));

            assertThat(store.lookups()).isEqualTo(lookupsAfterFirst);
        }
    }

    @Nested
    @DisplayName("scope monotonicity")
    class ScopeMonotonicity {

        @ParameterizedTest
        @EnumSource(value = PermissionScope.class, names = {"OWN", "DEPARTMENT", "SCHOOL", "ALL"})
        @DisplayName("ALL role grant should satisfy every scope")
        void allGrantShouldSatisfyEveryScope(PermissionScope requested) {
            store.withRoleGrant("r", "position", "UPDATE", PermissionScope.ALL).withMembership("u1", "r");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    new RequiredPermission("position", "UPDATE", requested));

            assertThat(result.allowed()).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = PermissionScope.class, names = {"DEPARTMENT", "SCHOOL", "ALL"})
        @DisplayName("OWN role grant should satisfy nothing broader than OWN")
        void ownGrantShouldNotSatisfyBroaderScopes(PermissionScope requested) {
            store.withRoleGrant("r", "position", "UPDATE", PermissionScope.OWN).withMembership("u1", "r");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    new RequiredPermission("position", "UPDATE", requested));

            assertThat(result.allowed()).isFalse();
        }

        @Test
        @DisplayName("unscoped role grant should satisfy a scoped request")
        void unscopedGrantShouldSatisfyScopedRequest() {
            store.withRoleGrant("r", "position", "READ", null).withMembership("u1", "r");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("position", "READ", "SCHOOL"));

            assertThat(result.allowed()).isTrue();
        }

        @Test
        @DisplayName("unknown requested scope should never be satisfied by a scoped grant")
        void unknownRequestedScopeShouldFailClosed() {
            store.withRoleGrant("r", "position", "READ", PermissionScope.ALL).withMembership("u1", "r");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("position", "READ", "GALAXY"));

            assertThat(result.allowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("scope ownership fallback")
    class OwnershipFallback {

        @Test
        @DisplayName("should allow OWN scope on the actor's own user record")
        void shouldAllowOwnScopeOnSelf() {
            Actor actor = anActor().withId("u1").build();

            AuthorizationResult result = evaluator.evaluate(actor,
                            List.of(RequiredPermission.of("user", "UPDATE", "OWN")),
                            RequestResourceIds.ofParam("id", "u1"))
                    .block();

            assertThat(result.allowed()).isTrue();
            assertThat(result.decisions().get(0).decision().reason()).isEqualTo("Allowed by OWN scope");
        }

        @Test
        @DisplayName("should allow DEPARTMENT scope when the user works in the actor's department")
        void shouldAllowDepartmentScope() {
            when(organizationDataStore.findDepartmentIdsForUser("u2")).thenReturn(Flux.just("dept-9", "dept-1"));
            Actor actor = anActor().withId("u1").withDepartmentId("dept-1").build();

            AuthorizationResult result = evaluator.evaluate(actor,
                            List.of(RequiredPermission.of("user", "UPDATE", "DEPARTMENT")),
                            RequestResourceIds.ofParam("userId", "u2"))
                    .block();

            assertThat(result.allowed()).isTrue();
            assertThat(result.decisions().get(0).decision().source()).isEqualTo(DecisionSource.SCOPE_OWNERSHIP);
        }

        @Test
        @DisplayName("should not cache ownership-derived decisions")
        void shouldNotCacheOwnershipDecisions() {
            when(organizationDataStore.findDepartmentIdsForUser("u2")).thenReturn(Flux.just("dept-1"));
            Actor actor = anActor().withId("u1").withDepartmentId("dept-1").build();
            List<RequiredPermission> required = List.of(RequiredPermission.of("user", "UPDATE", "DEPARTMENT"));

            evaluator.evaluate(actor, required, RequestResourceIds.ofParam("id", "u2")).block();
            evaluator.evaluate(actor, required, RequestResourceIds.ofParam("id", "u2")).block();

            verify(organizationDataStore, times(2)).findDepartmentIdsForUser("u2");
        }

        @Test
        @DisplayName("should deny a scoped request without resource id")
        void shouldDenyWithoutResourceId() {
            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("user", "UPDATE", "DEPARTMENT"));

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedReasons()).containsExactly("no resource id for scope check");
        }
    }

    @Nested
    @DisplayName("decision cache")
    class Caching {

        @Test
        @DisplayName("second evaluation should return the same decision without store lookups")
        void secondEvaluationShouldHitCache() {
            store.withRoleGrant("r", "school", "READ", PermissionScope.ALL).withMembership("u1", "r");
            Actor actor = anActor().withId("u1").build();
            RequiredPermission permission = RequiredPermission.of("school", "READ", "SCHOOL");

            AuthorizationResult first = evaluate(actor, permission);
            int lookupsAfterFirst = store.lookups();
            AuthorizationResult second = evaluate(actor, permission);

            assertThat(second.allowed()).isEqualTo(first.allowed());
            assertThat(second.decisions().get(0).decision()).isEqualTo(first.decisions().get(0).decision());
            assertThat(store.lookups()).isEqualTo(lookupsAfterFirst);
        }

        @Test
        @DisplayName("invalidating the actor should surface a newly granted role permission")
        void invalidationShouldSurfaceNewGrant() {
            store.withMembership("u1", "r");
            Actor actor = anActor().withId("u1").build();
            RequiredPermission permission = RequiredPermission.of("notification", "SEND");
            PermissionCacheInvalidator invalidator = new PermissionCacheInvalidator(decisionCache, store);

            assertThat(evaluate(actor, permission).allowed()).isFalse();

            store.withRoleGrant("r", "notification", "SEND", null);
            assertThat(evaluate(actor, permission).allowed()).isFalse();

            StepVerifier.create(invalidator.invalidateUserCache("u1")).verifyComplete();
            assertThat(evaluate(actor, permission).allowed()).isTrue();
        }

        @Test
        @DisplayName("cached decisions should not leak to an actor whose id differs only by delimiter")
        void shouldKeepCachedDecisionsPerActor() {
            store.withMembership("u_1", "superadmin").withLevel0Role("superadmin")
                    .withRoleGrant("r-admin", "school", "DELETE", PermissionScope.ALL)
                    .withMembership("u_2", "r-admin");
            RequiredPermission deleteSchool = RequiredPermission.of("school", "DELETE");

            assertThat(evaluate(anActor().withId("u_1").build(), deleteSchool).allowed()).isTrue();
            assertThat(evaluate(anActor().withId("u_2").build(), deleteSchool).allowed()).isTrue();

            AuthorizationResult colonOne = evaluate(anActor().withId("u:1").build(), deleteSchool);
            AuthorizationResult colonTwo = evaluate(anActor().withId("u:2").build(), deleteSchool);

            assertThat(colonOne.allowed()).isFalse();
            assertThat(colonOne.decisions().get(0).decision().source()).isNotEqualTo(DecisionSource.BYPASS);
            assertThat(colonTwo.allowed()).isFalse();
            assertThat(colonTwo.deniedMessage()).contains("no permission for school:DELETE");
        }

        @Test
        @DisplayName("lookup errors should deny without being cached")
        void lookupErrorsShouldDenyWithoutCaching() {
            store.failingOverridesWith(new IllegalStateException("corrupt document"));
            Actor actor = anActor().withId("u1").build();
            RequiredPermission permission = RequiredPermission.of("school", "READ");

            AuthorizationResult result = evaluate(actor, permission);
            int lookupsAfterFirst = store.lookups();
            evaluate(actor, permission);

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedReasons()).containsExactly("permission lookup failed for school:READ");
            assertThat(result.decisions().get(0).decision().source()).isEqualTo(DecisionSource.ERROR);
            assertThat(store.lookups()).isGreaterThan(lookupsAfterFirst);
        }
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("should allow an empty requirement list")
        void shouldAllowEmptyRequirements() {
            StepVerifier.create(evaluator.evaluate(anActor().build(), List.of()))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isTrue();
                        assertThat(result.decisions()).isEmpty();
                    })
                    .verifyComplete();
            assertThat(store.lookups()).isZero();
        }

        @Test
        @DisplayName("should deny when any tuple is denied and report only failing tuples")
        void shouldRequireEveryTuple() {
            store.withDirectGrant("u1", "school", "READ");

            AuthorizationResult result = evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("school", "READ"),
                    RequiredPermission.of("school", "DELETE"));

            assertThat(result.allowed()).isFalse();
            assertThat(result.decisions()).hasSize(2);
            assertThat(result.denied()).hasSize(1);
            assertThat(result.deniedMessage()).isEqualTo("Insufficient permissions: no permission for school:DELETE");
        }

        @Test
        @DisplayName("should record one event per tuple")
        void shouldRecordOneEventPerTuple() {
            store.withDirectGrant("u1", "school", "READ");

            evaluate(anActor().withId("u1").build(),
                    RequiredPermission.of("school", "READ", "SCHOOL"),
                    RequiredPermission.of("school", "DELETE"));

            assertThat(recorded).hasSize(2);
            DecisionEvent allowed = recorded.stream().filter(DecisionEvent::allowed).findFirst().orElseThrow();
            assertThat(allowed.actorId()).isEqualTo("u1");
            assertThat(allowed.scope()).isEqualTo("SCHOOL");
            assertThat(allowed.timestampMs()).isEqualTo(CLOCK.millis());
            assertThat(meterRegistry.counter("authz.decision", "result", "denied").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("data store unavailable")
    class Unavailable {

        @Test
        @DisplayName("should fail with AuthorizationUnavailableException instead of deciding")
        void shouldFailWithUnavailable() {
            store.failingWith(new DataStoreUnavailableException("hasHierarchyLevel0Role",
                    new RuntimeException("connection refused")));

            StepVerifier.create(evaluator.evaluate(anActor().build(), List.of(RequiredPermission.of("school", "READ"))))
                    .expectError(AuthorizationUnavailableException.class)
                    .verify();
            assertThat(recorded).isEmpty();
            assertThat(meterRegistry.counter("authz.evaluation.unavailable").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail when a source cannot reach the store")
        void shouldFailWhenSourceCannotReachStore() {
            store.failingOverridesWith(new DataStoreUnavailableException("findOverride",
                    new RuntimeException("timeout")));

            StepVerifier.create(evaluator.evaluate(anActor().build(), List.of(RequiredPermission.of("school", "READ"))))
                    .expectError(AuthorizationUnavailableException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("recorder failures should not affect the decision")
    void recorderFailuresShouldBeSwallowed() {
        PolicyEvaluator failingRecorderEvaluator = new PolicyEvaluator(
                List.of(new UserOverrideSource(store), new DirectUserPermissionSource(store)),
                new ScopeOwnershipChecker(List.of(), AuthzProperties.defaults()),
                new BypassAuthorityCheck(store, decisionCache),
                decisionCache,
                new AuthorizationMetrics(meterRegistry),
                CLOCK,
                event -> {
                    throw new IllegalStateException("recorder down");
                });
        store.withDirectGrant("u1", "school", "READ");

        StepVerifier.create(failingRecorderEvaluator.evaluate(anActor().withId("u1").build(),
                        List.of(RequiredPermission.of("school", "READ"))))
                .assertNext(result -> assertThat(result.allowed()).isTrue())
                .verifyComplete();
    }
}

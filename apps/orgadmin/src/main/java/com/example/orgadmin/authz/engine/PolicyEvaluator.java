package com.example.orgadmin.authz.engine;

import com.example.orgadmin.authz.audit.DecisionEvent;
import com.example.orgadmin.authz.audit.DecisionRecorder;
import com.example.orgadmin.authz.bypass.BypassAuthorityCheck;
import com.example.orgadmin.authz.cache.DecisionCache;
import com.example.orgadmin.authz.exception.AuthorizationUnavailableException;
import com.example.orgadmin.authz.exception.DataStoreUnavailableException;
import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.AuthorizationResult;
import com.example.orgadmin.authz.model.Decision;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.PermissionDecision;
import com.example.orgadmin.authz.model.RequestResourceIds;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import com.example.orgadmin.authz.scope.ScopeOwnershipChecker;
import com.example.orgadmin.authz.source.DirectUserPermissionSource;
import com.example.orgadmin.authz.source.PermissionSource;
import com.example.orgadmin.authz.source.PositionPermissionSource;
import com.example.orgadmin.authz.source.RolePermissionSource;
import com.example.orgadmin.authz.source.UserOverrideSource;
import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.observability.metrics.AuthorizationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Decides whether an actor holds every permission a request requires.
 *
 * <p>Per call: bypass check first (a superadmin is allowed everything). Per tuple: cached
 * decision, else the permission sources in fixed order {@code override -> direct -> role ->
 * position}, stopping at the first definitive answer. A scoped tuple nobody decided falls
 * through to the ownership check. The overall result is ALLOW only if every tuple is.
 *
 * <p>Caching: decisions from the permission sources are cached, as is a default denial of an
 * unscoped tuple. Decisions derived from a concrete resource id and decisions caused by a
 * lookup error are not.
 *
 * <p>An unreachable data store aborts the evaluation with {@link AuthorizationUnavailableException}.
 */
@Slf4j
@Component
public class PolicyEvaluator {

    static final String BYPASS_REASON = "bypass: hierarchy level 0";

    private final List<PermissionSource> sources;
    private final ScopeOwnershipChecker ownershipChecker;
    private final BypassAuthorityCheck bypassCheck;
    private final DecisionCache decisionCache;
    private final AuthorizationMetrics metrics;
    private final Clock clock;
    @Nullable
    private final DecisionRecorder recorder;

    @Autowired
    public PolicyEvaluator(
            UserOverrideSource userOverrideSource,
            DirectUserPermissionSource directUserPermissionSource,
            RolePermissionSource rolePermissionSource,
            PositionPermissionSource positionPermissionSource,
            ScopeOwnershipChecker ownershipChecker,
            BypassAuthorityCheck bypassCheck,
            DecisionCache decisionCache,
            AuthorizationMetrics metrics,
            Clock clock,
            @Nullable DecisionRecorder recorder) {
        this(List.of(userOverrideSource, directUserPermissionSource, rolePermissionSource, positionPermissionSource),
                ownershipChecker, bypassCheck, decisionCache, metrics, clock, recorder);
    }

    /**
     * @param sources permission sources in precedence order, highest first
     */
    public PolicyEvaluator(
            List<PermissionSource> sources,
            ScopeOwnershipChecker ownershipChecker,
            BypassAuthorityCheck bypassCheck,
            DecisionCache decisionCache,
            AuthorizationMetrics metrics,
            Clock clock,
            @Nullable DecisionRecorder recorder) {
        this.sources = List.copyOf(sources);
        this.ownershipChecker = ownershipChecker;
        this.bypassCheck = bypassCheck;
        this.decisionCache = decisionCache;
        this.metrics = metrics;
        this.clock = clock;
        this.recorder = recorder;
    }

    @NonNull
    public Mono<AuthorizationResult> evaluate(@NonNull Actor actor, @NonNull List<RequiredPermission> required) {
        return evaluate(actor, required, RequestResourceIds.empty());
    }

    @NonNull
    public Mono<AuthorizationResult> evaluate(
            @NonNull Actor actor,
            @NonNull List<RequiredPermission> required,
            @NonNull RequestResourceIds resourceIds) {
        if (required.isEmpty()) {
            return Mono.just(AuthorizationResult.of(List.of()));
        }

        return Mono.defer(() -> {
                    long startNanos = System.nanoTime();
                    return bypassCheck.isBypassAuthority(actor.id())
                            .flatMap(bypass -> bypass
                                    ? Mono.just(allowAll(actor, required, startNanos))
                                    : resolveAll(actor, required, resourceIds))
                            .map(AuthorizationResult::of)
                            .doOnNext(result -> metrics.recordEvaluation(Duration.ofNanos(System.nanoTime() - startNanos)));
                })
                .onErrorMap(DataStoreUnavailableException.class, e -> {
                    metrics.recordUnavailable();
                    log.error("Authorization unavailable: actor={}, operation={}, error={}",
                            StringSanitizer.forLog(actor.id()), e.getOperation(), e.getMessage());
                    return new AuthorizationUnavailableException("Authorization evaluation unavailable", e);
                });
    }

    private List<PermissionDecision> allowAll(Actor actor, List<RequiredPermission> required, long startNanos) {
        metrics.recordBypass();
        log.debug("Bypass authority for actor {}", StringSanitizer.forLog(actor.id()));
        Decision decision = Decision.allow(DecisionSource.BYPASS, BYPASS_REASON);
        return required.stream()
                .map(permission -> complete(actor, permission, decision, startNanos))
                .toList();
    }

    private Mono<List<PermissionDecision>> resolveAll(
            Actor actor, List<RequiredPermission> required, RequestResourceIds resourceIds) {
        return Flux.fromIterable(required)
                .flatMapSequential(permission -> resolve(actor, permission, resourceIds))
                .collectList();
    }

    private Mono<PermissionDecision> resolve(Actor actor, RequiredPermission permission, RequestResourceIds resourceIds) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return decisionCache.getDecision(actor.id(), permission)
                    .switchIfEmpty(Mono.defer(() -> evaluateSources(actor, permission, resourceIds)))
                    .map(decision -> complete(actor, permission, decision, startNanos));
        });
    }

    private Mono<Decision> evaluateSources(Actor actor, RequiredPermission permission, RequestResourceIds resourceIds) {
        return Flux.fromIterable(sources)
                .concatMap(source -> source.check(actor, permission))
                .filter(SourceResult::isDefinitive)
                .next()
                .flatMap(result -> cacheable(result)
                        ? store(actor, permission, result.toDecision())
                        : Mono.just(result.toDecision()))
                .switchIfEmpty(Mono.defer(() -> fallThrough(actor, permission, resourceIds)));
    }

    /**
     * No source decided. Unscoped tuples are denied outright; scoped ones get the ownership check.
     */
    private Mono<Decision> fallThrough(Actor actor, RequiredPermission permission, RequestResourceIds resourceIds) {
        if (!permission.hasScope()) {
            return store(actor, permission, noPermission(permission));
        }
        return ownershipChecker.check(actor, permission, resourceIds)
                .map(result -> result.isDefinitive() ? result.toDecision() : noPermission(permission));
    }

    private Mono<Decision> store(Actor actor, RequiredPermission permission, Decision decision) {
        return decisionCache.putDecision(actor.id(), permission, decision).thenReturn(decision);
    }

    private PermissionDecision complete(Actor actor, RequiredPermission permission, Decision decision, long startNanos) {
        metrics.recordDecision(decision.allowed());
        if (!decision.allowed()) {
            log.warn("Permission denied: actor={}, permission={}, scope={}, reason={}",
                    StringSanitizer.forLog(actor.id()), permission.describe(), permission.scopeKey(), decision.reason());
        }
        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        record(DecisionEvent.of(actor.id(), permission, decision, clock.millis(), durationMs));
        return new PermissionDecision(permission, decision);
    }

    private void record(DecisionEvent event) {
        if (recorder == null) {
            return;
        }
        try {
            recorder.record(event);
        } catch (RuntimeException e) {
            log.warn("Failed to record decision for actor {}: {}", StringSanitizer.forLog(event.actorId()), e.getMessage());
        }
    }

    private static boolean cacheable(SourceResult result) {
        return result.source() != DecisionSource.ERROR;
    }

    private static Decision noPermission(RequiredPermission permission) {
        return Decision.deny(DecisionSource.DEFAULT, "no permission for " + permission.describe());
    }
}

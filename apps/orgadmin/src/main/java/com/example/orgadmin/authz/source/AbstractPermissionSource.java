package com.example.orgadmin.authz.source;

import com.example.orgadmin.authz.exception.DataStoreUnavailableException;
import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import com.example.orgadmin.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Base for store-backed sources.
 *
 * <p>An empty lookup means NOT_APPLICABLE. Unexpected lookup errors become a DENY with
 * source ERROR; data-store unavailability propagates so the caller can fail the whole evaluation.
 */
@Slf4j
public abstract class AbstractPermissionSource implements PermissionSource {

    @Override
    public final Mono<SourceResult> check(Actor actor, RequiredPermission permission) {
        return Mono.defer(() -> lookup(actor, permission))
                .defaultIfEmpty(SourceResult.notApplicable(id()))
                .doOnNext(result -> log.debug("Source result: source={}, actor={}, permission={}, outcome={}",
                        id(), StringSanitizer.forLog(actor.id()), permission.describe(), result.outcome()))
                .onErrorResume(e -> !(e instanceof DataStoreUnavailableException), e -> {
                    log.error("Permission lookup failed: source={}, actor={}, permission={}, error={}",
                            id(), StringSanitizer.forLog(actor.id()), permission.describe(), e.getMessage(), e);
                    return Mono.just(SourceResult.failed("permission lookup failed for " + permission.describe()));
                });
    }

    /**
     * @return the definitive result, or empty when the source has nothing to say
     */
    protected abstract Mono<SourceResult> lookup(Actor actor, RequiredPermission permission);
}

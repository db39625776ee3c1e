package com.example.orgadmin.authz.source;

import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import reactor.core.publisher.Mono;

/**
 * One origin of authority consulted while evaluating a permission tuple.
 *
 * <p>Implementations answer ALLOW, DENY or NOT_APPLICABLE and never complete empty.
 * They must not throw for ordinary lookups; a failure to reach the data store is
 * signalled as {@link com.example.orgadmin.authz.exception.DataStoreUnavailableException}.
 */
public interface PermissionSource {

    DecisionSource id();

    Mono<SourceResult> check(Actor actor, RequiredPermission permission);
}

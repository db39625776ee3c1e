package com.example.orgadmin.authz.source;

import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Position-derived permissions. Positions carry no grants yet, so this source never decides.
 */
@Component
public class PositionPermissionSource implements PermissionSource {

    @Override
    public DecisionSource id() {
        return DecisionSource.POSITION_PERMISSION;
    }

    @Override
    public Mono<SourceResult> check(Actor actor, RequiredPermission permission) {
        return Mono.just(SourceResult.notApplicable(id()));
    }
}

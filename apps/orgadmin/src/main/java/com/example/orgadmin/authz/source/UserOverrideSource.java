package com.example.orgadmin.authz.source;

import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import com.example.orgadmin.datastore.PermissionDataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Per-user overrides. Highest precedence; can explicitly deny.
 */
@Component
@RequiredArgsConstructor
public class UserOverrideSource extends AbstractPermissionSource {

    private final PermissionDataStore dataStore;

    @Override
    public DecisionSource id() {
        return DecisionSource.USER_OVERRIDE;
    }

    @Override
    protected Mono<SourceResult> lookup(Actor actor, RequiredPermission permission) {
        return dataStore.findOverride(actor.id(), permission.resource(), permission.action())
                .map(override -> override.granted()
                        ? SourceResult.allow(id(), "Allowed by user override")
                        : SourceResult.deny(id(), "Denied by user override for " + permission.describe()));
    }
}

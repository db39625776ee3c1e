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
 * Permissions granted directly to the user. Grants are not filtered by the requested scope.
 */
@Component
@RequiredArgsConstructor
public class DirectUserPermissionSource extends AbstractPermissionSource {

    private final PermissionDataStore dataStore;

    @Override
    public DecisionSource id() {
        return DecisionSource.DIRECT_PERMISSION;
    }

    @Override
    protected Mono<SourceResult> lookup(Actor actor, RequiredPermission permission) {
        return dataStore.hasDirectGrant(actor.id(), permission.resource(), permission.action())
                .filter(Boolean::booleanValue)
                .map(granted -> SourceResult.allow(id(), "Allowed by direct user permission"));
    }
}

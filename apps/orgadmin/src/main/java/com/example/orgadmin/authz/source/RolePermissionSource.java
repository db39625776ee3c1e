package com.example.orgadmin.authz.source;

import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import com.example.orgadmin.authz.scope.ScopeComparator;
import com.example.orgadmin.datastore.PermissionDataStore;
import com.example.orgadmin.datastore.RoleGrant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Permissions reachable through the actor's roles.
 *
 * <p>When a scope is requested, only grants whose scope covers it count. Unscoped
 * grants match any request.
 */
@Component
@RequiredArgsConstructor
public class RolePermissionSource extends AbstractPermissionSource {

    private final PermissionDataStore dataStore;

    @Override
    public DecisionSource id() {
        return DecisionSource.ROLE_PERMISSION;
    }

    @Override
    protected Mono<SourceResult> lookup(Actor actor, RequiredPermission permission) {
        return dataStore.findRoleGrants(actor.id(), permission.resource(), permission.action())
                .any(grant -> covers(grant, permission))
                .filter(Boolean::booleanValue)
                .map(matched -> SourceResult.allow(id(), "Allowed by role permission"));
    }

    private static boolean covers(RoleGrant grant, RequiredPermission permission) {
        if (!permission.hasScope() || grant.scope() == null) {
            return true;
        }
        return ScopeComparator.isSufficient(grant.scope(), permission.scope());
    }
}

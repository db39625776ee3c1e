package com.example.orgadmin.datastore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the permission data the decision engine needs.
 *
 * <p>All operations fail with
 * {@link com.example.orgadmin.authz.exception.DataStoreUnavailableException} when the
 * store cannot be reached after retries.
 */
public interface PermissionDataStore {

    /**
     * Currently valid override for the tuple. Empty when there is none.
     * When several valid overrides exist, a denying one wins.
     */
    Mono<OverrideGrant> findOverride(String actorId, String resource, String action);

    /**
     * Whether the actor holds an effective direct grant of any active permission on (resource, action).
     */
    Mono<Boolean> hasDirectGrant(String actorId, String resource, String action);

    /**
     * Grants on (resource, action) reachable through the actor's effective, active roles.
     */
    Flux<RoleGrant> findRoleGrants(String actorId, String resource, String action);

    /**
     * Whether the actor holds an effective, active role at hierarchy level 0.
     */
    Mono<Boolean> hasHierarchyLevel0Role(String actorId);

    /**
     * Ids of users with an active membership in the role, regardless of effective period.
     */
    Flux<String> findActiveRoleHolders(String roleId);
}

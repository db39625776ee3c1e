package com.example.orgadmin.authz.service;

import com.example.orgadmin.authz.cache.DecisionCache;
import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.datastore.PermissionDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Write-side API for grant changes. Every operation completes only after the affected
 * cache entries are gone, and propagates cache failures to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionCacheInvalidator {

    private final DecisionCache decisionCache;
    private final PermissionDataStore dataStore;

    /**
     * Drops every cached decision of one actor. Use after an override or direct grant change.
     */
    @NonNull
    public Mono<Void> invalidateUserCache(@NonNull String actorId) {
        return decisionCache.invalidateActor(actorId)
                .doOnNext(count -> log.info("Invalidated {} cached decision(s) for actor {}",
                        count, StringSanitizer.forLog(actorId)))
                .then();
    }

    @NonNull
    public Mono<Void> invalidateAllCache() {
        return decisionCache.invalidateAllDecisions()
                .doOnNext(count -> log.info("Invalidated all cached decisions ({} entries)", count))
                .then();
    }

    /**
     * The actor gained or lost a role: its decisions and its bypass flag may both be stale.
     */
    @NonNull
    public Mono<Void> onRoleMembershipChanged(@NonNull String actorId) {
        return invalidateUserCache(actorId)
                .then(decisionCache.invalidateBypass(actorId))
                .then();
    }

    /**
     * Grants attached to a role changed: invalidate every active holder of the role.
     */
    @NonNull
    public Mono<Void> onRolePermissionsChanged(@NonNull String roleId) {
        return dataStore.findActiveRoleHolders(roleId)
                .concatMap(this::invalidateUserCache)
                .then()
                .doOnSuccess(v -> log.info("Invalidated cached decisions for holders of role {}",
                        StringSanitizer.forLog(roleId)));
    }

    /**
     * A role was created, deleted or had its hierarchy level changed.
     */
    @NonNull
    public Mono<Void> onRoleDefinitionChanged() {
        return invalidateAllCache()
                .then(decisionCache.invalidateAllBypass())
                .then();
    }

    @NonNull
    public Mono<Void> onPermissionDefinitionChanged() {
        return invalidateAllCache();
    }
}

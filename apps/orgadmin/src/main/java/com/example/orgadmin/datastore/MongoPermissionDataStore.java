package com.example.orgadmin.datastore;

import com.example.orgadmin.authz.model.PermissionScope;
import com.example.orgadmin.datastore.document.PermissionDoc;
import com.example.orgadmin.datastore.document.RoleDoc;
import com.example.orgadmin.datastore.document.UserOverrideDoc;
import com.example.orgadmin.datastore.document.UserRoleDoc;
import com.example.orgadmin.datastore.repository.PermissionRepository;
import com.example.orgadmin.datastore.repository.RolePermissionRepository;
import com.example.orgadmin.datastore.repository.RoleRepository;
import com.example.orgadmin.datastore.repository.UserOverrideRepository;
import com.example.orgadmin.datastore.repository.UserPermissionRepository;
import com.example.orgadmin.datastore.repository.UserRoleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * MongoDB-backed permission reads.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoPermissionDataStore implements PermissionDataStore {

    private static final int SUPERADMIN_HIERARCHY_LEVEL = 0;

    private final UserOverrideRepository overrideRepository;
    private final PermissionRepository permissionRepository;
    private final UserPermissionRepository userPermissionRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final DataStoreExecutor executor;
    private final Clock clock;

    @Override
    public Mono<OverrideGrant> findOverride(String actorId, String resource, String action) {
        Mono<List<UserOverrideDoc>> overrides = overrideRepository
                .findByUserProfileIdAndResourceAndAction(actorId, resource, action)
                .collectList();
        return executor.execute("findOverride", overrides)
                .flatMap(list -> Mono.justOrEmpty(selectOverride(list, clock.instant())));
    }

    @Override
    public Mono<Boolean> hasDirectGrant(String actorId, String resource, String action) {
        Mono<Boolean> lookup = permissionIds(resource, action)
                .flatMap(ids -> {
                    if (ids.isEmpty()) {
                        return Mono.just(false);
                    }
                    return userPermissionRepository
                            .findByUserProfileIdAndPermissionIdInAndGrantedTrue(actorId, ids)
                            .any(up -> TemporalValidity.isEffective(
                                    up.getEffectiveFrom(), up.getEffectiveUntil(), clock.instant()));
                });
        return executor.execute("hasDirectGrant", lookup);
    }

    @Override
    public Flux<RoleGrant> findRoleGrants(String actorId, String resource, String action) {
        Mono<List<RoleGrant>> lookup = permissionRepository.findByResourceAndActionAndActiveTrue(resource, action)
                .collectMap(PermissionDoc::getId, Function.identity())
                .flatMap(permissions -> roleGrants(actorId, permissions));
        return executor.execute("findRoleGrants", lookup)
                .flatMapIterable(Function.identity());
    }

    @Override
    public Mono<Boolean> hasHierarchyLevel0Role(String actorId) {
        Mono<Boolean> lookup = effectiveRoleIds(actorId)
                .flatMap(roleIds -> {
                    if (roleIds.isEmpty()) {
                        return Mono.just(false);
                    }
                    return roleRepository
                            .findByIdInAndHierarchyLevelAndActiveTrue(roleIds, SUPERADMIN_HIERARCHY_LEVEL)
                            .hasElements();
                });
        return executor.execute("hasHierarchyLevel0Role", lookup);
    }

    @Override
    public Flux<String> findActiveRoleHolders(String roleId) {
        return executor.executeMany("findActiveRoleHolders",
                userRoleRepository.findByRoleIdAndActiveTrue(roleId)
                        .map(UserRoleDoc::getUserProfileId)
                        .distinct());
    }

    private Mono<List<RoleGrant>> roleGrants(String actorId, Map<String, PermissionDoc> permissions) {
        if (permissions.isEmpty()) {
            return Mono.just(List.of());
        }
        return activeRoleIds(actorId)
                .flatMap(roleIds -> {
                    if (roleIds.isEmpty()) {
                        return Mono.just(List.<RoleGrant>of());
                    }
                    return rolePermissionRepository
                            .findByRoleIdInAndPermissionIdInAndGrantedTrue(roleIds, permissions.keySet())
                            .map(rp -> new RoleGrant(
                                    rp.getRoleId(),
                                    rp.getPermissionId(),
                                    PermissionScope.parse(permissions.get(rp.getPermissionId()).getScope())))
                            .collectList();
                });
    }

    private Mono<List<String>> permissionIds(String resource, String action) {
        return permissionRepository.findByResourceAndActionAndActiveTrue(resource, action)
                .map(PermissionDoc::getId)
                .collectList();
    }

    /**
     * Role ids of memberships that are active and within their effective period.
     */
    private Mono<Set<String>> effectiveRoleIds(String actorId) {
        return userRoleRepository.findByUserProfileIdAndActiveTrue(actorId)
                .filter(ur -> TemporalValidity.isEffective(ur.getEffectiveFrom(), ur.getEffectiveUntil(), clock.instant()))
                .map(UserRoleDoc::getRoleId)
                .collect(Collectors.toSet());
    }

    /**
     * Effective memberships restricted to roles that are themselves active.
     */
    private Mono<Set<String>> activeRoleIds(String actorId) {
        return effectiveRoleIds(actorId)
                .flatMap(roleIds -> {
                    if (roleIds.isEmpty()) {
                        return Mono.just(Set.<String>of());
                    }
                    return roleRepository.findByIdInAndActiveTrue(roleIds)
                            .map(RoleDoc::getId)
                            .collect(Collectors.toSet());
                });
    }

    private static Optional<OverrideGrant> selectOverride(List<UserOverrideDoc> overrides, Instant now) {
        List<UserOverrideDoc> valid = overrides.stream()
                .filter(o -> TemporalValidity.isUnexpired(o.getValidUntil(), now))
                .toList();
        return valid.stream()
                .filter(o -> !o.isGranted())
                .findFirst()
                .or(() -> valid.stream().findFirst())
                .map(o -> new OverrideGrant(o.isGranted(), o.getValidUntil()));
    }
}

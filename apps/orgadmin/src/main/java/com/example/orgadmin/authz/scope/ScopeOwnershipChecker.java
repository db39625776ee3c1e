package com.example.orgadmin.authz.scope;

import com.example.orgadmin.authz.exception.DataStoreUnavailableException;
import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.PermissionScope;
import com.example.orgadmin.authz.model.RequestResourceIds;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.authz.model.SourceResult;
import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.config.properties.AuthzProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decides a scoped request by relating the targeted resource to the actor's own affiliation.
 *
 * <p>Only consulted after every grant source stayed silent. OWN compares the resource owner with the
 * actor, DEPARTMENT and SCHOOL compare the resource's department/school with the actor's. ALL and
 * unknown scopes carry no ownership relation and are never decided here.
 */
@Slf4j
@Component
public class ScopeOwnershipChecker {

    static final String NO_RESOURCE_ID = "no resource id for scope check";

    private final Map<ResourceKind, OwnershipResolver> resolvers = new EnumMap<>(ResourceKind.class);
    private final AuthzProperties.OwnershipProperties ownership;

    public ScopeOwnershipChecker(List<OwnershipResolver> resolvers, AuthzProperties properties) {
        resolvers.forEach(resolver -> this.resolvers.put(resolver.kind(), resolver));
        this.ownership = properties.ownership();
    }

    /**
     * @return ALLOW when the ownership relation holds, DENY when no resource id could be found,
     * NOT_APPLICABLE otherwise
     */
    public Mono<SourceResult> check(Actor actor, RequiredPermission permission, RequestResourceIds resourceIds) {
        PermissionScope scope = permission.scope();
        if (scope == null || scope == PermissionScope.ALL || scope == PermissionScope.UNKNOWN) {
            return notApplicable();
        }

        String resourceId = resourceIds.extract(permission.resource());
        if (resourceId == null) {
            log.debug("No resource id for scope check: actor={}, permission={}",
                    StringSanitizer.forLog(actor.id()), permission.describe());
            return Mono.just(SourceResult.deny(DecisionSource.SCOPE_OWNERSHIP, NO_RESOURCE_ID));
        }

        ResourceKind kind = ownership.kindOf(permission.resource());
        OwnershipResolver resolver = kind != null ? resolvers.get(kind) : null;
        if (resolver == null) {
            log.debug("No ownership resolver for resource type: resource={}", StringSanitizer.forLog(permission.resource()));
            return notApplicable();
        }

        Mono<Boolean> related = switch (scope) {
            case OWN -> resolver.resolveOwner(resourceId)
                    .map(owner -> owner.equals(actor.id()))
                    .defaultIfEmpty(false);
            case DEPARTMENT -> contains(resolver.resolveDepartments(resourceId), actor.departmentId());
            case SCHOOL -> contains(resolver.resolveSchools(resourceId), actor.schoolId());
            default -> Mono.just(false);
        };

        return related.map(matched -> matched
                ? SourceResult.allow(DecisionSource.SCOPE_OWNERSHIP, "Allowed by " + scope.name() + " scope")
                : SourceResult.notApplicable(DecisionSource.SCOPE_OWNERSHIP))
                .onErrorResume(e -> !(e instanceof DataStoreUnavailableException), e -> {
                    log.error("Ownership lookup failed: actor={}, permission={}, error={}",
                            StringSanitizer.forLog(actor.id()), permission.describe(), e.getMessage(), e);
                    return Mono.just(SourceResult.failed("permission lookup failed for " + permission.describe()));
                });
    }

    private static Mono<Boolean> contains(Flux<String> candidates, String actorAffiliation) {
        if (actorAffiliation == null) {
            return Mono.just(false);
        }
        return candidates.any(actorAffiliation::equals);
    }

    private static Mono<SourceResult> notApplicable() {
        return Mono.just(SourceResult.notApplicable(DecisionSource.SCOPE_OWNERSHIP));
    }
}

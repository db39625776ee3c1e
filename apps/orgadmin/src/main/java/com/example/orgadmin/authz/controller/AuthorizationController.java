package com.example.orgadmin.authz.controller;

import com.example.orgadmin.authz.actor.ActorResolver;
import com.example.orgadmin.authz.annotation.RequiresPermission;
import com.example.orgadmin.authz.dto.PermissionCheckRequest;
import com.example.orgadmin.authz.dto.PermissionCheckResponse;
import com.example.orgadmin.authz.engine.PolicyEvaluator;
import com.example.orgadmin.authz.exception.MissingActorException;
import com.example.orgadmin.authz.service.PermissionCacheInvalidator;
import com.example.orgadmin.common.util.StringSanitizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/permissions")
@RequiredArgsConstructor
public class AuthorizationController {

    private final PolicyEvaluator policyEvaluator;
    private final PermissionCacheInvalidator cacheInvalidator;
    private final ActorResolver actorResolver;

    /**
     * Evaluates the given permissions for the calling actor without enforcing them.
     */
    @PostMapping("/check")
    public Mono<PermissionCheckResponse> check(
            @Valid @RequestBody PermissionCheckRequest request,
            ServerWebExchange exchange) {
        return actorResolver.resolve(exchange)
                .switchIfEmpty(Mono.error(() -> new MissingActorException("Authentication required")))
                .flatMap(actor -> policyEvaluator.evaluate(actor, request.requiredPermissions(), request.requestResourceIds()))
                .map(PermissionCheckResponse::from);
    }

    @DeleteMapping("/cache/users/{userId}")
    @RequiresPermission(resource = "permission", action = "MANAGE", scope = "ALL")
    public Mono<ResponseEntity<Void>> invalidateUserCache(
            @PathVariable("userId") String userId,
            ServerWebExchange exchange) {
        log.info("Invalidating cached decisions for user {}", StringSanitizer.forLog(userId));
        return cacheInvalidator.invalidateUserCache(userId)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @DeleteMapping("/cache/roles/{roleId}")
    @RequiresPermission(resource = "permission", action = "MANAGE", scope = "ALL")
    public Mono<ResponseEntity<Void>> invalidateRoleCache(
            @PathVariable("roleId") String roleId,
            ServerWebExchange exchange) {
        log.info("Invalidating cached decisions for holders of role {}", StringSanitizer.forLog(roleId));
        return cacheInvalidator.onRolePermissionsChanged(roleId)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @DeleteMapping("/cache")
    @RequiresPermission(resource = "permission", action = "MANAGE", scope = "ALL")
    public Mono<ResponseEntity<Void>> invalidateAllCache(ServerWebExchange exchange) {
        log.info("Invalidating all cached decisions");
        return cacheInvalidator.invalidateAllCache()
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}

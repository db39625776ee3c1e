package com.example.orgadmin.authz.actor;

import com.example.orgadmin.authz.model.Actor;
import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.config.properties.AuthzProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the actor snapshot forwarded by the identity gateway in trusted request headers.
 * Requests without a valid actor id resolve to no actor.
 */
@Slf4j
@Component
public class HeaderActorResolver implements ActorResolver {

    private final AuthzProperties.ActorHeaderProperties headerNames;

    public HeaderActorResolver(AuthzProperties properties) {
        this.headerNames = properties.actorHeaders();
    }

    @Override
    public Mono<Actor> resolve(@NonNull ServerWebExchange exchange) {
        HttpHeaders headers = exchange.getRequest().getHeaders();
        String actorId = StringSanitizer.headerValue(headers.getFirst(headerNames.actorId()));
        if (actorId == null) {
            return Mono.empty();
        }
        if (!StringSanitizer.isValidSafeId(actorId)) {
            log.warn("Rejecting malformed actor id header: {}", StringSanitizer.forLog(actorId));
            return Mono.empty();
        }
        return Mono.just(new Actor(
                actorId,
                StringSanitizer.headerValue(headers.getFirst(headerNames.schoolId())),
                StringSanitizer.headerValue(headers.getFirst(headerNames.departmentId())),
                StringSanitizer.headerValue(headers.getFirst(headerNames.positionId())),
                parseRoles(headers.getFirst(headerNames.roles()))
        ));
    }

    private static Set<String> parseRoles(@Nullable String header) {
        if (header == null || header.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}

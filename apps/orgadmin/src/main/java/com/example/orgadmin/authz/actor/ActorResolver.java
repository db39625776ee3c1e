package com.example.orgadmin.authz.actor;

import com.example.orgadmin.authz.model.Actor;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Supplies the authenticated actor of a request. Completes empty for anonymous requests.
 */
public interface ActorResolver {

    Mono<Actor> resolve(ServerWebExchange exchange);
}

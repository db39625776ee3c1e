package com.example.orgadmin.authz.scope;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Resolves where a resource sits in the organization, per resource kind.
 * Lookups a kind does not support complete empty, which fails the ownership check closed.
 */
public interface OwnershipResolver {

    ResourceKind kind();

    /**
     * User who owns the resource.
     */
    default Mono<String> resolveOwner(String resourceId) {
        return Mono.empty();
    }

    Flux<String> resolveDepartments(String resourceId);

    Flux<String> resolveSchools(String resourceId);
}

package com.example.orgadmin.authz.scope;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * A school is its own school and belongs to no single department.
 */
@Component
public class SchoolOwnershipResolver implements OwnershipResolver {

    @Override
    public ResourceKind kind() {
        return ResourceKind.SCHOOL;
    }

    @Override
    public Flux<String> resolveDepartments(String resourceId) {
        return Flux.empty();
    }

    @Override
    public Flux<String> resolveSchools(String resourceId) {
        return Flux.just(resourceId);
    }
}

package com.example.orgadmin.authz.scope;

import com.example.orgadmin.datastore.OrganizationDataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A user owns itself and belongs to the departments of its active positions.
 */
@Component
@RequiredArgsConstructor
public class UserOwnershipResolver implements OwnershipResolver {

    private final OrganizationDataStore organizationDataStore;

    @Override
    public ResourceKind kind() {
        return ResourceKind.USER;
    }

    @Override
    public Mono<String> resolveOwner(String resourceId) {
        return Mono.just(resourceId);
    }

    @Override
    public Flux<String> resolveDepartments(String resourceId) {
        return organizationDataStore.findDepartmentIdsForUser(resourceId);
    }

    @Override
    public Flux<String> resolveSchools(String resourceId) {
        return organizationDataStore.findDepartmentIdsForUser(resourceId)
                .collectList()
                .flatMapMany(organizationDataStore::findSchoolIdsForDepartments);
    }
}

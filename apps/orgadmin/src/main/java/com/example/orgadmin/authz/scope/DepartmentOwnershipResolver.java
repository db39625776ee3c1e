package com.example.orgadmin.authz.scope;

import com.example.orgadmin.datastore.OrganizationDataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

@Component
@RequiredArgsConstructor
public class DepartmentOwnershipResolver implements OwnershipResolver {

    private final OrganizationDataStore organizationDataStore;

    @Override
    public ResourceKind kind() {
        return ResourceKind.DEPARTMENT;
    }

    @Override
    public Flux<String> resolveDepartments(String resourceId) {
        return Flux.just(resourceId);
    }

    @Override
    public Flux<String> resolveSchools(String resourceId) {
        return organizationDataStore.findSchoolIdsForDepartments(List.of(resourceId));
    }
}

package com.example.orgadmin.authz.scope;

import com.example.orgadmin.datastore.OrganizationDataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

@Component
@RequiredArgsConstructor
public class PositionOwnershipResolver implements OwnershipResolver {

    private final OrganizationDataStore organizationDataStore;

    @Override
    public ResourceKind kind() {
        return ResourceKind.POSITION;
    }

    @Override
    public Flux<String> resolveDepartments(String resourceId) {
        return organizationDataStore.findDepartmentIdForPosition(resourceId).flux();
    }

    @Override
    public Flux<String> resolveSchools(String resourceId) {
        return organizationDataStore.findDepartmentIdForPosition(resourceId)
                .flatMapMany(departmentId -> organizationDataStore.findSchoolIdsForDepartments(List.of(departmentId)));
    }
}

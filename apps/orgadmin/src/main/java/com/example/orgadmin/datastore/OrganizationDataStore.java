package com.example.orgadmin.datastore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Organizational structure lookups used for scope ownership checks.
 */
public interface OrganizationDataStore {

    /**
     * Departments of the user's active positions.
     */
    Flux<String> findDepartmentIdsForUser(String userId);

    /**
     * Schools of the given active departments.
     */
    Flux<String> findSchoolIdsForDepartments(Collection<String> departmentIds);

    /**
     * Department of an active position. Empty when the position is unknown or inactive.
     */
    Mono<String> findDepartmentIdForPosition(String positionId);
}

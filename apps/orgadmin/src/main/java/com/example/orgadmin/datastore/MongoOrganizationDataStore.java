package com.example.orgadmin.datastore;

import com.example.orgadmin.datastore.document.DepartmentDoc;
import com.example.orgadmin.datastore.document.PositionDoc;
import com.example.orgadmin.datastore.document.UserPositionDoc;
import com.example.orgadmin.datastore.repository.DepartmentRepository;
import com.example.orgadmin.datastore.repository.PositionRepository;
import com.example.orgadmin.datastore.repository.UserPositionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class MongoOrganizationDataStore implements OrganizationDataStore {

    private final UserPositionRepository userPositionRepository;
    private final PositionRepository positionRepository;
    private final DepartmentRepository departmentRepository;
    private final DataStoreExecutor executor;

    @Override
    public Flux<String> findDepartmentIdsForUser(String userId) {
        Flux<String> lookup = userPositionRepository.findByUserProfileIdAndActiveTrue(userId)
                .map(UserPositionDoc::getPositionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet())
                .flatMapMany(positionIds -> positionIds.isEmpty()
                        ? Flux.<PositionDoc>empty()
                        : positionRepository.findByIdInAndActiveTrue(positionIds))
                .map(PositionDoc::getDepartmentId)
                .filter(Objects::nonNull)
                .distinct();
        return executor.executeMany("findDepartmentIdsForUser", lookup);
    }

    @Override
    public Flux<String> findSchoolIdsForDepartments(Collection<String> departmentIds) {
        if (departmentIds.isEmpty()) {
            return Flux.empty();
        }
        Flux<String> lookup = departmentRepository.findAllById(departmentIds)
                .filter(DepartmentDoc::isActive)
                .map(DepartmentDoc::getSchoolId)
                .filter(Objects::nonNull)
                .distinct();
        return executor.executeMany("findSchoolIdsForDepartments", lookup);
    }

    @Override
    public Mono<String> findDepartmentIdForPosition(String positionId) {
        Mono<String> lookup = positionRepository.findById(positionId)
                .filter(PositionDoc::isActive)
                .mapNotNull(PositionDoc::getDepartmentId);
        return executor.execute("findDepartmentIdForPosition", lookup);
    }
}

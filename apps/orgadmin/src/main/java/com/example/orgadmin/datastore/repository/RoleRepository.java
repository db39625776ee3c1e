package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.RoleDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

import java.util.Collection;

public interface RoleRepository extends ReactiveMongoRepository<RoleDoc, String> {

    Flux<RoleDoc> findByIdInAndActiveTrue(Collection<String> ids);

    Flux<RoleDoc> findByIdInAndHierarchyLevelAndActiveTrue(Collection<String> ids, int hierarchyLevel);
}

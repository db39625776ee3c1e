package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.RolePermissionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

import java.util.Collection;

public interface RolePermissionRepository extends ReactiveMongoRepository<RolePermissionDoc, String> {

    Flux<RolePermissionDoc> findByRoleIdInAndPermissionIdInAndGrantedTrue(
            Collection<String> roleIds, Collection<String> permissionIds);
}

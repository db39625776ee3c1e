package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.UserPermissionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

import java.util.Collection;

public interface UserPermissionRepository extends ReactiveMongoRepository<UserPermissionDoc, String> {

    Flux<UserPermissionDoc> findByUserProfileIdAndPermissionIdInAndGrantedTrue(
            String userProfileId, Collection<String> permissionIds);
}

package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.UserRoleDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

public interface UserRoleRepository extends ReactiveMongoRepository<UserRoleDoc, String> {

    Flux<UserRoleDoc> findByUserProfileIdAndActiveTrue(String userProfileId);

    Flux<UserRoleDoc> findByRoleIdAndActiveTrue(String roleId);
}

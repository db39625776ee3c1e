package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.UserPositionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

public interface UserPositionRepository extends ReactiveMongoRepository<UserPositionDoc, String> {

    Flux<UserPositionDoc> findByUserProfileIdAndActiveTrue(String userProfileId);
}

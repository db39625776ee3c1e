package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.UserOverrideDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

public interface UserOverrideRepository extends ReactiveMongoRepository<UserOverrideDoc, String> {

    /**
     * All overrides for the tuple, expired ones included. Validity is filtered by the caller.
     */
    Flux<UserOverrideDoc> findByUserProfileIdAndResourceAndAction(String userProfileId, String resource, String action);
}

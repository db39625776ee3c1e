package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.PermissionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

public interface PermissionRepository extends ReactiveMongoRepository<PermissionDoc, String> {

    /**
     * Active permission definitions for a (resource, action) pair, across all scopes.
     */
    Flux<PermissionDoc> findByResourceAndActionAndActiveTrue(String resource, String action);
}

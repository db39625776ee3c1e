package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.PositionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

import java.util.Collection;

public interface PositionRepository extends ReactiveMongoRepository<PositionDoc, String> {

    Flux<PositionDoc> findByIdInAndActiveTrue(Collection<String> ids);
}

package com.example.orgadmin.datastore.repository;

import com.example.orgadmin.datastore.document.DepartmentDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

public interface DepartmentRepository extends ReactiveMongoRepository<DepartmentDoc, String> {
}

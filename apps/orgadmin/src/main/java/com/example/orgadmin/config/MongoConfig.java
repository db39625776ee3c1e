package com.example.orgadmin.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = "com.example.orgadmin.datastore.repository")
@EnableReactiveMongoAuditing
public class MongoConfig {
    // Compound indexes are created from @CompoundIndex when auto-index-creation is enabled
}

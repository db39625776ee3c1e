package com.example.orgadmin.authz.cache;

import com.example.orgadmin.authz.model.Decision;
import com.example.orgadmin.authz.model.DecisionSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@DisplayName("InMemoryDecisionCacheStore")
class InMemoryDecisionCacheStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private InMemoryDecisionCacheStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDecisionCacheStore(100, nanos::get);
    }

    @Test
    @DisplayName("should return stored values until their TTL elapses")
    void shouldExpireEntriesPerTtl() {
        Decision decision = Decision.allow(DecisionSource.ROLE_PERMISSION, "Allowed by role permission");
        store.set("check:u1:school:READ:none", decision, Duration.ofMinutes(5)).block();
        store.set("hierarchy:level0:u1", true, Duration.ofMinutes(10)).block();

        nanos.addAndGet(Duration.ofMinutes(6).toNanos());

        StepVerifier.create(store.get("check:u1:school:READ:none")).verifyComplete();
        StepVerifier.create(store.get("hierarchy:level0:u1")).expectNext(true).verifyComplete();
    }

    @Test
    @DisplayName("should delete only keys under the given prefix")
    void shouldDeleteByPrefix() {
        Duration ttl = Duration.ofMinutes(5);
        store.set("check:u1:school:READ:none", "a", ttl).block();
        store.set("check:u1:user:UPDATE:OWN", "b", ttl).block();
        store.set("check:u10:school:READ:none", "c", ttl).block();
        store.set("hierarchy:level0:u1", false, ttl).block();

        StepVerifier.create(store.deletePrefix(CacheKeys.actorPrefix("u1"))).expectNext(2L).verifyComplete();

        StepVerifier.create(store.get("check:u10:school:READ:none")).expectNext("c").verifyComplete();
        StepVerifier.create(store.get("hierarchy:level0:u1")).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("should report whether a single key was removed")
    void shouldDeleteSingleKey() {
        store.set("hierarchy:level0:u1", true, Duration.ofMinutes(1)).block();

        StepVerifier.create(store.delete("hierarchy:level0:u1")).expectNext(1L).verifyComplete();
        StepVerifier.create(store.delete("hierarchy:level0:u1")).expectNext(0L).verifyComplete();
    }
}

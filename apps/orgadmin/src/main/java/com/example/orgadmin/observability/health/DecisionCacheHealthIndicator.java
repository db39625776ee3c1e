package com.example.orgadmin.observability.health;

import com.example.orgadmin.authz.cache.DecisionCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports decision cache connectivity via /actuator/health/decisionCache.
 * A down cache degrades latency only; decisions are re-evaluated from the data store.
 */
@Slf4j
@Component("decisionCacheHealthIndicator")
public class DecisionCacheHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final DecisionCacheStore store;

    public DecisionCacheHealthIndicator(DecisionCacheStore store) {
        this.store = store;
    }

    @Override
    public Mono<Health> health() {
        return store.ping()
                .map(pong -> Health.up()
                        .withDetail("cacheType", store.type())
                        .withDetail("ping", pong)
                        .build())
                .defaultIfEmpty(Health.unknown().withDetail("cacheType", store.type()).build())
                .timeout(HEALTH_CHECK_TIMEOUT)
                .onErrorResume(e -> {
                    log.warn("Decision cache health check failed: {}", e.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("cacheType", store.type())
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}

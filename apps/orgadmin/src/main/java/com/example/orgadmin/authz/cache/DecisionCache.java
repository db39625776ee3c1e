package com.example.orgadmin.authz.cache;

import com.example.orgadmin.authz.model.Decision;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.config.properties.AuthzProperties;
import com.example.orgadmin.observability.metrics.CacheMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Typed access to the decision cache store.
 *
 * <p>Reads and writes fail open: a broken store behaves like an empty cache. Invalidation
 * errors propagate so writers know their change may still be masked by stale entries.
 */
@Slf4j
@Component
public class DecisionCache {

    static final String DECISIONS = "decisions";
    static final String BYPASS = "bypass";

    private final DecisionCacheStore store;
    private final ObjectMapper objectMapper;
    private final CacheMetricsService metricsService;
    private final Duration decisionTtl;
    private final Duration bypassTtl;

    public DecisionCache(
            DecisionCacheStore store,
            AuthzProperties properties,
            ObjectMapper objectMapper,
            CacheMetricsService metricsService) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.decisionTtl = properties.cache().decisionTtl();
        this.bypassTtl = properties.cache().bypassTtl();
    }

    @NonNull
    public Mono<Decision> getDecision(@NonNull String actorId, @NonNull RequiredPermission permission) {
        return read(DECISIONS, CacheKeys.decision(actorId, permission), Decision.class);
    }

    @NonNull
    public Mono<Void> putDecision(@NonNull String actorId, @NonNull RequiredPermission permission, @NonNull Decision decision) {
        return write(CacheKeys.decision(actorId, permission), decision, decisionTtl);
    }

    @NonNull
    public Mono<Boolean> getBypassFlag(@NonNull String actorId) {
        return read(BYPASS, CacheKeys.bypass(actorId), Boolean.class);
    }

    @NonNull
    public Mono<Void> putBypassFlag(@NonNull String actorId, boolean bypass) {
        return write(CacheKeys.bypass(actorId), bypass, bypassTtl);
    }

    @NonNull
    public Mono<Long> invalidateActor(@NonNull String actorId) {
        return evict(DECISIONS, store.deletePrefix(CacheKeys.actorPrefix(actorId)));
    }

    @NonNull
    public Mono<Long> invalidateAllDecisions() {
        return evict(DECISIONS, store.deletePrefix(CacheKeys.DECISION_PREFIX));
    }

    @NonNull
    public Mono<Long> invalidateBypass(@NonNull String actorId) {
        return evict(BYPASS, store.delete(CacheKeys.bypass(actorId)));
    }

    @NonNull
    public Mono<Long> invalidateAllBypass() {
        return evict(BYPASS, store.deletePrefix(CacheKeys.BYPASS_PREFIX));
    }

    private <T> Mono<T> read(String cacheName, String key, Class<T> type) {
        return store.get(key)
                .flatMap(cached -> Mono.justOrEmpty(convert(key, cached, type)))
                .doOnNext(value -> {
                    log.debug("Cache hit for key: {}", StringSanitizer.forLog(key, 128));
                    metricsService.recordHit(cacheName, store.type());
                })
                .switchIfEmpty(Mono.fromRunnable(() -> {
                    log.debug("Cache miss for key: {}", StringSanitizer.forLog(key, 128));
                    metricsService.recordMiss(cacheName, store.type());
                }))
                .onErrorResume(e -> {
                    log.warn("Decision cache unavailable for key {}, re-evaluating: {}",
                            StringSanitizer.forLog(key, 128), e.getMessage());
                    metricsService.recordMiss(cacheName, store.type());
                    return Mono.empty();
                });
    }

    private Mono<Void> write(String key, Object value, Duration ttl) {
        return store.set(key, value, ttl)
                .onErrorResume(e -> {
                    log.warn("Failed to write to decision cache for key {}: {}",
                            StringSanitizer.forLog(key, 128), e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Long> evict(String cacheName, Mono<Long> deletion) {
        return deletion
                .defaultIfEmpty(0L)
                .doOnNext(count -> metricsService.recordEvictions(cacheName, store.type(), count));
    }

    private <T> T convert(String key, Object cached, Class<T> type) {
        if (type.isInstance(cached)) {
            return type.cast(cached);
        }
        try {
            return objectMapper.convertValue(cached, type);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring undecodable cache entry for key {}: {}", StringSanitizer.forLog(key, 128), e.getMessage());
            return null;
        }
    }
}

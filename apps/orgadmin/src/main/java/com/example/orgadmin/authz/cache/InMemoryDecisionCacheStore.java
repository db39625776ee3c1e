package com.example.orgadmin.authz.cache;

import com.example.orgadmin.config.properties.AuthzProperties;
import com.example.orgadmin.observability.metrics.CacheMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Single-process decision cache backed by Caffeine, with a TTL per entry.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.cache.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDecisionCacheStore implements DecisionCacheStore {

    private static final String CACHE_TYPE = "memory";

    private final Cache<String, Entry> cache;

    @Autowired
    public InMemoryDecisionCacheStore(AuthzProperties properties, CacheMetricsService metricsService) {
        this(properties.cache().maxEntries(), Ticker.systemTicker());
        metricsService.registerSizeGauge("decisions", CACHE_TYPE, cache::estimatedSize);
        log.info("In-memory decision cache initialized (single-pod mode, max-entries={})",
                properties.cache().maxEntries());
    }

    public InMemoryDecisionCacheStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    @NonNull
    public Mono<Object> get(@NonNull String key) {
        return Mono.fromCallable(() -> {
            Entry entry = cache.getIfPresent(key);
            return entry != null ? entry.value() : null;
        });
    }

    @Override
    @NonNull
    public Mono<Void> set(@NonNull String key, @NonNull Object value, @NonNull Duration ttl) {
        return Mono.fromRunnable(() -> cache.put(key, new Entry(value, ttl)));
    }

    @Override
    @NonNull
    public Mono<Long> delete(@NonNull String key) {
        return Mono.fromCallable(() -> cache.asMap().remove(key) != null ? 1L : 0L);
    }

    @Override
    @NonNull
    public Mono<Long> deletePrefix(@NonNull String prefix) {
        return Mono.fromCallable(() -> {
            List<String> keys = cache.asMap().keySet().stream()
                    .filter(key -> key.startsWith(prefix))
                    .toList();
            cache.invalidateAll(keys);
            return (long) keys.size();
        });
    }

    @Override
    @NonNull
    public Mono<String> ping() {
        return Mono.just("PONG");
    }

    @Override
    @NonNull
    public String type() {
        return CACHE_TYPE;
    }

    private record Entry(Object value, Duration ttl) {}

    private static final class PerEntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

package com.example.orgadmin.authz.cache;

import com.example.orgadmin.common.util.CacheKeyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static com.example.orgadmin.config.DecisionCacheConfig.DECISION_CACHE_TEMPLATE;

/**
 * Shared decision cache for multi-instance deployments.
 * Prefix deletion walks the keyspace with {@code SCAN MATCH} and deletes in batches.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
public class RedisDecisionCacheStore implements DecisionCacheStore {

    private static final String CACHE_TYPE = "redis";
    private static final long SCAN_COUNT = 500;
    private static final int DELETE_BATCH_SIZE = 100;

    private final ReactiveRedisTemplate<String, Object> redisTemplate;

    public RedisDecisionCacheStore(@Qualifier(DECISION_CACHE_TEMPLATE) ReactiveRedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.info("Redis decision cache initialized (multi-pod mode)");
    }

    @Override
    @NonNull
    public Mono<Object> get(@NonNull String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    @NonNull
    public Mono<Void> set(@NonNull String key, @NonNull Object value, @NonNull Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl).then();
    }

    @Override
    @NonNull
    public Mono<Long> delete(@NonNull String key) {
        return redisTemplate.delete(key);
    }

    @Override
    @NonNull
    public Mono<Long> deletePrefix(@NonNull String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(CacheKeyUtils.escapeGlob(prefix) + "*")
                .count(SCAN_COUNT)
                .build();
        return redisTemplate.scan(options)
                .buffer(DELETE_BATCH_SIZE)
                .concatMap(keys -> redisTemplate.delete(keys.toArray(new String[0])))
                .reduce(0L, Long::sum)
                .doOnNext(count -> log.debug("Deleted {} keys with prefix {}", count, prefix));
    }

    @Override
    @NonNull
    public Mono<String> ping() {
        return redisTemplate.getConnectionFactory()
                .getReactiveConnection()
                .ping();
    }

    @Override
    @NonNull
    public String type() {
        return CACHE_TYPE;
    }
}

package com.example.orgadmin.authz.cache;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key/value backend for cached decisions and bypass flags.
 */
public interface DecisionCacheStore {

    /**
     * @return the stored value, or empty when absent or expired
     */
    @NonNull
    Mono<Object> get(@NonNull String key);

    @NonNull
    Mono<Void> set(@NonNull String key, @NonNull Object value, @NonNull Duration ttl);

    /**
     * @return number of removed entries
     */
    @NonNull
    Mono<Long> delete(@NonNull String key);

    /**
     * Removes every key starting with {@code prefix}. Completes after the deletion finished.
     *
     * @return number of removed entries
     */
    @NonNull
    Mono<Long> deletePrefix(@NonNull String prefix);

    @NonNull
    Mono<String> ping();

    /**
     * Backend name used in metrics and health details.
     */
    @NonNull
    String type();
}

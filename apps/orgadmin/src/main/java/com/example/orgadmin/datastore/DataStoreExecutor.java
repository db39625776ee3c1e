package com.example.orgadmin.datastore;

import com.example.orgadmin.authz.exception.DataStoreUnavailableException;
import com.example.orgadmin.common.util.RetryUtils;
import com.example.orgadmin.config.properties.AuthzProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.function.Function;

/**
 * Applies timeout and bounded retry to data-store calls and classifies failures.
 *
 * <p>Transient failures that survive all retries become {@link DataStoreUnavailableException}.
 * Other errors pass through unchanged.
 */
@Slf4j
@Component
public class DataStoreExecutor {

    private final AuthzProperties.DataStoreProperties config;

    public DataStoreExecutor(AuthzProperties properties) {
        this.config = properties.dataStore();
    }

    @NonNull
    public <T> Mono<T> execute(@NonNull String operation, @NonNull Mono<T> call) {
        return call
                .timeout(config.timeout())
                .retryWhen(Retry.backoff(config.maxRetries(), config.initialBackoff())
                        .maxBackoff(config.maxBackoff())
                        .filter(RetryUtils.transientPredicate())
                        .doBeforeRetry(signal -> log.warn("Retrying data store call: operation={}, attempt={}, error={}",
                                operation, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(RetryUtils.transientPredicate(), e -> {
                    log.error("Data store unavailable: operation={}, error={}", operation, e.getMessage());
                    return new DataStoreUnavailableException(operation, e);
                });
    }

    /**
     * Multi-valued variant. Results are buffered so a retry never re-emits partial output.
     */
    @NonNull
    public <T> Flux<T> executeMany(@NonNull String operation, @NonNull Flux<T> call) {
        Mono<List<T>> buffered = call.collectList();
        return execute(operation, buffered).flatMapIterable(Function.identity());
    }
}

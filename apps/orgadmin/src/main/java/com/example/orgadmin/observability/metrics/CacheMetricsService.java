package com.example.orgadmin.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Hit, miss and eviction counters per cache name and backend type.
 */
@Slf4j
@Service
public class CacheMetricsService {

    private static final String METRIC_PREFIX = "orgadmin.cache";
    private static final String TAG_CACHE_NAME = "cache";
    private static final String TAG_CACHE_TYPE = "type";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> sizeGauges = new ConcurrentHashMap<>();

    public CacheMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordHit(String cacheName, String cacheType) {
        counter("hits", "Number of cache hits", cacheName, cacheType).increment();
    }

    public void recordMiss(String cacheName, String cacheType) {
        counter("misses", "Number of cache misses", cacheName, cacheType).increment();
    }

    public void recordEvictions(String cacheName, String cacheType, long count) {
        if (count > 0) {
            counter("evictions", "Number of cache evictions", cacheName, cacheType).increment(count);
        }
    }

    /**
     * Register a size gauge once per cache; the supplier is polled on scrape.
     */
    public void registerSizeGauge(String cacheName, String cacheType, Supplier<Number> sizeSupplier) {
        String key = cacheName + ":" + cacheType;
        if (sizeGauges.putIfAbsent(key, Boolean.TRUE) == null) {
            meterRegistry.gauge(
                    METRIC_PREFIX + ".size",
                    Tags.of(TAG_CACHE_NAME, cacheName, TAG_CACHE_TYPE, cacheType),
                    sizeSupplier,
                    supplier -> supplier.get().doubleValue()
            );
            log.debug("Registered size gauge for cache: {}:{}", cacheName, cacheType);
        }
    }

    private Counter counter(String name, String description, String cacheName, String cacheType) {
        String key = name + ":" + cacheName + ":" + cacheType;
        return counters.computeIfAbsent(key, k ->
                Counter.builder(METRIC_PREFIX + "." + name)
                        .description(description)
                        .tags(TAG_CACHE_NAME, cacheName, TAG_CACHE_TYPE, cacheType)
                        .register(meterRegistry)
        );
    }
}

package com.example.orgadmin.authz.audit;

import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.config.properties.AuthzProperties;
import com.example.orgadmin.observability.metrics.AuthorizationMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Buffers decision events in a bounded queue and drains them to every {@link DecisionSink}
 * on a background scheduler. When the queue is full the event is dropped and counted.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.authz.recorder.enabled", havingValue = "true", matchIfMissing = true)
public class AsyncDecisionRecorder implements DecisionRecorder {

    private final List<DecisionSink> sinks;
    private final AuthorizationMetrics metrics;
    private final Scheduler scheduler;
    private final Sinks.Many<DecisionEvent> queue;

    private Disposable subscription;

    @Autowired
    public AsyncDecisionRecorder(List<DecisionSink> sinks, AuthzProperties properties, AuthorizationMetrics metrics) {
        this(sinks, properties.recorder().queueCapacity(), metrics, Schedulers.boundedElastic());
    }

    AsyncDecisionRecorder(List<DecisionSink> sinks, int queueCapacity, AuthorizationMetrics metrics, Scheduler scheduler) {
        this.sinks = List.copyOf(sinks);
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.queue = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(queueCapacity));
    }

    @PostConstruct
    public void start() {
        subscription = queue.asFlux()
                .publishOn(scheduler, 1)
                .subscribe(
                        this::dispatch,
                        e -> log.error("Decision recorder stopped: {}", e.getMessage())
                );
        log.info("Decision recorder started with {} sink(s)", sinks.size());
    }

    @PreDestroy
    public void stop() {
        synchronized (queue) {
            queue.tryEmitComplete();
        }
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Decision recorder stopped");
        }
    }

    @Override
    public void record(DecisionEvent event) {
        Sinks.EmitResult result;
        // unicast sinks reject concurrent emitters
        synchronized (queue) {
            result = queue.tryEmitNext(event);
        }
        if (result.isFailure()) {
            metrics.recordDroppedEvent();
            log.warn("Decision event dropped: result={}, actor={}, permission={}:{}",
                    result, StringSanitizer.forLog(event.actorId()), event.resource(), event.action());
        }
    }

    private void dispatch(DecisionEvent event) {
        for (DecisionSink sink : sinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.warn("Decision sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}

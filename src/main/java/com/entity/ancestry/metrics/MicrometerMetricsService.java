package com.entity.ancestry.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code ancestry.resolution.duration} - Timer (tag: catalog)</li>
 *   <li>{@code ancestry.chain.length} - DistributionSummary</li>
 *   <li>{@code ancestry.catalog.registered} - Counter (tag: catalog)</li>
 *   <li>{@code ancestry.dispatch.invocations} - DistributionSummary</li>
 *   <li>{@code ancestry.cache.hit} - Counter</li>
 *   <li>{@code ancestry.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary chainLengthSummary;
    private final DistributionSummary dispatchSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.chainLengthSummary = DistributionSummary.builder("ancestry.chain.length")
                .description("Number of ancestors in resolved chains")
                .register(registry);
        this.dispatchSummary = DistributionSummary.builder("ancestry.dispatch.invocations")
                .description("Handlers invoked per dispatched instance")
                .register(registry);
        this.cacheHitCounter = Counter.builder("ancestry.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("ancestry.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(String catalogName, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(catalogName, k ->
                Timer.builder("ancestry.resolution.duration")
                        .description("Duration of ancestor resolution")
                        .tag("catalog", catalogName)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordChainLength(int length) {
        chainLengthSummary.record(length);
    }

    @Override
    public void incrementRegistration(String catalogName) {
        Counter counter = counterCache.computeIfAbsent(catalogName, k ->
                Counter.builder("ancestry.catalog.registered")
                        .description("Number of entities registered")
                        .tag("catalog", catalogName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordDispatchInvocations(int invocations) {
        dispatchSummary.record(invocations);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}

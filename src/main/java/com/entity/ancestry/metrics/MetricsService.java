package com.entity.ancestry.metrics;

import java.time.Duration;

/**
 * Interface for recording ancestry metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordResolutionDuration(String catalogName, Duration duration);

    void recordChainLength(int length);

    void incrementRegistration(String catalogName);

    void recordDispatchInvocations(int invocations);

    void recordCacheHit();

    void recordCacheMiss();
}

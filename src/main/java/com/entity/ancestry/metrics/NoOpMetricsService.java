package com.entity.ancestry.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String catalogName, Duration duration) {
    }

    @Override
    public void recordChainLength(int length) {
    }

    @Override
    public void incrementRegistration(String catalogName) {
    }

    @Override
    public void recordDispatchInvocations(int invocations) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

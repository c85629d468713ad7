package com.requirement.sync.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconciliationDuration(String outcome, Duration duration) {
    }

    @Override
    public void recordActionsEmitted(int count) {
    }

    @Override
    public void incrementModuleFailed(String reason) {
    }

    @Override
    public void incrementDeletionRetracted() {
    }
}

package com.requirement.sync.metrics;

import java.time.Duration;

/**
 * Interface for recording change set calculation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics registry.
 */
public interface MetricsService {

    /**
     * Records how long one module took to reconcile.
     *
     * @param outcome {@code success} or {@code failure}
     */
    void recordReconciliationDuration(String outcome, Duration duration);

    void recordActionsEmitted(int count);

    /**
     * Counts a module whose reconciliation was aborted.
     *
     * @param reason simple name of the error that aborted it
     */
    void incrementModuleFailed(String reason);

    void incrementDeletionRetracted();
}

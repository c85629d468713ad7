package com.requirement.sync.metrics;

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
 *   <li>{@code changeset.reconcile.duration}: Timer (tag: outcome)</li>
 *   <li>{@code changeset.actions.emitted}: DistributionSummary</li>
 *   <li>{@code changeset.module.failed}: Counter (tag: reason)</li>
 *   <li>{@code changeset.deletion.retracted}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary actionsSummary;
    private final Counter retractedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.actionsSummary = DistributionSummary.builder("changeset.actions.emitted")
                .description("Number of change actions emitted per module")
                .register(registry);
        this.retractedCounter = Counter.builder("changeset.deletion.retracted")
                .description("Number of proposed deletions retracted after a relocation")
                .register(registry);
    }

    @Override
    public void recordReconciliationDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("changeset.reconcile.duration")
                        .description("Duration of module reconciliation")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordActionsEmitted(int count) {
        actionsSummary.record(count);
    }

    @Override
    public void incrementModuleFailed(String reason) {
        Counter counter = counterCache.computeIfAbsent(reason, k ->
                Counter.builder("changeset.module.failed")
                        .description("Number of modules whose reconciliation was aborted")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementDeletionRetracted() {
        retractedCounter.increment();
    }
}

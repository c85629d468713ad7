package com.requirement.sync.api;

import com.requirement.sync.action.ChangeAction;
import com.requirement.sync.graph.LiveGraph;
import com.requirement.sync.logging.LogContext;
import com.requirement.sync.metrics.MetricsService;
import com.requirement.sync.reconcile.TrackerReconciler;
import com.requirement.sync.snapshot.TrackerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point computing change sets for one or more tracked modules.
 *
 * <p>Each module is reconciled independently. An error aborting one module is
 * logged, counted and returned as a failed {@link ModuleChangeSet}; the other
 * modules are still processed.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * ChangeSetCalculator calculator = new ChangeSetCalculator(liveGraph);
 * ModuleChangeSet result = calculator.calculate(TrackerConfig.of(moduleId), snapshot);
 * if (result.isSuccess()) {
 *     applier.apply(result.actions());
 * }
 * </pre>
 */
public class ChangeSetCalculator {
    private static final Logger log = LoggerFactory.getLogger(ChangeSetCalculator.class);

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_FAILURE = "failure";

    private final LiveGraph graph;
    private final ReconciliationOptions options;
    private final MetricsService metricsService;

    public ChangeSetCalculator(LiveGraph graph) {
        this(graph, ReconciliationOptions.defaults());
    }

    public ChangeSetCalculator(LiveGraph graph, ReconciliationOptions options) {
        this.graph = Objects.requireNonNull(graph, "graph is required");
        this.options = options != null ? options : ReconciliationOptions.defaults();
        this.metricsService = this.options.getMetricsService();
    }

    /**
     * Reconciles one module against its snapshot.
     */
    public ModuleChangeSet calculate(TrackerConfig config, TrackerSnapshot snapshot) {
        String correlationId = LogContext.generateCorrelationId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forModule(correlationId, config.moduleId())) {
            if (config.name() != null) {
                ctx.with(LogContext.TRACKER_NAME, config.name());
            }
            log.info("changeset.module.starting moduleId={} items={}", config.moduleId(), snapshot.getItems().size());
            try {
                List<ChangeAction> actions = new TrackerReconciler(snapshot, graph, config, options).reconcile();
                metricsService.recordReconciliationDuration(OUTCOME_SUCCESS, elapsedSince(start));
                metricsService.recordActionsEmitted(actions.size());
                log.info("changeset.module.finished moduleId={} actions={}", config.moduleId(), actions.size());
                return ModuleChangeSet.success(config.moduleId(), actions);
            } catch (ReconciliationException e) {
                metricsService.recordReconciliationDuration(OUTCOME_FAILURE, elapsedSince(start));
                return failed(config.moduleId(), e);
            }
        }
    }

    /**
     * Reconciles every snapshot against the config it belongs to, in snapshot order.
     * A snapshot is paired with the config whose external id equals its module
     * identifier, or else whose module id does.
     */
    public List<ModuleChangeSet> calculateAll(List<TrackerConfig> configs, List<TrackerSnapshot> snapshots) {
        List<ModuleChangeSet> results = new ArrayList<>(snapshots.size());
        for (TrackerSnapshot snapshot : snapshots) {
            Optional<TrackerConfig> config = findConfig(configs, snapshot.getModuleId());
            if (config.isPresent()) {
                results.add(calculate(config.get(), snapshot));
            } else {
                results.add(failed(snapshot.getModuleId(), new InvalidTrackerConfigException(
                        "No tracker configuration for snapshot of module " + snapshot.getModuleId())));
            }
        }
        long failures = results.stream().filter(ModuleChangeSet::isFailure).count();
        log.info("changeset.batch.finished modules={} failed={}", results.size(), failures);
        return results;
    }

    /**
     * Actions of all successful results, in result order.
     */
    public static List<ChangeAction> allActions(List<ModuleChangeSet> results) {
        List<ChangeAction> actions = new ArrayList<>();
        for (ModuleChangeSet result : results) {
            if (result.isSuccess()) {
                actions.addAll(result.actions());
            }
        }
        return actions;
    }

    private static Optional<TrackerConfig> findConfig(List<TrackerConfig> configs, String snapshotModuleId) {
        Optional<TrackerConfig> byExternalId = configs.stream()
                .filter(c -> c.externalId() != null && c.externalId().equals(snapshotModuleId))
                .findFirst();
        if (byExternalId.isPresent()) {
            return byExternalId;
        }
        return configs.stream()
                .filter(c -> c.moduleId() != null && c.moduleId().equals(snapshotModuleId))
                .findFirst();
    }

    private ModuleChangeSet failed(String moduleId, ReconciliationException error) {
        metricsService.incrementModuleFailed(error.getClass().getSimpleName());
        log.error("changeset.module.failed moduleId={} error={}", moduleId, error.getMessage());
        return ModuleChangeSet.failure(moduleId, error);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}

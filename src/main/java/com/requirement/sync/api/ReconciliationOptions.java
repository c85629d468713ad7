package com.requirement.sync.api;

import com.requirement.sync.metrics.MetricsService;
import com.requirement.sync.metrics.NoOpMetricsService;

import java.util.Objects;

/**
 * Options for change set calculation.
 */
public class ReconciliationOptions {

    private final boolean substituteDefaults;
    private final MetricsService metricsService;

    private ReconciliationOptions(Builder builder) {
        this.substituteDefaults = builder.substituteDefaults;
        this.metricsService = builder.metricsService;
    }

    /**
     * Whether an invalid attribute value is replaced by its kind's default
     * instead of aborting the module. Off by default.
     */
    public boolean isSubstituteDefaults() {
        return substituteDefaults;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Creates default options: fail fast on invalid values, no metrics.
     */
    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean substituteDefaults = false;
        private MetricsService metricsService = new NoOpMetricsService();

        public Builder substituteDefaults(boolean substituteDefaults) {
            this.substituteDefaults = substituteDefaults;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }
}

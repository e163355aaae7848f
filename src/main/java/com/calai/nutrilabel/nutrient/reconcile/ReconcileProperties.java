package com.calai.nutrilabel.nutrient.reconcile;

import com.calai.nutrilabel.nutrient.resolve.ResolverMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.reconcile.*
 */
@ConfigurationProperties(prefix = "app.reconcile")
public record ReconcileProperties(
        ResolverMode mode,
        Boolean globalFallbackEnabled,
        Double traceThreshold,
        Boolean createVerificationTasks,
        String createdBy
) {
    public static final double DEFAULT_TRACE_THRESHOLD = 0.00011;

    public ResolverMode modeOrDefault() {
        return mode == null ? ResolverMode.STANDARD : mode;
    }

    public boolean globalFallbackEnabledOrDefault() {
        return globalFallbackEnabled == null || globalFallbackEnabled;
    }

    public double traceThresholdOrDefault() {
        return (traceThreshold == null || traceThreshold < 0) ? DEFAULT_TRACE_THRESHOLD : traceThreshold;
    }

    public boolean createVerificationTasksOrDefault() {
        return createVerificationTasks == null || createVerificationTasks;
    }

    public String createdByOrDefault() {
        return (createdBy == null || createdBy.isBlank()) ? "agent" : createdBy.trim();
    }
}

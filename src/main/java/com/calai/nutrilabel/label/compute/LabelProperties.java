package com.calai.nutrilabel.label.compute;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.label.*
 */
@ConfigurationProperties(prefix = "app.label")
public record LabelProperties(
        Double qaToleranceKcal,
        String createdBy
) {
    public static final double DEFAULT_QA_TOLERANCE_KCAL = 20.0;

    public double qaToleranceKcalOrDefault() {
        return (qaToleranceKcal == null || qaToleranceKcal < 0) ? DEFAULT_QA_TOLERANCE_KCAL : qaToleranceKcal;
    }

    public String createdByOrDefault() {
        return (createdBy == null || createdBy.isBlank()) ? "agent" : createdBy.trim();
    }
}

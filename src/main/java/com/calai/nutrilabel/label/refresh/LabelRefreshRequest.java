package com.calai.nutrilabel.label.refresh;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param month YYYY-MM（UTC）
 * @param limit 最多處理幾個出餐（0 / null = 不限）
 */
public record LabelRefreshRequest(
        @NotBlank String organizationId,
        @NotBlank String month,
        @Min(0) Integer limit,
        boolean dryRun
) {}

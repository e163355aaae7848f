package com.calai.nutrilabel.nutrient.reconcile;

import com.calai.nutrilabel.nutrient.resolve.ResolverMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * @param ingredientKeys 空 = 全部 ingredient group
 * @param limit          最多處理幾個 ingredient group（0 / null = 不限）
 * @param mode           null = 用設定檔的 app.reconcile.mode
 */
public record ReconcileRequest(
        @NotBlank String organizationId,
        List<String> ingredientKeys,
        @Min(0) Integer limit,
        boolean dryRun,
        ResolverMode mode
) {
    public ReconcileRequest {
        ingredientKeys = ingredientKeys == null ? List.of() : List.copyOf(ingredientKeys);
    }
}

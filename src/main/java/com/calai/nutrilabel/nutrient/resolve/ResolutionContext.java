package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.source.upstream.UpstreamSession;

import java.util.List;
import java.util.Map;

/**
 * 單次 run 的解析環境
 * - existingByProduct：productId → 既有列
 */
public record ResolutionContext(
        UpstreamSession session,
        ResolverMode mode,
        Map<String, List<ExistingNutrientRow>> existingByProduct,
        boolean globalFallbackEnabled
) {
    public ResolutionContext {
        existingByProduct = existingByProduct == null ? Map.of() : existingByProduct;
        mode = mode == null ? ResolverMode.STANDARD : mode;
    }

    public List<ExistingNutrientRow> existingRows(String productId) {
        return existingByProduct.getOrDefault(productId, List.of());
    }

    public boolean isRepair() {
        return mode == ResolverMode.HISTORICAL_BACKFILL;
    }
}

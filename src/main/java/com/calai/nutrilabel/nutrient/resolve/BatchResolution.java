package com.calai.nutrilabel.nutrient.resolve;

import com.calai.nutrilabel.nutrient.model.ResolvedProfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一批產品的解析結果（依輸入順序）
 * - productsWithSourceMatch：stage 1~4 至少拿到一個非推估值的產品
 */
public record BatchResolution(
        Map<String, ResolvedProfile> profiles,
        Set<String> productsWithSourceMatch
) {
    public BatchResolution {
        profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
        productsWithSourceMatch = Set.copyOf(productsWithSourceMatch);
    }

    public ResolvedProfile profile(String productId) {
        return profiles.get(productId);
    }
}

package com.calai.nutrilabel.nutrient.source;

import com.calai.nutrilabel.nutrient.model.NutrientKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 單一來源的查詢結果：部分 key → 值（已是標準單位、per 100g）+ 一個 sourceRef
 * - exactUpcMatch / preferredDataType：決定該來源這次的 confidence
 */
public record ProviderHit(
        Map<NutrientKey, Double> values,
        String sourceRef,
        boolean exactUpcMatch,
        boolean preferredDataType
) {
    public ProviderHit {
        values = values == null || values.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(values));
        sourceRef = sourceRef == null ? "" : sourceRef;
    }

    public static ProviderHit of(Map<NutrientKey, Double> values, String sourceRef) {
        return new ProviderHit(values, sourceRef, false, false);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public long coreCount() {
        return values.keySet().stream().filter(NutrientKey::isCore).count();
    }
}
